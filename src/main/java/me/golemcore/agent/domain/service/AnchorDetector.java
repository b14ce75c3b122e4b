package me.golemcore.agent.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.agent.domain.model.AnchorPoint;
import me.golemcore.agent.domain.model.AnchorType;
import me.golemcore.agent.domain.model.ConversationTurn;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds milestone turns that can serve as the compaction boundary.
 *
 * <p>
 * Each turn is checked against {@link AnchorPattern} in order; the first match
 * wins. Matches below the configured minimum confidence are discarded.
 */
@Service
@Slf4j
public class AnchorDetector {

    static final double SYNTHETIC_CONFIDENCE = 0.8;

    private final List<AnchorPattern> patterns;
    private final double minConfidence;

    @Autowired
    public AnchorDetector(AgentProperties properties) {
        this(List.of(AnchorPattern.values()), properties.getCompaction().getAnchorConfidenceThreshold());
    }

    public AnchorDetector(List<AnchorPattern> patterns, double minConfidence) {
        this.patterns = List.copyOf(patterns);
        this.minConfidence = minConfidence;
    }

    public Optional<AnchorPoint> detect(ConversationTurn turn, int index) {
        for (AnchorPattern pattern : patterns) {
            if (!pattern.matches(turn)) {
                continue;
            }
            if (pattern.getConfidence() < minConfidence) {
                log.trace("[Compaction] Turn {} matched {} below confidence {}", index, pattern, minConfidence);
                return Optional.empty();
            }
            return Optional.of(AnchorPoint.builder()
                    .turnIndex(index)
                    .type(pattern.getType())
                    .weight(pattern.getWeight())
                    .confidence(pattern.getConfidence())
                    .description(pattern.getDescription())
                    .timestamp(turn.timestamp() != null ? turn.timestamp() : Instant.now())
                    .synthetic(false)
                    .build());
        }
        return Optional.empty();
    }

    /**
     * Runs detection over every turn and collects all anchors, ordered by turn
     * index.
     */
    public List<AnchorPoint> detectHistoricalAnchors(List<ConversationTurn> turns) {
        List<AnchorPoint> anchors = new ArrayList<>();
        for (int i = 0; i < turns.size(); i++) {
            detect(turns.get(i), i).ifPresent(anchors::add);
        }
        return anchors;
    }

    /**
     * Checkpoint anchor placed on the final turn when no milestone exists.
     */
    public AnchorPoint syntheticAnchor(List<ConversationTurn> turns) {
        int lastIndex = turns.size() - 1;
        ConversationTurn last = turns.get(lastIndex);
        return AnchorPoint.builder()
                .turnIndex(lastIndex)
                .type(AnchorType.USER_CHECKPOINT)
                .weight(AnchorType.USER_CHECKPOINT.getWeight())
                .confidence(SYNTHETIC_CONFIDENCE)
                .description("Conversation checkpoint")
                .timestamp(last.timestamp() != null ? last.timestamp() : Instant.now())
                .synthetic(true)
                .build();
    }
}
