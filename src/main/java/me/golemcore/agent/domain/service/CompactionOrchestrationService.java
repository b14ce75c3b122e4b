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

import me.golemcore.agent.domain.model.CompactionException;
import me.golemcore.agent.domain.model.CompactionPlan;
import me.golemcore.agent.domain.model.CompactionResult;
import me.golemcore.agent.domain.model.CompactionSummary;
import me.golemcore.agent.domain.model.ConversationTurn;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Compaction pipeline: plan the boundary, rebuild the history around the
 * summary and measure the result.
 *
 * <p>
 * The rebuilt history is the summary (as a system message carrying the
 * continuation notice) followed by the kept turns. Any failure surfaces as
 * {@link CompactionException} and leaves the caller's state untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CompactionOrchestrationService {

    static final String CONTINUATION_NOTICE = "This session is being continued from a previous conversation "
            + "that ran out of context.";
    static final String SUMMARY_HEADER = "[Conversation summary]";

    private final ContextCompactor contextCompactor;
    private final TurnConverter turnConverter;
    private final TokenEstimator tokenEstimator;
    private final AgentProperties properties;
    private final Clock clock;

    /**
     * Compacts a conversation.
     *
     * @param turns
     *            completed turns of the conversation
     * @param currentHistory
     *            the history being replaced, used for the original token count
     */
    public CompactionResult compact(List<ConversationTurn> turns, List<Message> currentHistory) {
        CompactionPlan plan;
        try {
            plan = contextCompactor.plan(turns);
        } catch (CompactionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CompactionException("Failed to build compaction summary: " + e.getMessage(), e);
        }

        List<Message> rebuilt = new ArrayList<>();
        rebuilt.add(createSummaryMessage(plan.summary()));
        for (ConversationTurn turn : plan.keptTurns()) {
            rebuilt.addAll(turnConverter.toMessages(turn));
        }

        long originalTokens = tokenEstimator.estimateMessages(currentHistory);
        long compactedTokens = Math.min(tokenEstimator.estimateMessages(rebuilt), originalTokens);
        double ratio = originalTokens > 0 ? 1.0 - (double) compactedTokens / originalTokens : 0.0;
        ratio = Math.max(0.0, Math.min(1.0, ratio));

        List<String> warnings = new ArrayList<>();
        double minRatio = properties.getCompaction().getMinCompressionRatio();
        if (ratio < minRatio) {
            String warning = String.format("Compression ratio below %.0f%% (%.0f%%) - consider starting fresh conversation",
                    minRatio * 100, ratio * 100);
            warnings.add(warning);
            log.warn("[Compaction] {}", warning);
        }

        CompactionSummary summary = CompactionSummary.builder()
                .originalTokens(originalTokens)
                .compactedTokens(compactedTokens)
                .compressionRatio(ratio * 100)
                .turnsSummarized(plan.summarizedTurns().size())
                .turnsKept(plan.keptTurns().size())
                .build();

        log.info("[Compaction] Compacted {} -> {} tokens ({}% compression), summarized {} turn(s), kept {}",
                originalTokens, compactedTokens, Math.round(ratio * 100), summary.turnsSummarized(),
                summary.turnsKept());

        return CompactionResult.builder()
                .messages(rebuilt)
                .keptTurns(plan.keptTurns())
                .plan(plan)
                .summary(summary)
                .warnings(warnings)
                .build();
    }

    Message createSummaryMessage(String summary) {
        return Message.builder()
                .role(Message.ROLE_SYSTEM)
                .content(SUMMARY_HEADER + "\n" + CONTINUATION_NOTICE + "\n\n" + summary)
                .timestamp(clock.instant())
                .build();
    }
}
