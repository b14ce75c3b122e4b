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
import me.golemcore.agent.domain.model.CompactionException;
import me.golemcore.agent.domain.model.CompactionPlan;
import me.golemcore.agent.domain.model.ConversationFlow;
import me.golemcore.agent.domain.model.ConversationTurn;
import me.golemcore.agent.domain.model.MigrationStrategy;
import me.golemcore.agent.domain.model.PreservationContext;
import me.golemcore.agent.domain.model.TurnToolCall;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Splits a conversation at its most recent anchor and writes the summary of
 * everything before it.
 *
 * <p>
 * The last {@code agent.compaction.keep-recent-turns} turns, clamped to two
 * or three, are never summarized. When no milestone turn exists, a synthetic checkpoint on the
 * final turn is used so a boundary always exists.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextCompactor {

    static final String NO_TURNS_SUMMARIZED = "No turns summarized.";
    static final String ANCHOR_PREFIX = "[ANCHOR] ";
    private static final int MAX_ANCHOR_CHARS = 500;
    private static final int MAX_OUTCOME_CHARS = 150;
    private static final int MIN_KEEP_RECENT = 2;
    private static final int MAX_KEEP_RECENT = 3;

    private final AnchorDetector anchorDetector;
    private final PreservationContextExtractor contextExtractor;
    private final AgentProperties properties;

    public CompactionPlan plan(List<ConversationTurn> turns) {
        if (turns == null || turns.isEmpty()) {
            throw new CompactionException("nothing to compact");
        }

        int keepRecent = Math.min(keepRecentTurns(), turns.size());
        int tailStart = turns.size() - keepRecent;

        List<AnchorPoint> anchors = anchorDetector.detectHistoricalAnchors(turns);
        AnchorPoint synthetic = null;
        if (anchors.isEmpty()) {
            synthetic = anchorDetector.syntheticAnchor(turns);
        }
        AnchorPoint boundaryAnchor = synthetic != null ? synthetic : anchors.get(anchors.size() - 1);

        PreservationContext context = contextExtractor.extract(turns);

        int boundary = Math.min(boundaryAnchor.turnIndex(), tailStart);
        MigrationStrategy strategy = synthetic == null && boundaryAnchor.turnIndex() <= tailStart
                ? MigrationStrategy.ANCHOR_POINT_ONLY
                : MigrationStrategy.LEGACY_FALLBACK;

        List<ConversationTurn> summarized = List.copyOf(turns.subList(0, boundary));
        List<ConversationTurn> kept = List.copyOf(turns.subList(boundary, turns.size()));

        Set<Integer> anchorIndexes = anchors.stream().map(AnchorPoint::turnIndex).collect(Collectors.toSet());
        String summary = buildSummary(context, summarized, anchorIndexes);

        ConversationFlow flow = ConversationFlow.builder()
                .turns(turns)
                .anchorPoints(anchors)
                .totalTokens(turns.stream().mapToLong(ConversationTurn::tokens).sum())
                .preservationContext(context)
                .migrationStrategy(strategy)
                .syntheticAnchor(synthetic)
                .build();

        log.debug("[Compaction] {} turns, {} anchor(s), boundary at {} ({}), summarizing {}",
                turns.size(), anchors.size(), boundary, strategy, summarized.size());

        return CompactionPlan.builder()
                .flow(flow)
                .boundaryAnchor(boundaryAnchor)
                .boundaryIndex(boundary)
                .summarizedTurns(summarized)
                .keptTurns(kept)
                .summary(summary)
                .build();
    }

    private int keepRecentTurns() {
        int configured = properties.getCompaction().getKeepRecentTurns();
        return Math.min(MAX_KEEP_RECENT, Math.max(MIN_KEEP_RECENT, configured));
    }

    String buildSummary(PreservationContext context, List<ConversationTurn> summarized,
            Set<Integer> anchorIndexes) {
        List<String> outcomes = new ArrayList<>();
        for (int i = 0; i < summarized.size(); i++) {
            outcomes.add(toOutcome(summarized.get(i), anchorIndexes.contains(i)));
        }
        String body = outcomes.isEmpty() ? NO_TURNS_SUMMARIZED : String.join("\n", outcomes);
        return context.format() + "\n\nKey outcomes:\n" + body;
    }

    String toOutcome(ConversationTurn turn, boolean anchor) {
        if (anchor) {
            return ANCHOR_PREFIX + truncate(turn.assistantResponse().strip(), MAX_ANCHOR_CHARS);
        }
        StringBuilder line = new StringBuilder();
        line.append(turn.hasFailedResult() ? "✗ " : "✓ ");

        Set<String> modified = new LinkedHashSet<>();
        for (TurnToolCall call : turn.toolCalls()) {
            if (ToolVocabulary.isFileModifying(call)) {
                String file = ToolVocabulary.fileName(call);
                if (file != null) {
                    modified.add(file);
                }
            }
        }
        if (!modified.isEmpty()) {
            line.append("Modified ").append(String.join(", ", modified)).append(": ");
        }

        String text = turn.assistantResponse().isBlank()
                ? "Response to: " + turn.userMessage().strip()
                : turn.assistantResponse().strip();
        line.append(truncate(firstSentence(text), MAX_OUTCOME_CHARS));
        return line.toString();
    }

    private static String firstSentence(String text) {
        int period = text.indexOf('.');
        String sentence = period >= 0 ? text.substring(0, period) : text;
        return sentence.replace('\n', ' ').strip();
    }

    private static String truncate(String text, int maxChars) {
        return text.length() <= maxChars ? text : text.substring(0, maxChars);
    }
}
