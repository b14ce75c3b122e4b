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

import me.golemcore.agent.domain.model.AnchorType;
import me.golemcore.agent.domain.model.ConversationTurn;
import me.golemcore.agent.domain.model.TurnToolResult;

import java.util.List;
import java.util.Locale;

/**
 * Milestone patterns checked against each turn, in declaration order. The
 * first pattern that matches decides the turn's anchor.
 */
public enum AnchorPattern {

    /**
     * The previous turn failed, this one modified files and tests now pass.
     */
    ERROR_RESOLUTION(AnchorType.ERROR_RESOLUTION, 0.95, 0.9, "Build error fixed and tests now pass") {
        @Override
        boolean matches(ConversationTurn turn) {
            return turn.previousError()
                    && ToolVocabulary.modifiesFiles(turn)
                    && ToolVocabulary.hasTestSuccess(turn);
        }
    },

    CODE_TASK_COMPLETION(AnchorType.TASK_COMPLETION, 0.92, 0.8, "File changes implemented and tests pass") {
        @Override
        boolean matches(ConversationTurn turn) {
            return !turn.previousError()
                    && ToolVocabulary.modifiesFiles(turn)
                    && ToolVocabulary.hasTestSuccess(turn);
        }
    },

    /**
     * A search returned substantial content and the assistant synthesized it.
     */
    SEARCH_SYNTHESIS(AnchorType.TASK_COMPLETION, 0.85, 0.75, "Search results gathered and synthesized") {
        @Override
        boolean matches(ConversationTurn turn) {
            boolean searched = turn.toolCalls().stream().anyMatch(ToolVocabulary::isSearch);
            boolean substantial = turn.toolResults().stream()
                    .anyMatch(result -> result.success() && result.output().length() > MIN_SEARCH_RESULT_CHARS);
            return searched && substantial && containsAny(turn.assistantResponse(), SYNTHESIS_MARKERS);
        }
    },

    SHELL_MILESTONE(AnchorType.TASK_COMPLETION, 0.88, 0.8, "Shell command reached a milestone") {
        @Override
        boolean matches(ConversationTurn turn) {
            if (turn.toolCalls().stream().noneMatch(ToolVocabulary::isShell)) {
                return false;
            }
            for (TurnToolResult result : turn.toolResults()) {
                if (result.success() && containsAny(result.output(), MILESTONE_KEYWORDS)) {
                    return true;
                }
            }
            return false;
        }
    };

    private static final int MIN_SEARCH_RESULT_CHARS = 100;
    private static final List<String> SYNTHESIS_MARKERS = List.of("based on", "according to",
            "the results show", "i found", "in summary", "to summarize");
    private static final List<String> MILESTONE_KEYWORDS = List.of("installed", "built", "compiled",
            "completed", "successfully");

    private final AnchorType type;
    private final double confidence;
    private final double weight;
    private final String description;

    AnchorPattern(AnchorType type, double confidence, double weight, String description) {
        this.type = type;
        this.confidence = confidence;
        this.weight = weight;
        this.description = description;
    }

    abstract boolean matches(ConversationTurn turn);

    public AnchorType getType() {
        return type;
    }

    public double getConfidence() {
        return confidence;
    }

    public double getWeight() {
        return weight;
    }

    public String getDescription() {
        return description;
    }

    private static boolean containsAny(String text, List<String> needles) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return needles.stream().anyMatch(lower::contains);
    }
}
