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

import me.golemcore.agent.domain.model.BuildStatus;
import me.golemcore.agent.domain.model.ConversationTurn;
import me.golemcore.agent.domain.model.PreservationContext;
import me.golemcore.agent.domain.model.TurnToolCall;
import me.golemcore.agent.domain.model.TurnToolResult;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Derives continuation facts from the whole conversation in a single forward
 * pass. The result is rebuilt from scratch on every compaction.
 */
@Service
public class PreservationContextExtractor {

    static final int MAX_GOALS = 3;
    static final int MAX_GOAL_CHARS = 100;
    static final int MAX_ERROR_CHARS = 100;
    static final int MAX_INTENT_CHARS = 200;
    static final String DEFAULT_INTENT = "Continue conversation";

    private static final List<String> GOAL_INDICATORS = List.of("help me", "i want to", "i need to", "please");

    public PreservationContext extract(List<ConversationTurn> turns) {
        Set<String> activeFiles = new LinkedHashSet<>();
        List<String> goals = new ArrayList<>();
        List<String> errorStates = new ArrayList<>();
        BuildStatus buildStatus = BuildStatus.UNKNOWN;

        for (ConversationTurn turn : turns) {
            for (TurnToolCall call : turn.toolCalls()) {
                String file = ToolVocabulary.fileName(call);
                if (file != null) {
                    activeFiles.add(file);
                }
            }
            for (TurnToolResult result : turn.toolResults()) {
                if (!result.success()) {
                    String firstLine = firstLine(result.output());
                    if (!firstLine.isBlank()) {
                        errorStates.add(truncate(firstLine, MAX_ERROR_CHARS));
                    }
                }
                buildStatus = nextBuildStatus(buildStatus, result);
            }
            String goal = extractGoal(turn.userMessage());
            if (goal != null) {
                goals.remove(goal);
                goals.add(goal);
            }
        }

        String lastIntent = turns.isEmpty() ? DEFAULT_INTENT
                : truncate(turns.get(turns.size() - 1).userMessage().strip(), MAX_INTENT_CHARS);
        if (lastIntent.isBlank()) {
            lastIntent = DEFAULT_INTENT;
        }

        List<String> recentGoals = goals.size() > MAX_GOALS
                ? goals.subList(goals.size() - MAX_GOALS, goals.size())
                : goals;

        return PreservationContext.builder()
                .activeFiles(new ArrayList<>(activeFiles))
                .currentGoals(new ArrayList<>(recentGoals))
                .errorStates(errorStates)
                .buildStatus(buildStatus)
                .lastUserIntent(lastIntent)
                .build();
    }

    private static BuildStatus nextBuildStatus(BuildStatus current, TurnToolResult result) {
        String output = result.output().toLowerCase(Locale.ROOT);
        if (!output.contains("test")) {
            return current;
        }
        if (result.success() && (output.contains("pass") || output.contains("success"))) {
            return BuildStatus.PASSING;
        }
        if (output.contains("fail") || output.contains("error")) {
            return BuildStatus.FAILING;
        }
        return current;
    }

    /**
     * Returns the user message up to its first period when it contains a goal
     * phrase, otherwise {@code null}.
     */
    private static String extractGoal(String userMessage) {
        if (userMessage == null || userMessage.isBlank()) {
            return null;
        }
        String lower = userMessage.toLowerCase(Locale.ROOT);
        if (GOAL_INDICATORS.stream().noneMatch(lower::contains)) {
            return null;
        }
        int period = userMessage.indexOf('.');
        String sentence = period >= 0 ? userMessage.substring(0, period) : userMessage;
        String goal = truncate(sentence.strip(), MAX_GOAL_CHARS);
        return goal.isEmpty() ? null : goal;
    }

    private static String firstLine(String text) {
        String stripped = text.strip();
        int newline = stripped.indexOf('\n');
        return newline >= 0 ? stripped.substring(0, newline).strip() : stripped;
    }

    private static String truncate(String text, int maxChars) {
        return text.length() <= maxChars ? text : text.substring(0, maxChars);
    }
}
