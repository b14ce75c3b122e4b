package me.golemcore.agent.domain.model;

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

import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * One completed exchange: the user message plus the assistant's full response,
 * including every tool call and result exchanged in between.
 *
 * <p>
 * Turns are immutable once committed. The only permitted change is the final
 * token annotation via {@link #withTokens(long)}, which returns a copy.
 */
@Builder(toBuilder = true)
public record ConversationTurn(
        String userMessage,
        List<TurnToolCall> toolCalls,
        List<TurnToolResult> toolResults,
        String assistantResponse,
        long tokens,
        Instant timestamp,
        boolean previousError) {

    public ConversationTurn {
        userMessage = userMessage != null ? userMessage : "";
        assistantResponse = assistantResponse != null ? assistantResponse : "";
        toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
        toolResults = toolResults != null ? List.copyOf(toolResults) : List.of();
    }

    public ConversationTurn withTokens(long annotatedTokens) {
        return toBuilder().tokens(annotatedTokens).build();
    }

    public boolean hasToolCall(String toolName) {
        return toolCalls.stream().anyMatch(call -> call.tool().equalsIgnoreCase(toolName));
    }

    public boolean hasFailedResult() {
        return toolResults.stream().anyMatch(result -> !result.success());
    }
}
