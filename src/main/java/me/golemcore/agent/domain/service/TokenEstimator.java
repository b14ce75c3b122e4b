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

import me.golemcore.agent.domain.model.ConversationTurn;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.TurnToolCall;
import me.golemcore.agent.domain.model.TurnToolResult;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Character-based token estimate used wherever the backend has not reported an
 * exact count: turn annotations, payload projection before a call, and the
 * size of a freshly compacted history.
 */
@Component
@RequiredArgsConstructor
public class TokenEstimator {

    private static final int MESSAGE_OVERHEAD_CHARS = 16;

    private final AgentProperties properties;

    public long estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        int charsPerToken = Math.max(1, properties.getCompaction().getCharsPerToken());
        return (text.length() + charsPerToken - 1) / charsPerToken;
    }

    public long estimateMessages(List<Message> messages) {
        if (messages == null || messages.isEmpty()) {
            return 0;
        }
        long chars = 0;
        for (Message message : messages) {
            chars += MESSAGE_OVERHEAD_CHARS;
            chars += length(message.getContent());
            if (message.hasToolCalls()) {
                for (Message.ToolCall call : message.getToolCalls()) {
                    chars += length(call.getName()) + argumentsLength(call.getArguments());
                }
            }
        }
        return toTokens(chars);
    }

    public long estimateTurn(ConversationTurn turn) {
        long chars = 2L * MESSAGE_OVERHEAD_CHARS
                + length(turn.userMessage())
                + length(turn.assistantResponse());
        for (TurnToolCall call : turn.toolCalls()) {
            chars += MESSAGE_OVERHEAD_CHARS + length(call.tool()) + argumentsLength(call.parameters());
        }
        for (TurnToolResult result : turn.toolResults()) {
            chars += MESSAGE_OVERHEAD_CHARS + length(result.output());
        }
        return toTokens(chars);
    }

    private long toTokens(long chars) {
        int charsPerToken = Math.max(1, properties.getCompaction().getCharsPerToken());
        return (chars + charsPerToken - 1) / charsPerToken;
    }

    private static long argumentsLength(Map<String, Object> arguments) {
        if (arguments == null) {
            return 0;
        }
        long chars = 0;
        for (Map.Entry<String, Object> entry : arguments.entrySet()) {
            chars += entry.getKey().length() + String.valueOf(entry.getValue()).length();
        }
        return chars;
    }

    private static int length(String text) {
        return text != null ? text.length() : 0;
    }
}
