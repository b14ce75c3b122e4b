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
import me.golemcore.agent.domain.model.ConversationTurn;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.TurnToolCall;
import me.golemcore.agent.domain.model.TurnToolResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts between the message history and {@link ConversationTurn}s.
 *
 * <p>
 * A tool result must always travel with the call it answers. Building a turn
 * from messages that contain an unanswered call or an unmatched result fails
 * with {@link CompactionException}.
 */
@Service
@RequiredArgsConstructor
public class TurnConverter {

    private final TokenEstimator tokenEstimator;

    /**
     * Builds one turn from an exchange that starts with the user message.
     */
    public ConversationTurn toTurn(List<Message> exchange, boolean previousError) {
        if (exchange.isEmpty() || !exchange.get(0).isUserMessage()) {
            throw new CompactionException("Exchange must start with a user message");
        }
        Message userMessage = exchange.get(0);
        List<TurnToolCall> toolCalls = new ArrayList<>();
        List<TurnToolResult> toolResults = new ArrayList<>();
        Set<String> openCallIds = new LinkedHashSet<>();
        StringBuilder response = new StringBuilder();

        for (Message msg : exchange.subList(1, exchange.size())) {
            if (msg.isAssistantMessage()) {
                appendSpan(response, msg.getContent());
                if (msg.hasToolCalls()) {
                    for (Message.ToolCall call : msg.getToolCalls()) {
                        toolCalls.add(TurnToolCall.builder()
                                .tool(call.getName())
                                .id(call.getId())
                                .parameters(call.getArguments())
                                .build());
                        openCallIds.add(call.getId());
                    }
                }
            } else if (msg.isToolMessage()) {
                if (!openCallIds.remove(msg.getToolCallId())) {
                    throw new CompactionException("Orphaned tool result without matching call: "
                            + msg.getToolCallId());
                }
                toolResults.add(TurnToolResult.builder()
                        .toolCallId(msg.getToolCallId())
                        .success(!msg.isToolError())
                        .output(msg.getContent())
                        .error(msg.isToolError() ? firstLine(msg.getContent()) : null)
                        .build());
            }
        }
        if (!openCallIds.isEmpty()) {
            throw new CompactionException("Orphaned tool call without result: " + openCallIds);
        }

        ConversationTurn turn = ConversationTurn.builder()
                .userMessage(userMessage.getContent())
                .toolCalls(toolCalls)
                .toolResults(toolResults)
                .assistantResponse(response.toString())
                .timestamp(userMessage.getTimestamp() != null ? userMessage.getTimestamp() : Instant.now())
                .previousError(previousError)
                .build();
        return turn.withTokens(tokenEstimator.estimateTurn(turn));
    }

    /**
     * Splits a history into turns. System messages are skipped, and a trailing
     * user message without any response does not form a turn.
     */
    public List<ConversationTurn> fromMessages(List<Message> messages) {
        List<ConversationTurn> turns = new ArrayList<>();
        List<Message> exchange = new ArrayList<>();
        for (Message msg : messages) {
            if (msg.isSystemMessage()) {
                continue;
            }
            if (msg.isUserMessage() && !exchange.isEmpty()) {
                addTurn(turns, exchange);
                exchange = new ArrayList<>();
            }
            if (exchange.isEmpty() && !msg.isUserMessage()) {
                // response without a preceding user message
                continue;
            }
            exchange.add(msg);
        }
        addTurn(turns, exchange);
        return turns;
    }

    /**
     * Renders a turn back into messages, keeping every call next to its result.
     *
     * @throws CompactionException
     *             if the turn's results do not answer each call exactly once
     */
    public List<Message> toMessages(ConversationTurn turn) {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.builder()
                .role(Message.ROLE_USER)
                .content(turn.userMessage())
                .timestamp(turn.timestamp())
                .build());

        if (!turn.toolCalls().isEmpty()) {
            Map<String, TurnToolCall> callsById = new LinkedHashMap<>();
            List<Message.ToolCall> calls = new ArrayList<>();
            for (int i = 0; i < turn.toolCalls().size(); i++) {
                TurnToolCall call = turn.toolCalls().get(i);
                String id = call.id() != null ? call.id() : "call_" + i;
                callsById.put(id, call);
                calls.add(Message.ToolCall.builder()
                        .id(id)
                        .name(call.tool())
                        .arguments(call.parameters())
                        .build());
            }
            messages.add(Message.builder()
                    .role(Message.ROLE_ASSISTANT)
                    .content("")
                    .toolCalls(calls)
                    .timestamp(turn.timestamp())
                    .build());

            if (callsById.size() != calls.size()) {
                throw new CompactionException("Turn repeats a tool call id");
            }
            if (turn.toolResults().size() != calls.size()) {
                throw new CompactionException("Turn has " + calls.size() + " tool call(s) but "
                        + turn.toolResults().size() + " result(s)");
            }
            List<String> ids = new ArrayList<>(callsById.keySet());
            Set<String> answered = new HashSet<>();
            for (int i = 0; i < turn.toolResults().size(); i++) {
                TurnToolResult result = turn.toolResults().get(i);
                // results without an id answer the call at the same position
                String id = result.toolCallId() != null ? result.toolCallId() : ids.get(i);
                if (!callsById.containsKey(id)) {
                    throw new CompactionException("Orphaned tool result without matching call: " + id);
                }
                if (!answered.add(id)) {
                    throw new CompactionException("Tool call answered more than once: " + id);
                }
                messages.add(Message.builder()
                        .role(Message.ROLE_TOOL)
                        .toolCallId(id)
                        .toolName(callsById.get(id).tool())
                        .content(result.output())
                        .toolError(!result.success())
                        .timestamp(turn.timestamp())
                        .build());
            }
        }

        if (!turn.assistantResponse().isBlank()) {
            messages.add(Message.builder()
                    .role(Message.ROLE_ASSISTANT)
                    .content(turn.assistantResponse())
                    .timestamp(turn.timestamp())
                    .build());
        }
        return messages;
    }

    private void addTurn(List<ConversationTurn> turns, List<Message> exchange) {
        if (exchange.size() < 2) {
            return;
        }
        boolean previousError = !turns.isEmpty() && turns.get(turns.size() - 1).hasFailedResult();
        turns.add(toTurn(exchange, previousError));
    }

    private static void appendSpan(StringBuilder response, String span) {
        if (span == null || span.isBlank()) {
            return;
        }
        if (response.length() > 0) {
            response.append("\n\n");
        }
        response.append(span);
    }

    private static String firstLine(String text) {
        if (text == null) {
            return null;
        }
        int newline = text.indexOf('\n');
        return newline >= 0 ? text.substring(0, newline) : text;
    }
}
