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
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Message of the session history in backend-neutral form. Roles are user,
 * assistant, system and tool; assistant messages may carry tool calls and tool
 * messages reference the call they answer.
 */
@Data
@Builder(toBuilder = true)
public class Message {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_TOOL = "tool";

    private String role;
    private String content;

    private List<ToolCall> toolCalls;
    private String toolCallId; // For tool response messages
    private String toolName;
    private boolean toolError;

    private Instant timestamp;

    public static Message user(String content) {
        return Message.builder().role(ROLE_USER).content(content).timestamp(Instant.now()).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(ROLE_ASSISTANT).content(content).timestamp(Instant.now()).build();
    }

    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    public boolean isSystemMessage() {
        return ROLE_SYSTEM.equals(role);
    }

    public boolean isToolMessage() {
        return ROLE_TOOL.equals(role);
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    private static final int MAX_ARGS_LENGTH = 200;
    private static final int MAX_RESULT_LENGTH = 2000;

    /**
     * Folds tool interactions into plain assistant text. An assistant message
     * with tool calls absorbs the tool messages answering those calls and
     * becomes a single assistant message listing each invocation and result.
     *
     * <p>
     * Messages without tool calls pass through unchanged.
     *
     * @param messages
     *            the message list to flatten
     * @return a new list with tool interactions converted to plain text
     */
    public static List<Message> flattenToolMessages(List<Message> messages) {
        if (messages == null || messages.isEmpty()) {
            return messages;
        }

        Map<String, Message> toolResultsByCallId = new LinkedHashMap<>();
        for (Message msg : messages) {
            if (msg.isToolMessage() && msg.getToolCallId() != null) {
                toolResultsByCallId.put(msg.getToolCallId(), msg);
            }
        }

        if (toolResultsByCallId.isEmpty() && messages.stream().noneMatch(Message::hasToolCalls)) {
            return messages;
        }

        List<Message> result = new ArrayList<>();
        Set<String> consumedToolCallIds = new HashSet<>();

        for (Message msg : messages) {
            if (msg.isToolMessage()) {
                if (consumedToolCallIds.contains(msg.getToolCallId())) {
                    continue;
                }
                result.add(Message.builder()
                        .role(ROLE_ASSISTANT)
                        .content(formatOrphanedToolResult(msg))
                        .timestamp(msg.getTimestamp())
                        .build());
            } else if (msg.isAssistantMessage() && msg.hasToolCalls()) {
                StringBuilder sb = new StringBuilder();
                if (msg.getContent() != null && !msg.getContent().isBlank()) {
                    sb.append(msg.getContent()).append("\n");
                }
                for (ToolCall tc : msg.getToolCalls()) {
                    sb.append("\n[Tool: ").append(tc.getName());
                    sb.append(" | Args: ").append(truncateStr(formatArgs(tc.getArguments()), MAX_ARGS_LENGTH));
                    sb.append("]\n");

                    Message toolResult = tc.getId() != null ? toolResultsByCallId.get(tc.getId()) : null;
                    if (toolResult != null) {
                        consumedToolCallIds.add(tc.getId());
                        String resultContent = toolResult.getContent();
                        if (resultContent == null || resultContent.isEmpty()) {
                            sb.append("[Result: <empty>]\n");
                        } else {
                            sb.append("[Result: ").append(truncateStr(resultContent, MAX_RESULT_LENGTH)).append("]\n");
                        }
                    } else {
                        sb.append("[Result: <no response>]\n");
                    }
                }

                result.add(Message.builder()
                        .role(ROLE_ASSISTANT)
                        .content(sb.toString().stripTrailing())
                        .timestamp(msg.getTimestamp())
                        .build());
            } else {
                result.add(msg);
            }
        }

        return result;
    }

    private static String formatArgs(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : args.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("\"").append(entry.getKey()).append("\": ");
            Object val = entry.getValue();
            if (val instanceof String) {
                sb.append("\"").append(val).append("\"");
            } else {
                sb.append(val);
            }
            first = false;
        }
        sb.append("}");
        return sb.toString();
    }

    private static String truncateStr(String text, int maxLen) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLen) {
            return text;
        }
        return text.substring(0, maxLen) + "...";
    }

    private static String formatOrphanedToolResult(Message toolMsg) {
        String name = toolMsg.getToolName() != null ? toolMsg.getToolName() : "unknown";
        String content = toolMsg.getContent();
        if (content == null || content.isEmpty()) {
            content = "<empty>";
        } else {
            content = truncateStr(content, MAX_RESULT_LENGTH);
        }
        return "[Tool: " + name + "]\n[Result: " + content + "]";
    }

    /**
     * Function call requested by the model.
     */
    @Data
    @Builder
    public static class ToolCall {
        private String id;
        private String name;
        private Map<String, Object> arguments;
    }
}
