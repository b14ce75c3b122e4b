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

/**
 * Single event of a backend stream.
 *
 * <p>
 * Usage events ({@link Type#CALL_START}, {@link Type#STREAM_DELTA},
 * {@link Type#FINAL_RESPONSE}) carry the index of the backend call they belong
 * to. A turn that runs a tool loop issues several calls; the index tells the
 * accumulator when one call ends and the next begins.
 */
@Data
@Builder
public class BackendEvent {

    public enum Type {
        TEXT, TOOL_CALL, TOOL_RESULT, CALL_START, STREAM_DELTA, FINAL_RESPONSE
    }

    private Type type;
    private String text;
    private ToolCallInfo toolCall;
    private ToolResultInfo toolResult;
    private int callIndex;
    private TokenUsage usage;

    public static BackendEvent text(String text) {
        return BackendEvent.builder().type(Type.TEXT).text(text).build();
    }

    public static BackendEvent toolCall(ToolCallInfo toolCall) {
        return BackendEvent.builder().type(Type.TOOL_CALL).toolCall(toolCall).build();
    }

    public static BackendEvent toolResult(ToolResultInfo toolResult) {
        return BackendEvent.builder().type(Type.TOOL_RESULT).toolResult(toolResult).build();
    }

    public static BackendEvent callStart(int callIndex, TokenUsage usage) {
        return BackendEvent.builder().type(Type.CALL_START).callIndex(callIndex).usage(usage).build();
    }

    public static BackendEvent streamDelta(int callIndex, TokenUsage usage) {
        return BackendEvent.builder().type(Type.STREAM_DELTA).callIndex(callIndex).usage(usage).build();
    }

    public static BackendEvent finalResponse(int callIndex, TokenUsage usage) {
        return BackendEvent.builder().type(Type.FINAL_RESPONSE).callIndex(callIndex).usage(usage).build();
    }

    public boolean isUsage() {
        return type == Type.CALL_START || type == Type.STREAM_DELTA || type == Type.FINAL_RESPONSE;
    }
}
