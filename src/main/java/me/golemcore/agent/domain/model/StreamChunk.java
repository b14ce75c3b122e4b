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

import java.util.List;
import java.util.OptionalDouble;

/**
 * Typed event delivered to the consumer of a prompt. Every prompt call ends
 * with exactly one terminal chunk ({@link ChunkType#DONE} or
 * {@link ChunkType#ERROR}).
 */
@Data
@Builder
public class StreamChunk {

    public enum ChunkType {
        TEXT, TOOL_CALL, TOOL_RESULT, STATUS, INTERRUPTED, TOKEN_UPDATE, DONE, ERROR
    }

    private ChunkType type;
    private String text;
    private ToolCallInfo toolCall;
    private ToolResultInfo toolResult;
    private List<String> queuedInputs;
    private TokenTracker tokens;
    /** Smoothed output rate of the running stream, {@code null} until measurable. */
    private Double tokensPerSecond;

    public static StreamChunk text(String text) {
        return StreamChunk.builder().type(ChunkType.TEXT).text(text).build();
    }

    public static StreamChunk toolCall(ToolCallInfo info) {
        return StreamChunk.builder().type(ChunkType.TOOL_CALL).toolCall(info).build();
    }

    public static StreamChunk toolResult(ToolResultInfo info) {
        return StreamChunk.builder().type(ChunkType.TOOL_RESULT).toolResult(info).build();
    }

    public static StreamChunk status(String message) {
        return StreamChunk.builder().type(ChunkType.STATUS).text(message).build();
    }

    public static StreamChunk interrupted(List<String> queuedInputs) {
        return StreamChunk.builder().type(ChunkType.INTERRUPTED).queuedInputs(List.copyOf(queuedInputs)).build();
    }

    public static StreamChunk tokenUpdate(TokenTracker tokens, OptionalDouble tokensPerSecond) {
        return StreamChunk.builder()
                .type(ChunkType.TOKEN_UPDATE)
                .tokens(tokens)
                .tokensPerSecond(tokensPerSecond.isPresent() ? tokensPerSecond.getAsDouble() : null)
                .build();
    }

    public static StreamChunk done() {
        return StreamChunk.builder().type(ChunkType.DONE).build();
    }

    public static StreamChunk error(String message) {
        return StreamChunk.builder().type(ChunkType.ERROR).text(message).build();
    }

    public boolean isTerminal() {
        return type == ChunkType.DONE || type == ChunkType.ERROR;
    }
}
