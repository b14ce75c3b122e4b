package me.golemcore.agent.domain.loop;

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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.domain.model.BackendEvent;
import me.golemcore.agent.domain.model.CancellationReason;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.StreamCancelledException;
import me.golemcore.agent.domain.model.StreamChunk;
import me.golemcore.agent.domain.model.StreamOutcome;
import me.golemcore.agent.domain.model.ToolCallInfo;
import me.golemcore.agent.domain.model.ToolResultInfo;
import me.golemcore.agent.domain.service.TokenAccountant;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Drives one backend stream to completion, interruption, compaction cancel or
 * failure.
 *
 * <p>
 * Backend events and external signals are merged into a single queue. Every
 * iteration checks the interrupt flag before taking the next item, so an
 * interrupt takes effect at the next chunk boundary. The loop never emits the
 * terminal chunk itself; the session does that once history is committed.
 */
@Slf4j
public class StreamLoop {

    private static final String PREVIEW_ELLIPSIS = "...";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final AtomicBoolean interruptFlag;
    private final InterruptSource interruptSource;
    private final TokenAccountant accountant;
    private final ObjectMapper objectMapper;
    private final int toolResultPreviewChars;
    private final TokenRateCalculator rateCalculator;

    private final BlockingQueue<LoopEvent> queue = new LinkedBlockingQueue<>();
    private final List<Message> produced = new ArrayList<>();
    private final StringBuilder textSpan = new StringBuilder();
    private final List<Message.ToolCall> pendingCalls = new ArrayList<>();
    private final Map<String, String> toolNamesById = new HashMap<>();
    private int rateCallIndex = -1;
    private long rateCallOutput;

    public StreamLoop(AtomicBoolean interruptFlag, InterruptSource interruptSource, TokenAccountant accountant,
            ObjectMapper objectMapper, int toolResultPreviewChars, TokenRateCalculator rateCalculator) {
        this.interruptFlag = interruptFlag;
        this.interruptSource = interruptSource;
        this.accountant = accountant;
        this.objectMapper = objectMapper;
        this.toolResultPreviewChars = toolResultPreviewChars;
        this.rateCalculator = rateCalculator;
    }

    public StreamResult run(Flux<BackendEvent> stream, CompactionHook hook, CancelSignal cancelSignal,
            BatchingChunkSink sink, Supplier<List<String>> queuedInputs) {
        Disposable.Swap subscription = Disposables.swap();
        cancelSignal.onCancel(reason -> {
            subscription.dispose();
            queue.offer(LoopEvent.failure(new StreamCancelledException(reason)));
        });
        Disposable signals = interruptSource.signals(interruptFlag)
                .subscribe(signal -> queue.offer(LoopEvent.signal(signal)));

        try {
            subscription.update(stream
                    .doOnNext(hook::observe)
                    .subscribe(
                            event -> queue.offer(LoopEvent.backend(event)),
                            error -> queue.offer(LoopEvent.failure(error)),
                            () -> queue.offer(LoopEvent.complete())));
            return loop(hook, sink, queuedInputs);
        } finally {
            subscription.dispose();
            signals.dispose();
        }
    }

    private StreamResult loop(CompactionHook hook, BatchingChunkSink sink, Supplier<List<String>> queuedInputs) {
        while (true) {
            if (interruptFlag.get()) {
                return interrupted(sink, queuedInputs);
            }
            LoopEvent event;
            try {
                event = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interruptFlag.set(true);
                return interrupted(sink, queuedInputs);
            }

            switch (event.kind()) {
            case SIGNAL -> sink.flushIfDue();
            case BACKEND -> {
                if (dispatch(event.backendEvent(), sink)) {
                    return completed(sink);
                }
            }
            case COMPLETE -> {
                log.debug("[Stream] Backend completed without a final response");
                return completed(sink);
            }
            case FAILURE -> {
                return failed(event.error(), hook, sink, queuedInputs);
            }
            default -> throw new IllegalStateException("Unknown loop event: " + event.kind());
            }
        }
    }

    /**
     * @return {@code true} when the event ends the stream successfully
     */
    private boolean dispatch(BackendEvent event, BatchingChunkSink sink) {
        switch (event.getType()) {
        case TEXT -> {
            if (event.getText() != null && !event.getText().isEmpty()) {
                textSpan.append(event.getText());
                sink.accept(StreamChunk.text(event.getText()));
            }
        }
        case TOOL_CALL -> onToolCall(event.getToolCall(), sink);
        case TOOL_RESULT -> onToolResult(event.getToolResult(), sink);
        case CALL_START -> sink.accept(StreamChunk.tokenUpdate(accountant.snapshot(), rateCalculator.currentRate()));
        case STREAM_DELTA -> {
            recordOutputRate(event);
            sink.accept(StreamChunk.tokenUpdate(accountant.snapshot(), rateCalculator.currentRate()));
        }
        case FINAL_RESPONSE -> {
            sink.accept(StreamChunk.tokenUpdate(accountant.snapshot(), rateCalculator.currentRate()));
            return true;
        }
        default -> log.warn("[Stream] Ignoring backend event {}", event.getType());
        }
        return false;
    }

    /**
     * Feeds the output growth of the current call into the rate calculator.
     * Output counts restart at zero with every call index.
     */
    private void recordOutputRate(BackendEvent event) {
        if (event.getUsage() == null) {
            return;
        }
        if (event.getCallIndex() != rateCallIndex) {
            rateCallIndex = event.getCallIndex();
            rateCallOutput = 0;
        }
        long output = event.getUsage().outputTokens();
        if (output > rateCallOutput) {
            rateCalculator.record(output - rateCallOutput);
            rateCallOutput = output;
        }
    }

    private void onToolCall(ToolCallInfo call, BatchingChunkSink sink) {
        if (call == null) {
            return;
        }
        flushTextSpan();
        pendingCalls.add(Message.ToolCall.builder()
                .id(call.id())
                .name(call.name())
                .arguments(parseArguments(call.input()))
                .build());
        toolNamesById.put(call.id(), call.name());
        sink.accept(StreamChunk.toolCall(call));
    }

    private void onToolResult(ToolResultInfo result, BatchingChunkSink sink) {
        if (result == null) {
            return;
        }
        if (!toolNamesById.containsKey(result.toolCallId())) {
            log.warn("[Stream] Dropping tool result without matching call: {}", result.toolCallId());
            return;
        }
        flushTextSpan();
        if (!pendingCalls.isEmpty()) {
            produced.add(Message.builder()
                    .role(Message.ROLE_ASSISTANT)
                    .content("")
                    .toolCalls(new ArrayList<>(pendingCalls))
                    .timestamp(Instant.now())
                    .build());
            pendingCalls.clear();
        }
        String content = result.content() != null ? result.content() : "";
        boolean error = result.error() || detectToolError(content);
        String toolName = toolNamesById.get(result.toolCallId());
        produced.add(Message.builder()
                .role(Message.ROLE_TOOL)
                .toolCallId(result.toolCallId())
                .toolName(toolName)
                .content(content)
                .toolError(error)
                .timestamp(Instant.now())
                .build());
        sink.accept(StreamChunk.toolResult(result.toBuilder()
                .toolName(toolName)
                .content(preview(content))
                .error(error)
                .build()));
    }

    private StreamResult completed(BatchingChunkSink sink) {
        sink.flush();
        return new StreamResult(StreamOutcome.COMPLETED, finishMessages(), null);
    }

    private StreamResult interrupted(BatchingChunkSink sink, Supplier<List<String>> queuedInputs) {
        log.info("[Stream] Interrupted, keeping {} chars of partial output", textSpan.length());
        sink.flush();
        sink.accept(StreamChunk.interrupted(queuedInputs.get()));
        return new StreamResult(StreamOutcome.INTERRUPTED, finishMessages(), null);
    }

    private StreamResult failed(Throwable error, CompactionHook hook, BatchingChunkSink sink,
            Supplier<List<String>> queuedInputs) {
        sink.flush();
        if (error instanceof StreamCancelledException cancelled) {
            if (cancelled.getReason() == CancellationReason.COMPACTION && hook.isCompactionNeeded()) {
                return new StreamResult(StreamOutcome.COMPACTION_TRIGGERED, List.of(), null);
            }
            if (cancelled.getReason() == CancellationReason.USER_INTERRUPT) {
                return interrupted(sink, queuedInputs);
            }
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        log.error("[Stream] Backend stream failed: {}", message);
        return new StreamResult(StreamOutcome.ERRORED, List.of(), message);
    }

    /**
     * Messages of the exchange with the trailing text span flushed and every
     * call that never received a result removed.
     */
    private List<Message> finishMessages() {
        flushTextSpan();
        Set<String> answered = new HashSet<>();
        for (Message msg : produced) {
            if (msg.isToolMessage()) {
                answered.add(msg.getToolCallId());
            }
        }
        Iterator<Message> iterator = produced.iterator();
        while (iterator.hasNext()) {
            Message msg = iterator.next();
            if (!msg.hasToolCalls()) {
                continue;
            }
            List<Message.ToolCall> kept = msg.getToolCalls().stream()
                    .filter(call -> answered.contains(call.getId()))
                    .toList();
            if (kept.isEmpty() && (msg.getContent() == null || msg.getContent().isBlank())) {
                iterator.remove();
            } else {
                msg.setToolCalls(kept.isEmpty() ? null : new ArrayList<>(kept));
            }
        }
        return Collections.unmodifiableList(new ArrayList<>(produced));
    }

    private void flushTextSpan() {
        if (textSpan.length() == 0) {
            return;
        }
        produced.add(Message.assistant(textSpan.toString()));
        textSpan.setLength(0);
    }

    private Map<String, Object> parseArguments(String input) {
        if (input == null || input.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(input, MAP_TYPE_REF);
        } catch (Exception e) {
            log.debug("[Stream] Tool input is not a JSON object: {}", e.getMessage());
            return Map.of("input", input);
        }
    }

    /**
     * A structured result reports failure through {@code "success": false} or
     * a non-empty {@code "error"} field. Plain text is never an error.
     */
    boolean detectToolError(String content) {
        String trimmed = content.strip();
        if (!trimmed.startsWith("{")) {
            return false;
        }
        try {
            JsonNode node = objectMapper.readTree(trimmed);
            if (!node.isObject()) {
                return false;
            }
            JsonNode success = node.get("success");
            if (success != null && success.isBoolean() && !success.asBoolean()) {
                return true;
            }
            JsonNode error = node.get("error");
            if (error == null || error.isNull()) {
                return false;
            }
            return !error.isTextual() || !error.asText().isEmpty();
        } catch (Exception e) {
            return false;
        }
    }

    String preview(String content) {
        String text = content;
        if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
            text = text.substring(1, text.length() - 1)
                    .replace("\\n", "\n")
                    .replace("\\t", "\t")
                    .replace("\\r", "\r")
                    .replace("\\\"", "\"")
                    .replace("\\\\", "\\");
        }
        if (text.length() <= toolResultPreviewChars) {
            return text;
        }
        return text.substring(0, Math.max(0, toolResultPreviewChars - PREVIEW_ELLIPSIS.length()))
                + PREVIEW_ELLIPSIS;
    }

    private record LoopEvent(Kind kind, BackendEvent backendEvent, Throwable error, LoopSignal signal) {

        enum Kind {
            BACKEND, COMPLETE, FAILURE, SIGNAL
        }

        static LoopEvent backend(BackendEvent event) {
            return new LoopEvent(Kind.BACKEND, event, null, null);
        }

        static LoopEvent complete() {
            return new LoopEvent(Kind.COMPLETE, null, null, null);
        }

        static LoopEvent failure(Throwable error) {
            return new LoopEvent(Kind.FAILURE, null, error, null);
        }

        static LoopEvent signal(LoopSignal signal) {
            return new LoopEvent(Kind.SIGNAL, null, null, signal);
        }
    }
}
