package me.golemcore.agent.domain.session;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.adapter.outbound.backend.BackendRegistry;
import me.golemcore.agent.domain.loop.BatchingChunkSink;
import me.golemcore.agent.domain.loop.CancelSignal;
import me.golemcore.agent.domain.loop.CompactionHook;
import me.golemcore.agent.domain.loop.InterruptSource;
import me.golemcore.agent.domain.loop.StreamLoop;
import me.golemcore.agent.domain.loop.StreamResult;
import me.golemcore.agent.domain.loop.TokenRateCalculator;
import me.golemcore.agent.domain.model.CancellationReason;
import me.golemcore.agent.domain.model.CompactionException;
import me.golemcore.agent.domain.model.CompactionResult;
import me.golemcore.agent.domain.model.CompactionSummary;
import me.golemcore.agent.domain.model.ConversationTurn;
import me.golemcore.agent.domain.model.HistoryMessage;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.StreamChunk;
import me.golemcore.agent.domain.model.StreamOutcome;
import me.golemcore.agent.domain.model.TokenTracker;
import me.golemcore.agent.domain.service.CompactionOrchestrationService;
import me.golemcore.agent.domain.service.TokenAccountant;
import me.golemcore.agent.domain.service.TokenEstimator;
import me.golemcore.agent.domain.service.TurnConverter;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.BackendAgent;
import me.golemcore.agent.port.outbound.BackendPort;
import me.golemcore.agent.port.outbound.ChunkSink;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A conversation with one model backend at a time.
 *
 * <p>
 * The session owns the message history, the completed turns, the token state
 * and the interrupt flag. {@link #prompt(String, ChunkSink)} and
 * {@link #compact()} hold the session lock for their whole duration; backend
 * switches are rejected while a prompt is running.
 *
 * <p>
 * When the compaction hook cancels a stream, the prompt is taken back out of
 * the history, the conversation is compacted, and the prompt is sent again
 * exactly once. A second threshold breach ends the call with an error.
 */
@Slf4j
public class AgentSession {

    private static final Set<String> RESTORABLE_ROLES = Set.of(Message.ROLE_USER, Message.ROLE_ASSISTANT,
            Message.ROLE_SYSTEM);

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicBoolean interruptFlag = new AtomicBoolean(false);
    private final AtomicBoolean streaming = new AtomicBoolean(false);
    private final Queue<String> queuedInputs = new ConcurrentLinkedQueue<>();
    private final TokenAccountant accountant = new TokenAccountant();

    private final List<Message> messages = new ArrayList<>();
    private final List<ConversationTurn> turns = new ArrayList<>();

    private final BackendRegistry backendRegistry;
    private final CompactionOrchestrationService compactionService;
    private final TurnConverter turnConverter;
    private final TokenEstimator tokenEstimator;
    private final InterruptSource interruptSource;
    private final AgentProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private volatile BackendPort backend;
    private volatile CancelSignal activeCancel;

    public AgentSession(BackendPort initialBackend, BackendRegistry backendRegistry,
            CompactionOrchestrationService compactionService, TurnConverter turnConverter,
            TokenEstimator tokenEstimator, InterruptSource interruptSource, AgentProperties properties,
            ObjectMapper objectMapper, Clock clock) {
        this.backend = initialBackend;
        this.backendRegistry = backendRegistry;
        this.compactionService = compactionService;
        this.turnConverter = turnConverter;
        this.tokenEstimator = tokenEstimator;
        this.interruptSource = interruptSource;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Sends a prompt and streams the response to {@code consumer}. Returns once
     * the call ended; the last chunk delivered is always {@code Done} or
     * {@code Error}.
     *
     * <p>
     * The interrupt flag is not cleared here. Callers reset it with
     * {@link #resetInterrupt()} before a new prompt.
     *
     * @throws IllegalArgumentException
     *             if the input is blank
     */
    public StreamOutcome prompt(String input, ChunkSink consumer) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Prompt must not be blank");
        }
        AgentProperties.StreamProperties stream = properties.getStream();
        BatchingChunkSink sink = new BatchingChunkSink(consumer, stream.getTextBatchChars(),
                stream.getTextBatchIntervalMs(), clock);

        lock.lock();
        streaming.set(true);
        try {
            return runPrompt(input, sink);
        } catch (RuntimeException e) {
            log.error("[Session] Prompt failed: {}", e.getMessage(), e);
            sink.accept(StreamChunk.error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
            return StreamOutcome.ERRORED;
        } finally {
            activeCancel = null;
            streaming.set(false);
            lock.unlock();
        }
    }

    /**
     * Reactive variant of {@link #prompt(String, ChunkSink)}. The prompt runs on
     * a bounded elastic worker; cancelling the subscription interrupts it.
     */
    public Flux<StreamChunk> promptStream(String input) {
        return Flux.<StreamChunk>create(emitter -> {
            emitter.onCancel(this::interrupt);
            Schedulers.boundedElastic().schedule(() -> {
                try {
                    prompt(input, emitter::next);
                    emitter.complete();
                } catch (RuntimeException e) {
                    emitter.error(e);
                }
            });
        });
    }

    private StreamOutcome runPrompt(String input, BatchingChunkSink sink) {
        Message userMessage = Message.builder()
                .role(Message.ROLE_USER)
                .content(input)
                .timestamp(clock.instant())
                .build();
        messages.add(userMessage);

        BackendPort activeBackend = backend;
        BackendAgent agent = activeBackend.createAgent();
        long threshold = TokenAccountant.threshold(activeBackend.getContextWindow(),
                properties.getCompaction().getThresholdRatio());
        boolean retried = false;

        while (true) {
            accountant.beginTurn();
            List<Message> outgoing = List.copyOf(messages);
            CancelSignal cancelSignal = new CancelSignal();
            activeCancel = cancelSignal;
            CompactionHook hook = new CompactionHook(accountant, threshold,
                    tokenEstimator.estimateMessages(outgoing), cancelSignal);
            StreamLoop loop = new StreamLoop(interruptFlag, interruptSource, accountant, objectMapper,
                    properties.getStream().getToolResultPreviewChars(), new TokenRateCalculator(clock));

            StreamResult result = loop.run(agent.stream(outgoing), hook, cancelSignal, sink,
                    this::drainQueuedInputs);

            switch (result.outcome()) {
            case COMPLETED, INTERRUPTED -> {
                commitExchange(result.messages());
                accountant.commitTurn();
                sink.accept(StreamChunk.done());
                return result.outcome();
            }
            case ERRORED -> {
                accountant.commitTurn();
                sink.accept(StreamChunk.error(result.errorMessage()));
                return StreamOutcome.ERRORED;
            }
            case COMPACTION_TRIGGERED -> {
                if (retried) {
                    log.warn("[Session] Threshold breached again after compaction");
                    accountant.beginTurn();
                    sink.accept(StreamChunk.error(
                            "Context window threshold exceeded again after compaction (" + threshold + " tokens)"));
                    return StreamOutcome.ERRORED;
                }
                if (!compactForRetry(userMessage, threshold, sink)) {
                    return StreamOutcome.ERRORED;
                }
                retried = true;
            }
            default -> throw new IllegalStateException("Unexpected stream outcome: " + result.outcome());
            }
        }
    }

    /**
     * Compacts the history without the pending prompt, then re-appends it.
     *
     * @return {@code false} if compaction failed and the call must end
     */
    private boolean compactForRetry(Message userMessage, long threshold, BatchingChunkSink sink) {
        sink.accept(StreamChunk.status("Context window threshold reached (" + threshold
                + " tokens), compacting conversation..."));
        accountant.beginTurn();
        messages.remove(messages.size() - 1);

        CompactionResult result;
        try {
            result = compactionService.compact(List.copyOf(turns), List.copyOf(messages));
        } catch (CompactionException e) {
            log.error("[Session] Compaction failed: {}", e.getMessage());
            messages.add(userMessage);
            sink.accept(StreamChunk.error("Compaction failed: " + e.getMessage()));
            return false;
        }

        applyCompaction(result);
        for (String warning : result.warnings()) {
            sink.accept(StreamChunk.status(warning));
        }
        CompactionSummary summary = result.summary();
        sink.accept(StreamChunk.status(String.format("Context compacted: %d -> %d tokens (%.0f%% compression)",
                summary.originalTokens(), summary.compactedTokens(), summary.compressionRatio())));
        messages.add(userMessage);
        return true;
    }

    private void commitExchange(List<Message> produced) {
        if (produced.isEmpty()) {
            return;
        }
        int userIndex = messages.size() - 1;
        messages.addAll(produced);
        List<Message> exchange = new ArrayList<>(messages.subList(userIndex, messages.size()));
        boolean previousError = !turns.isEmpty() && turns.get(turns.size() - 1).hasFailedResult();
        turns.add(turnConverter.toTurn(exchange, previousError));
    }

    private void applyCompaction(CompactionResult result) {
        messages.clear();
        messages.addAll(result.messages());
        turns.clear();
        turns.addAll(result.keptTurns());
        long compactedTokens = result.summary().compactedTokens();
        accountant.reset(TokenTracker.builder().inputTokens(compactedTokens).build(), compactedTokens);
    }

    /**
     * Compacts the conversation on request.
     *
     * @throws CompactionException
     *             if there is nothing to compact or the summary cannot be built
     */
    public CompactionSummary compact() {
        lock.lock();
        try {
            if (turns.isEmpty()) {
                throw new CompactionException("nothing to compact");
            }
            CompactionResult result = compactionService.compact(List.copyOf(turns), List.copyOf(messages));
            applyCompaction(result);
            return result.summary();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Requests cancellation of the running prompt, disposes its backend request
     * and wakes its loop.
     */
    public void interrupt() {
        if (!interruptFlag.getAndSet(true)) {
            log.info("[Session] Interrupt requested");
        }
        CancelSignal cancelSignal = activeCancel;
        if (cancelSignal != null) {
            cancelSignal.cancel(CancellationReason.USER_INTERRUPT);
        }
        interruptSource.wake();
    }

    public void resetInterrupt() {
        interruptFlag.set(false);
    }

    public boolean isInterrupted() {
        return interruptFlag.get();
    }

    public boolean isStreaming() {
        return streaming.get();
    }

    /**
     * Queues input typed while a prompt is streaming. The queue is handed back
     * with the {@code Interrupted} chunk.
     */
    public void enqueueInput(String input) {
        if (input != null && !input.isBlank()) {
            queuedInputs.add(input);
        }
    }

    public List<String> drainQueuedInputs() {
        List<String> drained = new ArrayList<>();
        String next;
        while ((next = queuedInputs.poll()) != null) {
            drained.add(next);
        }
        return drained;
    }

    /**
     * @throws IllegalStateException
     *             if a prompt is running
     * @throws IllegalArgumentException
     *             if no backend has that name
     */
    public void switchBackend(String name) {
        if (streaming.get() || !lock.tryLock()) {
            throw new IllegalStateException("Cannot switch backend while a stream is active");
        }
        try {
            BackendPort next = backendRegistry.getBackend(name);
            if (!next.isAvailable()) {
                log.warn("[Session] Switching to backend '{}' which reports itself unavailable", name);
            }
            log.info("[Session] Backend switched: {} -> {}", backend.getName(), next.getName());
            backend = next;
        } finally {
            lock.unlock();
        }
    }

    public String currentBackendName() {
        return backend.getName();
    }

    public List<String> availableBackends() {
        return backendRegistry.getNames();
    }

    public TokenTracker tokenTracker() {
        return accountant.snapshot();
    }

    /**
     * History flattened to {role, content} pairs. Tool interactions are folded
     * into assistant text.
     */
    public List<HistoryMessage> messages() {
        lock.lock();
        try {
            List<Message> flattened = Message.flattenToolMessages(new ArrayList<>(messages));
            List<HistoryMessage> result = new ArrayList<>();
            for (Message msg : flattened) {
                if (RESTORABLE_ROLES.contains(msg.getRole())) {
                    result.add(new HistoryMessage(msg.getRole(), msg.getContent() != null ? msg.getContent() : ""));
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the history with persisted messages. Unsupported roles are
     * dropped; token counters restart from the estimated size of the restored
     * history.
     */
    public void restoreMessages(List<HistoryMessage> persisted) {
        lock.lock();
        try {
            messages.clear();
            int dropped = 0;
            for (HistoryMessage item : persisted) {
                if (item == null || !RESTORABLE_ROLES.contains(item.role())) {
                    dropped++;
                    continue;
                }
                messages.add(Message.builder()
                        .role(item.role())
                        .content(item.content())
                        .timestamp(clock.instant())
                        .build());
            }
            if (dropped > 0) {
                log.warn("[Session] Dropped {} message(s) with unsupported roles on restore", dropped);
            }
            turns.clear();
            turns.addAll(turnConverter.fromMessages(messages));
            accountant.reset(TokenTracker.empty(), tokenEstimator.estimateMessages(messages));
            log.info("[Session] Restored {} messages, {} turns", messages.size(), turns.size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the history with persisted turns, such as those read back by
     * {@code TurnCodec}. Every turn is rendered into messages before anything
     * is replaced, so a turn whose results do not answer its calls leaves the
     * session untouched.
     *
     * @throws CompactionException
     *             if a turn's tool results do not pair with its tool calls
     */
    public void restoreTurns(List<ConversationTurn> persisted) {
        List<Message> rebuilt = new ArrayList<>();
        for (ConversationTurn turn : persisted) {
            rebuilt.addAll(turnConverter.toMessages(turn));
        }
        lock.lock();
        try {
            messages.clear();
            messages.addAll(rebuilt);
            turns.clear();
            turns.addAll(persisted);
            accountant.reset(TokenTracker.empty(), tokenEstimator.estimateMessages(messages));
            log.info("[Session] Restored {} turns, {} messages", turns.size(), messages.size());
        } finally {
            lock.unlock();
        }
    }

    public void clearHistory() {
        lock.lock();
        try {
            messages.clear();
            turns.clear();
            queuedInputs.clear();
            accountant.reset(TokenTracker.empty(), 0);
        } finally {
            lock.unlock();
        }
    }

    public List<ConversationTurn> turns() {
        lock.lock();
        try {
            return List.copyOf(turns);
        } finally {
            lock.unlock();
        }
    }
}
