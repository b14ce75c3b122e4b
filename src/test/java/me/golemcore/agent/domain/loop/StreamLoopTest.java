package me.golemcore.agent.domain.loop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.domain.model.BackendEvent;
import me.golemcore.agent.domain.model.BackendException;
import me.golemcore.agent.domain.model.CancellationReason;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.StreamChunk;
import me.golemcore.agent.domain.model.StreamOutcome;
import me.golemcore.agent.domain.model.ToolCallInfo;
import me.golemcore.agent.domain.model.ToolResultInfo;
import me.golemcore.agent.domain.model.TokenUsage;
import me.golemcore.agent.domain.service.TokenAccountant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class StreamLoopTest {

    private static final long THRESHOLD = 10_000;

    private AtomicBoolean interruptFlag;
    private TokenAccountant accountant;
    private CancelSignal cancelSignal;
    private List<StreamChunk> delivered;
    private HostWakeInterruptSource wakeSource;
    private MutableClock rateClock;
    private StreamLoop loop;

    @BeforeEach
    void setUp() {
        interruptFlag = new AtomicBoolean(false);
        accountant = new TokenAccountant();
        cancelSignal = new CancelSignal();
        delivered = new ArrayList<>();
        wakeSource = new HostWakeInterruptSource();
        rateClock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        loop = new StreamLoop(interruptFlag, wakeSource, accountant, new ObjectMapper(), 500,
                new TokenRateCalculator(rateClock));
    }

    private StreamResult run(Flux<BackendEvent> stream) {
        return run(stream, new CompactionHook(accountant, THRESHOLD, 0, cancelSignal));
    }

    private StreamResult run(Flux<BackendEvent> stream, CompactionHook hook) {
        BatchingChunkSink sink = new BatchingChunkSink(delivered::add, 1, 0, Clock.systemUTC());
        return loop.run(stream, hook, cancelSignal, sink, () -> List.of("queued"));
    }

    private static BackendEvent call(String id, String name, String input) {
        return BackendEvent.toolCall(ToolCallInfo.builder().id(id).name(name).input(input).build());
    }

    private static BackendEvent result(String id, String content) {
        return BackendEvent.toolResult(ToolResultInfo.builder().toolCallId(id).content(content).build());
    }

    private List<StreamChunk> chunksOf(StreamChunk.ChunkType type) {
        return delivered.stream().filter(chunk -> chunk.getType() == type).toList();
    }

    @Test
    void pairsToolCallsWithResults() {
        StreamResult streamResult = run(Flux.just(
                BackendEvent.callStart(0, TokenUsage.of(100, 0)),
                BackendEvent.text("Let me check."),
                call("c1", "Read", "{\"file_path\":\"a.txt\"}"),
                result("c1", "\"line1\\nline2\""),
                BackendEvent.text("Done."),
                BackendEvent.finalResponse(0, TokenUsage.of(100, 20))));

        assertEquals(StreamOutcome.COMPLETED, streamResult.outcome());
        List<Message> messages = streamResult.messages();
        assertEquals(4, messages.size());
        assertEquals("Let me check.", messages.get(0).getContent());
        assertEquals(Map.of("file_path", "a.txt"), messages.get(1).getToolCalls().get(0).getArguments());
        assertEquals("c1", messages.get(2).getToolCallId());
        assertEquals("Read", messages.get(2).getToolName());
        assertFalse(messages.get(2).isToolError());
        assertEquals("Done.", messages.get(3).getContent());

        ToolResultInfo preview = chunksOf(StreamChunk.ChunkType.TOOL_RESULT).get(0).getToolResult();
        assertEquals("line1\nline2", preview.content());
        assertEquals("Read", preview.toolName());
        assertEquals(120, accountant.snapshot().totalContext());
    }

    @Test
    void dropsResultWithoutMatchingCall() {
        StreamResult streamResult = run(Flux.just(
                BackendEvent.text("Hi"),
                result("ghost", "data"),
                BackendEvent.finalResponse(0, TokenUsage.of(10, 1))));

        assertEquals(1, streamResult.messages().size());
        assertTrue(chunksOf(StreamChunk.ChunkType.TOOL_RESULT).isEmpty());
    }

    @Test
    void prunesCallsThatNeverReceivedResult() {
        StreamResult streamResult = run(Flux.just(
                call("c1", "Read", "{}"),
                call("c2", "Read", "{}"),
                result("c1", "ok"),
                BackendEvent.finalResponse(0, TokenUsage.of(10, 1))));

        List<Message> messages = streamResult.messages();
        assertEquals(2, messages.size());
        assertEquals(1, messages.get(0).getToolCalls().size());
        assertEquals("c1", messages.get(0).getToolCalls().get(0).getId());
    }

    @Test
    void dropsUnansweredCallWithoutText() {
        StreamResult streamResult = run(Flux.just(
                BackendEvent.text("Working"),
                call("c1", "Bash", "{\"command\":\"ls\"}"),
                BackendEvent.finalResponse(0, TokenUsage.of(10, 1))));

        assertEquals(1, streamResult.messages().size());
        assertEquals("Working", streamResult.messages().get(0).getContent());
        assertEquals(1, chunksOf(StreamChunk.ChunkType.TOOL_CALL).size());
    }

    @Test
    void marksStructuredFailureAsToolError() {
        StreamResult streamResult = run(Flux.just(
                call("c1", "Bash", "{}"),
                result("c1", "{\"success\":false,\"error\":\"boom\"}"),
                BackendEvent.finalResponse(0, TokenUsage.of(10, 1))));

        assertTrue(streamResult.messages().get(1).isToolError());
        assertTrue(chunksOf(StreamChunk.ChunkType.TOOL_RESULT).get(0).getToolResult().error());
    }

    @Test
    void detectsToolErrorsOnlyInStructuredOutput() {
        assertTrue(loop.detectToolError("{\"success\": false}"));
        assertTrue(loop.detectToolError("{\"error\": \"not found\"}"));
        assertFalse(loop.detectToolError("{\"error\": \"\"}"));
        assertFalse(loop.detectToolError("{\"error\": null, \"success\": true}"));
        assertFalse(loop.detectToolError("error: plain text is not structured"));
        assertFalse(loop.detectToolError("{broken"));
    }

    @Test
    void previewIsTruncated() {
        String preview = loop.preview("x".repeat(600));

        assertEquals(500, preview.length());
        assertTrue(preview.endsWith("..."));
        assertEquals("short", loop.preview("short"));
    }

    @Test
    void reportsBackendFailure() {
        StreamResult streamResult = run(Flux.concat(
                Flux.just(BackendEvent.text("partial")),
                Flux.<BackendEvent>error(new BackendException("connection reset"))));

        assertEquals(StreamOutcome.ERRORED, streamResult.outcome());
        assertEquals("connection reset", streamResult.errorMessage());
        assertTrue(streamResult.messages().isEmpty());
    }

    @Test
    void completesWhenStreamEndsWithoutFinalResponse() {
        StreamResult streamResult = run(Flux.just(BackendEvent.text("Hello")));

        assertEquals(StreamOutcome.COMPLETED, streamResult.outcome());
        assertEquals("Hello", streamResult.messages().get(0).getContent());
    }

    @Test
    void interruptFlagStopsBeforeNextChunk() {
        interruptFlag.set(true);

        StreamResult streamResult = run(Flux.just(BackendEvent.text("never")));

        assertEquals(StreamOutcome.INTERRUPTED, streamResult.outcome());
        assertTrue(streamResult.messages().isEmpty());
        assertEquals(1, delivered.size());
        assertEquals(List.of("queued"), delivered.get(0).getQueuedInputs());
    }

    @Test
    void userCancelIsReportedAsInterrupt() {
        cancelSignal.cancel(CancellationReason.USER_INTERRUPT);

        StreamResult streamResult = run(Flux.just(BackendEvent.text("never")));

        assertEquals(StreamOutcome.INTERRUPTED, streamResult.outcome());
        assertEquals(StreamChunk.ChunkType.INTERRUPTED, delivered.get(delivered.size() - 1).getType());
    }

    @Test
    void compactionCancelEndsStreamWithoutOutput() {
        CompactionHook hook = new CompactionHook(accountant, 100, 0, cancelSignal);

        StreamResult streamResult = run(Flux.just(
                BackendEvent.callStart(0, TokenUsage.of(500, 0)),
                BackendEvent.text("never"),
                BackendEvent.finalResponse(0, TokenUsage.of(500, 10))), hook);

        assertEquals(StreamOutcome.COMPACTION_TRIGGERED, streamResult.outcome());
        assertTrue(streamResult.messages().isEmpty());
        assertTrue(chunksOf(StreamChunk.ChunkType.TEXT).isEmpty());
    }

    @Test
    void longToolResultPreviewStaysWithinLimit() {
        StreamResult streamResult = run(Flux.just(
                call("c1", "Bash", "{}"),
                result("c1", "y".repeat(900)),
                BackendEvent.finalResponse(0, TokenUsage.of(10, 1))));

        String preview = chunksOf(StreamChunk.ChunkType.TOOL_RESULT).get(0).getToolResult().content();
        assertEquals(500, preview.length());
        assertTrue(preview.endsWith("..."));
        assertEquals(900, streamResult.messages().get(1).getContent().length());
    }

    @Test
    void compactionCancelWithoutHookFlagIsAnError() {
        cancelSignal.cancel(CancellationReason.COMPACTION);

        StreamResult streamResult = run(Flux.never());

        assertEquals(StreamOutcome.ERRORED, streamResult.outcome());
        assertEquals("Stream cancelled: COMPACTION", streamResult.errorMessage());
        assertTrue(chunksOf(StreamChunk.ChunkType.INTERRUPTED).isEmpty());
    }

    @Test
    void hostWakeUnblocksSilentStream() {
        Thread waker = new Thread(() -> {
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            interruptFlag.set(true);
            wakeSource.wake();
        });
        waker.start();

        StreamResult streamResult = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> run(Flux.never()));

        assertEquals(StreamOutcome.INTERRUPTED, streamResult.outcome());
        assertEquals(List.of("queued"), delivered.get(delivered.size() - 1).getQueuedInputs());
    }

    @Test
    void reportsOutputRateOnTokenUpdates() {
        rateClock.stepOnRead(100);

        run(Flux.just(
                BackendEvent.streamDelta(0, TokenUsage.of(50, 10)),
                BackendEvent.streamDelta(0, TokenUsage.of(50, 20)),
                BackendEvent.streamDelta(1, TokenUsage.of(80, 5)),
                BackendEvent.finalResponse(1, TokenUsage.of(80, 5))));

        List<StreamChunk> updates = chunksOf(StreamChunk.ChunkType.TOKEN_UPDATE);
        assertEquals(4, updates.size());
        assertNull(updates.get(0).getTokensPerSecond());
        assertEquals(100.0, updates.get(1).getTokensPerSecond(), 0.001);
        // the second call restarts its output count, so its 5 tokens are recorded
        assertEquals(87.5, updates.get(2).getTokensPerSecond(), 0.001);
        assertEquals(87.5, updates.get(3).getTokensPerSecond(), 0.001);
    }
}
