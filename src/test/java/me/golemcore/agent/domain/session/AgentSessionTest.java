package me.golemcore.agent.domain.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.agent.adapter.outbound.backend.BackendRegistry;
import me.golemcore.agent.domain.loop.HostWakeInterruptSource;
import me.golemcore.agent.domain.model.BackendEvent;
import me.golemcore.agent.domain.model.CompactionException;
import me.golemcore.agent.domain.model.CompactionSummary;
import me.golemcore.agent.domain.model.ConversationTurn;
import me.golemcore.agent.domain.model.HistoryMessage;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.StreamChunk;
import me.golemcore.agent.domain.model.StreamOutcome;
import me.golemcore.agent.domain.model.TokenTracker;
import me.golemcore.agent.domain.model.TokenUsage;
import me.golemcore.agent.domain.model.TurnToolCall;
import me.golemcore.agent.domain.model.TurnToolResult;
import me.golemcore.agent.domain.service.AnchorDetector;
import me.golemcore.agent.domain.service.CompactionOrchestrationService;
import me.golemcore.agent.domain.service.ContextCompactor;
import me.golemcore.agent.domain.service.PreservationContextExtractor;
import me.golemcore.agent.domain.service.TokenEstimator;
import me.golemcore.agent.domain.service.TurnCodec;
import me.golemcore.agent.domain.service.TurnConverter;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AgentSessionTest {

    private static final int LARGE_WINDOW = 200_000;
    private static final int SMALL_WINDOW = 1_000;

    private AgentProperties properties;
    private BackendRegistry backendRegistry;
    private TokenEstimator tokenEstimator;
    private TurnConverter turnConverter;
    private CompactionOrchestrationService compactionService;
    private Clock clock;
    private List<StreamChunk> chunks;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        properties.getStream().setTextBatchChars(1);
        backendRegistry = mock(BackendRegistry.class);
        tokenEstimator = new TokenEstimator(properties);
        turnConverter = new TurnConverter(tokenEstimator);
        clock = Clock.fixed(Instant.parse("2026-01-01T12:00:00Z"), ZoneOffset.UTC);
        ContextCompactor compactor = new ContextCompactor(new AnchorDetector(properties),
                new PreservationContextExtractor(), properties);
        compactionService = new CompactionOrchestrationService(compactor, turnConverter, tokenEstimator, properties,
                clock);
        chunks = new ArrayList<>();
    }

    private AgentSession sessionOn(ScriptedBackend backend) {
        return new AgentSession(backend, backendRegistry, compactionService, turnConverter, tokenEstimator,
                new HostWakeInterruptSource(), properties, new ObjectMapper(), clock);
    }

    private List<StreamChunk.ChunkType> visibleTypes() {
        return chunks.stream()
                .map(StreamChunk::getType)
                .filter(type -> type != StreamChunk.ChunkType.TOKEN_UPDATE)
                .toList();
    }

    private List<String> statusTexts() {
        return chunks.stream()
                .filter(chunk -> chunk.getType() == StreamChunk.ChunkType.STATUS)
                .map(StreamChunk::getText)
                .toList();
    }

    private StreamChunk lastChunk() {
        return chunks.get(chunks.size() - 1);
    }

    private static List<HistoryMessage> conversation(int turns) {
        List<HistoryMessage> history = new ArrayList<>();
        for (int i = 0; i < turns; i++) {
            history.add(new HistoryMessage(Message.ROLE_USER, "Question number " + i));
            history.add(new HistoryMessage(Message.ROLE_ASSISTANT, "Answer number " + i + " with some detail."));
        }
        return history;
    }

    @Test
    void completesPromptAndCommitsTurn() {
        ScriptedBackend backend = new ScriptedBackend("scripted", LARGE_WINDOW).script(
                BackendEvent.callStart(0, TokenUsage.of(50, 0)),
                BackendEvent.text("Hello"),
                BackendEvent.text(" there."),
                BackendEvent.finalResponse(0, TokenUsage.of(50, 5)));
        AgentSession session = sessionOn(backend);

        StreamOutcome outcome = session.prompt("Hi", chunks::add);

        assertEquals(StreamOutcome.COMPLETED, outcome);
        assertEquals(List.of(StreamChunk.ChunkType.TEXT, StreamChunk.ChunkType.TEXT, StreamChunk.ChunkType.DONE),
                visibleTypes());
        assertEquals(1, session.turns().size());
        assertEquals("Hello there.", session.turns().get(0).assistantResponse());
        assertEquals(List.of(new HistoryMessage("user", "Hi"), new HistoryMessage("assistant", "Hello there.")),
                session.messages());
        assertEquals(55, session.tokenTracker().totalContext());
        assertFalse(session.isStreaming());
    }

    @Test
    void accumulatesUsageAcrossCallsOfATurn() {
        ScriptedBackend backend = new ScriptedBackend("scripted", LARGE_WINDOW)
                .script(BackendEvent.callStart(0, TokenUsage.of(1000, 0)),
                        BackendEvent.text("First."),
                        BackendEvent.finalResponse(0, TokenUsage.of(1000, 200)))
                .script(BackendEvent.callStart(0, TokenUsage.of(500, 0)),
                        BackendEvent.streamDelta(0, TokenUsage.of(500, 50)),
                        BackendEvent.text("Second."),
                        BackendEvent.finalResponse(1, TokenUsage.of(520, 80)));
        AgentSession session = sessionOn(backend);
        session.prompt("one", chunks::add);
        assertEquals(1200, session.tokenTracker().totalContext());

        session.prompt("two", chunks::add);

        assertEquals(1200 + 550 + 600, session.tokenTracker().totalContext());
        TokenTracker lastUpdate = chunks.stream()
                .filter(chunk -> chunk.getType() == StreamChunk.ChunkType.TOKEN_UPDATE)
                .reduce((first, second) -> second)
                .orElseThrow()
                .getTokens();
        assertEquals(2350, lastUpdate.totalContext());
    }

    @Test
    void interruptKeepsPartialOutput() {
        ScriptedBackend backend = new ScriptedBackend("scripted", LARGE_WINDOW).script(
                BackendEvent.callStart(0, TokenUsage.of(10, 0)),
                BackendEvent.text("Hello "),
                BackendEvent.text("world"),
                BackendEvent.text("!"),
                BackendEvent.finalResponse(0, TokenUsage.of(10, 5)));
        AgentSession session = sessionOn(backend);
        session.enqueueInput("follow-up");

        StreamOutcome outcome = session.prompt("Say hello", chunk -> {
            chunks.add(chunk);
            if (chunk.getType() == StreamChunk.ChunkType.TEXT) {
                session.interrupt();
            }
        });

        assertEquals(StreamOutcome.INTERRUPTED, outcome);
        assertEquals(List.of(StreamChunk.ChunkType.TEXT, StreamChunk.ChunkType.INTERRUPTED,
                StreamChunk.ChunkType.DONE), visibleTypes());
        StreamChunk interrupted = chunks.stream()
                .filter(chunk -> chunk.getType() == StreamChunk.ChunkType.INTERRUPTED)
                .findFirst()
                .orElseThrow();
        assertEquals(List.of("follow-up"), interrupted.getQueuedInputs());
        assertEquals(1, session.turns().size());
        assertEquals("Hello ", session.turns().get(0).assistantResponse());
        assertEquals(new HistoryMessage("assistant", "Hello "), session.messages().get(1));

        assertTrue(session.isInterrupted());
        session.resetInterrupt();
        assertFalse(session.isInterrupted());
    }

    @Test
    void compactsAndRetriesOnceWhenThresholdIsReached() {
        ScriptedBackend backend = new ScriptedBackend("scripted", SMALL_WINDOW)
                .script(BackendEvent.callStart(0, TokenUsage.of(950, 0)),
                        BackendEvent.text("too big"),
                        BackendEvent.finalResponse(0, TokenUsage.of(950, 5)))
                .script(BackendEvent.callStart(0, TokenUsage.of(100, 0)),
                        BackendEvent.text("Fresh answer."),
                        BackendEvent.finalResponse(0, TokenUsage.of(100, 10)));
        AgentSession session = sessionOn(backend);
        session.restoreMessages(conversation(5));

        StreamOutcome outcome = session.prompt("Next question", chunks::add);

        assertEquals(StreamOutcome.COMPLETED, outcome);
        assertEquals(2, backend.getRequests().size());
        assertEquals("Context window threshold reached (900 tokens), compacting conversation...",
                statusTexts().get(0));
        assertTrue(statusTexts().stream().anyMatch(text -> text.startsWith("Context compacted: ")));
        assertTrue(chunks.stream().noneMatch(chunk -> "too big".equals(chunk.getText())));
        assertEquals(StreamChunk.ChunkType.DONE, lastChunk().getType());

        List<Message> retried = backend.getRequests().get(1);
        assertTrue(retried.get(0).isSystemMessage());
        assertTrue(retried.get(0).getContent().contains("continued from a previous conversation"));
        assertEquals("Next question", retried.get(retried.size() - 1).getContent());

        List<HistoryMessage> history = session.messages();
        assertEquals("system", history.get(0).role());
        assertEquals(new HistoryMessage("assistant", "Fresh answer."), history.get(history.size() - 1));
        assertEquals(4, session.turns().size());
    }

    @Test
    void failsWhenThresholdIsReachedAgainAfterCompaction() {
        ScriptedBackend backend = new ScriptedBackend("scripted", SMALL_WINDOW)
                .script(BackendEvent.callStart(0, TokenUsage.of(950, 0)))
                .script(BackendEvent.callStart(0, TokenUsage.of(950, 0)))
                .script(BackendEvent.callStart(0, TokenUsage.of(10, 0)));
        AgentSession session = sessionOn(backend);
        session.restoreMessages(conversation(5));

        StreamOutcome outcome = session.prompt("Next question", chunks::add);

        assertEquals(StreamOutcome.ERRORED, outcome);
        assertEquals(2, backend.getRequests().size());
        assertEquals(StreamChunk.ChunkType.ERROR, lastChunk().getType());
        assertEquals("Context window threshold exceeded again after compaction (900 tokens)",
                lastChunk().getText());
    }

    @Test
    void reportsCompactionFailureAndKeepsPrompt() {
        ScriptedBackend backend = new ScriptedBackend("scripted", SMALL_WINDOW)
                .script(BackendEvent.callStart(0, TokenUsage.of(950, 0)));
        AgentSession session = sessionOn(backend);

        StreamOutcome outcome = session.prompt("Huge prompt", chunks::add);

        assertEquals(StreamOutcome.ERRORED, outcome);
        assertEquals("Compaction failed: nothing to compact", lastChunk().getText());
        assertEquals(List.of(new HistoryMessage("user", "Huge prompt")), session.messages());
        assertEquals(TokenTracker.empty(), session.tokenTracker());
    }

    @Test
    void reportsBackendFailure() {
        AgentSession session = sessionOn(new ScriptedBackend("scripted", LARGE_WINDOW));

        StreamOutcome outcome = session.prompt("Hi", chunks::add);

        assertEquals(StreamOutcome.ERRORED, outcome);
        assertEquals(StreamChunk.ChunkType.ERROR, lastChunk().getType());
        assertEquals("No script left", lastChunk().getText());
        assertTrue(session.turns().isEmpty());
    }

    @Test
    void rejectsBlankPrompt() {
        AgentSession session = sessionOn(new ScriptedBackend("scripted", LARGE_WINDOW));

        assertThrows(IllegalArgumentException.class, () -> session.prompt("  ", chunks::add));
    }

    @Test
    void restoresSupportedRolesOnly() {
        AgentSession session = sessionOn(new ScriptedBackend("scripted", LARGE_WINDOW));

        session.restoreMessages(List.of(
                new HistoryMessage("system", "Earlier summary"),
                new HistoryMessage("user", "Hi"),
                new HistoryMessage("assistant", "Hello."),
                new HistoryMessage("tool", "raw output"),
                new HistoryMessage("user", "Bye"),
                new HistoryMessage("assistant", "Goodbye.")));

        assertEquals(List.of(
                new HistoryMessage("system", "Earlier summary"),
                new HistoryMessage("user", "Hi"),
                new HistoryMessage("assistant", "Hello."),
                new HistoryMessage("user", "Bye"),
                new HistoryMessage("assistant", "Goodbye.")), session.messages());
        assertEquals(2, session.turns().size());
        assertEquals(TokenTracker.empty(), session.tokenTracker());
    }

    @Test
    void manualCompactionReplacesHistory() {
        AgentSession session = sessionOn(new ScriptedBackend("scripted", LARGE_WINDOW));
        session.restoreMessages(conversation(6));

        CompactionSummary summary = session.compact();

        assertEquals(3, summary.turnsSummarized());
        assertEquals(3, summary.turnsKept());
        assertEquals("system", session.messages().get(0).role());
        assertEquals(3, session.turns().size());
        assertEquals(summary.compactedTokens(), session.tokenTracker().inputTokens());
    }

    @Test
    void manualCompactionOfEmptyHistoryFails() {
        AgentSession session = sessionOn(new ScriptedBackend("scripted", LARGE_WINDOW));

        CompactionException exception = assertThrows(CompactionException.class, session::compact);
        assertEquals("nothing to compact", exception.getMessage());
    }

    @Test
    void switchesBackendBetweenPrompts() {
        ScriptedBackend other = new ScriptedBackend("other", LARGE_WINDOW);
        when(backendRegistry.getBackend("other")).thenReturn(other);
        when(backendRegistry.getBackend("missing")).thenThrow(new IllegalArgumentException("Unknown backend: missing"));
        AgentSession session = sessionOn(new ScriptedBackend("scripted", LARGE_WINDOW));

        assertThrows(IllegalArgumentException.class, () -> session.switchBackend("missing"));
        assertEquals("scripted", session.currentBackendName());

        session.switchBackend("other");

        assertEquals("other", session.currentBackendName());
    }

    @Test
    void rejectsBackendSwitchWhileStreaming() {
        ScriptedBackend backend = new ScriptedBackend("scripted", LARGE_WINDOW).script(
                BackendEvent.text("Hi"),
                BackendEvent.finalResponse(0, TokenUsage.of(5, 1)));
        AgentSession session = sessionOn(backend);
        AtomicReference<RuntimeException> rejected = new AtomicReference<>();

        session.prompt("Hello", chunk -> {
            if (chunk.getType() == StreamChunk.ChunkType.TEXT) {
                assertTrue(session.isStreaming());
                try {
                    session.switchBackend("other");
                } catch (IllegalStateException e) {
                    rejected.set(e);
                }
            }
        });

        assertInstanceOf(IllegalStateException.class, rejected.get());
        assertEquals("scripted", session.currentBackendName());
        verify(backendRegistry, never()).getBackend("other");
    }

    @Test
    void clearHistoryResetsState() {
        AgentSession session = sessionOn(new ScriptedBackend("scripted", LARGE_WINDOW));
        session.restoreMessages(conversation(2));
        session.enqueueInput("later");

        session.clearHistory();

        assertTrue(session.messages().isEmpty());
        assertTrue(session.turns().isEmpty());
        assertTrue(session.drainQueuedInputs().isEmpty());
    }

    @Test
    void streamsChunksReactively() {
        ScriptedBackend backend = new ScriptedBackend("scripted", LARGE_WINDOW).script(
                BackendEvent.text("Hi"),
                BackendEvent.finalResponse(0, TokenUsage.of(5, 1)));
        AgentSession session = sessionOn(backend);

        StepVerifier.create(session.promptStream("Hello")
                .map(StreamChunk::getType)
                .filter(type -> type != StreamChunk.ChunkType.TOKEN_UPDATE))
                .expectNext(StreamChunk.ChunkType.TEXT, StreamChunk.ChunkType.DONE)
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void restoresTurnsDecodedFromJson() {
        TurnCodec codec = new TurnCodec(new ObjectMapper().registerModule(new JavaTimeModule()));
        ConversationTurn turn = readTurn("c1", "c1");
        AgentSession session = sessionOn(new ScriptedBackend("scripted", LARGE_WINDOW));

        session.restoreTurns(codec.decode(codec.encode(List.of(turn))));

        assertEquals(1, session.turns().size());
        assertEquals("It says data.", session.turns().get(0).assistantResponse());
        List<HistoryMessage> history = session.messages();
        assertEquals(3, history.size());
        assertEquals(new HistoryMessage("user", "Read a.txt"), history.get(0));
        assertTrue(history.get(1).content().contains("[Tool: Read"));
        assertTrue(history.get(1).content().contains("[Result: data]"));
        assertEquals(new HistoryMessage("assistant", "It says data."), history.get(2));
    }

    @Test
    void rejectsTurnsWhoseResultsDoNotPairWithCalls() {
        AgentSession session = sessionOn(new ScriptedBackend("scripted", LARGE_WINDOW));
        session.restoreMessages(conversation(2));

        CompactionException exception = assertThrows(CompactionException.class,
                () -> session.restoreTurns(List.of(readTurn("c1", "c9"))));

        assertEquals("Orphaned tool result without matching call: c9", exception.getMessage());
        assertEquals(4, session.messages().size());
        assertEquals(2, session.turns().size());
    }

    private static ConversationTurn readTurn(String callId, String resultId) {
        return ConversationTurn.builder()
                .userMessage("Read a.txt")
                .toolCalls(List.of(TurnToolCall.builder()
                        .tool("Read")
                        .id(callId)
                        .parameters(Map.of("file_path", "a.txt"))
                        .build()))
                .toolResults(List.of(TurnToolResult.builder()
                        .toolCallId(resultId)
                        .success(true)
                        .output("data")
                        .build()))
                .assistantResponse("It says data.")
                .tokens(40)
                .timestamp(Instant.parse("2026-01-01T11:00:00Z"))
                .build();
    }
}
