package me.golemcore.agent.domain.service;

import me.golemcore.agent.domain.model.CompactionException;
import me.golemcore.agent.domain.model.ConversationTurn;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.TurnToolCall;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static me.golemcore.agent.domain.service.TurnFixtures.NOW;
import static me.golemcore.agent.domain.service.TurnFixtures.ok;
import static me.golemcore.agent.domain.service.TurnFixtures.toolTurn;
import static org.junit.jupiter.api.Assertions.*;

class TurnConverterTest {

    private TurnConverter converter;

    @BeforeEach
    void setUp() {
        converter = new TurnConverter(new TokenEstimator(new AgentProperties()));
    }

    private static Message user(String content) {
        return Message.builder().role(Message.ROLE_USER).content(content).timestamp(NOW).build();
    }

    private static Message assistant(String content) {
        return Message.builder().role(Message.ROLE_ASSISTANT).content(content).timestamp(NOW).build();
    }

    private static Message callMessage(String id, String tool) {
        return Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content("")
                .toolCalls(List.of(Message.ToolCall.builder()
                        .id(id)
                        .name(tool)
                        .arguments(Map.of("file_path", "src/app.ts"))
                        .build()))
                .timestamp(NOW)
                .build();
    }

    private static Message toolMessage(String id, String content, boolean error) {
        return Message.builder()
                .role(Message.ROLE_TOOL)
                .toolCallId(id)
                .toolName("Read")
                .content(content)
                .toolError(error)
                .timestamp(NOW)
                .build();
    }

    @Test
    void buildsTurnFromExchange() {
        ConversationTurn turn = converter.toTurn(List.of(
                user("Show me the app"),
                assistant("Let me look."),
                callMessage("c1", "Read"),
                toolMessage("c1", "console.log('hi')", false),
                assistant("It logs a greeting.")), false);

        assertEquals("Show me the app", turn.userMessage());
        assertEquals("Let me look.\n\nIt logs a greeting.", turn.assistantResponse());
        assertEquals(1, turn.toolCalls().size());
        assertEquals("src/app.ts", turn.toolCalls().get(0).stringParameter("file_path"));
        assertTrue(turn.toolResults().get(0).success());
        assertEquals(NOW, turn.timestamp());
        assertTrue(turn.tokens() > 0);
    }

    @Test
    void failedToolMessageBecomesFailedResult() {
        ConversationTurn turn = converter.toTurn(List.of(
                user("Read it"),
                callMessage("c1", "Read"),
                toolMessage("c1", "file not found\nstack", true)), false);

        assertFalse(turn.toolResults().get(0).success());
        assertEquals("file not found", turn.toolResults().get(0).error());
        assertTrue(turn.hasFailedResult());
    }

    @Test
    void rejectsOrphanedToolResult() {
        List<Message> exchange = List.of(user("Read it"), toolMessage("missing", "data", false));

        CompactionException exception = assertThrows(CompactionException.class,
                () -> converter.toTurn(exchange, false));
        assertTrue(exception.getMessage().contains("missing"));
    }

    @Test
    void rejectsUnansweredToolCall() {
        List<Message> exchange = List.of(user("Read it"), callMessage("c1", "Read"), assistant("Done."));

        assertThrows(CompactionException.class, () -> converter.toTurn(exchange, false));
    }

    @Test
    void rejectsExchangeWithoutUserMessage() {
        assertThrows(CompactionException.class, () -> converter.toTurn(List.of(assistant("Hi")), false));
    }

    @Test
    void splitsHistoryIntoTurns() {
        List<Message> history = List.of(
                Message.builder().role(Message.ROLE_SYSTEM).content("summary").timestamp(NOW).build(),
                user("first"),
                assistant("First answer."),
                user("second"),
                callMessage("c1", "Read"),
                toolMessage("c1", "boom", true),
                assistant("That failed."),
                user("third"),
                assistant("Third answer."),
                user("pending"));

        List<ConversationTurn> turns = converter.fromMessages(history);

        assertEquals(3, turns.size());
        assertEquals("first", turns.get(0).userMessage());
        assertFalse(turns.get(1).previousError());
        assertTrue(turns.get(2).previousError());
    }

    @Test
    void rendersTurnWithCallsBesideResults() {
        ConversationTurn turn = toolTurn("Check",
                List.of(TurnToolCall.builder().tool("Read").parameters(Map.of("path", "a.txt")).build()),
                List.of(ok(null, "contents")),
                "Checked.", false);

        List<Message> messages = converter.toMessages(turn);

        assertEquals(4, messages.size());
        assertTrue(messages.get(0).isUserMessage());
        assertEquals("call_0", messages.get(1).getToolCalls().get(0).getId());
        assertEquals("call_0", messages.get(2).getToolCallId());
        assertEquals("Read", messages.get(2).getToolName());
        assertEquals("Checked.", messages.get(3).getContent());
    }

    @Test
    void renderedTurnConvertsBack() {
        ConversationTurn turn = TurnFixtures.codingTurnWithPassingTests(false);

        ConversationTurn restored = converter.toTurn(converter.toMessages(turn), false);

        assertEquals(turn.userMessage(), restored.userMessage());
        assertEquals(turn.toolCalls(), restored.toolCalls());
        assertEquals(turn.toolResults().size(), restored.toolResults().size());
        assertEquals(turn.assistantResponse(), restored.assistantResponse());
    }

    @Test
    void renderingRejectsResultCountThatDiffersFromCalls() {
        ConversationTurn turn = toolTurn("Check",
                List.of(TurnToolCall.builder().tool("Read").build(), TurnToolCall.builder().tool("Grep").build()),
                List.of(ok(null, "contents")),
                "Checked.", false);

        CompactionException exception = assertThrows(CompactionException.class, () -> converter.toMessages(turn));
        assertEquals("Turn has 2 tool call(s) but 1 result(s)", exception.getMessage());
    }

    @Test
    void renderingRejectsCallAnsweredTwice() {
        ConversationTurn turn = toolTurn("Check",
                List.of(TurnToolCall.builder().tool("Read").id("r1").build(),
                        TurnToolCall.builder().tool("Read").id("r2").build()),
                List.of(ok("r1", "first"), ok("r1", "again")),
                "Checked.", false);

        CompactionException exception = assertThrows(CompactionException.class, () -> converter.toMessages(turn));
        assertEquals("Tool call answered more than once: r1", exception.getMessage());
    }
}
