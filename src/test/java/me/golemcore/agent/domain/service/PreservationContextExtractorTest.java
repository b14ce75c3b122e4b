package me.golemcore.agent.domain.service;

import me.golemcore.agent.domain.model.BuildStatus;
import me.golemcore.agent.domain.model.ConversationTurn;
import me.golemcore.agent.domain.model.PreservationContext;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.golemcore.agent.domain.service.TurnFixtures.call;
import static me.golemcore.agent.domain.service.TurnFixtures.failed;
import static me.golemcore.agent.domain.service.TurnFixtures.ok;
import static me.golemcore.agent.domain.service.TurnFixtures.simpleTurn;
import static me.golemcore.agent.domain.service.TurnFixtures.toolTurn;
import static org.junit.jupiter.api.Assertions.*;

class PreservationContextExtractorTest {

    private final PreservationContextExtractor extractor = new PreservationContextExtractor();

    @Test
    void collectsUniqueActiveFilesInOrder() {
        List<ConversationTurn> turns = List.of(
                simpleTurn("Start", "Ok."),
                toolTurn("Edit auth", List.of(call("Edit", "e1", "src/auth.rs")), List.of(ok("e1", "ok")), "Done.",
                        false),
                toolTurn("Write login", List.of(call("Write", "w1", "src/login.ts")), List.of(ok("w1", "ok")),
                        "Done.", false),
                toolTurn("Read config", List.of(call("Read", "r1", "config.json")), List.of(ok("r1", "{}")),
                        "Done.", false),
                toolTurn("Edit auth again", List.of(call("Edit", "e2", "src/auth.rs")), List.of(ok("e2", "ok")),
                        "Done.", false));

        PreservationContext context = extractor.extract(turns);

        assertEquals(List.of("auth.rs", "login.ts", "config.json"), context.activeFiles());
    }

    @Test
    void keepsThreeMostRecentGoalsInChronologicalOrder() {
        List<ConversationTurn> turns = List.of(
                simpleTurn("Please fix the auth bug. It breaks login.", "Ok."),
                simpleTurn("Help me implement OAuth", "Ok."),
                simpleTurn("Thanks", "Welcome."),
                simpleTurn("I want to add rate limiting", "Ok."),
                simpleTurn("I need to ship by Friday", "Ok."));

        PreservationContext context = extractor.extract(turns);

        assertEquals(List.of("Help me implement OAuth", "I want to add rate limiting", "I need to ship by Friday"),
                context.currentGoals());
    }

    @Test
    void goalIsCutAtFirstPeriodAndLimited() {
        String longGoal = "Please " + "x".repeat(150);

        PreservationContext context = extractor.extract(List.of(
                simpleTurn("Please fix the auth bug. Then deploy.", "Ok."),
                simpleTurn(longGoal, "Ok.")));

        assertEquals("Please fix the auth bug", context.currentGoals().get(0));
        assertEquals(100, context.currentGoals().get(1).length());
    }

    @Test
    void buildStatusIsLastWriterWins() {
        ConversationTurn passing = toolTurn("Run tests", List.of(call("Bash", "b1", null)),
                List.of(ok("b1", "running 15 tests\nAll 15 tests passed")), "Tests pass!", false);
        ConversationTurn failing = toolTurn("Run tests", List.of(call("Bash", "b2", null)),
                List.of(failed("b2", "running 10 tests\nFAILED: 3 tests failed")), "Tests failed.", false);

        assertEquals(BuildStatus.PASSING, extractor.extract(List.of(passing)).buildStatus());
        assertEquals(BuildStatus.FAILING, extractor.extract(List.of(passing, failing)).buildStatus());
        assertEquals(BuildStatus.PASSING, extractor.extract(List.of(failing, passing)).buildStatus());
        assertEquals(BuildStatus.UNKNOWN, extractor.extract(List.of(simpleTurn("hi", "hello"))).buildStatus());
    }

    @Test
    void recordsFirstLineOfFailedResults() {
        ConversationTurn turn = toolTurn("Build", List.of(call("Bash", "b1", null)),
                List.of(failed("b1", "error: cannot find module xyz\n  at line 3")), "Build failed.", false);

        PreservationContext context = extractor.extract(List.of(turn));

        assertEquals(List.of("error: cannot find module xyz"), context.errorStates());
    }

    @Test
    void lastIntentComesFromLatestTurn() {
        PreservationContext context = extractor.extract(List.of(
                simpleTurn("Start project", "Ok."),
                simpleTurn("Now deploy this to production " + "y".repeat(300), "Ok.")));

        assertTrue(context.lastUserIntent().startsWith("Now deploy this to production"));
        assertEquals(200, context.lastUserIntent().length());
    }

    @Test
    void emptyConversationUsesDefaults() {
        PreservationContext context = extractor.extract(List.of());

        assertTrue(context.activeFiles().isEmpty());
        assertTrue(context.currentGoals().isEmpty());
        assertEquals(BuildStatus.UNKNOWN, context.buildStatus());
        assertEquals("Continue conversation", context.lastUserIntent());
    }

    @Test
    void formatRendersContextBlock() {
        PreservationContext context = PreservationContext.builder()
                .activeFiles(List.of("auth.rs", "login.ts"))
                .currentGoals(List.of("Fix auth bug", "Add OAuth"))
                .buildStatus(BuildStatus.PASSING)
                .build();

        assertEquals("Active files: auth.rs, login.ts\nGoals: Fix auth bug; Add OAuth\nBuild: passing",
                context.format());
    }

    @Test
    void formatShowsNoneAndOptionalLines() {
        PreservationContext context = PreservationContext.builder()
                .errorStates(List.of("boom"))
                .lastUserIntent("Deploy")
                .build();

        assertEquals("Active files: none\nGoals: none\nBuild: unknown\nErrors: boom\nLast intent: Deploy",
                context.format());
    }
}
