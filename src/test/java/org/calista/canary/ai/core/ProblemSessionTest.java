package org.calista.canary.ai.core;

import org.calista.canary.ai.cognitive.StrategyDecision;
import org.calista.canary.ai.cognitive.ToolCandidate;
import org.calista.canary.ai.events.SessionEvent;
import org.calista.canary.ai.provenance.AnswerTemplates;
import org.calista.canary.ai.provenance.DegradationLevel;
import org.calista.canary.ai.provenance.GroundedAnswer;
import org.calista.canary.ai.provenance.Observation;
import org.calista.canary.ai.tool.ExecutionOutcome;
import org.calista.canary.ai.tool.ToolResult;
import org.calista.canary.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ProblemSessionTest {

    @TempDir
    Path dir;

    private MutableClock clock;
    private CanaryKernel kernel;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock();
        kernel = CanaryKernel.builder()
                .configRoot(dir)
                .clock(clock)
                .build(Path.of("canary.json"));
    }

    @AfterEach
    void tearDown() {
        kernel.close();
    }

    @Test
    void kernelCreatesConfigAndDataDir() {
        assertTrue(Files.exists(dir.resolve("canary.json")));
        assertTrue(Files.isDirectory(dir.resolve("data")));
        assertNotNull(kernel.eventStore());
    }

    @Test
    void groundedLoopEndsWithFullAnswer() throws Exception {
        try (ProblemSession s = kernel.openSession("population of Lyon")) {
            s.beginIteration();
            assertEquals(StrategyDecision.CONTINUE, s.evaluate().decision);

            Observation o = s.recordToolOutcome("web_search", ExecutionOutcome.plain("Lyon: 522,250 inhabitants (2021)"));
            s.state().markProgress();
            s.state().updateConfidence(0.9);
            assertEquals(StrategyDecision.CONCLUDE, s.evaluate().decision);

            GroundedAnswer a = s.answer("According to the search results [" + o.id + "], Lyon has about 522,000 inhabitants.");
            assertEquals(DegradationLevel.FULL_ANSWER, a.degradationLevel);
            assertTrue(a.content.startsWith("According to the search results"));
            assertEquals(1, a.highConfidenceParts.size());
            assertEquals(1, s.registry().claimCount());

            List<String> types = kernel.eventStore().readAll(s.id()).stream()
                    .map(e -> e.type)
                    .collect(Collectors.toList());
            assertEquals(List.of(SessionEvent.STRATEGY, SessionEvent.OBSERVATION, SessionEvent.STRATEGY, SessionEvent.ANSWER), types);
        }
        assertEquals(0, kernel.openSessionCount());
    }

    @Test
    void staleEvidenceIsRefused() throws Exception {
        try (ProblemSession s = kernel.openSession("weather now")) {
            s.recordToolOutcome("web_search", ExecutionOutcome.plain("sunny, 21C"));
            clock.advance(Duration.ofSeconds(3601));

            assertEquals(StrategyDecision.REQUEST_MORE_INFO, s.evaluate().decision);

            GroundedAnswer a = s.answer("It is sunny and 21C.");
            assertEquals(DegradationLevel.REFUSE, a.degradationLevel);
            assertEquals(AnswerTemplates.english().refusal, a.content);
        }
    }

    @Test
    void refusalNeverEchoesTheRawAnswer() throws Exception {
        try (ProblemSession s = kernel.openSession("geography")) {
            GroundedAnswer a = s.answer("The capital of Atlantis is Poseidonia with five million residents.");

            assertEquals(DegradationLevel.REFUSE, a.degradationLevel);
            assertEquals(1, a.claims.size());
            String out = a.toFormattedOutput();
            assertTrue(out.contains(AnswerTemplates.english().refusal));
            assertFalse(out.contains("Poseidonia"));
        }
    }

    @Test
    void failedToolLeavesLedgerUngrounded() throws Exception {
        try (ProblemSession s = kernel.openSession("read the page")) {
            s.recordToolOutcome("read_url", ExecutionOutcome.withProvenance(
                    ToolResult.fromError("404 not found", "read_url", clock.instant())));

            assertEquals(1, s.registry().observationCount());
            GroundedAnswer a = s.answer("The page says hello.");
            assertEquals(DegradationLevel.REQUEST_MORE_INFO, a.degradationLevel);
        }
    }

    @Test
    void sessionsDoNotShareLedgers() throws Exception {
        try (ProblemSession a = kernel.openSession("a"); ProblemSession b = kernel.openSession("b")) {
            assertEquals(2, kernel.openSessionCount());
            a.recordUserInput("use metric units");
            assertEquals(1, a.registry().observationCount());
            assertEquals(0, b.registry().observationCount());
            assertNotEquals(a.id(), b.id());
        }
    }

    @Test
    void admissibleToolsFollowConfidence() throws Exception {
        try (ProblemSession s = kernel.openSession("g")) {
            List<String> low = names(s.admissibleTools());
            assertEquals(List.of("web_search", "read_url", "Read", "Glob", "ask_user"), low);

            s.state().updateConfidence(0.6);
            List<String> higher = names(s.admissibleTools());
            assertEquals(List.of("web_search", "read_url", "Read", "Glob", "ask_user", "python_exec", "Bash"), higher);
        }
    }

    @Test
    void promptContextCombinesLedgerAndHints() throws Exception {
        try (ProblemSession s = kernel.openSession("g")) {
            s.beginIteration();
            assertTrue(s.promptContext().startsWith("[no valid observations]"));
            assertTrue(s.promptContext().contains("no observations gathered yet"));

            s.recordToolOutcome("Read", ExecutionOutcome.plain("file contents"));
            assertTrue(s.promptContext().startsWith("[current observations]"));
            assertTrue(s.provenanceSummary().contains("(Read)") || s.provenanceSummary().contains("] Read ("));
        }
    }

    @Test
    void closedSessionRejectsWork() throws Exception {
        ProblemSession s = kernel.openSession("g");
        s.recordUserInput("x");
        s.close();
        s.close();

        assertTrue(s.isClosed());
        assertEquals(0, s.registry().observationCount());
        assertThrows(IllegalStateException.class, s::evaluate);
        assertThrows(IllegalStateException.class, () -> s.answer("x"));
    }

    @Test
    void closedKernelRefusesSessions() {
        kernel.close();
        assertTrue(kernel.isClosed());
        assertThrows(IllegalStateException.class, () -> kernel.openSession("g"));
    }

    @Test
    void snapshotOnCloseExportsLedger() throws Exception {
        Path root = dir.resolve("snap");
        Files.createDirectories(root);
        Files.writeString(root.resolve("canary.json"),
                "{\"sessions\": {\"snapshotOnClose\": true, \"eventLogEnabled\": false}}", StandardCharsets.UTF_8);

        try (CanaryKernel k = CanaryKernel.builder().configRoot(root).clock(clock).build(Path.of("canary.json"))) {
            assertNull(k.eventStore());

            String id;
            try (ProblemSession s = k.openSession("g")) {
                id = s.id();
                s.recordToolOutcome("web_search", ExecutionOutcome.plain("result"));
            }

            Path snapshot = root.resolve("data/snapshots/" + id + ".jsonl");
            assertTrue(Files.exists(snapshot));
            assertEquals(1, k.snapshotStore().load(snapshot, clock, k.policy()).observationCount());
        }
    }

    @Test
    void chineseLocaleFromConfig() throws Exception {
        Path root = dir.resolve("zh");
        Files.createDirectories(root);
        Files.writeString(root.resolve("canary.json"), "{\"answer\": {\"locale\": \"zh\"}}", StandardCharsets.UTF_8);

        try (CanaryKernel k = CanaryKernel.builder().configRoot(root).clock(clock).build(Path.of("canary.json"));
             ProblemSession s = k.openSession("g")) {
            assertEquals(AnswerTemplates.chinese().refusal, s.answer("X").content);
        }
    }

    private static List<String> names(List<ToolCandidate> xs) {
        return xs.stream().map(t -> t.name).collect(Collectors.toList());
    }
}
