package org.calista.canary.ai.tool;

import org.calista.canary.ai.cognitive.CognitiveState;
import org.calista.canary.ai.provenance.Observation;
import org.calista.canary.ai.provenance.ObservationType;
import org.calista.canary.ai.provenance.ProvenanceRegistry;
import org.calista.canary.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolObservationRecorderTest {

    private MutableClock clock;
    private ProvenanceRegistry registry;
    private CognitiveState state;
    private ToolObservationRecorder recorder;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        registry = new ProvenanceRegistry(clock);
        state = new CognitiveState("goal");
        recorder = new ToolObservationRecorder(ToolCatalog.defaults());
    }

    @Test
    void plainOutputUsesCatalogDefaults() {
        Observation o = recorder.record("web_search", ExecutionOutcome.plain("three results"), registry, state);

        assertEquals(ObservationType.TOOL_RETURN, o.sourceType);
        assertEquals("web_search", o.sourceId);
        assertEquals(1.0, o.confidence, 1e-9);
        assertEquals(3600L, o.ttlSeconds.longValue());
        assertEquals(clock.instant(), o.timestamp);
        assertSame(o, registry.getObservation(o.id).orElseThrow());
        assertEquals(1, state.observationCount());
        assertEquals("web_search", state.lastToolUsed);
    }

    @Test
    void shellOutputIsSlightlyLessTrusted() {
        Observation o = recorder.record("Bash", ExecutionOutcome.plain("ok"), registry, state);
        assertEquals(0.9, o.confidence, 1e-9);
        assertNull(o.ttlSeconds);
    }

    @Test
    void userAnswersBecomeUserInput() {
        Observation o = recorder.record("ask_user", ExecutionOutcome.plain("metric please"), registry, state);
        assertEquals(ObservationType.USER_INPUT, o.sourceType);
        assertEquals("user", o.sourceId);
        assertEquals(0.8, o.confidence, 1e-9);

        Observation direct = recorder.recordUserInput("Lyon, France", registry, null);
        assertEquals(ObservationType.USER_INPUT, direct.sourceType);
        assertEquals(2, registry.observationCount());
    }

    @Test
    void unknownToolGetsPlainToolReturn() {
        Observation o = recorder.record("custom_tool", ExecutionOutcome.plain("x"), registry, null);
        assertEquals(ObservationType.TOOL_RETURN, o.sourceType);
        assertEquals("custom_tool", o.sourceId);
        assertEquals(1.0, o.confidence, 1e-9);
        assertNull(o.ttlSeconds);
    }

    @Test
    void providedObservationIsStoredAsIs() {
        ToolResult r = ToolResult.fromSuccess("42", "python_exec", 0.95, 120L, "math", Map.of("expr", "6*7"), clock.instant());
        Observation o = recorder.record("python_exec", ExecutionOutcome.withProvenance(r), registry, state);

        assertSame(r.observation, o);
        assertEquals(0.95, o.confidence, 1e-9);
        assertEquals("math", o.scope);
        assertEquals("6*7", o.metadata.get("expr"));
        assertEquals(0.95, state.averageObservationConfidence(), 1e-9);
    }

    @Test
    void failuresAreRecordedWithZeroConfidence() {
        ToolResult r = ToolResult.fromError("timeout after 30s", "read_url", clock.instant());
        Observation o = recorder.record("read_url", ExecutionOutcome.withProvenance(r), registry, state);

        assertFalse(r.success);
        assertEquals("timeout after 30s", r.errorMessage);
        assertEquals(0.0, o.confidence, 1e-9);
        assertEquals(ToolResult.ERROR_SCOPE, o.scope);
        assertEquals("timeout after 30s", o.metadata.get("error"));
        assertEquals(1, registry.observationCount());
        assertTrue(registry.getValidObservations(0.5).isEmpty());
    }

    @Test
    void longOutputIsTruncatedInTheLedgerOnly() {
        String big = "z".repeat(2_000);

        ToolResult r = ToolResult.fromSuccess(big, "read_url", 1.0, clock.instant());
        assertEquals(2_000, r.content.length());
        assertEquals(ToolResult.OBSERVATION_CONTENT_CHARS, r.observation.content.length());

        ExecutionOutcome plain = ExecutionOutcome.plain(big);
        Observation o = recorder.record("read_url", plain, registry, null);
        assertEquals(ToolResult.OBSERVATION_CONTENT_CHARS, o.content.length());
        assertEquals(2_000, plain.text().length());
    }

    @Test
    void eachOutcomeVariantResolvesItsOwnObservation() {
        ToolResult r = ToolResult.fromSuccess("cached page", "read_url", 0.7, clock.instant().minusSeconds(30));
        Observation carried = ExecutionOutcome.withProvenance(r).toObservation("read_url", recorder.catalog(), clock.instant());
        assertSame(r.observation, carried);
        assertEquals(clock.instant().minusSeconds(30), carried.timestamp);

        Observation wrapped = ExecutionOutcome.plain("fresh page").toObservation("read_url", recorder.catalog(), clock.instant());
        assertEquals(clock.instant(), wrapped.timestamp);
        assertEquals(7200L, wrapped.ttlSeconds.longValue());
        assertEquals("read_url", wrapped.metadata.get("tool"));
    }

    @Test
    void outcomeTextIsWhatTheModelSees() {
        assertEquals("hi", ExecutionOutcome.plain("hi").text());
        assertEquals("", ExecutionOutcome.plain(null).text());
        assertEquals("boom", ExecutionOutcome.withProvenance(ToolResult.fromError("boom", "Bash", clock.instant())).text());
    }
}
