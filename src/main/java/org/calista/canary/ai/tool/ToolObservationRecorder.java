package org.calista.canary.ai.tool;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.canary.ai.cognitive.CognitiveState;
import org.calista.canary.ai.provenance.Observation;
import org.calista.canary.ai.provenance.ObservationType;
import org.calista.canary.ai.provenance.ProvenanceRegistry;

import java.time.Instant;
import java.util.Objects;

/**
 * ToolObservationRecorder — the single point where tool output enters the ledger.
 * Each outcome variant decides its own observation ({@link ExecutionOutcome#toObservation}).
 *
 * <p>
 * Every call records exactly one observation:
 * - {@link ExecutionOutcome.WithProvenance}: the result's own observation, as is
 * - {@link ExecutionOutcome.Plain}: wrapped using the tool's catalog entry (type, confidence, TTL);
 *   unknown tools get a plain TOOL_RETURN at the type default
 * </p>
 * The cognitive state, when given, is told about the observation's confidence.
 */
public final class ToolObservationRecorder {

    private static final Logger log = LogManager.getLogger(ToolObservationRecorder.class);

    private final ToolCatalog catalog;

    public ToolObservationRecorder(ToolCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public ToolCatalog catalog() {
        return catalog;
    }

    /**
     * @param state nullable
     * @return the stored observation
     */
    public Observation record(String toolName,
                              ExecutionOutcome outcome,
                              ProvenanceRegistry registry,
                              CognitiveState state) {
        Objects.requireNonNull(toolName, "toolName");
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(registry, "registry");

        Observation obs = resolve(toolName, outcome, registry.now());
        registry.addObservation(obs);

        if (state != null) {
            state.recordObservation(obs.confidence);
            state.lastToolUsed = toolName;
        }

        if (obs.confidence == 0.0 && ToolResult.ERROR_SCOPE.equals(obs.scope)) {
            log.info("tool {} failed, recorded as zero-confidence observation {}", toolName, obs.id);
        } else if (log.isDebugEnabled()) {
            log.debug("tool {} -> observation {} ({}, conf={})", toolName, obs.id, obs.sourceType, obs.confidence);
        }
        return obs;
    }

    /** User answers to a clarification question. */
    public Observation recordUserInput(String answer, ProvenanceRegistry registry, CognitiveState state) {
        Objects.requireNonNull(registry, "registry");
        Observation obs = Observation.builder()
                .content(answer)
                .sourceType(ObservationType.USER_INPUT)
                .sourceId("user")
                .timestamp(registry.now())
                .build();
        registry.addObservation(obs);
        if (state != null) state.recordObservation(obs.confidence);
        return obs;
    }

    Observation resolve(String toolName, ExecutionOutcome outcome, Instant now) {
        return outcome.toObservation(toolName, catalog, now);
    }
}
