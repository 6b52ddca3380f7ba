package org.calista.canary.ai.core;

import org.calista.canary.ai.cognitive.CognitiveState;
import org.calista.canary.ai.cognitive.StrategyPath;
import org.calista.canary.ai.cognitive.ToolCandidate;
import org.calista.canary.ai.events.EventStore;
import org.calista.canary.ai.events.SessionEvent;
import org.calista.canary.ai.provenance.Claim;
import org.calista.canary.ai.provenance.GroundedAnswer;
import org.calista.canary.ai.provenance.Observation;
import org.calista.canary.ai.provenance.ProvenanceRegistry;
import org.calista.canary.ai.tool.ExecutionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * ProblemSession — one problem being worked on by one agent loop.
 *
 * <p>
 * Owns exactly one {@link ProvenanceRegistry} and one {@link CognitiveState}; neither is ever
 * handed to another session. Not thread-safe: drive it from the loop that opened it.
 * Methods that write the audit log declare {@link IOException}.
 * </p>
 */
public final class ProblemSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProblemSession.class);

    private final CanaryKernel kernel;
    private final String id;
    private final String goal;

    private final ProvenanceRegistry registry;
    private final CognitiveState state;

    private boolean closed = false;

    ProblemSession(CanaryKernel kernel, String goal) {
        this.kernel = Objects.requireNonNull(kernel, "kernel");
        this.id = UUID.randomUUID().toString();
        this.goal = goal == null ? "" : goal.trim();
        this.registry = new ProvenanceRegistry(kernel.clock(), kernel.policy());
        this.state = new CognitiveState(this.goal);
    }

    public String id() { return id; }
    public String goal() { return goal; }
    public ProvenanceRegistry registry() { return registry; }
    public CognitiveState state() { return state; }

    // ---------------------------------------------------------------------
    // Loop hooks
    // ---------------------------------------------------------------------

    public void beginIteration() {
        ensureOpen();
        state.incrementIteration();
    }

    /** Exactly one observation per tool call, successful or not. */
    public Observation recordToolOutcome(String toolName, ExecutionOutcome outcome) throws IOException {
        ensureOpen();
        Observation obs = kernel.recorder().record(toolName, outcome, registry, state);
        state.lastActionType = "tool";
        event(SessionEvent.OBSERVATION, obs.id + " " + obs.sourceType.label() + ":" + obs.sourceId
                + " conf=" + obs.confidence);
        return obs;
    }

    public Observation recordUserInput(String answer) throws IOException {
        ensureOpen();
        Observation obs = kernel.recorder().recordUserInput(answer, registry, state);
        state.lastActionType = "ask_user";
        event(SessionEvent.OBSERVATION, obs.id + " " + obs.sourceType.label() + ":" + obs.sourceId
                + " conf=" + obs.confidence);
        return obs;
    }

    public StrategyPath evaluate() throws IOException {
        ensureOpen();
        StrategyPath path = kernel.strategyGate().evaluate(state, registry);
        event(SessionEvent.STRATEGY, path.decision + ": " + path.reason);
        return path;
    }

    /** Tools the loop may run at the current confidence, safest first. */
    public List<ToolCandidate> admissibleTools() {
        return kernel.commitmentPolicy().rankTools(kernel.recorder().catalog().candidates(), state.confidence());
    }

    /** Ledger block plus cognitive hints, for the next prompt. */
    public String promptContext() {
        String ledger = registry.toContext(kernel.policy().contextObservations);
        String hints = state.toContext();
        return hints.isEmpty() ? ledger : ledger + "\n\n" + hints;
    }

    // ---------------------------------------------------------------------
    // Answer
    // ---------------------------------------------------------------------

    /**
     * Extracts claims from the model's raw answer, records them, then applies the degradation contract.
     */
    public GroundedAnswer answer(String rawAnswer) throws IOException {
        ensureOpen();
        List<Claim> claims = kernel.extractor().extractAndRecord(rawAnswer, registry);
        GroundedAnswer a = kernel.answerGenerator().generate(rawAnswer, registry, claims);
        event(SessionEvent.ANSWER, a.degradationLevel + " observations=" + a.observationsUsed.size()
                + " claims=" + claims.size());
        return a;
    }

    public String provenanceSummary() {
        return kernel.answerGenerator().formatProvenanceSummary(registry);
    }

    public Path saveSnapshot() throws IOException {
        Path file = kernel.io().resolve(kernel.config().sessions.snapshotDir + "/" + id + ".jsonl");
        kernel.snapshotStore().save(registry, file);
        event(SessionEvent.SNAPSHOT, file.toString());
        return file;
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    public boolean isClosed() {
        return closed;
    }

    /** Optionally exports the ledger, then discards it. */
    @Override
    public void close() throws IOException {
        if (closed) return;
        try {
            if (kernel.config().sessions.snapshotOnClose && registry.observationCount() > 0) {
                saveSnapshot();
            }
        } finally {
            closed = true;
            registry.clear();
            kernel.sessionClosed(this);
        }
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("session " + id + " is closed");
    }

    private void event(String type, String text) throws IOException {
        EventStore events = kernel.eventStore();
        if (events == null) return;
        events.append(SessionEvent.of(type, id, text, kernel.clock().millis()));
        log.trace("event {} {}: {}", id, type, text);
    }

    @Override
    public String toString() {
        return "ProblemSession{" + id + ", " + state + ", " + registry + '}';
    }
}
