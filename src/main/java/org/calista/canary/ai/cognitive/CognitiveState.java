package org.calista.canary.ai.cognitive;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * CognitiveState — mutable per-problem running counters consumed by {@link StrategyGate}.
 *
 * Rules:
 * - one instance per problem/session, mutated only by the owning loop (not thread-safe)
 * - confidence is always clamped to [0,1]
 * - uncertainties keep insertion order and never hold duplicates
 */
public final class CognitiveState {

    public static final double INITIAL_CONFIDENCE = 0.3;

    // -------------------- Confidence / uncertainty --------------------

    private double confidence;
    private final LinkedHashSet<String> uncertainties = new LinkedHashSet<>();

    // -------------------- Progress --------------------

    private int iterationCount;
    /** Consecutive iterations without progress. */
    private int stallCount;

    public String lastActionType = "";
    public String lastToolUsed = "";

    // -------------------- Problem understanding --------------------

    private final String goalStatement;
    public String currentHypothesis = "";

    // -------------------- Observation tracking --------------------

    private int observationCount;
    private double observationConfidenceSum;
    private boolean hasToolObservations;

    public CognitiveState(String goalStatement) {
        this(goalStatement, INITIAL_CONFIDENCE);
    }

    public CognitiveState(String goalStatement, double initialConfidence) {
        this.goalStatement = goalStatement == null ? "" : goalStatement;
        this.confidence = clamp01(initialConfidence);
    }

    // -------------------- Mutators --------------------

    public void updateConfidence(double value) {
        this.confidence = clamp01(value);
    }

    public void addUncertainty(String uncertainty) {
        if (uncertainty == null || uncertainty.isBlank()) return;
        uncertainties.add(uncertainty.trim());
    }

    public void removeUncertainty(String uncertainty) {
        if (uncertainty == null) return;
        uncertainties.remove(uncertainty.trim());
    }

    public void incrementIteration() {
        iterationCount++;
    }

    /** Progress was made: the stall streak resets. */
    public void markProgress() {
        stallCount = 0;
    }

    public void markStall() {
        stallCount++;
    }

    public void recordObservation(double observationConfidence) {
        observationCount++;
        observationConfidenceSum += clamp01(observationConfidence);
        hasToolObservations = true;
    }

    // -------------------- Reads --------------------

    public double confidence() {
        return confidence;
    }

    /** Snapshot in insertion order. */
    public List<String> uncertainties() {
        return new ArrayList<>(uncertainties);
    }

    public int iterationCount() {
        return iterationCount;
    }

    public int stallCount() {
        return stallCount;
    }

    public String goalStatement() {
        return goalStatement;
    }

    public int observationCount() {
        return observationCount;
    }

    public double observationConfidenceSum() {
        return observationConfidenceSum;
    }

    public boolean hasToolObservations() {
        return hasToolObservations;
    }

    public boolean hasStalled(int threshold) {
        return stallCount >= threshold;
    }

    public double averageObservationConfidence() {
        return observationCount == 0 ? 0.0 : observationConfidenceSum / observationCount;
    }

    /**
     * Short hint block for the prompt builder; empty when there is nothing worth saying.
     */
    public String toContext() {
        ArrayList<String> lines = new ArrayList<>(4);

        if (confidence < 0.5) {
            lines.add("current confidence is low (" + pct(confidence) + ")");
        }
        if (!uncertainties.isEmpty()) {
            List<String> all = uncertainties();
            lines.add("open uncertainties: " + String.join(", ", all.subList(0, Math.min(2, all.size()))));
        }
        if (stallCount >= 2) {
            lines.add("progress is slow, consider switching strategy");
        }
        if (observationCount == 0 && iterationCount > 0) {
            lines.add("note: no observations gathered yet");
        } else if (observationCount > 0) {
            double avg = averageObservationConfidence();
            if (avg < 0.6) lines.add("observation confidence is low (" + pct(avg) + ")");
        }
        return String.join("\n", lines);
    }

    public Map<String, Object> toMap() {
        LinkedHashMap<String, Object> m = new LinkedHashMap<>();
        m.put("confidence", confidence);
        m.put("uncertainties", uncertainties());
        m.put("iteration_count", iterationCount);
        m.put("stall_count", stallCount);
        m.put("goal_statement", goalStatement);
        m.put("observation_count", observationCount);
        m.put("average_observation_confidence", averageObservationConfidence());
        return m;
    }

    private static String pct(double v) {
        return String.format(Locale.ROOT, "%.0f%%", v * 100.0);
    }

    private static double clamp01(double x) {
        if (!Double.isFinite(x)) return 0.0;
        if (x < 0.0) return 0.0;
        if (x > 1.0) return 1.0;
        return x;
    }

    @Override
    public String toString() {
        return "CognitiveState{conf=" + confidence
                + ", iter=" + iterationCount
                + ", stall=" + stallCount
                + ", uncertainties=" + uncertainties.size()
                + ", obs=" + observationCount
                + '}';
    }
}
