package org.calista.canary.ai.cognitive;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * MinimalCommitmentPolicy — gates tools by risk against the loop's current confidence.
 *
 * <p>A tool may run only when {@code confidence >= threshold(risk)}. Admissible tools are
 * ordered safest first; ties keep their input order.</p>
 */
public final class MinimalCommitmentPolicy {

    private final Map<ToolRisk, Double> thresholds;

    public MinimalCommitmentPolicy() {
        this(defaultThresholds());
    }

    /** Missing tiers fall back to {@link ToolRisk#minConfidence()}. */
    public MinimalCommitmentPolicy(Map<ToolRisk, Double> overrides) {
        EnumMap<ToolRisk, Double> m = defaultThresholds();
        if (overrides != null) {
            for (Map.Entry<ToolRisk, Double> e : overrides.entrySet()) {
                if (e.getKey() == null || e.getValue() == null || !Double.isFinite(e.getValue())) continue;
                m.put(e.getKey(), e.getValue());
            }
        }
        this.thresholds = m;
    }

    public static EnumMap<ToolRisk, Double> defaultThresholds() {
        EnumMap<ToolRisk, Double> m = new EnumMap<>(ToolRisk.class);
        for (ToolRisk r : ToolRisk.values()) m.put(r, r.minConfidence());
        return m;
    }

    public double threshold(ToolRisk risk) {
        return thresholds.get(Objects.requireNonNull(risk, "risk"));
    }

    public boolean shouldProceed(ToolRisk risk, double confidence) {
        return confidence >= threshold(risk);
    }

    /**
     * Drops tools whose risk is not admissible at {@code confidence}, then sorts by tier
     * (SAFE, LOW, MEDIUM, HIGH). {@link List#sort} is stable.
     */
    public List<ToolCandidate> rankTools(List<ToolCandidate> tools, double confidence) {
        if (tools == null || tools.isEmpty()) return List.of();

        ArrayList<ToolCandidate> out = new ArrayList<>(tools.size());
        for (ToolCandidate t : tools) {
            if (t != null && shouldProceed(t.risk, confidence)) out.add(t);
        }
        out.sort(Comparator.comparingInt(t -> t.risk.ordinal()));
        return out;
    }
}
