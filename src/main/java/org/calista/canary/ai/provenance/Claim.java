package org.calista.canary.ai.provenance;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Claim — a statement derived from observations through a recorded transform chain.
 *
 * <p>{@link #confidence()} is a cache of the last {@link #updateConfidence} call; observations expire,
 * so callers that need a trustworthy value must recompute it against the current ledger.</p>
 */
public final class Claim {

    public final String id;
    public final String statement;
    public final ClaimType claimType;
    public final List<String> sourceObservations;
    public final List<TransformStep> transformChain;
    public final String scope;
    public final Instant createdAt;

    /** Derived; see {@link #computeConfidence(Map, Instant)}. */
    private double confidence;

    private Claim(Builder b) {
        this.id = (b.id == null || b.id.isBlank()) ? Ids.next() : b.id;
        this.statement = b.statement == null ? "" : b.statement;
        this.claimType = b.claimType == null ? ClaimType.FACT : b.claimType;
        this.sourceObservations = b.sourceObservations == null ? List.of() : List.copyOf(b.sourceObservations);
        this.transformChain = b.transformChain == null ? List.of() : List.copyOf(b.transformChain);
        this.scope = b.scope == null ? "" : b.scope;
        this.createdAt = Objects.requireNonNull(b.createdAt, "createdAt");
        this.confidence = clamp01(b.confidence);
    }

    public static Builder builder() {
        return new Builder();
    }

    public double confidence() {
        return confidence;
    }

    // ---------------------------------------------------------------------
    // Confidence
    // ---------------------------------------------------------------------

    /**
     * Weakest link: min confidence over present, unexpired sources, plus the transform deltas, clamped.
     * Missing or expired sources contribute nothing; no usable source yields 0.0.
     */
    public double computeConfidence(Map<String, Observation> observations, Instant now) {
        Objects.requireNonNull(now, "now");
        if (sourceObservations.isEmpty() || observations == null || observations.isEmpty()) return 0.0;

        double base = Double.NaN;
        for (String obsId : sourceObservations) {
            Observation o = observations.get(obsId);
            if (o == null || o.isExpired(now)) continue;
            base = Double.isNaN(base) ? o.confidence : Math.min(base, o.confidence);
        }
        if (Double.isNaN(base)) return 0.0;

        for (TransformStep step : transformChain) {
            base += step.confidenceDelta;
        }
        return clamp01(base);
    }

    public double updateConfidence(Map<String, Observation> observations, Instant now) {
        this.confidence = computeConfidence(observations, now);
        return this.confidence;
    }

    // ---------------------------------------------------------------------
    // Audit
    // ---------------------------------------------------------------------

    public String auditTrail() {
        StringBuilder sb = new StringBuilder(256);
        sb.append("claim: ").append(statement);
        sb.append("\ntype: ").append(claimType.wire());
        sb.append("\nconfidence: ").append(Math.round(confidence * 100)).append('%');
        sb.append("\nsource observations:");
        for (String obsId : sourceObservations) {
            sb.append("\n  - ").append(obsId);
        }
        if (!transformChain.isEmpty()) {
            sb.append("\nreasoning chain:");
            int i = 1;
            for (TransformStep step : transformChain) {
                sb.append("\n  ").append(i++).append(". [").append(step.operation.wire()).append("] ").append(step.description);
                if (!step.inputIds.isEmpty()) {
                    sb.append("\n     inputs: ").append(String.join(", ", step.inputIds));
                }
                sb.append("\n     confidence delta: ").append(String.format(Locale.ROOT, "%+.2f", step.confidenceDelta));
            }
        }
        return sb.toString();
    }

    // ---------------------------------------------------------------------
    // Map form
    // ---------------------------------------------------------------------

    public Map<String, Object> toMap() {
        ArrayList<Map<String, Object>> chain = new ArrayList<>(transformChain.size());
        for (TransformStep t : transformChain) chain.add(t.toMap());

        LinkedHashMap<String, Object> m = new LinkedHashMap<>();
        m.put("id", id);
        m.put("statement", statement);
        m.put("claim_type", claimType.wire());
        m.put("source_observations", sourceObservations);
        m.put("transform_chain", chain);
        m.put("confidence", confidence);
        m.put("scope", scope);
        m.put("created_at", createdAt.toString());
        return m;
    }

    /** @param fallbackCreatedAt used when the row carries no parseable creation time */
    public static Claim fromMap(Map<String, ?> m, Instant fallbackCreatedAt) {
        ArrayList<TransformStep> chain = new ArrayList<>();
        for (Map<String, Object> t : WireMaps.maps(m, "transform_chain")) {
            chain.add(TransformStep.fromMap(t));
        }
        Double conf = WireMaps.dbl(m, "confidence");
        return builder()
                .id(WireMaps.str(m, "id", null))
                .statement(WireMaps.str(m, "statement", ""))
                .claimType(ClaimType.fromWire(WireMaps.str(m, "claim_type", null)))
                .sourceObservations(WireMaps.strings(m, "source_observations"))
                .transformChain(chain)
                .confidence(conf == null ? 0.0 : conf)
                .scope(WireMaps.str(m, "scope", ""))
                .createdAt(WireMaps.instant(m, "created_at", Objects.requireNonNull(fallbackCreatedAt, "fallbackCreatedAt")))
                .build();
    }

    private static double clamp01(double x) {
        if (!Double.isFinite(x)) return 0.0;
        if (x < 0.0) return 0.0;
        if (x > 1.0) return 1.0;
        return x;
    }

    @Override
    public String toString() {
        return "Claim{"
                + "id='" + id + '\''
                + ", type=" + claimType.wire()
                + ", conf=" + confidence
                + ", sources=" + sourceObservations
                + '}';
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder {
        private String id;
        private String statement;
        private ClaimType claimType = ClaimType.FACT;
        private List<String> sourceObservations;
        private List<TransformStep> transformChain;
        private double confidence = 0.0;
        private String scope;
        private Instant createdAt;

        private Builder() {}

        public Builder id(String v) { this.id = v; return this; }

        public Builder statement(String v) { this.statement = v; return this; }

        public Builder claimType(ClaimType v) { this.claimType = v; return this; }

        public Builder sourceObservations(List<String> v) { this.sourceObservations = v; return this; }

        public Builder transformChain(List<TransformStep> v) { this.transformChain = v; return this; }

        /** Only meaningful for restored claims; registries recompute it on insert. */
        public Builder confidence(double v) { this.confidence = v; return this; }

        public Builder scope(String v) { this.scope = v; return this; }

        public Builder createdAt(Instant v) { this.createdAt = v; return this; }

        public Claim build() {
            return new Claim(this);
        }
    }
}
