package org.calista.canary.ai.provenance;

/**
 * Degradation/confidence policy knobs.
 *
 * All thresholds and decay constants live here so the policy stays data-driven;
 * {@link #defaults()} reproduces the shipped behavior.
 */
public final class ProvenancePolicy {

    public static final double DEFAULT_FULL_CONFIDENCE = 0.8;
    public static final double DEFAULT_PARTIAL_CONFIDENCE = 0.5;
    public static final int DEFAULT_MIN_OBSERVATIONS = 1;

    public static final double DEFAULT_INFERENCE_DELTA = -0.1;
    public static final double DEFAULT_HYPOTHESIS_DELTA = -0.3;

    public static final double DEFAULT_HIGH_CLAIM_CONFIDENCE = 0.8;
    public static final double DEFAULT_MEDIUM_CLAIM_CONFIDENCE = 0.5;

    public static final long DEFAULT_NEAR_EXPIRY_SECONDS = 1800L;
    public static final int DEFAULT_CROSS_VALIDATION_OBSERVATIONS = 3;
    public static final int DEFAULT_EXCERPT_CHARS = 100;
    /** Shortest claim excerpt allowed in an answer's confidence breakdown. */
    public static final int MIN_EXCERPT_CHARS = 16;
    public static final int DEFAULT_CONTEXT_OBSERVATIONS = 5;

    // --- degradation ---
    /** Average observation confidence required for FULL_ANSWER. */
    public final double fullConfidence;
    /** Average observation confidence required for PARTIAL_WITH_UNCERTAINTY. */
    public final double partialConfidence;
    public final int minObservationsForAnswer;

    // --- claim chain ---
    public final double inferenceDelta;
    public final double hypothesisDelta;

    // --- claim buckets ---
    public final double highClaimConfidence;
    public final double mediumClaimConfidence;
    public final int excerptChars;

    // --- limitations / suggestions ---
    public final long nearExpirySeconds;
    /** Below this many valid observations a partial answer suggests gathering more. */
    public final int crossValidationObservations;

    public final int contextObservations;

    private ProvenancePolicy(Builder b) {
        this.fullConfidence = clamp01(b.fullConfidence, DEFAULT_FULL_CONFIDENCE);
        this.partialConfidence = clamp01(b.partialConfidence, DEFAULT_PARTIAL_CONFIDENCE);
        this.minObservationsForAnswer = Math.max(0, b.minObservationsForAnswer);
        this.inferenceDelta = clampDelta(b.inferenceDelta, DEFAULT_INFERENCE_DELTA);
        this.hypothesisDelta = clampDelta(b.hypothesisDelta, DEFAULT_HYPOTHESIS_DELTA);
        this.highClaimConfidence = clamp01(b.highClaimConfidence, DEFAULT_HIGH_CLAIM_CONFIDENCE);
        this.mediumClaimConfidence = clamp01(b.mediumClaimConfidence, DEFAULT_MEDIUM_CLAIM_CONFIDENCE);
        this.excerptChars = Math.max(MIN_EXCERPT_CHARS, b.excerptChars);
        this.nearExpirySeconds = Math.max(0L, b.nearExpirySeconds);
        this.crossValidationObservations = Math.max(0, b.crossValidationObservations);
        this.contextObservations = Math.max(1, b.contextObservations);
    }

    public static ProvenancePolicy defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static double clamp01(double v, double def) {
        if (!Double.isFinite(v)) return def;
        return Math.max(0.0, Math.min(1.0, v));
    }

    private static double clampDelta(double v, double def) {
        if (!Double.isFinite(v)) return def;
        return Math.max(-1.0, Math.min(1.0, v));
    }

    @Override
    public String toString() {
        return "ProvenancePolicy{full=" + fullConfidence
                + ", partial=" + partialConfidence
                + ", minObs=" + minObservationsForAnswer
                + ", inferΔ=" + inferenceDelta
                + ", hypoΔ=" + hypothesisDelta
                + '}';
    }

    public static final class Builder {
        private double fullConfidence = DEFAULT_FULL_CONFIDENCE;
        private double partialConfidence = DEFAULT_PARTIAL_CONFIDENCE;
        private int minObservationsForAnswer = DEFAULT_MIN_OBSERVATIONS;
        private double inferenceDelta = DEFAULT_INFERENCE_DELTA;
        private double hypothesisDelta = DEFAULT_HYPOTHESIS_DELTA;
        private double highClaimConfidence = DEFAULT_HIGH_CLAIM_CONFIDENCE;
        private double mediumClaimConfidence = DEFAULT_MEDIUM_CLAIM_CONFIDENCE;
        private int excerptChars = DEFAULT_EXCERPT_CHARS;
        private long nearExpirySeconds = DEFAULT_NEAR_EXPIRY_SECONDS;
        private int crossValidationObservations = DEFAULT_CROSS_VALIDATION_OBSERVATIONS;
        private int contextObservations = DEFAULT_CONTEXT_OBSERVATIONS;

        private Builder() {}

        public Builder fullConfidence(double v) { this.fullConfidence = v; return this; }
        public Builder partialConfidence(double v) { this.partialConfidence = v; return this; }
        public Builder minObservationsForAnswer(int v) { this.minObservationsForAnswer = v; return this; }
        public Builder inferenceDelta(double v) { this.inferenceDelta = v; return this; }
        public Builder hypothesisDelta(double v) { this.hypothesisDelta = v; return this; }
        public Builder highClaimConfidence(double v) { this.highClaimConfidence = v; return this; }
        public Builder mediumClaimConfidence(double v) { this.mediumClaimConfidence = v; return this; }
        public Builder excerptChars(int v) { this.excerptChars = v; return this; }
        public Builder nearExpirySeconds(long v) { this.nearExpirySeconds = v; return this; }
        public Builder crossValidationObservations(int v) { this.crossValidationObservations = v; return this; }
        public Builder contextObservations(int v) { this.contextObservations = v; return this; }

        public ProvenancePolicy build() {
            return new ProvenancePolicy(this);
        }
    }
}
