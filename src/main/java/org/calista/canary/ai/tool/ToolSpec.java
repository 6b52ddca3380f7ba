package org.calista.canary.ai.tool;

import org.calista.canary.ai.cognitive.ToolCandidate;
import org.calista.canary.ai.cognitive.ToolRisk;
import org.calista.canary.ai.provenance.ObservationType;

import java.util.Objects;

/**
 * Catalog entry: how a tool's plain output is turned into an observation, and how risky it is to run.
 */
public final class ToolSpec {

    public final String name;
    public final String category;
    public final ToolRisk risk;
    public final ObservationType observationType;
    public final double defaultConfidence;

    /** Null means the observation never expires. */
    public final Long ttlSeconds;

    private ToolSpec(Builder b) {
        this.name = Objects.requireNonNull(b.name, "name");
        this.category = b.category == null ? "general" : b.category;
        this.risk = b.risk == null ? ToolRisk.SAFE : b.risk;
        this.observationType = b.observationType == null ? ObservationType.TOOL_RETURN : b.observationType;
        this.defaultConfidence = b.defaultConfidence == null
                ? this.observationType.defaultConfidence()
                : clamp01(b.defaultConfidence);
        this.ttlSeconds = (b.ttlSeconds != null && b.ttlSeconds <= 0) ? null : b.ttlSeconds;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public ToolCandidate candidate() {
        return new ToolCandidate(name, risk);
    }

    private static double clamp01(double x) {
        if (!Double.isFinite(x) || x < 0.0) return 0.0;
        return Math.min(1.0, x);
    }

    @Override
    public String toString() {
        return "ToolSpec{" + name + ", " + category + ", " + risk
                + ", conf=" + defaultConfidence + ", ttl=" + ttlSeconds + '}';
    }

    public static final class Builder {
        private final String name;
        private String category;
        private ToolRisk risk;
        private ObservationType observationType;
        private Double defaultConfidence;
        private Long ttlSeconds;

        private Builder(String name) {
            this.name = name;
        }

        public Builder category(String v) { this.category = v; return this; }

        public Builder risk(ToolRisk v) { this.risk = v; return this; }

        public Builder observationType(ObservationType v) { this.observationType = v; return this; }

        public Builder defaultConfidence(double v) { this.defaultConfidence = v; return this; }

        public Builder ttlSeconds(long v) { this.ttlSeconds = v; return this; }

        public ToolSpec build() {
            return new ToolSpec(this);
        }
    }
}
