package org.calista.canary.ai.cognitive;

/**
 * Risk tier of a tool. Declaration order is the ranking order (safest first).
 */
public enum ToolRisk {
    SAFE(0.0),
    LOW(0.3),
    MEDIUM(0.5),
    HIGH(0.8);

    private final double minConfidence;

    ToolRisk(double minConfidence) {
        this.minConfidence = minConfidence;
    }

    /** Confidence the loop must hold before a tool of this tier may run. */
    public double minConfidence() {
        return minConfidence;
    }
}
