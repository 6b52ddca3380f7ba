package org.calista.canary.ai.provenance;

/**
 * Where an observation came from. Only these sources may introduce world state into the ledger.
 */
public enum ObservationType {

    /** Tool/API return value. */
    TOOL_RETURN(1.0, "tool"),

    /** Something the user said. */
    USER_INPUT(0.8, "user"),

    /** System-defined rule, formally verifiable. */
    DEFINED_RULE(1.0, "rule");

    private final double defaultConfidence;
    private final String label;

    ObservationType(double defaultConfidence, String label) {
        this.defaultConfidence = defaultConfidence;
        this.label = label;
    }

    /** Confidence used when the producer did not set one. */
    public double defaultConfidence() {
        return defaultConfidence;
    }

    public String label() {
        return label;
    }
}
