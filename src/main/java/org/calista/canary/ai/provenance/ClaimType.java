package org.calista.canary.ai.provenance;

import java.util.Locale;

/**
 * Evidence strength of a claim. Wire values are lowercase.
 */
public enum ClaimType {
    FACT("fact"),
    INFERENCE("inference"),
    HYPOTHESIS("hypothesis");

    private final String wire;

    ClaimType(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    /** Unknown/blank values map to HYPOTHESIS (least trusted). */
    public static ClaimType fromWire(String value) {
        if (value == null || value.isBlank()) return HYPOTHESIS;
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (ClaimType t : values()) {
            if (t.wire.equals(v) || t.name().toLowerCase(Locale.ROOT).equals(v)) return t;
        }
        return HYPOTHESIS;
    }
}
