package org.calista.canary.ai.provenance;

import java.util.Locale;

public enum TransformOperation {
    EXTRACT,
    AGGREGATE,
    INFER,
    COMBINE;

    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TransformOperation fromWire(String value) {
        if (value == null || value.isBlank()) return INFER;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return INFER;
        }
    }
}
