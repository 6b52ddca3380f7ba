package org.calista.canary.ai.provenance;

import java.util.Locale;

public enum ConfidenceHint {
    HIGH,
    MEDIUM,
    LOW;

    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
