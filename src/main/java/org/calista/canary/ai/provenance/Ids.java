package org.calista.canary.ai.provenance;

import java.util.UUID;

/** Short ledger ids; these are what the model cites as {@code [xxxxxxxx]}. */
public final class Ids {

    public static final int LENGTH = 8;

    private Ids() {}

    public static String next() {
        return UUID.randomUUID().toString().substring(0, LENGTH);
    }
}
