package org.calista.canary.ai.provenance;

import java.util.List;
import java.util.Objects;

/**
 * Candidate claim parsed out of generated text, before it is bound into the ledger.
 */
public final class ExtractedClaim {

    public final String statement;
    public final ClaimType claimType;

    /** Ledger ids cited in the sentence as {@code [xxxxxxxx]}. */
    public final List<String> observationRefs;

    public final String reasoning;
    public final ConfidenceHint confidenceHint;

    public ExtractedClaim(String statement,
                          ClaimType claimType,
                          List<String> observationRefs,
                          String reasoning,
                          ConfidenceHint confidenceHint) {
        this.statement = Objects.requireNonNull(statement, "statement");
        this.claimType = claimType == null ? ClaimType.HYPOTHESIS : claimType;
        this.observationRefs = observationRefs == null ? List.of() : List.copyOf(observationRefs);
        this.reasoning = reasoning == null ? "" : reasoning;
        this.confidenceHint = confidenceHint == null ? ConfidenceHint.LOW : confidenceHint;
    }

    public boolean hasRefs() {
        return !observationRefs.isEmpty();
    }

    @Override
    public String toString() {
        return "ExtractedClaim{" + claimType.wire() + ", hint=" + confidenceHint.wire() + ", refs=" + observationRefs + '}';
    }
}
