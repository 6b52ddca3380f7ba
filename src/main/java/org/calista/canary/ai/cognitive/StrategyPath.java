package org.calista.canary.ai.cognitive;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of one {@link StrategyGate} evaluation. Pure value, never stored by the gate.
 */
public final class StrategyPath {

    public final StrategyDecision decision;
    public final String reason;

    /** Nullable. */
    public final String suggestedAction;

    public StrategyPath(StrategyDecision decision, String reason, String suggestedAction) {
        this.decision = Objects.requireNonNull(decision, "decision");
        this.reason = reason == null ? "" : reason;
        this.suggestedAction = suggestedAction;
    }

    public static StrategyPath of(StrategyDecision decision, String reason) {
        return new StrategyPath(decision, reason, null);
    }

    public static StrategyPath of(StrategyDecision decision, String reason, String suggestedAction) {
        return new StrategyPath(decision, reason, suggestedAction);
    }

    public Optional<String> suggestion() {
        return Optional.ofNullable(suggestedAction);
    }

    /** True for decisions that end the loop with an answer. */
    public boolean isTerminal() {
        return decision == StrategyDecision.CONCLUDE || decision == StrategyDecision.DEGRADE;
    }

    @Override
    public String toString() {
        return "StrategyPath{" + decision + ", reason='" + reason + '\''
                + (suggestedAction == null ? "" : ", action='" + suggestedAction + '\'')
                + '}';
    }
}
