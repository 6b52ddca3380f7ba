package org.calista.canary.ai.cognitive;

import java.util.Objects;

/** A tool the loop could call next, with its risk tier. */
public final class ToolCandidate {

    public final String name;
    public final ToolRisk risk;

    public ToolCandidate(String name, ToolRisk risk) {
        this.name = Objects.requireNonNull(name, "name");
        this.risk = Objects.requireNonNull(risk, "risk");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ToolCandidate)) return false;
        ToolCandidate that = (ToolCandidate) o;
        return name.equals(that.name) && risk == that.risk;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, risk);
    }

    @Override
    public String toString() {
        return name + "(" + risk + ")";
    }
}
