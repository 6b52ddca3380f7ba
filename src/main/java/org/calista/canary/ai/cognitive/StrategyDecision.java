package org.calista.canary.ai.cognitive;

/** Control action chosen for the next loop iteration. */
public enum StrategyDecision {
    /** Keep going on the current path. */
    CONTINUE,
    /** Dig deeper into the current approach. */
    DEEPEN,
    /** Switch method/skill. */
    PIVOT,
    /** Ask the user for clarification. */
    ASK_USER,
    /** Output with uncertainty acknowledged. */
    DEGRADE,
    /** Output the final answer. */
    CONCLUDE,
    /** Gather (or refresh) observations before answering. */
    REQUEST_MORE_INFO
}
