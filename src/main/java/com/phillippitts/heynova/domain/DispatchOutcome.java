package com.phillippitts.heynova.domain;

/**
 * Result of routing one command through the skill table.
 */
public enum DispatchOutcome {

    /** A skill handled the command (its side effects already ran); keep listening. */
    HANDLED,

    /** No skill predicate matched; the fallback chain takes over. */
    UNCLAIMED,

    /** Handled by the exit skill; the assistant session ends after this cycle. */
    SESSION_END;

    public boolean isHandled() {
        return this != UNCLAIMED;
    }
}
