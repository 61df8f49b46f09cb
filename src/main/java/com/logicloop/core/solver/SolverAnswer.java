package com.logicloop.core.solver;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of one entailment check.
 *
 * PROVED   : premises force the conclusion
 * DISPROVED: premises force the negation of the conclusion
 * UNKNOWN  : neither could be established (or the time budget ran out)
 * ERROR    : the query could not be run; SolverResult.getError() says why
 */
public enum SolverAnswer {
    PROVED("Proved"),
    DISPROVED("Disproved"),
    UNKNOWN("Unknown"),
    ERROR("Error");

    private final String label;

    SolverAnswer(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /** Proved or Disproved. */
    public boolean isDecisive() {
        return this == PROVED || this == DISPROVED;
    }

    @Override
    public String toString() {
        return label;
    }
}
