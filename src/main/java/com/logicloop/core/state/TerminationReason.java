package com.logicloop.core.state;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a refinement session stopped.
 */
public enum TerminationReason {

    /** The current best solved to Proved or Disproved. */
    DECISIVE_SUCCESS("decisive-success"),

    /** consecutive reverts reached the early-stop threshold. */
    REVERT_BUDGET_EXHAUSTED("revert-budget-exhausted"),

    /** iteration counter reached the configured maximum. */
    ITERATION_CAP("iteration-cap"),

    /** The generator could not be called; fatal for the session, history is kept. */
    GENERATOR_UNREACHABLE("generator-unreachable");

    private final String label;

    TerminationReason(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isSuccess() {
        return this == DECISIVE_SUCCESS;
    }

    @Override
    public String toString() {
        return label;
    }
}
