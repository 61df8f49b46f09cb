package com.logicloop.core.formalization;

import java.util.List;

/**
 * Result of FormulationValidator.validate().
 */
public final class ValidationReport {

    private final boolean      valid;
    private final int          numPredicates;
    private final List<String> issues;

    public ValidationReport(boolean valid, int numPredicates, List<String> issues) {
        this.valid         = valid;
        this.numPredicates = numPredicates;
        this.issues        = issues != null ? List.copyOf(issues) : List.of();
    }

    public boolean      isValid()          { return valid; }
    public int          getNumPredicates() { return numPredicates; }
    public List<String> getIssues()        { return issues; }

    /** Issues joined into one line, for feedback and logs. */
    public String summary() {
        return issues.isEmpty() ? "ok" : String.join("; ", issues);
    }

    @Override
    public String toString() {
        return "ValidationReport{valid=" + valid + ", predicates=" + numPredicates + ", issues=" + issues + "}";
    }
}
