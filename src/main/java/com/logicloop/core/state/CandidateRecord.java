package com.logicloop.core.state;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.logicloop.core.formalization.Formalization;
import com.logicloop.core.generator.ComparisonVerdict;
import com.logicloop.core.solver.SolverResult;

import java.util.List;

/**
 * What happened to one proposed candidate inside an iteration.
 *
 * solverResult is null when the candidate never reached SOLVE; verdict is
 * null when it never reached COMPARE. diagnostic holds the feedback line
 * produced for it (validation issues or classified solver error).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CandidateRecord {

    private final int               index;
    private final Formalization     formalization;
    private final List<String>      validationIssues;
    private final SolverResult      solverResult;
    private final String            diagnostic;
    private final ComparisonVerdict verdict;

    public CandidateRecord(int index,
                           Formalization formalization,
                           List<String> validationIssues,
                           SolverResult solverResult,
                           String diagnostic,
                           ComparisonVerdict verdict) {
        this.index            = index;
        this.formalization    = formalization;
        this.validationIssues = validationIssues != null ? List.copyOf(validationIssues) : List.of();
        this.solverResult     = solverResult;
        this.diagnostic       = diagnostic;
        this.verdict          = verdict;
    }

    /** Same candidate after COMPARE. */
    public CandidateRecord withVerdict(ComparisonVerdict v) {
        return new CandidateRecord(index, formalization, validationIssues, solverResult, diagnostic, v);
    }

    public int               getIndex()            { return index; }
    public Formalization     getFormalization()    { return formalization; }
    public List<String>      getValidationIssues() { return validationIssues; }
    public SolverResult      getSolverResult()     { return solverResult; }
    public String            getDiagnostic()       { return diagnostic; }
    public ComparisonVerdict getVerdict()          { return verdict; }

    @JsonIgnore
    public boolean isValid() {
        return validationIssues.isEmpty();
    }

    /** Passed validation and the solver returned a non-Error answer. */
    @JsonIgnore
    public boolean isExecuted() {
        return isValid() && solverResult != null && solverResult.isExecuted();
    }

    @JsonIgnore
    public boolean isDecisive() {
        return isValid() && solverResult != null && solverResult.isDecisive();
    }

    @Override
    public String toString() {
        return "Candidate#" + index
                + (isValid() ? " → " + solverResult : " invalid: " + String.join("; ", validationIssues));
    }
}
