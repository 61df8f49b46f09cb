package com.logicloop.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.logicloop.core.formalization.Formalization;
import com.logicloop.core.solver.SolverResult;
import com.logicloop.core.state.IterationRecord;
import com.logicloop.core.state.TerminationReason;

import java.util.List;

/**
 * Persisted outcome of one refinement session.
 *
 * Always carries a final best formalization and result, even when the
 * session ended on GENERATOR_UNREACHABLE during INIT (then the best is a
 * failed formalization and the result an Error).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RefinementTrace {

    private final String                statementId;
    private final String                statement;
    private final List<IterationRecord> history;
    private final Formalization         finalBest;
    private final SolverResult          finalResult;
    private final TerminationReason     terminationReason;
    private final int                   iterations;
    private final int                   totalReverts;
    private final int                   generatorCalls;
    private final long                  wallTimeMs;
    private final String                fatalError;

    public RefinementTrace(
            String                statementId,
            String                statement,
            List<IterationRecord> history,
            Formalization         finalBest,
            SolverResult          finalResult,
            TerminationReason     terminationReason,
            int                   iterations,
            int                   totalReverts,
            int                   generatorCalls,
            long                  wallTimeMs,
            String                fatalError
    ) {
        this.statementId       = statementId;
        this.statement         = statement;
        this.history           = List.copyOf(history);
        this.finalBest         = finalBest;
        this.finalResult       = finalResult;
        this.terminationReason = terminationReason;
        this.iterations        = iterations;
        this.totalReverts      = totalReverts;
        this.generatorCalls    = generatorCalls;
        this.wallTimeMs        = wallTimeMs;
        this.fatalError        = fatalError;
    }

    public String                getStatementId()       { return statementId; }
    public String                getStatement()         { return statement; }
    public List<IterationRecord> getHistory()           { return history; }
    public Formalization         getFinalBest()         { return finalBest; }
    public SolverResult          getFinalResult()       { return finalResult; }
    public TerminationReason     getTerminationReason() { return terminationReason; }
    public int                   getIterations()        { return iterations; }
    public int                   getTotalReverts()      { return totalReverts; }
    public int                   getGeneratorCalls()    { return generatorCalls; }
    public long                  getWallTimeMs()        { return wallTimeMs; }
    /** Generator failure message; set only for GENERATOR_UNREACHABLE. */
    public String                getFatalError()        { return fatalError; }

    /** The final formalization executed on the solver (non-Error answer). */
    @JsonIgnore
    public boolean isExecuted() {
        return finalResult != null && finalResult.isExecuted();
    }

    @Override
    public String toString() {
        return "RefinementTrace{" + statementId
                + ", reason=" + terminationReason
                + ", iterations=" + iterations
                + ", answer=" + finalResult + "}";
    }
}
