package com.logicloop.evaluation;

import com.logicloop.core.solver.SolverAnswer;
import com.logicloop.orchestrator.dto.RefinementTrace;

/**
 * A problem paired with the trace its session produced.
 */
public final class ProblemOutcome {

    private final Problem         problem;
    private final RefinementTrace trace;

    public ProblemOutcome(Problem problem, RefinementTrace trace) {
        if (problem == null || trace == null) {
            throw new IllegalArgumentException("problem and trace are required");
        }
        this.problem = problem;
        this.trace   = trace;
    }

    public Problem         getProblem() { return problem; }
    public RefinementTrace getTrace()   { return trace; }

    public SolverAnswer getAnswer() {
        return trace.getFinalResult().getAnswer();
    }

    /** Null when the final formalization did not execute. */
    public Label getPredicted() {
        return Label.fromAnswer(getAnswer());
    }

    public boolean isExecuted() {
        return trace.isExecuted();
    }

    public boolean isCorrect() {
        Label predicted = getPredicted();
        return predicted != null && predicted == problem.getLabel();
    }
}
