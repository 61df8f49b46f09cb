package com.logicloop.core.solver;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Prover9 backend placeholder.
 *
 * A declared backend that always answers Error with a fixed diagnostic, so
 * callers can tell "backend missing" apart from a genuine logical failure.
 */
@Component
public class UnimplementedSolver implements EntailmentSolver {

    static final String NOT_IMPLEMENTED = "Prover9 backend not implemented";

    @Override
    public SolverBackend backend() {
        return SolverBackend.PROVER9;
    }

    @Override
    public SolverResult solve(List<String> premises, String conclusion, Duration timeout) {
        return SolverResult.error(NOT_IMPLEMENTED);
    }
}
