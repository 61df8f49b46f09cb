package com.logicloop.core.solver;

import java.time.Duration;
import java.util.List;

/**
 * Capability interface: one implementation per reasoning backend.
 *
 * Implementations may throw on unexpected failures; SolverAdapter is the
 * boundary that turns every exception into an Error SolverResult.
 */
public interface EntailmentSolver {

    SolverBackend backend();

    /**
     * Decide whether the premises entail the conclusion.
     *
     * @param premises   non-empty formula strings (the adapter rejects empty lists)
     * @param conclusion non-blank formula string
     * @param timeout    budget the backend may use for its own limits
     */
    SolverResult solve(List<String> premises, String conclusion, Duration timeout);
}
