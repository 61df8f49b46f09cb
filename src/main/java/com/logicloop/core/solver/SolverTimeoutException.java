package com.logicloop.core.solver;

/**
 * Thrown by a backend that enforces its own time budget and ran out of it.
 * SolverAdapter maps it to an Error result with timeout=true.
 */
public class SolverTimeoutException extends RuntimeException {

    public SolverTimeoutException(String message) {
        super(message);
    }
}
