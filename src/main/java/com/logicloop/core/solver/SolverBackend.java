package com.logicloop.core.solver;

import java.util.Locale;

/**
 * Reasoning backends the SolverAdapter can dispatch to.
 *
 * Z3     : first-order entailment via the Z3 SMT solver (Z3EntailmentSolver).
 *           "sat" is accepted as an alias for configurations that name the
 *           backend by its decision procedure.
 * PROVER9: declared, not implemented; always answers Error.
 */
public enum SolverBackend {
    Z3,
    PROVER9;

    public static SolverBackend fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Solver backend name must not be blank");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("SAT")) return Z3;
        return SolverBackend.valueOf(normalized);
    }
}
