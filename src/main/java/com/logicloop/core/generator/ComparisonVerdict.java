package com.logicloop.core.generator;

/**
 * Pairwise judgement between current best (A) and new candidate (B).
 */
public enum ComparisonVerdict {
    A,
    B;

    public Decision toDecision() {
        return this == B ? Decision.IMPROVED : Decision.REVERT;
    }
}
