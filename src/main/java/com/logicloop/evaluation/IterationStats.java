package com.logicloop.evaluation;

/**
 * Backtracking statistics for one iteration index across all sessions.
 */
public final class IterationStats {

    private final int iteration;
    private final int decisions;
    private final int reverts;

    public IterationStats(int iteration, int decisions, int reverts) {
        this.iteration = iteration;
        this.decisions = decisions;
        this.reverts   = reverts;
    }

    public int getIteration() { return iteration; }
    /** Sessions that recorded this iteration. */
    public int getDecisions() { return decisions; }
    public int getReverts()   { return reverts; }

    public double getRevertFraction() {
        return decisions == 0 ? 0.0 : (double) reverts / decisions;
    }

    @Override
    public String toString() {
        return String.format("iter %d: %d/%d reverted (%.2f)", iteration, reverts, decisions, getRevertFraction());
    }
}
