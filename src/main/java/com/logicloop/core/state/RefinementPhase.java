package com.logicloop.core.state;

/**
 * Phase graph of one refinement session.
 *
 * INIT → PROPOSE → VALIDATE → SOLVE → COMPARE → {ACCEPT, REVERT} → PROPOSE | TERMINATE
 *
 * INIT      : initial formalization is generated and solved once; it becomes
 *             the first current best.
 * PROPOSE   : N candidates are requested from the generator with the
 *             statement, the current best and last iteration's feedback.
 * VALIDATE  : each candidate is parsed and structurally validated; invalid
 *             candidates drop out of this iteration.
 * SOLVE     : each valid candidate is sent to the solver adapter. A decisive
 *             answer skips COMPARE and is accepted at once.
 * COMPARE   : executed candidates are judged against the current best,
 *             one at a time, with the statement as context.
 * ACCEPT    : candidate replaces the current best, revert streak resets.
 * REVERT    : current best is kept, revert streak grows by one. Also entered
 *             without COMPARE when no candidate survived VALIDATE / SOLVE.
 * TERMINATE : decisive best, revert streak at threshold, iteration cap, or
 *             generator unreachable.
 */
public enum RefinementPhase {
    INIT,
    PROPOSE,
    VALIDATE,
    SOLVE,
    COMPARE,
    ACCEPT,
    REVERT,
    TERMINATE
}
