package com.logicloop.core.state;

import com.logicloop.core.formalization.Formalization;
import com.logicloop.core.generator.Decision;
import com.logicloop.core.solver.SolverResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * RefinementState: running memory of one refinement session.
 *
 * Owned by a single controller session and mutated only by it. Created in
 * INIT with the initial formalization as current best, discarded when the
 * session's trace has been built.
 *
 * INVARIANTS:
 *   - iteration starts at 0 and grows by exactly one per recorded iteration
 *   - consecutiveReverts is 0 right after an ACCEPT, +1 after each REVERT
 *   - history is append-only and ordered by iteration
 */
public class RefinementState {

    private static final Logger log = LoggerFactory.getLogger(RefinementState.class);

    private final String statement;

    private Formalization   currentBest;
    private SolverResult    currentBestResult;
    private RefinementPhase phase = RefinementPhase.INIT;

    private int iteration          = 0;
    private int consecutiveReverts = 0;
    private int totalReverts       = 0;
    private int generatorCalls     = 0;

    private String feedback;

    private final List<IterationRecord> history = new ArrayList<>();

    public RefinementState(String statement, Formalization initial, SolverResult initialResult) {
        if (initial == null || initialResult == null) {
            throw new IllegalArgumentException("initial formalization and its result are required");
        }
        this.statement         = statement;
        this.currentBest       = initial;
        this.currentBestResult = initialResult;
    }

    // =========================================================================
    // Phase
    // =========================================================================

    public RefinementPhase getPhase() { return phase; }

    public void setPhase(RefinementPhase next) {
        if (this.phase != next) {
            log.debug("[State] Phase transition: {} → {}", this.phase, next);
            this.phase = next;
        }
    }

    // =========================================================================
    // Decisions
    // =========================================================================

    /**
     * ACCEPT: candidate replaces the current best and the revert streak resets.
     * Returns the record appended to history.
     */
    public IterationRecord accept(Formalization candidate, SolverResult result,
                                  IterationRecord.Builder record) {
        this.currentBest        = candidate;
        this.currentBestResult  = result;
        this.consecutiveReverts = 0;
        return append(record.decision(Decision.IMPROVED).accepted(candidate));
    }

    /** REVERT: current best unchanged, revert streak grows by one. */
    public IterationRecord revert(IterationRecord.Builder record) {
        this.consecutiveReverts++;
        this.totalReverts++;
        return append(record.decision(Decision.REVERT));
    }

    private IterationRecord append(IterationRecord.Builder record) {
        IterationRecord built = record
                .bestResult(currentBestResult)
                .consecutiveReverts(consecutiveReverts)
                .build();

        if (built.getIteration() != iteration + 1) {
            throw new IllegalStateException("Out-of-order iteration record: expected "
                    + (iteration + 1) + " but got " + built.getIteration());
        }
        history.add(built);
        iteration = built.getIteration();
        feedback  = built.getReasoning();
        return built;
    }

    // =========================================================================
    // Counters
    // =========================================================================

    /** Feedback for the first PROPOSE, derived from the INIT solve. */
    public void seedFeedback(String initialFeedback) {
        if (!history.isEmpty()) {
            throw new IllegalStateException("feedback can only be seeded before the first iteration");
        }
        this.feedback = initialFeedback;
    }

    public void addGeneratorCalls(int n) {
        generatorCalls += n;
    }

    // =========================================================================
    // Getters
    // =========================================================================

    public String                getStatement()          { return statement; }
    public Formalization         getCurrentBest()        { return currentBest; }
    public SolverResult          getCurrentBestResult()  { return currentBestResult; }
    public int                   getIteration()          { return iteration; }
    public int                   getNextIteration()      { return iteration + 1; }
    public int                   getConsecutiveReverts() { return consecutiveReverts; }
    public int                   getTotalReverts()       { return totalReverts; }
    public int                   getGeneratorCalls()     { return generatorCalls; }
    /** Reasoning of the last recorded iteration, or the seeded INIT feedback. */
    public String                getFeedback()           { return feedback; }
    public List<IterationRecord> getHistory()            { return Collections.unmodifiableList(history); }
}
