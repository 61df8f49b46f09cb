package com.logicloop.core.state;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.logicloop.core.formalization.Formalization;
import com.logicloop.core.generator.Decision;
import com.logicloop.core.solver.SolverResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable record of one refinement iteration (PROPOSE → ... → ACCEPT | REVERT).
 *
 * Appended to RefinementState.history by the controller once the decision is
 * taken. Never edited afterwards.
 *
 * forced      : REVERT taken without COMPARE (no candidate validated or executed).
 * earlyStop   : ACCEPT taken without COMPARE because a candidate was decisive.
 * accepted    : the candidate that became current best; null on REVERT.
 * reasoning   : why the decision was made; also the feedback for the next PROPOSE.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class IterationRecord {

    private final int                   iteration;
    private final Decision              decision;
    private final boolean               forced;
    private final boolean               earlyStop;
    private final List<CandidateRecord> candidates;
    private final Formalization         accepted;
    private final SolverResult          bestResult;
    private final int                   consecutiveReverts;
    private final String                reasoning;

    private IterationRecord(Builder b) {
        if (b.decision == null) {
            throw new IllegalStateException("IterationRecord requires a decision");
        }
        if (b.decision == Decision.IMPROVED && b.accepted == null) {
            throw new IllegalStateException("IMPROVED record requires the accepted candidate");
        }
        this.iteration          = b.iteration;
        this.decision           = b.decision;
        this.forced             = b.forced;
        this.earlyStop          = b.earlyStop;
        this.candidates         = List.copyOf(b.candidates);
        this.accepted           = b.decision == Decision.IMPROVED ? b.accepted : null;
        this.bestResult         = b.bestResult;
        this.consecutiveReverts = b.consecutiveReverts;
        this.reasoning          = b.reasoning;
    }

    public int                   getIteration()          { return iteration; }
    public Decision              getDecision()           { return decision; }
    public boolean               isForced()              { return forced; }
    public boolean               isEarlyStop()           { return earlyStop; }
    public List<CandidateRecord> getCandidates()         { return candidates; }
    public Formalization         getAccepted()           { return accepted; }
    /** Solver result of the current best after this iteration. */
    public SolverResult          getBestResult()         { return bestResult; }
    /** Revert streak after this iteration. */
    public int                   getConsecutiveReverts() { return consecutiveReverts; }
    public String                getReasoning()          { return reasoning; }

    public boolean isRevert() {
        return decision == Decision.REVERT;
    }

    /** One-line summary for logs. */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append("Iteration ").append(iteration).append(": ").append(decision);
        if (forced)    sb.append(" (forced)");
        if (earlyStop) sb.append(" (decisive)");
        sb.append(", best=").append(bestResult);
        sb.append(", reverts=").append(consecutiveReverts);
        if (reasoning != null && !reasoning.isBlank()) {
            sb.append(", reason=").append(reasoning);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return summary();
    }

    // ----------------------------------------------------------------
    // Builder
    // ----------------------------------------------------------------

    public static Builder builder(int iteration) {
        return new Builder(iteration);
    }

    public static final class Builder {
        private final int                   iteration;
        private Decision                    decision;
        private boolean                     forced;
        private boolean                     earlyStop;
        private final List<CandidateRecord> candidates = new ArrayList<>();
        private Formalization               accepted;
        private SolverResult                bestResult;
        private int                         consecutiveReverts;
        private String                      reasoning;

        private Builder(int iteration) {
            this.iteration = iteration;
        }

        public Builder decision(Decision d)                    { this.decision = d;             return this; }
        public Builder forced(boolean v)                       { this.forced = v;               return this; }
        public Builder earlyStop(boolean v)                    { this.earlyStop = v;            return this; }
        public Builder candidates(List<CandidateRecord> list)  { this.candidates.clear();
                                                                 this.candidates.addAll(list);  return this; }
        public Builder accepted(Formalization f)               { this.accepted = f;             return this; }
        public Builder bestResult(SolverResult r)              { this.bestResult = r;           return this; }
        public Builder consecutiveReverts(int n)               { this.consecutiveReverts = n;   return this; }
        public Builder reasoning(String s)                     { this.reasoning = s;            return this; }

        public IterationRecord build() { return new IterationRecord(this); }
    }
}
