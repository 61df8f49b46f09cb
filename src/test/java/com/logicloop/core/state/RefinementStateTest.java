package com.logicloop.core.state;

import com.logicloop.core.formalization.Formalization;
import com.logicloop.core.generator.Decision;
import com.logicloop.core.solver.SolverResult;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RefinementStateTest {

    private final Formalization initial   = Formalization.of(Map.of(), List.of("Human(socrates)"), "Mortal(socrates)");
    private final Formalization candidate = Formalization.of(Map.of(),
            List.of("ForAll(x, Implies(Human(x), Mortal(x)))", "Human(socrates)"), "Mortal(socrates)");

    private RefinementState newState() {
        return new RefinementState("Is Socrates mortal?", initial, SolverResult.unknown());
    }

    @Test
    void testRevertKeepsBestAndCountsStreak() {
        RefinementState state = newState();

        IterationRecord first  = state.revert(IterationRecord.builder(1).reasoning("judge preferred A"));
        IterationRecord second = state.revert(IterationRecord.builder(2).reasoning("judge preferred A again"));

        assertSame(initial, state.getCurrentBest());
        assertEquals(2, state.getConsecutiveReverts());
        assertEquals(2, state.getTotalReverts());
        assertEquals(1, first.getConsecutiveReverts());
        assertEquals(2, second.getConsecutiveReverts());
        assertNull(second.getAccepted());
        assertTrue(second.isRevert());
    }

    @Test
    void testAcceptResetsStreakAndReplacesBest() {
        RefinementState state = newState();
        state.revert(IterationRecord.builder(1).reasoning("no"));

        IterationRecord record = state.accept(candidate, SolverResult.proved(),
                IterationRecord.builder(2).reasoning("better"));

        assertSame(candidate, state.getCurrentBest());
        assertEquals(0, state.getConsecutiveReverts());
        assertEquals(1, state.getTotalReverts());
        assertEquals(Decision.IMPROVED, record.getDecision());
        assertSame(candidate, record.getAccepted());
        assertTrue(record.getBestResult().isDecisive());
    }

    @Test
    void testFeedbackFollowsLastReasoning() {
        RefinementState state = newState();
        state.seedFeedback("syntax error (z3): unexpected token");
        assertEquals("syntax error (z3): unexpected token", state.getFeedback());

        state.revert(IterationRecord.builder(1).reasoning("All candidates failed validation"));
        assertEquals("All candidates failed validation", state.getFeedback());

        assertThrows(IllegalStateException.class, () -> state.seedFeedback("too late"));
    }

    @Test
    void testOutOfOrderIterationIsRejected() {
        RefinementState state = newState();
        state.revert(IterationRecord.builder(1));

        assertThrows(IllegalStateException.class, () -> state.revert(IterationRecord.builder(3)));
        assertEquals(1, state.getIteration());
        assertEquals(2, state.getNextIteration());
        assertEquals(1, state.getHistory().size());
    }

    @Test
    void testHistoryIsReadOnly() {
        RefinementState state = newState();
        state.revert(IterationRecord.builder(1));

        assertThrows(UnsupportedOperationException.class, () -> state.getHistory().clear());
    }

    @Test
    void testMissingInitialResultIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RefinementState("s", initial, null));
    }

    @Test
    void testGeneratorCallsAccumulate() {
        RefinementState state = newState();
        state.addGeneratorCalls(1);
        state.addGeneratorCalls(3);
        assertEquals(4, state.getGeneratorCalls());
    }

    @Test
    void testImprovedRecordNeedsAcceptedCandidate() {
        IterationRecord.Builder builder = IterationRecord.builder(1).decision(Decision.IMPROVED);
        assertThrows(IllegalStateException.class, builder::build);
        assertThrows(IllegalStateException.class, () -> IterationRecord.builder(1).build());
    }

    @Test
    void testCandidateFlags() {
        CandidateRecord invalid = new CandidateRecord(1, Formalization.failed("Malformed payload: empty response"),
                List.of("Malformed payload: empty response"), null, "malformed payload (z3)", null);
        CandidateRecord errored = new CandidateRecord(2, candidate, List.of(),
                SolverResult.error("Arity mismatch"), "arity mismatch (z3)", null);
        CandidateRecord proved  = new CandidateRecord(3, candidate, List.of(), SolverResult.proved(), null, null);

        assertFalse(invalid.isValid());
        assertFalse(invalid.isExecuted());
        assertTrue(errored.isValid());
        assertFalse(errored.isExecuted());
        assertTrue(proved.isExecuted());
        assertTrue(proved.isDecisive());
    }
}
