package com.logicloop.core.solver;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class Z3EntailmentSolverTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final Z3EntailmentSolver solver = new Z3EntailmentSolver();

    @Test
    void testModusPonensIsProved() {
        SolverResult result = solver.solve(
                List.of("P(a)", "Implies(P(a), Q(a))"), "Q(a)", TIMEOUT);

        assertEquals(SolverAnswer.PROVED, result.getAnswer());
        assertFalse(result.isTimeout());
    }

    @Test
    void testSyllogismIsProved() {
        SolverResult result = solver.solve(
                List.of("ForAll(x, Implies(Human(x), Mortal(x)))", "Human(socrates)"),
                "Mortal(socrates)", TIMEOUT);

        assertEquals(SolverAnswer.PROVED, result.getAnswer());
    }

    @Test
    void testSymbolicSyntaxIsProved() {
        SolverResult result = solver.solve(
                List.of("∀x (Bird(x) ∧ ¬Penguin(x) → Flies(x))", "Bird(tweety)", "¬Penguin(tweety)"),
                "Flies(tweety)", TIMEOUT);

        assertEquals(SolverAnswer.PROVED, result.getAnswer());
    }

    @Test
    void testContradictedConclusionIsDisproved() {
        SolverResult result = solver.solve(
                List.of("ForAll(x, Implies(Penguin(x), Not(Flies(x))))", "Penguin(pingu)"),
                "Flies(pingu)", TIMEOUT);

        assertEquals(SolverAnswer.DISPROVED, result.getAnswer());
    }

    @Test
    void testIndependentConclusionIsUnknown() {
        SolverResult result = solver.solve(List.of("Human(socrates)"), "Mortal(socrates)", TIMEOUT);

        assertEquals(SolverAnswer.UNKNOWN, result.getAnswer());
        assertNull(result.getError());
        assertFalse(result.isTimeout());
    }

    @Test
    void testUniversalClaimDoesNotFollowFromOneInstance() {
        SolverResult result = solver.solve(List.of("Flies(tweety)"), "ForAll(x, Flies(x))", TIMEOUT);

        assertEquals(SolverAnswer.UNKNOWN, result.getAnswer());
    }

    @Test
    void testUniversalClaimRefutedByAnonymousCounterexample() {
        // Two different anonymous individuals: one flies, one does not
        SolverResult result = solver.solve(
                List.of("Exists(x, Flies(x))", "Exists(x, Not(Flies(x)))"),
                "ForAll(x, Flies(x))", TIMEOUT);

        assertEquals(SolverAnswer.DISPROVED, result.getAnswer());
    }

    @Test
    void testExistentialPremisesDoNotCollapseIntoOneIndividual() {
        SolverResult result = solver.solve(
                List.of("∃x Cat(x)", "∃x Dog(x)"),
                "∃x (Cat(x) ∧ Dog(x))", TIMEOUT);

        assertEquals(SolverAnswer.UNKNOWN, result.getAnswer());
    }

    @Test
    void testExistentialFromInstanceIsProved() {
        SolverResult result = solver.solve(List.of("Cat(tom)"), "Exists(x, Cat(x))", TIMEOUT);

        assertEquals(SolverAnswer.PROVED, result.getAnswer());
    }

    @Test
    void testEqualityIsUnderstood() {
        SolverResult result = solver.solve(List.of("Wise(hesperus)", "hesperus = phosphorus"),
                "Wise(phosphorus)", TIMEOUT);

        assertEquals(SolverAnswer.PROVED, result.getAnswer());
    }

    @Test
    void testShadowedVariableIsBoundByInnerQuantifier() {
        // The inner Exists rebinds x
        SolverResult result = solver.solve(
                List.of("ForAll(x, Exists(x, P(x)))"),
                "Exists(y, P(y))", TIMEOUT);

        assertEquals(SolverAnswer.PROVED, result.getAnswer());
    }

    @Test
    void testContradictoryPremisesProveAnything() {
        SolverResult result = solver.solve(List.of("P(a)", "Not(P(a))"), "Q(b)", TIMEOUT);

        assertEquals(SolverAnswer.PROVED, result.getAnswer());
    }

    @Test
    void testMalformedFormulaIsError() {
        SolverResult result = solver.solve(List.of("And(P(a), "), "P(a)", TIMEOUT);

        assertEquals(SolverAnswer.ERROR, result.getAnswer());
        assertTrue(result.getError().contains("Syntax error in premise 1"));
    }

    @Test
    void testDeeplyNestedFormulaIsSyntaxError() {
        String nested = "Not(".repeat(20_000) + "P(a)" + ")".repeat(20_000);

        SolverResult result = solver.solve(List.of(nested), "Q(a)", TIMEOUT);

        assertEquals(SolverAnswer.ERROR, result.getAnswer());
        assertTrue(result.getError().contains("nesting exceeds"));
    }

    @Test
    void testArityMismatchIsError() {
        SolverResult result = solver.solve(List.of("Likes(a, b)"), "Likes(a)", TIMEOUT);

        assertEquals(SolverAnswer.ERROR, result.getAnswer());
        assertTrue(result.getError().startsWith("Arity mismatch"));
    }

    @Test
    void testSameQueryGivesSameAnswer() {
        List<String> premises = List.of("ForAll(x, Implies(A(x), B(x)))", "A(k)");

        SolverResult first  = solver.solve(premises, "B(k)", TIMEOUT);
        SolverResult second = solver.solve(premises, "B(k)", TIMEOUT);

        assertEquals(first.getAnswer(), second.getAnswer());
    }
}
