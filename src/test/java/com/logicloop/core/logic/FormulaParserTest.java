package com.logicloop.core.logic;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FormulaParserTest {

    @Test
    void testFunctionStyleQuantifier() {
        Formula f = FormulaParser.parse("ForAll(x, Implies(Human(x), Mortal(x)))");

        assertEquals(Formula.Kind.FORALL, f.getKind());
        assertEquals(List.of("x"), f.getVariables());
        assertEquals(Formula.Kind.IMPLIES, f.operand(0).getKind());
    }

    @Test
    void testSymbolicAndFunctionStyleAgree() {
        Formula symbolic = FormulaParser.parse("∀x (Human(x) → Mortal(x))");
        Formula function = FormulaParser.parse("ForAll(x, Implies(Human(x), Mortal(x)))");

        assertEquals(function, symbolic);
    }

    @Test
    void testBracketedVariableList() {
        Formula f = FormulaParser.parse("ForAll([x, y], Implies(Parent(x, y), Older(x, y)))");

        assertEquals(List.of("x", "y"), f.getVariables());
    }

    @Test
    void testSymbolicQuantifierBindsTightly() {
        Formula f = FormulaParser.parse("∀x P(x) → Q(x)");

        assertEquals(Formula.Kind.IMPLIES, f.getKind());
        assertEquals(Formula.Kind.FORALL, f.operand(0).getKind());
    }

    @Test
    void testDotGivesWideScope() {
        Formula f = FormulaParser.parse("all x. P(x) -> Q(x)");

        assertEquals(Formula.Kind.FORALL, f.getKind());
        assertEquals(Formula.Kind.IMPLIES, f.operand(0).getKind());
    }

    @Test
    void testAsciiAliases() {
        Formula ascii    = FormulaParser.parse("P(a) & Q(a) -> R(a)");
        Formula function = FormulaParser.parse("Implies(And(P(a), Q(a)), R(a))");

        assertEquals(function, ascii);
    }

    @Test
    void testAndBindsTighterThanOr() {
        Formula f = FormulaParser.parse("A | B & C");

        assertEquals(Formula.Kind.OR, f.getKind());
        assertEquals(Formula.Kind.ATOM, f.operand(0).getKind());
        assertEquals(Formula.Kind.AND, f.operand(1).getKind());
    }

    @Test
    void testImplicationIsRightAssociative() {
        Formula f = FormulaParser.parse("A -> B -> C");

        assertEquals(Formula.implies(Formula.proposition("A"),
                        Formula.implies(Formula.proposition("B"), Formula.proposition("C"))), f);
    }

    @Test
    void testConjunctionsAreFlattened() {
        Formula f = FormulaParser.parse("P(a) ∧ Q(a) ∧ R(a)");

        assertEquals(Formula.Kind.AND, f.getKind());
        assertEquals(3, f.getOperands().size());
    }

    @Test
    void testNegatedEquality() {
        Formula f = FormulaParser.parse("a != b");

        assertEquals(Formula.Kind.NOT, f.getKind());
        assertEquals(Formula.Kind.EQUALS, f.operand(0).getKind());
    }

    @Test
    void testExistentialWord() {
        Formula f = FormulaParser.parse("exists y (Cat(y) ∧ ¬Black(y))");

        assertEquals(Formula.Kind.EXISTS, f.getKind());
        assertEquals(Formula.Kind.AND, f.operand(0).getKind());
    }

    @Test
    void testRenderingParsesBack() {
        Formula f = FormulaParser.parse(
                "∀x ((Bird(x) ∧ ¬Penguin(x)) → Flies(x)) ↔ ∃y (Bird(y) ⊕ Fish(y))");

        assertEquals(f, FormulaParser.parse(f.toString()));
    }

    @Test
    void testPredicateSignatures() {
        Formula f = FormulaParser.parse("And(P(a), Q(a, b), ForAll(x, P(x)))");

        Set<PredicateSignature> predicates = f.predicates();
        assertEquals(2, predicates.size());
        assertTrue(predicates.contains(new PredicateSignature("Q", 2)));
    }

    @Test
    void testDanglingOperatorIsRejected() {
        FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class,
                () -> FormulaParser.parse("P(a) ∧"));

        assertTrue(e.getMessage().contains("dangling"));
    }

    @Test
    void testWrongArityOfConnective() {
        FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class,
                () -> FormulaParser.parse("Implies(P(a))"));

        assertTrue(e.getMessage().contains("expects 2"));
    }

    @Test
    void testUnbalancedParenthesesAreRejected() {
        assertFalse(FormulaParser.isParseable("And(P(a), Q(a)"));
        assertFalse(FormulaParser.isParseable("P(a))"));
    }

    @Test
    void testFunctionTermsAreRejected() {
        FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class,
                () -> FormulaParser.parse("Loves(mother(a), a)"));

        assertTrue(e.getMessage().contains("Function terms"));
    }

    @Test
    void testUnknownCharacterReportsPosition() {
        FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class,
                () -> FormulaParser.parse("P(a) # Q(a)"));

        assertEquals(5, e.getPosition());
    }

    @Test
    void testConnectiveNameIsOnlyAKeywordOnItsOwn() {
        Formula f = FormulaParser.parse("Andrew(a) ∧ Order(a)");

        assertEquals(Formula.Kind.AND, f.getKind());
        assertEquals("Andrew", f.operand(0).getName());
    }

    @Test
    void testExtraClosingParenthesisNamesTheToken() {
        FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class,
                () -> FormulaParser.parse("P(a))"));

        assertTrue(e.getMessage().startsWith("Unexpected token ')'"));
        assertEquals(4, e.getPosition());
    }

    @Test
    void testModerateNestingIsAccepted() {
        String nested = "Not(".repeat(100) + "P(a)" + ")".repeat(100);

        assertTrue(FormulaParser.isParseable(nested));
        assertTrue(FormulaParser.isParseable("¬".repeat(100) + "P(a)"));
    }

    @Test
    void testDeepFunctionStyleNestingIsRejected() {
        String nested = "Not(".repeat(20_000) + "P(a)" + ")".repeat(20_000);

        FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse(nested));

        assertTrue(e.getMessage().contains("nesting exceeds " + FormulaParser.MAX_DEPTH));
    }

    @Test
    void testDeepPrefixNegationIsRejected() {
        assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse("¬".repeat(20_000) + "P(a)"));
        assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse("∀x ".repeat(20_000) + "P(x)"));
    }

    @Test
    void testLongImplicationChainIsRejected() {
        StringBuilder chain = new StringBuilder("P0");
        for (int i = 1; i < 20_000; i++) chain.append(" → P").append(i);

        assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse(chain.toString()));
    }

    @Test
    void testWideQuantifiersNestAcrossConjunctions() {
        String chained = "∀x. P(x) ∧ ".repeat(20_000) + "Q(a)";

        assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse(chained));
    }

    @Test
    void testLongFlatConjunctionIsAccepted() {
        String flat = String.join(" ∧ ", Collections.nCopies(5_000, "¬P(a)"));

        Formula f = FormulaParser.parse(flat);

        assertEquals(Formula.Kind.AND, f.getKind());
        assertEquals(5_000, f.getOperands().size());
    }

    @Test
    void testBlankFormula() {
        assertFalse(FormulaParser.isParseable("   "));
        assertFalse(FormulaParser.isParseable(null));
    }
}
