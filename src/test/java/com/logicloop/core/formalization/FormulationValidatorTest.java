package com.logicloop.core.formalization;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FormulationValidatorTest {

    private final FormulationValidator validator = new FormulationValidator();

    @Test
    void testPredicateExtraction() {
        ValidationReport report = validator.validate(
                List.of("ForAll(x, Implies(Human(x), Mortal(x)))", "Human(socrates)"),
                "Mortal(socrates)");

        assertTrue(report.isValid());
        assertEquals(2, report.getNumPredicates());
        assertEquals("ok", report.summary());
    }

    @Test
    void testQuantifierHandling() {
        ValidationReport report = validator.validate(
                List.of("∀x (Cat(x) → Animal(x))", "∃y Cat(y)"),
                "∃z Animal(z)");

        assertTrue(report.isValid(), report::summary);
    }

    @Test
    void testEmptyPremisesAreInvalid() {
        ValidationReport report = validator.validate(List.of(), "Q(a)");

        assertFalse(report.isValid());
        assertTrue(report.getIssues().contains("premises are empty"));
    }

    @Test
    void testConclusionMustParse() {
        ValidationReport report = validator.validate(List.of("P(a)"), "Implies(P(a),");

        assertFalse(report.isValid());
        assertTrue(report.getIssues().get(0).startsWith("conclusion syntax error"));
    }

    @Test
    void testEveryPremiseIsChecked() {
        ValidationReport report = validator.validate(List.of("P(a)", "P(a) ∧", "Q(b) ∨"), "P(a)");

        assertEquals(2, report.getIssues().size());
        assertTrue(report.getIssues().get(0).startsWith("premise 2"));
        assertTrue(report.getIssues().get(1).startsWith("premise 3"));
    }

    @Test
    void testDeeplyNestedPremiseIsAnIssueNotACrash() {
        String nested = "Not(".repeat(20_000) + "P(a)" + ")".repeat(20_000);

        ValidationReport report = validator.validate(List.of(nested), "Q(a)");

        assertFalse(report.isValid());
        assertTrue(report.getIssues().get(0).startsWith("premise 1 syntax error"));
        assertTrue(report.getIssues().get(0).contains("nesting exceeds"));
    }

    @Test
    void testDeeplyNestedConclusionIsAnIssueNotACrash() {
        ValidationReport report = validator.validate(List.of("P(a)"), "¬".repeat(20_000) + "P(a)");

        assertFalse(report.isValid());
        assertTrue(report.getIssues().get(0).startsWith("conclusion syntax error"));
    }

    @Test
    void testConclusionPredicatesNeedNotAppearInPremises() {
        ValidationReport report = validator.validate(List.of("P(a)"), "Unrelated(b)");

        assertTrue(report.isValid());
        assertEquals(2, report.getNumPredicates());
    }

    @Test
    void testWellFormedGate() {
        Formalization good = Formalization.of(Map.of(), List.of("P(a)"), "P(a)");
        Formalization bad  = Formalization.of(Map.of(), List.of("P(a) ->"), "P(a)");

        assertTrue(validator.isWellFormed(good));
        assertFalse(validator.isWellFormed(bad));
        assertFalse(validator.isWellFormed(Formalization.failed("Malformed payload: no JSON object found")));
        assertFalse(validator.isWellFormed(Formalization.of(Map.of(), List.of(), "P(a)")));
    }
}
