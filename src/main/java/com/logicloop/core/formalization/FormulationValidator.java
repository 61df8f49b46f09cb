package com.logicloop.core.formalization;

import com.logicloop.core.logic.Formula;
import com.logicloop.core.logic.FormulaParser;
import com.logicloop.core.logic.FormulaSyntaxException;
import com.logicloop.core.logic.PredicateSignature;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * FormulationValidator: structural gate in front of the solver.
 *
 * Rules (all must hold for valid = true):
 *   1. premises non-empty
 *   2. conclusion non-blank and parseable
 *   3. every premise parseable
 * Predicates used only in the conclusion are fine; the solver decides those.
 * Quantifiers (∀ ∃ ForAll Exists) are ordinary syntax here.
 *
 * num_predicates counts distinct name/arity signatures over the parseable formulas.
 */
@Component
public class FormulationValidator {

    private static final Logger log = LoggerFactory.getLogger(FormulationValidator.class);

    public ValidationReport validate(List<String> premises, String conclusion) {

        List<String>            issues     = new ArrayList<>();
        Set<PredicateSignature> signatures = new LinkedHashSet<>();

        if (premises == null || premises.isEmpty()) {
            issues.add("premises are empty");
        } else {
            for (int i = 0; i < premises.size(); i++) {
                String premise = premises.get(i);
                if (premise == null || premise.isBlank()) {
                    issues.add("premise " + (i + 1) + " is blank");
                    continue;
                }
                try {
                    Formula f = FormulaParser.parse(premise);
                    signatures.addAll(f.predicates());
                } catch (FormulaSyntaxException e) {
                    issues.add("premise " + (i + 1) + " syntax error: " + e.getMessage());
                }
            }
        }

        if (conclusion == null || conclusion.isBlank()) {
            issues.add("conclusion is empty");
        } else {
            try {
                signatures.addAll(FormulaParser.parse(conclusion).predicates());
            } catch (FormulaSyntaxException e) {
                issues.add("conclusion syntax error: " + e.getMessage());
            }
        }

        ValidationReport report = new ValidationReport(issues.isEmpty(), signatures.size(), issues);
        if (!report.isValid()) {
            log.info("[Validator] Rejected: {}", report.summary());
        }
        return report;
    }

    public ValidationReport validate(Formalization formalization) {
        if (formalization == null) {
            return new ValidationReport(false, 0, List.of("no formalization"));
        }
        if (formalization.isFailed()) {
            return new ValidationReport(false, 0, List.of(formalization.getFormalizationError()));
        }
        return validate(formalization.getPremises(), formalization.getConclusion());
    }

    /** The gate used before a candidate is offered to the solver. */
    public boolean isWellFormed(Formalization formalization) {
        return formalization != null
                && formalization.isWellFormed()
                && validate(formalization).isValid();
    }
}
