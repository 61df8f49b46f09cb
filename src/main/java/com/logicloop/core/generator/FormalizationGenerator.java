package com.logicloop.core.generator;

import com.logicloop.core.formalization.Formalization;

import java.util.List;

/**
 * Generator boundary consumed by the refinement loop.
 *
 * Payloads are raw structured text; the loop parses them itself, so a
 * generator never has to produce well-formed output. Every method throws
 * GeneratorUnavailableException when the generator cannot be called.
 */
public interface FormalizationGenerator {

    /** Initial, non-refined formalization of the statement. */
    String formalize(String statement);

    /**
     * Alternative candidates for the current best.
     *
     * @param feedback classified solver/validator error or comparison reasoning
     *                 from the previous iteration; null when there is none
     * @param count    number of candidates wanted (the loop's fan-out)
     */
    List<String> propose(String statement, Formalization currentBest, String feedback, int count);

    /** Which of the two is semantically closer to the statement: A (current) or B (candidate). */
    ComparisonVerdict compare(String statement, Formalization candidateA, Formalization candidateB);
}
