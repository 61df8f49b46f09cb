package com.logicloop.llm;

/**
 * Which part of the refinement loop a language-model call serves.
 * Drives system prompt and sampling temperature in the LLMClient.
 */
public enum GeneratorRole {
    /** Initial natural language → logic translation. */
    FORMALIZER,
    /** Alternative candidates given the current best and feedback. */
    REFINER,
    /** Pairwise semantic comparison of two formalizations. */
    JUDGE
}
