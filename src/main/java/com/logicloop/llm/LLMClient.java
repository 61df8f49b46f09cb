package com.logicloop.llm;

/**
 * LLMClient: single interface for all language-model calls.
 *
 * ONE abstract method: generateWithRole(GeneratorRole, String, double).
 * Implementations own the system prompts; callers only send the task body.
 *
 * Infrastructure failures (server unreachable, non-retryable HTTP errors,
 * malformed transport envelope) are thrown as RuntimeException. The generator
 * layer turns them into GeneratorUnavailableException.
 */
public interface LLMClient {

    /**
     * @param role        Loop role; selects the system prompt.
     * @param userPrompt  Task-specific prompt body.
     * @param temperature Sampling temperature (0.0 = deterministic).
     * @return Raw model text. Never null; empty string on empty model output.
     */
    String generateWithRole(GeneratorRole role, String userPrompt, double temperature);

    /**
     * Canonical per-role sampling temperatures.
     *
     * FORMALIZER 0.0: one faithful translation
     * REFINER    0.7: alternatives must actually differ
     * JUDGE      0.0: deterministic verdict
     */
    default double getTemperatureForRole(GeneratorRole role) {
        return switch (role) {
            case FORMALIZER -> 0.0;
            case REFINER    -> 0.7;
            case JUDGE      -> 0.0;
        };
    }
}
