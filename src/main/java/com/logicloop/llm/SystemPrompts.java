package com.logicloop.llm;

/**
 * Role → system prompt. Shared by every LLMClient implementation so the
 * personas stay identical across transports.
 */
final class SystemPrompts {

    private SystemPrompts() {
    }

    static String forRole(GeneratorRole role) {
        return switch (role) {
            case FORMALIZER -> """
                    You translate natural-language reasoning problems into first-order logic.
                    Output ONLY one JSON object with fields:
                      "predicates": object mapping each signature like "Human(x)" to its meaning,
                      "premises":   array of formula strings,
                      "conclusion": formula string.
                    Formula syntax: Pred(a, b), Not(f), And(f, g), Or(f, g), Implies(f, g),
                    Iff(f, g), ForAll(x, f), Exists(x, f), or the symbols ∀ ∃ ¬ ∧ ∨ → ↔.
                    No prose outside the JSON object.
                    """;

            case REFINER -> """
                    You repair first-order logic formalizations.
                    Keep the meaning of the original problem; fix only what the feedback names.
                    Output ONLY one JSON object with "predicates", "premises" and "conclusion".
                    No prose outside the JSON object.
                    """;

            case JUDGE -> """
                    You compare two logic formalizations of the same problem for semantic fidelity.
                    Prefer the one whose premises and conclusion mean what the problem says,
                    even if the other one looks more syntactically polished.
                    Explain briefly, then end with a final line: "Answer: A" or "Answer: B".
                    """;
        };
    }
}
