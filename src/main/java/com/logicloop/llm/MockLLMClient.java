package com.logicloop.llm;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Deterministic stand-in for dry runs and the Spring context test.
 *
 * Formalizer and refiner get the classic Socrates syllogism; the judge always
 * prefers the new candidate.
 */
@Component
@Profile("mock")
public class MockLLMClient implements LLMClient {

    static final String SYLLOGISM = """
            {
              "predicates": { "Human(x)": "x is human", "Mortal(x)": "x is mortal" },
              "premises": [ "ForAll(x, Implies(Human(x), Mortal(x)))", "Human(socrates)" ],
              "conclusion": "Mortal(socrates)"
            }
            """;

    @Override
    public String generateWithRole(GeneratorRole role, String userPrompt, double temperature) {
        return switch (role) {
            case FORMALIZER, REFINER -> SYLLOGISM;
            case JUDGE -> "Candidate B keeps the universal premise intact.\nAnswer: B";
        };
    }
}
