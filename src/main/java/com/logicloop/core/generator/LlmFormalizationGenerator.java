package com.logicloop.core.generator;

import com.logicloop.core.formalization.Formalization;
import com.logicloop.llm.GeneratorRole;
import com.logicloop.llm.LLMClient;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * LlmFormalizationGenerator: FormalizationGenerator over an LLMClient.
 *
 * Every prompt carries the original statement, so refinement and judging are
 * done against the meaning of the problem and not only against the formulas.
 *
 * propose() issues one call per candidate; the temperature is nudged per
 * candidate so the alternatives differ.
 *
 * Any exception from the client becomes GeneratorUnavailableException.
 */
@Component
public class LlmFormalizationGenerator implements FormalizationGenerator {

    private static final Logger log = LoggerFactory.getLogger(LlmFormalizationGenerator.class);

    private static final int     MAX_PROMPT_CHARS       = 14000;
    private static final int     MAX_FEEDBACK_CHARS     = 1500;
    private static final double  CANDIDATE_TEMPERATURE_STEP = 0.1;

    private static final Pattern ANSWER_LINE  = Pattern.compile("answer\\s*[:=]?\\s*\\**\\s*([AB])\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern LONE_LETTER  = Pattern.compile("\\b([AB])\\b");

    private final LLMClient llmClient;

    public LlmFormalizationGenerator(LLMClient llmClient) {
        this.llmClient = llmClient;
    }

    // =========================================================================
    // FormalizationGenerator
    // =========================================================================

    @Override
    public String formalize(String statement) {
        String prompt = """
                Problem:
                %s

                Translate the problem into first-order logic.
                The last question or claim of the problem is the conclusion; everything else is premises.
                """.formatted(statement);

        return call(GeneratorRole.FORMALIZER, prompt, llmClient.getTemperatureForRole(GeneratorRole.FORMALIZER));
    }

    @Override
    public List<String> propose(String statement, Formalization currentBest, String feedback, int count) {
        String prompt = buildRefinementPrompt(statement, currentBest, feedback);
        double base   = llmClient.getTemperatureForRole(GeneratorRole.REFINER);

        List<String> payloads = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            double temperature = Math.min(1.0, base + i * CANDIDATE_TEMPERATURE_STEP);
            payloads.add(call(GeneratorRole.REFINER, prompt, temperature));
        }
        log.info("[Generator] Proposed {} candidate payload(s)", payloads.size());
        return payloads;
    }

    @Override
    public ComparisonVerdict compare(String statement, Formalization candidateA, Formalization candidateB) {
        String prompt = """
                Problem:
                %s

                Formalization A:
                %s
                Formalization B:
                %s
                Which formalization captures the meaning of the problem more faithfully?
                A syntactically cleaner encoding that changes the meaning is worse.
                """.formatted(statement, candidateA.toPromptSection(), candidateB.toPromptSection());

        String answer = call(GeneratorRole.JUDGE, budget(prompt), llmClient.getTemperatureForRole(GeneratorRole.JUDGE));
        ComparisonVerdict verdict = parseVerdict(answer);
        log.info("[Generator] Judge verdict: {}", verdict);
        return verdict;
    }

    // =========================================================================
    // Prompt builders
    // =========================================================================

    String buildRefinementPrompt(String statement, Formalization currentBest, String feedback) {
        String trimmedFeedback = feedback;
        if (trimmedFeedback != null && trimmedFeedback.length() > MAX_FEEDBACK_CHARS) {
            trimmedFeedback = trimmedFeedback.substring(0, MAX_FEEDBACK_CHARS) + "\n[... truncated ...]";
        }

        String prompt = """
                Problem:
                %s

                Current formalization:
                %s
                Feedback from the last attempt:
                %s

                Produce an improved formalization of the SAME problem.
                Do not drop premises that the problem states; do not add facts it does not state.
                """.formatted(
                statement,
                currentBest != null ? currentBest.toPromptSection() : "  (none)\n",
                trimmedFeedback != null && !trimmedFeedback.isBlank()
                        ? trimmedFeedback
                        : "none; the solver could not reach a definite answer"
        );

        return budget(prompt);
    }

    private String budget(String prompt) {
        if (prompt.length() > MAX_PROMPT_CHARS) {
            log.warn("[Generator] Prompt exceeded budget ({} chars). Trimming.", prompt.length());
            return prompt.substring(0, MAX_PROMPT_CHARS);
        }
        return prompt;
    }

    // =========================================================================
    // Verdict parsing
    // =========================================================================

    /**
     * "Answer: B" wins; otherwise the last standalone A/B token; otherwise A
     * (keep the current best when the judge is unreadable).
     */
    static ComparisonVerdict parseVerdict(String text) {
        if (text == null || text.isBlank()) return ComparisonVerdict.A;

        Matcher answer = ANSWER_LINE.matcher(text);
        String found = null;
        while (answer.find()) found = answer.group(1);

        if (found == null) {
            Matcher lone = LONE_LETTER.matcher(text);
            while (lone.find()) found = lone.group(1);
        }

        return "B".equalsIgnoreCase(found) ? ComparisonVerdict.B : ComparisonVerdict.A;
    }

    // =========================================================================
    // Transport
    // =========================================================================

    private String call(GeneratorRole role, String prompt, double temperature) {
        try {
            String text = llmClient.generateWithRole(role, prompt, temperature);
            return text != null ? text : "";
        } catch (RuntimeException e) {
            log.error("[Generator] {} call failed: {}", role, e.getMessage());
            throw new GeneratorUnavailableException(role + " call failed: " + e.getMessage(), e);
        }
    }
}
