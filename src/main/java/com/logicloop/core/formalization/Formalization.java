package com.logicloop.core.formalization;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Formalization: one candidate logical encoding of a natural-language statement.
 *
 * Either WELL-FORMED (no formalizationError, premises non-empty, conclusion
 * non-blank) or FAILED (formalizationError set, other fields possibly empty).
 * A failed Formalization is never sent to a solver.
 *
 * STATIC FACTORIES:
 *   of(predicates, premises, conclusion) : candidate built from parsed fields
 *   failed(error)                        : deserialization/construction failure
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Formalization {

    private final Map<String, String> predicates;   // signature → natural-language gloss
    private final List<String>        premises;
    private final String              conclusion;
    private final String              formalizationError;

    private Formalization(Map<String, String> predicates, List<String> premises,
                          String conclusion, String formalizationError) {
        this.predicates         = predicates != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(predicates))
                : Map.of();
        this.premises           = premises != null ? List.copyOf(premises) : List.of();
        this.conclusion         = conclusion != null ? conclusion : "";
        this.formalizationError = formalizationError;
    }

    public static Formalization of(Map<String, String> predicates, List<String> premises, String conclusion) {
        return new Formalization(predicates, premises, conclusion, null);
    }

    public static Formalization failed(String error) {
        String message = error != null && !error.isBlank() ? error : "formalization failed";
        return new Formalization(Map.of(), List.of(), "", message);
    }

    @JsonProperty("predicates")
    public Map<String, String> getPredicates() { return predicates; }

    @JsonProperty("premises")
    public List<String> getPremises() { return premises; }

    @JsonProperty("conclusion")
    public String getConclusion() { return conclusion; }

    @JsonProperty("formalization_error")
    public String getFormalizationError() { return formalizationError; }

    @JsonIgnore
    public boolean isFailed() {
        return formalizationError != null;
    }

    /** Structural shape only; syntax is FormulationValidator's job. */
    @JsonIgnore
    public boolean isWellFormed() {
        return formalizationError == null && !premises.isEmpty() && !conclusion.isBlank();
    }

    /**
     * Plain-text rendering for prompts. Plain text (not JSON) keeps nested
     * quoting out of the generator's context.
     */
    public String toPromptSection() {
        if (isFailed()) {
            return "  (failed formalization: " + formalizationError + ")\n";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("  Predicates:\n");
        predicates.forEach((sig, gloss) -> sb.append("    ").append(sig).append(" : ").append(gloss).append("\n"));
        sb.append("  Premises:\n");
        for (int i = 0; i < premises.size(); i++) {
            sb.append("    ").append(i + 1).append(". ").append(premises.get(i)).append("\n");
        }
        sb.append("  Conclusion: ").append(conclusion).append("\n");
        return sb.toString();
    }

    @Override
    public String toString() {
        if (isFailed()) return "Formalization{failed='" + formalizationError + "'}";
        return "Formalization{premises=" + premises.size() + ", conclusion='" + conclusion + "'}";
    }
}
