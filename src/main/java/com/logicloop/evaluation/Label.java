package com.logicloop.evaluation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.logicloop.core.solver.SolverAnswer;

import java.util.Locale;

/**
 * Ground-truth / predicted label of a problem.
 */
public enum Label {
    TRUE("True"),
    FALSE("False"),
    UNCERTAIN("Uncertain");

    private final String text;

    Label(String text) {
        this.text = text;
    }

    @JsonValue
    public String getText() {
        return text;
    }

    /**
     * Accepts True/False/Uncertain in any case, plus "Unknown" for UNCERTAIN.
     */
    @JsonCreator
    public static Label fromText(String value) {
        if (value == null) {
            throw new IllegalArgumentException("label must not be null");
        }
        return switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "true", "yes"                   -> TRUE;
            case "false", "no"                   -> FALSE;
            case "uncertain", "unknown"          -> UNCERTAIN;
            default -> throw new IllegalArgumentException("Unknown label: " + value);
        };
    }

    /** Proved → TRUE, Disproved → FALSE, Unknown → UNCERTAIN; Error has no label (null). */
    public static Label fromAnswer(SolverAnswer answer) {
        if (answer == null) return null;
        return switch (answer) {
            case PROVED    -> TRUE;
            case DISPROVED -> FALSE;
            case UNKNOWN   -> UNCERTAIN;
            case ERROR     -> null;
        };
    }

    @Override
    public String toString() {
        return text;
    }
}
