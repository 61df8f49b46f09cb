package com.logicloop.core.logic;

/**
 * Raised by FormulaParser when a formula string cannot be parsed.
 *
 * Never escapes the core: FormulationValidator turns it into a validation issue,
 * SolverAdapter turns it into an Error SolverResult.
 */
public class FormulaSyntaxException extends RuntimeException {

    private final int position;

    public FormulaSyntaxException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    /** Zero-based character offset of the offending token, -1 when unknown. */
    public int getPosition() {
        return position;
    }
}
