package com.logicloop.core.solver;

/**
 * Classification of solver / formalization failures.
 *
 * Each type carries the lower-case keyword every diagnostic must contain and
 * a repair hint for the next refinement attempt.
 */
public enum SolverFailureType {

    /**
     * Time budget exceeded.
     * Example: "Z3 exception: timeout exceeded after 30000ms"
     */
    TIMEOUT("timeout", "simplify the premises or drop redundant quantifiers"),

    /**
     * A formula does not parse.
     * Example: "Syntax error in premise 2: Unexpected token 'is' at position 5"
     */
    SYNTAX_ERROR("syntax error", "use Pred(args), And/Or/Not/Implies or ∀/∃ with balanced parentheses"),

    /**
     * The same predicate appears with different numbers of arguments.
     */
    ARITY_MISMATCH("arity mismatch", "use every predicate with one fixed number of arguments"),

    /**
     * No premises were given.
     */
    EMPTY_PREMISES("empty premises", "state at least one premise"),

    /**
     * The selected backend exists only as a declaration.
     */
    NOT_IMPLEMENTED("not implemented", "switch to the z3 backend"),

    /**
     * The generator's payload was not a usable formalization.
     */
    MALFORMED_PAYLOAD("malformed payload",
            "return one JSON object with predicates, premises and conclusion"),

    /**
     * Unknown or unclassified error.
     */
    UNKNOWN("solver error", "re-check the formalization for unsupported constructs");

    private final String keyword;
    private final String hint;

    SolverFailureType(String keyword, String hint) {
        this.keyword = keyword;
        this.hint    = hint;
    }

    public String getKeyword() { return keyword; }
    public String getHint()    { return hint; }
}
