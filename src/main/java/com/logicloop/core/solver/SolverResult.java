package com.logicloop.core.solver;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * SolverResult: immutable outcome of one solver invocation.
 *
 * INVARIANTS (enforced by the constructor):
 *   answer == ERROR  ⇔  error is non-blank
 *   timeout == true  ⇒  answer ∈ {UNKNOWN, ERROR}
 *
 * Construct via the static factories.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SolverResult {

    private final SolverAnswer answer;
    private final String       error;
    private final boolean      timeout;

    @JsonCreator
    public SolverResult(
            @JsonProperty("answer")  SolverAnswer answer,
            @JsonProperty("error")   String       error,
            @JsonProperty("timeout") boolean      timeout
    ) {
        if (answer == null) {
            throw new IllegalArgumentException("answer must not be null");
        }
        boolean hasError = error != null && !error.isBlank();
        if ((answer == SolverAnswer.ERROR) != hasError) {
            throw new IllegalArgumentException(
                    "error must be set exactly when answer is Error (answer=" + answer + ")");
        }
        if (timeout && answer != SolverAnswer.UNKNOWN && answer != SolverAnswer.ERROR) {
            throw new IllegalArgumentException("timeout implies Unknown or Error, got " + answer);
        }
        this.answer  = answer;
        this.error   = hasError ? error : null;
        this.timeout = timeout;
    }

    // =========================================================================
    // Static factories
    // =========================================================================

    public static SolverResult proved()    { return new SolverResult(SolverAnswer.PROVED, null, false); }
    public static SolverResult disproved() { return new SolverResult(SolverAnswer.DISPROVED, null, false); }
    public static SolverResult unknown()   { return new SolverResult(SolverAnswer.UNKNOWN, null, false); }

    /** Budget ran out before the backend concluded either way. */
    public static SolverResult timedOut() {
        return new SolverResult(SolverAnswer.UNKNOWN, null, true);
    }

    public static SolverResult error(String message) {
        return new SolverResult(SolverAnswer.ERROR,
                message == null || message.isBlank() ? "unspecified solver error" : message, false);
    }

    /** The backend itself signalled a timeout. */
    public static SolverResult timeoutError(String message) {
        return new SolverResult(SolverAnswer.ERROR,
                message == null || message.isBlank() ? "timeout" : message, true);
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public SolverAnswer getAnswer()  { return answer; }
    public String       getError()   { return error; }
    public boolean      isTimeout()  { return timeout; }

    public boolean isDecisive() { return answer.isDecisive(); }

    /** Ran to a logical answer, i.e. anything but Error. */
    public boolean isExecuted() { return answer != SolverAnswer.ERROR; }

    @Override
    public String toString() {
        return "SolverResult{answer=" + answer
                + (error != null ? ", error='" + error + "'" : "")
                + (timeout ? ", timeout" : "") + "}";
    }
}
