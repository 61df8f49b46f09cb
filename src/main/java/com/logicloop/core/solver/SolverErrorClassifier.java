package com.logicloop.core.solver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * SolverErrorClassifier: turns a raw backend/validator message into one short,
 * actionable diagnostic line for the generator's next attempt.
 *
 * Output shape:  "<keyword> (<backend>): <detail> | hint: <hint>"
 * The keyword is always lower case (e.g. "timeout", "syntax error").
 * Detail is the first line of the raw message, capped at MAX_DETAIL_CHARS.
 *
 * First match wins; timeout is checked before everything else. The timeout
 * rule only looks at how the message starts ("timeout ...", "timed out ...",
 * "Z3 exception: timeout ..."), so a predicate such as Timeout(x) or
 * Cancelled(order) quoted inside a syntax error is not mistaken for one.
 * Results flagged timeout=true are classified as timeouts without looking
 * at the message at all.
 */
@Component
public class SolverErrorClassifier {

    private static final Logger log = LoggerFactory.getLogger(SolverErrorClassifier.class);

    static final int MAX_DETAIL_CHARS = 160;

    private static final Pattern TIMEOUT_PATTERN =
        Pattern.compile("\\s*(?:[\\w-]+ exception:\\s*)?"
                + "(?:timeout|timed[ _-]?out|time[ _-]out|deadline exceeded|cancell?ed)(?![\\w(])",
                Pattern.CASE_INSENSITIVE);

    private static final Pattern SYNTAX_PATTERN =
        Pattern.compile("syntax|parse|unexpected (token|character|end)|expected .* but found|dangling",
                Pattern.CASE_INSENSITIVE);

    private static final Pattern ARITY_PATTERN =
        Pattern.compile("arity|wrong number of arguments|sort mismatch", Pattern.CASE_INSENSITIVE);

    private static final Pattern EMPTY_PREMISES_PATTERN =
        Pattern.compile("no premises|premises (is|are) empty", Pattern.CASE_INSENSITIVE);

    private static final Pattern NOT_IMPLEMENTED_PATTERN =
        Pattern.compile("not implemented|unsupported backend", Pattern.CASE_INSENSITIVE);

    private static final Pattern PAYLOAD_PATTERN =
        Pattern.compile("json|payload|deserializ|missing field", Pattern.CASE_INSENSITIVE);

    public SolverFailureType categorize(String rawMessage) {
        String raw = rawMessage != null ? rawMessage : "";

        if (TIMEOUT_PATTERN.matcher(raw).lookingAt())     return SolverFailureType.TIMEOUT;
        if (NOT_IMPLEMENTED_PATTERN.matcher(raw).find())  return SolverFailureType.NOT_IMPLEMENTED;
        if (EMPTY_PREMISES_PATTERN.matcher(raw).find())   return SolverFailureType.EMPTY_PREMISES;
        if (ARITY_PATTERN.matcher(raw).find())            return SolverFailureType.ARITY_MISMATCH;
        if (PAYLOAD_PATTERN.matcher(raw).find())          return SolverFailureType.MALFORMED_PAYLOAD;
        if (SYNTAX_PATTERN.matcher(raw).find())           return SolverFailureType.SYNTAX_ERROR;
        return SolverFailureType.UNKNOWN;
    }

    public String classify(String rawMessage, SolverBackend backend) {
        return render(categorize(rawMessage), rawMessage, backend);
    }

    /** Diagnostic for a SolverResult; null when the result is not an error or timeout. */
    public String classify(SolverResult result, SolverBackend backend) {
        if (result.isTimeout()) {
            String detail = result.getError() != null ? result.getError() : "no conclusion within budget";
            return render(SolverFailureType.TIMEOUT, detail, backend);
        }
        if (result.getAnswer() == SolverAnswer.ERROR) {
            return classify(result.getError(), backend);
        }
        return null;
    }

    private String render(SolverFailureType type, String rawMessage, SolverBackend backend) {
        String backendName = backend != null ? backend.name().toLowerCase(Locale.ROOT) : "solver";
        String detail = firstLine(rawMessage);

        String diagnostic = detail.isEmpty()
                ? type.getKeyword() + " (" + backendName + ") | hint: " + type.getHint()
                : type.getKeyword() + " (" + backendName + "): " + detail + " | hint: " + type.getHint();

        log.debug("[Classifier] {} → {}", type, diagnostic);
        return diagnostic;
    }

    private static String firstLine(String raw) {
        if (raw == null) return "";
        String trimmed = raw.strip();
        int newline = trimmed.indexOf('\n');
        if (newline >= 0) trimmed = trimmed.substring(0, newline).strip();
        if (trimmed.length() > MAX_DETAIL_CHARS) {
            trimmed = trimmed.substring(0, MAX_DETAIL_CHARS) + "...";
        }
        return trimmed;
    }
}
