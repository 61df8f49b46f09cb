package com.logicloop.evaluation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One dataset entry: a natural-language statement with its expected label.
 *
 * Datasets either carry the full "statement", or a "context" plus a
 * "question" which are joined into one statement.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Problem {

    private final String id;
    private final String statement;
    private final Label  label;

    public Problem(String id, String statement, Label label) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("problem id must not be blank");
        }
        if (statement == null || statement.isBlank()) {
            throw new IllegalArgumentException("problem " + id + " has no statement");
        }
        this.id        = id;
        this.statement = statement;
        this.label     = label;
    }

    @JsonCreator
    public static Problem fromJson(
            @JsonProperty("id")        String id,
            @JsonProperty("statement") String statement,
            @JsonProperty("context")   String context,
            @JsonProperty("question")  String question,
            @JsonProperty("label")     Label  label
    ) {
        String text = statement;
        if (text == null || text.isBlank()) {
            text = join(context, question);
        }
        return new Problem(id, text, label);
    }

    private static String join(String context, String question) {
        if (context == null || context.isBlank()) return question;
        if (question == null || question.isBlank()) return context;
        return context.strip() + "\n" + question.strip();
    }

    public String getId()        { return id; }
    public String getStatement() { return statement; }
    /** Expected label; null when the dataset is unlabelled. */
    public Label  getLabel()     { return label; }

    @Override
    public String toString() {
        return "Problem{" + id + ", label=" + label + "}";
    }
}
