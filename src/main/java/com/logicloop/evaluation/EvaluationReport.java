package com.logicloop.evaluation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate metrics over a batch of sessions.
 *
 *   accuracy          = correct / total
 *   executionRate     = executed / total            (Er)
 *   executionAccuracy = correct / executed          (Ea, 0 when nothing executed)
 */
public final class EvaluationReport {

    private final int                  total;
    private final int                  executed;
    private final int                  correct;
    private final List<IterationStats> backtracking;
    private final Map<String, Integer> terminationCounts;
    private final double               averageIterations;
    private final double               averageGeneratorCalls;

    public EvaluationReport(int total, int executed, int correct,
                            List<IterationStats> backtracking,
                            Map<String, Integer> terminationCounts,
                            double averageIterations,
                            double averageGeneratorCalls) {
        this.total                 = total;
        this.executed              = executed;
        this.correct               = correct;
        this.backtracking          = List.copyOf(backtracking);
        this.terminationCounts     = Collections.unmodifiableMap(new LinkedHashMap<>(terminationCounts));
        this.averageIterations     = averageIterations;
        this.averageGeneratorCalls = averageGeneratorCalls;
    }

    public int getTotal()    { return total; }
    public int getExecuted() { return executed; }
    public int getCorrect()  { return correct; }

    public double getAccuracy() {
        return total == 0 ? 0.0 : (double) correct / total;
    }

    public double getExecutionRate() {
        return total == 0 ? 0.0 : (double) executed / total;
    }

    public double getExecutionAccuracy() {
        return executed == 0 ? 0.0 : (double) correct / executed;
    }

    public List<IterationStats> getBacktracking()          { return backtracking; }
    public Map<String, Integer> getTerminationCounts()     { return terminationCounts; }
    public double               getAverageIterations()     { return averageIterations; }
    public double               getAverageGeneratorCalls() { return averageGeneratorCalls; }

    @Override
    public String toString() {
        return String.format(
                "EvaluationReport{total=%d, accuracy=%.3f, Er=%.3f, Ea=%.3f, avgIterations=%.2f, avgCalls=%.2f, terminations=%s}",
                total, getAccuracy(), getExecutionRate(), getExecutionAccuracy(),
                averageIterations, averageGeneratorCalls, terminationCounts);
    }
}
