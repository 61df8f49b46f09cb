package com.logicloop.evaluation;

import com.logicloop.core.state.IterationRecord;
import com.logicloop.core.state.TerminationReason;
import com.logicloop.orchestrator.dto.RefinementTrace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Evaluator: turns finished session traces into an EvaluationReport.
 *
 * Execution rate and execution accuracy are kept apart: Ea only counts
 * sessions whose final formalization executed, so a run that executes
 * rarely but correctly is not hidden behind a low overall accuracy.
 *
 * Backtracking statistics are bucketed by iteration index, so a falling
 * revert fraction over later iterations shows the generator using the feedback.
 */
@Component
public class Evaluator {

    private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

    public EvaluationReport evaluate(List<ProblemOutcome> outcomes) {
        int total    = outcomes.size();
        int executed = 0;
        int correct  = 0;
        long iterationSum = 0;
        long callSum      = 0;

        Map<Integer, int[]>  perIteration = new TreeMap<>();
        Map<String, Integer> terminations = new LinkedHashMap<>();
        for (TerminationReason reason : TerminationReason.values()) {
            terminations.put(reason.getLabel(), 0);
        }

        for (ProblemOutcome outcome : outcomes) {
            RefinementTrace trace = outcome.getTrace();

            if (outcome.isExecuted()) executed++;
            if (outcome.isCorrect())  correct++;

            iterationSum += trace.getIterations();
            callSum      += trace.getGeneratorCalls();
            terminations.merge(trace.getTerminationReason().getLabel(), 1, Integer::sum);

            for (IterationRecord record : trace.getHistory()) {
                int[] bucket = perIteration.computeIfAbsent(record.getIteration(), k -> new int[2]);
                bucket[0]++;
                if (record.isRevert()) bucket[1]++;
            }
        }

        List<IterationStats> backtracking = new ArrayList<>();
        perIteration.forEach((iteration, bucket) ->
                backtracking.add(new IterationStats(iteration, bucket[0], bucket[1])));

        EvaluationReport report = new EvaluationReport(
                total, executed, correct, backtracking, terminations,
                total == 0 ? 0.0 : (double) iterationSum / total,
                total == 0 ? 0.0 : (double) callSum / total);

        log.info("[Evaluator] {}", report);
        backtracking.forEach(stats -> log.info("[Evaluator] Backtracking {}", stats));
        return report;
    }
}
