package com.logicloop.evaluation;

import com.logicloop.orchestrator.RefinementController;
import com.logicloop.orchestrator.dto.RefinementTrace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs refinement sessions for many problems on a fixed worker pool.
 *
 * Sessions share nothing mutable: each run() call on the controller builds
 * its own state and only reads the shared configuration. Outcomes are
 * returned in input order.
 */
@Component
public class BatchRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    private final RefinementController controller;
    private final Evaluator            evaluator;
    private final TraceWriter          traceWriter;
    private final int                  workers;

    public BatchRunner(
            RefinementController controller,
            Evaluator            evaluator,
            TraceWriter          traceWriter,
            @Value("${logicloop.evaluation.workers:4}") int workers
    ) {
        if (workers < 1) {
            throw new IllegalArgumentException("logicloop.evaluation.workers must be >= 1, got " + workers);
        }
        this.controller  = controller;
        this.evaluator   = evaluator;
        this.traceWriter = traceWriter;
        this.workers     = workers;
    }

    public List<ProblemOutcome> runAll(List<Problem> problems) {
        log.info("[Batch] Running {} problem(s) on {} worker(s)", problems.size(), workers);

        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            List<Future<RefinementTrace>> futures = new ArrayList<>(problems.size());
            for (Problem problem : problems) {
                futures.add(pool.submit(() -> controller.run(problem.getId(), problem.getStatement())));
            }

            List<ProblemOutcome> outcomes = new ArrayList<>(problems.size());
            for (int i = 0; i < problems.size(); i++) {
                Problem         problem = problems.get(i);
                RefinementTrace trace   = await(futures.get(i), problem);
                ProblemOutcome  outcome = new ProblemOutcome(problem, trace);
                outcomes.add(outcome);

                log.info("[Batch] {} → {} (expected {}, {})", problem.getId(), outcome.getPredicted(),
                        problem.getLabel(), outcome.isCorrect() ? "correct" : "wrong");
                persist(trace);
            }
            return outcomes;

        } finally {
            pool.shutdownNow();
        }
    }

    /** runAll + evaluate + write the summary when an output directory is set. */
    public EvaluationReport runAndEvaluate(List<Problem> problems) {
        EvaluationReport report = evaluator.evaluate(runAll(problems));
        if (traceWriter.isEnabled()) {
            try {
                log.info("[Batch] Summary written to {}", traceWriter.writeReport(report));
            } catch (IOException e) {
                log.error("[Batch] Failed to write evaluation summary", e);
            }
        }
        return report;
    }

    private RefinementTrace await(Future<RefinementTrace> future, Problem problem) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalStateException("Session for " + problem.getId() + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + problem.getId(), e);
        }
    }

    private void persist(RefinementTrace trace) {
        if (!traceWriter.isEnabled()) return;
        try {
            traceWriter.writeTrace(trace);
        } catch (IOException e) {
            log.error("[Batch] Failed to write trace for {}", trace.getStatementId(), e);
        }
    }
}
