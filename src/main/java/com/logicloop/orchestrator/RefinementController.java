package com.logicloop.orchestrator;

import com.logicloop.config.RefinementConfig;
import com.logicloop.config.RefinementConfigResolver;
import com.logicloop.core.formalization.Formalization;
import com.logicloop.core.formalization.FormalizationParser;
import com.logicloop.core.formalization.FormulationValidator;
import com.logicloop.core.formalization.ValidationReport;
import com.logicloop.core.generator.ComparisonVerdict;
import com.logicloop.core.generator.Decision;
import com.logicloop.core.generator.FormalizationGenerator;
import com.logicloop.core.generator.GeneratorUnavailableException;
import com.logicloop.core.solver.SolverAdapter;
import com.logicloop.core.solver.SolverBackend;
import com.logicloop.core.solver.SolverErrorClassifier;
import com.logicloop.core.solver.SolverResult;
import com.logicloop.core.state.CandidateRecord;
import com.logicloop.core.state.IterationRecord;
import com.logicloop.core.state.RefinementPhase;
import com.logicloop.core.state.RefinementState;
import com.logicloop.core.state.TerminationReason;
import com.logicloop.orchestrator.dto.RefinementTrace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * RefinementController: top-level controller for the Formalize → Solve → Refine loop.
 *
 * Phase flow:  INIT → PROPOSE → VALIDATE → SOLVE → COMPARE → {ACCEPT, REVERT} → TERMINATE
 *
 * One call to run() is one session. The session owns its RefinementState;
 * the controller itself holds only read-only collaborators and the shared
 * RefinementConfig, so concurrent sessions on one instance are independent.
 *
 * FAILURE CLASSES:
 *   - malformed payload / validation failure → candidate dropped, diagnostic becomes feedback
 *   - solver Error / timeout                 → candidate dropped, classified diagnostic becomes feedback
 *   - generator unreachable or timed out     → session ends with GENERATOR_UNREACHABLE, history kept
 *   - budget exhaustion                      → normal termination with the best-known formalization
 *
 * Termination is checked in one place (checkTermination) after every ACCEPT / REVERT.
 */
@Component
public class RefinementController {

    private static final Logger log = LoggerFactory.getLogger(RefinementController.class);

    private static final int MAX_STATEMENT_ID_CHARS = 30;

    private final FormalizationGenerator generator;
    private final FormalizationParser    parser;
    private final FormulationValidator   validator;
    private final SolverAdapter          solverAdapter;
    private final SolverErrorClassifier  classifier;
    private final RefinementConfig       config;

    private final ExecutorService generatorCalls;
    private final ExecutorService candidateWorkers;

    @Autowired
    public RefinementController(
            FormalizationGenerator   generator,
            FormalizationParser      parser,
            FormulationValidator     validator,
            SolverAdapter            solverAdapter,
            SolverErrorClassifier    classifier,
            RefinementConfigResolver configResolver
    ) {
        this(generator, parser, validator, solverAdapter, classifier, configResolver.getConfig());
    }

    public RefinementController(
            FormalizationGenerator generator,
            FormalizationParser    parser,
            FormulationValidator   validator,
            SolverAdapter          solverAdapter,
            SolverErrorClassifier  classifier,
            RefinementConfig       config
    ) {
        this.generator        = generator;
        this.parser           = parser;
        this.validator        = validator;
        this.solverAdapter    = solverAdapter;
        this.classifier       = classifier;
        this.config           = config;
        this.generatorCalls   = Executors.newCachedThreadPool(new NamedDaemonFactory("generator"));
        this.candidateWorkers = Executors.newCachedThreadPool(new NamedDaemonFactory("candidate"));
    }

    public RefinementConfig getConfig() {
        return config;
    }

    @PreDestroy
    public void shutdown() {
        generatorCalls.shutdownNow();
        candidateWorkers.shutdownNow();
    }

    // =========================================================================
    // MAIN ENTRY POINT
    // =========================================================================

    public RefinementTrace run(String statement) {
        return run(null, statement);
    }

    /**
     * Run one refinement session.
     *
     * @param statementId  id used in logs and the trace; derived from the statement when null
     * @param statement    natural-language problem (context + question)
     * @return             trace with history, final best and termination reason; never null
     */
    public RefinementTrace run(String statementId, String statement) {

        String id        = statementId != null ? statementId : extractStatementId(statement);
        long   startTime = System.currentTimeMillis();

        log.info("========== REFINEMENT START [{}] ==========", id);
        log.info("[Controller] {}", config);

        // ---------------------------------------------------------------------
        // INIT
        // ---------------------------------------------------------------------
        String rawInitial;
        try {
            rawInitial = callGenerator("formalize", () -> generator.formalize(statement));
        } catch (GeneratorUnavailableException e) {
            log.error("[Controller] Generator unreachable during INIT: {}", e.getMessage());
            Formalization none = Formalization.failed("Generator unreachable: " + e.getMessage());
            RefinementState state = new RefinementState(statement, none,
                    SolverResult.error("No formalization: generator unreachable"));
            state.addGeneratorCalls(1);
            return finish(id, state, TerminationReason.GENERATOR_UNREACHABLE, startTime, e.getMessage());
        }

        CandidateRecord initial = evaluate(0, rawInitial);
        RefinementState state   = new RefinementState(statement, initial.getFormalization(), resultOf(initial));
        state.addGeneratorCalls(1);
        state.seedFeedback(initial.getDiagnostic());

        log.info("[Controller] INIT best: {} → {}", initial.getFormalization(), state.getCurrentBestResult());

        if (state.getCurrentBestResult().isDecisive()) {
            log.info("[Controller] Initial formalization is already decisive");
            return finish(id, state, TerminationReason.DECISIVE_SUCCESS, startTime, null);
        }

        // ---------------------------------------------------------------------
        // REFINEMENT LOOP
        // ---------------------------------------------------------------------
        while (true) {

            int iteration = state.getNextIteration();
            log.info("[Controller] ---- Iteration {} (reverts in a row: {}) ----",
                    iteration, state.getConsecutiveReverts());

            try {
                runIteration(iteration, state);
            } catch (GeneratorUnavailableException e) {
                log.error("[Controller] Generator unreachable in iteration {}: {}", iteration, e.getMessage());
                return finish(id, state, TerminationReason.GENERATOR_UNREACHABLE, startTime, e.getMessage());
            }

            TerminationReason reason = checkTermination(state);
            if (reason != null) {
                return finish(id, state, reason, startTime, null);
            }
        }
    }

    // =========================================================================
    // ONE ITERATION: PROPOSE → VALIDATE → SOLVE → COMPARE → ACCEPT | REVERT
    // =========================================================================

    private void runIteration(int iteration, RefinementState state) {

        IterationRecord.Builder record = IterationRecord.builder(iteration);

        // PROPOSE
        state.setPhase(RefinementPhase.PROPOSE);
        Formalization best     = state.getCurrentBest();
        String        feedback = state.getFeedback();
        int           count    = config.getCandidates();

        List<String> payloads = callGenerator("propose",
                () -> generator.propose(state.getStatement(), best, feedback, count));
        state.addGeneratorCalls(count);

        // VALIDATE + SOLVE
        state.setPhase(RefinementPhase.VALIDATE);
        List<CandidateRecord> candidates = evaluateAll(payloads);
        state.setPhase(RefinementPhase.SOLVE);
        candidates.forEach(c -> log.info("[Controller] {}", c));

        CandidateRecord decisive = candidates.stream()
                .filter(CandidateRecord::isDecisive)
                .findFirst()
                .orElse(null);

        if (decisive != null) {
            state.setPhase(RefinementPhase.ACCEPT);
            IterationRecord done = state.accept(decisive.getFormalization(), decisive.getSolverResult(),
                    record.candidates(candidates)
                          .earlyStop(true)
                          .reasoning("Candidate #" + decisive.getIndex() + " solved decisively: "
                                  + decisive.getSolverResult().getAnswer()));
            log.info("[Controller] {}", done.summary());
            return;
        }

        List<CandidateRecord> valid = candidates.stream()
                .filter(CandidateRecord::isValid)
                .collect(Collectors.toList());

        if (valid.isEmpty()) {
            revert(state, record.candidates(candidates).forced(true),
                    "All candidates failed validation: " + joinDiagnostics(candidates, payloads.isEmpty()));
            return;
        }

        List<CandidateRecord> executed = valid.stream()
                .filter(CandidateRecord::isExecuted)
                .collect(Collectors.toList());

        if (executed.isEmpty()) {
            revert(state, record.candidates(candidates).forced(true),
                    "All valid candidates failed in the solver: " + joinDiagnostics(valid, false));
            return;
        }

        // COMPARE: one candidate at a time against the same current best
        state.setPhase(RefinementPhase.COMPARE);
        compareAndDecide(state, record, candidates, executed);
    }

    private void compareAndDecide(RefinementState state, IterationRecord.Builder record,
                                  List<CandidateRecord> candidates, List<CandidateRecord> executed) {

        Formalization best = state.getCurrentBest();

        if (best.isFailed()) {
            CandidateRecord first = executed.get(0);
            accept(state, record.candidates(candidates), first,
                    "Current best never formalized; candidate #" + first.getIndex()
                            + " executed (" + first.getSolverResult().getAnswer() + ")");
            return;
        }

        List<CandidateRecord> judged = new ArrayList<>(candidates);

        for (CandidateRecord candidate : executed) {
            ComparisonVerdict verdict = callGenerator("compare",
                    () -> generator.compare(state.getStatement(), best, candidate.getFormalization()));
            state.addGeneratorCalls(1);

            CandidateRecord withVerdict = candidate.withVerdict(verdict);
            judged.set(candidates.indexOf(candidate), withVerdict);
            log.info("[Controller] Judge: current best vs candidate #{} → {}", candidate.getIndex(), verdict);

            if (verdict.toDecision() == Decision.IMPROVED) {
                accept(state, record.candidates(judged), withVerdict,
                        "Judge preferred candidate #" + candidate.getIndex() + " over the current best"
                                + unknownHint(withVerdict.getSolverResult()));
                return;
            }
        }

        String rejected = executed.stream()
                .map(c -> "#" + c.getIndex())
                .collect(Collectors.joining(", "));
        revert(state, record.candidates(judged),
                "Judge preferred the current best over candidate(s) " + rejected
                        + ": the alternatives drifted from the meaning of the statement");
    }

    private void accept(RefinementState state, IterationRecord.Builder record,
                        CandidateRecord candidate, String reasoning) {
        state.setPhase(RefinementPhase.ACCEPT);
        IterationRecord done = state.accept(candidate.getFormalization(), candidate.getSolverResult(),
                record.reasoning(reasoning));
        log.info("[Controller] {}", done.summary());
    }

    private void revert(RefinementState state, IterationRecord.Builder record, String reasoning) {
        state.setPhase(RefinementPhase.REVERT);
        IterationRecord done = state.revert(record.reasoning(reasoning));
        log.warn("[Controller] {}", done.summary());
    }

    // =========================================================================
    // TERMINATION
    // =========================================================================

    /** Null means keep going. */
    TerminationReason checkTermination(RefinementState state) {
        if (state.getCurrentBestResult().isDecisive()) {
            return TerminationReason.DECISIVE_SUCCESS;
        }
        if (state.getConsecutiveReverts() >= config.getEarlyStopThreshold()) {
            log.warn("[Controller] {} consecutive reverts, stopping early", state.getConsecutiveReverts());
            return TerminationReason.REVERT_BUDGET_EXHAUSTED;
        }
        if (state.getIteration() >= config.getMaxIterations()) {
            log.info("[Controller] Iteration cap {} reached", config.getMaxIterations());
            return TerminationReason.ITERATION_CAP;
        }
        return null;
    }

    private RefinementTrace finish(String id, RefinementState state, TerminationReason reason,
                                   long startTime, String fatalError) {
        state.setPhase(RefinementPhase.TERMINATE);
        long wallTime = System.currentTimeMillis() - startTime;

        RefinementTrace trace = new RefinementTrace(
                id,
                state.getStatement(),
                state.getHistory(),
                state.getCurrentBest(),
                state.getCurrentBestResult(),
                reason,
                state.getIteration(),
                state.getTotalReverts(),
                state.getGeneratorCalls(),
                wallTime,
                fatalError
        );

        logBenchmark(trace);
        log.info("========== REFINEMENT END [{}]: {} ==========", id, reason);
        return trace;
    }

    // =========================================================================
    // VALIDATE + SOLVE
    // =========================================================================

    private List<CandidateRecord> evaluateAll(List<String> payloads) {
        if (payloads == null || payloads.isEmpty()) {
            return List.of();
        }

        if (!config.isParallelCandidates() || payloads.size() == 1) {
            List<CandidateRecord> out = new ArrayList<>(payloads.size());
            for (int i = 0; i < payloads.size(); i++) {
                out.add(evaluate(i + 1, payloads.get(i)));
            }
            return out;
        }

        List<Future<CandidateRecord>> futures = new ArrayList<>(payloads.size());
        for (int i = 0; i < payloads.size(); i++) {
            int    index   = i + 1;
            String payload = payloads.get(i);
            futures.add(candidateWorkers.submit(() -> evaluate(index, payload)));
        }

        // Collected in proposal order regardless of completion order
        List<CandidateRecord> out = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            out.add(await(futures.get(i), i + 1));
        }
        return out;
    }

    private CandidateRecord await(Future<CandidateRecord> future, int index) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[Controller] Candidate #{} evaluation failed", index, cause);
            String message = "Candidate evaluation failed: " + cause;
            return new CandidateRecord(index, Formalization.failed(message), List.of(message), null,
                    classifier.classify(message, config.getBackend()), null);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while evaluating candidate #" + index, e);
        }
    }

    /** Parse → validate → solve one raw payload. Never throws for bad input. */
    CandidateRecord evaluate(int index, String payload) {
        SolverBackend backend       = config.getBackend();
        Formalization formalization = parser.parse(payload);
        ValidationReport report     = validator.validate(formalization);

        if (!report.isValid()) {
            return new CandidateRecord(index, formalization, report.getIssues(), null,
                    classifier.classify(report.summary(), backend), null);
        }

        SolverResult result = solverAdapter.solve(
                formalization.getPremises(),
                formalization.getConclusion(),
                backend,
                config.getSolverTimeout());

        return new CandidateRecord(index, formalization, List.of(), result,
                classifier.classify(result, backend), null);
    }

    /** Result that stands for a candidate; invalid candidates never reached the solver. */
    private static SolverResult resultOf(CandidateRecord candidate) {
        if (candidate.getSolverResult() != null) {
            return candidate.getSolverResult();
        }
        return SolverResult.error("Not solved: " + String.join("; ", candidate.getValidationIssues()));
    }

    // =========================================================================
    // GENERATOR CALLS
    // =========================================================================

    /**
     * Bounded generator call. Timeout, interruption and any failure inside the
     * generator all surface as GeneratorUnavailableException.
     */
    private <T> T callGenerator(String operation, Callable<T> call) {
        long timeoutMs = config.getGeneratorTimeout().toMillis();
        Future<T> future;
        try {
            future = generatorCalls.submit(call);
        } catch (RuntimeException e) {
            throw new GeneratorUnavailableException(operation + " could not be scheduled: " + e.getMessage(), e);
        }

        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);

        } catch (TimeoutException e) {
            future.cancel(true);
            throw new GeneratorUnavailableException(operation + " timed out after " + timeoutMs + " ms", e);

        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof GeneratorUnavailableException) {
                throw (GeneratorUnavailableException) cause;
            }
            throw new GeneratorUnavailableException(operation + " failed: " + cause.getMessage(), cause);

        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new GeneratorUnavailableException(operation + " interrupted", e);
        }
    }

    // =========================================================================
    // HELPERS
    // =========================================================================

    private static String joinDiagnostics(List<CandidateRecord> candidates, boolean nothingProposed) {
        if (nothingProposed) {
            return "generator returned no candidates";
        }
        return candidates.stream()
                .map(c -> "#" + c.getIndex() + " " + (c.getDiagnostic() != null ? c.getDiagnostic() : "rejected"))
                .collect(Collectors.joining(" ; "));
    }

    private static String unknownHint(SolverResult result) {
        return result.isDecisive()
                ? ""
                : "; solver still answers " + result.getAnswer()
                        + ", premises neither prove nor refute the conclusion";
    }

    private String extractStatementId(String statement) {
        if (statement == null || statement.isBlank()) return "unknown";
        String flat = statement.strip().replaceAll("\\s+", " ");
        return flat.length() > MAX_STATEMENT_ID_CHARS ? flat.substring(0, MAX_STATEMENT_ID_CHARS) : flat;
    }

    /**
     * Single JSON line per session, consumed by log parsers.
     */
    private void logBenchmark(RefinementTrace trace) {
        String json = String.format(
                "{\"statement_id\":\"%s\",\"termination_reason\":\"%s\",\"iterations\":%d," +
                "\"total_reverts\":%d,\"generator_calls\":%d,\"final_answer\":\"%s\"," +
                "\"executed\":%b,\"wall_time_ms\":%d}",
                trace.getStatementId().replace("\"", "'"),
                trace.getTerminationReason(),
                trace.getIterations(),
                trace.getTotalReverts(),
                trace.getGeneratorCalls(),
                trace.getFinalResult().getAnswer(),
                trace.isExecuted(),
                trace.getWallTimeMs()
        );

        log.info("[Benchmark] {}", json);
    }

    private static final class NamedDaemonFactory implements ThreadFactory {

        private final String        prefix;
        private final AtomicInteger counter = new AtomicInteger();

        NamedDaemonFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
