package com.logicloop.core.solver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * SolverAdapter: the single entry point for entailment checks.
 *
 * GUARANTEES:
 *   - Always returns a SolverResult; nothing is thrown past this class.
 *   - Empty premises / blank conclusion → Error (ill-posed query), no backend call.
 *   - Each call is bounded by its timeout. On expiry the backend task is
 *     interrupted and the result is Unknown with timeout=true.
 *   - A backend that raises SolverTimeoutException → Error with timeout=true.
 *   - Any other backend exception → Error carrying the exception message.
 *
 * Stateless per call; one instance is shared by all concurrent sessions.
 */
@Component
public class SolverAdapter {

    private static final Logger log = LoggerFactory.getLogger(SolverAdapter.class);

    private final Map<SolverBackend, EntailmentSolver> backends = new EnumMap<>(SolverBackend.class);
    private final ExecutorService                      workers;

    public SolverAdapter(List<EntailmentSolver> solvers) {
        for (EntailmentSolver solver : solvers) {
            backends.put(solver.backend(), solver);
        }
        this.workers = Executors.newCachedThreadPool(new SolverThreadFactory());
        log.info("[Solver] Registered backends: {}", backends.keySet());
    }

    public SolverResult solve(List<String> premises, String conclusion,
                              SolverBackend backend, Duration timeout) {

        if (premises == null || premises.isEmpty()) {
            return SolverResult.error("Ill-posed query: no premises given");
        }
        if (conclusion == null || conclusion.isBlank()) {
            return SolverResult.error("Ill-posed query: conclusion is empty");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return SolverResult.error("Invalid solver timeout: " + timeout);
        }

        EntailmentSolver solver = backends.get(backend);
        if (solver == null) {
            return SolverResult.error("Backend " + backend + " not implemented");
        }

        List<String> premiseCopy = List.copyOf(premises);
        long start = System.currentTimeMillis();
        Future<SolverResult> future;
        try {
            future = workers.submit(() -> solver.solve(premiseCopy, conclusion, timeout));
        } catch (RuntimeException e) {
            log.error("[Solver] Could not schedule {} query: {}", backend, e.getMessage());
            return SolverResult.error("Solver unavailable: " + e.getMessage());
        }

        try {
            SolverResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("[Solver] {} → {} in {} ms", backend, result, System.currentTimeMillis() - start);
            return result != null ? result : SolverResult.error("Backend " + backend + " returned no result");

        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Solver] {} timed out after {} ms", backend, timeout.toMillis());
            return SolverResult.timedOut();

        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof SolverTimeoutException) {
                log.warn("[Solver] {} reported timeout: {}", backend, cause.getMessage());
                return SolverResult.timeoutError(cause.getMessage());
            }
            log.warn("[Solver] {} failed: {}", backend, describe(cause));
            return SolverResult.error(backend + " exception: " + describe(cause));

        } catch (CancellationException e) {
            return SolverResult.timedOut();

        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return SolverResult.error("Solver call interrupted");
        }
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return message != null && !message.isBlank()
                ? message
                : t.getClass().getSimpleName();
    }

    private static final class SolverThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "solver-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
