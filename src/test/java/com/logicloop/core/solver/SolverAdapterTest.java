package com.logicloop.core.solver;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SolverAdapterTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final SolverAdapter adapter = new SolverAdapter(List.of(
            new Z3EntailmentSolver(),
            new UnimplementedSolver()));

    @AfterEach
    void tearDown() {
        adapter.shutdown();
    }

    @Test
    void testModusPonensScenario() {
        SolverResult result = adapter.solve(
                List.of("P(a)", "Implies(P(a), Q(a))"), "Q(a)", SolverBackend.Z3, TIMEOUT);

        assertEquals("Proved", result.getAnswer().getLabel());
    }

    @Test
    void testEmptyPremisesIsError() {
        SolverResult result = adapter.solve(List.of(), "Q(a)", SolverBackend.Z3, TIMEOUT);

        assertEquals(SolverAnswer.ERROR, result.getAnswer());
        assertNotNull(result.getError());
    }

    @Test
    void testBlankConclusionIsError() {
        SolverResult result = adapter.solve(List.of("P(a)"), " ", SolverBackend.Z3, TIMEOUT);

        assertEquals(SolverAnswer.ERROR, result.getAnswer());
    }

    @Test
    void testProver9ReportsNotImplemented() {
        SolverResult result = adapter.solve(List.of("P(a)"), "P(a)", SolverBackend.PROVER9, TIMEOUT);

        assertEquals(SolverAnswer.ERROR, result.getAnswer());
        assertTrue(result.getError().toLowerCase().contains("not implemented"));
    }

    @Test
    void testMissingBackendReportsNotImplemented() {
        SolverAdapter z3Only = new SolverAdapter(List.of(new Z3EntailmentSolver()));
        try {
            SolverResult result = z3Only.solve(List.of("P(a)"), "P(a)", SolverBackend.PROVER9, TIMEOUT);

            assertEquals(SolverAnswer.ERROR, result.getAnswer());
            assertTrue(result.getError().contains("not implemented"));
        } finally {
            z3Only.shutdown();
        }
    }

    @Test
    void testMalformedFormulaDoesNotThrow() {
        SolverResult result = adapter.solve(List.of("P(a) ∧ ∧ Q(a)"), "Q(a)", SolverBackend.Z3, TIMEOUT);

        assertTrue(result.getAnswer() == SolverAnswer.ERROR || result.getAnswer() == SolverAnswer.UNKNOWN);
        assertNotNull(result.getError());
    }

    @Test
    void testSlowBackendTimesOutAsUnknown() {
        SolverAdapter slow = new SolverAdapter(List.of(new SleepingSolver()));
        try {
            long start = System.currentTimeMillis();
            SolverResult result = slow.solve(List.of("P(a)"), "P(a)", SolverBackend.Z3, Duration.ofMillis(200));

            assertEquals(SolverAnswer.UNKNOWN, result.getAnswer());
            assertTrue(result.isTimeout());
            assertTrue(System.currentTimeMillis() - start < 5_000, "Timeout should not wait for the backend");
        } finally {
            slow.shutdown();
        }
    }

    @Test
    void testBackendTimeoutExceptionIsErrorWithTimeout() {
        SolverAdapter signalling = new SolverAdapter(List.of(new SignallingTimeoutSolver()));
        try {
            SolverResult result = signalling.solve(List.of("P(a)"), "P(a)", SolverBackend.Z3, TIMEOUT);

            assertEquals(SolverAnswer.ERROR, result.getAnswer());
            assertTrue(result.isTimeout());
            assertTrue(result.getError().contains("timeout"));
        } finally {
            signalling.shutdown();
        }
    }

    @Test
    void testBackendExceptionBecomesError() {
        SolverAdapter failing = new SolverAdapter(List.of(new ExplodingSolver()));
        try {
            SolverResult result = failing.solve(List.of("P(a)"), "P(a)", SolverBackend.Z3, TIMEOUT);

            assertEquals(SolverAnswer.ERROR, result.getAnswer());
            assertTrue(result.getError().contains("boom"));
            assertFalse(result.isTimeout());
        } finally {
            failing.shutdown();
        }
    }

    @Test
    void testInvalidTimeoutIsError() {
        SolverResult result = adapter.solve(List.of("P(a)"), "P(a)", SolverBackend.Z3, Duration.ZERO);

        assertEquals(SolverAnswer.ERROR, result.getAnswer());
    }

    // =========================================================================
    // Fake backends
    // =========================================================================

    private static final class SleepingSolver implements EntailmentSolver {
        @Override
        public SolverBackend backend() {
            return SolverBackend.Z3;
        }

        @Override
        public SolverResult solve(List<String> premises, String conclusion, Duration timeout) {
            try {
                Thread.sleep(30_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return SolverResult.proved();
        }
    }

    private static final class SignallingTimeoutSolver implements EntailmentSolver {
        @Override
        public SolverBackend backend() {
            return SolverBackend.Z3;
        }

        @Override
        public SolverResult solve(List<String> premises, String conclusion, Duration timeout) {
            throw new SolverTimeoutException("Z3 exception: timeout exceeded after 30000ms");
        }
    }

    private static final class ExplodingSolver implements EntailmentSolver {
        @Override
        public SolverBackend backend() {
            return SolverBackend.Z3;
        }

        @Override
        public SolverResult solve(List<String> premises, String conclusion, Duration timeout) {
            throw new IllegalStateException("boom");
        }
    }
}
