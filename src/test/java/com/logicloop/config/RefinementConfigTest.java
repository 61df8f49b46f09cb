package com.logicloop.config;

import com.logicloop.core.solver.SolverBackend;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RefinementConfigTest {

    @Test
    void testDefaults() {
        RefinementConfig config = RefinementConfig.builder().build();

        assertEquals(SolverBackend.Z3, config.getBackend());
        assertEquals(2, config.getCandidates());
        assertEquals(2, config.getEarlyStopThreshold());
        assertEquals(4, config.getMaxIterations());
        assertEquals(Duration.ofSeconds(5), config.getSolverTimeout());
        assertTrue(config.isParallelCandidates());
    }

    @Test
    void testToBuilderChangesOnlyWhatIsSet() {
        RefinementConfig base   = RefinementConfig.builder().candidates(3).build();
        RefinementConfig capped = base.toBuilder().maxIterations(1).build();

        assertEquals(3, capped.getCandidates());
        assertEquals(1, capped.getMaxIterations());
        assertEquals(4, base.getMaxIterations());
    }

    @Test
    void testInvalidBoundsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> RefinementConfig.builder().candidates(0).build());
        assertThrows(IllegalArgumentException.class, () -> RefinementConfig.builder().earlyStopThreshold(0).build());
        assertThrows(IllegalArgumentException.class, () -> RefinementConfig.builder().maxIterations(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> RefinementConfig.builder().solverTimeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> RefinementConfig.builder().generatorTimeout(Duration.ofMillis(-1)).build());
        assertThrows(IllegalArgumentException.class, () -> RefinementConfig.builder().backend(null).build());
    }

    @Test
    void testResolverReadsPropertyValues() {
        RefinementConfigResolver resolver =
                new RefinementConfigResolver("z3", 3, 1, 6, 2000, 30000, false);
        RefinementConfig config = resolver.getConfig();

        assertEquals(SolverBackend.Z3, config.getBackend());
        assertEquals(3, config.getCandidates());
        assertEquals(1, config.getEarlyStopThreshold());
        assertEquals(6, config.getMaxIterations());
        assertEquals(Duration.ofMillis(2000), config.getSolverTimeout());
        assertEquals(Duration.ofSeconds(30), config.getGeneratorTimeout());
        assertFalse(config.isParallelCandidates());
    }

    @Test
    void testSatIsAnAliasOfZ3() {
        RefinementConfigResolver resolver =
                new RefinementConfigResolver("SAT", 2, 2, 4, 5000, 60000, true);

        assertEquals(SolverBackend.Z3, resolver.getConfig().getBackend());
    }

    @Test
    void testResolverRejectsUnknownBackend() {
        assertThrows(IllegalArgumentException.class,
                () -> new RefinementConfigResolver("vampire", 2, 2, 4, 5000, 60000, true));
    }
}
