package com.logicloop.config;

import com.logicloop.core.solver.SolverBackend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Reads logicloop.refinement.* once at startup and exposes the resulting
 * RefinementConfig. Invalid values fail context startup.
 */
@Component
public class RefinementConfigResolver {

    private static final Logger log = LoggerFactory.getLogger(RefinementConfigResolver.class);

    private final RefinementConfig config;

    public RefinementConfigResolver(
        @Value("${logicloop.refinement.backend:Z3}")                  String  backend,
        @Value("${logicloop.refinement.candidates:2}")                int     candidates,
        @Value("${logicloop.refinement.early-stop-threshold:2}")      int     earlyStopThreshold,
        @Value("${logicloop.refinement.max-iterations:4}")            int     maxIterations,
        @Value("${logicloop.refinement.solver-timeout-ms:5000}")      long    solverTimeoutMs,
        @Value("${logicloop.refinement.generator-timeout-ms:60000}")  long    generatorTimeoutMs,
        @Value("${logicloop.refinement.parallel-candidates:true}")    boolean parallelCandidates
    ) {
        this.config = RefinementConfig.builder()
                .backend(SolverBackend.fromName(backend))
                .candidates(candidates)
                .earlyStopThreshold(earlyStopThreshold)
                .maxIterations(maxIterations)
                .solverTimeout(Duration.ofMillis(solverTimeoutMs))
                .generatorTimeout(Duration.ofMillis(generatorTimeoutMs))
                .parallelCandidates(parallelCandidates)
                .build();

        log.info("[Config] {}", config);
    }

    public RefinementConfig getConfig() {
        return config;
    }
}
