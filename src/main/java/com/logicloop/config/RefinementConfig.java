package com.logicloop.config;

import com.logicloop.core.solver.SolverBackend;

import java.time.Duration;

/**
 * RefinementConfig: immutable settings for one refinement controller.
 *
 * Shared read-only between concurrent sessions. Built by
 * RefinementConfigResolver from properties, or directly via the builder.
 *
 * Bounds: candidates ≥ 1, earlyStopThreshold ≥ 1, maxIterations ≥ 1,
 * timeouts strictly positive.
 */
public final class RefinementConfig {

    private final SolverBackend backend;
    private final int           candidates;
    private final int           earlyStopThreshold;
    private final int           maxIterations;
    private final Duration      solverTimeout;
    private final Duration      generatorTimeout;
    private final boolean       parallelCandidates;

    private RefinementConfig(Builder b) {
        if (b.backend == null) throw new IllegalArgumentException("backend must be set");
        if (b.candidates < 1) throw new IllegalArgumentException("candidates must be >= 1, got " + b.candidates);
        if (b.earlyStopThreshold < 1) {
            throw new IllegalArgumentException("early-stop threshold must be >= 1, got " + b.earlyStopThreshold);
        }
        if (b.maxIterations < 1) {
            throw new IllegalArgumentException("max iterations must be >= 1, got " + b.maxIterations);
        }
        requirePositive("solver timeout", b.solverTimeout);
        requirePositive("generator timeout", b.generatorTimeout);

        this.backend            = b.backend;
        this.candidates         = b.candidates;
        this.earlyStopThreshold = b.earlyStopThreshold;
        this.maxIterations      = b.maxIterations;
        this.solverTimeout      = b.solverTimeout;
        this.generatorTimeout   = b.generatorTimeout;
        this.parallelCandidates = b.parallelCandidates;
    }

    private static void requirePositive(String name, Duration d) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, got " + d);
        }
    }

    public SolverBackend getBackend()            { return backend; }
    public int           getCandidates()         { return candidates; }
    public int           getEarlyStopThreshold() { return earlyStopThreshold; }
    public int           getMaxIterations()      { return maxIterations; }
    public Duration      getSolverTimeout()      { return solverTimeout; }
    public Duration      getGeneratorTimeout()   { return generatorTimeout; }
    public boolean       isParallelCandidates()  { return parallelCandidates; }

    public static Builder builder() {
        return new Builder();
    }

    /** Copy with selected fields changed. */
    public Builder toBuilder() {
        return new Builder()
                .backend(backend)
                .candidates(candidates)
                .earlyStopThreshold(earlyStopThreshold)
                .maxIterations(maxIterations)
                .solverTimeout(solverTimeout)
                .generatorTimeout(generatorTimeout)
                .parallelCandidates(parallelCandidates);
    }

    @Override
    public String toString() {
        return String.format(
                "RefinementConfig{backend=%s, N=%d, earlyStop=%d, maxIter=%d, solverTimeout=%dms, generatorTimeout=%dms, parallel=%b}",
                backend, candidates, earlyStopThreshold, maxIterations,
                solverTimeout.toMillis(), generatorTimeout.toMillis(), parallelCandidates);
    }

    public static final class Builder {
        private SolverBackend backend            = SolverBackend.Z3;
        private int           candidates         = 2;
        private int           earlyStopThreshold = 2;
        private int           maxIterations      = 4;
        private Duration      solverTimeout      = Duration.ofSeconds(5);
        private Duration      generatorTimeout   = Duration.ofSeconds(60);
        private boolean       parallelCandidates = true;

        private Builder() {
        }

        public Builder backend(SolverBackend v)        { this.backend = v;            return this; }
        public Builder candidates(int v)               { this.candidates = v;         return this; }
        public Builder earlyStopThreshold(int v)       { this.earlyStopThreshold = v; return this; }
        public Builder maxIterations(int v)            { this.maxIterations = v;      return this; }
        public Builder solverTimeout(Duration v)       { this.solverTimeout = v;      return this; }
        public Builder generatorTimeout(Duration v)    { this.generatorTimeout = v;   return this; }
        public Builder parallelCandidates(boolean v)   { this.parallelCandidates = v; return this; }

        public RefinementConfig build() { return new RefinementConfig(this); }
    }
}
