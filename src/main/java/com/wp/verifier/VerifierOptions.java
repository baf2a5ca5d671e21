package com.wp.verifier;

import java.nio.file.Path;

/**
 * Settings of one verification run.
 */
public class VerifierOptions {

    public static final long DEFAULT_SOLVER_TIMEOUT_MILLIS = 10_000;
    public static final long DEFAULT_DEADLINE_GRACE_MILLIS = 2_000;

    private long solverTimeoutMillis = DEFAULT_SOLVER_TIMEOUT_MILLIS;
    private long deadlineGraceMillis = DEFAULT_DEADLINE_GRACE_MILLIS;
    private int parallelism = Math.max(1, Runtime.getRuntime().availableProcessors());
    private boolean collectMetrics = true;
    private Path contractsFile;
    private Path dotOutputDirectory;

    /**
     * Timeout handed to the solver for each condition.
     */
    public long getSolverTimeoutMillis() {
        return solverTimeoutMillis;
    }

    public VerifierOptions setSolverTimeoutMillis(long solverTimeoutMillis) {
        if (solverTimeoutMillis <= 0) {
            throw new IllegalArgumentException("Solver timeout must be positive: " + solverTimeoutMillis);
        }
        this.solverTimeoutMillis = solverTimeoutMillis;
        return this;
    }

    /**
     * Extra time granted past the solver timeout before a check is abandoned.
     */
    public long getDeadlineGraceMillis() {
        return deadlineGraceMillis;
    }

    public VerifierOptions setDeadlineGraceMillis(long deadlineGraceMillis) {
        if (deadlineGraceMillis < 0) {
            throw new IllegalArgumentException("Deadline grace must not be negative: " + deadlineGraceMillis);
        }
        this.deadlineGraceMillis = deadlineGraceMillis;
        return this;
    }

    public long getDeadlineMillis() {
        return solverTimeoutMillis + deadlineGraceMillis;
    }

    /**
     * Number of conditions checked at the same time.
     */
    public int getParallelism() {
        return parallelism;
    }

    public VerifierOptions setParallelism(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1: " + parallelism);
        }
        this.parallelism = parallelism;
        return this;
    }

    public boolean isCollectMetrics() {
        return collectMetrics;
    }

    public VerifierOptions setCollectMetrics(boolean collectMetrics) {
        this.collectMetrics = collectMetrics;
        return this;
    }

    /**
     * JSON file with contracts of external methods, or {@code null}.
     */
    public Path getContractsFile() {
        return contractsFile;
    }

    public VerifierOptions setContractsFile(Path contractsFile) {
        this.contractsFile = contractsFile;
        return this;
    }

    /**
     * Directory receiving a DOT rendering of every CFG, or {@code null} for none.
     */
    public Path getDotOutputDirectory() {
        return dotOutputDirectory;
    }

    public VerifierOptions setDotOutputDirectory(Path dotOutputDirectory) {
        this.dotOutputDirectory = dotOutputDirectory;
        return this;
    }

    @Override
    public String toString() {
        return "VerifierOptions{timeout=" + solverTimeoutMillis + "ms, grace=" + deadlineGraceMillis
                + "ms, parallelism=" + parallelism + ", metrics=" + collectMetrics
                + ", contracts=" + contractsFile + ", dot=" + dotOutputDirectory + "}";
    }
}
