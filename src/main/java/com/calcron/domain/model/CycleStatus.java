package com.calcron.domain.model;

/**
 * Outcome of one reconciliation cycle, with the process exit code used in run-once mode.
 */
public enum CycleStatus {
    SUCCESS(0),
    ABORTED(1),
    PARTIAL(2),
    SKIPPED(3);

    private final int exitCode;

    CycleStatus(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
