package com.calcron.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Summary of one cycle for operators: status, counters and per-event failures.
 */
public record SyncReport(
        CycleStatus status,
        Instant startedAt,
        Instant finishedAt,
        int scheduled,
        int rescheduled,
        int cancelled,
        int unchanged,
        List<ActionFailure> failures,
        String abortReason
) {
    public SyncReport {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public record ActionFailure(String eventId, ActionType action, String reason) {}

    public static SyncReport skipped(Instant now) {
        return new SyncReport(CycleStatus.SKIPPED, now, now, 0, 0, 0, 0, List.of(),
                "Another cycle is still running");
    }

    public static SyncReport aborted(Instant startedAt, Instant finishedAt, String reason) {
        return new SyncReport(CycleStatus.ABORTED, startedAt, finishedAt, 0, 0, 0, 0, List.of(), reason);
    }

    public int failed() {
        return failures.size();
    }

    public String summary() {
        return String.format("%s: %d scheduled, %d rescheduled, %d cancelled, %d unchanged, %d failed",
                status, scheduled, rescheduled, cancelled, unchanged, failed());
    }
}
