package com.calcron.infrastructure.web.dto;

import com.calcron.domain.model.SyncReport;
import java.time.Instant;
import java.util.List;

public record SyncReportResponse(
        String status,
        int exit_code,
        Instant started_at,
        Instant finished_at,
        int scheduled,
        int rescheduled,
        int cancelled,
        int unchanged,
        List<FailureDto> failures,
        String abort_reason
) {
    public static SyncReportResponse fromReport(SyncReport report) {
        var failures = report.failures().stream()
                .map(FailureDto::fromFailure)
                .toList();

        return new SyncReportResponse(
                report.status().name(),
                report.status().exitCode(),
                report.startedAt(),
                report.finishedAt(),
                report.scheduled(),
                report.rescheduled(),
                report.cancelled(),
                report.unchanged(),
                failures,
                report.abortReason()
        );
    }

    public record FailureDto(
            String event_id,
            String action,
            String reason
    ) {
        public static FailureDto fromFailure(SyncReport.ActionFailure failure) {
            return new FailureDto(failure.eventId(), failure.action().name(), failure.reason());
        }
    }
}
