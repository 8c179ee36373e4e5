package com.calcron.infrastructure.web.dto;

import com.calcron.domain.model.JobRecord;
import java.time.Instant;
import java.util.List;

public record JobListResponse(
        JobData data
) {
    public static JobListResponse fromRecords(List<JobRecord> records) {
        var jobs = records.stream()
                .map(JobDto::fromRecord)
                .toList();

        return new JobListResponse(new JobData(jobs));
    }

    public record JobData(
            List<JobDto> jobs
    ) {}

    public record JobDto(
            String event_id,
            Instant scheduled_time,
            String job_handle,
            String status,
            String revision_token,
            Instant updated_at
    ) {
        public static JobDto fromRecord(JobRecord record) {
            return new JobDto(
                    record.eventId(),
                    record.scheduledTime(),
                    record.jobHandle(),
                    record.status().name(),
                    record.revisionToken(),
                    record.updatedAt()
            );
        }
    }
}
