package com.calcron.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted link between a calendar occurrence and the job scheduled for it.
 * A {@code null} job handle means no external job is known to exist.
 */
public record JobRecord(
        String eventId,
        Instant scheduledTime,
        String revisionToken,
        String jobHandle,
        JobStatus status,
        Instant updatedAt
) {
    public JobRecord {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(scheduledTime, "scheduledTime");
        Objects.requireNonNull(revisionToken, "revisionToken");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(updatedAt, "updatedAt");
    }

    public static JobRecord pending(CalendarEvent event, String jobHandle, Instant now) {
        return new JobRecord(event.eventId(), event.startTime(), event.revisionToken(),
                Objects.requireNonNull(jobHandle, "jobHandle"), JobStatus.PENDING, now);
    }

    /**
     * Failed attempt for an event. {@code jobHandle} is the handle that may still be live, if any.
     */
    public static JobRecord failed(CalendarEvent event, String jobHandle, Instant now) {
        return new JobRecord(event.eventId(), event.startTime(), event.revisionToken(),
                jobHandle, JobStatus.FAILED, now);
    }

    public JobRecord markFailed(Instant now) {
        return new JobRecord(eventId, scheduledTime, revisionToken, jobHandle, JobStatus.FAILED, now);
    }

    public boolean hasJobHandle() {
        return jobHandle != null && !jobHandle.isBlank();
    }

    public boolean isPending() {
        return status == JobStatus.PENDING;
    }
}
