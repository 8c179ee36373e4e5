package com.calcron.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One step needed to bring the job queue in line with the calendar.
 *
 * <p>{@code event} is present for SCHEDULE and RESCHEDULE and for NOOPs derived from
 * an event. {@code record} is the prior record, present for RESCHEDULE and CANCEL.
 */
public record SyncAction(
        ActionType type,
        String eventId,
        CalendarEvent event,
        JobRecord record
) {
    public SyncAction {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(eventId, "eventId");
    }

    public static SyncAction schedule(CalendarEvent event) {
        return new SyncAction(ActionType.SCHEDULE, event.eventId(), event, null);
    }

    public static SyncAction reschedule(CalendarEvent event, JobRecord oldRecord) {
        return new SyncAction(ActionType.RESCHEDULE, event.eventId(), event,
                Objects.requireNonNull(oldRecord, "oldRecord"));
    }

    public static SyncAction cancel(JobRecord oldRecord) {
        return new SyncAction(ActionType.CANCEL, oldRecord.eventId(), null, oldRecord);
    }

    public static SyncAction noOp(CalendarEvent event, JobRecord record) {
        return new SyncAction(ActionType.NOOP, event.eventId(), event, record);
    }

    public Optional<JobRecord> recordOptional() {
        return Optional.ofNullable(record);
    }

    /**
     * Instant used to order actions: the event start, or the recorded fire time for cancels.
     */
    public Instant sortTime() {
        if (event != null) {
            return event.startTime();
        }
        return record != null ? record.scheduledTime() : Instant.MIN;
    }
}
