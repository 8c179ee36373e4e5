package com.calcron.application;

import com.calcron.domain.model.ActionOutcome;
import com.calcron.domain.model.CalendarEvent;
import com.calcron.domain.model.JobRecord;
import com.calcron.domain.model.SyncAction;
import com.calcron.domain.port.out.CancelResult;
import com.calcron.domain.port.out.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Applies a single {@link SyncAction} through the {@link JobScheduler}.
 *
 * <p>Never throws for a scheduler failure: every action ends as a complete PENDING record,
 * a complete FAILED record, or a removal.
 */
@Service
public class JobActionExecutor {

    private static final Logger logger = LoggerFactory.getLogger(JobActionExecutor.class);

    private final JobScheduler jobScheduler;
    private final Clock clock;

    public JobActionExecutor(JobScheduler jobScheduler, Clock clock) {
        this.jobScheduler = jobScheduler;
        this.clock = clock;
    }

    public ActionOutcome apply(SyncAction action) {
        return switch (action.type()) {
            case SCHEDULE -> schedule(action);
            case RESCHEDULE -> reschedule(action);
            case CANCEL -> cancel(action);
            case NOOP -> ActionOutcome.success(action, action.record());
        };
    }

    private ActionOutcome schedule(SyncAction action) {
        CalendarEvent event = action.event();
        try {
            String handle = jobScheduler.submit(event.startTime(), event.actionSpec());
            logger.info("Scheduled job {} for event {} at {}", handle, event.eventId(), event.startTime());
            return ActionOutcome.success(action, JobRecord.pending(event, handle, clock.instant()));
        } catch (RuntimeException e) {
            logger.warn("Failed to schedule event {}: {}", event.eventId(), e.getMessage());
            return ActionOutcome.failure(action, JobRecord.failed(event, null, clock.instant()), reasonOf(e));
        }
    }

    private ActionOutcome reschedule(SyncAction action) {
        CalendarEvent event = action.event();
        JobRecord oldRecord = action.record();

        if (isDue(oldRecord, clock.instant())) {
            logger.info("Job {} for event {} was due at {}, leaving it in place",
                    oldRecord.jobHandle(), event.eventId(), oldRecord.scheduledTime());
        } else if (oldRecord.hasJobHandle()) {
            try {
                cancelHandle(oldRecord);
            } catch (RuntimeException e) {
                // The old job may still be live: keep its handle so the next cycle cancels it first.
                logger.warn("Failed to cancel job {} while rescheduling event {}: {}",
                        oldRecord.jobHandle(), event.eventId(), e.getMessage());
                return ActionOutcome.failure(action, oldRecord.markFailed(clock.instant()), reasonOf(e));
            }
        }

        try {
            String handle = jobScheduler.submit(event.startTime(), event.actionSpec());
            logger.info("Rescheduled event {} from {} to {} (job {} -> {})", event.eventId(),
                    oldRecord.scheduledTime(), event.startTime(), oldRecord.jobHandle(), handle);
            return ActionOutcome.success(action, JobRecord.pending(event, handle, clock.instant()));
        } catch (RuntimeException e) {
            logger.warn("Cancelled job {} but failed to resubmit event {}: {}",
                    oldRecord.jobHandle(), event.eventId(), e.getMessage());
            return ActionOutcome.failure(action, JobRecord.failed(event, null, clock.instant()), reasonOf(e));
        }
    }

    private ActionOutcome cancel(SyncAction action) {
        JobRecord record = action.record();
        Instant now = clock.instant();

        if (!record.hasJobHandle()) {
            logger.info("Dropping record for event {}: no job was ever submitted", record.eventId());
            return ActionOutcome.removed(action);
        }

        if (isDue(record, now)) {
            // Due or already run: cancelling now could suppress an execution that is starting.
            logger.info("Job {} for event {} was due at {}, forgetting it",
                    record.jobHandle(), record.eventId(), record.scheduledTime());
            return ActionOutcome.removed(action);
        }

        try {
            cancelHandle(record);
            logger.info("Cancelled job {} for event {}", record.jobHandle(), record.eventId());
            return ActionOutcome.removed(action);
        } catch (RuntimeException e) {
            logger.warn("Failed to cancel job {} for event {}: {}",
                    record.jobHandle(), record.eventId(), e.getMessage());
            return ActionOutcome.failure(action, record.markFailed(now), reasonOf(e));
        }
    }

    private static boolean isDue(JobRecord record, Instant now) {
        return record.isPending() && record.hasJobHandle() && !record.scheduledTime().isAfter(now);
    }

    private void cancelHandle(JobRecord record) {
        CancelResult result = jobScheduler.cancel(record.jobHandle());
        if (result == CancelResult.NOT_FOUND) {
            logger.info("Job {} for event {} was not found by the scheduler, treating it as gone",
                    record.jobHandle(), record.eventId());
        }
    }

    private static String reasonOf(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
