package com.calcron.application;

import com.calcron.domain.exception.JobStoreException;
import com.calcron.domain.model.ActionType;
import com.calcron.domain.model.CycleStatus;
import com.calcron.domain.model.JobRecord;
import com.calcron.domain.model.SyncReport;
import com.calcron.domain.port.out.CancelResult;
import com.calcron.domain.port.out.JobRecordStore;
import com.calcron.domain.port.out.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cancels every job the engine knows about and forgets the corresponding records.
 * Records whose cancel fails are kept as FAILED so a later reset or cycle can retry them.
 */
@Service
public class ResetJobs {

    private static final Logger logger = LoggerFactory.getLogger(ResetJobs.class);

    private final JobRecordStore jobRecordStore;
    private final JobScheduler jobScheduler;
    private final CycleGate cycleGate;
    private final Clock clock;

    public ResetJobs(JobRecordStore jobRecordStore, JobScheduler jobScheduler, CycleGate cycleGate, Clock clock) {
        this.jobRecordStore = jobRecordStore;
        this.jobScheduler = jobScheduler;
        this.cycleGate = cycleGate;
        this.clock = clock;
    }

    public SyncReport reset() {
        return cycleGate.runIfIdle("reset", this::resetAll)
                .orElseGet(() -> SyncReport.skipped(clock.instant()));
    }

    private SyncReport resetAll() {
        Instant startedAt = clock.instant();
        logger.info("Resetting all synchronised jobs");

        Map<String, JobRecord> records;
        try {
            records = jobRecordStore.load();
        } catch (JobStoreException e) {
            return SyncReport.aborted(startedAt, clock.instant(), "Job store unavailable: " + e.getMessage());
        }

        Map<String, JobRecord> remaining = new LinkedHashMap<>();
        List<SyncReport.ActionFailure> failures = new ArrayList<>();
        int cancelled = 0;

        for (JobRecord record : records.values()) {
            if (!record.hasJobHandle()) {
                cancelled++;
                continue;
            }
            try {
                CancelResult result = jobScheduler.cancel(record.jobHandle());
                logger.debug("Cancel of job {} for event {}: {}", record.jobHandle(), record.eventId(), result);
                cancelled++;
            } catch (RuntimeException e) {
                logger.warn("Failed to cancel job {} for event {}: {}",
                        record.jobHandle(), record.eventId(), e.getMessage());
                remaining.put(record.eventId(), record.markFailed(clock.instant()));
                failures.add(new SyncReport.ActionFailure(record.eventId(), ActionType.CANCEL, e.getMessage()));
            }
        }

        try {
            jobRecordStore.save(remaining);
        } catch (JobStoreException e) {
            return new SyncReport(CycleStatus.ABORTED, startedAt, clock.instant(), 0, 0, cancelled, 0, failures,
                    "Job store unavailable, reset was not saved: " + e.getMessage());
        }

        CycleStatus status = failures.isEmpty() ? CycleStatus.SUCCESS : CycleStatus.PARTIAL;
        SyncReport report = new SyncReport(status, startedAt, clock.instant(), 0, 0, cancelled, 0, failures, null);
        logger.info("Reset finished - {}", report.summary());
        return report;
    }
}
