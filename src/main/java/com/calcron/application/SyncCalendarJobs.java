package com.calcron.application;

import com.calcron.domain.exception.JobSchedulerException;
import com.calcron.domain.exception.JobStoreException;
import com.calcron.domain.model.ActionOutcome;
import com.calcron.domain.model.ActionType;
import com.calcron.domain.model.CalendarEvent;
import com.calcron.domain.model.CyclePhase;
import com.calcron.domain.model.CycleStatus;
import com.calcron.domain.model.EventSnapshot;
import com.calcron.domain.model.JobRecord;
import com.calcron.domain.model.SyncAction;
import com.calcron.domain.model.SyncReport;
import com.calcron.domain.port.out.CalendarEventSource;
import com.calcron.domain.port.out.JobRecordStore;
import com.calcron.domain.port.out.JobScheduler;
import com.calcron.domain.port.out.SyncStatusRepository;
import com.calcron.domain.reconcile.Reconciler;
import com.calcron.infrastructure.config.SyncProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs reconciliation cycles: fetch, reconcile, apply, persist.
 *
 * <p>A cycle that cannot load the store or read the calendar aborts with no side effects.
 * Once actions are being applied, every completed outcome is persisted, so the next cycle
 * retries exactly what did not succeed.
 */
@Service
public class SyncCalendarJobs {

    private static final Logger logger = LoggerFactory.getLogger(SyncCalendarJobs.class);

    private final CalendarEventSource calendarEventSource;
    private final JobRecordStore jobRecordStore;
    private final JobScheduler jobScheduler;
    private final Reconciler reconciler;
    private final JobActionExecutor actionExecutor;
    private final SyncStatusRepository syncStatusRepository;
    private final CycleGate cycleGate;
    private final Clock clock;
    private final SyncProperties properties;
    private final Executor applyExecutor;

    private final AtomicReference<CyclePhase> phase = new AtomicReference<>(CyclePhase.IDLE);
    private final AtomicReference<SyncReport> lastReport = new AtomicReference<>();

    public SyncCalendarJobs(CalendarEventSource calendarEventSource,
                            JobRecordStore jobRecordStore,
                            JobScheduler jobScheduler,
                            Reconciler reconciler,
                            JobActionExecutor actionExecutor,
                            SyncStatusRepository syncStatusRepository,
                            CycleGate cycleGate,
                            Clock clock,
                            SyncProperties properties,
                            @Qualifier("actionApplyExecutor") Executor applyExecutor) {
        this.calendarEventSource = calendarEventSource;
        this.jobRecordStore = jobRecordStore;
        this.jobScheduler = jobScheduler;
        this.reconciler = reconciler;
        this.actionExecutor = actionExecutor;
        this.syncStatusRepository = syncStatusRepository;
        this.cycleGate = cycleGate;
        this.clock = clock;
        this.properties = properties;
        this.applyExecutor = applyExecutor;
    }

    /**
     * Runs one cycle, or returns a SKIPPED report when another cycle holds the gate.
     */
    public SyncReport runCycle() {
        Optional<SyncReport> report = cycleGate.runIfIdle("sync", this::runGuarded);
        return report.orElseGet(() -> SyncReport.skipped(clock.instant()));
    }

    public CyclePhase currentPhase() {
        return phase.get();
    }

    public Optional<SyncReport> lastReport() {
        return Optional.ofNullable(lastReport.get());
    }

    private SyncReport runGuarded() {
        Instant startedAt = clock.instant();
        logger.info("Starting sync cycle");
        SyncReport report;
        try {
            report = execute(startedAt);
        } finally {
            phase.set(CyclePhase.IDLE);
        }

        if (report.status() == CycleStatus.ABORTED) {
            logger.error("Sync cycle aborted: {}", report.abortReason());
        } else {
            logger.info("Sync cycle finished - {}", report.summary());
        }
        report.failures().forEach(failure -> logger.warn("{} of event {} failed: {}",
                failure.action(), failure.eventId(), failure.reason()));

        lastReport.set(report);
        syncStatusRepository.recordLastCycle(report);
        return report;
    }

    private SyncReport execute(Instant startedAt) {
        phase.set(CyclePhase.FETCHING);

        Map<String, JobRecord> records;
        try {
            records = jobRecordStore.load();
        } catch (JobStoreException e) {
            return SyncReport.aborted(startedAt, clock.instant(), "Job store unavailable: " + e.getMessage());
        }

        // Listed before the reference instant so a job firing mid-cycle is already in the past.
        Set<String> liveHandles = listLiveHandles();

        Instant referenceTime = clock.instant();
        Instant horizonEnd = referenceTime.plus(properties.getHorizon());
        EventSnapshot snapshot;
        try {
            List<CalendarEvent> events = calendarEventSource.fetchEvents(referenceTime, horizonEnd)
                    .get(properties.getFetchTimeout().toMillis(), TimeUnit.MILLISECONDS);
            snapshot = EventSnapshot.of(referenceTime, horizonEnd, events);
            logger.info("Fetched {} calendar events between {} and {}", snapshot.size(), referenceTime, horizonEnd);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return SyncReport.aborted(startedAt, clock.instant(), "Calendar unavailable: " + cause.getMessage());
        } catch (TimeoutException e) {
            return SyncReport.aborted(startedAt, clock.instant(),
                    "Calendar unavailable: no answer within " + properties.getFetchTimeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SyncReport.aborted(startedAt, clock.instant(), "Interrupted while fetching calendar events");
        }

        phase.set(CyclePhase.RECONCILING);
        List<SyncAction> actions = reconciler.reconcile(snapshot, records, liveHandles);

        phase.set(CyclePhase.APPLYING);
        Map<String, JobRecord> updated = new LinkedHashMap<>(records);
        List<ActionOutcome> outcomes = new ArrayList<>(actions.size());
        boolean completed = applyAll(actions, updated, outcomes);

        phase.set(CyclePhase.PERSISTING);
        String abortReason = null;
        if (!completed) {
            abortReason = String.format("Interrupted after applying %d of %d actions", outcomes.size(), actions.size());
        }
        // The interrupt is held back while saving so completed outcomes still reach the store.
        boolean interrupted = Thread.interrupted();
        try {
            jobRecordStore.save(updated);
        } catch (JobStoreException e) {
            abortReason = "Job store unavailable, outcomes of this cycle were not saved: " + e.getMessage();
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        return buildReport(startedAt, outcomes, abortReason);
    }

    private Set<String> listLiveHandles() {
        try {
            return jobScheduler.liveHandles();
        } catch (JobSchedulerException e) {
            logger.warn("Could not list scheduled jobs, skipping the live job check: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Applies cancels first, then everything else. Returns false when interrupted part-way.
     */
    private boolean applyAll(List<SyncAction> actions, Map<String, JobRecord> records, List<ActionOutcome> outcomes) {
        List<SyncAction> cancels = actions.stream().filter(a -> a.type() == ActionType.CANCEL).toList();
        List<SyncAction> others = actions.stream().filter(a -> a.type() != ActionType.CANCEL).toList();

        for (List<SyncAction> group : List.of(cancels, others)) {
            boolean completed = properties.getApplyParallelism() > 1
                    ? applyConcurrently(group, records, outcomes)
                    : applySequentially(group, records, outcomes);
            if (!completed) {
                return false;
            }
        }
        return true;
    }

    private boolean applySequentially(List<SyncAction> group, Map<String, JobRecord> records, List<ActionOutcome> outcomes) {
        for (SyncAction action : group) {
            if (Thread.currentThread().isInterrupted()) {
                return false;
            }
            fold(applySafely(action), records, outcomes);
        }
        return true;
    }

    private boolean applyConcurrently(List<SyncAction> group, Map<String, JobRecord> records, List<ActionOutcome> outcomes) {
        List<CompletableFuture<ActionOutcome>> futures = group.stream()
                .map(action -> CompletableFuture.supplyAsync(() -> applySafely(action), applyExecutor))
                .toList();

        for (CompletableFuture<ActionOutcome> future : futures) {
            fold(future.join(), records, outcomes);
        }
        return !Thread.currentThread().isInterrupted();
    }

    private ActionOutcome applySafely(SyncAction action) {
        try {
            return actionExecutor.apply(action);
        } catch (RuntimeException e) {
            logger.error("Unexpected error applying {} for event {}", action.type(), action.eventId(), e);
            JobRecord failed = action.recordOptional()
                    .map(record -> record.markFailed(clock.instant()))
                    .orElseGet(() -> JobRecord.failed(action.event(), null, clock.instant()));
            return ActionOutcome.failure(action, failed, "Unexpected error: " + e);
        }
    }

    private static void fold(ActionOutcome outcome, Map<String, JobRecord> records, List<ActionOutcome> outcomes) {
        if (outcome.removesRecord()) {
            records.remove(outcome.eventId());
        } else {
            records.put(outcome.eventId(), outcome.record());
        }
        outcomes.add(outcome);
    }

    private SyncReport buildReport(Instant startedAt, List<ActionOutcome> outcomes, String abortReason) {
        int scheduled = 0;
        int rescheduled = 0;
        int cancelled = 0;
        int unchanged = 0;
        List<SyncReport.ActionFailure> failures = new ArrayList<>();

        for (ActionOutcome outcome : outcomes) {
            ActionType type = outcome.action().type();
            if (!outcome.succeeded()) {
                failures.add(new SyncReport.ActionFailure(outcome.eventId(), type, outcome.failureReason()));
                continue;
            }
            switch (type) {
                case SCHEDULE -> scheduled++;
                case RESCHEDULE -> rescheduled++;
                case CANCEL -> cancelled++;
                case NOOP -> unchanged++;
            }
        }

        CycleStatus status;
        if (abortReason != null) {
            status = CycleStatus.ABORTED;
        } else if (!failures.isEmpty()) {
            status = CycleStatus.PARTIAL;
        } else {
            status = CycleStatus.SUCCESS;
        }

        return new SyncReport(status, startedAt, clock.instant(),
                scheduled, rescheduled, cancelled, unchanged, failures, abortReason);
    }
}
