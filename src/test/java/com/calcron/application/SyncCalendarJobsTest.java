package com.calcron.application;

import com.calcron.domain.exception.CalendarUnavailableException;
import com.calcron.domain.exception.JobSchedulerException;
import com.calcron.domain.exception.JobStoreException;
import com.calcron.domain.model.ActionType;
import com.calcron.domain.model.CalendarEvent;
import com.calcron.domain.model.CyclePhase;
import com.calcron.domain.model.CycleStatus;
import com.calcron.domain.model.JobRecord;
import com.calcron.domain.model.JobStatus;
import com.calcron.domain.model.SyncReport;
import com.calcron.domain.port.out.CalendarEventSource;
import com.calcron.domain.port.out.CancelResult;
import com.calcron.domain.port.out.JobRecordStore;
import com.calcron.domain.port.out.JobScheduler;
import com.calcron.domain.port.out.SyncStatusRepository;
import com.calcron.domain.reconcile.Reconciler;
import com.calcron.infrastructure.config.SyncProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SyncCalendarJobsTest {

    private static final Instant NOW = Instant.parse("2024-06-01T10:00:00Z");

    @Mock
    private CalendarEventSource calendarEventSource;

    @Mock
    private JobRecordStore jobRecordStore;

    @Mock
    private JobScheduler jobScheduler;

    @Mock
    private SyncStatusRepository syncStatusRepository;

    @Captor
    private ArgumentCaptor<Map<String, JobRecord>> savedRecords;

    private final CycleGate cycleGate = new CycleGate();
    private final SyncProperties properties = new SyncProperties();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    private SyncCalendarJobs syncCalendarJobs;

    @BeforeEach
    void setUp() {
        syncCalendarJobs = newSyncCalendarJobs(Runnable::run);
    }

    @Test
    void shouldScheduleNewEventsAndPersistRecords() {
        // Given
        CalendarEvent event = event("e1", NOW.plusSeconds(3600), "r1");
        givenRecords(Map.of());
        givenEvents(event);
        when(jobScheduler.submit(event.startTime(), event.actionSpec())).thenReturn("42");

        // When
        SyncReport report = syncCalendarJobs.runCycle();

        // Then
        assertThat(report.status()).isEqualTo(CycleStatus.SUCCESS);
        assertThat(report.scheduled()).isEqualTo(1);
        verify(jobRecordStore).save(savedRecords.capture());
        assertThat(savedRecords.getValue()).containsOnlyKeys("e1");
        assertThat(savedRecords.getValue().get("e1").jobHandle()).isEqualTo("42");
        verify(syncStatusRepository).recordLastCycle(report);
        assertThat(syncCalendarJobs.lastReport()).contains(report);
        assertThat(syncCalendarJobs.currentPhase()).isEqualTo(CyclePhase.IDLE);
    }

    @Test
    void shouldFetchExactlyTheConfiguredHorizon() {
        // Given
        properties.setHorizon(Duration.ofDays(3));
        givenRecords(Map.of());
        givenEvents();

        // When
        syncCalendarJobs.runCycle();

        // Then
        verify(calendarEventSource).fetchEvents(NOW, NOW.plus(Duration.ofDays(3)));
    }

    @Test
    void shouldRescheduleMovedEvent() {
        // Given
        JobRecord old = pending("e1", NOW.plusSeconds(3600), "r1", "7");
        CalendarEvent moved = event("e1", NOW.plusSeconds(7200), "r2");
        givenRecords(Map.of("e1", old));
        givenEvents(moved);
        when(jobScheduler.cancel("7")).thenReturn(CancelResult.CANCELLED);
        when(jobScheduler.submit(moved.startTime(), moved.actionSpec())).thenReturn("8");

        // When
        SyncReport report = syncCalendarJobs.runCycle();

        // Then
        assertThat(report.status()).isEqualTo(CycleStatus.SUCCESS);
        assertThat(report.rescheduled()).isEqualTo(1);
        verify(jobRecordStore).save(savedRecords.capture());
        JobRecord saved = savedRecords.getValue().get("e1");
        assertThat(saved.jobHandle()).isEqualTo("8");
        assertThat(saved.scheduledTime()).isEqualTo(moved.startTime());
        assertThat(saved.revisionToken()).isEqualTo("r2");
    }

    @Test
    void shouldCancelJobOfRemovedEvent() {
        // Given
        givenRecords(Map.of("e1", pending("e1", NOW.plusSeconds(3600), "r1", "7")));
        givenEvents();
        when(jobScheduler.cancel("7")).thenReturn(CancelResult.CANCELLED);

        // When
        SyncReport report = syncCalendarJobs.runCycle();

        // Then
        assertThat(report.cancelled()).isEqualTo(1);
        verify(jobRecordStore).save(savedRecords.capture());
        assertThat(savedRecords.getValue()).isEmpty();
    }

    @Test
    void shouldRetryFailedCancelOnNextCycle() {
        // Given - first cycle cannot cancel
        JobRecord record = pending("e1", NOW.plusSeconds(3600), "r1", "7");
        givenRecords(Map.of("e1", record));
        givenEvents();
        when(jobScheduler.cancel("7"))
                .thenThrow(new JobSchedulerException("atrm timed out"))
                .thenReturn(CancelResult.CANCELLED);

        // When
        SyncReport first = syncCalendarJobs.runCycle();

        // Then
        assertThat(first.status()).isEqualTo(CycleStatus.PARTIAL);
        assertThat(first.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.eventId()).isEqualTo("e1");
            assertThat(failure.action()).isEqualTo(ActionType.CANCEL);
            assertThat(failure.reason()).isEqualTo("atrm timed out");
        });
        verify(jobRecordStore).save(savedRecords.capture());
        Map<String, JobRecord> afterFirst = Map.copyOf(savedRecords.getValue());
        assertThat(afterFirst.get("e1").status()).isEqualTo(JobStatus.FAILED);
        assertThat(afterFirst.get("e1").jobHandle()).isEqualTo("7");

        // When - second cycle starts from what the first one saved
        givenRecords(afterFirst);
        SyncReport second = syncCalendarJobs.runCycle();

        // Then
        assertThat(second.status()).isEqualTo(CycleStatus.SUCCESS);
        assertThat(second.cancelled()).isEqualTo(1);
        verify(jobRecordStore, times(2)).save(savedRecords.capture());
        assertThat(savedRecords.getValue()).isEmpty();
    }

    @Test
    void shouldKeepGoingAfterSingleActionFailure() {
        // Given
        CalendarEvent bad = event("bad", NOW.plusSeconds(100), "r1");
        CalendarEvent good = event("good", NOW.plusSeconds(200), "r1");
        givenRecords(Map.of());
        givenEvents(bad, good);
        when(jobScheduler.submit(bad.startTime(), bad.actionSpec())).thenThrow(new JobSchedulerException("at refused"));
        when(jobScheduler.submit(good.startTime(), good.actionSpec())).thenReturn("5");

        // When
        SyncReport report = syncCalendarJobs.runCycle();

        // Then
        assertThat(report.status()).isEqualTo(CycleStatus.PARTIAL);
        assertThat(report.scheduled()).isEqualTo(1);
        assertThat(report.failed()).isEqualTo(1);
        verify(jobRecordStore).save(savedRecords.capture());
        assertThat(savedRecords.getValue().get("bad").status()).isEqualTo(JobStatus.FAILED);
        assertThat(savedRecords.getValue().get("good").jobHandle()).isEqualTo("5");
    }

    @Test
    void shouldTurnUnexpectedSchedulerErrorIntoActionFailure() {
        // Given
        CalendarEvent event = event("e1", NOW.plusSeconds(100), "r1");
        givenRecords(Map.of());
        givenEvents(event);
        when(jobScheduler.submit(any(), any())).thenThrow(new IllegalStateException("unexpected"));

        // When
        SyncReport report = syncCalendarJobs.runCycle();

        // Then
        assertThat(report.status()).isEqualTo(CycleStatus.PARTIAL);
        verify(jobRecordStore).save(savedRecords.capture());
        assertThat(savedRecords.getValue().get("e1").status()).isEqualTo(JobStatus.FAILED);
    }

    @Test
    void shouldAbortWithoutSideEffectsWhenStoreCannotBeLoaded() {
        // Given
        when(jobRecordStore.load()).thenThrow(new JobStoreException("connection refused", null));

        // When
        SyncReport report = syncCalendarJobs.runCycle();

        // Then
        assertThat(report.status()).isEqualTo(CycleStatus.ABORTED);
        assertThat(report.abortReason()).contains("connection refused");
        verifyNoInteractions(calendarEventSource, jobScheduler);
        verify(jobRecordStore, never()).save(anyMap());
        verify(syncStatusRepository).recordLastCycle(report);
    }

    @Test
    void shouldAbortWithoutSideEffectsWhenCalendarIsUnavailable() {
        // Given
        givenRecords(Map.of("e1", pending("e1", NOW.plusSeconds(3600), "r1", "7")));
        when(calendarEventSource.fetchEvents(any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new CalendarUnavailableException("HTTP 503")));

        // When
        SyncReport report = syncCalendarJobs.runCycle();

        // Then
        assertThat(report.status()).isEqualTo(CycleStatus.ABORTED);
        assertThat(report.abortReason()).contains("HTTP 503");
        verify(jobScheduler, never()).cancel(any());
        verify(jobScheduler, never()).submit(any(), any());
        verify(jobRecordStore, never()).save(anyMap());
    }

    @Test
    void shouldAbortWhenCalendarDoesNotAnswerInTime() {
        // Given
        properties.setFetchTimeout(Duration.ofMillis(50));
        givenRecords(Map.of());
        when(calendarEventSource.fetchEvents(any(), any())).thenReturn(new CompletableFuture<>());

        // When
        SyncReport report = syncCalendarJobs.runCycle();

        // Then
        assertThat(report.status()).isEqualTo(CycleStatus.ABORTED);
        verify(jobRecordStore, never()).save(anyMap());
    }

    @Test
    void shouldReportAbortWhenSaveFails() {
        // Given
        CalendarEvent event = event("e1", NOW.plusSeconds(3600), "r1");
        givenRecords(Map.of());
        givenEvents(event);
        when(jobScheduler.submit(any(), any())).thenReturn("1");
        doThrow(new JobStoreException("disk full", null)).when(jobRecordStore).save(anyMap());

        // When
        SyncReport report = syncCalendarJobs.runCycle();

        // Then
        assertThat(report.status()).isEqualTo(CycleStatus.ABORTED);
        assertThat(report.scheduled()).isEqualTo(1);
        assertThat(report.abortReason()).contains("disk full");
    }

    @Test
    void shouldProceedWhenLiveJobsCannotBeListed() {
        // Given
        CalendarEvent event = event("e1", NOW.plusSeconds(3600), "r1");
        when(jobRecordStore.load()).thenReturn(new LinkedHashMap<>(Map.of("e1", pending("e1", event.startTime(), "r1", "7"))));
        when(jobScheduler.liveHandles()).thenThrow(new JobSchedulerException("atq missing"));
        givenEvents(event);

        // When
        SyncReport report = syncCalendarJobs.runCycle();

        // Then
        assertThat(report.status()).isEqualTo(CycleStatus.SUCCESS);
        assertThat(report.unchanged()).isEqualTo(1);
        verify(jobScheduler, never()).submit(any(), any());
    }

    @Test
    void shouldRescheduleJobThatVanishedFromQueue() {
        // Given
        CalendarEvent event = event("e1", NOW.plusSeconds(3600), "r1");
        when(jobRecordStore.load()).thenReturn(new LinkedHashMap<>(Map.of("e1", pending("e1", event.startTime(), "r1", "7"))));
        when(jobScheduler.liveHandles()).thenReturn(Set.of());
        givenEvents(event);
        when(jobScheduler.submit(event.startTime(), event.actionSpec())).thenReturn("8");

        // When
        SyncReport report = syncCalendarJobs.runCycle();

        // Then
        assertThat(report.scheduled()).isEqualTo(1);
        verify(jobScheduler, never()).cancel(any());
        verify(jobRecordStore).save(savedRecords.capture());
        assertThat(savedRecords.getValue().get("e1").jobHandle()).isEqualTo("8");
    }

    @Test
    void shouldSkipWhenAnotherCycleIsRunning() {
        // When
        Optional<SyncReport> report = cycleGate.runIfIdle("reset", syncCalendarJobs::runCycle);

        // Then
        assertThat(report).hasValueSatisfying(r -> assertThat(r.status()).isEqualTo(CycleStatus.SKIPPED));
        verifyNoInteractions(jobRecordStore, calendarEventSource, jobScheduler);
    }

    @Test
    void shouldPersistCompletedActionsAndAbortWhenInterrupted() {
        // Given
        CalendarEvent first = event("a", NOW.plusSeconds(60), "r1");
        CalendarEvent second = event("b", NOW.plusSeconds(120), "r1");
        JobRecord previous = new JobRecord("b", NOW.plusSeconds(120), "r1", null, JobStatus.FAILED, NOW.minusSeconds(600));
        givenRecords(Map.of("b", previous));
        givenEvents(first, second);
        when(jobScheduler.submit(first.startTime(), first.actionSpec())).thenAnswer(invocation -> {
            Thread.currentThread().interrupt();
            return "1";
        });
        AtomicBoolean interruptedWhileSaving = new AtomicBoolean(true);
        doAnswer(invocation -> {
            interruptedWhileSaving.set(Thread.currentThread().isInterrupted());
            return null;
        }).when(jobRecordStore).save(anyMap());

        try {
            // When
            SyncReport report = syncCalendarJobs.runCycle();

            // Then
            assertThat(report.status()).isEqualTo(CycleStatus.ABORTED);
            assertThat(report.abortReason()).isEqualTo("Interrupted after applying 1 of 2 actions");
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
            assertThat(interruptedWhileSaving).isFalse();
            verify(jobScheduler, never()).submit(second.startTime(), second.actionSpec());
            verify(jobRecordStore).save(savedRecords.capture());
            assertThat(savedRecords.getValue().get("a").jobHandle()).isEqualTo("1");
            assertThat(savedRecords.getValue().get("b")).isEqualTo(previous);
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void shouldApplyActionsConcurrentlyWhenConfigured() {
        // Given
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            properties.setApplyParallelism(4);
            syncCalendarJobs = newSyncCalendarJobs(pool);
            List<CalendarEvent> events = List.of(
                    event("a", NOW.plusSeconds(10), "r1"),
                    event("b", NOW.plusSeconds(20), "r1"),
                    event("c", NOW.plusSeconds(30), "r1"),
                    event("d", NOW.plusSeconds(40), "r1"));
            givenRecords(Map.of("gone", pending("gone", NOW.plusSeconds(50), "r1", "99")));
            when(calendarEventSource.fetchEvents(any(), any())).thenReturn(CompletableFuture.completedFuture(events));
            when(jobScheduler.cancel("99")).thenReturn(CancelResult.CANCELLED);
            for (CalendarEvent event : events) {
                when(jobScheduler.submit(eq(event.startTime()), eq(event.actionSpec()))).thenReturn("h-" + event.eventId());
            }

            // When
            SyncReport report = syncCalendarJobs.runCycle();

            // Then
            assertThat(report.status()).isEqualTo(CycleStatus.SUCCESS);
            assertThat(report.scheduled()).isEqualTo(4);
            assertThat(report.cancelled()).isEqualTo(1);
            verify(jobRecordStore).save(savedRecords.capture());
            assertThat(savedRecords.getValue().values().stream().map(JobRecord::jobHandle).collect(Collectors.toSet()))
                    .containsExactlyInAnyOrder("h-a", "h-b", "h-c", "h-d");
        } finally {
            pool.shutdownNow();
        }
    }

    private SyncCalendarJobs newSyncCalendarJobs(Executor applyExecutor) {
        return new SyncCalendarJobs(calendarEventSource, jobRecordStore, jobScheduler, new Reconciler(),
                new JobActionExecutor(jobScheduler, clock), syncStatusRepository, cycleGate, clock, properties,
                applyExecutor);
    }

    private void givenRecords(Map<String, JobRecord> records) {
        when(jobRecordStore.load()).thenReturn(new LinkedHashMap<>(records));
        lenient().when(jobScheduler.liveHandles()).thenReturn(records.values().stream()
                .filter(JobRecord::hasJobHandle)
                .map(JobRecord::jobHandle)
                .collect(Collectors.toSet()));
    }

    private void givenEvents(CalendarEvent... events) {
        when(calendarEventSource.fetchEvents(any(), any()))
                .thenReturn(CompletableFuture.completedFuture(List.of(events)));
    }

    private static CalendarEvent event(String id, Instant start, String revision) {
        return new CalendarEvent(id, start, "notify-send " + id, revision);
    }

    private static JobRecord pending(String id, Instant at, String revision, String handle) {
        return new JobRecord(id, at, revision, handle, JobStatus.PENDING, NOW.minusSeconds(600));
    }
}
