package com.calcron.domain.reconcile;

import com.calcron.domain.model.ActionType;
import com.calcron.domain.model.CalendarEvent;
import com.calcron.domain.model.EventSnapshot;
import com.calcron.domain.model.JobRecord;
import com.calcron.domain.model.SyncAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes the actions that make the job queue match a calendar snapshot.
 *
 * <p>Pure: no I/O, no clock. Every event in the snapshot and every record without an
 * event yields exactly one action. The returned list holds all cancels first, then
 * schedules and reschedules, then no-ops; each group ascending by start time.
 */
@Component
public class Reconciler {

    private static final Logger logger = LoggerFactory.getLogger(Reconciler.class);

    private static final Comparator<SyncAction> EXECUTION_ORDER =
            Comparator.<SyncAction>comparingInt(action -> groupOf(action.type()))
                    .thenComparing(SyncAction::sortTime)
                    .thenComparing(SyncAction::eventId);

    public List<SyncAction> reconcile(EventSnapshot snapshot, Map<String, JobRecord> records) {
        return reconcile(snapshot, records, null);
    }

    /**
     * @param liveHandles handles the external scheduler currently holds, or {@code null} when unknown
     */
    public List<SyncAction> reconcile(EventSnapshot snapshot,
                                      Map<String, JobRecord> records,
                                      Set<String> liveHandles) {
        Map<String, CalendarEvent> events = snapshot.byId();
        List<SyncAction> actions = new ArrayList<>(events.size() + records.size());

        for (CalendarEvent event : events.values()) {
            JobRecord record = records.get(event.eventId());
            actions.add(decide(snapshot, event, record, liveHandles));
        }

        for (JobRecord record : records.values()) {
            if (!events.containsKey(record.eventId())) {
                actions.add(SyncAction.cancel(record));
            }
        }

        actions.sort(EXECUTION_ORDER);
        logger.debug("Reconciled {} events against {} records into {} actions",
                events.size(), records.size(), actions.size());
        return actions;
    }

    private SyncAction decide(EventSnapshot snapshot, CalendarEvent event, JobRecord record, Set<String> liveHandles) {
        if (!snapshot.isUpcoming(event)) {
            // Never schedule into the past; a leftover record is cleaned up.
            return record != null ? SyncAction.cancel(record) : SyncAction.noOp(event, null);
        }

        if (record == null) {
            return SyncAction.schedule(event);
        }

        if (!record.isPending()) {
            return record.hasJobHandle()
                    ? SyncAction.reschedule(event, record)
                    : SyncAction.schedule(event);
        }

        if (!record.revisionToken().equals(event.revisionToken())) {
            return SyncAction.reschedule(event, record);
        }

        if (liveHandles != null && !liveHandles.contains(record.jobHandle())) {
            logger.warn("Job {} for event {} is no longer known to the scheduler, scheduling again",
                    record.jobHandle(), event.eventId());
            return SyncAction.schedule(event);
        }

        return SyncAction.noOp(event, record);
    }

    static int groupOf(ActionType type) {
        return switch (type) {
            case CANCEL -> 0;
            case SCHEDULE, RESCHEDULE -> 1;
            case NOOP -> 2;
        };
    }
}
