package com.calcron.domain.model;

import java.util.Objects;

/**
 * Result of applying one {@link SyncAction}.
 *
 * <p>{@code record} is the record to persist for the event, or {@code null} when the
 * record must be removed. {@code failureReason} is set only when {@code succeeded} is false.
 */
public record ActionOutcome(
        SyncAction action,
        boolean succeeded,
        JobRecord record,
        String failureReason
) {
    public ActionOutcome {
        Objects.requireNonNull(action, "action");
        if (!succeeded && failureReason == null) {
            throw new IllegalArgumentException("A failed outcome needs a reason");
        }
    }

    public static ActionOutcome success(SyncAction action, JobRecord record) {
        return new ActionOutcome(action, true, record, null);
    }

    public static ActionOutcome removed(SyncAction action) {
        return new ActionOutcome(action, true, null, null);
    }

    public static ActionOutcome failure(SyncAction action, JobRecord record, String reason) {
        return new ActionOutcome(action, false, Objects.requireNonNull(record, "record"), reason);
    }

    public String eventId() {
        return action.eventId();
    }

    public boolean removesRecord() {
        return record == null;
    }
}
