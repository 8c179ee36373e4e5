package com.calcron.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One concrete calendar occurrence, normalized to UTC.
 * Recurring series arrive already expanded, one instance per occurrence.
 */
public record CalendarEvent(
        String eventId,
        Instant startTime,
        String actionSpec,
        String revisionToken
) {
    public CalendarEvent {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(startTime, "startTime");
        Objects.requireNonNull(actionSpec, "actionSpec");
        Objects.requireNonNull(revisionToken, "revisionToken");
    }
}
