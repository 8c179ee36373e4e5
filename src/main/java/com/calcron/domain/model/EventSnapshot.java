package com.calcron.domain.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable view of the calendar occurrences relevant to one sync cycle.
 *
 * <p>{@code referenceTime} is the cycle's "now": nothing at or before it is ever scheduled.
 * Event ids are unique; when the source reports an id twice, the later entry wins.
 */
public record EventSnapshot(
        Instant referenceTime,
        Instant horizonEnd,
        List<CalendarEvent> events
) {
    private static final Comparator<CalendarEvent> BY_START =
            Comparator.comparing(CalendarEvent::startTime).thenComparing(CalendarEvent::eventId);

    public EventSnapshot {
        Objects.requireNonNull(referenceTime, "referenceTime");
        Objects.requireNonNull(horizonEnd, "horizonEnd");
        if (horizonEnd.isBefore(referenceTime)) {
            throw new IllegalArgumentException("Horizon end " + horizonEnd + " is before reference time " + referenceTime);
        }
        events = List.copyOf(events);
    }

    public static EventSnapshot of(Instant referenceTime, Instant horizonEnd, List<CalendarEvent> events) {
        Map<String, CalendarEvent> unique = new LinkedHashMap<>();
        for (CalendarEvent event : events) {
            unique.put(event.eventId(), event);
        }

        List<CalendarEvent> sorted = unique.values().stream()
                .sorted(BY_START)
                .toList();

        return new EventSnapshot(referenceTime, horizonEnd, sorted);
    }

    public static EventSnapshot empty(Instant referenceTime, Instant horizonEnd) {
        return new EventSnapshot(referenceTime, horizonEnd, List.of());
    }

    public Map<String, CalendarEvent> byId() {
        Map<String, CalendarEvent> index = new LinkedHashMap<>();
        for (CalendarEvent event : events) {
            if (index.put(event.eventId(), event) != null) {
                throw new IllegalStateException("Duplicate event id in snapshot: " + event.eventId());
            }
        }
        return index;
    }

    public boolean isUpcoming(CalendarEvent event) {
        return event.startTime().isAfter(referenceTime);
    }

    public int size() {
        return events.size();
    }
}
