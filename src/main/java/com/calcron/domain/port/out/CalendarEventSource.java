package com.calcron.domain.port.out;

import com.calcron.domain.model.CalendarEvent;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for reading calendar occurrences.
 * Domain doesn't care about HTTP, JSON, OAuth, etc.
 */
public interface CalendarEventSource {

    /**
     * Fetches every occurrence that starts or is still running between {@code from} and {@code to},
     * normalized to UTC with recurrences expanded.
     *
     * <p>The future completes exceptionally with a
     * {@link com.calcron.domain.exception.CalendarUnavailableException} when any part of the
     * range could not be read. It never completes with a partial list.
     *
     * @param from lower bound of the sync horizon, inclusive
     * @param to upper bound of the sync horizon, exclusive
     * @return A CompletableFuture with the occurrences found in the range.
     */
    CompletableFuture<List<CalendarEvent>> fetchEvents(Instant from, Instant to);
}
