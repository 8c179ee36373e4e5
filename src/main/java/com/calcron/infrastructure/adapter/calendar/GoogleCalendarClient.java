package com.calcron.infrastructure.adapter.calendar;

import com.calcron.domain.exception.CalendarUnavailableException;
import com.calcron.domain.model.CalendarEvent;
import com.calcron.domain.port.out.CalendarEventSource;
import com.calcron.infrastructure.adapter.calendar.dto.GoogleEventDto;
import com.calcron.infrastructure.adapter.calendar.dto.GoogleEventListDto;
import com.calcron.infrastructure.config.CalendarProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.github.resilience4j.timelimiter.annotation.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import retrofit2.Response;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Reads the events of one Google calendar, page by page.
 * A fetch either returns every event of the window or fails: there is no fallback to an empty list,
 * since an empty snapshot would cancel every scheduled job.
 */
@Component
public class GoogleCalendarClient implements CalendarEventSource {

    private static final Logger logger = LoggerFactory.getLogger(GoogleCalendarClient.class);

    private final GoogleCalendarApi calendarApi;
    private final GoogleCalendarEventMapper eventMapper;
    private final CalendarProperties properties;

    public GoogleCalendarClient(GoogleCalendarApi calendarApi,
                                GoogleCalendarEventMapper eventMapper,
                                CalendarProperties properties) {
        this.calendarApi = calendarApi;
        this.eventMapper = eventMapper;
        this.properties = properties;
    }

    @Override
    @CircuitBreaker(name = "calendar-source")
    @Retry(name = "calendar-source")
    @TimeLimiter(name = "calendar-source")
    public CompletableFuture<List<CalendarEvent>> fetchEvents(Instant from, Instant to) {
        return CompletableFuture.supplyAsync(() -> fetchAllPages(from, to));
    }

    List<CalendarEvent> fetchAllPages(Instant from, Instant to) {
        if (properties.getCalendarId() == null || properties.getCalendarId().isBlank()) {
            throw new CalendarUnavailableException("No calendar id configured (calcron.calendar.calendar-id)");
        }

        logger.debug("Fetching events of {} between {} and {}", properties.getCalendarId(), from, to);

        List<GoogleEventDto> items = new ArrayList<>();
        String calendarTimeZone = null;
        String pageToken = null;
        int pages = 0;

        do {
            if (++pages > properties.getMaxPages()) {
                throw new CalendarUnavailableException("Calendar returned more than " + properties.getMaxPages() + " pages");
            }

            GoogleEventListDto page = fetchPage(from, to, pageToken);
            if (page.items() != null) {
                items.addAll(page.items());
            }
            if (page.timeZone() != null) {
                calendarTimeZone = page.timeZone();
            }
            pageToken = page.nextPageToken();

        } while (pageToken != null && !pageToken.isBlank());

        List<CalendarEvent> events = eventMapper.mapToEvents(items, calendarTimeZone);
        logger.info("Fetched {} calendar items in {} page(s), {} relevant events", items.size(), pages, events.size());
        return events;
    }

    private GoogleEventListDto fetchPage(Instant from, Instant to, String pageToken) {
        Response<GoogleEventListDto> response;
        try {
            response = calendarApi.listEvents(
                    properties.getCalendarId(),
                    from.toString(),
                    to.toString(),
                    true,
                    "startTime",
                    properties.getMaxResults(),
                    pageToken,
                    blankToNull(properties.getApiKey())
            ).execute();
        } catch (IOException e) {
            logger.error("I/O error fetching calendar events: {}", e.getMessage());
            throw new CalendarUnavailableException("Failed to reach the calendar API", e);
        }

        if (!response.isSuccessful()) {
            logger.warn("Calendar API answered {} {}", response.code(), response.message());
            throw new CalendarUnavailableException("Calendar API returned HTTP " + response.code());
        }
        if (response.body() == null) {
            throw new CalendarUnavailableException("Calendar API returned an empty body");
        }
        return response.body();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
