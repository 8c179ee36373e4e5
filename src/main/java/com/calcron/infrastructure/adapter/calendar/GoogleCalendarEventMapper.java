package com.calcron.infrastructure.adapter.calendar;

import com.calcron.domain.exception.CalendarUnavailableException;
import com.calcron.domain.model.CalendarEvent;
import com.calcron.infrastructure.adapter.calendar.dto.GoogleEventDto;
import com.calcron.infrastructure.adapter.calendar.dto.GoogleEventTimeDto;
import com.calcron.infrastructure.config.CalendarProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Component
public class GoogleCalendarEventMapper {

    private static final Logger logger = LoggerFactory.getLogger(GoogleCalendarEventMapper.class);

    private final CalendarProperties properties;

    public GoogleCalendarEventMapper(CalendarProperties properties) {
        this.properties = properties;
    }

    /**
     * Maps Google events to calendar events.
     * Cancelled events and events without a description are dropped.
     * When an id shows up twice the most recently updated copy is kept.
     *
     * @param items events of all fetched pages
     * @param calendarTimeZone zone reported by the calendar itself, may be {@code null}
     * @throws CalendarUnavailableException if a relevant event cannot be mapped, since leaving it out
     *         would cancel its job
     */
    public List<CalendarEvent> mapToEvents(List<GoogleEventDto> items, String calendarTimeZone) {
        Map<String, GoogleEventDto> latest = new LinkedHashMap<>();
        items.stream()
                .filter(item -> item != null && item.id() != null)
                .filter(item -> !item.isCancelled())
                .filter(item -> item.description() != null && !item.description().isBlank())
                .forEach(item -> latest.merge(item.id(), item, GoogleCalendarEventMapper::moreRecent));

        return latest.values().stream()
                .map(item -> mapToEvent(item, calendarTimeZone))
                .toList();
    }

    private CalendarEvent mapToEvent(GoogleEventDto item, String calendarTimeZone) {
        try {
            Instant start = toInstant(item.start(), calendarTimeZone);
            String payload = buildPayload(item);

            return new CalendarEvent(item.id(), start, payload, revisionToken(start, payload));

        } catch (DateTimeException | IllegalArgumentException e) {
            logger.error("Failed to map calendar event {} - {}", item.id(), e.getMessage());
            throw new CalendarUnavailableException("Calendar event " + item.id() + " cannot be mapped", e);
        }
    }

    /**
     * The description is the command, unless a wrapper script is configured, in which case the
     * wrapper receives the event fields as shell-quoted arguments.
     */
    String buildPayload(GoogleEventDto item) {
        String description = item.description().strip();
        if (properties.getActionWrapper() == null || properties.getActionWrapper().isBlank()) {
            return description;
        }

        String arguments = Stream.of(
                        rawTime(item.start()),
                        rawTime(item.end() != null ? item.end() : item.start()),
                        item.summary(),
                        item.location(),
                        description)
                .map(GoogleCalendarEventMapper::shellQuote)
                .collect(Collectors.joining(" "));
        return properties.getActionWrapper() + " " + arguments;
    }

    static String revisionToken(Instant start, String payload) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(start.toString().getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(payload.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String shellQuote(String value) {
        if (value == null) {
            return "''";
        }
        return "'" + value.replace("'", "'\\''") + "'";
    }

    private Instant toInstant(GoogleEventTimeDto time, String calendarTimeZone) {
        if (time == null) {
            throw new IllegalArgumentException("event has no start");
        }
        if (time.dateTime() != null) {
            return OffsetDateTime.parse(time.dateTime()).toInstant();
        }
        if (time.date() != null) {
            ZoneId zone = time.timeZone() != null ? ZoneId.of(time.timeZone()) : fallbackZone(calendarTimeZone);
            return LocalDate.parse(time.date()).atStartOfDay(zone).toInstant();
        }
        throw new IllegalArgumentException("event start has neither dateTime nor date");
    }

    private ZoneId fallbackZone(String calendarTimeZone) {
        if (properties.getTimeZone() != null && !properties.getTimeZone().isBlank()) {
            return ZoneId.of(properties.getTimeZone());
        }
        if (calendarTimeZone != null && !calendarTimeZone.isBlank()) {
            return ZoneId.of(calendarTimeZone);
        }
        return ZoneOffset.UTC;
    }

    private static String rawTime(GoogleEventTimeDto time) {
        if (time == null) {
            return "";
        }
        return time.dateTime() != null ? time.dateTime() : time.date();
    }

    private static GoogleEventDto moreRecent(GoogleEventDto existing, GoogleEventDto candidate) {
        if (existing.updated() == null || candidate.updated() == null) {
            return candidate;
        }
        try {
            return OffsetDateTime.parse(candidate.updated()).isBefore(OffsetDateTime.parse(existing.updated()))
                    ? existing
                    : candidate;
        } catch (DateTimeParseException e) {
            return candidate;
        }
    }
}
