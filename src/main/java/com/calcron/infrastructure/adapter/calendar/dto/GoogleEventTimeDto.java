package com.calcron.infrastructure.adapter.calendar.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Either {@code dateTime} (RFC 3339 with offset) or {@code date} (all-day event) is set.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GoogleEventTimeDto(
        String dateTime,
        String date,
        String timeZone
) {}
