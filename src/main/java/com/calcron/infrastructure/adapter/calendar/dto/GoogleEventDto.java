package com.calcron.infrastructure.adapter.calendar.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GoogleEventDto(
        String id,
        String status,
        String summary,
        String description,
        String location,
        String updated,
        GoogleEventTimeDto start,
        GoogleEventTimeDto end
) {
    public boolean isCancelled() {
        return "cancelled".equals(status);
    }
}
