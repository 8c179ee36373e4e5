package com.calcron.infrastructure.adapter.calendar.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GoogleEventListDto(
        List<GoogleEventDto> items,
        String nextPageToken,
        String timeZone
) {}
