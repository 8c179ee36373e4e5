package com.calcron.infrastructure.web.dto;

public record SyncStatusResponse(
        String phase,
        boolean busy,
        SyncReportResponse last_cycle
) {}
