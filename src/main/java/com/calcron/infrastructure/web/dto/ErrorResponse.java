package com.calcron.infrastructure.web.dto;

public record ErrorResponse(
        String error,
        String message
) {}
