package com.forecastalpha.analysis.controller.dto;

import java.util.Map;

/**
 * Error envelope returned by every endpoint; {@code details} is never null.
 */
public record ErrorResponseDto(String code, String message, Map<String, Object> details, String traceId) {

    public ErrorResponseDto {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
