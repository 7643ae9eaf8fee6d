package com.forecastalpha.analysis.controller.dto;

public record ConnectionResponseDto(String status, String connectionId) {
}
