package com.forecastalpha.analysis.controller.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.Map;

public record ConnectionRequestDto(
        String driver,
        String host,
        @Min(1) @Max(65535) Integer port,
        String username,
        String password,
        String database,
        Boolean ssl,
        Map<String, String> options,
        String jdbcUrl
) {
    @Override
    public String toString() {
        return "ConnectionRequestDto[driver=" + driver + ", host=" + host + ", port=" + port
                + ", database=" + database + ", username=" + username + ", password=***]";
    }
}
