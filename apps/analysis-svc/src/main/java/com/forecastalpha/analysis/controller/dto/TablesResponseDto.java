package com.forecastalpha.analysis.controller.dto;

import java.util.List;

public record TablesResponseDto(String status, List<TableDto> tables) {

    public record TableDto(String name, List<String> columns) {
    }
}
