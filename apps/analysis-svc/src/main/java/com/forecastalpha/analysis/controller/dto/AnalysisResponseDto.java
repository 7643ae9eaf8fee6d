package com.forecastalpha.analysis.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

public record AnalysisResponseDto(
        String status,
        List<AnomalyDto> anomalies,
        List<ForecastPointDto> forecast,
        List<HistoricalPointDto> historical,
        MetricsDto metrics,
        List<String> pipelineSteps
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record AnomalyDto(
            String timestamp,
            String metric,
            String severity,
            Double value,
            Double zScore,
            Double score
    ) {
    }

    public record ForecastPointDto(String date, double prediction) {
    }

    public record HistoricalPointDto(String date, double value) {
    }

    public record MetricsDto(
            int rows,
            int anomalies,
            int forecastHorizon,
            String anomalyMethod,
            String forecastMethod,
            String targetColumn
    ) {
    }
}
