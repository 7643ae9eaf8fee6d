package com.forecastalpha.analysis.model;

import java.util.List;

public record AnalysisResult(
        List<AnomalyRecord> anomalies,
        List<ForecastPoint> forecast,
        List<HistoricalPoint> historical,
        Metrics metrics,
        List<String> pipelineSteps
) {
    public AnalysisResult {
        anomalies = List.copyOf(anomalies);
        forecast = List.copyOf(forecast);
        historical = List.copyOf(historical);
        pipelineSteps = List.copyOf(pipelineSteps);
    }

    /**
     * Exactly one of {@code zScore} and {@code score} is set, depending on the detection method.
     */
    public record AnomalyRecord(
            String timestamp,
            String metric,
            Severity severity,
            Double value,
            Double zScore,
            Double score
    ) {
        public enum Severity {
            MEDIUM,
            HIGH
        }
    }

    public record ForecastPoint(String date, double prediction) {
    }

    public record HistoricalPoint(String date, double value) {
    }

    public record Metrics(
            int rows,
            int anomalies,
            int forecastHorizon,
            AnomalyMethod anomalyMethod,
            ForecastMethod forecastMethod,
            String targetColumn
    ) {
    }
}
