package com.forecastalpha.analysis.model;

import java.util.List;

/**
 * Caller-supplied analysis parameters as received. Null fields fall back to configured defaults,
 * method names are resolved leniently.
 */
public record AnalysisRequest(
        String targetColumn,
        String dateColumn,
        List<String> featureColumns,
        Integer limit,
        Integer maxRows,
        String anomalyMethod,
        String forecastMethod,
        Double anomalyThreshold,
        Integer forecastPeriods
) {
    public AnalysisRequest {
        featureColumns = featureColumns == null ? List.of() : List.copyOf(featureColumns);
        if (dateColumn != null && dateColumn.isBlank()) {
            dateColumn = null;
        }
    }

    public static AnalysisRequest forTarget(String targetColumn, String dateColumn) {
        return new AnalysisRequest(targetColumn, dateColumn, List.of(), null, null, null, null, null, null);
    }
}
