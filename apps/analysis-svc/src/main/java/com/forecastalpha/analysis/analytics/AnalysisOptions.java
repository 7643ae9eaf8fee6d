package com.forecastalpha.analysis.analytics;

import com.forecastalpha.analysis.model.AnomalyMethod;
import com.forecastalpha.analysis.model.ForecastMethod;
import java.util.List;

/**
 * Fully resolved parameters of one pipeline run.
 *
 * @param limit      requested row limit
 * @param maxRows    optional hard cap; the row source fetches {@code min(limit, maxRows)} rows
 * @param maxSamples optional cap on the anomaly-detection working set
 */
public record AnalysisOptions(
        String targetColumn,
        String dateColumn,
        List<String> featureColumns,
        int limit,
        Integer maxRows,
        AnomalyMethod anomalyMethod,
        ForecastMethod forecastMethod,
        double anomalyThreshold,
        int forecastPeriods,
        Integer maxSamples,
        long samplingSeed
) {
    public AnalysisOptions {
        if (targetColumn == null || targetColumn.isBlank()) {
            throw new IllegalArgumentException("targetColumn must be provided");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        if (maxRows != null && maxRows <= 0) {
            throw new IllegalArgumentException("maxRows must be positive");
        }
        if (forecastPeriods <= 0) {
            throw new IllegalArgumentException("forecastPeriods must be positive");
        }
        featureColumns = featureColumns == null ? List.of() : List.copyOf(featureColumns);
    }

    public int effectiveRowLimit() {
        return maxRows == null ? limit : Math.min(limit, maxRows);
    }

    public DetectionSettings detectionSettings() {
        return new DetectionSettings(anomalyMethod, anomalyThreshold, maxSamples, samplingSeed, featureColumns);
    }
}
