package com.forecastalpha.analysis.controller.dto;

import com.forecastalpha.analysis.analytics.AnalysisDefaults;
import com.forecastalpha.analysis.model.AnalysisRequest;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.List;
import java.util.Map;

/**
 * Inline variant of {@link AnalysisRequestDto}: rows travel in the request body.
 */
public record DatasetAnalysisRequestDto(
        @NotNull List<Map<String, Object>> rows,
        @NotBlank String targetColumn,
        String dateColumn,
        List<String> featureColumns,
        @Min(1) Integer limit,
        @Min(1) Integer maxRows,
        String anomalyMethod,
        String forecastMethod,
        @Positive Double anomalyThreshold,
        @Min(1) @Max(AnalysisDefaults.FORECAST_PERIODS_CEILING) Integer forecastPeriods
) {
    public AnalysisRequest toAnalysisRequest() {
        return new AnalysisRequest(
                targetColumn,
                dateColumn,
                featureColumns,
                limit,
                maxRows,
                anomalyMethod,
                forecastMethod,
                anomalyThreshold,
                forecastPeriods
        );
    }
}
