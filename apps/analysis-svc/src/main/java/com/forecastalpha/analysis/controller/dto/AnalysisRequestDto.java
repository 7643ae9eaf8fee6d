package com.forecastalpha.analysis.controller.dto;

import com.forecastalpha.analysis.analytics.AnalysisDefaults;
import com.forecastalpha.analysis.model.AnalysisRequest;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.util.List;

public record AnalysisRequestDto(
        @NotBlank String connectionId,
        @NotBlank String table,
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
