package com.forecastalpha.analysis.analytics;

import com.forecastalpha.analysis.model.AnomalyMethod;
import java.util.List;

/**
 * Parameters for one detection call.
 *
 * @param featureColumns optional restriction of the isolation-forest feature matrix; the target
 *                       column is always included
 */
public record DetectionSettings(
        AnomalyMethod method,
        double threshold,
        Integer maxSamples,
        long seed,
        List<String> featureColumns
) {
    public DetectionSettings {
        if (method == null) {
            throw new IllegalArgumentException("method must be provided");
        }
        if (maxSamples != null && maxSamples <= 0) {
            throw new IllegalArgumentException("maxSamples must be positive");
        }
        featureColumns = featureColumns == null ? List.of() : List.copyOf(featureColumns);
    }

    public static DetectionSettings of(AnomalyMethod method, double threshold) {
        return new DetectionSettings(method, threshold, null, AnalysisDefaults.SAMPLING_SEED, List.of());
    }
}
