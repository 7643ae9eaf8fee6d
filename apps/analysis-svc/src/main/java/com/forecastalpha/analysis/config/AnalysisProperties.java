package com.forecastalpha.analysis.config;

import com.forecastalpha.analysis.analytics.AnalysisDefaults;
import com.forecastalpha.analysis.model.AnomalyMethod;
import com.forecastalpha.analysis.model.ForecastMethod;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "forecastalpha")
public record AnalysisProperties(
        String environment,
        Analysis analysis
) {

    @ConstructorBinding
    public AnalysisProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (analysis == null) {
            analysis = Analysis.defaults();
        }
    }

    public record Analysis(
            Double anomalyThreshold,
            Integer forecastPeriods,
            String anomalyMethod,
            String forecastMethod,
            Integer maxSamples,
            Integer rowLimit,
            Long samplingSeed,
            Integer maxForecastPeriods
    ) {
        public Analysis {
            if (anomalyThreshold == null) {
                anomalyThreshold = AnalysisDefaults.ANOMALY_THRESHOLD;
            }
            if (anomalyThreshold <= 0) {
                throw new IllegalArgumentException("anomalyThreshold must be positive");
            }
            if (forecastPeriods == null) {
                forecastPeriods = AnalysisDefaults.FORECAST_PERIODS;
            }
            if (forecastPeriods <= 0) {
                throw new IllegalArgumentException("forecastPeriods must be positive");
            }
            if (anomalyMethod == null || anomalyMethod.isBlank()) {
                anomalyMethod = AnomalyMethod.ZSCORE.wireName();
            } else if (AnomalyMethod.fromWireName(anomalyMethod).isEmpty()) {
                throw new IllegalArgumentException("unknown anomalyMethod '" + anomalyMethod + "'");
            }
            if (forecastMethod == null || forecastMethod.isBlank()) {
                forecastMethod = ForecastMethod.LINEAR_REGRESSION.wireName();
            } else if (ForecastMethod.fromWireName(forecastMethod).isEmpty()) {
                throw new IllegalArgumentException("unknown forecastMethod '" + forecastMethod + "'");
            }
            // maxSamples is optional; null means no cap
            if (maxSamples != null && maxSamples <= 0) {
                throw new IllegalArgumentException("maxSamples must be positive when set");
            }
            if (rowLimit == null) {
                rowLimit = AnalysisDefaults.ROW_LIMIT;
            }
            if (rowLimit <= 0) {
                throw new IllegalArgumentException("rowLimit must be positive");
            }
            if (samplingSeed == null) {
                samplingSeed = AnalysisDefaults.SAMPLING_SEED;
            }
            if (maxForecastPeriods == null) {
                maxForecastPeriods = Math.max(AnalysisDefaults.MAX_FORECAST_PERIODS, forecastPeriods);
            }
            if (maxForecastPeriods <= 0 || maxForecastPeriods > AnalysisDefaults.FORECAST_PERIODS_CEILING) {
                throw new IllegalArgumentException(
                        "maxForecastPeriods must be between 1 and " + AnalysisDefaults.FORECAST_PERIODS_CEILING);
            }
            if (forecastPeriods > maxForecastPeriods) {
                throw new IllegalArgumentException("forecastPeriods must not exceed maxForecastPeriods");
            }
        }

        public static Analysis defaults() {
            return new Analysis(null, null, null, null, null, null, null, null);
        }

        public AnomalyMethod defaultAnomalyMethod() {
            return AnomalyMethod.fromWireName(anomalyMethod).orElse(AnomalyMethod.ZSCORE);
        }

        public ForecastMethod defaultForecastMethod() {
            return ForecastMethod.fromWireName(forecastMethod).orElse(ForecastMethod.LINEAR_REGRESSION);
        }
    }
}
