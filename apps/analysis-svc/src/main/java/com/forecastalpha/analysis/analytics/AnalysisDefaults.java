package com.forecastalpha.analysis.analytics;

public final class AnalysisDefaults {

    public static final double ANOMALY_THRESHOLD = 3.0d;
    public static final int FORECAST_PERIODS = 3;
    public static final int MAX_FORECAST_PERIODS = 365;

    /**
     * Hard ceiling on any forecast horizon, whatever {@code max-forecast-periods} is configured to.
     */
    public static final int FORECAST_PERIODS_CEILING = 10_000;
    public static final int ROW_LIMIT = 10_000;
    public static final long SAMPLING_SEED = 42L;

    /**
     * Isolation-forest rows whose decision score is at or below this percentile are flagged.
     */
    public static final double ISOLATION_PERCENTILE = 2.0d;
    public static final double ISOLATION_HIGH_MARGIN = 0.1d;

    private AnalysisDefaults() {
    }
}
