package com.forecastalpha.analysis.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final AnalysisProperties props;

    public StartupDiagnostics(AnalysisProperties props) {
        this.props = props;
    }

    @PostConstruct
    void logConfig() {
        var analysis = props.analysis();
        log.info("Startup diagnostics: environment='{}'", props.environment());
        log.info("Analysis defaults: anomalyMethod='{}', threshold={}, forecastMethod='{}', periods={} (max {}), maxSamples={}, rowLimit={}, seed={}",
                analysis.defaultAnomalyMethod().wireName(), analysis.anomalyThreshold(),
                analysis.defaultForecastMethod().wireName(), analysis.forecastPeriods(), analysis.maxForecastPeriods(),
                analysis.maxSamples(), analysis.rowLimit(), analysis.samplingSeed());
    }
}
