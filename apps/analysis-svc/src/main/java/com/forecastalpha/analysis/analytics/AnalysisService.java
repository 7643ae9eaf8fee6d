package com.forecastalpha.analysis.analytics;

import com.forecastalpha.analysis.config.AnalysisProperties;
import com.forecastalpha.analysis.datasource.ConnectionDescriptor;
import com.forecastalpha.analysis.datasource.ConnectionRegistry;
import com.forecastalpha.analysis.datasource.TableSource;
import com.forecastalpha.analysis.datasource.TableSourceFactory;
import com.forecastalpha.analysis.datasource.UnknownConnectionException;
import com.forecastalpha.analysis.model.AnalysisRequest;
import com.forecastalpha.analysis.model.AnalysisResult;
import com.forecastalpha.analysis.model.AnomalyMethod;
import com.forecastalpha.analysis.model.ForecastMethod;
import com.forecastalpha.analysis.model.Table;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Resolves caller parameters against configured defaults and feeds rows from a registered
 * connection or an inline dataset through the {@link PipelineRunner}.
 */
@Service
public class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    private final PipelineRunner pipelineRunner;
    private final ConnectionRegistry connectionRegistry;
    private final TableSourceFactory tableSourceFactory;
    private final AnalysisProperties properties;

    public AnalysisService(
            PipelineRunner pipelineRunner,
            ConnectionRegistry connectionRegistry,
            TableSourceFactory tableSourceFactory,
            AnalysisProperties properties
    ) {
        this.pipelineRunner = pipelineRunner;
        this.connectionRegistry = connectionRegistry;
        this.tableSourceFactory = tableSourceFactory;
        this.properties = properties;
    }

    public AnalysisResult analyzeConnection(String connectionId, String tableName, AnalysisRequest request) {
        AnalysisOptions options = resolveOptions(request);
        ConnectionDescriptor descriptor = connectionRegistry.resolve(connectionId)
                .orElseThrow(() -> new UnknownConnectionException(connectionId));
        TableSource source = tableSourceFactory.open(descriptor);
        Table raw = source.fetch(tableName, options.effectiveRowLimit());
        log.info("Analyzing table '{}' via connection {}: rows={}, target='{}'",
                tableName, connectionId, raw.rowCount(), options.targetColumn());
        return pipelineRunner.run(raw, options);
    }

    public AnalysisResult analyzeDataset(List<? extends Map<String, ?>> rows, AnalysisRequest request) {
        AnalysisOptions options = resolveOptions(request);
        List<? extends Map<String, ?>> records = rows == null ? List.of() : rows;
        int limit = options.effectiveRowLimit();
        if (records.size() > limit) {
            log.info("Inline dataset truncated from {} to {} rows", records.size(), limit);
            records = records.subList(0, limit);
        }
        return pipelineRunner.run(Table.fromRecords(records), options);
    }

    AnalysisOptions resolveOptions(AnalysisRequest request) {
        AnalysisProperties.Analysis defaults = properties.analysis();
        AnomalyMethod anomalyMethod = resolveAnomalyMethod(request.anomalyMethod(), defaults.defaultAnomalyMethod());
        ForecastMethod forecastMethod = resolveForecastMethod(request.forecastMethod(), defaults.defaultForecastMethod());
        double threshold = request.anomalyThreshold() != null ? request.anomalyThreshold() : defaults.anomalyThreshold();
        if (!(threshold > 0)) {
            throw new IllegalArgumentException("anomaly_threshold must be positive");
        }
        int periods = request.forecastPeriods() != null ? request.forecastPeriods() : defaults.forecastPeriods();
        if (periods > defaults.maxForecastPeriods()) {
            throw new IllegalArgumentException(
                    "forecast_periods must not exceed " + defaults.maxForecastPeriods());
        }
        int limit = request.limit() != null ? request.limit() : defaults.rowLimit();
        Integer maxSamples = request.maxRows() != null ? request.maxRows() : defaults.maxSamples();
        return new AnalysisOptions(
                request.targetColumn(),
                request.dateColumn(),
                request.featureColumns(),
                limit,
                request.maxRows(),
                anomalyMethod,
                forecastMethod,
                threshold,
                periods,
                maxSamples,
                defaults.samplingSeed()
        );
    }

    private AnomalyMethod resolveAnomalyMethod(String requested, AnomalyMethod fallback) {
        if (requested == null || requested.isBlank()) {
            return fallback;
        }
        return AnomalyMethod.fromWireName(requested).orElseGet(() -> {
            log.warn("Unknown anomaly method '{}', falling back to '{}'", requested, fallback.wireName());
            return fallback;
        });
    }

    private ForecastMethod resolveForecastMethod(String requested, ForecastMethod fallback) {
        if (requested == null || requested.isBlank()) {
            return fallback;
        }
        return ForecastMethod.fromWireName(requested).orElseGet(() -> {
            log.warn("Unknown forecast method '{}', falling back to '{}'", requested, fallback.wireName());
            return fallback;
        });
    }
}
