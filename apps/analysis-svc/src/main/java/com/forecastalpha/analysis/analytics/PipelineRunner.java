package com.forecastalpha.analysis.analytics;

import com.forecastalpha.analysis.model.AnalysisResult;
import com.forecastalpha.analysis.model.CellValues;
import com.forecastalpha.analysis.model.Column;
import com.forecastalpha.analysis.model.Table;
import com.forecastalpha.analysis.pipeline.DataCleaner;
import com.forecastalpha.analysis.pipeline.DataNormalizer;
import com.forecastalpha.analysis.pipeline.StageResult;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Wires a raw table through cleaning, normalisation, anomaly detection and forecasting.
 * Synchronous and stateless: every call works on its own tables.
 */
@Component
public class PipelineRunner {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    private final DataCleaner dataCleaner;
    private final DataNormalizer dataNormalizer;
    private final AnomalyDetectionService anomalyDetectionService;
    private final ForecastService forecastService;

    public PipelineRunner(
            DataCleaner dataCleaner,
            DataNormalizer dataNormalizer,
            AnomalyDetectionService anomalyDetectionService,
            ForecastService forecastService
    ) {
        this.dataCleaner = dataCleaner;
        this.dataNormalizer = dataNormalizer;
        this.anomalyDetectionService = anomalyDetectionService;
        this.forecastService = forecastService;
    }

    /**
     * @throws MissingColumnsException when the target or date column is absent from {@code raw}
     */
    public AnalysisResult run(Table raw, AnalysisOptions options) {
        validateColumns(raw, options);

        StageResult cleaned = dataCleaner.clean(raw);
        StageResult normalized = dataNormalizer.normalize(cleaned.table());
        List<String> steps = new ArrayList<>(cleaned.steps());
        steps.addAll(normalized.steps());

        Table table = cleaned.table();
        List<AnalysisResult.AnomalyRecord> anomalies = anomalyDetectionService.detectAnomalies(
                table,
                options.targetColumn(),
                options.dateColumn(),
                normalized.table(),
                options.detectionSettings()
        );
        List<AnalysisResult.ForecastPoint> forecast = forecastService.forecast(
                table,
                options.targetColumn(),
                options.dateColumn(),
                options.forecastMethod(),
                options.forecastPeriods()
        );
        List<AnalysisResult.HistoricalPoint> historical = historicalSeries(table, options.targetColumn(), options.dateColumn());

        AnalysisResult.Metrics metrics = new AnalysisResult.Metrics(
                table.rowCount(),
                anomalies.size(),
                forecast.size(),
                options.anomalyMethod(),
                options.forecastMethod(),
                options.targetColumn()
        );
        log.info("Analysis completed: target='{}', rows={}, anomalies={}, horizon={}, anomalyMethod={}, forecastMethod={}",
                options.targetColumn(), metrics.rows(), metrics.anomalies(), metrics.forecastHorizon(),
                options.anomalyMethod().wireName(), options.forecastMethod().wireName());
        return new AnalysisResult(anomalies, forecast, historical, metrics, steps);
    }

    private void validateColumns(Table raw, AnalysisOptions options) {
        List<String> missing = new ArrayList<>();
        if (!raw.hasColumn(options.targetColumn())) {
            missing.add(options.targetColumn());
        }
        if (options.dateColumn() != null && !raw.hasColumn(options.dateColumn())) {
            missing.add(options.dateColumn());
        }
        if (!missing.isEmpty()) {
            throw new MissingColumnsException(missing);
        }
    }

    /**
     * Cleaned target series, sorted by date when a date column is present (rows with unparseable
     * dates left out), otherwise in row order labelled by row position. A date column without a
     * single parseable value counts as absent, matching the sequence labels of the forecast.
     */
    static List<AnalysisResult.HistoricalPoint> historicalSeries(Table cleaned, String targetColumn, String dateColumn) {
        TargetSeries series = TargetSeries.of(cleaned, targetColumn);
        Optional<Column> dates = cleaned.column(dateColumn);
        List<DatedValue> dated = new ArrayList<>(series.size());
        if (dates.isPresent()) {
            for (int i = 0; i < series.size(); i++) {
                LocalDateTime date = CellValues.toDateTime(dates.get().get(series.positions().get(i)));
                if (date != null) {
                    dated.add(new DatedValue(date, series.values()[i]));
                }
            }
        }
        List<AnalysisResult.HistoricalPoint> points = new ArrayList<>(series.size());
        if (dated.isEmpty()) {
            for (int i = 0; i < series.size(); i++) {
                points.add(new AnalysisResult.HistoricalPoint(String.valueOf(series.positions().get(i)), series.values()[i]));
            }
            return points;
        }
        dated.sort(Comparator.comparing(DatedValue::date));
        for (DatedValue value : dated) {
            points.add(new AnalysisResult.HistoricalPoint(CellValues.isoFormat(value.date()), value.value()));
        }
        return points;
    }

    private record DatedValue(LocalDateTime date, double value) {
    }
}
