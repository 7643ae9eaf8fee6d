package com.forecastalpha.analysis.analytics;

import com.forecastalpha.analysis.model.AnalysisResult;
import com.forecastalpha.analysis.model.AnalysisResult.AnomalyRecord.Severity;
import com.forecastalpha.analysis.model.CellValues;
import com.forecastalpha.analysis.model.Column;
import com.forecastalpha.analysis.model.ColumnType;
import com.forecastalpha.analysis.model.Table;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    /**
     * Flags anomalous observations of {@code targetColumn}. A missing or entirely non-numeric target
     * yields an empty list.
     *
     * @param features optional normalised feature table, row-aligned with {@code cleaned}; only used
     *                 by the isolation-forest method
     */
    public List<AnalysisResult.AnomalyRecord> detectAnomalies(
            Table cleaned,
            String targetColumn,
            String dateColumn,
            Table features,
            DetectionSettings settings
    ) {
        TargetSeries series = TargetSeries.of(cleaned, targetColumn)
                .downsample(settings.maxSamples(), settings.seed());
        if (series.isEmpty()) {
            return List.of();
        }
        return switch (settings.method()) {
            case ZSCORE -> zScore(cleaned, targetColumn, dateColumn, series, settings.threshold());
            case ISOLATION_FOREST -> isolationForest(cleaned, targetColumn, dateColumn, features, series, settings);
        };
    }

    private List<AnalysisResult.AnomalyRecord> zScore(
            Table cleaned,
            String targetColumn,
            String dateColumn,
            TargetSeries series,
            double threshold
    ) {
        double mean = new Mean().evaluate(series.values());
        double std = new StandardDeviation(false).evaluate(series.values());
        if (Double.isNaN(std) || std == 0d) {
            return List.of();
        }
        List<AnalysisResult.AnomalyRecord> anomalies = new ArrayList<>();
        for (int i = 0; i < series.size(); i++) {
            double value = series.values()[i];
            double z = (value - mean) / std;
            if (Math.abs(z) > threshold) {
                Severity severity = Math.abs(z) > threshold + 1 ? Severity.HIGH : Severity.MEDIUM;
                anomalies.add(new AnalysisResult.AnomalyRecord(
                        timestampFor(cleaned, dateColumn, series.positions().get(i)),
                        targetColumn,
                        severity,
                        value,
                        z,
                        null
                ));
            }
        }
        return anomalies;
    }

    private List<AnalysisResult.AnomalyRecord> isolationForest(
            Table cleaned,
            String targetColumn,
            String dateColumn,
            Table features,
            TargetSeries series,
            DetectionSettings settings
    ) {
        FeatureMatrix matrix = buildFeatureMatrix(cleaned, targetColumn, features, series, settings.featureColumns());
        if (matrix.rows().isEmpty()) {
            return List.of();
        }
        matrix = matrix.downsample(settings.maxSamples(), settings.seed());
        double[][] data = matrix.rows().toArray(new double[0][]);
        IsolationForest forest = IsolationForest.fit(data, settings.seed());
        double[] scores = forest.decisionScores(data);
        double threshold = new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(scores, AnalysisDefaults.ISOLATION_PERCENTILE);
        log.debug("Isolation forest fitted on {}x{} matrix, threshold={}", data.length, matrix.columns().size(), threshold);

        List<AnalysisResult.AnomalyRecord> anomalies = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            if (scores[i] > threshold) {
                continue;
            }
            int position = matrix.positions().get(i);
            Severity severity = scores[i] < threshold - AnalysisDefaults.ISOLATION_HIGH_MARGIN ? Severity.HIGH : Severity.MEDIUM;
            anomalies.add(new AnalysisResult.AnomalyRecord(
                    timestampFor(cleaned, dateColumn, position),
                    targetColumn,
                    severity,
                    matrix.targetValues().get(i),
                    null,
                    scores[i]
            ));
        }
        return anomalies;
    }

    /**
     * Numeric feature matrix restricted to the series' surviving rows. Rows with any null cell are dropped.
     */
    FeatureMatrix buildFeatureMatrix(
            Table cleaned,
            String targetColumn,
            Table features,
            TargetSeries series,
            List<String> featureColumns
    ) {
        Table source = cleaned;
        if (features != null && features.rowCount() == cleaned.rowCount()) {
            source = features;
        } else if (features != null) {
            log.warn("Feature table has {} rows but cleaned table has {}; using cleaned numeric columns",
                    features.rowCount(), cleaned.rowCount());
        }
        Map<String, List<Object>> selected = new LinkedHashMap<>();
        for (Column column : source.columns()) {
            boolean requested = featureColumns.isEmpty() || featureColumns.contains(column.name());
            if ((column.type() == ColumnType.NUMERIC && requested) || column.name().equals(targetColumn)) {
                selected.put(column.name(), column.values());
            }
        }
        if (!selected.containsKey(targetColumn)) {
            selected.put(targetColumn, cleaned.column(targetColumn).map(Column::values).orElseThrow());
        }
        List<Object> targetCells = cleaned.column(targetColumn).map(Column::values).orElseThrow();

        List<String> columns = List.copyOf(selected.keySet());
        List<double[]> rows = new ArrayList<>(series.size());
        List<Integer> positions = new ArrayList<>(series.size());
        List<Double> targetValues = new ArrayList<>(series.size());
        for (int position : series.positions()) {
            double[] row = new double[columns.size()];
            boolean complete = true;
            for (int c = 0; c < columns.size() && complete; c++) {
                Double value = CellValues.toDouble(selected.get(columns.get(c)).get(position));
                complete = value != null;
                row[c] = complete ? value : 0d;
            }
            if (complete) {
                rows.add(row);
                positions.add(position);
                targetValues.add(CellValues.toDouble(targetCells.get(position)));
            }
        }
        return new FeatureMatrix(columns, rows, positions, targetValues);
    }

    /**
     * Date-column value at {@code position} as ISO-8601 when it parses, its string form otherwise;
     * the row position itself when there is no usable date.
     */
    static String timestampFor(Table table, String dateColumn, int position) {
        Optional<Column> column = table.column(dateColumn);
        if (column.isEmpty()) {
            return String.valueOf(position);
        }
        Object cell = column.get().get(position);
        if (cell == null) {
            return String.valueOf(position);
        }
        LocalDateTime dateTime = CellValues.toDateTime(cell);
        return dateTime != null ? CellValues.isoFormat(dateTime) : cell.toString();
    }

    record FeatureMatrix(List<String> columns, List<double[]> rows, List<Integer> positions, List<Double> targetValues) {

        FeatureMatrix downsample(Integer maxSamples, long seed) {
            if (maxSamples == null || rows.size() <= maxSamples) {
                return this;
            }
            List<Integer> picked = TargetSeries.sampleIndices(rows.size(), maxSamples, seed);
            List<double[]> keptRows = new ArrayList<>(picked.size());
            List<Integer> keptPositions = new ArrayList<>(picked.size());
            List<Double> keptTargets = new ArrayList<>(picked.size());
            for (int index : picked) {
                keptRows.add(rows.get(index));
                keptPositions.add(positions.get(index));
                keptTargets.add(targetValues.get(index));
            }
            return new FeatureMatrix(columns, keptRows, keptPositions, keptTargets);
        }
    }
}
