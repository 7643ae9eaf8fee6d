package com.forecastalpha.analysis.analytics;

import com.forecastalpha.analysis.model.AnalysisResult;
import com.forecastalpha.analysis.model.CellValues;
import com.forecastalpha.analysis.model.Column;
import com.forecastalpha.analysis.model.ForecastMethod;
import com.forecastalpha.analysis.model.Table;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Short-horizon forecasts of the target column, always in the original (cleaned) scale.
 */
@Component
public class ForecastService {

    private static final Logger log = LoggerFactory.getLogger(ForecastService.class);

    public List<AnalysisResult.ForecastPoint> forecast(
            Table cleaned,
            String targetColumn,
            String dateColumn,
            ForecastMethod method,
            int horizon
    ) {
        if (horizon <= 0) {
            throw new IllegalArgumentException("horizon must be positive");
        }
        TargetSeries series = TargetSeries.of(cleaned, targetColumn);
        if (series.isEmpty()) {
            return List.of();
        }
        double[] predictions = switch (method) {
            case LINEAR_REGRESSION -> linearRegression(series, horizon);
            case HOLT_WINTERS -> holtWinters(series, horizon);
        };
        List<String> labels = futureLabels(cleaned, dateColumn, series.size(), horizon);
        List<AnalysisResult.ForecastPoint> points = new ArrayList<>(horizon);
        for (int i = 0; i < horizon; i++) {
            points.add(new AnalysisResult.ForecastPoint(labels.get(i), predictions[i]));
        }
        return points;
    }

    /**
     * Ordinary least squares of value against sequence number, extrapolated to positions
     * {@code n .. n + horizon - 1}. Fewer than two points give a flat forecast at the mean.
     */
    double[] linearRegression(TargetSeries series, int horizon) {
        double[] predictions = new double[horizon];
        int n = series.size();
        if (n < 2) {
            Arrays.fill(predictions, series.mean());
            return predictions;
        }
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < n; i++) {
            regression.addData(i, series.values()[i]);
        }
        for (int i = 0; i < horizon; i++) {
            predictions[i] = regression.predict(n + i);
        }
        return predictions;
    }

    double[] holtWinters(TargetSeries series, int horizon) {
        if (series.size() < 3) {
            return linearRegression(series, horizon);
        }
        DampedTrendSmoothing model = DampedTrendSmoothing.fit(series.values());
        log.debug("Damped trend fitted: alpha={} beta={} phi={}", model.alpha(), model.beta(), model.phi());
        return model.forecast(horizon);
    }

    /**
     * Labels for the forecast points: future timestamps at the inferred cadence of the date column
     * (daily when it cannot be inferred), or sequence numbers {@code n, n + 1, ...} without usable dates.
     */
    static List<String> futureLabels(Table cleaned, String dateColumn, int seriesLength, int horizon) {
        List<LocalDateTime> observed = parsedDates(cleaned, dateColumn);
        List<String> labels = new ArrayList<>(horizon);
        if (observed.isEmpty()) {
            for (int i = 0; i < horizon; i++) {
                labels.add(String.valueOf(seriesLength + i));
            }
            return labels;
        }
        Cadence cadence = Cadence.infer(observed).orElse(Cadence.DAILY);
        LocalDateTime last = observed.get(observed.size() - 1);
        for (LocalDateTime next : cadence.after(last, horizon)) {
            labels.add(CellValues.isoFormat(next));
        }
        return labels;
    }

    static List<LocalDateTime> parsedDates(Table table, String dateColumn) {
        Optional<Column> column = table.column(dateColumn);
        if (column.isEmpty()) {
            return List.of();
        }
        return column.get().values().stream()
                .map(CellValues::toDateTime)
                .filter(Objects::nonNull)
                .sorted()
                .toList();
    }
}
