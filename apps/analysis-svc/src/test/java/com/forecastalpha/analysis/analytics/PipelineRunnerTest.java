package com.forecastalpha.analysis.analytics;

import static com.forecastalpha.analysis.TestTables.row;
import static com.forecastalpha.analysis.TestTables.table;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.forecastalpha.analysis.model.AnalysisResult;
import com.forecastalpha.analysis.model.AnomalyMethod;
import com.forecastalpha.analysis.model.Column;
import com.forecastalpha.analysis.model.ForecastMethod;
import com.forecastalpha.analysis.model.Table;
import com.forecastalpha.analysis.pipeline.DataCleaner;
import com.forecastalpha.analysis.pipeline.DataNormalizer;
import java.util.List;
import org.junit.jupiter.api.Test;

class PipelineRunnerTest {

    private final PipelineRunner runner = new PipelineRunner(
            new DataCleaner(),
            new DataNormalizer(),
            new AnomalyDetectionService(),
            new ForecastService()
    );

    @Test
    void runsAllStagesAndReportsMetrics() {
        Table raw = table(
                row("day", "2024-01-01", "value", 100, "region", "north"),
                row("day", "2024-01-02", "value", 105, "region", "south"),
                row("day", "2024-01-03", "value", 110, "region", "north"),
                row("day", "2024-01-04", "value", 400, "region", "south"),
                row("day", "2024-01-05", "value", 115, "region", "north"),
                row("day", "2024-01-06", "value", 120, "region", null)
        );

        AnalysisResult result = runner.run(raw, options("value", "day", AnomalyMethod.ZSCORE, 2.0, 3));

        assertThat(result.anomalies()).extracting(AnalysisResult.AnomalyRecord::timestamp)
                .containsExactly("2024-01-04T00:00:00");
        assertThat(result.forecast()).extracting(AnalysisResult.ForecastPoint::date)
                .containsExactly("2024-01-07T00:00:00", "2024-01-08T00:00:00", "2024-01-09T00:00:00");
        assertThat(result.historical()).hasSize(6);
        assertThat(result.metrics().rows()).isEqualTo(6);
        assertThat(result.metrics().anomalies()).isEqualTo(1);
        assertThat(result.metrics().forecastHorizon()).isEqualTo(3);
        assertThat(result.metrics().anomalyMethod()).isEqualTo(AnomalyMethod.ZSCORE);
        assertThat(result.metrics().forecastMethod()).isEqualTo(ForecastMethod.LINEAR_REGRESSION);
        assertThat(result.metrics().targetColumn()).isEqualTo("value");
        assertThat(result.pipelineSteps())
                .startsWith("drop_duplicates")
                .contains("parse_datetime:day", "fill_missing_categorical_mode:region",
                        "standardize:value", "one_hot_encode:region");
    }

    @Test
    void historicalSeriesIsSortedByDate() {
        Table raw = table(
                row("day", "2024-01-03", "value", 3),
                row("day", "2024-01-01", "value", 1),
                row("day", "garbage", "value", 99),
                row("day", "2024-01-02", "value", 2)
        );

        AnalysisResult result = runner.run(raw, options("value", "day", AnomalyMethod.ZSCORE, 3.0, 1));

        assertThat(result.historical()).extracting(AnalysisResult.HistoricalPoint::date)
                .containsExactly("2024-01-01T00:00:00", "2024-01-02T00:00:00", "2024-01-03T00:00:00");
        assertThat(result.historical()).extracting(AnalysisResult.HistoricalPoint::value)
                .containsExactly(1d, 2d, 3d);
    }

    @Test
    void historicalSeriesUsesRowPositionsWithoutDateColumn() {
        Table raw = table(row("value", 5), row("value", 6));

        AnalysisResult result = runner.run(raw, options("value", null, AnomalyMethod.ZSCORE, 3.0, 2));

        assertThat(result.historical()).extracting(AnalysisResult.HistoricalPoint::date).containsExactly("0", "1");
        assertThat(result.forecast()).extracting(AnalysisResult.ForecastPoint::date).containsExactly("2", "3");
    }

    @Test
    void dateColumnWithoutParseableValuesFallsBackToRowPositions() {
        Table raw = table(
                row("year", 2019, "value", 10),
                row("year", 2020, "value", 12),
                row("year", 2021, "value", 14)
        );

        AnalysisResult result = runner.run(raw, options("value", "year", AnomalyMethod.ZSCORE, 3.0, 2));

        assertThat(result.historical()).extracting(AnalysisResult.HistoricalPoint::date).containsExactly("0", "1", "2");
        assertThat(result.historical()).extracting(AnalysisResult.HistoricalPoint::value).containsExactly(10d, 12d, 14d);
        assertThat(result.forecast()).extracting(AnalysisResult.ForecastPoint::date).containsExactly("3", "4");
    }

    @Test
    void rejectsMissingTargetAndDateColumns() {
        Table raw = table(row("value", 1));

        assertThatThrownBy(() -> runner.run(raw, options("amount", "day", AnomalyMethod.ZSCORE, 3.0, 1)))
                .isInstanceOfSatisfying(MissingColumnsException.class,
                        ex -> assertThat(ex.missingColumns()).containsExactly("amount", "day"));
    }

    @Test
    void emptyTableProducesEmptyResult() {
        Table raw = new Table(List.of(Column.of("value", List.of())), 0);

        AnalysisResult result = runner.run(raw, options("value", null, AnomalyMethod.ISOLATION_FOREST, 3.0, 3));

        assertThat(result.anomalies()).isEmpty();
        assertThat(result.forecast()).isEmpty();
        assertThat(result.historical()).isEmpty();
        assertThat(result.metrics().rows()).isZero();
    }

    private static AnalysisOptions options(String target, String date, AnomalyMethod method, double threshold, int periods) {
        return new AnalysisOptions(
                target,
                date,
                List.of(),
                AnalysisDefaults.ROW_LIMIT,
                null,
                method,
                ForecastMethod.LINEAR_REGRESSION,
                threshold,
                periods,
                null,
                AnalysisDefaults.SAMPLING_SEED
        );
    }
}
