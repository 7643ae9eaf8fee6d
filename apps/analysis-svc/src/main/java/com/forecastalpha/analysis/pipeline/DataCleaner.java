package com.forecastalpha.analysis.pipeline;

import com.forecastalpha.analysis.model.CellValues;
import com.forecastalpha.analysis.model.Column;
import com.forecastalpha.analysis.model.ColumnType;
import com.forecastalpha.analysis.model.Table;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Deterministic fixes to a raw table: deduplication, empty-column removal, type coercion and
 * missing-value imputation, followed by a last deduplication of rows the fills made identical. Columns that cannot be coerced are passed through unchanged.
 */
@Component
public class DataCleaner {

    private static final Logger log = LoggerFactory.getLogger(DataCleaner.class);

    public StageResult clean(Table raw) {
        List<String> steps = new ArrayList<>();
        Table table = dropDuplicates(raw, steps);
        table = dropEmptyColumns(table, steps);
        table = coerceNumericColumns(table, steps);
        table = parseDatetimeColumns(table, steps);
        table = coerceRemainingToText(table, steps);
        table = fillNumericWithMedian(table, steps);
        table = fillCategoricalWithMode(table, steps);
        table = dropDuplicatesAfterFill(table, steps);
        log.debug("Cleaned table: {} -> {} steps={}", raw, table, steps);
        return new StageResult(table, steps);
    }

    private Table dropDuplicates(Table table, List<String> steps) {
        steps.add("drop_duplicates");
        List<Integer> kept = distinctRows(table);
        int removed = table.rowCount() - kept.size();
        if (removed == 0) {
            return table;
        }
        steps.add("removed_duplicates:" + removed);
        return table.selectRows(kept);
    }

    /**
     * Imputation can turn rows that differed only in a missing cell into exact copies.
     */
    private Table dropDuplicatesAfterFill(Table table, List<String> steps) {
        List<Integer> kept = distinctRows(table);
        int removed = table.rowCount() - kept.size();
        if (removed == 0) {
            return table;
        }
        steps.add("removed_duplicates_after_fill:" + removed);
        return table.selectRows(kept);
    }

    private static List<Integer> distinctRows(Table table) {
        Set<List<Object>> seen = new HashSet<>();
        List<Integer> kept = new ArrayList<>(table.rowCount());
        for (int i = 0; i < table.rowCount(); i++) {
            if (seen.add(table.row(i))) {
                kept.add(i);
            }
        }
        return kept;
    }

    private Table dropEmptyColumns(Table table, List<String> steps) {
        if (table.rowCount() == 0) {
            return table;
        }
        List<String> empty = table.columns().stream()
                .filter(Column::isEntirelyNull)
                .map(Column::name)
                .toList();
        if (empty.isEmpty()) {
            return table;
        }
        steps.add("drop_empty_columns:" + String.join(",", empty));
        return table.withoutColumns(empty);
    }

    private Table coerceNumericColumns(Table table, List<String> steps) {
        Table result = table;
        for (Column column : table.columns()) {
            if (!column.type().isCategorical() || column.isEntirelyNull()) {
                continue;
            }
            List<Double> coerced = new ArrayList<>(column.size());
            boolean allNumeric = true;
            for (Object value : column.values()) {
                Double number = CellValues.toDouble(value);
                if (value != null && number == null) {
                    allNumeric = false;
                    break;
                }
                coerced.add(number);
            }
            if (allNumeric) {
                result = result.withColumn(Column.numeric(column.name(), coerced));
                steps.add("coerce_numeric:" + column.name());
            }
        }
        return result;
    }

    private Table parseDatetimeColumns(Table table, List<String> steps) {
        Table result = table;
        for (Column column : table.columns()) {
            if (column.type() == ColumnType.NUMERIC) {
                continue;
            }
            List<LocalDateTime> parsed = new ArrayList<>(column.size());
            boolean anyParsed = false;
            for (Object value : column.values()) {
                LocalDateTime dateTime = CellValues.toDateTime(value);
                anyParsed |= dateTime != null;
                parsed.add(dateTime);
            }
            if (anyParsed) {
                result = result.withColumn(column.withValues(ColumnType.DATETIME, parsed));
                steps.add("parse_datetime:" + column.name());
            }
        }
        return result;
    }

    private Table coerceRemainingToText(Table table, List<String> steps) {
        Table result = table;
        for (Column column : table.columns()) {
            if (column.type() != ColumnType.MIXED || column.isEntirelyNull()) {
                continue;
            }
            List<Object> text = column.values().stream()
                    .map(value -> value == null ? null : (Object) value.toString())
                    .toList();
            result = result.withColumn(column.withValues(ColumnType.TEXT, new ArrayList<>(text)));
            steps.add("coerce_text:" + column.name());
        }
        return result;
    }

    private Table fillNumericWithMedian(Table table, List<String> steps) {
        Table result = table;
        List<String> filled = new ArrayList<>();
        for (Column column : table.columns()) {
            if (column.type() != ColumnType.NUMERIC || column.nullCount() == 0 || column.isEntirelyNull()) {
                continue;
            }
            double[] present = column.values().stream()
                    .filter(Objects::nonNull)
                    .mapToDouble(value -> (Double) value)
                    .toArray();
            double median = new Median().evaluate(present);
            List<Object> values = column.values().stream()
                    .map(value -> value == null ? (Object) median : value)
                    .toList();
            result = result.withColumn(column.withValues(ColumnType.NUMERIC, new ArrayList<>(values)));
            filled.add(column.name());
        }
        if (!filled.isEmpty()) {
            steps.add("fill_missing_numeric_median:" + String.join(",", filled));
        }
        return result;
    }

    private Table fillCategoricalWithMode(Table table, List<String> steps) {
        Table result = table;
        List<String> filled = new ArrayList<>();
        for (Column column : table.columns()) {
            if (column.type() != ColumnType.TEXT || column.nullCount() == 0 || column.isEntirelyNull()) {
                continue;
            }
            String mode = modeOf(column);
            List<Object> values = column.values().stream()
                    .map(value -> value == null ? (Object) mode : value)
                    .toList();
            result = result.withColumn(column.withValues(ColumnType.TEXT, new ArrayList<>(values)));
            filled.add(column.name());
        }
        if (!filled.isEmpty()) {
            steps.add("fill_missing_categorical_mode:" + String.join(",", filled));
        }
        return result;
    }

    /**
     * Most frequent value; ties resolve to the lexically smallest value.
     */
    static String modeOf(Column column) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Object value : column.values()) {
            if (value != null) {
                counts.merge(value.toString(), 1L, Long::sum);
            }
        }
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(null);
    }
}
