package com.forecastalpha.analysis.pipeline;

import com.forecastalpha.analysis.model.Column;
import com.forecastalpha.analysis.model.ColumnType;
import com.forecastalpha.analysis.model.Table;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.springframework.stereotype.Component;

/**
 * Builds the anomaly-detection feature table: numeric columns are standardised with population
 * statistics, categorical columns are one-hot encoded with the lexically first level dropped.
 * Row count and row order are preserved.
 */
@Component
public class DataNormalizer {

    public StageResult normalize(Table cleaned) {
        List<String> steps = new ArrayList<>();
        Table table = standardizeNumeric(cleaned, steps);
        table = oneHotEncode(table, steps);
        return new StageResult(table, steps);
    }

    private Table standardizeNumeric(Table table, List<String> steps) {
        Table result = table;
        List<String> standardized = new ArrayList<>();
        for (Column column : table.columns()) {
            if (column.type() != ColumnType.NUMERIC) {
                continue;
            }
            result = result.withColumn(standardize(column));
            standardized.add(column.name());
        }
        if (!standardized.isEmpty()) {
            steps.add("standardize:" + String.join(",", standardized));
        }
        return result;
    }

    static Column standardize(Column column) {
        double[] present = column.values().stream()
                .filter(Objects::nonNull)
                .mapToDouble(value -> (Double) value)
                .toArray();
        double mean = new Mean().evaluate(present);
        double std = new StandardDeviation(false).evaluate(present);
        List<Double> values = new ArrayList<>(column.size());
        if (Double.isNaN(std) || std == 0d) {
            // no spread: the column carries no signal
            for (int i = 0; i < column.size(); i++) {
                values.add(0d);
            }
            return Column.numeric(column.name(), values);
        }
        for (Object value : column.values()) {
            values.add(value == null ? null : ((Double) value - mean) / std);
        }
        return Column.numeric(column.name(), values);
    }

    private Table oneHotEncode(Table table, List<String> steps) {
        List<Column> kept = new ArrayList<>();
        List<Column> indicators = new ArrayList<>();
        List<String> encoded = new ArrayList<>();
        Set<String> usedNames = new HashSet<>(table.columnNames());
        for (Column column : table.columns()) {
            if (!column.type().isCategorical()) {
                kept.add(column);
                continue;
            }
            encoded.add(column.name());
            TreeSet<String> levels = new TreeSet<>();
            column.values().stream().filter(Objects::nonNull).map(Object::toString).forEach(levels::add);
            if (!levels.isEmpty()) {
                levels.pollFirst();
            }
            for (String level : levels) {
                String name = uniqueName(column.name() + "_" + level, usedNames);
                List<Double> flags = new ArrayList<>(column.size());
                for (Object value : column.values()) {
                    flags.add(value != null && level.equals(value.toString()) ? 1d : 0d);
                }
                indicators.add(Column.numeric(name, flags));
            }
        }
        if (encoded.isEmpty()) {
            return table;
        }
        steps.add("one_hot_encode:" + String.join(",", encoded));
        kept.addAll(indicators);
        return new Table(kept, table.rowCount());
    }

    private static String uniqueName(String candidate, Set<String> usedNames) {
        String name = candidate;
        int suffix = 1;
        while (!usedNames.add(name)) {
            name = candidate + "_" + suffix++;
        }
        return name;
    }
}
