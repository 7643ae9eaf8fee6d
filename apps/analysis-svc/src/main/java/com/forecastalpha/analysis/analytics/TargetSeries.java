package com.forecastalpha.analysis.analytics;

import com.forecastalpha.analysis.model.CellValues;
import com.forecastalpha.analysis.model.Column;
import com.forecastalpha.analysis.model.Table;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * The numeric-coerced target column with null cells dropped. {@code positions} holds the
 * original row index of every surviving value.
 */
record TargetSeries(List<Integer> positions, double[] values) {

    TargetSeries {
        positions = List.copyOf(positions);
        values = values.clone();
    }

    static TargetSeries of(Table table, String targetColumn) {
        Optional<Column> column = table.column(targetColumn);
        if (column.isEmpty()) {
            return new TargetSeries(List.of(), new double[0]);
        }
        List<Integer> positions = new ArrayList<>();
        List<Double> values = new ArrayList<>();
        List<Object> cells = column.get().values();
        for (int i = 0; i < cells.size(); i++) {
            Double value = CellValues.toDouble(cells.get(i));
            if (value != null) {
                positions.add(i);
                values.add(value);
            }
        }
        return new TargetSeries(positions, values.stream().mapToDouble(Double::doubleValue).toArray());
    }

    int size() {
        return values.length;
    }

    boolean isEmpty() {
        return values.length == 0;
    }

    double mean() {
        double sum = 0d;
        for (double value : values) {
            sum += value;
        }
        return values.length == 0 ? Double.NaN : sum / values.length;
    }

    /**
     * Caps the series at {@code maxSamples} points with a seeded sample, keeping original row order.
     */
    TargetSeries downsample(Integer maxSamples, long seed) {
        if (maxSamples == null || values.length <= maxSamples) {
            return this;
        }
        List<Integer> picked = sampleIndices(values.length, maxSamples, seed);
        List<Integer> keptPositions = new ArrayList<>(picked.size());
        double[] keptValues = new double[picked.size()];
        for (int i = 0; i < picked.size(); i++) {
            keptPositions.add(positions.get(picked.get(i)));
            keptValues[i] = values[picked.get(i)];
        }
        return new TargetSeries(keptPositions, keptValues);
    }

    /**
     * Partial Fisher-Yates draw of {@code count} distinct indices out of {@code size}, returned sorted.
     */
    static List<Integer> sampleIndices(int size, int count, long seed) {
        int[] indices = new int[size];
        for (int i = 0; i < size; i++) {
            indices[i] = i;
        }
        Random random = new Random(seed);
        int limit = Math.min(count, size);
        for (int i = 0; i < limit; i++) {
            int j = i + random.nextInt(size - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        List<Integer> picked = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            picked.add(indices[i]);
        }
        picked.sort(null);
        return picked;
    }
}
