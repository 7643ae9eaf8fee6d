package com.forecastalpha.analysis.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named, typed column of cells. Values are held in their canonical form
 * (see {@link CellValues#normalize(Object)}) and never mutated after construction.
 */
public record Column(String name, ColumnType type, List<Object> values) {

    public Column {
        Objects.requireNonNull(name, "name must be provided");
        Objects.requireNonNull(type, "type must be provided");
        Objects.requireNonNull(values, "values must be provided");
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    /**
     * Builds a column from arbitrary raw cells, inferring its type.
     */
    public static Column of(String name, List<?> rawValues) {
        List<Object> normalized = new ArrayList<>(rawValues.size());
        for (Object raw : rawValues) {
            normalized.add(CellValues.normalize(raw));
        }
        return new Column(name, inferType(normalized), normalized);
    }

    public static Column numeric(String name, List<Double> values) {
        return new Column(name, ColumnType.NUMERIC, new ArrayList<>(values));
    }

    public int size() {
        return values.size();
    }

    public Object get(int row) {
        return values.get(row);
    }

    public long nullCount() {
        return values.stream().filter(Objects::isNull).count();
    }

    public boolean isEntirelyNull() {
        return nullCount() == values.size();
    }

    public Column withValues(ColumnType newType, List<?> newValues) {
        return new Column(name, newType, new ArrayList<>(newValues));
    }

    static ColumnType inferType(List<Object> values) {
        boolean numeric = true;
        boolean datetime = true;
        boolean text = true;
        boolean any = false;
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            any = true;
            numeric &= value instanceof Double;
            datetime &= value instanceof java.time.LocalDateTime;
            text &= value instanceof String;
        }
        if (!any) {
            return ColumnType.MIXED;
        }
        if (numeric) {
            return ColumnType.NUMERIC;
        }
        if (datetime) {
            return ColumnType.DATETIME;
        }
        return text ? ColumnType.TEXT : ColumnType.MIXED;
    }
}
