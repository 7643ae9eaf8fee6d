package com.forecastalpha.analysis.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, column-oriented snapshot of a tabular dataset. Every transformation returns a new
 * table; columns may be shared between tables because they are themselves immutable.
 */
public final class Table {

    private final List<Column> columns;
    private final int rowCount;

    public Table(List<Column> columns) {
        this(columns, columns.isEmpty() ? 0 : columns.get(0).size());
    }

    public Table(List<Column> columns, int rows) {
        Objects.requireNonNull(columns, "columns must be provided");
        if (rows < 0) {
            throw new IllegalArgumentException("row count must not be negative");
        }
        Set<String> names = new HashSet<>();
        for (Column column : columns) {
            if (!names.add(column.name())) {
                throw new IllegalArgumentException("duplicate column name: " + column.name());
            }
            if (column.size() != rows) {
                throw new IllegalArgumentException("column '" + column.name() + "' has " + column.size()
                        + " rows, expected " + rows);
            }
        }
        this.columns = List.copyOf(columns);
        this.rowCount = rows;
    }

    public static Table empty() {
        return new Table(List.of());
    }

    /**
     * Builds a table from row records. Column order follows first appearance of each key;
     * keys missing from a record are treated as null cells.
     */
    public static Table fromRecords(List<? extends Map<String, ?>> records) {
        Map<String, List<Object>> cells = new LinkedHashMap<>();
        for (Map<String, ?> record : records) {
            for (String key : record.keySet()) {
                cells.computeIfAbsent(key, ignored -> new ArrayList<>());
            }
        }
        for (Map<String, ?> record : records) {
            for (Map.Entry<String, List<Object>> entry : cells.entrySet()) {
                entry.getValue().add(record.get(entry.getKey()));
            }
        }
        List<Column> columns = new ArrayList<>(cells.size());
        cells.forEach((name, values) -> columns.add(Column.of(name, values)));
        return new Table(columns, records.size());
    }

    public List<Column> columns() {
        return columns;
    }

    public List<String> columnNames() {
        return columns.stream().map(Column::name).toList();
    }

    public int rowCount() {
        return rowCount;
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean hasColumn(String name) {
        return column(name).isPresent();
    }

    public Optional<Column> column(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return columns.stream().filter(column -> column.name().equals(name)).findFirst();
    }

    public List<Object> row(int index) {
        List<Object> row = new ArrayList<>(columns.size());
        for (Column column : columns) {
            row.add(column.get(index));
        }
        return row;
    }

    /**
     * Returns a table holding only the given row positions, in the given order.
     */
    public Table selectRows(List<Integer> positions) {
        List<Column> selected = new ArrayList<>(columns.size());
        for (Column column : columns) {
            List<Object> values = new ArrayList<>(positions.size());
            for (int position : positions) {
                values.add(column.get(position));
            }
            selected.add(column.withValues(column.type(), values));
        }
        return new Table(selected, positions.size());
    }

    /**
     * Replaces the column with the same name in place, or appends it when absent.
     */
    public Table withColumn(Column replacement) {
        List<Column> updated = new ArrayList<>(columns);
        for (int i = 0; i < updated.size(); i++) {
            if (updated.get(i).name().equals(replacement.name())) {
                updated.set(i, replacement);
                return new Table(updated, rowCount);
            }
        }
        updated.add(replacement);
        return new Table(updated, rowCount);
    }

    public Table withoutColumns(Collection<String> names) {
        return new Table(columns.stream().filter(column -> !names.contains(column.name())).toList(), rowCount);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Table table)) {
            return false;
        }
        return rowCount == table.rowCount && columns.equals(table.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rowCount);
    }

    @Override
    public String toString() {
        return "Table{columns=" + columnNames() + ", rows=" + rowCount + "}";
    }
}
