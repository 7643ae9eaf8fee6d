package com.forecastalpha.analysis;

import com.forecastalpha.analysis.model.Table;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Small builders for row-oriented test fixtures. Null cells are allowed.
 */
public final class TestTables {

    private TestTables() {
    }

    public static Map<String, Object> row(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("key/value pairs expected");
        }
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    @SafeVarargs
    public static Table table(Map<String, Object>... rows) {
        return Table.fromRecords(List.of(rows));
    }

    public static Table series(String column, double... values) {
        List<Map<String, Object>> rows = new ArrayList<>(values.length);
        for (double value : values) {
            rows.add(row(column, value));
        }
        return Table.fromRecords(rows);
    }

    public static Table dailySeries(String dateColumn, String valueColumn, String startDate, double... values) {
        java.time.LocalDate start = java.time.LocalDate.parse(startDate);
        List<Map<String, Object>> rows = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            rows.add(row(dateColumn, start.plusDays(i).toString(), valueColumn, values[i]));
        }
        return Table.fromRecords(rows);
    }
}
