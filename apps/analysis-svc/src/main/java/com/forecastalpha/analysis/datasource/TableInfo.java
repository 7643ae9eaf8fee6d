package com.forecastalpha.analysis.datasource;

import java.util.List;

public record TableInfo(String name, List<String> columns) {

    public TableInfo {
        columns = columns == null ? List.of() : List.copyOf(columns);
    }
}
