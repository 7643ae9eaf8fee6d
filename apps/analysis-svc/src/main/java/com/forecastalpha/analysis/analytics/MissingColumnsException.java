package com.forecastalpha.analysis.analytics;

import java.util.List;

/**
 * Raised before any stage runs when a required column is absent from the raw table.
 */
public class MissingColumnsException extends IllegalArgumentException {

    private final List<String> missingColumns;

    public MissingColumnsException(List<String> missingColumns) {
        super("Missing columns in dataset: " + String.join(", ", missingColumns));
        this.missingColumns = List.copyOf(missingColumns);
    }

    public List<String> missingColumns() {
        return missingColumns;
    }
}
