package com.forecastalpha.analysis.model;

public enum ColumnType {
    NUMERIC,
    TEXT,
    DATETIME,
    /**
     * Mixed value kinds, or no non-null value at all. Never survives cleaning.
     */
    MIXED;

    public boolean isCategorical() {
        return this == TEXT || this == MIXED;
    }
}
