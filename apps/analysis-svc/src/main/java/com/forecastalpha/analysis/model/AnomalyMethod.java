package com.forecastalpha.analysis.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum AnomalyMethod {
    ZSCORE("zscore"),
    ISOLATION_FOREST("isolation_forest");

    private final String wireName;

    AnomalyMethod(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<AnomalyMethod> fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(method -> method.wireName.equals(normalized)).findFirst();
    }
}
