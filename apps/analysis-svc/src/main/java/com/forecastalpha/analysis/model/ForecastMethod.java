package com.forecastalpha.analysis.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum ForecastMethod {
    LINEAR_REGRESSION("linear_regression"),
    HOLT_WINTERS("holt_winters");

    private final String wireName;

    ForecastMethod(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ForecastMethod> fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(method -> method.wireName.equals(normalized)).findFirst();
    }
}
