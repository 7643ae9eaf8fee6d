package com.forecastalpha.analysis.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;

class CellValuesTest {

    @Test
    void parsesSupportedDateFormats() {
        LocalDateTime midnight = LocalDateTime.of(2024, 3, 5, 0, 0);

        assertThat(CellValues.toDateTime("2024-03-05")).isEqualTo(midnight);
        assertThat(CellValues.toDateTime("2024/03/05")).isEqualTo(midnight);
        assertThat(CellValues.toDateTime("03/05/2024")).isEqualTo(midnight);
        assertThat(CellValues.toDateTime("2024-03-05T10:15:30")).isEqualTo(LocalDateTime.of(2024, 3, 5, 10, 15, 30));
        assertThat(CellValues.toDateTime("2024-03-05 10:15")).isEqualTo(LocalDateTime.of(2024, 3, 5, 10, 15));
        assertThat(CellValues.toDateTime("2024-03-05T10:15:30+02:00")).isEqualTo(LocalDateTime.of(2024, 3, 5, 8, 15, 30));
        assertThat(CellValues.toDateTime(LocalDate.of(2024, 3, 5))).isEqualTo(midnight);
    }

    @Test
    void unparseableValuesAreMissing() {
        assertThat(CellValues.toDateTime("yesterday")).isNull();
        assertThat(CellValues.toDateTime(12.0)).isNull();
        assertThat(CellValues.toDouble("n/a")).isNull();
        assertThat(CellValues.toDouble(" ")).isNull();
        assertThat(CellValues.toDouble(Double.NaN)).isNull();
    }

    @Test
    void coercesNumbers() {
        assertThat(CellValues.toDouble(" 4.25 ")).isEqualTo(4.25);
        assertThat(CellValues.toDouble(7)).isEqualTo(7.0);
    }

    @Test
    void formatsIsoWithFractionOnlyWhenPresent() {
        assertThat(CellValues.isoFormat(LocalDateTime.of(2024, 1, 2, 3, 4, 5))).isEqualTo("2024-01-02T03:04:05");
        assertThat(CellValues.isoFormat(LocalDateTime.of(2024, 1, 2, 3, 4, 5, 500_000_000)))
                .isEqualTo("2024-01-02T03:04:05.5");
    }
}
