package com.forecastalpha.analysis.pipeline;

import static com.forecastalpha.analysis.TestTables.row;
import static com.forecastalpha.analysis.TestTables.table;
import static org.assertj.core.api.Assertions.assertThat;

import com.forecastalpha.analysis.model.Column;
import com.forecastalpha.analysis.model.ColumnType;
import com.forecastalpha.analysis.model.Table;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class DataCleanerTest {

    private final DataCleaner cleaner = new DataCleaner();

    @Test
    void fillsMissingValuesWithMedianAndMode() {
        Table raw = table(
                row("id", 1, "value", 10, "category", "A"),
                row("id", 1, "value", 10, "category", null),
                row("id", 2, "value", null, "category", "B"),
                row("id", 3, "value", 40, "category", "B")
        );

        StageResult result = cleaner.clean(raw);

        Table cleaned = result.table();
        // rows differ in category, so none are exact duplicates
        assertThat(cleaned.rowCount()).isEqualTo(4);
        assertThat(cleaned.column("value").orElseThrow().values()).containsExactly(10d, 10d, 10d, 40d);
        assertThat(cleaned.column("category").orElseThrow().values()).containsExactly("A", "B", "B", "B");
        assertThat(result.steps())
                .startsWith("drop_duplicates")
                .contains("fill_missing_numeric_median:value", "fill_missing_categorical_mode:category")
                .noneMatch(step -> step.startsWith("removed_duplicates"));
    }

    @Test
    void removesExactDuplicateRowsKeepingFirstOccurrence() {
        Table raw = table(
                row("id", 1, "value", 10),
                row("id", 1, "value", 10),
                row("id", 2, "value", 20)
        );

        StageResult result = cleaner.clean(raw);

        assertThat(result.table().rowCount()).isEqualTo(2);
        assertThat(result.table().column("id").orElseThrow().values()).containsExactly(1d, 2d);
        assertThat(result.steps()).containsSequence("drop_duplicates", "removed_duplicates:1");
    }

    @Test
    void dropsColumnsWithoutAnyValue() {
        Table raw = table(
                row("value", 1, "notes", null),
                row("value", 2, "notes", null)
        );

        StageResult result = cleaner.clean(raw);

        assertThat(result.table().columnNames()).containsExactly("value");
        assertThat(result.steps()).contains("drop_empty_columns:notes");
    }

    @Test
    void coercesNumericStringsAndParsesDates() {
        Table raw = table(
                row("day", "2024-01-01", "amount", "12.5", "label", "x"),
                row("day", "2024/01/02", "amount", "7", "label", "y"),
                row("day", "01/03/2024", "amount", null, "label", "z")
        );

        StageResult result = cleaner.clean(raw);

        Table cleaned = result.table();
        Column day = cleaned.column("day").orElseThrow();
        Column amount = cleaned.column("amount").orElseThrow();
        assertThat(day.type()).isEqualTo(ColumnType.DATETIME);
        assertThat(day.values()).containsExactly(
                LocalDateTime.of(2024, 1, 1, 0, 0),
                LocalDateTime.of(2024, 1, 2, 0, 0),
                LocalDateTime.of(2024, 1, 3, 0, 0));
        assertThat(amount.type()).isEqualTo(ColumnType.NUMERIC);
        assertThat(amount.values()).containsExactly(12.5d, 7d, 9.75d);
        assertThat(cleaned.column("label").orElseThrow().type()).isEqualTo(ColumnType.TEXT);
        assertThat(result.steps()).contains("coerce_numeric:amount", "parse_datetime:day");
    }

    @Test
    void unparseableDatesBecomeMissingAndStayUnfilled() {
        Table raw = table(
                row("day", "2024-01-01", "value", 1),
                row("day", "not a date", "value", 2)
        );

        Column day = cleaner.clean(raw).table().column("day").orElseThrow();

        assertThat(day.type()).isEqualTo(ColumnType.DATETIME);
        assertThat(day.values()).containsExactly(LocalDateTime.of(2024, 1, 1, 0, 0), null);
    }

    @Test
    void mixedColumnsAreStringified() {
        Table raw = table(
                row("code", 1, "value", 1),
                row("code", "B7", "value", 2)
        );

        StageResult result = cleaner.clean(raw);

        Column code = result.table().column("code").orElseThrow();
        assertThat(code.type()).isEqualTo(ColumnType.TEXT);
        assertThat(code.values()).containsExactly("1.0", "B7");
        assertThat(result.steps()).contains("coerce_text:code");
    }

    @Test
    void cleaningIsIdempotent() {
        Table raw = table(
                row("day", "2024-01-01", "value", 10, "category", "A"),
                row("day", "2024-01-02", "value", null, "category", null),
                row("day", "2024-01-02", "value", null, "category", null),
                row("day", "2024-01-03", "value", 30, "category", "B")
        );

        Table once = cleaner.clean(raw).table();
        Table twice = cleaner.clean(once).table();

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void rowsMadeIdenticalByImputationAreDeduplicated() {
        Table raw = table(
                row("id", 1, "value", 10),
                row("id", 1, "value", null)
        );

        StageResult result = cleaner.clean(raw);
        Table twice = cleaner.clean(result.table()).table();

        assertThat(result.table().rowCount()).isEqualTo(1);
        assertThat(result.table().column("value").orElseThrow().values()).containsExactly(10d);
        assertThat(result.steps()).endsWith("removed_duplicates_after_fill:1");
        assertThat(twice).isEqualTo(result.table());
    }

    @Test
    void emptyTablePassesThrough() {
        StageResult result = cleaner.clean(Table.empty());

        assertThat(result.table().rowCount()).isZero();
        assertThat(result.steps()).containsExactly("drop_duplicates");
    }

    @Test
    void modeTiesResolveToLexicallySmallestValue() {
        Column column = Column.of("c", List.of("b", "a", "b", "a"));

        assertThat(DataCleaner.modeOf(column)).isEqualTo("a");
    }
}
