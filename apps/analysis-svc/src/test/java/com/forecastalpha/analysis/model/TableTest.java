package com.forecastalpha.analysis.model;

import static com.forecastalpha.analysis.TestTables.row;
import static com.forecastalpha.analysis.TestTables.table;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class TableTest {

    @Test
    void columnOrderFollowsFirstAppearance() {
        Table table = table(
                row("b", 1, "a", "x"),
                row("a", "y", "c", 2.5)
        );

        assertThat(table.columnNames()).containsExactly("b", "a", "c");
        assertThat(table.rowCount()).isEqualTo(2);
        assertThat(table.row(1)).containsExactly(null, "y", 2.5);
    }

    @Test
    void infersColumnTypes() {
        Table table = table(
                row("n", 1, "t", "x", "d", LocalDateTime.of(2024, 1, 1, 0, 0), "m", 1, "e", null),
                row("n", 2.5, "t", "y", "d", null, "m", "z", "e", null)
        );

        assertThat(table.column("n").orElseThrow().type()).isEqualTo(ColumnType.NUMERIC);
        assertThat(table.column("t").orElseThrow().type()).isEqualTo(ColumnType.TEXT);
        assertThat(table.column("d").orElseThrow().type()).isEqualTo(ColumnType.DATETIME);
        assertThat(table.column("m").orElseThrow().type()).isEqualTo(ColumnType.MIXED);
        assertThat(table.column("e").orElseThrow().type()).isEqualTo(ColumnType.MIXED);
    }

    @Test
    void nanBecomesMissing() {
        Column column = Column.of("v", List.of(1.0, Double.NaN));

        assertThat(column.values()).containsExactly(1.0, null);
        assertThat(column.nullCount()).isEqualTo(1);
    }

    @Test
    void selectRowsKeepsRequestedOrder() {
        Table table = table(row("v", 1), row("v", 2), row("v", 3));

        Table selected = table.selectRows(List.of(2, 0));

        assertThat(selected.column("v").orElseThrow().values()).containsExactly(3d, 1d);
    }

    @Test
    void removingEveryColumnKeepsRowCount() {
        Table table = table(row("v", 1), row("v", 2));

        assertThat(table.withoutColumns(List.of("v")).rowCount()).isEqualTo(2);
    }

    @Test
    void rejectsMisalignedColumns() {
        assertThatThrownBy(() -> new Table(List.of(
                Column.of("a", List.of(1)),
                Column.of("b", List.of(1, 2)))))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
