package com.forecastalpha.analysis.datasource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.forecastalpha.analysis.model.ColumnType;
import com.forecastalpha.analysis.model.Table;
import java.time.LocalDateTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

class JdbcTableSourceTest {

    private static final String URL = "jdbc:h2:mem:jdbc_table_source;DB_CLOSE_DELAY=-1";

    private final JdbcTableSource source = new JdbcTableSource(new ConnectionDescriptor(URL, "sa", ""));

    @BeforeEach
    void setUp() {
        JdbcTemplate jdbc = new JdbcTemplate(new DriverManagerDataSource(URL, "sa", ""));
        jdbc.execute("DROP TABLE IF EXISTS SALES");
        jdbc.execute("CREATE TABLE SALES (SOLD_ON DATE, AMOUNT DOUBLE, REGION VARCHAR(20))");
        jdbc.update("INSERT INTO SALES VALUES (DATE '2024-01-01', 10.5, 'north')");
        jdbc.update("INSERT INTO SALES VALUES (DATE '2024-01-02', 12.0, 'south')");
        jdbc.update("INSERT INTO SALES VALUES (DATE '2024-01-03', NULL, 'north')");
    }

    @Test
    void validatesReachableDatabase() {
        source.validateConnection();
    }

    @Test
    void unreachableDatabaseRaisesDataSourceException() {
        JdbcTableSource broken = new JdbcTableSource(
                new ConnectionDescriptor("jdbc:nosuchdriver://localhost/db", "u", "p"));

        assertThatThrownBy(broken::validateConnection).isInstanceOf(DataSourceException.class);
    }

    @Test
    void listsTablesWithColumns() {
        assertThat(source.listTables())
                .filteredOn(table -> table.name().equals("SALES"))
                .singleElement()
                .satisfies(table -> assertThat(table.columns()).containsExactly("SOLD_ON", "AMOUNT", "REGION"));
    }

    @Test
    void fetchesRowsAsTypedTable() {
        Table table = source.fetch("SALES", 100);

        assertThat(table.rowCount()).isEqualTo(3);
        assertThat(table.columnNames()).containsExactly("SOLD_ON", "AMOUNT", "REGION");
        assertThat(table.column("SOLD_ON").orElseThrow().type()).isEqualTo(ColumnType.DATETIME);
        assertThat(table.column("SOLD_ON").orElseThrow().get(0)).isEqualTo(LocalDateTime.of(2024, 1, 1, 0, 0));
        assertThat(table.column("AMOUNT").orElseThrow().values()).containsExactly(10.5, 12.0, null);
        assertThat(table.column("REGION").orElseThrow().type()).isEqualTo(ColumnType.TEXT);
    }

    @Test
    void fetchHonoursRowLimitAndMatchesNamesCaseInsensitively() {
        assertThat(source.fetch("sales", 2).rowCount()).isEqualTo(2);
    }

    @Test
    void rejectsTablesOutsideTheCatalogue() {
        assertThatThrownBy(() -> source.fetch("SALES; DROP TABLE SALES", 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(source.fetch("SALES", 10).rowCount()).isEqualTo(3);
    }

    @Test
    void quotesIdentifiers() {
        assertThat(JdbcTableSource.quoteIdentifier("odd\"name", "\"")).isEqualTo("\"odd\"\"name\"");
        assertThat(JdbcTableSource.quoteIdentifier("plain", " ")).isEqualTo("plain");
    }
}
