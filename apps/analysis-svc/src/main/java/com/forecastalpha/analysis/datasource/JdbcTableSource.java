package com.forecastalpha.analysis.datasource;

import com.forecastalpha.analysis.model.Column;
import com.forecastalpha.analysis.model.Table;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

/**
 * Reads tables over JDBC. Table names are only ever taken from the database catalogue, never
 * spliced into SQL as supplied by the caller.
 */
public class JdbcTableSource implements TableSource {

    private static final Logger log = LoggerFactory.getLogger(JdbcTableSource.class);

    private final ConnectionDescriptor descriptor;
    private final JdbcTemplate jdbcTemplate;

    public JdbcTableSource(ConnectionDescriptor descriptor) {
        this.descriptor = descriptor;
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                descriptor.url(), descriptor.username(), descriptor.password());
        this.jdbcTemplate = new JdbcTemplate(dataSource);
    }

    @Override
    public void validateConnection() {
        Integer probe;
        try {
            probe = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
        } catch (DataAccessException ex) {
            throw new DataSourceException("Unable to connect to " + descriptor.redactedUrl(), ex);
        }
        if (probe == null || probe != 1) {
            throw new DataSourceException("Unexpected probe result from " + descriptor.redactedUrl(), null);
        }
        log.debug("Validated connection to {}", descriptor.redactedUrl());
    }

    @Override
    public List<TableInfo> listTables() {
        try {
            return jdbcTemplate.execute((ConnectionCallback<List<TableInfo>>) JdbcTableSource::readCatalogue);
        } catch (DataAccessException ex) {
            throw new DataSourceException("Unable to list tables of " + descriptor.redactedUrl(), ex);
        }
    }

    @Override
    public Table fetch(String tableName, int rowLimit) {
        if (rowLimit <= 0) {
            throw new IllegalArgumentException("rowLimit must be positive");
        }
        TableInfo table = findTable(tableName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown table: " + tableName));
        try {
            String quote = jdbcTemplate.execute((ConnectionCallback<String>) connection ->
                    connection.getMetaData().getIdentifierQuoteString());
            String sql = "SELECT * FROM " + quoteIdentifier(table.name(), quote);
            Table result = jdbcTemplate.query(connection -> {
                PreparedStatement statement = connection.prepareStatement(sql);
                statement.setMaxRows(rowLimit);
                return statement;
            }, (ResultSetExtractor<Table>) JdbcTableSource::toTable);
            log.info("Fetched {} rows from table '{}' (limit={})",
                    result == null ? 0 : result.rowCount(), table.name(), rowLimit);
            return result == null ? Table.empty() : result;
        } catch (DataAccessException ex) {
            throw new DataSourceException("Unable to read table '" + table.name() + "'", ex);
        }
    }

    private Optional<TableInfo> findTable(String tableName) {
        if (tableName == null || tableName.isBlank()) {
            return Optional.empty();
        }
        List<TableInfo> tables = listTables();
        Optional<TableInfo> exact = tables.stream().filter(t -> t.name().equals(tableName)).findFirst();
        if (exact.isPresent()) {
            return exact;
        }
        return tables.stream().filter(t -> t.name().equalsIgnoreCase(tableName)).findFirst();
    }

    static String quoteIdentifier(String name, String quote) {
        if (quote == null || quote.isBlank()) {
            return name;
        }
        String q = quote.trim();
        return q + name.replace(q, q + q) + q;
    }

    private static List<TableInfo> readCatalogue(Connection connection) throws SQLException {
        DatabaseMetaData metaData = connection.getMetaData();
        String catalog = connection.getCatalog();
        String schema = connection.getSchema();
        List<String> names = new ArrayList<>();
        try (ResultSet tables = metaData.getTables(catalog, schema, "%", null)) {
            while (tables.next()) {
                String type = tables.getString("TABLE_TYPE");
                if (isUserRelation(type)) {
                    names.add(tables.getString("TABLE_NAME"));
                }
            }
        }
        List<TableInfo> result = new ArrayList<>(names.size());
        for (String name : names) {
            List<String> columns = new ArrayList<>();
            try (ResultSet rs = metaData.getColumns(catalog, schema, name, "%")) {
                while (rs.next()) {
                    columns.add(rs.getString("COLUMN_NAME"));
                }
            }
            result.add(new TableInfo(name, columns));
        }
        return result;
    }

    private static boolean isUserRelation(String type) {
        if (type == null) {
            return false;
        }
        String upper = type.toUpperCase(Locale.ROOT);
        if (upper.contains("SYSTEM") || upper.contains("TEMPORARY")) {
            return false;
        }
        return upper.contains("TABLE") || upper.contains("VIEW");
    }

    private static Table toTable(ResultSet rs) throws SQLException {
        ResultSetMetaData metaData = rs.getMetaData();
        int columnCount = metaData.getColumnCount();
        List<String> names = new ArrayList<>(columnCount);
        List<List<Object>> cells = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            names.add(metaData.getColumnLabel(i));
            cells.add(new ArrayList<>());
        }
        int rows = 0;
        while (rs.next()) {
            for (int i = 1; i <= columnCount; i++) {
                cells.get(i - 1).add(rs.getObject(i));
            }
            rows++;
        }
        List<Column> columns = new ArrayList<>(columnCount);
        for (int i = 0; i < columnCount; i++) {
            columns.add(Column.of(names.get(i), cells.get(i)));
        }
        return new Table(columns, rows);
    }
}
