package com.forecastalpha.analysis.datasource;

import com.forecastalpha.analysis.model.Table;
import java.util.List;

/**
 * A relational store the pipeline can read rows from.
 */
public interface TableSource {

    /**
     * @throws DataSourceException when the store cannot be reached
     */
    void validateConnection();

    List<TableInfo> listTables();

    /**
     * Reads at most {@code rowLimit} rows of {@code tableName}, in the store's natural order.
     *
     * @throws IllegalArgumentException when the table is not in the store's catalogue
     * @throws DataSourceException      when the read fails
     */
    Table fetch(String tableName, int rowLimit);
}
