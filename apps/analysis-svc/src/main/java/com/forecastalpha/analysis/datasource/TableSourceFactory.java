package com.forecastalpha.analysis.datasource;

import org.springframework.stereotype.Component;

@Component
public class TableSourceFactory {

    public TableSource open(ConnectionDescriptor descriptor) {
        return new JdbcTableSource(descriptor);
    }
}
