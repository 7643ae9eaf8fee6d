package com.forecastalpha.analysis.datasource;

public class DataSourceException extends RuntimeException {

    public DataSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
