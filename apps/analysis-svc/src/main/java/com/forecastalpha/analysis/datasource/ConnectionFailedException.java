package com.forecastalpha.analysis.datasource;

/**
 * A connection attempt that never got as far as registration.
 */
public class ConnectionFailedException extends DataSourceException {

    public ConnectionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
