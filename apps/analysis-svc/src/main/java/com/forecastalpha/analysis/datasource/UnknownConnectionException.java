package com.forecastalpha.analysis.datasource;

public class UnknownConnectionException extends RuntimeException {

    private final String connectionId;

    public UnknownConnectionException(String connectionId) {
        super("Unknown connection id: " + connectionId);
        this.connectionId = connectionId;
    }

    public String connectionId() {
        return connectionId;
    }
}
