package com.forecastalpha.analysis.datasource;

/**
 * Everything needed to open a JDBC connection. The password never appears in {@link #toString()}.
 */
public record ConnectionDescriptor(String url, String username, String password) {

    public ConnectionDescriptor {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must be provided");
        }
        if (!url.startsWith("jdbc:")) {
            throw new IllegalArgumentException("url must start with 'jdbc:'");
        }
    }

    public String redactedUrl() {
        return ConnectionUrlBuilder.redact(url);
    }

    @Override
    public String toString() {
        String user = username == null || username.isBlank() ? "<none>" : username;
        return "ConnectionDescriptor[url=" + redactedUrl() + ", username=" + user + ", password=***]";
    }
}
