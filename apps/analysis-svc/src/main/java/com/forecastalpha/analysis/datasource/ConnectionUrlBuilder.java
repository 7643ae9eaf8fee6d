package com.forecastalpha.analysis.datasource;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Assembles {@code jdbc:<driver>://host:port/database?k=v} URLs from connection fields.
 */
public final class ConnectionUrlBuilder {

    private static final Pattern DRIVER_NAME = Pattern.compile("[a-z][a-z0-9]*(:[a-z][a-z0-9]*)*");
    private static final Pattern PASSWORD_PARAM = Pattern.compile("(?i)(password=)[^&;]+");

    private ConnectionUrlBuilder() {
    }

    public static String build(String driver, String host, Integer port, String database, Map<String, String> options) {
        if (driver == null || !DRIVER_NAME.matcher(driver.trim().toLowerCase()).matches()) {
            throw new IllegalArgumentException("driver must be a JDBC sub-protocol such as 'postgresql' (actual='" + driver + "')");
        }
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host must be provided");
        }
        if (port != null && (port <= 0 || port > 65535)) {
            throw new IllegalArgumentException("port must be between 1 and 65535");
        }
        StringBuilder url = new StringBuilder("jdbc:")
                .append(driver.trim().toLowerCase())
                .append("://")
                .append(host.trim());
        if (port != null) {
            url.append(':').append(port);
        }
        url.append('/');
        if (database != null && !database.isBlank()) {
            url.append(database.trim());
        }
        if (options != null && !options.isEmpty()) {
            // sorted so equal inputs always produce equal URLs
            String query = new TreeMap<>(options).entrySet().stream()
                    .map(e -> encode(e.getKey()) + "=" + encode(e.getValue() == null ? "" : e.getValue()))
                    .collect(Collectors.joining("&"));
            url.append('?').append(query);
        }
        return url.toString();
    }

    /**
     * Masks any {@code password=} query parameter so the URL can be logged.
     */
    public static String redact(String url) {
        if (url == null) {
            return null;
        }
        return PASSWORD_PARAM.matcher(url).replaceAll("$1***");
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
