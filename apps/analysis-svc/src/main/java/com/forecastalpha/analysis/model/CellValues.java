package com.forecastalpha.analysis.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.function.Function;

/**
 * Coercion helpers shared by every pipeline stage. Failed coercions return {@code null}
 * instead of throwing, so callers can drop or keep the cell as they see fit.
 */
public final class CellValues {

    /**
     * Seconds always printed, fraction only when non-zero.
     */
    public static final DateTimeFormatter ISO_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    private static final DateTimeFormatter LOCAL_DATE_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .appendValue(ChronoField.HOUR_OF_DAY, 2)
            .appendLiteral(':')
            .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
            .optionalStart()
            .appendLiteral(':')
            .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    private static final List<DateTimeFormatter> DATE_ONLY = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("yyyy/MM/dd"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy")
    );

    private CellValues() {
    }

    /**
     * Canonical cell representation: numbers become {@link Double} (NaN becomes null),
     * temporal values become {@link LocalDateTime}, anything else its string form.
     */
    public static Object normalize(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number number) {
            double value = number.doubleValue();
            return Double.isNaN(value) ? null : value;
        }
        LocalDateTime temporal = temporalOf(raw);
        if (temporal != null) {
            return temporal;
        }
        return raw.toString();
    }

    public static Double toDouble(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return Double.isNaN(d) || Double.isInfinite(d) ? null : d;
        }
        if (value instanceof String text) {
            String trimmed = text.trim();
            if (trimmed.isEmpty()) {
                return null;
            }
            try {
                double d = Double.parseDouble(trimmed);
                return Double.isNaN(d) || Double.isInfinite(d) ? null : d;
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    public static LocalDateTime toDateTime(Object value) {
        if (value == null) {
            return null;
        }
        LocalDateTime temporal = temporalOf(value);
        if (temporal != null) {
            return temporal;
        }
        if (value instanceof String text) {
            return parseDateTime(text.trim());
        }
        return null;
    }

    public static String isoFormat(LocalDateTime value) {
        return ISO_FORMAT.format(value);
    }

    private static LocalDateTime parseDateTime(String text) {
        if (text.isEmpty()) {
            return null;
        }
        LocalDateTime parsed = attempt(text,
                candidate -> OffsetDateTime.parse(candidate).atZoneSameInstant(ZoneOffset.UTC).toLocalDateTime());
        if (parsed == null) {
            parsed = attempt(text, candidate -> LocalDateTime.parse(candidate, LOCAL_DATE_TIME));
        }
        for (int i = 0; parsed == null && i < DATE_ONLY.size(); i++) {
            DateTimeFormatter formatter = DATE_ONLY.get(i);
            parsed = attempt(text, candidate -> LocalDate.parse(candidate, formatter).atStartOfDay());
        }
        return parsed;
    }

    private static LocalDateTime attempt(String text, Function<String, LocalDateTime> parser) {
        try {
            return parser.apply(text);
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    private static LocalDateTime temporalOf(Object raw) {
        if (raw instanceof LocalDateTime dateTime) {
            return dateTime;
        }
        if (raw instanceof LocalDate date) {
            return date.atStartOfDay();
        }
        if (raw instanceof java.sql.Timestamp timestamp) {
            return timestamp.toLocalDateTime();
        }
        if (raw instanceof java.sql.Date sqlDate) {
            return sqlDate.toLocalDate().atStartOfDay();
        }
        if (raw instanceof java.util.Date date) {
            return LocalDateTime.ofInstant(date.toInstant(), ZoneOffset.UTC);
        }
        if (raw instanceof Instant instant) {
            return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
        }
        if (raw instanceof OffsetDateTime offset) {
            return offset.atZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
        }
        if (raw instanceof ZonedDateTime zoned) {
            return zoned.withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
        }
        return null;
    }
}
