package org.carball.reducer.output;

import java.sql.Time;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;

/**
 * Converts JDBC temporal values to {@code java.time} and renders them the way the engine
 * prints them: {@code 2024-01-02 10:11:12}, fractional seconds only when present.
 */
final class TemporalValues {

    static final DateTimeFormatter TIMESTAMP_TEXT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral(' ')
            .appendPattern("HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .toFormatter();

    static final DateTimeFormatter TIMESTAMP_WITH_OFFSET_TEXT = new DateTimeFormatterBuilder()
            .append(TIMESTAMP_TEXT)
            .appendOffset("+HH:mm", "+00")
            .toFormatter();

    private TemporalValues() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns the {@code java.time} equivalent of a JDBC date, time or timestamp; any other
     * value is returned unchanged.
     */
    static Object normalize(Object value) {
        if (value instanceof Timestamp timestamp) {
            return timestamp.toLocalDateTime();
        }
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate();
        }
        if (value instanceof Time time) {
            return time.toLocalTime();
        }
        return value;
    }

    static boolean isTemporal(Object value) {
        Object normalized = normalize(value);
        return normalized instanceof LocalDateTime
                || normalized instanceof LocalDate
                || normalized instanceof LocalTime
                || normalized instanceof OffsetDateTime;
    }

    /**
     * Text form of a value for a CSV cell. Temporal values use the engine's format; everything
     * else is left for the CSV printer.
     */
    static Object toCsvValue(Object value) {
        Object normalized = normalize(value);
        if (normalized instanceof LocalDateTime dateTime) {
            return dateTime.format(TIMESTAMP_TEXT);
        }
        if (normalized instanceof OffsetDateTime dateTime) {
            return dateTime.format(TIMESTAMP_WITH_OFFSET_TEXT);
        }
        if (normalized instanceof LocalDate || normalized instanceof LocalTime) {
            return normalized.toString();
        }
        return value;
    }
}
