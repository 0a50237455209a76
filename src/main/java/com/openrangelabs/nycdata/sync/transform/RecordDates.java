package com.openrangelabs.nycdata.sync.transform;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.function.Supplier;

/**
 * Parsing and formatting of source date values.
 * Socrata floating timestamps look like {@code 2024-01-15T00:00:00.000}; some datasets
 * carry compact dates such as {@code 20240115} and declare their own pattern.
 */
public final class RecordDates {

    public static final DateTimeFormatter FLOATING_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS");

    private RecordDates() {}

    /**
     * Parse a source value, returning null when it is blank or not a recognizable date
     */
    public static LocalDateTime parse(String value, String pattern) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        if (pattern != null && !pattern.isBlank()) {
            return parseWithPattern(trimmed, DateTimeFormatter.ofPattern(pattern));
        }
        LocalDateTime parsed = tryParse(() -> LocalDateTime.parse(trimmed));
        if (parsed == null) {
            parsed = tryParse(() -> LocalDate.parse(trimmed).atStartOfDay());
        }
        if (parsed == null) {
            parsed = tryParse(() -> OffsetDateTime.parse(trimmed).toLocalDateTime());
        }
        return parsed;
    }

    /**
     * Format a watermark the way the source compares it
     */
    public static String format(LocalDateTime value, String pattern) {
        if (pattern != null && !pattern.isBlank()) {
            return DateTimeFormatter.ofPattern(pattern).format(value);
        }
        return FLOATING_TIMESTAMP.format(value);
    }

    private static LocalDateTime parseWithPattern(String value, DateTimeFormatter formatter) {
        LocalDateTime parsed = tryParse(() -> LocalDateTime.parse(value, formatter));
        return parsed != null ? parsed : tryParse(() -> LocalDate.parse(value, formatter).atStartOfDay());
    }

    private static LocalDateTime tryParse(Supplier<LocalDateTime> parser) {
        try {
            return parser.get();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
