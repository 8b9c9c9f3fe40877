package io.marshalxform.core.field;

import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** Resolves the format names accepted by date/time fields. */
final class TemporalFormats {

    static final String ISO = "iso";
    static final String RFC = "rfc";

    private TemporalFormats() {}

    /**
     * Returns the formatter for {@code format}: {@code iso} (or {@code null}), {@code rfc} for RFC
     * 1123, or a {@link DateTimeFormatter} pattern.
     *
     * @throws IllegalArgumentException if the pattern is invalid
     */
    static DateTimeFormatter dateTimeFormatter(String format) {
        if (format == null || ISO.equalsIgnoreCase(format)) {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME;
        }
        if (RFC.equalsIgnoreCase(format)) {
            return DateTimeFormatter.RFC_1123_DATE_TIME;
        }
        return DateTimeFormatter.ofPattern(format, Locale.ROOT);
    }
}
