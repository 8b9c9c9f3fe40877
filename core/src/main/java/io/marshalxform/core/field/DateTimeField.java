package io.marshalxform.core.field;

import io.marshalxform.core.schema.Schema;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;

/**
 * Date-time field. On dump the value ({@link Instant}, {@link OffsetDateTime}, {@link
 * ZonedDateTime}, or a {@link LocalDateTime} taken to be UTC) is normalized to UTC and formatted; on
 * load text is parsed to an {@link OffsetDateTime}, taking text without an offset to be UTC.
 *
 * <p>The format is {@code iso} (the default), {@code rfc}, or a {@link DateTimeFormatter} pattern.
 * A field without its own format uses the schema's {@code dateformat} option when set.
 */
public class DateTimeField extends Field {

    private final String format;
    private DateTimeFormatter formatter;

    public DateTimeField() {
        this(null);
    }

    public DateTimeField(String format) {
        this.format = format;
        this.formatter = TemporalFormats.dateTimeFormatter(format);
    }

    /** The declared format, or {@code null} if the field defers to the schema option. */
    public String format() {
        return format;
    }

    @Override
    public String kind() {
        return "datetime";
    }

    @Override
    protected void onBind(Schema parent) {
        if (format == null && parent != null && parent.options().dateformat() != null) {
            formatter = TemporalFormats.dateTimeFormatter(parent.options().dateformat());
        }
    }

    /** Zone the value is rendered in on dump. */
    protected ZoneId outputZone() {
        return ZoneOffset.UTC;
    }

    @Override
    protected Object format(Object value) {
        try {
            return formatter.format(toInstant(value).atZone(outputZone()));
        } catch (DateTimeException e) {
            throw dumpError(quoted(value) + " cannot be formatted as a datetime.", e);
        }
    }

    @Override
    protected Object convert(Object value) {
        try {
            if (value instanceof CharSequence) {
                return parse(value.toString().trim());
            }
            return toInstant(value).atOffset(ZoneOffset.UTC);
        } catch (DateTimeException e) {
            throw loadError(quoted(value) + " cannot be deserialized to a datetime.", e);
        }
    }

    private OffsetDateTime parse(String text) {
        TemporalAccessor parsed = formatter.parseBest(
                text, OffsetDateTime::from, ZonedDateTime::from, LocalDateTime::from, LocalDate::from);
        if (parsed instanceof OffsetDateTime) {
            return (OffsetDateTime) parsed;
        }
        if (parsed instanceof ZonedDateTime) {
            return ((ZonedDateTime) parsed).toOffsetDateTime();
        }
        if (parsed instanceof LocalDateTime) {
            return ((LocalDateTime) parsed).atOffset(ZoneOffset.UTC);
        }
        return ((LocalDate) parsed).atStartOfDay().atOffset(ZoneOffset.UTC);
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant();
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toInstant();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
        }
        if (value instanceof java.util.Date) {
            return ((java.util.Date) value).toInstant();
        }
        throw new DateTimeException("not a date-time: " + value.getClass().getName());
    }
}
