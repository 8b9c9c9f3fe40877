package io.marshalxform.core.field;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/** ISO time-of-day field backed by {@link LocalTime}, rendered with millisecond precision. */
public class TimeField extends Field {

    @Override
    public String kind() {
        return "time";
    }

    @Override
    protected Object format(Object value) {
        LocalTime time;
        if (value instanceof LocalTime) {
            time = (LocalTime) value;
        } else if (value instanceof OffsetTime) {
            time = ((OffsetTime) value).toLocalTime();
        } else if (value instanceof LocalDateTime) {
            time = ((LocalDateTime) value).toLocalTime();
        } else if (value instanceof OffsetDateTime) {
            time = ((OffsetDateTime) value).toLocalTime();
        } else if (value instanceof ZonedDateTime) {
            time = ((ZonedDateTime) value).toLocalTime();
        } else {
            throw dumpError(quoted(value) + " cannot be formatted as a time.");
        }
        return DateTimeFormatter.ISO_LOCAL_TIME.format(time.truncatedTo(ChronoUnit.MILLIS));
    }

    @Override
    protected Object convert(Object value) {
        if (value instanceof LocalTime) {
            return value;
        }
        try {
            return LocalTime.parse(value.toString().trim());
        } catch (DateTimeException e) {
            throw loadError(quoted(value) + " cannot be deserialized to a time.", e);
        }
    }
}
