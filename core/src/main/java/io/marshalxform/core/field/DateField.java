package io.marshalxform.core.field;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/** ISO calendar date field backed by {@link LocalDate}. */
public class DateField extends Field {

    @Override
    public String kind() {
        return "date";
    }

    @Override
    protected Object format(Object value) {
        LocalDate date;
        if (value instanceof LocalDate) {
            date = (LocalDate) value;
        } else if (value instanceof LocalDateTime) {
            date = ((LocalDateTime) value).toLocalDate();
        } else if (value instanceof OffsetDateTime) {
            date = ((OffsetDateTime) value).toLocalDate();
        } else if (value instanceof ZonedDateTime) {
            date = ((ZonedDateTime) value).toLocalDate();
        } else {
            throw dumpError(quoted(value) + " cannot be formatted as a date.");
        }
        return DateTimeFormatter.ISO_LOCAL_DATE.format(date);
    }

    @Override
    protected Object convert(Object value) {
        if (value instanceof LocalDate) {
            return value;
        }
        try {
            return LocalDate.parse(value.toString().trim());
        } catch (DateTimeException e) {
            throw loadError(quoted(value) + " cannot be deserialized to a date.", e);
        }
    }
}
