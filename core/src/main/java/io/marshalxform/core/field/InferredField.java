package io.marshalxform.core.field;

import io.marshalxform.core.error.AttributeLookupException;
import io.marshalxform.core.model.Missing;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Pass-through field synthesized for names listed by the {@code fields} or {@code additional}
 * options without a declaration. Having no declared type, it formats values by their runtime type
 * and fails when the attribute does not exist at all.
 */
public class InferredField extends Field {

    @Override
    public String kind() {
        return "inferred";
    }

    @Override
    public Object serialize(Object source) {
        Object value = getValue(source);
        if (source != null && Missing.isMissing(value)) {
            throw new AttributeLookupException(
                    "'" + source.getClass().getSimpleName() + "' object has no attribute '" + key() + "'",
                    schemaName(),
                    name());
        }
        return serializeValue(value);
    }

    @Override
    protected Object format(Object value) {
        if (value instanceof OffsetDateTime) {
            return utc((OffsetDateTime) value);
        }
        if (value instanceof ZonedDateTime) {
            return utc(((ZonedDateTime) value).toOffsetDateTime());
        }
        if (value instanceof LocalDateTime) {
            return utc(((LocalDateTime) value).atOffset(ZoneOffset.UTC));
        }
        if (value instanceof LocalDate) {
            return DateTimeFormatter.ISO_LOCAL_DATE.format((LocalDate) value);
        }
        if (value instanceof LocalTime) {
            return DateTimeFormatter.ISO_LOCAL_TIME.format(((LocalTime) value).truncatedTo(ChronoUnit.MILLIS));
        }
        if (value instanceof UUID) {
            return value.toString();
        }
        if (value instanceof Enum) {
            return ((Enum<?>) value).name();
        }
        return value;
    }

    @Override
    protected Object convert(Object value) {
        return value;
    }

    private static String utc(OffsetDateTime value) {
        return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(value.withOffsetSameInstant(ZoneOffset.UTC));
    }
}
