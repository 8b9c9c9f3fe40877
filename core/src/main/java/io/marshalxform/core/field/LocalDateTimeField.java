package io.marshalxform.core.field;

import java.time.ZoneId;
import java.util.Objects;

/** A {@link DateTimeField} that renders values in a local zone (the system zone by default). */
public class LocalDateTimeField extends DateTimeField {

    private final ZoneId zone;

    public LocalDateTimeField() {
        this(null, ZoneId.systemDefault());
    }

    public LocalDateTimeField(String format) {
        this(format, ZoneId.systemDefault());
    }

    public LocalDateTimeField(String format, ZoneId zone) {
        super(format);
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    @Override
    public String kind() {
        return "localdatetime";
    }

    @Override
    protected ZoneId outputZone() {
        return zone;
    }
}
