package io.marshalxform.core.field;

import java.util.UUID;
import java.util.regex.Pattern;

/** UUID field. Dumps the canonical string form; loads a {@link UUID}. */
public class UuidField extends Field {

    private static final Pattern CANONICAL =
            Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    @Override
    public String kind() {
        return "uuid";
    }

    @Override
    protected Object format(Object value) {
        UUID uuid = toUuid(value);
        if (uuid == null) {
            throw dumpError(quoted(value) + " is not a valid UUID.");
        }
        return uuid.toString();
    }

    @Override
    protected Object convert(Object value) {
        UUID uuid = toUuid(value);
        if (uuid == null) {
            throw loadError(quoted(value) + " is not a valid UUID.");
        }
        return uuid;
    }

    private static UUID toUuid(Object value) {
        if (value instanceof UUID) {
            return (UUID) value;
        }
        if (value instanceof CharSequence) {
            String text = value.toString().trim();
            if (CANONICAL.matcher(text).matches()) {
                return UUID.fromString(text);
            }
        }
        return null;
    }
}
