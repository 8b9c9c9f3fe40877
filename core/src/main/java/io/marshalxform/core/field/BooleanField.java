package io.marshalxform.core.field;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Boolean field tolerant of common textual and numeric spellings: {@code "t"}, {@code "true"},
 * {@code "1"}, {@code 1} and friends are true; {@code "f"}, {@code "false"}, {@code "0"}, {@code 0}
 * and {@code 0.0} are false.
 */
public class BooleanField extends Field {

    private static final Set<String> TRUTHY = Set.of("t", "T", "true", "True", "TRUE", "1");
    private static final Set<String> FALSY = Set.of("f", "F", "false", "False", "FALSE", "0");

    @Override
    public String kind() {
        return "boolean";
    }

    @Override
    protected Object kindDefault() {
        return false;
    }

    @Override
    protected Object format(Object value) {
        return toBoolean(value, true);
    }

    @Override
    protected Object convert(Object value) {
        return toBoolean(value, false);
    }

    private Boolean toBoolean(Object value, boolean dumping) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof CharSequence) {
            String text = value.toString();
            if (TRUTHY.contains(text)) {
                return true;
            }
            if (FALSY.contains(text)) {
                return false;
            }
        } else if (value instanceof Number) {
            try {
                BigDecimal number = DecimalSupport.toBigDecimal(value);
                if (number.compareTo(BigDecimal.ONE) == 0) {
                    return true;
                }
                if (number.signum() == 0) {
                    return false;
                }
            } catch (NumberFormatException e) {
                // NaN and infinities fall through to the error below
            }
        }
        String message = quoted(value) + " is not a valid boolean.";
        throw dumping ? dumpError(message) : loadError(message);
    }
}
