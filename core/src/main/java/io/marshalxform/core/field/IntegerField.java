package io.marshalxform.core.field;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Integer field backed by {@link Integer}. Fractional numbers are truncated toward zero; values
 * outside the {@code int} range are conversion errors.
 */
public class IntegerField extends Field {

    @Override
    public String kind() {
        return "integer";
    }

    @Override
    protected Object kindDefault() {
        return 0;
    }

    @Override
    protected Object format(Object value) {
        return toInteger(value, true);
    }

    @Override
    protected Object convert(Object value) {
        return toInteger(value, false);
    }

    private Integer toInteger(Object value, boolean dumping) {
        String message = quoted(value) + " cannot be converted to an integer.";
        try {
            if (value instanceof Integer) {
                return (Integer) value;
            }
            if (value instanceof Double || value instanceof Float) {
                double d = ((Number) value).doubleValue();
                if (Double.isNaN(d) || Double.isInfinite(d)) {
                    throw dumping ? dumpError(message) : loadError(message);
                }
                if (d >= Integer.MAX_VALUE + 1.0 || d <= Integer.MIN_VALUE - 1.0) {
                    throw dumping ? dumpError(message) : loadError(message);
                }
                return (int) d;
            }
            if (value instanceof Number) {
                return new BigDecimal(value.toString()).setScale(0, RoundingMode.DOWN).intValueExact();
            }
            if (value instanceof Boolean) {
                return (Boolean) value ? 1 : 0;
            }
            if (value instanceof CharSequence) {
                return Integer.valueOf(value.toString().trim());
            }
        } catch (NumberFormatException | ArithmeticException e) {
            throw dumping ? dumpError(message, e) : loadError(message, e);
        }
        throw dumping ? dumpError(message) : loadError(message);
    }
}
