package io.marshalxform.core.field;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Fixed-point number rendered as a string with a fixed count of decimals, rounded half-even. */
public class FixedField extends Field {

    private final int decimals;

    public FixedField() {
        this(5);
    }

    public FixedField(int decimals) {
        if (decimals < 0) {
            throw new IllegalArgumentException("decimals must not be negative: " + decimals);
        }
        this.decimals = decimals;
    }

    public int decimals() {
        return decimals;
    }

    @Override
    public String kind() {
        return "fixed";
    }

    @Override
    protected Object kindDefault() {
        return BigDecimal.ZERO.setScale(decimals).toPlainString();
    }

    @Override
    protected Object format(Object value) {
        return toFixed(value, true);
    }

    @Override
    protected Object convert(Object value) {
        return toFixed(value, false);
    }

    private String toFixed(Object value, boolean dumping) {
        try {
            return DecimalSupport.toBigDecimal(value).setScale(decimals, RoundingMode.HALF_EVEN).toPlainString();
        } catch (NumberFormatException e) {
            String message = quoted(value) + " cannot be converted to a fixed-point number.";
            throw dumping ? dumpError(message, e) : loadError(message, e);
        }
    }
}
