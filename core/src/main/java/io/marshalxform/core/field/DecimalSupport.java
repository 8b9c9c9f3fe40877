package io.marshalxform.core.field;

import java.math.BigDecimal;

/** Conversions shared by the {@link BigDecimal}-based field kinds. */
final class DecimalSupport {

    private DecimalSupport() {}

    /**
     * Converts numbers and numeric strings to {@link BigDecimal}.
     *
     * @throws NumberFormatException if the value is not numeric, NaN or infinite
     */
    static BigDecimal toBigDecimal(Object value) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new NumberFormatException("not a finite number: " + d);
            }
            return BigDecimal.valueOf(d);
        }
        if (value instanceof Number || value instanceof CharSequence) {
            return new BigDecimal(value.toString().trim());
        }
        throw new NumberFormatException("not a number: " + value.getClass().getName());
    }
}
