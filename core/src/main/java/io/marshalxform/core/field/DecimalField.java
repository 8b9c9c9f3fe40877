package io.marshalxform.core.field;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Exact decimal field backed by {@link BigDecimal}. When {@code places} is set the value is
 * rescaled with the configured rounding mode (half-even by default).
 */
public class DecimalField extends Field {

    private final Integer places;
    private final RoundingMode rounding;
    private boolean asString;

    public DecimalField() {
        this(null, RoundingMode.HALF_EVEN);
    }

    public DecimalField(Integer places) {
        this(places, RoundingMode.HALF_EVEN);
    }

    public DecimalField(Integer places, RoundingMode rounding) {
        if (places != null && places < 0) {
            throw new IllegalArgumentException("places must not be negative: " + places);
        }
        this.places = places;
        this.rounding = rounding == null ? RoundingMode.HALF_EVEN : rounding;
    }

    /**
     * Dumps the value as a plain string instead of a {@link BigDecimal}.
     *
     * @return this field (fluent)
     */
    public DecimalField asString() {
        this.asString = true;
        return this;
    }

    public Integer places() {
        return places;
    }

    public RoundingMode rounding() {
        return rounding;
    }

    @Override
    public String kind() {
        return "decimal";
    }

    @Override
    protected Object format(Object value) {
        BigDecimal decimal = toDecimal(value, true);
        return asString ? decimal.toPlainString() : decimal;
    }

    @Override
    protected Object convert(Object value) {
        return toDecimal(value, false);
    }

    private BigDecimal toDecimal(Object value, boolean dumping) {
        try {
            BigDecimal decimal = DecimalSupport.toBigDecimal(value);
            return places == null ? decimal : decimal.setScale(places, rounding);
        } catch (NumberFormatException | ArithmeticException e) {
            String message = quoted(value) + " cannot be converted to a decimal.";
            throw dumping ? dumpError(message, e) : loadError(message, e);
        }
    }
}
