package io.marshalxform.core.field;

/** A {@link FixedField} with two decimals. */
public class PriceField extends FixedField {

    public PriceField() {
        super(2);
    }

    @Override
    public String kind() {
        return "price";
    }
}
