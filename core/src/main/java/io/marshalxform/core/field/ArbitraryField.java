package io.marshalxform.core.field;

/** Arbitrary-precision number rendered as a plain decimal string. */
public class ArbitraryField extends Field {

    @Override
    public String kind() {
        return "arbitrary";
    }

    @Override
    protected Object kindDefault() {
        return "0";
    }

    @Override
    protected Object format(Object value) {
        return toPlain(value, true);
    }

    @Override
    protected Object convert(Object value) {
        return toPlain(value, false);
    }

    private String toPlain(Object value, boolean dumping) {
        try {
            return DecimalSupport.toBigDecimal(value).toPlainString();
        } catch (NumberFormatException e) {
            String message = quoted(value) + " cannot be converted to an arbitrary-precision number.";
            throw dumping ? dumpError(message, e) : loadError(message, e);
        }
    }
}
