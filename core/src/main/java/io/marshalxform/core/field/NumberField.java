package io.marshalxform.core.field;

/** Floating point field backed by {@link Double}, optionally rendered as a string on dump. */
public class NumberField extends Field {

    private boolean asString;

    /**
     * Dumps the number as its string rendering instead of a {@link Double}.
     *
     * @return this field (fluent)
     */
    public NumberField asString() {
        this.asString = true;
        return this;
    }

    public boolean isAsString() {
        return asString;
    }

    @Override
    public String kind() {
        return "number";
    }

    @Override
    protected Object kindDefault() {
        return render(0.0);
    }

    @Override
    protected Object format(Object value) {
        return render(toDouble(value, true));
    }

    @Override
    protected Object convert(Object value) {
        return toDouble(value, false);
    }

    private Object render(double value) {
        return asString ? Double.toString(value) : (Object) value;
    }

    private double toDouble(Object value, boolean dumping) {
        try {
            if (value instanceof Number) {
                return ((Number) value).doubleValue();
            }
            if (value instanceof Boolean) {
                return (Boolean) value ? 1.0 : 0.0;
            }
            if (value instanceof CharSequence) {
                return Double.parseDouble(value.toString().trim());
            }
        } catch (NumberFormatException e) {
            String message = quoted(value) + " cannot be converted to a number.";
            throw dumping ? dumpError(message, e) : loadError(message, e);
        }
        String message = quoted(value) + " cannot be converted to a number.";
        throw dumping ? dumpError(message) : loadError(message);
    }
}
