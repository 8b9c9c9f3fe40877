package io.marshalxform.core.model;

/**
 * Marker for an attribute or key that is wholly absent, as opposed to present with a {@code null}
 * value. Attribute resolution returns {@link #VALUE} when a lookup finds nothing, and {@code
 * Field.deserialize} returns it for an absent key so the engine can leave the key out of the
 * output.
 */
public enum Missing {
    VALUE;

    /** Returns {@code true} if {@code value} is the missing marker. */
    public static boolean isMissing(Object value) {
        return value == VALUE;
    }

    /** Returns {@code true} if {@code value} is {@code null} or the missing marker. */
    public static boolean isMissingOrNull(Object value) {
        return value == null || value == VALUE;
    }

    @Override
    public String toString() {
        return "<missing>";
    }
}
