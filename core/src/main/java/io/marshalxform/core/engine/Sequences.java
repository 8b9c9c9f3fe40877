package io.marshalxform.core.engine;

import java.util.Arrays;
import java.util.Iterator;
import java.util.Map;
import java.util.stream.BaseStream;

/** Recognizes and iterates the sequence types accepted in many-mode. */
final class Sequences {

    private Sequences() {}

    /** Returns {@code true} for iterables (other than maps), iterators, streams and object arrays. */
    static boolean isSequence(Object value) {
        return (value instanceof Iterable && !(value instanceof Map))
                || value instanceof Iterator
                || value instanceof BaseStream
                || value instanceof Object[];
    }

    /** Iterates a value for which {@link #isSequence} is true, in a single pass. */
    static Iterator<?> iterator(Object value) {
        if (value instanceof Iterable) {
            return ((Iterable<?>) value).iterator();
        }
        if (value instanceof Iterator) {
            return (Iterator<?>) value;
        }
        if (value instanceof BaseStream) {
            return ((BaseStream<?, ?>) value).iterator();
        }
        return Arrays.asList((Object[]) value).iterator();
    }
}
