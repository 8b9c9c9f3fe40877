package io.marshalxform.core.access;

import io.marshalxform.core.model.Missing;
import io.marshalxform.core.spi.AttributeAccessor;
import java.util.Map;

/** Reads attributes from {@link Map} sources by key. A key that is not present yields {@link Missing#VALUE}. */
public final class MapAttributeAccessor implements AttributeAccessor {

    public static final MapAttributeAccessor INSTANCE = new MapAttributeAccessor();

    private MapAttributeAccessor() {}

    @Override
    public boolean canAccess(Object source) {
        return source instanceof Map;
    }

    @Override
    public Object get(Object source, String name) {
        Map<?, ?> map = (Map<?, ?>) source;
        if (!map.containsKey(name)) {
            return Missing.VALUE;
        }
        return map.get(name);
    }

    @Override
    public String toString() {
        return "MapAttributeAccessor";
    }
}
