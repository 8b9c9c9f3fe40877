package io.marshalxform.core.field;

import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Dump-only field computed by a function of the object being dumped, or of the object and the
 * schema context.
 *
 * <pre>{@code
 * FunctionField.of((User u) -> u.getName().toUpperCase())
 * FunctionField.withContext((User u, Map<String, Object> ctx) -> ctx.get("blog") != null)
 * }</pre>
 */
public class FunctionField extends ComputedField {

    private final BiFunction<Object, Map<String, Object>, ?> function;
    private final boolean requiresContext;

    private FunctionField(BiFunction<Object, Map<String, Object>, ?> function, boolean requiresContext) {
        this.function = function;
        this.requiresContext = requiresContext;
    }

    /** A field computed from the object alone. */
    @SuppressWarnings("unchecked")
    public static <T> FunctionField of(Function<T, ?> function) {
        Objects.requireNonNull(function, "function must not be null");
        return new FunctionField((obj, ctx) -> function.apply((T) obj), false);
    }

    /** A field computed from the object and the schema context. Dumping without a context fails. */
    @SuppressWarnings("unchecked")
    public static <T> FunctionField withContext(BiFunction<T, Map<String, Object>, ?> function) {
        Objects.requireNonNull(function, "function must not be null");
        return new FunctionField((obj, ctx) -> function.apply((T) obj, ctx), true);
    }

    @Override
    public String kind() {
        return "function";
    }

    @Override
    protected String label() {
        return "Function";
    }

    @Override
    protected boolean requiresContext() {
        return requiresContext;
    }

    @Override
    protected Object compute(Object source, Map<String, Object> context) {
        return function.apply(source, context);
    }
}
