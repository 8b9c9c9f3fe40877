package io.marshalxform.core.field;

import io.marshalxform.core.access.MethodInvoker;
import io.marshalxform.core.schema.Schema;
import java.util.Map;
import java.util.Objects;

/**
 * Dump-only field computed by a public method of the schema subclass. The method takes the object
 * being dumped, and optionally the context map as a second parameter:
 *
 * <pre>{@code
 * public boolean isOwner(User user, Map<String, Object> context) { ... }
 * }</pre>
 *
 * The method is looked up when the field is bound, so a missing method fails schema construction.
 */
public class MethodField extends ComputedField {

    private final String methodName;
    private MethodInvoker invoker;

    public MethodField(String methodName) {
        this.methodName = Objects.requireNonNull(methodName, "methodName must not be null");
    }

    public String methodName() {
        return methodName;
    }

    @Override
    public String kind() {
        return "method";
    }

    @Override
    protected void onBind(Schema parent) {
        invoker = MethodInvoker.find(parent.getClass(), methodName, parent.name(), name());
    }

    @Override
    protected String label() {
        return "Method";
    }

    @Override
    protected boolean requiresContext() {
        return invoker.requiresContext();
    }

    @Override
    protected Object compute(Object source, Map<String, Object> context) {
        return invoker.invoke(parent(), source, context);
    }
}
