package io.marshalxform.core.field;

import io.marshalxform.core.spi.EmailValidator;
import io.marshalxform.core.validate.DefaultEmailValidator;
import java.util.Objects;

/** Email address field validated in both directions by an {@link EmailValidator}. */
public class EmailField extends Field {

    private final EmailValidator validator;

    public EmailField() {
        this(DefaultEmailValidator.INSTANCE);
    }

    public EmailField(EmailValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
    }

    @Override
    public String kind() {
        return "email";
    }

    @Override
    protected Object format(Object value) {
        String text = value.toString();
        if (!validator.isValid(text)) {
            throw dumpError("\"" + text + "\" is not a valid email address.");
        }
        return text;
    }

    @Override
    protected Object convert(Object value) {
        String text = value.toString();
        if (!validator.isValid(text)) {
            throw loadError("\"" + text + "\" is not a valid email address.");
        }
        return text;
    }
}
