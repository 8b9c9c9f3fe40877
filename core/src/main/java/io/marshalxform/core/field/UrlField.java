package io.marshalxform.core.field;

import io.marshalxform.core.spi.UrlValidator;
import io.marshalxform.core.validate.DefaultUrlValidator;
import java.util.Objects;
import java.util.Optional;

/**
 * URL field validated in both directions by a {@link UrlValidator}. When the validator can suggest
 * a fix (typically a missing scheme) the error message includes it.
 */
public class UrlField extends Field {

    private final boolean relative;
    private final UrlValidator validator;

    public UrlField() {
        this(false);
    }

    public UrlField(boolean relative) {
        this(relative, DefaultUrlValidator.INSTANCE);
    }

    public UrlField(boolean relative, UrlValidator validator) {
        this.relative = relative;
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
    }

    public boolean isRelative() {
        return relative;
    }

    @Override
    public String kind() {
        return "url";
    }

    @Override
    protected Object format(Object value) {
        String text = value.toString();
        if (!validator.isValid(text, relative)) {
            throw dumpError(message(text));
        }
        return text;
    }

    @Override
    protected Object convert(Object value) {
        String text = value.toString();
        if (!validator.isValid(text, relative)) {
            throw loadError(message(text));
        }
        return text;
    }

    private String message(String text) {
        String message = "\"" + text + "\" is not a valid URL.";
        Optional<String> suggestion = validator.suggest(text);
        return suggestion.map(s -> message + " Did you mean: \"" + s + "\"?").orElse(message);
    }
}
