package io.marshalxform.core.error;

import java.util.List;

/** Thrown on load when a required field's key is wholly absent from the input mapping. */
public final class RequiredFieldException extends SchemaDataException {

    private static final long serialVersionUID = 1L;

    public static final String MESSAGE = "Missing data for required field.";

    public RequiredFieldException(String schemaName, String fieldName) {
        super(List.of(MESSAGE), schemaName, fieldName, Phase.LOAD);
    }
}
