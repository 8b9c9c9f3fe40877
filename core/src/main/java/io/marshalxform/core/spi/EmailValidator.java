package io.marshalxform.core.spi;

/** Lexical email address check used by email fields. */
@FunctionalInterface
public interface EmailValidator {

    boolean isValid(String value);
}
