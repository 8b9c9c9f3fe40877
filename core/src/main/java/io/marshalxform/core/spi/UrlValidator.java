package io.marshalxform.core.spi;

import java.util.Optional;

/** Lexical URL check used by URL fields. Substitutable for testing or stricter policy. */
public interface UrlValidator {

    /**
     * Returns {@code true} if {@code value} is a well-formed URL.
     *
     * @param value         the candidate URL
     * @param allowRelative whether a relative reference such as {@code /foo} is acceptable
     */
    boolean isValid(String value, boolean allowRelative);

    /**
     * Suggests a corrected form of an invalid URL, typically by adding an explicit scheme.
     *
     * @return the suggestion, or empty if no simple correction is known
     */
    default Optional<String> suggest(String value) {
        return Optional.empty();
    }
}
