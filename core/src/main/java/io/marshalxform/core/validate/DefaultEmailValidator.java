package io.marshalxform.core.validate;

import io.marshalxform.core.spi.EmailValidator;
import java.util.regex.Pattern;

/**
 * Regex-based email check. The address is split at the last {@code @}; the local part may be a
 * dot-atom or a quoted string, the domain a dotted host name, {@code localhost}, or a bracketed IP
 * literal.
 */
public final class DefaultEmailValidator implements EmailValidator {

    public static final DefaultEmailValidator INSTANCE = new DefaultEmailValidator();

    private static final Pattern USER = Pattern.compile(
            "(^[-!#$%&'*+/=?^_`{}|~0-9A-Z]+(\\.[-!#$%&'*+/=?^_`{}|~0-9A-Z]+)*$)"
                    + "|(^\"([\\x01-\\x08\\x0b\\x0c\\x0e-\\x1f!#-\\[\\]-\\x7f]|\\\\[\\x01-\\x09\\x0b\\x0c\\x0e-\\x7f])*\"$)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern DOMAIN = Pattern.compile(
            "^(?:[A-Z0-9](?:[A-Z0-9-]{0,61}[A-Z0-9])?\\.)+[A-Z]{2,63}\\.?$", Pattern.CASE_INSENSITIVE);

    private static final Pattern LITERAL = Pattern.compile("^\\[([A-F0-9:.]+)\\]$", Pattern.CASE_INSENSITIVE);

    private DefaultEmailValidator() {}

    @Override
    public boolean isValid(String value) {
        if (value == null) {
            return false;
        }
        int at = value.lastIndexOf('@');
        if (at <= 0 || at == value.length() - 1) {
            return false;
        }
        String user = value.substring(0, at);
        String domain = value.substring(at + 1);
        if (!USER.matcher(user).matches()) {
            return false;
        }
        return "localhost".equalsIgnoreCase(domain)
                || DOMAIN.matcher(domain).matches()
                || LITERAL.matcher(domain).matches();
    }
}
