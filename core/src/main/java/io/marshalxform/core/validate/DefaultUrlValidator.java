package io.marshalxform.core.validate;

import io.marshalxform.core.spi.UrlValidator;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Regex-based URL check accepting {@code http}, {@code https}, {@code ftp} and {@code ftps} URLs
 * whose host is a domain name, {@code localhost}, or an IPv4/IPv6 literal. With {@code
 * allowRelative}, a path-only reference starting with {@code /} is accepted as well.
 */
public final class DefaultUrlValidator implements UrlValidator {

    public static final DefaultUrlValidator INSTANCE = new DefaultUrlValidator();

    private static final String HOST = "(?:(?:[A-Z0-9](?:[A-Z0-9-]{0,61}[A-Z0-9])?\\.)+(?:[A-Z]{2,63}\\.?|[A-Z0-9-]{2,}\\.?)"
            + "|localhost"
            + "|\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}"
            + "|\\[?[A-F0-9]*:[A-F0-9:]+\\]?)";

    private static final String PORT_AND_PATH = "(?::\\d+)?(?:/?|[/?]\\S+)";

    private static final Pattern ABSOLUTE =
            Pattern.compile("^(?:http|ftp)s?://" + HOST + PORT_AND_PATH + "$", Pattern.CASE_INSENSITIVE);

    private static final Pattern RELATIVE = Pattern.compile(
            "^(?:(?:http|ftp)s?://" + HOST + ")?" + PORT_AND_PATH + "$", Pattern.CASE_INSENSITIVE);

    private DefaultUrlValidator() {}

    @Override
    public boolean isValid(String value, boolean allowRelative) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        return (allowRelative ? RELATIVE : ABSOLUTE).matcher(value).matches();
    }

    /** Suggests {@code http://value} when {@code value} lacks a scheme but is otherwise valid. */
    @Override
    public Optional<String> suggest(String value) {
        if (value == null || value.isEmpty() || value.contains("://")) {
            return Optional.empty();
        }
        String candidate = "http://" + value;
        return ABSOLUTE.matcher(candidate).matches() ? Optional.of(candidate) : Optional.empty();
    }
}
