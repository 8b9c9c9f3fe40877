package io.marshalxform.core.validate;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DefaultUrlValidatorTest {

    private final DefaultUrlValidator validator = DefaultUrlValidator.INSTANCE;

    @ParameterizedTest
    @ValueSource(strings = {
        "http://example.org",
        "https://example.org/path?q=1",
        "ftp://files.example.org/pub/file.txt",
        "http://localhost:8000/",
        "http://192.168.0.1/admin",
        "http://[::1]:8080/"
    })
    void acceptsAbsoluteUrls(String url) {
        assertThat(validator.isValid(url, false)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"www.foo.com", "example", "javascript:alert(1)", "http://", "/relative/path", ""})
    void rejectsNonAbsoluteUrls(String url) {
        assertThat(validator.isValid(url, false)).isFalse();
    }

    @Test
    void relativeModeAcceptsPaths() {
        assertThat(validator.isValid("/foo/bar", true)).isTrue();
        assertThat(validator.isValid("http://example.org/foo", true)).isTrue();
        assertThat(validator.isValid("foo bar", true)).isFalse();
    }

    @Test
    void suggestsSchemeForBareHost() {
        assertThat(validator.suggest("www.foo.com")).contains("http://www.foo.com");
        assertThat(validator.suggest("http://www.foo.com")).isEmpty();
        assertThat(validator.suggest("not a host")).isEmpty();
    }
}
