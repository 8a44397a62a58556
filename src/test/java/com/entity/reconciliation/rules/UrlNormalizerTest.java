package com.entity.reconciliation.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class UrlNormalizerTest {

    @ParameterizedTest
    @DisplayName("Should canonicalize URLs")
    @CsvSource({
            "https://Example.COM,https://example.com/",
            "HTTPS://example.com/Path,https://example.com/Path",
            "https://example.com:443/app,https://example.com/app",
            "http://example.com:80/,http://example.com/",
            "http://example.com:443/x,https://example.com/x",
            "https://example.com:80/x,http://example.com/x",
            "https://example.com:8443/x,https://example.com:8443/x",
            "https://example.com/search?q=1#top,https://example.com/search",
            "https://user@example.com/,https://user@example.com/"
    })
    void testNormalize(String input, String expected) {
        assertEquals(expected, UrlNormalizer.normalize(input));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"example.com/path", "https://", "http://:80/", "ht tp://bad"})
    @DisplayName("Should reject unusable URLs")
    void testInvalid(String input) {
        assertThrows(IllegalArgumentException.class, () -> UrlNormalizer.normalize(input));
        assertFalse(UrlNormalizer.isValid(input));
    }

    @Test
    @DisplayName("Normalizing twice should be stable")
    void testIdempotent() {
        String once = UrlNormalizer.normalize("HTTP://Example.com:443");
        assertEquals(once, UrlNormalizer.normalize(once));
    }
}
