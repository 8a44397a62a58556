package com.entity.reconciliation.rules;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationEngineTest {

    private NormalizationEngine engine;

    @BeforeEach
    void setUp() {
        engine = NormalizationEngine.withDefaults();
    }

    @Test
    @DisplayName("Should handle null and blank inputs")
    void testNullAndBlankInputs() {
        assertEquals("", engine.normalize(null, "risk"));
        assertEquals("", engine.normalize("", "risk"));
        assertEquals("", engine.normalize("   ", "risk"));
    }

    @ParameterizedTest
    @DisplayName("Should normalize risk names")
    @CsvSource({
            "Weak TLS Cipher,weak-tls-cipher",
            "'  padded name  ',padded-name",
            "exposed#admin#panel,exposedadminpanel",
            "multiple   spaces,multiple-spaces"
    })
    void testRiskNames(String input, String expected) {
        assertEquals(expected, engine.normalize(input, "risk"));
    }

    @Test
    @DisplayName("Type specific rules should not apply to other types")
    void testTypeScoping() {
        assertEquals("weak tls cipher", engine.normalize(" Weak TLS Cipher ", "asset"));
        assertEquals("a#b", engine.normalize("a#b", null));
        assertEquals("ab", engine.normalize("a#b", "RISK"));
    }

    @Test
    @DisplayName("Should strip control characters")
    void testControlCharacters() {
        assertEquals("abc", engine.normalize("a\u0000b\u0007c", null));
    }

    @Test
    @DisplayName("Rules should run in priority order")
    void testPriorityOrder() {
        NormalizationEngine custom = new NormalizationEngine(List.of(
                NormalizationRule.of("second", "b", "c", 20),
                NormalizationRule.of("first", "a", "b", 10)));

        assertEquals("cc", custom.normalize("ab", null));
        assertEquals("first", custom.getRules().get(0).name());
    }

    @Test
    @DisplayName("Rules should match case-insensitively")
    void testCaseInsensitiveRule() {
        NormalizationEngine custom = new NormalizationEngine(List.of(
                NormalizationRule.of("drop-www", "^www\\.", "", 10)));

        assertEquals("example.com", custom.normalize("WWW.Example.com", null));
    }
}
