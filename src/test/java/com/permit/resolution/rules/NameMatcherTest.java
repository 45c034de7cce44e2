package com.permit.resolution.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NameMatcher Tests")
class NameMatcherTest {

    private final NormalizationEngine engine = DefaultNormalizationRules.createDefaultEngine();

    @ParameterizedTest(name = "''{0}'' vs ''{1}'' -> {2}")
    @CsvSource(delimiter = '|', value = {
            "J. Doe|Jane Doe|true",
            "Jane Doe|J. Doe|true",
            "J. Q. Doe|Jane Quinn Doe|true",
            "Jane Doe|Jane Doe|false",
            "J. Doe|John Smith|false",
            "J. Doe|K. Doe|false",
            "Jane Doe|John Doe|false",
            "J. Doe|Jane Q. Doe|false",
            "Doe|Doe|false",
            "J Doe|Jane Doe|true"
    })
    void initialsCompatible(String left, String right, boolean expected) {
        assertEquals(expected, NameMatcher.initialsCompatible(engine.key(left), engine.key(right)));
    }

    @Test
    @DisplayName("Empty keys never match")
    void emptyKeys() {
        assertFalse(NameMatcher.initialsCompatible(NameKey.EMPTY, engine.key("J. Doe")));
    }
}
