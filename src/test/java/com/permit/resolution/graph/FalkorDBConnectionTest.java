package com.permit.resolution.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FalkorDBConnection parameter binding")
class FalkorDBConnectionTest {

    @Test
    @DisplayName("Strings are quoted and escaped")
    void quotesStrings() {
        assertEquals("'O\\'Brien'", FalkorDBConnection.literal("O'Brien"));
    }

    @Test
    @DisplayName("Numbers, booleans, null and lists are inlined")
    void inlinesOtherValues() {
        assertEquals("42", FalkorDBConnection.literal(42));
        assertEquals("true", FalkorDBConnection.literal(true));
        assertEquals("null", FalkorDBConnection.literal(null));
        assertEquals("['P1', 'P2', null]", FalkorDBConnection.literal(Arrays.asList("P1", "P2", null)));
    }

    @Test
    @DisplayName("Longer parameter names are bound first")
    void bindsLongestFirst() {
        String bound = FalkorDBConnection.bind("RETURN $id, $idA", Map.of("id", "x", "idA", List.of(1, 2)));
        assertEquals("RETURN 'x', [1, 2]", bound);
    }
}
