package com.pulsar.blueprint_compiler.engine;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LiteralFormatterTest {

    @Test
    void shouldQuoteAndEscapeStrings() {
        assertEquals("\"say \\\"hi\\\"\\n\"", LiteralFormatter.format("say \"hi\"\n"));
    }

    @Test
    void shouldPrintWholeFloatsWithoutFraction() {
        assertEquals("3", LiteralFormatter.format(3.0));
        assertEquals("2.5", LiteralFormatter.format(2.5));
        assertEquals("-7", LiteralFormatter.format(-7.0f));
        assertEquals("42", LiteralFormatter.format(42L));
    }

    @Test
    void shouldRenderBooleans() {
        assertEquals("true", LiteralFormatter.format(Boolean.TRUE));
    }

    @Test
    void shouldRenderListsAsTuples() {
        assertEquals("(1, 2.5, \"x\")", LiteralFormatter.format(List.of(1, 2.5, "x")));
    }

    @Test
    void shouldRenderVectorObjectsAsTuples() {
        Map<String, Object> vector = new LinkedHashMap<>();
        vector.put("x", 1.0);
        vector.put("y", 2.0);
        assertEquals("(1, 2)", LiteralFormatter.format(vector));

        vector.put("z", 0.5);
        assertEquals("(1, 2, 0.5)", LiteralFormatter.format(vector));
    }

    @Test
    void shouldFallBackToDefaultForNull() {
        assertEquals("Default::default()", LiteralFormatter.format(null));
    }
}
