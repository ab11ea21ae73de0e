package com.pulsar.blueprint_compiler.engine;

import java.util.Collection;
import java.util.Map;
import java.util.stream.Collectors;

/** Renders literal property and pin default values as source text. */
public final class LiteralFormatter {

    private LiteralFormatter() {
    }

    public static String format(Object value) {
        if (value == null) return "Default::default()";
        if (value instanceof String s) return quote(s);
        if (value instanceof Boolean b) return b.toString();
        if (value instanceof Double || value instanceof Float) return number(((Number) value).doubleValue());
        if (value instanceof Number n) return n.toString();
        if (value instanceof Collection<?> items) {
            return items.stream().map(LiteralFormatter::format).collect(Collectors.joining(", ", "(", ")"));
        }
        if (value instanceof Map<?, ?> map && map.containsKey("x") && map.containsKey("y")) {
            // Vector-like objects from the editor: { x, y[, z] }
            String tuple = format(map.get("x")) + ", " + format(map.get("y"));
            return map.containsKey("z") ? "(" + tuple + ", " + format(map.get("z")) + ")" : "(" + tuple + ")";
        }
        return quote(value.toString());
    }

    static String number(double d) {
        if (d == Math.floor(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }

    static String quote(String s) {
        StringBuilder out = new StringBuilder(s.length() + 2).append('"');
        for (char c : s.toCharArray()) {
            switch (c) {
                case '"'  -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default   -> out.append(c);
            }
        }
        return out.append('"').toString();
    }
}
