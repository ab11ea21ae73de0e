package com.pulsar.blueprint_compiler.types;

import com.pulsar.blueprint_compiler.model.types.TypeInfo;
import com.pulsar.blueprint_compiler.model.types.WrapperType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parsing, formatting and connection rules for pin types.
 *
 * <pre>
 *   parse("Arc&lt;Vec&lt;String&gt;&gt;")  → base "String", wrappers [SHARED_REF, LIST]
 *   parse("&amp;mut T")              → base "T", wrappers [MUTABLE_BORROW], wildcard
 * </pre>
 *
 * Compatibility is strict structural equality (wildcards match anything); conversion
 * additionally allows wrapper changes around the same base type and the widening table below.
 */
public final class TypeSystem {

    // Implicit conversions keyed by formatted source type. Closed transitively in the static block.
    private static final Map<String, Set<String>> WIDENINGS = new HashMap<>();

    static {
        widen("i8", "i16");
        widen("i16", "i32");
        widen("i32", "i64");
        widen("i64", "i128");
        widen("u8", "u16");
        widen("u16", "u32");
        widen("u32", "u64");
        widen("u64", "u128");
        widen("u8", "i16");
        widen("u16", "i32");
        widen("u32", "i64");
        widen("u64", "i128");
        for (String small : List.of("i8", "i16", "i32", "u8", "u16")) {
            widen(small, "f32");
        }
        for (String integer : List.of("i64", "i128", "u32", "u64", "u128")) {
            widen(integer, "f64");
        }
        widen("f32", "f64");
        closeTransitively();

        // String slices and owned strings convert both ways; added after the closure on purpose
        widen("&str", "String");
        widen("String", "&str");
    }

    private TypeSystem() {
    }

    // ── Parse / format ────────────────────────────────────────────────────────

    public static TypeInfo parse(String typeString) {
        if (typeString == null || typeString.isBlank()) {
            throw new IllegalArgumentException("Type string must not be blank");
        }
        String remaining = typeString.trim();
        List<WrapperType> wrappers = new ArrayList<>();

        boolean peeled = true;
        while (peeled) {
            peeled = false;
            for (WrapperType wrapper : WrapperType.values()) {
                String inner = peel(remaining, wrapper);
                if (inner != null) {
                    wrappers.add(wrapper);
                    remaining = inner.trim();
                    peeled = true;
                    break;
                }
            }
        }

        return new TypeInfo(remaining, wrappers, isWildcardToken(remaining));
    }

    public static String format(TypeInfo type) {
        String result = type.baseType();
        List<WrapperType> wrappers = type.wrappers();
        for (int i = wrappers.size() - 1; i >= 0; i--) {
            result = wrappers.get(i).wrap(result);
        }
        return result;
    }

    private static String peel(String type, WrapperType wrapper) {
        if (!type.startsWith(wrapper.getPrefix())) return null;
        if (wrapper.getSuffix().isEmpty()) {
            return type.substring(wrapper.getPrefix().length());
        }
        if (type.length() <= wrapper.getPrefix().length() || !type.endsWith(wrapper.getSuffix())) return null;
        return type.substring(wrapper.getPrefix().length(), type.length() - wrapper.getSuffix().length());
    }

    static boolean isWildcardToken(String token) {
        if ("?".equals(token) || "_".equals(token)) return true;
        return token.length() == 1 && Character.isUpperCase(token.charAt(0));
    }

    // ── Connection rules ──────────────────────────────────────────────────────

    public static boolean isCompatible(TypeInfo a, TypeInfo b) {
        if (a.wildcard() || b.wildcard()) return true;
        return a.baseType().equals(b.baseType()) && a.wrappers().equals(b.wrappers());
    }

    public static boolean canConvert(TypeInfo from, TypeInfo to) {
        if (from.wildcard() || to.wildcard()) return true;
        if (from.baseType().equals(to.baseType())) return true;
        return WIDENINGS.getOrDefault(format(from), Set.of()).contains(format(to));
    }

    /** Formatted target types {@code type} widens to, excluding itself. */
    public static Set<String> wideningsOf(String type) {
        return Collections.unmodifiableSet(WIDENINGS.getOrDefault(type, Set.of()));
    }

    // ── Literals / display ────────────────────────────────────────────────────

    /** Literal used for an input that has no wire, property or pin default. */
    public static String defaultValue(TypeInfo type) {
        String formatted = format(type);
        if ("f32".equals(formatted) || "f64".equals(formatted)) {
            return "0.0";
        }
        if (formatted.startsWith("(") && formatted.endsWith(")")
                && (formatted.contains("f32") || formatted.contains("f64"))) {
            int count = formatted.substring(1, formatted.length() - 1).split(",").length;
            return "(" + String.join(", ", Collections.nCopies(count, "0.0")) + ")";
        }
        return "Default::default()";
    }

    public static String displayName(String type) {
        return switch (type) {
            case "()"     -> "Unit";
            case "bool"   -> "Boolean";
            case "i32"    -> "Integer (32-bit)";
            case "i64"    -> "Integer (64-bit)";
            case "f32"    -> "Float (32-bit)";
            case "f64"    -> "Float (64-bit)";
            case "&str"   -> "String";
            case "String" -> "String (owned)";
            default -> type.startsWith("(") && type.endsWith(")") ? "Tuple: " + type : type;
        };
    }

    // ── Widening table ────────────────────────────────────────────────────────

    private static void widen(String from, String to) {
        WIDENINGS.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to);
    }

    private static void closeTransitively() {
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Set<String> targets : WIDENINGS.values()) {
                for (String target : List.copyOf(targets)) {
                    for (String next : WIDENINGS.getOrDefault(target, Set.of())) {
                        changed |= targets.add(next);
                    }
                }
            }
        }
    }
}
