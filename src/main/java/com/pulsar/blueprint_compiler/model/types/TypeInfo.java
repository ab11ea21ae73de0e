package com.pulsar.blueprint_compiler.model.types;

import java.util.List;

/**
 * Structural type of a data pin: a base type wrapped by an outside-in stack of wrappers.
 * For wildcards the base type keeps the token it was written with ("?", "_", "T").
 */
public record TypeInfo(String baseType, List<WrapperType> wrappers, boolean wildcard) {

    public TypeInfo {
        wrappers = wrappers != null ? List.copyOf(wrappers) : List.of();
    }

    public static TypeInfo wildcardType() {
        return new TypeInfo("?", List.of(), true);
    }
}
