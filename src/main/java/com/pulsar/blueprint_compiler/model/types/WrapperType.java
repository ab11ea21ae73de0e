package com.pulsar.blueprint_compiler.model.types;

import lombok.Getter;

/**
 * Container/reference wrappers a {@link TypeInfo} may stack around its base type.
 * Parse order matters: {@code &mut } must be tried before {@code &}.
 */
@Getter
public enum WrapperType {
    LIST("Vec<", ">"),
    MAP("HashMap<", ">"),
    SET("HashSet<", ">"),
    SHARED_REF("Arc<", ">"),
    UNIQUE_REF("Box<", ">"),
    MUTABLE_BORROW("&mut ", ""),
    BORROW("&", ""),
    OPTIONAL("Option<", ">"),
    FALLIBLE("Result<", ">");

    private final String prefix;
    private final String suffix;

    WrapperType(String prefix, String suffix) {
        this.prefix = prefix;
        this.suffix = suffix;
    }

    public String wrap(String inner) {
        return prefix + inner + suffix;
    }
}
