package com.pulsar.blueprint_compiler.model.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.pulsar.blueprint_compiler.model.types.TypeInfo;
import com.pulsar.blueprint_compiler.types.TypeSystem;

/**
 * Pin type: control flow, a concrete data type, or a data wildcard.
 * Serialized as a single string: {@code "exec"}, {@code "any"} or the type spelling.
 */
public record PinType(Kind kind, TypeInfo typeInfo) {

    public enum Kind {
        EXECUTION,
        TYPED,
        WILDCARD
    }

    private static final PinType EXECUTION = new PinType(Kind.EXECUTION, null);
    private static final PinType WILDCARD  = new PinType(Kind.WILDCARD, TypeInfo.wildcardType());

    public static PinType execution() {
        return EXECUTION;
    }

    public static PinType wildcard() {
        return WILDCARD;
    }

    public static PinType typed(String type) {
        return new PinType(Kind.TYPED, TypeSystem.parse(type));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PinType fromString(String value) {
        if (value == null || value.isBlank() || "any".equals(value.trim())) return WILDCARD;
        if ("exec".equals(value.trim())) return EXECUTION;
        return typed(value);
    }

    public boolean isExecution() {
        return kind == Kind.EXECUTION;
    }

    public boolean isWildcard() {
        return kind == Kind.WILDCARD;
    }

    @JsonValue
    public String asString() {
        return switch (kind) {
            case EXECUTION -> "exec";
            case WILDCARD  -> "any";
            case TYPED     -> TypeSystem.format(typeInfo);
        };
    }

    @Override
    public String toString() {
        return asString();
    }
}
