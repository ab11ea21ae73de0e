package com.pulsar.blueprint_compiler.model.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * How a node participates in code generation.
 *
 * PURE          – an expression; no execution pins, pulled in wherever its output is read
 * FUNCTION      – one statement followed by a single continuation
 * CONTROL_FLOW  – a source template with labelled execution outputs spliced in place
 * EVENT         – an entry point; becomes one generated function
 */
public enum NodeKind {
    PURE,
    FUNCTION,
    CONTROL_FLOW,
    EVENT;

    // Catalogs spell these "pure", "fn", "control_flow", "event"
    @JsonCreator
    public static NodeKind fromString(String value) {
        return switch (value.trim().toLowerCase()) {
            case "pure"                         -> PURE;
            case "fn", "function"               -> FUNCTION;
            case "control_flow", "controlflow"  -> CONTROL_FLOW;
            case "event"                        -> EVENT;
            default -> throw new IllegalArgumentException("Unknown node kind: " + value);
        };
    }
}
