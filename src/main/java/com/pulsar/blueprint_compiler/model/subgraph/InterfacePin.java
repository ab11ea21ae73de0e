package com.pulsar.blueprint_compiler.model.subgraph;

import com.pulsar.blueprint_compiler.model.graph.PinType;

/** A pin on the outside of a reusable graph: "exec" pins carry control, the rest carry data. */
public record InterfacePin(String name, PinType type) {

    public static InterfacePin of(String name, String type) {
        return new InterfacePin(name, PinType.fromString(type));
    }
}
