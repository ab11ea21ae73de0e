package com.pulsar.blueprint_compiler.model.graph;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum ConnectionKind {
    EXECUTION,
    DATA;

    // Editor exports use lowercase ("execution" / "data")
    @JsonCreator
    public static ConnectionKind fromString(String value) {
        return ConnectionKind.valueOf(value.trim().toUpperCase());
    }
}
