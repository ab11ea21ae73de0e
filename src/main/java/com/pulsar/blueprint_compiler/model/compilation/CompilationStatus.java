package com.pulsar.blueprint_compiler.model.compilation;

public enum CompilationStatus {
    STARTED,
    COMPLETED,
    FAILED
}
