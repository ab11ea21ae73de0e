package com.pulsar.blueprint_compiler.model.compilation;

public enum CompilationPhase {
    EXPANSION,
    METADATA,
    VALIDATION,
    ROUTING,
    RESOLUTION,
    GENERATION,
    ASSEMBLY
}
