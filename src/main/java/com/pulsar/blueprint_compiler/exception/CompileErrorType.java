package com.pulsar.blueprint_compiler.exception;

public enum CompileErrorType {
    UNKNOWN_NODE_TYPE,
    NO_ENTRY_POINT,
    SUBGRAPH_NOT_FOUND,
    CIRCULAR_REFERENCE,
    DEPTH_EXCEEDED,
    MISSING_RESULT_VARIABLE,
    CYCLIC_PURE_DEPENDENCY,
    UNRESOLVED_DATA_DEPENDENCY,
    INVALID_TEMPLATE,

    // Load-time validation of the expanded graph
    MULTIPLE_DATA_SOURCES,
    INVALID_CONNECTION,
    TYPE_MISMATCH
}
