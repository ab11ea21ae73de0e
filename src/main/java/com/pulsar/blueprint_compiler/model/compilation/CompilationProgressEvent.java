package com.pulsar.blueprint_compiler.model.compilation;

/** Published for every phase transition. {@code detail} is free text for humans. */
public record CompilationProgressEvent(String compilationId, CompilationPhase phase,
                                       CompilationStatus status, String detail) {

    public String toDiagnosticLine() {
        String line = "[" + phase + "] " + status;
        return detail == null || detail.isBlank() ? line : line + ": " + detail;
    }
}
