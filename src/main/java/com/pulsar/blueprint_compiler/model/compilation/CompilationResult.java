package com.pulsar.blueprint_compiler.model.compilation;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class CompilationResult {
    private String compilationId;
    private String source;

    private int eventCount;
    private int nodeCount;

    // Human-readable progress lines in the order they happened; not a machine contract
    private List<String> diagnostics;
}
