package com.pulsar.blueprint_compiler.exception;

import lombok.Getter;

/**
 * Fatal error for the current compilation. Carries the identifiers the editor needs to point
 * the user at the offending node, pin, connection or subgraph definition.
 */
@Getter
public class CompilationException extends RuntimeException {

    private final CompileErrorType type;
    private final String nodeId;
    private final String pinName;
    private final String subgraphId;
    private final String connectionId;

    private CompilationException(CompileErrorType type, String message,
                                 String nodeId, String pinName, String subgraphId, String connectionId) {
        super(message);
        this.type = type;
        this.nodeId = nodeId;
        this.pinName = pinName;
        this.subgraphId = subgraphId;
        this.connectionId = connectionId;
    }

    // ── Compilation phases ────────────────────────────────────────────────────

    public static CompilationException unknownNodeType(String nodeId, String nodeType) {
        return new CompilationException(CompileErrorType.UNKNOWN_NODE_TYPE,
                "Unknown node type '" + nodeType + "' on node " + nodeId, nodeId, null, null, null);
    }

    public static CompilationException noEntryPoint() {
        return new CompilationException(CompileErrorType.NO_ENTRY_POINT,
                "No event nodes found in graph; at least one entry point is required", null, null, null, null);
    }

    public static CompilationException subgraphNotFound(String subgraphId) {
        return new CompilationException(CompileErrorType.SUBGRAPH_NOT_FOUND,
                "Subgraph definition not found: " + subgraphId, null, null, subgraphId, null);
    }

    public static CompilationException circularReference(String subgraphId) {
        return new CompilationException(CompileErrorType.CIRCULAR_REFERENCE,
                "Circular subgraph reference detected at: " + subgraphId, null, null, subgraphId, null);
    }

    public static CompilationException depthExceeded(int maxDepth) {
        return new CompilationException(CompileErrorType.DEPTH_EXCEEDED,
                "Maximum subgraph expansion depth exceeded: " + maxDepth, null, null, null, null);
    }

    public static CompilationException missingResultVariable(String nodeId) {
        return new CompilationException(CompileErrorType.MISSING_RESULT_VARIABLE,
                "No result variable recorded for node " + nodeId, nodeId, null, null, null);
    }

    public static CompilationException cyclicPureDependency(String nodeId) {
        return new CompilationException(CompileErrorType.CYCLIC_PURE_DEPENDENCY,
                "Cyclic dependency detected among pure nodes (involving " + nodeId + ")", nodeId, null, null, null);
    }

    public static CompilationException unresolvedDataDependency(String nodeId, String pinName) {
        return new CompilationException(CompileErrorType.UNRESOLVED_DATA_DEPENDENCY,
                "Data input '" + pinName + "' on node " + nodeId
                        + " reads a result that has not been generated on this execution path",
                nodeId, pinName, null, null);
    }

    public static CompilationException invalidTemplate(String nodeId, String nodeType, String reason) {
        return new CompilationException(CompileErrorType.INVALID_TEMPLATE,
                "Source template of '" + nodeType + "' cannot be inlined at node " + nodeId + ": " + reason,
                nodeId, null, null, null);
    }

    // ── Validation ────────────────────────────────────────────────────────────

    public static CompilationException multipleDataSources(String nodeId, String pinName) {
        return new CompilationException(CompileErrorType.MULTIPLE_DATA_SOURCES,
                "Data input '" + pinName + "' on node " + nodeId + " has more than one incoming connection",
                nodeId, pinName, null, null);
    }

    public static CompilationException invalidConnection(String connectionId, String nodeId, String pinName, String reason) {
        return new CompilationException(CompileErrorType.INVALID_CONNECTION,
                "Invalid connection" + (connectionId != null ? " " + connectionId : "") + ": " + reason, nodeId, pinName, null, connectionId);
    }

    public static CompilationException typeMismatch(String connectionId, String nodeId, String pinName,
                                                    String sourceType, String targetType) {
        return new CompilationException(CompileErrorType.TYPE_MISMATCH,
                "Connection " + connectionId + " cannot convert " + sourceType + " to " + targetType
                        + " (input '" + pinName + "' on node " + nodeId + ")",
                nodeId, pinName, null, connectionId);
    }
}
