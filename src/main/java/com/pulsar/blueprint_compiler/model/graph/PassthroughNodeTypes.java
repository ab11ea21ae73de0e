package com.pulsar.blueprint_compiler.model.graph;

import java.util.Set;

/**
 * Built-in node types that need no catalog entry. They generate no code: data flows
 * through them pin-for-pin and execution continues along their routed outputs.
 */
public final class PassthroughNodeTypes {

    public static final String REROUTE         = "reroute";
    public static final String MACRO_ENTRY     = "macro_entry";
    public static final String MACRO_EXIT      = "macro_exit";
    public static final String SUBGRAPH_INPUT  = "subgraph_input";
    public static final String SUBGRAPH_OUTPUT = "subgraph_output";

    private static final Set<String> ALL = Set.of(REROUTE, MACRO_ENTRY, MACRO_EXIT, SUBGRAPH_INPUT, SUBGRAPH_OUTPUT);

    private PassthroughNodeTypes() {
    }

    public static boolean isPassthrough(String nodeType) {
        return nodeType != null && ALL.contains(nodeType);
    }

    public static boolean isEntry(String nodeType) {
        return MACRO_ENTRY.equals(nodeType) || SUBGRAPH_INPUT.equals(nodeType);
    }

    public static boolean isExit(String nodeType) {
        return MACRO_EXIT.equals(nodeType) || SUBGRAPH_OUTPUT.equals(nodeType);
    }
}
