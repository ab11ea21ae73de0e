package com.pulsar.blueprint_compiler.engine;

import com.pulsar.blueprint_compiler.model.graph.GraphDescription;
import com.pulsar.blueprint_compiler.model.graph.NodeInstance;
import com.pulsar.blueprint_compiler.model.metadata.NodeMetadata;
import lombok.Getter;

import java.util.Map;

/**
 * Everything code generation reads for one compilation. Built from the expanded graph and
 * discarded afterwards; nothing in it is shared between compilations.
 */
@Getter
public class GenerationContext {

    private final GraphDescription graph;
    private final Map<String, NodeMetadata> metadataByNode;
    private final ExecutionRouter router;
    private final DataResolver resolver;
    private final String indentUnit;
    private final CodeGenerator generator;

    public GenerationContext(GraphDescription graph, Map<String, NodeMetadata> metadataByNode,
                             ExecutionRouter router, DataResolver resolver,
                             String indentUnit, CodeGenerator generator) {
        this.graph = graph;
        this.metadataByNode = metadataByNode;
        this.router = router;
        this.resolver = resolver;
        this.indentUnit = indentUnit;
        this.generator = generator;
    }

    public String indent(int level) {
        return indentUnit.repeat(Math.max(level, 0));
    }

    /** Generates the chains wired to {@code pin} of {@code node}, in wire order. */
    public void followPin(NodeInstance node, String pin, TraversalState state, StringBuilder out, int indent) {
        for (ExecutionRouter.RouteKey target : router.getTargets(node.getId(), pin)) {
            generator.generateExecChain(target.nodeId(), target.pin(), state, out, indent, this);
        }
    }
}
