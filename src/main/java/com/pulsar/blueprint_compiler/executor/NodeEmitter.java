package com.pulsar.blueprint_compiler.executor;

import com.pulsar.blueprint_compiler.engine.GenerationContext;
import com.pulsar.blueprint_compiler.engine.TraversalState;
import com.pulsar.blueprint_compiler.model.graph.NodeInstance;
import com.pulsar.blueprint_compiler.model.metadata.NodeKind;
import com.pulsar.blueprint_compiler.model.metadata.NodeMetadata;

public interface NodeEmitter {

    NodeKind supportedKind();

    // Appends the node's code at the given indent level, then continues down its execution outputs
    void emit(NodeInstance node, NodeMetadata metadata, TraversalState state,
              GenerationContext ctx, StringBuilder out, int indent);
}
