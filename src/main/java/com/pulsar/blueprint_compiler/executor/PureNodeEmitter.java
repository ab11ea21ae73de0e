package com.pulsar.blueprint_compiler.executor;

import com.pulsar.blueprint_compiler.engine.GenerationContext;
import com.pulsar.blueprint_compiler.engine.TraversalState;
import com.pulsar.blueprint_compiler.model.graph.NodeInstance;
import com.pulsar.blueprint_compiler.model.metadata.NodeKind;
import com.pulsar.blueprint_compiler.model.metadata.NodeMetadata;
import org.springframework.stereotype.Component;

/** Pure nodes are expressions; the data resolver pulls them in wherever their outputs are read. */
@Component
public class PureNodeEmitter implements NodeEmitter {

    @Override
    public NodeKind supportedKind() {
        return NodeKind.PURE;
    }

    @Override
    public void emit(NodeInstance node, NodeMetadata metadata, TraversalState state,
                     GenerationContext ctx, StringBuilder out, int indent) {
        // nothing to emit
    }
}
