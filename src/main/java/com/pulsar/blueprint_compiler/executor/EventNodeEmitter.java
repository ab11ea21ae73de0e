package com.pulsar.blueprint_compiler.executor;

import com.pulsar.blueprint_compiler.engine.GenerationContext;
import com.pulsar.blueprint_compiler.engine.TraversalState;
import com.pulsar.blueprint_compiler.model.graph.NodeInstance;
import com.pulsar.blueprint_compiler.model.metadata.NodeKind;
import com.pulsar.blueprint_compiler.model.metadata.NodeMetadata;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Events only start chains. One reached through an execution wire ends that chain; its own
 * body is generated as a separate function.
 */
@Slf4j
@Component
public class EventNodeEmitter implements NodeEmitter {

    @Override
    public NodeKind supportedKind() {
        return NodeKind.EVENT;
    }

    @Override
    public void emit(NodeInstance node, NodeMetadata metadata, TraversalState state,
                     GenerationContext ctx, StringBuilder out, int indent) {
        log.debug("[COMPILER] Execution wire into event node {} ignored", node.getId());
    }
}
