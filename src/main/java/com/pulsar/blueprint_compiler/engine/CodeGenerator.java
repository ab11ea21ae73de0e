package com.pulsar.blueprint_compiler.engine;

import com.pulsar.blueprint_compiler.exception.CompilationException;
import com.pulsar.blueprint_compiler.executor.NodeEmitterRegistry;
import com.pulsar.blueprint_compiler.model.graph.GraphDescription;
import com.pulsar.blueprint_compiler.model.graph.NodeInstance;
import com.pulsar.blueprint_compiler.model.graph.PassthroughNodeTypes;
import com.pulsar.blueprint_compiler.model.metadata.NodeMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Walks execution wiring from each event and emits block-structured code.
 *
 * The walk is a depth-first traversal with a visited set per path: a node already on the
 * current path ends the chain, which is what stops execution cycles. Iteration only comes
 * from loop templates (for_loop, while_loop), never from wiring.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CodeGenerator {

    public static final String DEFAULT_EVENT_OUTPUT = "Body";

    private final NodeEmitterRegistry emitterRegistry;

    public GenerationContext newContext(GraphDescription graph, Map<String, NodeMetadata> metadataByNode,
                                        ExecutionRouter router, DataResolver resolver, String indentUnit) {
        return new GenerationContext(graph, metadataByNode, router, resolver, indentUnit, this);
    }

    /** {@code pub fn <functionName>() { ... }} for one event node, with a trailing newline. */
    public String generateEventFunction(NodeInstance event, String functionName, GenerationContext ctx) {
        NodeMetadata metadata = ctx.getMetadataByNode().get(event.getId());
        List<String> outputs = metadata != null && !metadata.getExecOutputs().isEmpty()
                ? metadata.getExecOutputs()
                : List.of(DEFAULT_EVENT_OUTPUT);

        TraversalState state = TraversalState.forFunction();
        state.markVisited(event.getId());

        StringBuilder body = new StringBuilder();
        for (String pin : outputs) {
            ctx.followPin(event, pin, state, body, 1);
        }

        StringBuilder fn = new StringBuilder("pub fn ").append(functionName).append("() {\n");
        List<String> bindings = ctx.getResolver().sharedTemporaryBindings(state);
        if (!bindings.isEmpty()) {
            String indent = ctx.indent(1);
            fn.append(indent).append("// Pure node evaluations\n");
            bindings.forEach(line -> fn.append(indent).append(line).append('\n'));
            fn.append('\n');
        }
        fn.append(body).append("}\n");

        log.info("[COMPILER] Generated function {} from event {}", functionName, event.getId());
        return fn.toString();
    }

    /**
     * @param arrivalPin execution input pin the wire arrived on; macro entry and exit nodes
     *                   continue only from the output pin of the same name
     */
    public void generateExecChain(String nodeId, String arrivalPin, TraversalState state, StringBuilder out,
                                  int indent, GenerationContext ctx) {
        NodeInstance node = ctx.getGraph().getNode(nodeId)
                .orElseThrow(() -> CompilationException.invalidConnection(null, nodeId, null,
                        "execution wire targets missing node " + nodeId));

        boolean pinForPin = arrivalPin != null
                && PassthroughNodeTypes.isPassthrough(node.getNodeType())
                && !PassthroughNodeTypes.REROUTE.equals(node.getNodeType());
        String visitKey = pinForPin ? nodeId + "." + arrivalPin : nodeId;
        if (!state.markVisited(visitKey)) {
            log.debug("[COMPILER] {} already on this path, chain ends", visitKey);
            return;
        }

        if (PassthroughNodeTypes.isPassthrough(node.getNodeType())) {
            List<String> pins = pinForPin ? List.of(arrivalPin) : ctx.getRouter().routedPins(nodeId);
            for (String pin : pins) {
                ctx.followPin(node, pin, state, out, indent);
            }
            return;
        }

        NodeMetadata metadata = ctx.getMetadataByNode().get(nodeId);
        if (metadata == null) {
            throw CompilationException.unknownNodeType(nodeId, node.getNodeType());
        }
        emitterRegistry.get(metadata.getKind()).emit(node, metadata, state, ctx, out, indent);
    }
}
