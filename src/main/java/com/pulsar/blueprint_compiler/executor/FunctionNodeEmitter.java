package com.pulsar.blueprint_compiler.executor;

import com.pulsar.blueprint_compiler.engine.DataResolver;
import com.pulsar.blueprint_compiler.engine.GenerationContext;
import com.pulsar.blueprint_compiler.engine.TraversalState;
import com.pulsar.blueprint_compiler.model.graph.NodeInstance;
import com.pulsar.blueprint_compiler.model.metadata.NodeKind;
import com.pulsar.blueprint_compiler.model.metadata.NodeMetadata;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One call statement per node:
 * <pre>
 *   print_string("Hello");
 *   let node_len_result = string_length(node_read_result);
 * </pre>
 * then the chain continues from the node's execution output.
 */
@Component
public class FunctionNodeEmitter implements NodeEmitter {

    @Override
    public NodeKind supportedKind() {
        return NodeKind.FUNCTION;
    }

    @Override
    public void emit(NodeInstance node, NodeMetadata metadata, TraversalState state,
                     GenerationContext ctx, StringBuilder out, int indent) {
        String args = metadata.getParams().stream()
                .map(p -> ctx.getResolver().inputExpression(node.getId(), p.name(), p.type(), state))
                .collect(Collectors.joining(", "));
        String call = metadata.callableName() + "(" + args + ")";

        out.append(ctx.indent(indent));
        if (metadata.hasReturnValue()) {
            String resultVar = DataResolver.resultVariable(node.getId());
            out.append("let ").append(resultVar).append(" = ").append(call).append(";\n");
            state.recordResult(node.getId(), resultVar);
        } else {
            out.append(call).append(";\n");
        }

        for (String pin : continuationPins(node, metadata, ctx)) {
            ctx.followPin(node, pin, state, out, indent);
        }
    }

    // Single declared output; catalogs that declare none continue along whatever is wired
    private static List<String> continuationPins(NodeInstance node, NodeMetadata metadata, GenerationContext ctx) {
        if (!metadata.getExecOutputs().isEmpty()) {
            return List.of(metadata.getExecOutputs().get(0));
        }
        return ctx.getRouter().routedPins(node.getId());
    }
}
