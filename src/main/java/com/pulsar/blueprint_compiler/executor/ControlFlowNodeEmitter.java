package com.pulsar.blueprint_compiler.executor;

import com.pulsar.blueprint_compiler.engine.GenerationContext;
import com.pulsar.blueprint_compiler.engine.TemplateInliner;
import com.pulsar.blueprint_compiler.engine.TraversalState;
import com.pulsar.blueprint_compiler.exception.CompilationException;
import com.pulsar.blueprint_compiler.model.graph.NodeInstance;
import com.pulsar.blueprint_compiler.model.metadata.NodeKind;
import com.pulsar.blueprint_compiler.model.metadata.NodeMetadata;
import com.pulsar.blueprint_compiler.model.metadata.NodeParameter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Inlines the node's source template. Each execution output is generated into its own buffer
 * from a copy of the current traversal state, so branches cannot revisit their ancestors and
 * do not see each other's nodes. Results generated by an output spliced at the template's top
 * level stay readable by the outputs after it.
 */
@Slf4j
@Component
public class ControlFlowNodeEmitter implements NodeEmitter {

    @Override
    public NodeKind supportedKind() {
        return NodeKind.CONTROL_FLOW;
    }

    @Override
    public void emit(NodeInstance node, NodeMetadata metadata, TraversalState state,
                     GenerationContext ctx, StringBuilder out, int indent) {
        if (metadata.getSource() == null || metadata.getSource().isBlank()) {
            throw CompilationException.invalidTemplate(node.getId(), metadata.getName(), "no source template");
        }
        Set<String> topLevel;
        try {
            topLevel = TemplateInliner.topLevelOutputs(metadata.getSource());
        } catch (IllegalArgumentException ex) {
            throw CompilationException.invalidTemplate(node.getId(), metadata.getName(), ex.getMessage());
        }

        Map<String, String> params = new LinkedHashMap<>();
        for (NodeParameter param : metadata.getParams()) {
            params.put(param.name(), ctx.getResolver().inputExpression(node.getId(), param.name(), param.type(), state));
        }

        Map<String, String> execBlocks = new LinkedHashMap<>();
        for (String pin : metadata.getExecOutputs()) {
            TraversalState branch = topLevel.contains(pin) ? state.sameScope() : state.branch();
            StringBuilder block = new StringBuilder();
            ctx.followPin(node, pin, branch, block, 0);
            execBlocks.put(pin, block.toString());
        }

        String body = TemplateInliner.inline(metadata.getSource(), execBlocks, params, ctx.getIndentUnit());
        log.debug("[COMPILER] Inlined {} ({}) with outputs {}", node.getId(), metadata.getName(), execBlocks.keySet());

        String prefix = ctx.indent(indent);
        for (String line : body.split("\n")) {
            if (!line.isBlank()) {
                out.append(prefix).append(line).append('\n');
            }
        }
    }
}
