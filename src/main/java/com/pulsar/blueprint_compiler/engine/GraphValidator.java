package com.pulsar.blueprint_compiler.engine;

import com.pulsar.blueprint_compiler.exception.CompilationException;
import com.pulsar.blueprint_compiler.model.graph.Connection;
import com.pulsar.blueprint_compiler.model.graph.GraphDescription;
import com.pulsar.blueprint_compiler.model.graph.NodeInstance;
import com.pulsar.blueprint_compiler.model.graph.Pin;
import com.pulsar.blueprint_compiler.model.graph.PinType;
import com.pulsar.blueprint_compiler.types.TypeSystem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Checks connections of the expanded graph before code generation.
 *
 * Pins are only checked on nodes that declare pins on that side; catalog-only nodes may
 * leave them implicit.
 */
@Slf4j
@Component
public class GraphValidator {

    public void validate(GraphDescription graph) {
        for (Connection conn : graph.getConnections()) {
            NodeInstance source = endpoint(graph, conn, conn.getSourceNode(), conn.getSourcePin());
            NodeInstance target = endpoint(graph, conn, conn.getTargetNode(), conn.getTargetPin());

            Optional<Pin> sourcePin = declaredPin(source.getOutputs(), conn.getSourcePin(), conn, source, "output");
            Optional<Pin> targetPin = declaredPin(target.getInputs(), conn.getTargetPin(), conn, target, "input");

            checkCategory(conn, source, sourcePin);
            checkCategory(conn, target, targetPin);

            if (!conn.isExecution() && sourcePin.isPresent() && targetPin.isPresent()) {
                checkTypes(conn, sourcePin.get().getType(), targetPin.get().getType());
            }
        }
        log.info("[COMPILER] Validated {} connections", graph.getConnections().size());
    }

    private static NodeInstance endpoint(GraphDescription graph, Connection conn, String nodeId, String pin) {
        return graph.getNode(nodeId).orElseThrow(() ->
                CompilationException.invalidConnection(conn.getId(), nodeId, pin, "node " + nodeId + " does not exist"));
    }

    private static Optional<Pin> declaredPin(List<Pin> pins, String name, Connection conn, NodeInstance node, String side) {
        if (pins.isEmpty()) return Optional.empty();
        Optional<Pin> pin = pins.stream().filter(p -> p.getName().equals(name)).findFirst();
        if (pin.isEmpty()) {
            throw CompilationException.invalidConnection(conn.getId(), node.getId(), name,
                    "node " + node.getId() + " has no " + side + " pin '" + name + "'");
        }
        return pin;
    }

    private static void checkCategory(Connection conn, NodeInstance node, Optional<Pin> pin) {
        if (pin.isEmpty() || pin.get().getType() == null) return;
        if (pin.get().isExecution() != conn.isExecution()) {
            throw CompilationException.invalidConnection(conn.getId(), node.getId(), pin.get().getName(),
                    (conn.isExecution() ? "execution" : "data") + " connection attached to "
                            + (pin.get().isExecution() ? "execution" : "data") + " pin '" + pin.get().getName() + "'");
        }
    }

    private static void checkTypes(Connection conn, PinType sourceType, PinType targetType) {
        if (sourceType == null || targetType == null || sourceType.isWildcard() || targetType.isWildcard()) return;
        if (!TypeSystem.canConvert(sourceType.typeInfo(), targetType.typeInfo())) {
            throw CompilationException.typeMismatch(conn.getId(), conn.getTargetNode(), conn.getTargetPin(),
                    sourceType.asString(), targetType.asString());
        }
    }
}
