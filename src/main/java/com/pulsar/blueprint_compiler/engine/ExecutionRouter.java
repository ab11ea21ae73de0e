package com.pulsar.blueprint_compiler.engine;

import com.pulsar.blueprint_compiler.model.graph.Connection;
import com.pulsar.blueprint_compiler.model.graph.GraphDescription;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Where execution goes next: (source node, execution output pin) → ordered (target node, input pin).
 * Target order is wire order in the graph.
 */
@Slf4j
public final class ExecutionRouter {

    public record RouteKey(String nodeId, String pin) {
    }

    private final Map<RouteKey, List<RouteKey>> routes;

    private ExecutionRouter(Map<RouteKey, List<RouteKey>> routes) {
        this.routes = routes;
    }

    public static ExecutionRouter build(GraphDescription graph) {
        Map<RouteKey, List<RouteKey>> routes = new LinkedHashMap<>();
        for (Connection conn : graph.getConnections()) {
            if (!conn.isExecution()) continue;
            routes.computeIfAbsent(new RouteKey(conn.getSourceNode(), conn.getSourcePin()), k -> new ArrayList<>())
                  .add(new RouteKey(conn.getTargetNode(), conn.getTargetPin()));
            log.debug("[ROUTING] {}.{} -> {}.{}", conn.getSourceNode(), conn.getSourcePin(),
                    conn.getTargetNode(), conn.getTargetPin());
        }
        log.info("[ROUTING] Built {} execution routes", routes.size());
        return new ExecutionRouter(routes);
    }

    public List<String> getConnectedNodes(String nodeId, String pin) {
        return getTargets(nodeId, pin).stream().map(RouteKey::nodeId).toList();
    }

    /** Targets of {@code nodeId.pin} with the input pin each wire arrives on. */
    public List<RouteKey> getTargets(String nodeId, String pin) {
        List<RouteKey> targets = routes.get(new RouteKey(nodeId, pin));
        return targets != null ? Collections.unmodifiableList(targets) : List.of();
    }

    /** Execution output pins of {@code nodeId} that have at least one wire, in wire order. */
    public List<String> routedPins(String nodeId) {
        return routes.keySet().stream()
                .filter(key -> key.nodeId().equals(nodeId))
                .map(RouteKey::pin)
                .toList();
    }

    public int size() {
        return routes.size();
    }
}
