package com.pulsar.blueprint_compiler.library;

import com.pulsar.blueprint_compiler.config.BlueprintCompilerProperties;
import com.pulsar.blueprint_compiler.exception.CompilationException;
import com.pulsar.blueprint_compiler.model.graph.Connection;
import com.pulsar.blueprint_compiler.model.graph.GraphDescription;
import com.pulsar.blueprint_compiler.model.graph.NodeInstance;
import com.pulsar.blueprint_compiler.model.graph.PassthroughNodeTypes;
import com.pulsar.blueprint_compiler.model.subgraph.SubGraphDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flattens macro/subgraph instance nodes into the graph that contains them.
 *
 * Each pass inlines every instance currently in the graph; instances brought in by that pass
 * are handled by the next one, until none remain or the depth limit is hit.
 *
 * Given an instance {@code m1} of a definition whose interior holds {@code macro_entry → add → macro_exit}:
 * <pre>
 *   before:  a ──▶ m1 ──▶ b
 *   after:   a ──▶ m1_macro_entry ──▶ m1_add ──▶ m1_macro_exit ──▶ b
 * </pre>
 */
@Slf4j
@Component
public class SubGraphExpander {

    private final LibraryManager libraryManager;
    private final int maxDepth;

    @Autowired
    public SubGraphExpander(LibraryManager libraryManager, BlueprintCompilerProperties properties) {
        this(libraryManager, properties.getMaxExpansionDepth());
    }

    public SubGraphExpander(LibraryManager libraryManager, int maxDepth) {
        this.libraryManager = libraryManager;
        this.maxDepth = maxDepth;
    }

    public void expandAll(GraphDescription graph) {
        expandAll(graph, maxDepth);
    }

    /** Expands in place. Fails before touching the graph if a referenced definition is missing or circular. */
    public void expandAll(GraphDescription graph, int depthLimit) {
        for (NodeInstance node : graph.getNodeList()) {
            if (node.isSubgraphInstance()) {
                validateNoCircularRefs(libraryManager.require(node.referencedDefinitionId()));
            }
        }
        expandRecursive(graph, 0, depthLimit);
    }

    private void expandRecursive(GraphDescription graph, int depth, int depthLimit) {
        if (depth > depthLimit) {
            throw CompilationException.depthExceeded(depthLimit);
        }

        List<NodeInstance> instances = graph.getNodeList().stream()
                .filter(NodeInstance::isSubgraphInstance)
                .toList();
        if (instances.isEmpty()) return;

        log.info("[EXPANDER] Expanding {} instance(s) at depth {}", instances.size(), depth);
        for (NodeInstance instance : instances) {
            expandInstance(graph, instance, libraryManager.require(instance.referencedDefinitionId()));
        }

        expandRecursive(graph, depth + 1, depthLimit);
    }

    // ── Single instance ───────────────────────────────────────────────────────

    private void expandInstance(GraphDescription graph, NodeInstance instance, SubGraphDefinition definition) {
        String instanceId = instance.getId();
        GraphDescription interior = definition.getGraph();
        String prefix = uniquePrefix(graph, instanceId, interior);

        // 1. Interior nodes under the instance prefix, positioned relative to the instance
        Map<String, String> idMapping = new HashMap<>();
        for (NodeInstance node : interior.getNodeList()) {
            String newId = prefix + node.getId();
            idMapping.put(node.getId(), newId);
            graph.addNode(node.copyAs(newId, node.getPosition().translate(instance.getPosition())));
        }

        String entryId = idMapping.get(findInterfaceNode(interior, true));
        String exitId  = idMapping.get(findInterfaceNode(interior, false));

        // Literals typed on the instance become literals on the entry node's matching inputs
        if (entryId != null) {
            graph.getNode(entryId).ifPresent(entry -> instance.getProperties().forEach(entry::setProperty));
        }

        // 2. Boundary connections rewritten in place so fan-out order is preserved
        List<Connection> connections = graph.getConnections();
        for (int i = 0; i < connections.size(); i++) {
            Connection conn = connections.get(i);
            if (!conn.touches(instanceId)) continue;

            Connection rewired = conn.copy();
            if (instanceId.equals(conn.getTargetNode())) {
                rewired.setId(conn.getId() + "_to_input");
                rewired.setTargetNode(entryId);
            }
            if (instanceId.equals(conn.getSourceNode())) {
                rewired.setId(conn.getId() + "_from_output");
                rewired.setSourceNode(exitId);
            }
            if (rewired.getSourceNode() == null || rewired.getTargetNode() == null) {
                log.warn("[EXPANDER] Definition '{}' has no interface node for pin; dropping connection {}",
                        definition.getId(), conn.getId());
                continue;
            }
            graph.replaceConnection(i, rewired);
        }

        // 3. Interior connections with remapped endpoints
        for (Connection conn : interior.getConnections()) {
            String source = idMapping.get(conn.getSourceNode());
            String target = idMapping.get(conn.getTargetNode());
            if (source == null || target == null) {
                throw CompilationException.invalidConnection(conn.getId(), conn.getTargetNode(), conn.getTargetPin(),
                        "endpoint not found inside subgraph definition '" + definition.getId() + "'");
            }
            Connection copy = conn.copy();
            copy.setId(prefix + conn.getId());
            copy.setSourceNode(source);
            copy.setTargetNode(target);
            graph.addConnection(copy);
        }

        // 4. The instance goes, along with any boundary wire that could not be rewired
        graph.removeNode(instanceId);

        log.debug("[EXPANDER] Inlined '{}' as {} ({} nodes)", definition.getId(), instanceId, interior.getNodeCount());
    }

    private static String uniquePrefix(GraphDescription graph, String instanceId, GraphDescription interior) {
        String prefix = instanceId + "_";
        while (collides(graph, prefix, interior)) {
            prefix = prefix + "_";
        }
        return prefix;
    }

    private static boolean collides(GraphDescription graph, String prefix, GraphDescription interior) {
        return interior.getNodeList().stream().anyMatch(n -> graph.containsNode(prefix + n.getId()));
    }

    // Prefer the conventional ids, then fall back to any node of the right pass-through type
    private static String findInterfaceNode(GraphDescription interior, boolean entry) {
        String preferred = entry ? PassthroughNodeTypes.MACRO_ENTRY : PassthroughNodeTypes.MACRO_EXIT;
        String legacy    = entry ? PassthroughNodeTypes.SUBGRAPH_INPUT : PassthroughNodeTypes.SUBGRAPH_OUTPUT;
        if (interior.containsNode(preferred)) return preferred;
        if (interior.containsNode(legacy)) return legacy;
        return interior.getNodeList().stream()
                .filter(n -> entry ? PassthroughNodeTypes.isEntry(n.getNodeType()) : PassthroughNodeTypes.isExit(n.getNodeType()))
                .map(NodeInstance::getId)
                .findFirst()
                .orElse(null);
    }

    // ── Circular references ───────────────────────────────────────────────────

    public void validateNoCircularRefs(SubGraphDefinition definition) {
        checkCircularRefs(definition, new LinkedHashSet<>());
    }

    private void checkCircularRefs(SubGraphDefinition definition, Set<String> path) {
        if (!path.add(definition.getId())) {
            log.error("[EXPANDER] Circular reference: {} -> {}", String.join(" -> ", path), definition.getId());
            throw CompilationException.circularReference(definition.getId());
        }
        for (String nestedId : definition.referencedDefinitionIds()) {
            checkCircularRefs(libraryManager.require(nestedId), path);
        }
        path.remove(definition.getId());
    }
}
