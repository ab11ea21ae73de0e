package com.pulsar.blueprint_compiler.engine;

import com.pulsar.blueprint_compiler.exception.CompilationException;
import com.pulsar.blueprint_compiler.model.graph.Connection;
import com.pulsar.blueprint_compiler.model.graph.GraphDescription;
import com.pulsar.blueprint_compiler.model.graph.NodeInstance;
import com.pulsar.blueprint_compiler.model.graph.PassthroughNodeTypes;
import com.pulsar.blueprint_compiler.model.graph.Pin;
import com.pulsar.blueprint_compiler.model.metadata.NodeKind;
import com.pulsar.blueprint_compiler.model.metadata.NodeMetadata;
import com.pulsar.blueprint_compiler.types.TypeSystem;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns data wiring into expression text.
 *
 * Every data input resolves to one of:
 * <ul>
 *   <li>a literal: node property, else pin default, else the type's default value</li>
 *   <li>a Pure node call, inlined as {@code add(a, b)} or read from a shared temporary</li>
 *   <li>the result temporary of a Function node generated earlier on the same execution path</li>
 * </ul>
 * Pass-through nodes (reroutes, macro entry/exit) are looked through.
 */
@Slf4j
public final class DataResolver {

    private record PinKey(String nodeId, String pin) {
    }

    private final GraphDescription graph;
    private final Map<String, NodeMetadata> metadataByNode;

    // Data connection feeding each input pin; at most one per pin
    private final Map<PinKey, Connection> dataInputs;
    private final Map<String, List<Connection>> dataInputsByNode;

    private final List<String> pureEvaluationOrder;
    private final Set<String> sharedPureNodes;

    private DataResolver(GraphDescription graph, Map<String, NodeMetadata> metadataByNode,
                         Map<PinKey, Connection> dataInputs, Map<String, List<Connection>> dataInputsByNode) {
        this.graph = graph;
        this.metadataByNode = metadataByNode;
        this.dataInputs = dataInputs;
        this.dataInputsByNode = dataInputsByNode;
        this.pureEvaluationOrder = new ArrayList<>();
        this.sharedPureNodes = new LinkedHashSet<>();
    }

    /**
     * @param metadataByNode catalog entry per node id; pass-through nodes have none
     */
    public static DataResolver build(GraphDescription graph, Map<String, NodeMetadata> metadataByNode,
                                     PureNodeStrategy strategy) {
        Map<PinKey, Connection> dataInputs = new HashMap<>();
        Map<String, List<Connection>> byNode = new HashMap<>();
        for (Connection conn : graph.getConnections()) {
            if (conn.isExecution()) continue;
            PinKey key = new PinKey(conn.getTargetNode(), conn.getTargetPin());
            if (dataInputs.putIfAbsent(key, conn) != null) {
                log.error("[DATA_RESOLVER] Input {}.{} is fed by more than one connection",
                        conn.getTargetNode(), conn.getTargetPin());
                throw CompilationException.multipleDataSources(conn.getTargetNode(), conn.getTargetPin());
            }
            byNode.computeIfAbsent(conn.getTargetNode(), k -> new ArrayList<>()).add(conn);
        }

        DataResolver resolver = new DataResolver(graph, metadataByNode, dataInputs, byNode);
        resolver.orderPureNodes();
        if (strategy == PureNodeStrategy.SHARED_TEMPORARIES) {
            resolver.selectSharedPureNodes();
        }
        log.info("[DATA_RESOLVER] {} data inputs wired, pure order {}, shared {}",
                dataInputs.size(), resolver.pureEvaluationOrder, resolver.sharedPureNodes);
        return resolver;
    }

    public static String resultVariable(String nodeId) {
        return "node_" + sanitizeVarName(nodeId) + "_result";
    }

    public static String sanitizeVarName(String name) {
        StringBuilder out = new StringBuilder(name.length());
        for (char c : name.toCharArray()) {
            out.append(Character.isLetterOrDigit(c) || c == '_' ? c : '_');
        }
        return out.toString();
    }

    public List<String> getPureEvaluationOrder() {
        return Collections.unmodifiableList(pureEvaluationOrder);
    }

    public boolean isShared(String nodeId) {
        return sharedPureNodes.contains(nodeId);
    }

    // ── Expressions ───────────────────────────────────────────────────────────

    /** Expression for input {@code pinName} of {@code nodeId}; {@code declaredType} is used for defaults. */
    public String inputExpression(String nodeId, String pinName, String declaredType, TraversalState state) {
        String expression = inputExpression(nodeId, pinName, declaredType, state, new HashSet<>());
        log.debug("[DATA_RESOLVER] {}.{} = {}", nodeId, pinName, expression);
        return expression;
    }

    /**
     * {@code let} lines for the shared Pure temporaries read while generating an event function,
     * in Pure evaluation order. Temporaries their arguments read are included too.
     */
    public List<String> sharedTemporaryBindings(TraversalState state) {
        Map<String, String> calls = new HashMap<>();
        boolean grew = true;
        while (grew) {
            grew = false;
            for (String nodeId : List.copyOf(state.sharedTemporaries())) {
                if (calls.containsKey(nodeId)) continue;
                NodeInstance node = requireNode(nodeId);
                Set<String> resolving = new HashSet<>(Set.of(nodeId));
                calls.put(nodeId, callExpression(node, metadataByNode.get(nodeId), state, resolving));
                grew = true;
            }
        }
        return pureEvaluationOrder.stream()
                .filter(calls::containsKey)
                .map(id -> "let " + resultVariable(id) + " = " + calls.get(id) + ";")
                .toList();
    }

    private String inputExpression(String nodeId, String pinName, String declaredType,
                                   TraversalState state, Set<String> resolving) {
        Connection conn = dataInputs.get(new PinKey(nodeId, pinName));
        if (conn != null) {
            return sourceExpression(conn, state, nodeId, pinName, resolving);
        }
        return literal(nodeId, pinName, declaredType);
    }

    private String sourceExpression(Connection conn, TraversalState state,
                                    String consumerNode, String consumerPin, Set<String> resolving) {
        NodeInstance source = requireNode(conn.getSourceNode());
        String sourceId = source.getId();

        if (PassthroughNodeTypes.isPassthrough(source.getNodeType())) {
            enter(resolving, sourceId);
            String value = upstreamOfPassthrough(source, conn.getSourcePin())
                    .map(up -> sourceExpression(up, state, consumerNode, consumerPin, resolving))
                    .orElseGet(() -> literal(sourceId, passthroughInputPin(source, conn.getSourcePin()), null));
            resolving.remove(sourceId);
            return value;
        }

        NodeMetadata meta = metadataByNode.get(sourceId);
        if (meta == null) {
            throw CompilationException.missingResultVariable(sourceId);
        }

        String value;
        if (meta.getKind() == NodeKind.PURE) {
            if (sharedPureNodes.contains(sourceId)) {
                state.useSharedTemporary(sourceId);
                value = resultVariable(sourceId);
            } else {
                enter(resolving, sourceId);
                value = callExpression(source, meta, state, resolving);
                resolving.remove(sourceId);
            }
        } else {
            if (meta.getKind() == NodeKind.FUNCTION && !meta.hasReturnValue()) {
                throw CompilationException.missingResultVariable(sourceId);
            }
            value = state.result(sourceId)
                    .orElseThrow(() -> CompilationException.unresolvedDataDependency(consumerNode, consumerPin));
        }
        return withOutputIndex(source, conn.getSourcePin(), value);
    }

    private String callExpression(NodeInstance node, NodeMetadata meta, TraversalState state, Set<String> resolving) {
        String args = meta.getParams().stream()
                .map(p -> inputExpression(node.getId(), p.name(), p.type(), state, resolving))
                .collect(Collectors.joining(", "));
        return meta.callableName() + "(" + args + ")";
    }

    private static void enter(Set<String> resolving, String nodeId) {
        if (!resolving.add(nodeId)) {
            throw CompilationException.cyclicPureDependency(nodeId);
        }
    }

    // Producers with several data outputs return a tuple
    private static String withOutputIndex(NodeInstance source, String pin, String value) {
        int index = source.dataOutputIndex(pin);
        if (source.dataOutputCount() > 1 && index >= 0) {
            return value + "." + index;
        }
        return value;
    }

    // ── Literals ──────────────────────────────────────────────────────────────

    private String literal(String nodeId, String pinName, String declaredType) {
        NodeInstance node = requireNode(nodeId);
        Object property = node.getProperties().get(pinName);
        if (property != null) {
            return LiteralFormatter.format(property);
        }
        Optional<Pin> pin = node.findInput(pinName);
        if (pin.isPresent() && pin.get().getDefaultValue() != null) {
            return LiteralFormatter.format(pin.get().getDefaultValue());
        }
        if (pin.isPresent() && pin.get().getType() != null && !pin.get().getType().isWildcard()) {
            if (pin.get().isExecution()) return "()";
            return TypeSystem.defaultValue(pin.get().getType().typeInfo());
        }
        if (declaredType != null && !declaredType.isBlank()) {
            return TypeSystem.defaultValue(TypeSystem.parse(declaredType));
        }
        return "Default::default()";
    }

    // ── Pass-through nodes ────────────────────────────────────────────────────

    private Optional<Connection> upstreamOfPassthrough(NodeInstance node, String outputPin) {
        if (PassthroughNodeTypes.REROUTE.equals(node.getNodeType())) {
            // A reroute forwards whatever its (single) data input receives
            return dataInputsByNode.getOrDefault(node.getId(), List.of()).stream().findFirst();
        }
        return Optional.ofNullable(dataInputs.get(new PinKey(node.getId(), outputPin)));
    }

    private static String passthroughInputPin(NodeInstance node, String outputPin) {
        if (PassthroughNodeTypes.REROUTE.equals(node.getNodeType())) {
            return node.getInputs().stream()
                    .filter(p -> !p.isExecution())
                    .map(Pin::getName)
                    .findFirst()
                    .orElse(outputPin);
        }
        return outputPin;
    }

    /** The node whose value actually arrives through {@code conn}, looking through pass-throughs. */
    private Optional<String> producerOf(Connection conn) {
        Set<String> seen = new HashSet<>();
        Connection current = conn;
        while (true) {
            NodeInstance source = graph.getNode(current.getSourceNode()).orElse(null);
            if (source == null) return Optional.empty();
            if (!PassthroughNodeTypes.isPassthrough(source.getNodeType())) return Optional.of(source.getId());
            if (!seen.add(source.getId())) {
                throw CompilationException.cyclicPureDependency(source.getId());
            }
            Optional<Connection> upstream = upstreamOfPassthrough(source, current.getSourcePin());
            if (upstream.isEmpty()) return Optional.empty();
            current = upstream.get();
        }
    }

    // ── Pure ordering ─────────────────────────────────────────────────────────

    private boolean isPure(String nodeId) {
        NodeMetadata meta = metadataByNode.get(nodeId);
        return meta != null && meta.getKind() == NodeKind.PURE;
    }

    // Kahn's algorithm over Pure → Pure data edges, seeded in node insertion order
    private void orderPureNodes() {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (NodeInstance node : graph.getNodeList()) {
            if (isPure(node.getId())) inDegree.put(node.getId(), 0);
        }

        for (Connection conn : dataConnections()) {
            if (!isPure(conn.getTargetNode())) continue;
            Optional<String> producer = producerOf(conn);
            if (producer.isPresent() && isPure(producer.get())) {
                dependents.computeIfAbsent(producer.get(), k -> new ArrayList<>()).add(conn.getTargetNode());
                inDegree.merge(conn.getTargetNode(), 1, Integer::sum);
            }
        }

        Deque<String> ready = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) ready.add(id);
        });
        while (!ready.isEmpty()) {
            String id = ready.poll();
            pureEvaluationOrder.add(id);
            for (String dependent : dependents.getOrDefault(id, List.of())) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (pureEvaluationOrder.size() < inDegree.size()) {
            String stuck = inDegree.keySet().stream()
                    .filter(id -> !pureEvaluationOrder.contains(id))
                    .findFirst()
                    .orElseThrow();
            log.error("[DATA_RESOLVER] Cyclic dependency among pure nodes, starting at {}", stuck);
            throw CompilationException.cyclicPureDependency(stuck);
        }
    }

    // Pure nodes read by more than one wire whose inputs never depend on a side-effect result
    private void selectSharedPureNodes() {
        Map<String, Integer> consumers = new HashMap<>();
        for (Connection conn : dataConnections()) {
            NodeInstance target = graph.getNode(conn.getTargetNode()).orElse(null);
            if (target == null || PassthroughNodeTypes.isPassthrough(target.getNodeType())) continue;
            producerOf(conn).filter(this::isPure).ifPresent(id -> consumers.merge(id, 1, Integer::sum));
        }

        Set<String> sideEffectFree = new HashSet<>();
        for (String id : pureEvaluationOrder) {
            boolean free = dataInputsByNode.getOrDefault(id, List.of()).stream()
                    .map(this::producerOf)
                    .allMatch(producer -> producer.isEmpty() || sideEffectFree.contains(producer.get()));
            if (free) sideEffectFree.add(id);
            if (free && consumers.getOrDefault(id, 0) > 1) sharedPureNodes.add(id);
        }
    }

    private List<Connection> dataConnections() {
        return graph.getConnections().stream().filter(c -> !c.isExecution()).toList();
    }

    private NodeInstance requireNode(String nodeId) {
        return graph.getNode(nodeId)
                .orElseThrow(() -> CompilationException.invalidConnection(null, nodeId, null, "node " + nodeId + " does not exist"));
    }
}
