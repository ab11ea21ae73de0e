package com.pulsar.blueprint_compiler.model.graph;

import com.fasterxml.jackson.annotation.JsonGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSetter;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A Blueprint graph as handed over by the editor.
 *
 * Nodes keep insertion order so that generated output is deterministic; connections keep
 * wire order, which is the order execution fan-out is emitted in.
 * Serialized as {@code { "metadata": {...}, "nodes": [...], "connections": [...] }}.
 */
public class GraphDescription {

    private final Map<String, NodeInstance> nodes = new LinkedHashMap<>();
    private final List<Connection> connections = new ArrayList<>();

    @Getter
    @Setter
    private GraphMetadata metadata = new GraphMetadata();

    public GraphDescription() {
    }

    public GraphDescription(String name) {
        this.metadata.setName(name);
    }

    // ── Nodes ─────────────────────────────────────────────────────────────────

    public void addNode(NodeInstance node) {
        if (nodes.containsKey(node.getId())) {
            throw new IllegalArgumentException("Duplicate node id: " + node.getId());
        }
        nodes.put(node.getId(), node);
    }

    /** Removes the node together with every connection attached to it. */
    public Optional<NodeInstance> removeNode(String nodeId) {
        NodeInstance removed = nodes.remove(nodeId);
        if (removed != null) {
            connections.removeIf(c -> c.touches(nodeId));
        }
        return Optional.ofNullable(removed);
    }

    public Optional<NodeInstance> getNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public boolean containsNode(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    @JsonIgnore
    public Collection<NodeInstance> getNodeList() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    @JsonIgnore
    public int getNodeCount() {
        return nodes.size();
    }

    @JsonGetter("nodes")
    List<NodeInstance> nodesForJson() {
        return new ArrayList<>(nodes.values());
    }

    @JsonSetter("nodes")
    void nodesFromJson(List<NodeInstance> list) {
        nodes.clear();
        if (list != null) list.forEach(this::addNode);
    }

    // ── Connections ───────────────────────────────────────────────────────────

    public void addConnection(Connection connection) {
        connections.add(connection);
    }

    /** Replaces the connection at {@code index}, keeping its place in wire order. */
    public void replaceConnection(int index, Connection replacement) {
        connections.set(index, replacement);
    }

    public boolean removeConnection(String connectionId) {
        return connections.removeIf(c -> c.getId().equals(connectionId));
    }

    @JsonGetter("connections")
    public List<Connection> getConnections() {
        return Collections.unmodifiableList(connections);
    }

    @JsonSetter("connections")
    void connectionsFromJson(List<Connection> list) {
        connections.clear();
        if (list != null) connections.addAll(list);
    }

    // ── Copy ──────────────────────────────────────────────────────────────────

    public GraphDescription deepCopy() {
        GraphDescription copy = new GraphDescription();
        copy.setMetadata(metadata.copy());
        nodes.values().forEach(n -> copy.addNode(n.copy()));
        connections.forEach(c -> copy.addConnection(c.copy()));
        return copy;
    }

    /** Structural equality over node ids, node types and connection endpoints. */
    public boolean sameStructureAs(GraphDescription other) {
        if (!nodes.keySet().equals(other.nodes.keySet())) return false;
        for (NodeInstance node : nodes.values()) {
            if (!node.getNodeType().equals(other.nodes.get(node.getId()).getNodeType())) return false;
        }
        return connections.equals(other.connections);
    }
}
