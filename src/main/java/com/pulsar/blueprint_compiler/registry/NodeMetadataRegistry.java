package com.pulsar.blueprint_compiler.registry;

import com.pulsar.blueprint_compiler.exception.CompilationException;
import com.pulsar.blueprint_compiler.model.metadata.NodeMetadata;
import com.pulsar.blueprint_compiler.model.metadata.NodeParameter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Process-wide node catalog. Built lazily on first access and read-only afterwards, so
 * concurrent compilations share it without locking once it is published.
 */
@Slf4j
@Component
public class NodeMetadataRegistry {

    private final NodeCatalogSource source;

    private volatile Map<String, NodeMetadata> nodes;

    public NodeMetadataRegistry(NodeCatalogSource source) {
        this.source = source;
    }

    public Optional<NodeMetadata> find(String nodeType) {
        return Optional.ofNullable(nodes().get(nodeType));
    }

    /** Metadata for {@code nodeType}, or UNKNOWN_NODE_TYPE naming the node that referenced it. */
    public NodeMetadata require(String nodeId, String nodeType) {
        NodeMetadata metadata = nodes().get(nodeType);
        if (metadata == null) {
            throw CompilationException.unknownNodeType(nodeId, nodeType);
        }
        return metadata;
    }

    public boolean contains(String nodeType) {
        return nodes().containsKey(nodeType);
    }

    public Collection<NodeMetadata> all() {
        return nodes().values();
    }

    public int size() {
        return nodes().size();
    }

    /** Distinct parameter and return types used across the catalog, sorted. */
    public Set<String> listTypes() {
        Set<String> types = new TreeSet<>();
        for (NodeMetadata metadata : nodes().values()) {
            metadata.getParams().stream().map(NodeParameter::type).forEach(types::add);
            if (metadata.hasReturnValue()) types.add(metadata.getReturnType());
        }
        return types;
    }

    private Map<String, NodeMetadata> nodes() {
        Map<String, NodeMetadata> current = nodes;
        if (current == null) {
            synchronized (this) {
                current = nodes;
                if (current == null) {
                    current = build();
                    nodes = current;
                }
            }
        }
        return current;
    }

    private Map<String, NodeMetadata> build() {
        Map<String, NodeMetadata> byName = new LinkedHashMap<>();
        for (NodeMetadata metadata : source.loadNodes()) {
            if (metadata.getName() == null || metadata.getName().isBlank() || metadata.getKind() == null) {
                throw new IllegalStateException("Node catalog entry is missing a name or kind: " + metadata);
            }
            if (byName.putIfAbsent(metadata.getName(), metadata) != null) {
                log.warn("[REGISTRY] Duplicate node definition '{}' ignored; keeping the first one", metadata.getName());
            }
        }
        log.info("[REGISTRY] Loaded {} node definitions", byName.size());
        return Collections.unmodifiableMap(byName);
    }
}
