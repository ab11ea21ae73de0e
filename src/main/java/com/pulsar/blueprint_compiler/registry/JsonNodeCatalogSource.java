package com.pulsar.blueprint_compiler.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulsar.blueprint_compiler.model.metadata.NodeMetadata;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads node catalogs shaped as {@code { "nodes": [ {...}, ... ] }} from Spring resource locations.
 */
@Slf4j
public class JsonNodeCatalogSource implements NodeCatalogSource {

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final List<String> locations;

    public JsonNodeCatalogSource(ResourceLoader resourceLoader, ObjectMapper objectMapper, List<String> locations) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.locations = List.copyOf(locations);
    }

    @Override
    public List<NodeMetadata> loadNodes() {
        List<NodeMetadata> nodes = new ArrayList<>();
        for (String location : locations) {
            Resource resource = resourceLoader.getResource(location);
            if (!resource.exists()) {
                throw new IllegalStateException("Node catalog not found: " + location);
            }
            try (InputStream in = resource.getInputStream()) {
                CatalogDocument document = objectMapper.readValue(in, CatalogDocument.class);
                List<NodeMetadata> loaded = document.nodes() != null ? document.nodes() : List.of();
                log.info("[REGISTRY] Read {} node definitions from {}", loaded.size(), location);
                nodes.addAll(loaded);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read node catalog " + location + ": " + e.getMessage(), e);
            }
        }
        return nodes;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CatalogDocument(List<NodeMetadata> nodes) {
    }
}
