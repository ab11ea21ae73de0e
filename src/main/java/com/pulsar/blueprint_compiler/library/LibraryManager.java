package com.pulsar.blueprint_compiler.library;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulsar.blueprint_compiler.config.BlueprintCompilerProperties;
import com.pulsar.blueprint_compiler.exception.CompilationException;
import com.pulsar.blueprint_compiler.model.subgraph.SubGraphDefinition;
import com.pulsar.blueprint_compiler.model.subgraph.SubGraphLibrary;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of reusable graph definitions, keyed by definition id across all libraries.
 */
@Slf4j
@Component
public class LibraryManager {

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final List<String> libraryLocations;

    private final Map<String, SubGraphLibrary> libraries = new ConcurrentHashMap<>();
    private final Map<String, SubGraphDefinition> definitions = new ConcurrentHashMap<>();

    @Autowired
    public LibraryManager(BlueprintCompilerProperties properties, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.libraryLocations = List.copyOf(properties.getLibraryLocations());
    }

    /** Standalone manager with nothing preloaded. */
    public LibraryManager() {
        this.resourceLoader = new DefaultResourceLoader();
        this.objectMapper = new ObjectMapper();
        this.libraryLocations = List.of();
    }

    @PostConstruct
    public void loadConfiguredLibraries() {
        libraryLocations.forEach(this::loadLibrary);
    }

    // ── Registration ──────────────────────────────────────────────────────────

    public void registerLibrary(SubGraphLibrary library) {
        libraries.put(library.getId(), library);
        library.getSubgraphs().forEach(this::registerDefinition);
        log.info("[LIBRARY] Registered library '{}' with {} definitions", library.getId(), library.getSubgraphs().size());
    }

    public void registerDefinition(SubGraphDefinition definition) {
        definition.syncInterfaceNodes();
        if (definitions.put(definition.getId(), definition) != null) {
            log.warn("[LIBRARY] Definition '{}' replaced by a newer registration", definition.getId());
        }
    }

    public SubGraphLibrary loadLibrary(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("[LIBRARY] Library not found, skipping: {}", location);
            return null;
        }
        try (InputStream in = resource.getInputStream()) {
            SubGraphLibrary library = objectMapper.readValue(in, SubGraphLibrary.class);
            registerLibrary(library);
            return library;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read subgraph library " + location + ": " + e.getMessage(), e);
        }
    }

    // ── Lookup ────────────────────────────────────────────────────────────────

    public Optional<SubGraphDefinition> find(String definitionId) {
        return Optional.ofNullable(definitions.get(definitionId));
    }

    public SubGraphDefinition require(String definitionId) {
        SubGraphDefinition definition = definitions.get(definitionId);
        if (definition == null) {
            throw CompilationException.subgraphNotFound(definitionId);
        }
        return definition;
    }

    public Collection<SubGraphLibrary> allLibraries() {
        return Collections.unmodifiableCollection(libraries.values());
    }

    public int definitionCount() {
        return definitions.size();
    }
}
