package com.pulsar.blueprint_compiler.config;

import com.pulsar.blueprint_compiler.library.LibraryManager;
import com.pulsar.blueprint_compiler.registry.NodeMetadataRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Logs at startup what the compiler can build with. Touching the registry here also
 * builds it, so a broken catalog fails the application start rather than the first compile.
 */
@Slf4j
@Component
public class CatalogStartupLogger implements ApplicationRunner {

    private final NodeMetadataRegistry metadataRegistry;
    private final LibraryManager libraryManager;
    private final BlueprintCompilerProperties properties;

    public CatalogStartupLogger(NodeMetadataRegistry metadataRegistry, LibraryManager libraryManager,
                                BlueprintCompilerProperties properties) {
        this.metadataRegistry = metadataRegistry;
        this.libraryManager = libraryManager;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        int nodes = metadataRegistry.size();
        if (nodes == 0) {
            log.warn("[REGISTRY] Node catalog is empty; every compilation will fail. Locations: {}",
                    properties.getCatalogLocations());
        } else {
            log.info("[REGISTRY] {} node definitions available ({} distinct pin types)",
                    nodes, metadataRegistry.listTypes().size());
        }
        log.info("[LIBRARY] {} subgraph definitions available from {} libraries",
                libraryManager.definitionCount(), libraryManager.allLibraries().size());
        log.info("[COMPILER] Pure node strategy {}, max expansion depth {}, connection validation {}",
                properties.getPureNodeStrategy(), properties.getMaxExpansionDepth(),
                properties.isValidateConnections() ? "on" : "off");
    }
}
