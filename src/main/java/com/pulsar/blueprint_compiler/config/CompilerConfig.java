package com.pulsar.blueprint_compiler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulsar.blueprint_compiler.registry.JsonNodeCatalogSource;
import com.pulsar.blueprint_compiler.registry.NodeCatalogSource;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

@Configuration
@EnableConfigurationProperties(BlueprintCompilerProperties.class)
public class CompilerConfig {

    // Catalog documents listed in blueprint.compiler.catalog-locations
    @Bean
    public NodeCatalogSource nodeCatalogSource(ResourceLoader resourceLoader, ObjectMapper objectMapper,
                                               BlueprintCompilerProperties properties) {
        return new JsonNodeCatalogSource(resourceLoader, objectMapper, properties.getCatalogLocations());
    }
}
