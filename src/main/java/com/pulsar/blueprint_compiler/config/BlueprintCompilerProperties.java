package com.pulsar.blueprint_compiler.config;

import com.pulsar.blueprint_compiler.engine.PureNodeStrategy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "blueprint.compiler")
public class BlueprintCompilerProperties {

    public static final List<String> DEFAULT_PREAMBLE = List.of(
            "// Auto-generated code from Pulsar Blueprint",
            "// DO NOT EDIT - Changes will be overwritten",
            "",
            "use pulsar_std::*;"
    );

    private int maxExpansionDepth = 100;

    // Node catalogs, merged in order; first definition of a name wins
    private List<String> catalogLocations = new ArrayList<>(List.of("classpath:blueprint/node-catalog.json"));

    // Subgraph libraries registered at startup
    private List<String> libraryLocations = new ArrayList<>();

    private List<String> preamble = new ArrayList<>(DEFAULT_PREAMBLE);

    // Spaces per indentation level in generated code
    private int indent = 4;

    private PureNodeStrategy pureNodeStrategy = PureNodeStrategy.INLINE;

    private boolean validateConnections = true;

    public String indentUnit() {
        return " ".repeat(Math.max(indent, 0));
    }
}
