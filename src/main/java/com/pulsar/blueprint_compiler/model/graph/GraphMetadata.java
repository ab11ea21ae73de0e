package com.pulsar.blueprint_compiler.model.graph;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GraphMetadata {
    private String name = "";
    private String description = "";
    private String version = "0.1.0";

    public GraphMetadata copy() {
        return new GraphMetadata(name, description, version);
    }
}
