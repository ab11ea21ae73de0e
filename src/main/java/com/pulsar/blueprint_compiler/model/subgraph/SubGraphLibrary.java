package com.pulsar.blueprint_compiler.model.subgraph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SubGraphLibrary {

    private String id;
    private String name;
    private String category = "";
    private List<SubGraphDefinition> subgraphs = new ArrayList<>();

    public SubGraphLibrary(String id, String name, String category) {
        this.id = id;
        this.name = name;
        this.category = category;
    }

    public SubGraphLibrary addSubgraph(SubGraphDefinition definition) {
        subgraphs.add(definition);
        return this;
    }
}
