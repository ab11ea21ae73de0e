package com.pulsar.blueprint_compiler.model.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One node placed in a graph. {@code nodeType} is either a catalog key ("print_string"),
 * a pass-through type ("reroute", "macro_entry", ...) or a reference to a reusable
 * graph ("macro:&lt;definition id&gt;" / "subgraph:&lt;definition id&gt;").
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NodeInstance {

    public static final String MACRO_PREFIX    = "macro:";
    public static final String SUBGRAPH_PREFIX = "subgraph:";

    private String id;
    private String nodeType;
    private Position position = Position.ORIGIN;

    // Literal values typed into the node on the canvas, keyed by input pin / parameter name
    private Map<String, Object> properties = new LinkedHashMap<>();

    private List<Pin> inputs  = new ArrayList<>();
    private List<Pin> outputs = new ArrayList<>();

    public NodeInstance(String id, String nodeType) {
        this(id, nodeType, Position.ORIGIN);
    }

    public NodeInstance(String id, String nodeType, Position position) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Node id must not be blank");
        }
        this.id = id;
        this.nodeType = nodeType;
        this.position = position;
    }

    // ── Pins ──────────────────────────────────────────────────────────────────

    public void setInputs(List<Pin> inputs) {
        this.inputs = new ArrayList<>();
        if (inputs != null) inputs.forEach(this::addInput);
    }

    public void setOutputs(List<Pin> outputs) {
        this.outputs = new ArrayList<>();
        if (outputs != null) outputs.forEach(this::addOutput);
    }

    public NodeInstance addInput(Pin pin) {
        pin.setDirection(PinDirection.INPUT);
        inputs.add(pin);
        return this;
    }

    public NodeInstance addOutput(Pin pin) {
        pin.setDirection(PinDirection.OUTPUT);
        outputs.add(pin);
        return this;
    }

    public NodeInstance addInput(String name, PinType type) {
        return addInput(Pin.input(name, type));
    }

    public NodeInstance addOutput(String name, PinType type) {
        return addOutput(Pin.output(name, type));
    }

    public Optional<Pin> findInput(String name) {
        return inputs.stream().filter(p -> p.getName().equals(name)).findFirst();
    }

    public Optional<Pin> findOutput(String name) {
        return outputs.stream().filter(p -> p.getName().equals(name)).findFirst();
    }

    /** Position of a data output among this node's data outputs, or -1. */
    public int dataOutputIndex(String name) {
        int index = 0;
        for (Pin pin : outputs) {
            if (pin.isExecution()) continue;
            if (pin.getName().equals(name)) return index;
            index++;
        }
        return -1;
    }

    public long dataOutputCount() {
        return outputs.stream().filter(p -> !p.isExecution()).count();
    }

    // ── Properties ────────────────────────────────────────────────────────────

    public NodeInstance setProperty(String name, Object value) {
        properties.put(name, value);
        return this;
    }

    public void setProperties(Map<String, Object> properties) {
        this.properties = properties != null ? new LinkedHashMap<>(properties) : new LinkedHashMap<>();
    }

    // ── Reusable graph references ─────────────────────────────────────────────

    @JsonIgnore
    public boolean isSubgraphInstance() {
        return nodeType != null && (nodeType.startsWith(MACRO_PREFIX) || nodeType.startsWith(SUBGRAPH_PREFIX));
    }

    public String referencedDefinitionId() {
        if (nodeType == null) return null;
        if (nodeType.startsWith(MACRO_PREFIX))    return nodeType.substring(MACRO_PREFIX.length());
        if (nodeType.startsWith(SUBGRAPH_PREFIX)) return nodeType.substring(SUBGRAPH_PREFIX.length());
        return null;
    }

    public NodeInstance copyAs(String newId, Position newPosition) {
        NodeInstance copy = new NodeInstance(newId, nodeType, newPosition);
        copy.setProperties(properties);
        inputs.forEach(p -> copy.addInput(p.copy()));
        outputs.forEach(p -> copy.addOutput(p.copy()));
        return copy;
    }

    public NodeInstance copy() {
        return copyAs(id, position);
    }
}
