package com.pulsar.blueprint_compiler.model.subgraph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.pulsar.blueprint_compiler.model.graph.GraphDescription;
import com.pulsar.blueprint_compiler.model.graph.NodeInstance;
import com.pulsar.blueprint_compiler.model.graph.Pin;
import com.pulsar.blueprint_compiler.model.graph.PassthroughNodeTypes;
import com.pulsar.blueprint_compiler.model.graph.Position;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A reusable graph (macro) with a declared pin interface.
 *
 * Inside, the interface is represented by two pass-through nodes: {@code macro_entry}, whose
 * outputs feed the interior from the instance's inputs, and {@code macro_exit}, whose inputs
 * feed the instance's outputs. Both carry every interface pin in both directions so the
 * expander can rewire outside connections pin-for-pin.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SubGraphDefinition {

    private String id;
    private String name;
    private String description = "";
    private GraphDescription graph = new GraphDescription();
    private List<InterfacePin> inputs = new ArrayList<>();
    private List<InterfacePin> outputs = new ArrayList<>();

    public SubGraphDefinition(String id, String name) {
        this.id = id;
        this.name = name;
        this.graph = new GraphDescription(name);
    }

    public SubGraphDefinition addInputPin(String pinName, String type) {
        inputs.add(InterfacePin.of(pinName, type));
        return this;
    }

    public SubGraphDefinition addOutputPin(String pinName, String type) {
        outputs.add(InterfacePin.of(pinName, type));
        return this;
    }

    /** Creates or completes the interior entry/exit nodes so they expose every interface pin. */
    public void syncInterfaceNodes() {
        NodeInstance entry = interfaceNode(PassthroughNodeTypes.MACRO_ENTRY);
        NodeInstance exit  = interfaceNode(PassthroughNodeTypes.MACRO_EXIT);
        inputs.forEach(pin -> exposeBothWays(entry, pin));
        outputs.forEach(pin -> exposeBothWays(exit, pin));
    }

    /** A {@code macro:<id>} node exposing this definition's interface. */
    public NodeInstance createInstance(String instanceId, Position position) {
        NodeInstance instance = new NodeInstance(instanceId, NodeInstance.MACRO_PREFIX + id, position);
        inputs.forEach(pin -> instance.addInput(pin.name(), pin.type()));
        outputs.forEach(pin -> instance.addOutput(pin.name(), pin.type()));
        return instance;
    }

    /** Definition ids referenced by instance nodes directly inside this definition. */
    public List<String> referencedDefinitionIds() {
        return graph.getNodeList().stream()
                .filter(NodeInstance::isSubgraphInstance)
                .map(NodeInstance::referencedDefinitionId)
                .toList();
    }

    private NodeInstance interfaceNode(String type) {
        Optional<NodeInstance> existing = graph.getNode(type);
        if (existing.isPresent()) return existing.get();
        NodeInstance node = new NodeInstance(type, type);
        graph.addNode(node);
        return node;
    }

    private static void exposeBothWays(NodeInstance node, InterfacePin pin) {
        if (node.findInput(pin.name()).isEmpty())  node.addInput(Pin.input(pin.name(), pin.type()));
        if (node.findOutput(pin.name()).isEmpty()) node.addOutput(Pin.output(pin.name(), pin.type()));
    }
}
