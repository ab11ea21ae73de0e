package com.pulsar.blueprint_compiler.model.metadata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.pulsar.blueprint_compiler.model.graph.NodeInstance;
import com.pulsar.blueprint_compiler.model.graph.PinType;
import com.pulsar.blueprint_compiler.model.graph.Position;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Catalog entry for one node type.
 *
 * {@code source} is the full function text for CONTROL_FLOW nodes, e.g.
 * <pre>
 * fn branch(condition: bool) {
 *     if condition {
 *         exec_output!("True");
 *     } else {
 *         exec_output!("False");
 *     }
 * }
 * </pre>
 * PURE and FUNCTION nodes are emitted as calls to {@link #callableName()}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NodeMetadata {

    public static final String RESULT_PIN = "result";

    private String name;
    private NodeKind kind;

    @Builder.Default
    private List<NodeParameter> params = new ArrayList<>();

    // null means the node returns nothing
    private String returnType;

    @Builder.Default
    private List<String> execInputs = new ArrayList<>();

    @Builder.Default
    private List<String> execOutputs = new ArrayList<>();

    private String source;

    // Defaults to name when absent
    private String callable;

    private String category;

    private String color;

    @Builder.Default
    private List<String> documentation = new ArrayList<>();

    @Builder.Default
    private List<NodeImport> imports = new ArrayList<>();

    public String callableName() {
        return callable != null && !callable.isBlank() ? callable : name;
    }

    public boolean hasReturnValue() {
        return returnType != null && !returnType.isBlank() && !"()".equals(returnType.trim());
    }

    public Optional<NodeParameter> findParam(String paramName) {
        return params.stream().filter(p -> p.name().equals(paramName)).findFirst();
    }

    /** A node of this type with the pins the editor would create for it. */
    public NodeInstance instantiate(String nodeId, Position position) {
        NodeInstance node = new NodeInstance(nodeId, name, position);
        execInputs.forEach(pin -> node.addInput(pin, PinType.execution()));
        params.forEach(param -> node.addInput(param.name(), PinType.fromString(param.type())));
        execOutputs.forEach(pin -> node.addOutput(pin, PinType.execution()));
        if (hasReturnValue()) {
            node.addOutput(RESULT_PIN, PinType.fromString(returnType));
        }
        return node;
    }
}
