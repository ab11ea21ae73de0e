package com.pulsar.blueprint_compiler.model.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Connection {
    private String id;

    private String sourceNode;
    private String sourcePin;

    private String targetNode;
    private String targetPin;

    private ConnectionKind kind;

    public static Connection execution(String id, String sourceNode, String sourcePin,
                                       String targetNode, String targetPin) {
        return new Connection(id, sourceNode, sourcePin, targetNode, targetPin, ConnectionKind.EXECUTION);
    }

    public static Connection data(String id, String sourceNode, String sourcePin,
                                  String targetNode, String targetPin) {
        return new Connection(id, sourceNode, sourcePin, targetNode, targetPin, ConnectionKind.DATA);
    }

    @JsonIgnore
    public boolean isExecution() {
        return kind == ConnectionKind.EXECUTION;
    }

    public boolean touches(String nodeId) {
        return nodeId.equals(sourceNode) || nodeId.equals(targetNode);
    }

    public Connection copy() {
        return toBuilder().build();
    }
}
