package com.pulsar.blueprint_compiler.model.graph;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GraphDescriptionTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private static GraphDescription twoNodeGraph() {
        GraphDescription graph = new GraphDescription("pair");
        graph.addNode(new NodeInstance("a", "begin_play"));
        graph.addNode(new NodeInstance("b", "print_string").setProperty("text", "hi"));
        graph.addConnection(Connection.execution("c1", "a", "Body", "b", "exec"));
        return graph;
    }

    @Test
    void shouldRejectDuplicateNodeIds() {
        GraphDescription graph = twoNodeGraph();

        assertThrows(IllegalArgumentException.class, () -> graph.addNode(new NodeInstance("a", "main")));
    }

    @Test
    void shouldRejectBlankNodeId() {
        assertThrows(IllegalArgumentException.class, () -> new NodeInstance(" ", "main"));
    }

    @Test
    void shouldDropAttachedConnectionsWhenRemovingNode() {
        GraphDescription graph = twoNodeGraph();

        assertTrue(graph.removeNode("b").isPresent());

        assertFalse(graph.containsNode("b"));
        assertTrue(graph.getConnections().isEmpty());
        assertTrue(graph.removeNode("b").isEmpty());
    }

    @Test
    void shouldRemoveConnectionById() {
        GraphDescription graph = twoNodeGraph();

        assertTrue(graph.removeConnection("c1"));
        assertFalse(graph.removeConnection("c1"));
    }

    @Test
    void shouldKeepNodeInsertionOrder() {
        GraphDescription graph = twoNodeGraph();
        graph.addNode(new NodeInstance("0", "main"));

        List<String> ids = graph.getNodeList().stream().map(NodeInstance::getId).toList();

        assertEquals(List.of("a", "b", "0"), ids);
    }

    @Test
    void shouldProduceIndependentDeepCopy() {
        GraphDescription original = twoNodeGraph();
        GraphDescription copy = original.deepCopy();

        copy.getNode("b").orElseThrow().setProperty("text", "changed");
        copy.getConnections().get(0).setTargetPin("other");
        copy.addNode(new NodeInstance("c", "main"));

        assertEquals("hi", original.getNode("b").orElseThrow().getProperties().get("text"));
        assertEquals("exec", original.getConnections().get(0).getTargetPin());
        assertEquals(2, original.getNodeCount());
        assertFalse(original.sameStructureAs(copy));
        assertTrue(original.sameStructureAs(original.deepCopy()));
    }

    @Test
    void shouldExposeConnectionsReadOnly() {
        GraphDescription graph = twoNodeGraph();

        assertThrows(UnsupportedOperationException.class,
                () -> graph.getConnections().add(Connection.data("c2", "a", "x", "b", "y")));
    }

    @Test
    void shouldReadEditorJson() throws Exception {
        GraphDescription graph;
        try (InputStream in = getClass().getResourceAsStream("/graphs/hello_world.json")) {
            graph = objectMapper.readValue(in, GraphDescription.class);
        }

        assertEquals("hello_world", graph.getMetadata().getName());
        assertEquals(2, graph.getNodeCount());
        NodeInstance print = graph.getNode("print").orElseThrow();
        assertEquals(new Position(240, 0), print.getPosition());
        assertEquals("Hello", print.getProperties().get("text"));
        assertEquals(PinDirection.INPUT, print.findInput("text").orElseThrow().getDirection());
        assertEquals("String", print.findInput("text").orElseThrow().getType().asString());
        assertTrue(print.findInput("exec").orElseThrow().isExecution());
        assertEquals(ConnectionKind.EXECUTION, graph.getConnections().get(0).getKind());
    }

    @Test
    void shouldSurviveJsonRoundTrip() throws Exception {
        GraphDescription graph = twoNodeGraph();
        graph.getNode("b").orElseThrow().addInput(Pin.input("text", PinType.typed("Vec<i32>")).withDefault(List.of(1, 2)));

        GraphDescription read = objectMapper.readValue(objectMapper.writeValueAsString(graph), GraphDescription.class);

        assertTrue(graph.sameStructureAs(read));
        Pin pin = read.getNode("b").orElseThrow().findInput("text").orElseThrow();
        assertEquals("Vec<i32>", pin.getType().asString());
        assertEquals(List.of(1, 2), pin.getDefaultValue());
    }

    @Test
    void shouldParsePinTypeSpellings() {
        assertTrue(PinType.fromString("exec").isExecution());
        assertTrue(PinType.fromString("any").isWildcard());
        assertTrue(PinType.fromString("").isWildcard());
        assertEquals("Option<f64>", PinType.fromString("Option<f64>").asString());
    }

    @Test
    void shouldIndexDataOutputsSkippingExecutionPins() {
        NodeInstance node = new NodeInstance("split", "split_vector")
                .addOutput("then", PinType.execution())
                .addOutput("x", PinType.typed("f32"))
                .addOutput("y", PinType.typed("f32"));

        assertEquals(0, node.dataOutputIndex("x"));
        assertEquals(1, node.dataOutputIndex("y"));
        assertEquals(-1, node.dataOutputIndex("then"));
        assertEquals(2, node.dataOutputCount());
    }
}
