package com.pulsar.blueprint_compiler.library;

import com.pulsar.blueprint_compiler.exception.CompilationException;
import com.pulsar.blueprint_compiler.exception.CompileErrorType;
import com.pulsar.blueprint_compiler.model.graph.Connection;
import com.pulsar.blueprint_compiler.model.graph.GraphDescription;
import com.pulsar.blueprint_compiler.model.graph.NodeInstance;
import com.pulsar.blueprint_compiler.model.graph.PassthroughNodeTypes;
import com.pulsar.blueprint_compiler.model.graph.PinType;
import com.pulsar.blueprint_compiler.model.graph.Position;
import com.pulsar.blueprint_compiler.model.subgraph.SubGraphDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SubGraphExpanderTest {

    private LibraryManager libraries;
    private SubGraphExpander expander;

    @BeforeEach
    void setUp() {
        libraries = new LibraryManager();
        expander = new SubGraphExpander(libraries, 100);
        libraries.registerDefinition(greet());
    }

    // macro_entry ──▶ p ──▶ macro_exit, with msg wired into p.text
    private static SubGraphDefinition greet() {
        SubGraphDefinition greet = new SubGraphDefinition("greet", "Greet")
                .addInputPin("exec", "exec")
                .addInputPin("msg", "String")
                .addOutputPin("then", "exec");
        NodeInstance print = new NodeInstance("p", "print_string", new Position(50, 10))
                .addInput("exec", PinType.execution())
                .addInput("text", PinType.typed("String"))
                .addOutput("then", PinType.execution());
        greet.getGraph().addNode(print);
        greet.getGraph().addConnection(Connection.execution("i1", PassthroughNodeTypes.MACRO_ENTRY, "exec", "p", "exec"));
        greet.getGraph().addConnection(Connection.data("i2", PassthroughNodeTypes.MACRO_ENTRY, "msg", "p", "text"));
        greet.getGraph().addConnection(Connection.execution("i3", "p", "then", PassthroughNodeTypes.MACRO_EXIT, "then"));
        return greet;
    }

    // A definition whose interior only forwards execution through one nested instance
    private static SubGraphDefinition wrapping(String id, String nestedId) {
        SubGraphDefinition definition = new SubGraphDefinition(id, id)
                .addInputPin("exec", "exec")
                .addOutputPin("then", "exec");
        definition.getGraph().addNode(new NodeInstance("inner", NodeInstance.MACRO_PREFIX + nestedId));
        definition.getGraph().addConnection(Connection.execution("w1", PassthroughNodeTypes.MACRO_ENTRY, "exec", "inner", "exec"));
        definition.getGraph().addConnection(Connection.execution("w2", "inner", "then", PassthroughNodeTypes.MACRO_EXIT, "then"));
        return definition;
    }

    private GraphDescription callerOf(String definitionId) {
        GraphDescription graph = new GraphDescription("caller");
        graph.addNode(new NodeInstance("event", "begin_play"));
        graph.addNode(new NodeInstance("m1", NodeInstance.MACRO_PREFIX + definitionId, new Position(100, 200)));
        graph.addNode(new NodeInstance("after", "print_string"));
        graph.addConnection(Connection.execution("c1", "event", "Body", "m1", "exec"));
        graph.addConnection(Connection.execution("c2", "m1", "then", "after", "exec"));
        return graph;
    }

    @Test
    void shouldReplaceInstanceWithInteriorNodes() {
        GraphDescription graph = callerOf("greet");

        expander.expandAll(graph);

        // 3 nodes - 1 instance + 3 interior nodes
        assertEquals(5, graph.getNodeCount());
        assertFalse(graph.containsNode("m1"));
        assertTrue(graph.containsNode("m1_macro_entry"));
        assertTrue(graph.containsNode("m1_p"));
        assertTrue(graph.containsNode("m1_macro_exit"));
        assertTrue(graph.getNodeList().stream().noneMatch(NodeInstance::isSubgraphInstance));
    }

    @Test
    void shouldRewireBoundaryConnectionsInPlace() {
        GraphDescription graph = callerOf("greet");

        expander.expandAll(graph);

        Connection in = graph.getConnections().get(0);
        Connection out = graph.getConnections().get(1);
        assertEquals("c1_to_input", in.getId());
        assertEquals("m1_macro_entry", in.getTargetNode());
        assertEquals("c2_from_output", out.getId());
        assertEquals("m1_macro_exit", out.getSourceNode());
        assertEquals("after", out.getTargetNode());
        assertTrue(graph.getConnections().stream().anyMatch(c -> c.getId().equals("m1_i2")
                && c.getSourceNode().equals("m1_macro_entry") && c.getTargetNode().equals("m1_p")));
    }

    @Test
    void shouldOffsetInteriorPositionsByInstancePosition() {
        GraphDescription graph = callerOf("greet");

        expander.expandAll(graph);

        assertEquals(new Position(150, 210), graph.getNode("m1_p").orElseThrow().getPosition());
    }

    @Test
    void shouldCarryInstanceLiteralsToEntryNode() {
        GraphDescription graph = callerOf("greet");
        graph.getNode("m1").orElseThrow().setProperty("msg", "Hi");

        expander.expandAll(graph);

        assertEquals("Hi", graph.getNode("m1_macro_entry").orElseThrow().getProperties().get("msg"));
        assertFalse(libraries.require("greet").getGraph().getNode(PassthroughNodeTypes.MACRO_ENTRY)
                .orElseThrow().getProperties().containsKey("msg"));
    }

    @Test
    void shouldLeaveExpandedGraphUnchangedOnSecondPass() {
        GraphDescription graph = callerOf("greet");
        expander.expandAll(graph);
        GraphDescription once = graph.deepCopy();

        expander.expandAll(graph);

        assertTrue(graph.sameStructureAs(once));
    }

    @Test
    void shouldExpandNestedDefinitions() {
        libraries.registerDefinition(wrapping("outer", "greet"));
        GraphDescription graph = callerOf("outer");

        expander.expandAll(graph);

        assertTrue(graph.containsNode("m1_inner_p"));
        assertTrue(graph.getNodeList().stream().noneMatch(NodeInstance::isSubgraphInstance));
    }

    @Test
    void shouldAvoidIdCollisionsWithExistingNodes() {
        GraphDescription graph = callerOf("greet");
        graph.addNode(new NodeInstance("m1_p", "print_string"));

        expander.expandAll(graph);

        assertTrue(graph.containsNode("m1__p"));
        assertTrue(graph.containsNode("m1__macro_entry"));
    }

    @Test
    void shouldFailOnMissingDefinition() {
        GraphDescription graph = callerOf("nope");

        CompilationException ex = assertThrows(CompilationException.class, () -> expander.expandAll(graph));

        assertEquals(CompileErrorType.SUBGRAPH_NOT_FOUND, ex.getType());
        assertEquals("nope", ex.getSubgraphId());
    }

    @Test
    void shouldDetectCircularReferencesBeforeExpanding() {
        libraries.registerDefinition(wrapping("ping", "pong"));
        libraries.registerDefinition(wrapping("pong", "ping"));
        GraphDescription graph = callerOf("ping");
        GraphDescription before = graph.deepCopy();

        CompilationException ex = assertThrows(CompilationException.class, () -> expander.expandAll(graph));

        assertEquals(CompileErrorType.CIRCULAR_REFERENCE, ex.getType());
        assertEquals("ping", ex.getSubgraphId());
        assertTrue(graph.sameStructureAs(before));
    }

    @Test
    void shouldDetectSelfReference() {
        libraries.registerDefinition(wrapping("loop", "loop"));

        CompilationException ex = assertThrows(CompilationException.class,
                () -> expander.validateNoCircularRefs(libraries.require("loop")));

        assertEquals(CompileErrorType.CIRCULAR_REFERENCE, ex.getType());
    }

    @Test
    void shouldStopAtDepthLimit() {
        libraries.registerDefinition(wrapping("level1", "greet"));
        libraries.registerDefinition(wrapping("level2", "level1"));

        // level2 → level1 → greet takes three expansion passes
        CompilationException ex = assertThrows(CompilationException.class,
                () -> expander.expandAll(callerOf("level2"), 2));
        assertEquals(CompileErrorType.DEPTH_EXCEEDED, ex.getType());

        GraphDescription graph = callerOf("level2");
        expander.expandAll(graph, 3);
        assertTrue(graph.containsNode("m1_inner_inner_p"));
    }
}
