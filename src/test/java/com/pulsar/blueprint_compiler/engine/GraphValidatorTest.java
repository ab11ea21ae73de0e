package com.pulsar.blueprint_compiler.engine;

import com.pulsar.blueprint_compiler.CompilerFixtures;
import com.pulsar.blueprint_compiler.GraphBuilder;
import com.pulsar.blueprint_compiler.exception.CompilationException;
import com.pulsar.blueprint_compiler.exception.CompileErrorType;
import com.pulsar.blueprint_compiler.model.graph.GraphDescription;
import com.pulsar.blueprint_compiler.model.graph.NodeInstance;
import com.pulsar.blueprint_compiler.model.graph.PinType;
import com.pulsar.blueprint_compiler.registry.NodeMetadataRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GraphValidatorTest {

    private final GraphValidator validator = new GraphValidator();
    private NodeMetadataRegistry catalog;

    @BeforeEach
    void setUp() {
        catalog = CompilerFixtures.catalog();
    }

    private GraphBuilder graph() {
        return GraphBuilder.graph(catalog, "validation");
    }

    @Test
    void shouldAcceptWideningConnections() {
        GraphDescription graph = graph()
                .node("event", "begin_play")
                .node("sum", "add")
                .node("show", "print_number")
                .exec("event", "Body", "show")
                .data("sum", "result", "show", "value")
                .build();

        assertDoesNotThrow(() -> validator.validate(graph));
    }

    @Test
    void shouldRejectIncompatibleTypes() {
        GraphDescription graph = graph()
                .node("cmp", "greater_than")
                .node("sum", "add")
                .data("cmp", "result", "sum", "a")
                .build();

        CompilationException ex = assertThrows(CompilationException.class, () -> validator.validate(graph));

        assertEquals(CompileErrorType.TYPE_MISMATCH, ex.getType());
        assertEquals("c1", ex.getConnectionId());
        assertEquals("sum", ex.getNodeId());
    }

    @Test
    void shouldRejectUnknownPin() {
        GraphDescription graph = graph()
                .node("event", "begin_play")
                .node("print", "print_string")
                .exec("event", "Body", "print", "go")
                .build();

        CompilationException ex = assertThrows(CompilationException.class, () -> validator.validate(graph));

        assertEquals(CompileErrorType.INVALID_CONNECTION, ex.getType());
        assertEquals("go", ex.getPinName());
    }

    @Test
    void shouldRejectExecutionWireIntoDataPin() {
        GraphDescription graph = graph()
                .node("event", "begin_play")
                .node("print", "print_string")
                .exec("event", "Body", "print", "text")
                .build();

        CompilationException ex = assertThrows(CompilationException.class, () -> validator.validate(graph));

        assertEquals(CompileErrorType.INVALID_CONNECTION, ex.getType());
        assertEquals("print", ex.getNodeId());
    }

    @Test
    void shouldRejectMissingEndpoint() {
        GraphDescription graph = graph()
                .node("event", "begin_play")
                .exec("event", "Body", "ghost")
                .build();

        CompilationException ex = assertThrows(CompilationException.class, () -> validator.validate(graph));

        assertEquals(CompileErrorType.INVALID_CONNECTION, ex.getType());
        assertEquals("ghost", ex.getNodeId());
    }

    @Test
    void shouldAcceptAnythingIntoWildcardPin() {
        GraphDescription graph = graph()
                .node("cmp", "greater_than")
                .node(new NodeInstance("sink", "debug_sink").addInput("value", PinType.wildcard()))
                .data("cmp", "result", "sink", "value")
                .build();

        assertDoesNotThrow(() -> validator.validate(graph));
    }

    @Test
    void shouldSkipPinChecksOnNodesWithoutDeclaredPins() {
        GraphDescription graph = graph()
                .node(new NodeInstance("a", "reroute"))
                .node(new NodeInstance("b", "reroute"))
                .data("a", "out", "b", "in")
                .build();

        assertDoesNotThrow(() -> validator.validate(graph));
    }
}
