package com.pulsar.blueprint_compiler.engine;

import com.pulsar.blueprint_compiler.model.graph.Connection;
import com.pulsar.blueprint_compiler.model.graph.GraphDescription;
import com.pulsar.blueprint_compiler.model.graph.NodeInstance;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionRouterTest {

    private static GraphDescription graph() {
        GraphDescription graph = new GraphDescription("routes");
        for (String id : List.of("event", "a", "b", "c", "seq")) {
            graph.addNode(new NodeInstance(id, "print_string"));
        }
        graph.addConnection(Connection.execution("c1", "event", "Body", "b", "exec"));
        graph.addConnection(Connection.data("c2", "a", "result", "b", "text"));
        graph.addConnection(Connection.execution("c3", "event", "Body", "a", "exec"));
        graph.addConnection(Connection.execution("c4", "seq", "Then1", "c", "exec"));
        graph.addConnection(Connection.execution("c5", "seq", "Then0", "a", "exec"));
        return graph;
    }

    @Test
    void shouldListTargetsInWireOrder() {
        ExecutionRouter router = ExecutionRouter.build(graph());

        assertEquals(List.of("b", "a"), router.getConnectedNodes("event", "Body"));
    }

    @Test
    void shouldIgnoreDataConnections() {
        ExecutionRouter router = ExecutionRouter.build(graph());

        assertTrue(router.getConnectedNodes("a", "result").isEmpty());
        assertEquals(3, router.size());
    }

    @Test
    void shouldReturnEmptyListForUnwiredPin() {
        ExecutionRouter router = ExecutionRouter.build(graph());

        assertEquals(List.of(), router.getConnectedNodes("c", "then"));
        assertEquals(List.of(), router.getConnectedNodes("missing", "Body"));
    }

    @Test
    void shouldReportRoutedPinsInFirstWireOrder() {
        ExecutionRouter router = ExecutionRouter.build(graph());

        assertEquals(List.of("Then1", "Then0"), router.routedPins("seq"));
        assertEquals(List.of(), router.routedPins("b"));
    }

    @Test
    void shouldKeepInputPinOfEachTarget() {
        GraphDescription graph = new GraphDescription("pins");
        for (String id : List.of("check", "exit")) {
            graph.addNode(new NodeInstance(id, "print_string"));
        }
        graph.addConnection(Connection.execution("c1", "check", "True", "exit", "yes"));
        graph.addConnection(Connection.execution("c2", "check", "False", "exit", "no"));

        ExecutionRouter router = ExecutionRouter.build(graph);

        assertEquals(List.of(new ExecutionRouter.RouteKey("exit", "yes")), router.getTargets("check", "True"));
        assertEquals(List.of(new ExecutionRouter.RouteKey("exit", "no")), router.getTargets("check", "False"));
    }

    @Test
    void shouldNotExposeMutableTargetLists() {
        ExecutionRouter router = ExecutionRouter.build(graph());

        assertThrows(UnsupportedOperationException.class, () -> router.getConnectedNodes("event", "Body").add("x"));
    }
}
