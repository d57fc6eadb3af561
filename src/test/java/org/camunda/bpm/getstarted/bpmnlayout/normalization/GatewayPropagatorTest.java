package org.camunda.bpm.getstarted.bpmnlayout.normalization;

import org.camunda.bpm.getstarted.bpmnlayout.LayoutConfig;
import org.camunda.bpm.getstarted.bpmnlayout.LayoutTrace;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.camunda.bpm.getstarted.bpmnlayout.models.MoveInfo;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.camunda.bpm.getstarted.bpmnlayout.TestGraphs.*;
import static org.junit.jupiter.api.Assertions.*;

class GatewayPropagatorTest {
    private final GatewayPropagator propagator = new GatewayPropagator(LayoutConfig.defaults(), LayoutTrace.disabled());

    private static BpmnNode graph() {
        return withEdges(root(
                        node("G", "exclusiveGateway", 400, 15, 50, 50),
                        node("X", "task", 300, 0, 100, 80),
                        node("Y", "task", 420, 0, 100, 80),
                        node("Z", "task", 900, 0, 100, 80),
                        node("B", "task", 300, 200, 100, 80)),
                edge("f1", "G", "X"), edge("f2", "X", "Y"), edge("f3", "Y", "Z"), edge("f4", "G", "B"));
    }

    private static Map<String, MoveInfo> gatewayMove() {
        return Map.of("G", MoveInfo.builder().nodeId("G").newY(15).offset(0).newX(400.0).build());
    }

    @Test
    void shouldPushMainFlowBehindMovedGateway() {
        BpmnNode graph = graph();

        Map<String, MoveInfo> moves = propagator.propagate(graph, gatewayMove(), Set.of("G", "X", "Y", "Z"));

        assertEquals(500, find(graph, "X").x);
        assertEquals(650, find(graph, "Y").x);
        assertEquals(500, moves.get("X").newX());
        assertEquals(0, moves.get("X").offset());
        // already far enough right
        assertEquals(900, find(graph, "Z").x);
        assertFalse(moves.containsKey("Z"));
    }

    @Test
    void shouldNotMoveNodesOutsideMainFlow() {
        BpmnNode graph = graph();

        Map<String, MoveInfo> moves = propagator.propagate(graph, gatewayMove(), Set.of("G", "X"));

        assertFalse(moves.containsKey("B"));
        assertEquals(300, find(graph, "B").x);
        assertEquals(420, find(graph, "Y").x);
    }

    @Test
    void shouldIgnoreMovesWithoutNewX() {
        BpmnNode graph = graph();
        Map<String, MoveInfo> moves = Map.of("G", MoveInfo.builder().nodeId("G").newY(100).offset(85).build());

        assertTrue(propagator.propagate(graph, moves, Set.of("G", "X")).isEmpty());
    }
}
