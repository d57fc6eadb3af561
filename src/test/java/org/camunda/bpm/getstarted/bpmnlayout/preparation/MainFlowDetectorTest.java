package org.camunda.bpm.getstarted.bpmnlayout.preparation;

import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.camunda.bpm.getstarted.bpmnlayout.TestGraphs.*;
import static org.junit.jupiter.api.Assertions.*;

class MainFlowDetectorTest {

    @Test
    void shouldStopAtBoundaryEventsAndTheirTargets() {
        BpmnNode host = node("A", "task");
        host.boundaryEvents = new ArrayList<>(List.of(node("BE", "boundaryEvent")));
        BpmnNode graph = withEdges(root(node("S", "startEvent"), host, node("B", "task"), node("E", "endEvent"),
                        node("H", "task"), node("X", "endEvent")),
                edge("f1", "S", "A"), edge("f2", "A", "B"), edge("f3", "B", "E"), edge("f4", "BE", "H"),
                edge("f5", "H", "X"));

        Set<String> mainFlow = MainFlowDetector.detect(graph, Set.of("H"));

        assertEquals(List.of("S", "A", "B", "E"), List.copyOf(mainFlow));
    }

    @Test
    void shouldUniteSeveralStartEventsAndSurviveCycles() {
        BpmnNode graph = withEdges(root(node("S1", "startEvent"), node("S2", "startEvent"), node("A", "task"),
                        node("B", "task")),
                edge("f1", "S1", "A"), edge("f2", "S2", "B"), edge("f3", "A", "B"), edge("f4", "B", "A"));

        Set<String> mainFlow = MainFlowDetector.detect(graph, Set.of());

        assertEquals(Set.of("S1", "S2", "A", "B"), mainFlow);
    }

    @Test
    void shouldFindStartEventsInContainers() {
        BpmnNode pool = withEdges(container("P", "participant", node("S", "startEvent"), node("A", "task")),
                edge("f1", "S", "A"));

        assertEquals(Set.of("S", "A"), MainFlowDetector.detect(root(pool), Set.of()));
    }

    @Test
    void shouldBeEmptyWithoutStartEvent() {
        BpmnNode graph = withEdges(root(node("A", "task"), node("B", "task")), edge("f1", "A", "B"));

        assertTrue(MainFlowDetector.detect(graph, Set.of()).isEmpty());
        assertEquals(Map.of("A", List.of("B")), MainFlowDetector.outgoingEdges(graph));
    }
}
