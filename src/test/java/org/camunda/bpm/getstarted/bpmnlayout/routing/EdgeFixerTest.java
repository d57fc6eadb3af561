package org.camunda.bpm.getstarted.bpmnlayout.routing;

import org.camunda.bpm.getstarted.bpmnlayout.LayoutConfig;
import org.camunda.bpm.getstarted.bpmnlayout.LayoutTrace;
import org.camunda.bpm.getstarted.bpmnlayout.models.Bounds;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.camunda.bpm.getstarted.bpmnlayout.models.Point;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.camunda.bpm.getstarted.bpmnlayout.TestGraphs.*;
import static org.junit.jupiter.api.Assertions.*;

class EdgeFixerTest {
    private final EdgeFixer fixer = new EdgeFixer(LayoutConfig.defaults(), LayoutTrace.disabled());

    private static BpmnNode rowWithEdgeThroughMiddle() {
        return withEdges(root(
                        node("A", "task", 0, 0, 100, 80),
                        node("B", "task", 150, 0, 100, 80),
                        node("C", "task", 300, 0, 100, 80)),
                routed("f", "A", "C", new Point(100, 40), new Point(300, 40)));
    }

    @Test
    void shouldRerouteEdgeCrossingNode() {
        BpmnNode graph = rowWithEdgeThroughMiddle();

        List<String> fixed = fixer.fix(graph);

        assertEquals(List.of("f"), fixed);
        List<Point> route = findEdge(graph, "f").waypoints();
        assertFalse(EdgeFixer.crossesNodes(route, List.of(new Bounds(150, 0, 100, 80))));
        assertTrue(Geometry.isOrthogonal(route));
    }

    @Test
    void shouldBeIdempotent() {
        BpmnNode graph = rowWithEdgeThroughMiddle();
        fixer.fix(graph);
        List<Point> first = findEdge(graph, "f").waypoints();

        assertTrue(fixer.fix(graph).isEmpty());
        assertEquals(first, findEdge(graph, "f").waypoints());
    }

    @Test
    void shouldLeaveCleanEdgesAlone() {
        BpmnNode graph = withEdges(root(
                        node("A", "task", 0, 0, 100, 80),
                        node("B", "task", 150, 0, 100, 80)),
                routed("f", "A", "B", new Point(100, 40), new Point(150, 40)));

        assertTrue(fixer.fix(graph).isEmpty());
        assertEquals(List.of(new Point(100, 40), new Point(150, 40)), findEdge(graph, "f").waypoints());
    }

    @Test
    void shouldSkipEdgesLeavingBoundaryEvents() {
        BpmnNode graph = withEdges(root(
                        node("BE", "boundaryEvent", 0, 22, 36, 36),
                        node("B", "task", 150, 0, 100, 80),
                        node("C", "task", 300, 0, 100, 80)),
                routed("f", "BE", "C", new Point(36, 40), new Point(300, 40)));

        assertTrue(fixer.fix(graph).isEmpty());
    }

    @Test
    void shouldIgnoreNodesOfOtherParticipants() {
        BpmnNode p1 = container("P1", "participant",
                node("A", "task", 0, 0, 100, 80),
                node("C", "task", 300, 0, 100, 80));
        p1.setPosition(0, 0);
        p1.setSize(400, 80);
        // overlaps the route geometrically but lives in another pool
        BpmnNode p2 = container("P2", "participant", node("B", "task", 150, 0, 100, 80));
        p2.setPosition(0, 0);
        p2.setSize(400, 80);
        withEdges(p1, routed("f", "A", "C", new Point(100, 40), new Point(300, 40)));

        assertTrue(fixer.fix(root(p1, p2)).isEmpty());
    }

    @Test
    void shouldDetectReturnEdgeRunningThroughItsTarget() {
        Bounds source = new Bounds(300, 200, 100, 80);
        Bounds target = new Bounds(0, 0, 100, 80);

        assertTrue(EdgeFixer.crossesThroughReturnTarget(
                List.of(new Point(350, 200), new Point(350, 40), new Point(50, 40)), source, target));
        assertFalse(EdgeFixer.crossesThroughReturnTarget(
                List.of(new Point(350, 200), new Point(350, 40), new Point(100, 40)), source, target));
    }
}
