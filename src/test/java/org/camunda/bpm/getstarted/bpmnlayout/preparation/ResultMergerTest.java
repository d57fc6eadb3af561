package org.camunda.bpm.getstarted.bpmnlayout.preparation;

import org.camunda.bpm.getstarted.bpmnlayout.LayoutConfig;
import org.camunda.bpm.getstarted.bpmnlayout.LayoutTrace;
import org.camunda.bpm.getstarted.bpmnlayout.models.Bounds;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.camunda.bpm.getstarted.bpmnlayout.models.Point;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.camunda.bpm.getstarted.bpmnlayout.TestGraphs.*;
import static org.junit.jupiter.api.Assertions.*;

class ResultMergerTest {
    private final ResultMerger merger = new ResultMerger(LayoutConfig.defaults(), LayoutTrace.disabled());

    @Test
    void shouldCopyPositionsAndRoutes() {
        BpmnNode original = withEdges(root(node("A", "task"), node("B", "task")), edge("f", "A", "B"));
        BpmnNode layouted = withEdges(root(
                        node("A", "task", 10, 20, 100, 80),
                        node("B", "task", 200, 20, 100, 80)),
                routed("f", "A", "B", new Point(110, 60), new Point(200, 60)));
        layouted.setSize(320, 120);

        BpmnNode merged = merger.merge(original, layouted);

        assertSame(original, merged);
        assertEquals(320, original.width);
        assertEquals(10, find(original, "A").x);
        assertEquals(20, find(original, "A").y);
        assertEquals(100, find(original, "A").width);
        assertEquals(List.of(new Point(110, 60), new Point(200, 60)), findEdge(original, "f").waypoints());
    }

    @Test
    void shouldMatchNodesByIdAcrossDifferentStructure() {
        BpmnNode original = root(node("A", "task"));
        BpmnNode lane = container("L", "lane", node("A", "task", 10, 20, 100, 80));
        lane.setPosition(30, 0);
        BpmnNode layouted = root(lane);

        merger.merge(original, layouted);

        assertEquals(40, find(original, "A").x);
        assertEquals(20, find(original, "A").y);
    }

    @Test
    void shouldKeepNodesThatWereNotLaidOut() {
        BpmnNode original = root(node("A", "task", 5, 6, 100, 80));

        merger.merge(original, root());

        assertEquals(5, find(original, "A").x);
        assertEquals(6, find(original, "A").y);
    }

    @Test
    void shouldSeatBoundaryEventsOnHostBottom() {
        BpmnNode host = node("A", "task");
        host.boundaryEvents = new ArrayList<>(List.of(node("BE", "boundaryEvent")));
        BpmnNode original = root(host);
        BpmnNode layouted = root(node("A", "task", 0, 0, 100, 80), node("BE", "boundaryEvent", 300, 300, 36, 36));

        merger.merge(original, layouted);

        BpmnNode event = host.boundaryEvents.get(0);
        assertEquals(32, event.x);
        assertEquals(62, event.y);
        assertEquals(36, event.width);
    }

    @Test
    void shouldRouteBoundaryBranchDownFromSeatedEvent() {
        Bounds event = new Bounds(100, 82, 36, 36);
        Bounds target = new Bounds(200, 200, 100, 80);

        List<Point> route = ResultMerger.seatedBoundaryRoute(List.of(), event, target);

        assertEquals(List.of(new Point(118, 118), new Point(118, 138), new Point(250, 138), new Point(250, 200)),
                route);
    }

    @Test
    void shouldKeepRouteAlreadyLeavingTheSeat() {
        List<Point> route = List.of(new Point(118, 118), new Point(118, 240));

        assertSame(route, ResultMerger.seatedBoundaryRoute(route, new Bounds(100, 82, 36, 36),
                new Bounds(68, 240, 100, 80)));
    }
}
