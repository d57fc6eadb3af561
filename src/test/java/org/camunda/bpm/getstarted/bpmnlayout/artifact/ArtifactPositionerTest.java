package org.camunda.bpm.getstarted.bpmnlayout.artifact;

import org.camunda.bpm.getstarted.bpmnlayout.LayoutConfig;
import org.camunda.bpm.getstarted.bpmnlayout.LayoutTrace;
import org.camunda.bpm.getstarted.bpmnlayout.models.ArtifactInfo;
import org.camunda.bpm.getstarted.bpmnlayout.models.Bounds;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.camunda.bpm.getstarted.bpmnlayout.models.Point;
import org.camunda.bpm.getstarted.bpmnlayout.routing.Geometry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.camunda.bpm.getstarted.bpmnlayout.TestGraphs.*;
import static org.junit.jupiter.api.Assertions.*;

class ArtifactPositionerTest {
    private final LayoutConfig config = LayoutConfig.defaults();
    private final ArtifactPositioner positioner = new ArtifactPositioner(config, LayoutTrace.disabled());

    private static BpmnNode graph() {
        return withEdges(root(
                        node("T", "task", 200, 100, 100, 80),
                        node("D1", "dataObjectReference", 0, 0, 36, 50),
                        node("D2", "dataStoreReference", 0, 0, 36, 50),
                        node("O", "dataObjectReference", 0, 0, 36, 50),
                        node("N", "textAnnotation", 0, 0, 100, 30)),
                edge("i1", "D1", "T", "dataInputAssociation"),
                edge("i2", "D2", "T", "dataInputAssociation"),
                edge("o1", "T", "O", "dataOutputAssociation"),
                edge("x", "N", "O", "association"));
    }

    @Test
    void shouldClassifyInputsAndOutputs() {
        Map<String, ArtifactInfo> infos = ArtifactPositioner.collectInfo(graph());

        assertEquals(3, infos.size());
        assertTrue(infos.get("D1").input());
        assertEquals("T", infos.get("D1").associatedTaskId());
        assertFalse(infos.get("O").input());
        // association between two artifacts
        assertFalse(infos.containsKey("N"));
    }

    @Test
    void shouldLineUpInputsFromLeftEdgeAndOutputsRightOfTask() {
        BpmnNode graph = graph();

        positioner.reposition(graph, ArtifactPositioner.collectInfo(graph));

        BpmnNode d1 = find(graph, "D1");
        BpmnNode d2 = find(graph, "D2");
        BpmnNode o = find(graph, "O");
        assertEquals(200, d1.x);
        assertEquals(200 + 36 + config.artifactSpacing(), d2.x);
        assertEquals(300 + config.artifactSpacing(), o.x);
        assertEquals(100 - 50 - config.artifactVerticalGap(), d1.y);
        assertEquals(d1.y, o.y);
    }

    @Test
    void shouldRouteAssociationsDirectly() {
        BpmnNode graph = graph();

        positioner.reposition(graph, ArtifactPositioner.collectInfo(graph));

        assertEquals(List.of(new Point(218, 80), new Point(218, 100)), findEdge(graph, "i1").waypoints());
        assertEquals(List.of(new Point(300, 100), new Point(333, 80)), findEdge(graph, "o1").waypoints());
    }

    @Test
    void shouldClampDirectRouteToTaskWidth() {
        List<Point> route = ArtifactPositioner.directRoute(new Bounds(0, 0, 36, 50), new Bounds(100, 100, 100, 80),
                true);

        assertEquals(List.of(new Point(18, 50), new Point(100, 100)), route);
    }

    @Test
    void shouldBendVerticalAssociationThroughMiddle() {
        BpmnNode graph = withEdges(root(
                        node("D", "dataObjectReference", 200, 0, 36, 50),
                        node("T", "task", 300, 200, 100, 80)),
                edge("i", "D", "T", "dataInputAssociation"));

        positioner.recalculateWithObstacleAvoidance(graph, ArtifactPositioner.collectInfo(graph));

        assertEquals(List.of(new Point(218, 50), new Point(218, 125), new Point(350, 125), new Point(350, 200)),
                findEdge(graph, "i").waypoints());
    }

    @Test
    void shouldAvoidObstacleOnHorizontalAssociation() {
        Bounds obstacle = new Bounds(150, 0, 100, 80);
        List<Point> route = positioner.routeAround(new Bounds(0, 15, 36, 50), new Bounds(400, 0, 100, 80), true,
                List.of(obstacle));

        assertEquals(new Point(36, 40), route.get(0));
        assertEquals(new Point(400, 40), route.get(route.size() - 1));
        assertEquals(0, Geometry.countCrossings(route, List.of(obstacle)));
    }
}
