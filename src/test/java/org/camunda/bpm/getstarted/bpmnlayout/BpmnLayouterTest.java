package org.camunda.bpm.getstarted.bpmnlayout;

import org.camunda.bpm.getstarted.bpmnlayout.engine.LayoutEngineException;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnEdge;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.camunda.bpm.getstarted.bpmnlayout.models.Point;
import org.camunda.bpm.getstarted.bpmnlayout.routing.Geometry;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static org.camunda.bpm.getstarted.bpmnlayout.TestGraphs.*;
import static org.junit.jupiter.api.Assertions.*;

class BpmnLayouterTest {
    private static final double EPSILON = 1e-6;

    private final LayoutConfig config = LayoutConfig.defaults();
    private final StubLayoutEngine engine = new StubLayoutEngine();
    private final BpmnLayouter layouter = new BpmnLayouter(config, engine, LoggerFactory.getLogger(BpmnLayouterTest.class));

    @Test
    void shouldConnectTwoTasksWithStraightEdge() {
        BpmnNode graph = withEdges(root(node("A", "task"), node("B", "task")), edge("e1", "A", "B"));

        BpmnNode result = layouter.layout(graph);

        BpmnNode a = find(result, "A");
        BpmnNode b = find(result, "B");
        assertEquals(100, a.width);
        assertEquals(80, a.height);
        assertEquals(100, b.width);
        assertEquals(80, b.height);
        assertTrue(b.x > a.x);

        List<Point> route = findEdge(result, "e1").waypoints();
        assertEquals(2, route.size());
        assertEquals(new Point(a.x + 100, a.y + 40), route.get(0));
        assertEquals(new Point(b.x, b.y + 40), route.get(1));
    }

    @Test
    void shouldNotModifyCallersGraph() {
        BpmnNode graph = withEdges(root(node("A", "task"), node("B", "task")), edge("e1", "A", "B"));

        BpmnNode result = layouter.layout(graph);

        assertNotSame(graph, result);
        assertNull(graph.children.get(0).x);
        assertNull(graph.children.get(0).width);
        assertFalse(graph.edges.get(0).hasRoute());
    }

    @Test
    void shouldPlaceBoundaryTargetsBelowHostWithDistinctX() {
        BpmnNode host = node("T", "userTask");
        host.width = 150.0;
        host.height = 80.0;
        host.boundaryEvents = new ArrayList<>(List.of(node("BE1", "boundaryEvent"), node("BE2", "boundaryEvent")));
        BpmnNode graph = withEdges(root(node("S", "startEvent"), host, node("E", "endEvent"),
                        node("H1", "task"), node("H2", "task")),
                edge("f1", "S", "T"), edge("f2", "T", "E"), edge("f3", "BE1", "H1"), edge("f4", "BE2", "H2"));

        BpmnNode result = layouter.layout(graph);

        BpmnNode t = find(result, "T");
        BpmnNode h1 = find(result, "H1");
        BpmnNode h2 = find(result, "H2");
        assertTrue(h1.y >= t.y + t.height, "H1 below host");
        assertTrue(h2.y >= t.y + t.height, "H2 below host");
        assertTrue(h2.x - h1.x >= config.boundaryEventPitch() - EPSILON,
                "targets at least one boundary event pitch apart, in boundary order");
    }

    @Test
    void shouldStackLanesWithoutGaps() {
        BpmnNode lane1 = container("L1", "lane", node("A", "task"));
        BpmnNode lane2 = container("L2", "lane", node("B", "task"));
        BpmnNode pool = withEdges(container("P", "participant", lane1, lane2), edge("e1", "A", "B"));

        BpmnNode result = layouter.layout(root(pool));

        BpmnNode p = find(result, "P");
        BpmnNode l1 = find(result, "L1");
        BpmnNode l2 = find(result, "L2");
        assertEquals(0, l1.y);
        assertEquals(l1.height, l2.y);
        assertEquals(l1.width, l2.width);
        assertEquals(p.width - config.laneHeaderWidth(), l1.width, EPSILON);
        assertEquals(p.height, l1.height + l2.height, EPSILON);
    }

    @Test
    void shouldPlaceInputArtifactAboveTaskLeftEdge() {
        BpmnNode data = node("D", "dataObjectReference");
        BpmnNode graph = withEdges(root(node("S", "startEvent"), node("T", "task"), data),
                edge("f1", "S", "T"), edge("a1", "D", "T", "dataInputAssociation"));

        BpmnNode result = layouter.layout(graph);

        BpmnNode t = find(result, "T");
        BpmnNode d = find(result, "D");
        assertEquals(t.y - d.height - config.artifactVerticalGap(), d.y, EPSILON);
        assertEquals(t.x, d.x, EPSILON);
    }

    @Test
    void shouldKeepBlackBoxPoolHeightAndGrowNormalPool() {
        BpmnNode blackBox = node("P1", "participant");
        blackBox.bpmn.isBlackBox = true;
        BpmnNode normal = withEdges(container("P2", "participant", node("A", "task"), node("B", "task")),
                edge("f1", "A", "B"));
        BpmnNode collaboration = withEdges(container("C", "collaboration", blackBox, normal),
                edge("m1", "A", "P1", "messageFlow"));
        // pool padding 12 + task 80 + 12 as placed by the stub engine
        double engineHeight = 104;

        BpmnNode result = layouter.layout(root(collaboration));

        BpmnNode p1 = find(result, "P1");
        BpmnNode p2 = find(result, "P2");
        BpmnNode c = find(result, "C");
        assertEquals(config.blackBoxPoolHeight(), p1.height, EPSILON);
        assertEquals(engineHeight + config.poolExtraHeight(), p2.height, EPSILON);
        assertEquals(p1.y + p1.height, p2.y, EPSILON);
        assertEquals(p1.height + p2.height, c.height, EPSILON);
        assertEquals(p1.width, p2.width, EPSILON);
    }

    @Test
    void shouldRouteEdgeAroundNodeInTheWay() {
        BpmnNode graph = withEdges(root(node("A", "task"), node("X", "task"), node("B", "task")),
                edge("e1", "A", "B"));

        BpmnNode result = layouter.layout(graph);

        BpmnNode x = find(result, "X");
        List<Point> route = findEdge(result, "e1").waypoints();
        assertTrue(route.size() > 2);
        for (int i = 0; i < route.size() - 1; i++) {
            assertFalse(Geometry.segmentCrossesNode(route.get(i), route.get(i + 1), x.bounds()),
                    "segment " + i + " crosses X");
        }
    }

    @Test
    void shouldPropagateEngineFailure() {
        BpmnLayouter failing = new BpmnLayouter(config, prepared -> {
            throw new LayoutEngineException("engine down");
        }, LoggerFactory.getLogger(BpmnLayouterTest.class));

        LayoutEngineException e = assertThrows(LayoutEngineException.class,
                () -> failing.layout(root(node("A", "task"))));
        assertEquals("engine down", e.getMessage());
    }

    @Test
    void shouldLayoutJson() {
        String json = """
                {
                  "id": "diagram",
                  "children": [
                    { "id": "A", "bpmn": { "type": "task", "name": "Check" } },
                    { "id": "B", "bpmn": { "type": "task", "name": "Ship" } }
                  ],
                  "edges": [
                    { "id": "e1", "sources": ["A"], "targets": ["B"], "bpmn": { "type": "sequenceFlow" } }
                  ]
                }
                """;

        String result = layouter.layoutJson(json);

        assertTrue(result.contains("\"startPoint\""));
        assertTrue(result.contains("\"width\" : 100.0"));
        assertEquals(1, engine.calls());
    }

    @Test
    void shouldRejectInvalidJson() {
        assertThrows(IllegalArgumentException.class, () -> layouter.layoutJson("{ not json"));
    }

    @Test
    void shouldLayoutWithDebugTracing() {
        LayoutConfig debug = LayoutConfig.defaultsBuilder().debug(true).build();
        BpmnLayouter traced = new BpmnLayouter(debug, new StubLayoutEngine(),
                LoggerFactory.getLogger(BpmnLayouterTest.class));
        BpmnNode graph = withEdges(root(node("A", "task"), node("B", "task")), edge("e1", "A", "B"));

        BpmnNode result = traced.layout(graph);

        BpmnEdge edge = findEdge(result, "e1");
        assertTrue(edge.hasRoute());
    }
}
