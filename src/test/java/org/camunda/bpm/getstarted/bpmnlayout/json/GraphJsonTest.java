package org.camunda.bpm.getstarted.bpmnlayout.json;

import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.camunda.bpm.getstarted.bpmnlayout.models.Point;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.camunda.bpm.getstarted.bpmnlayout.TestGraphs.*;
import static org.junit.jupiter.api.Assertions.*;

class GraphJsonTest {
    @Test
    void shouldReadNodesEdgesAndUnknownFields() {
        BpmnNode graph = GraphJson.read("""
                {
                  "id": "diagram",
                  "someVendorField": 1,
                  "layoutOptions": { "elk.direction": "DOWN" },
                  "children": [
                    { "id": "T", "width": 120, "bpmn": { "type": "userTask", "name": "Review", "extra": true } }
                  ],
                  "edges": [ { "id": "e", "sources": ["T"], "targets": ["T"] } ]
                }
                """);

        assertEquals("diagram", graph.id);
        assertEquals("DOWN", graph.option("elk.direction"));
        BpmnNode task = graph.children.get(0);
        assertEquals("userTask", task.type());
        assertEquals("Review", task.name());
        assertEquals(120, task.width);
        assertNull(task.height);
        assertEquals("T", graph.edges.get(0).sourceId());
    }

    @Test
    void shouldRejectEmptyAndMalformedInput() {
        assertThrows(IllegalArgumentException.class, () -> GraphJson.read(" "));
        assertThrows(IllegalArgumentException.class, () -> GraphJson.read("[1, 2"));
    }

    @Test
    void shouldWriteRouteAsSections() {
        BpmnNode graph = withEdges(root(node("A", "task", 0, 0, 100, 80)),
                routed("e1", "A", "A", new Point(0, 0), new Point(10, 0), new Point(10, 10)));

        String json = GraphJson.write(graph);

        assertTrue(json.contains("\"startPoint\""));
        assertTrue(json.contains("\"bendPoints\""));
        assertTrue(json.contains("\"coordinateSpace\" : \"CONTAINER\""));
        assertFalse(json.contains("priority"));
    }

    @Test
    void shouldCopyIndependently() {
        BpmnNode graph = withEdges(root(node("A", "task", 0, 0, 100, 80)),
                routed("e1", "A", "A", new Point(0, 0), new Point(10, 0)));

        BpmnNode copy = GraphJson.deepCopy(graph);
        copy.children.get(0).x = 500.0;
        copy.edges.get(0).translateRoute(5, 5);

        assertEquals(0, graph.children.get(0).x);
        assertEquals(List.of(new Point(0, 0), new Point(10, 0)), graph.edges.get(0).waypoints());
        assertEquals(new Point(5, 5), copy.edges.get(0).waypoints().get(0));
    }
}
