package org.camunda.bpm.getstarted.bpmnlayout.lane;

import org.camunda.bpm.getstarted.bpmnlayout.LayoutConfig;
import org.camunda.bpm.getstarted.bpmnlayout.LayoutTrace;
import org.camunda.bpm.getstarted.bpmnlayout.models.Bounds;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnEdge;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.camunda.bpm.getstarted.bpmnlayout.models.CoordinateSpace;
import org.camunda.bpm.getstarted.bpmnlayout.models.Point;
import org.camunda.bpm.getstarted.bpmnlayout.options.ElkOptions;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.camunda.bpm.getstarted.bpmnlayout.TestGraphs.*;
import static org.junit.jupiter.api.Assertions.*;

class LaneArrangerTest {
    private final LayoutConfig config = LayoutConfig.defaults();
    private final LaneArranger arranger = new LaneArranger(config, LayoutTrace.disabled());

    private static BpmnNode layoutedPool() {
        BpmnNode pool = container("P", "participant",
                node("A", "task", 12, 12, 100, 80),
                node("B", "task", 162, 12, 100, 80));
        pool.setPosition(0, 0);
        pool.setSize(274, 104);
        return withEdges(pool, edge("e1", "A", "B"));
    }

    @Test
    void shouldStackLanesAndCentreContent() {
        BpmnNode layouted = root(layoutedPool());
        BpmnNode original = root(container("P", "participant",
                container("L1", "lane", node("A", "task")),
                container("L2", "lane", node("B", "task"))));

        arranger.rearrange(layouted, original, Map.of());

        BpmnNode pool = find(layouted, "P");
        BpmnNode l1 = find(layouted, "L1");
        BpmnNode l2 = find(layouted, "L2");
        // content 262 wide plus the extra width
        assertEquals(312, l1.width);
        assertEquals(config.laneHeaderWidth() + 312, pool.width);
        assertEquals(config.laneHeaderWidth(), l1.x);
        assertEquals(0, l1.y);
        assertEquals(160, l1.height);
        assertEquals(160, l2.y);
        assertEquals(320, pool.height);
        assertEquals(40, find(layouted, "A").y);
        assertEquals(40, find(layouted, "B").y);
        assertSame(l1, pool.children.get(0));
    }

    @Test
    void shouldRouteFlowsBetweenLanesSideToSide() {
        BpmnNode layouted = root(layoutedPool());
        BpmnNode original = root(container("P", "participant",
                container("L1", "lane", node("A", "task")),
                container("L2", "lane", node("B", "task"))));

        arranger.rearrange(layouted, original, Map.of());

        BpmnEdge edge = findEdge(layouted, "e1");
        assertEquals(CoordinateSpace.POOL, edge.coordinateSpace());
        List<Point> route = edge.waypoints();
        assertEquals(4, route.size());
        assertEquals(new Point(142, 80), route.get(0));
        assertEquals(new Point(192, 240), route.get(3));
        assertEquals(route.get(1).x(), route.get(2).x());
    }

    @Test
    void shouldOrderLanesByPartition() {
        BpmnNode first = container("L1", "lane", node("A", "task"));
        BpmnNode second = container("L2", "lane", node("B", "task"));
        first.layoutOptions = new HashMap<>(Map.of(ElkOptions.PARTITION, "2"));
        second.layoutOptions = new HashMap<>(Map.of(ElkOptions.PARTITION, "1"));

        List<BpmnNode> sorted = LaneArranger.sortedLanes(List.of(first, second, node("X", "task")));

        assertEquals(List.of(second, first), sorted);
    }

    @Test
    void shouldGiveEmptyLaneDefaultHeight() {
        BpmnNode layouted = root(layoutedPool());
        BpmnNode original = root(container("P", "participant",
                container("L1", "lane", node("A", "task"), node("B", "task")),
                container("L2", "lane")));

        arranger.rearrange(layouted, original, Map.of());

        BpmnNode l2 = find(layouted, "L2");
        assertEquals(config.emptyLaneContentHeight() + config.laneExtraHeight(), l2.height);
        assertNull(l2.children);
    }

    @Test
    void shouldPutBoundaryEventIntoHostLane() {
        BpmnNode pool = layoutedPool();
        pool.mutableChildren().add(node("BE", "boundaryEvent", 94, 74, 36, 36));
        BpmnNode layouted = root(pool);
        BpmnNode original = root(container("P", "participant",
                container("L1", "lane", node("A", "task")),
                container("L2", "lane", node("B", "task"))));

        arranger.rearrange(layouted, original, Map.of("BE", "A"));

        BpmnNode l1 = find(layouted, "L1");
        assertTrue(l1.children.stream().anyMatch(n -> "BE".equals(n.id)));
    }

    @Test
    void shouldNestLanesInsideParentLane() {
        BpmnNode layouted = root(layoutedPool());
        BpmnNode original = root(container("P", "participant",
                container("L1", "lane",
                        container("L1a", "lane", node("A", "task")),
                        container("L1b", "lane", node("B", "task")))));

        arranger.rearrange(layouted, original, Map.of());

        BpmnNode l1 = find(layouted, "L1");
        BpmnNode l1a = find(layouted, "L1a");
        BpmnNode l1b = find(layouted, "L1b");
        assertEquals(l1.width - config.laneHeaderWidth(), l1a.width);
        assertEquals(l1a.height, l1b.y);
        assertEquals(l1a.height + l1b.height, l1.height);
        List<Point> route = findEdge(layouted, "e1").waypoints();
        for (int i = 0; i < route.size() - 1; i++) {
            assertTrue(route.get(i + 1).x() >= route.get(i).x(), "segment " + i + " runs back");
        }
    }

    @Test
    void shouldLeaveThroughBottomWhenTargetOverlapsBelow() {
        List<Point> route = LaneArranger.sideToSideRoute(new Bounds(100, 0, 100, 80), new Bounds(150, 200, 100, 80));

        assertEquals(List.of(new Point(150, 80), new Point(150, 140), new Point(200, 140), new Point(200, 200)),
                route);
    }

    @Test
    void shouldLeaveThroughTopWhenTargetOverlapsAbove() {
        List<Point> route = LaneArranger.sideToSideRoute(new Bounds(100, 200, 100, 80), new Bounds(100, 0, 100, 80));

        // straight up, centres line up
        assertEquals(List.of(new Point(150, 200), new Point(150, 80)), route);
    }

    @Test
    void shouldLeavePoolsWithoutLanesAlone() {
        BpmnNode layouted = root(layoutedPool());
        BpmnNode original = root(container("P", "participant", node("A", "task"), node("B", "task")));

        arranger.rearrange(layouted, original, Map.of());

        assertEquals(274, find(layouted, "P").width);
        assertFalse(findEdge(layouted, "e1").hasRoute());
    }
}
