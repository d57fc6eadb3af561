package org.camunda.bpm.getstarted.bpmnlayout.pool;

import org.camunda.bpm.getstarted.bpmnlayout.LayoutConfig;
import org.camunda.bpm.getstarted.bpmnlayout.models.Bounds;
import org.camunda.bpm.getstarted.bpmnlayout.models.Point;
import org.camunda.bpm.getstarted.bpmnlayout.routing.Geometry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MessageFlowRouterTest {
    private final LayoutConfig config = LayoutConfig.defaults();
    private final MessageFlowRouter router = new MessageFlowRouter(config);

    @Test
    void shouldRouteStraightDownWhenAligned() {
        List<Point> route = router.route(new Bounds(0, 0, 100, 80), new Bounds(0, 200, 100, 80),
                false, false, List.of());

        assertEquals(List.of(new Point(50, 80), new Point(50, 200)), route);
    }

    @Test
    void shouldJogHalfwayForShortOffset() {
        List<Point> route = router.route(new Bounds(0, 0, 100, 80), new Bounds(100, 200, 100, 80),
                false, false, List.of());

        assertEquals(List.of(new Point(50, 80), new Point(50, 140), new Point(150, 140), new Point(150, 200)),
                route);
    }

    @Test
    void shouldJogNearTargetForLongOffset() {
        List<Point> route = router.route(new Bounds(0, 0, 100, 80), new Bounds(500, 200, 100, 80),
                false, false, List.of());

        double jogY = 200 - config.messageFlowJog();
        assertEquals(List.of(new Point(50, 80), new Point(50, jogY), new Point(550, jogY), new Point(550, 200)),
                route);
    }

    @Test
    void shouldAlignBlackBoxEndWithOtherEnd() {
        List<Point> route = router.route(new Bounds(300, 200, 100, 80), new Bounds(0, 0, 800, 60),
                false, true, List.of());

        assertEquals(List.of(new Point(350, 200), new Point(350, 60)), route);
    }

    @Test
    void shouldRouteSideBySideHorizontally() {
        List<Point> route = router.route(new Bounds(0, 0, 100, 80), new Bounds(300, 0, 100, 80),
                false, false, List.of());

        assertEquals(List.of(new Point(100, 40), new Point(300, 40)), route);
    }

    @Test
    void shouldDetourAroundObstacle() {
        Bounds source = new Bounds(0, 0, 100, 80);
        Bounds target = new Bounds(0, 300, 100, 80);
        Bounds obstacle = new Bounds(0, 150, 100, 80);

        List<Point> route = router.route(source, target, false, false, List.of(obstacle));

        assertEquals(new Point(50, 80), route.get(0));
        assertEquals(new Point(50, 300), route.get(route.size() - 1));
        for (int i = 0; i < route.size() - 1; i++) {
            assertFalse(Geometry.segmentCrossesNode(route.get(i), route.get(i + 1), obstacle));
        }
    }

    @Test
    void shouldKeepDesiredXWhenLaneIsFree() {
        double x = MessageFlowRouter.clearLane(50, 0, 300, List.of(new Bounds(200, 100, 100, 80)));

        assertEquals(50, x);
    }

    @Test
    void shouldPickGapBetweenObstacles() {
        List<Bounds> obstacles = List.of(new Bounds(0, 100, 100, 80), new Bounds(200, 100, 100, 80));

        double x = MessageFlowRouter.clearLane(90, 0, 300, obstacles);

        // gap 105..195, nearest usable x keeps the margin
        assertEquals(110, x);
    }

    @Test
    void shouldPassBesideRowWithoutGaps() {
        List<Bounds> obstacles = List.of(new Bounds(0, 100, 100, 80), new Bounds(100, 100, 100, 80));

        double x = MessageFlowRouter.clearLane(150, 0, 300, obstacles);

        assertEquals(205, x);
    }

    @Test
    void shouldIgnoreObstaclesOutsideBand() {
        double x = MessageFlowRouter.clearLane(50, 0, 90, List.of(new Bounds(0, 100, 100, 80)));

        assertEquals(50, x);
    }
}
