package org.camunda.bpm.getstarted.bpmnlayout.routing;

import org.camunda.bpm.getstarted.bpmnlayout.LayoutConfig;
import org.camunda.bpm.getstarted.bpmnlayout.LayoutTrace;
import org.camunda.bpm.getstarted.bpmnlayout.index.NodeIndex;
import org.camunda.bpm.getstarted.bpmnlayout.models.Bounds;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnEdge;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnTypes;
import org.camunda.bpm.getstarted.bpmnlayout.models.Obstacle;
import org.camunda.bpm.getstarted.bpmnlayout.models.Point;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reroutes edges whose route passes through a node that is neither their source nor their target.
 * <p>
 * Obstacles are flow nodes grouped by the participant enclosing them, an edge only checks the nodes of
 * its own participant. Edges leaving boundary events are skipped, the boundary event handler routes
 * them.
 */
public class EdgeFixer {
    private static final String ROOT_GROUP = "";

    private final double margin;
    private final LayoutConfig config;
    private final LayoutTrace trace;

    public EdgeFixer(LayoutConfig config, LayoutTrace trace) {
        this.config = config;
        this.margin = config.edgeFixerMargin();
        this.trace = trace;
    }

    /**
     * @return ids of the edges that got a new route
     */
    public List<String> fix(BpmnNode graph) {
        NodeIndex index = NodeIndex.build(graph);
        Map<String, List<Obstacle>> obstaclesByGroup = collectObstacles(index);
        List<String> fixed = new ArrayList<>();

        for (NodeIndex.EdgeRef ref : index.edges()) {
            BpmnEdge edge = ref.edge();
            if (!edge.hasRoute()) {
                continue;
            }
            String sourceId = edge.sourceId();
            String targetId = edge.targetId();
            if (!index.contains(sourceId) || !index.contains(targetId)) {
                continue;
            }
            if (index.isBoundaryEvent(sourceId) || BpmnTypes.BOUNDARY_EVENT.equals(index.node(sourceId).type())) {
                continue;
            }

            List<Obstacle> candidates = obstaclesByGroup.getOrDefault(groupOf(index, ref.owner()), List.of());
            List<Bounds> obstacles = new ArrayList<>();
            for (Obstacle obstacle : candidates) {
                if (obstacle.id().equals(sourceId) || obstacle.id().equals(targetId)
                        || index.isDescendantOf(sourceId, obstacle.id())
                        || index.isDescendantOf(targetId, obstacle.id())) {
                    continue;
                }
                obstacles.add(obstacle.bounds());
            }

            List<Point> route = index.absoluteWaypoints(edge);
            Bounds source = index.absoluteBounds(sourceId);
            Bounds target = index.absoluteBounds(targetId);
            boolean crossesTarget = crossesThroughReturnTarget(route, source, target);
            if (!crossesNodes(route, obstacles) && !crossesTarget) {
                continue;
            }

            List<Point> rerouted = reroute(route, source, target, obstacles);
            index.setAbsoluteRoute(edge, rerouted);
            fixed.add(edge.id);
            trace.trace("Edge {} rerouted through {} bend points", edge.id, rerouted.size() - 2);
        }
        return fixed;
    }

    private Map<String, List<Obstacle>> collectObstacles(NodeIndex index) {
        Map<String, List<Obstacle>> groups = new HashMap<>();
        for (BpmnNode node : index.nodes()) {
            if (node == index.root() || !isObstacle(index, node)) {
                continue;
            }
            groups.computeIfAbsent(groupOf(index, index.parent(node.id)), k -> new ArrayList<>())
                    .add(new Obstacle(node.id, index.absoluteBounds(node.id)));
        }
        return groups;
    }

    private static boolean isObstacle(NodeIndex index, BpmnNode node) {
        String type = node.type();
        return BpmnTypes.isFlowNode(type) && !BpmnTypes.BOUNDARY_EVENT.equals(type)
                && !index.isBoundaryEvent(node.id);
    }

    private static String groupOf(NodeIndex index, BpmnNode container) {
        if (container == null) {
            return ROOT_GROUP;
        }
        if (BpmnTypes.isPool(container.type())) {
            return container.id;
        }
        BpmnNode pool = index.nearestAncestor(container.id, n -> BpmnTypes.isPool(n.type()));
        return pool == null ? ROOT_GROUP : pool.id;
    }

    static boolean crossesNodes(List<Point> route, List<Bounds> obstacles) {
        for (int i = 0; i < route.size() - 1; i++) {
            for (Bounds obstacle : obstacles) {
                if (Geometry.segmentCrossesNode(route.get(i), route.get(i + 1), obstacle)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * A return edge (target above the source) whose last horizontal segment runs through the target.
     */
    static boolean crossesThroughReturnTarget(List<Point> route, Bounds source, Bounds target) {
        if (route.size() < 2 || target.bottom() >= source.y()) {
            return false;
        }
        Point last = route.get(route.size() - 1);
        Point beforeLast = route.get(route.size() - 2);
        if (Math.abs(beforeLast.y() - last.y()) >= 5) {
            return false;
        }
        double minX = Math.min(beforeLast.x(), last.x());
        double maxX = Math.max(beforeLast.x(), last.x());
        return beforeLast.y() > target.y() && beforeLast.y() < target.bottom()
                && minX < target.right() && maxX > target.x();
    }

    /**
     * Grid search first, then the perpendicular detour, then the plain orthogonal route.
     */
    List<Point> reroute(List<Point> route, Bounds source, Bounds target, List<Bounds> obstacles) {
        Point originalStart = route.get(0);
        Point originalEnd = route.get(route.size() - 1);
        Side sourceSide = connectionSide(originalStart, originalEnd, true);
        Side targetSide = connectionSide(originalStart, originalEnd, false);

        PathfindingRouter router = PathfindingRouter.from(config);
        router.setObstacles(obstacles);
        PathfindingRouter.RouteResult found = router.routeEdge(source, target, sourceSide, targetSide);
        if (found.success() && isClean(found.path(), obstacles)) {
            return found.path();
        }

        List<Point> detour = perpendicularDetour(originalStart, originalEnd, source, target, sourceSide, targetSide,
                obstacles);
        if (!crossesNodes(detour, obstacles)) {
            return detour;
        }
        trace.trace("No clean route between {} and {}, using the plain orthogonal route", source, target);
        return Geometry.orthogonalPath(sourceSide.connectionPoint(source), targetSide.connectionPoint(target), true);
    }

    private static boolean isClean(List<Point> route, List<Bounds> obstacles) {
        for (Bounds obstacle : obstacles) {
            if (Geometry.routeIntersects(route, obstacle)) {
                return false;
            }
        }
        return Geometry.isOrthogonal(route);
    }

    /**
     * Left-to-right diagrams prefer horizontal connections. A target far above or below enters
     * vertically.
     */
    private static Side connectionSide(Point from, Point to, boolean source) {
        double dx = to.x() - from.x();
        double dy = to.y() - from.y();
        if (dx > 0) {
            if (source) {
                return Side.RIGHT;
            }
            if (Math.abs(dy) > Math.abs(dx) * 1.5) {
                return dy > 0 ? Side.TOP : Side.BOTTOM;
            }
            return Side.LEFT;
        }
        if (dx < 0) {
            return source ? Side.LEFT : Side.RIGHT;
        }
        if (source) {
            return dy > 0 ? Side.BOTTOM : Side.TOP;
        }
        return dy > 0 ? Side.TOP : Side.BOTTOM;
    }

    private List<Point> perpendicularDetour(Point originalStart, Point originalEnd, Bounds source, Bounds target,
                                            Side sourceSide, Side targetSide, List<Bounds> obstacles) {
        Point start = sourceSide.connectionPoint(source);
        Point end = targetSide.connectionPoint(target);

        double pathMinX = Math.min(start.x(), end.x()) - margin;
        double pathMaxX = Math.max(start.x(), end.x()) + margin;
        double pathMinY = Math.min(start.y(), end.y()) - margin;
        double pathMaxY = Math.max(start.y(), end.y()) + margin;
        List<Bounds> blocking = new ArrayList<>();
        for (Bounds obs : obstacles) {
            if (obs.x() < pathMaxX && obs.right() > pathMinX && obs.y() < pathMaxY && obs.bottom() > pathMinY) {
                blocking.add(obs);
            }
        }

        List<Point> bends;
        double dx = originalEnd.x() - originalStart.x();
        double dy = originalEnd.y() - originalStart.y();
        if (blocking.isEmpty()) {
            bends = perpendicularBends(start, end, sourceSide, targetSide);
        } else if (dx > 0 && dy != 0) {
            bends = routeRightThenVertical(start, end, blocking);
        } else if (dx > 0) {
            bends = routeRight(start, end, sourceSide, source, target, blocking);
        } else if (dy < 0) {
            bends = routeUp(start, end, sourceSide, source, target, blocking);
        } else if (dy > 0) {
            bends = routeDown(start, end, sourceSide, source, target, blocking);
        } else {
            bends = routeLeft(start, end, sourceSide, source, target, blocking);
        }

        List<Point> route = new ArrayList<>();
        route.add(start);
        route.addAll(bends);
        route.add(end);
        return Geometry.simplify(route);
    }

    private static List<Point> perpendicularBends(Point start, Point end, Side sourceSide, Side targetSide) {
        List<Point> bends = new ArrayList<>();
        if (Math.abs(start.x() - end.x()) < 5 || Math.abs(start.y() - end.y()) < 5) {
            return bends;
        }
        boolean verticalExit = !sourceSide.isHorizontal();
        boolean verticalEntry = !targetSide.isHorizontal();
        if (verticalExit && verticalEntry) {
            double midY = (start.y() + end.y()) / 2;
            bends.add(new Point(start.x(), midY));
            bends.add(new Point(end.x(), midY));
        } else if (!verticalExit && !verticalEntry) {
            double midX = (start.x() + end.x()) / 2;
            bends.add(new Point(midX, start.y()));
            bends.add(new Point(midX, end.y()));
        } else if (verticalExit) {
            bends.add(new Point(start.x(), end.y()));
        } else {
            bends.add(new Point(end.x(), start.y()));
        }
        return bends;
    }

    // right and up or down: go right past the blocking nodes, then vertically
    private List<Point> routeRightThenVertical(Point start, Point end, List<Bounds> obstacles) {
        double minY = Math.min(start.y(), end.y());
        double maxY = Math.max(start.y(), end.y());
        double clearX = start.x();
        boolean blocked = false;
        for (Bounds obs : obstacles) {
            if (obs.x() < end.x() && obs.right() > start.x() - margin && obs.y() < maxY && obs.bottom() > minY) {
                clearX = Math.max(clearX, obs.right() + margin);
                blocked = true;
            }
        }
        List<Point> bends = new ArrayList<>();
        clearX = Math.max(clearX, end.x());
        if (!blocked || Math.abs(clearX - end.x()) < 5) {
            bends.add(new Point(end.x(), start.y()));
        } else {
            bends.add(new Point(clearX, start.y()));
            bends.add(new Point(clearX, end.y()));
        }
        return bends;
    }

    private List<Point> routeRight(Point start, Point end, Side sourceSide, Bounds source, Bounds target,
                                   List<Bounds> obstacles) {
        List<Point> bends = new ArrayList<>();
        double routeX = source.right() + margin;
        for (Bounds obs : obstacles) {
            if (obs.right() > source.right() && obs.x() < target.x()) {
                routeX = Math.max(routeX, obs.right() + margin);
            }
        }
        routeX = Math.min(routeX, target.x() - margin);

        if (routeX <= source.right()) {
            double clearY = Math.max(source.bottom(), target.bottom()) + margin;
            for (Bounds obs : obstacles) {
                clearY = Math.max(clearY, obs.bottom() + margin);
            }
            if (sourceSide == Side.RIGHT) {
                bends.add(new Point(start.x() + margin, start.y()));
                bends.add(new Point(start.x() + margin, clearY));
                bends.add(new Point(end.x() - margin, clearY));
                bends.add(new Point(end.x() - margin, end.y()));
            } else {
                bends.add(new Point(start.x(), clearY));
                bends.add(new Point(end.x(), clearY));
            }
        } else {
            bends.add(new Point(routeX, start.y()));
            bends.add(new Point(routeX, end.y()));
        }
        return bends;
    }

    private List<Point> routeUp(Point start, Point end, Side sourceSide, Bounds source, Bounds target,
                                List<Bounds> obstacles) {
        List<Point> bends = new ArrayList<>();
        double clearX = Math.max(source.right(), target.right()) + margin;
        for (Bounds obs : obstacles) {
            clearX = Math.max(clearX, obs.right() + margin);
        }
        if (sourceSide == Side.TOP) {
            double exitY = start.y() - margin;
            bends.add(new Point(start.x(), exitY));
            bends.add(new Point(clearX, exitY));
        } else {
            bends.add(new Point(clearX, start.y()));
        }
        bends.add(new Point(clearX, end.y()));
        return bends;
    }

    private List<Point> routeDown(Point start, Point end, Side sourceSide, Bounds source, Bounds target,
                                  List<Bounds> obstacles) {
        List<Point> bends = new ArrayList<>();
        double avoidX = Math.min(start.x(), end.x());
        for (Bounds obs : obstacles) {
            if (obs.y() <= end.y() && obs.bottom() >= start.y()) {
                if (obs.x() <= start.x() && obs.right() >= start.x()) {
                    avoidX = Math.min(avoidX, obs.x() - margin);
                }
                if (obs.x() <= end.x() && obs.right() >= end.x()) {
                    avoidX = Math.min(avoidX, obs.x() - margin);
                }
            }
        }
        avoidX = Math.min(avoidX, Math.min(source.x(), target.x()) - margin);

        if (sourceSide == Side.BOTTOM) {
            double exitY = start.y() + margin;
            bends.add(new Point(start.x(), exitY));
            if (avoidX < start.x() - 5) {
                bends.add(new Point(avoidX, exitY));
                bends.add(new Point(avoidX, end.y() - margin));
                bends.add(new Point(end.x(), end.y() - margin));
            } else if (Math.abs(start.x() - end.x()) > 5) {
                bends.add(new Point(end.x(), exitY));
            }
        } else {
            double midY = (start.y() + end.y()) / 2;
            bends.add(new Point(avoidX, start.y()));
            bends.add(new Point(avoidX, midY));
            bends.add(new Point(end.x(), midY));
        }
        return bends;
    }

    private List<Point> routeLeft(Point start, Point end, Side sourceSide, Bounds source, Bounds target,
                                  List<Bounds> obstacles) {
        List<Point> bends = new ArrayList<>();
        if (sourceSide == Side.LEFT) {
            double clearX = Math.min(source.x(), target.x()) - margin;
            for (Bounds obs : obstacles) {
                if (obs.x() < source.x() && obs.right() > target.right()) {
                    clearX = Math.min(clearX, obs.x() - margin);
                }
            }
            bends.add(new Point(clearX, start.y()));
            bends.add(new Point(clearX, end.y()));
        } else {
            double exitX = start.x() - margin;
            bends.add(new Point(exitX, start.y()));
            bends.add(new Point(exitX, end.y()));
        }
        return bends;
    }
}
