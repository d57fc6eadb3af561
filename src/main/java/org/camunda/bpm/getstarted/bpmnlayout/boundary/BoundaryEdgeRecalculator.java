package org.camunda.bpm.getstarted.bpmnlayout.boundary;

import org.camunda.bpm.getstarted.bpmnlayout.LayoutConfig;
import org.camunda.bpm.getstarted.bpmnlayout.LayoutTrace;
import org.camunda.bpm.getstarted.bpmnlayout.index.NodeIndex;
import org.camunda.bpm.getstarted.bpmnlayout.models.BoundaryEventInfo;
import org.camunda.bpm.getstarted.bpmnlayout.models.Bounds;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnEdge;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.camunda.bpm.getstarted.bpmnlayout.models.MoveInfo;
import org.camunda.bpm.getstarted.bpmnlayout.models.Point;
import org.camunda.bpm.getstarted.bpmnlayout.routing.Geometry;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reroutes the edges touching moved nodes and the edges leaving boundary events.
 * <p>
 * The route shape follows the main direction from source to target. Downwards the edge leaves the
 * source at the bottom and enters the target from the top, upwards it leaves to the right and comes
 * up into the target's bottom, sideways it runs from side to side. Hosts and moved nodes in the way
 * are passed on the cheaper side.
 */
public class BoundaryEdgeRecalculator {
    private final LayoutConfig config;
    private final LayoutTrace trace;

    public BoundaryEdgeRecalculator(LayoutConfig config, LayoutTrace trace) {
        this.config = config;
        this.trace = trace;
    }

    public void recalculate(BpmnNode graph, Map<String, MoveInfo> moves, Map<String, BoundaryEventInfo> infos) {
        NodeIndex index = NodeIndex.build(graph);

        Set<String> obstacleIds = new LinkedHashSet<>();
        for (BoundaryEventInfo info : infos.values()) {
            obstacleIds.add(info.hostId());
        }
        obstacleIds.addAll(moves.keySet());

        Map<String, Bounds> seated = seatedEvents(index, infos);
        for (NodeIndex.EdgeRef ref : index.edges()) {
            BpmnEdge edge = ref.edge();
            String sourceId = edge.sourceId();
            String targetId = edge.targetId();
            if (sourceId == null || targetId == null) {
                continue;
            }
            boolean fromBoundaryEvent = infos.containsKey(sourceId);
            if (!fromBoundaryEvent && !moves.containsKey(sourceId) && !moves.containsKey(targetId)) {
                continue;
            }
            Bounds source = seated.containsKey(sourceId) ? seated.get(sourceId) : boundsOf(index, sourceId);
            Bounds target = boundsOf(index, targetId);
            if (source == null || target == null) {
                trace.trace("[Boundary] edge {} has an unknown endpoint", edge.id);
                continue;
            }

            List<Bounds> obstacles = new ArrayList<>();
            for (String id : obstacleIds) {
                if (!id.equals(sourceId) && !id.equals(targetId) && index.contains(id)) {
                    obstacles.add(index.absoluteBounds(id));
                }
            }
            List<Point> route = route(source, target, obstacles);
            if (route.size() < 2) {
                trace.trace("[Boundary] edge {} collapsed to a point, keeping its route", edge.id);
                continue;
            }
            trace.trace("[Boundary] rerouted {}: {}", edge.id, route);
            index.setAbsoluteRoute(edge, route);
        }
    }

    private Map<String, Bounds> seatedEvents(NodeIndex index, Map<String, BoundaryEventInfo> infos) {
        Map<String, Bounds> seated = new HashMap<>();
        for (BoundaryEventInfo info : infos.values()) {
            if (!index.contains(info.hostId())) {
                continue;
            }
            BpmnNode event = index.node(info.boundaryEventId());
            double width = event == null || event.width == null ? config.boundaryEventWidth() : event.width;
            double height = event == null || event.height == null ? config.boundaryEventWidth() : event.height;
            seated.put(info.boundaryEventId(), BoundarySeats.seat(index.absoluteBounds(info.hostId()), info.index(),
                    info.total(), config.boundaryEventPitch(), width, height));
        }
        return seated;
    }

    private static Bounds boundsOf(NodeIndex index, String id) {
        return index.contains(id) ? index.absoluteBounds(id) : null;
    }

    /**
     * Orthogonal route from {@code source} to {@code target} around {@code obstacles}, all in the
     * same coordinate system, without repeated or collinear points.
     */
    List<Point> route(Bounds source, Bounds target, List<Bounds> obstacles) {
        return Geometry.simplify(rawRoute(source, target, obstacles));
    }

    private List<Point> rawRoute(Bounds source, Bounds target, List<Bounds> obstacles) {
        double dx = target.x() - source.x();
        double dy = target.y() - source.y();
        boolean vertical = Math.abs(dy) > Math.abs(dx);

        if (vertical && dy > 0) {
            return routeDown(source, target, obstacles);
        }
        if (vertical) {
            return routeUp(source, target, obstacles);
        }
        if (dx > 0) {
            return routeRight(source, target, obstacles);
        }
        return routeLeft(source, target, obstacles);
    }

    private List<Point> routeDown(Bounds source, Bounds target, List<Bounds> obstacles) {
        double clearance = config.branchDetourClearance();
        double jog = config.branchDetourJog();
        Point start = new Point(source.centerX(), source.bottom());
        Point end = new Point(target.centerX(), target.y());
        List<Point> route = new ArrayList<>(List.of(start));

        List<Bounds> blocking = findBlockingObstacles(start, end, obstacles, true);
        if (blocking.isEmpty()) {
            double midY = (start.y() + end.y()) / 2;
            route.add(new Point(start.x(), midY));
            route.add(new Point(end.x(), midY));
        } else {
            double left = Math.min(start.x(), end.x());
            double right = Math.max(start.x(), end.x());
            for (Bounds obstacle : blocking) {
                left = Math.min(left, obstacle.x() - clearance);
                right = Math.max(right, obstacle.right() + clearance);
            }
            // the detour lane itself must not run into something
            for (Bounds obstacle : obstacles) {
                if (obstacle.y() < end.y() && obstacle.bottom() > start.y()) {
                    if (obstacle.x() <= left + jog && obstacle.right() >= left - jog) {
                        left = Math.min(left, obstacle.x() - clearance);
                    }
                    if (obstacle.x() <= right + jog && obstacle.right() >= right - jog) {
                        right = Math.max(right, obstacle.right() + clearance);
                    }
                }
            }
            double leftLength = Math.abs(start.x() - left) + Math.abs(end.x() - left);
            double rightLength = Math.abs(start.x() - right) + Math.abs(end.x() - right);
            double detourX = leftLength <= rightLength ? left : right;

            double exitY = start.y() + jog;
            route.add(new Point(start.x(), exitY));
            route.add(new Point(detourX, exitY));
            route.add(new Point(detourX, end.y() - jog));
            route.add(new Point(end.x(), end.y() - jog));
        }
        route.add(end);
        return route;
    }

    private List<Point> routeUp(Bounds source, Bounds target, List<Bounds> obstacles) {
        double clearance = config.branchDetourClearance();
        Point start = new Point(source.right(), source.centerY());
        Point end = new Point(target.centerX(), target.bottom());

        double clearX = Math.max(source.right(), target.right()) + clearance;
        for (Bounds obstacle : obstacles) {
            if (obstacle.y() < source.y() && obstacle.bottom() > target.y()) {
                clearX = Math.max(clearX, obstacle.right() + clearance);
            }
        }
        return List.of(start, new Point(clearX, start.y()), new Point(clearX, end.y()), end);
    }

    private List<Point> routeRight(Bounds source, Bounds target, List<Bounds> obstacles) {
        double clearance = config.branchDetourClearance();
        double jog = config.branchDetourJog();
        Point start = new Point(source.right(), source.centerY());
        Point end = new Point(target.x(), target.centerY());
        List<Point> route = new ArrayList<>(List.of(start));

        List<Bounds> blocking = findBlockingObstacles(start, end, obstacles, false);
        if (blocking.isEmpty()) {
            double midX = (start.x() + end.x()) / 2;
            route.add(new Point(midX, start.y()));
            route.add(new Point(midX, end.y()));
        } else {
            double clearY = Math.max(source.bottom(), target.bottom()) + clearance;
            for (Bounds obstacle : blocking) {
                clearY = Math.max(clearY, obstacle.bottom() + clearance);
            }
            route.add(new Point(start.x() + jog, start.y()));
            route.add(new Point(start.x() + jog, clearY));
            route.add(new Point(end.x() - jog, clearY));
            route.add(new Point(end.x() - jog, end.y()));
        }
        route.add(end);
        return route;
    }

    private List<Point> routeLeft(Bounds source, Bounds target, List<Bounds> obstacles) {
        double clearance = config.branchDetourClearance();
        Point start = new Point(source.x(), source.centerY());
        Point end = new Point(target.right(), target.centerY());

        double clearX = Math.min(source.x(), target.x()) - clearance;
        for (Bounds obstacle : obstacles) {
            clearX = Math.min(clearX, obstacle.x() - clearance);
        }
        return List.of(start, new Point(clearX, start.y()), new Point(clearX, end.y()), end);
    }

    /**
     * Obstacles inside the corridor between the two points, widened across the travel direction by
     * {@link Geometry#COLLISION_MARGIN}.
     *
     * @param vertical whether the path mainly runs vertically
     */
    static List<Bounds> findBlockingObstacles(Point start, Point end, List<Bounds> obstacles, boolean vertical) {
        double margin = Geometry.COLLISION_MARGIN;
        double minX = Math.min(start.x(), end.x());
        double maxX = Math.max(start.x(), end.x());
        double minY = Math.min(start.y(), end.y());
        double maxY = Math.max(start.y(), end.y());
        if (vertical) {
            minX -= margin;
            maxX += margin;
        } else {
            minY -= margin;
            maxY += margin;
        }

        List<Bounds> blocking = new ArrayList<>();
        for (Bounds obstacle : obstacles) {
            if (obstacle.y() < maxY && obstacle.bottom() > minY && obstacle.x() < maxX && obstacle.right() > minX) {
                blocking.add(obstacle);
            }
        }
        return blocking;
    }
}
