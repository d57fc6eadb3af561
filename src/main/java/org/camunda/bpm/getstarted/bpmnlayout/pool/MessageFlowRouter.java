package org.camunda.bpm.getstarted.bpmnlayout.pool;

import org.camunda.bpm.getstarted.bpmnlayout.LayoutConfig;
import org.camunda.bpm.getstarted.bpmnlayout.models.Bounds;
import org.camunda.bpm.getstarted.bpmnlayout.models.Point;
import org.camunda.bpm.getstarted.bpmnlayout.routing.Geometry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Routes flows between pools.
 * <p>
 * Between stacked pools a flow leaves the source at the bottom (or top) and enters the target from
 * the facing side. A black-box end takes the x of the other end so the flow drops straight onto the
 * empty pool. When a node lies on the path, the vertical part is moved sideways into the nearest
 * gap between the obstacles, or past all of them.
 */
public class MessageFlowRouter {
    // ends closer than this in x are connected by a straight line
    private static final double STRAIGHT_TOLERANCE = 5;
    private static final double SAME_LEVEL_TOLERANCE = 10;

    private final LayoutConfig config;

    public MessageFlowRouter(LayoutConfig config) {
        this.config = config;
    }

    /**
     * @param obstacles nodes the route must not cross, the two ends and their containers excluded
     */
    public List<Point> route(Bounds source, Bounds target, boolean sourceBlackBox, boolean targetBlackBox,
                             List<Bounds> obstacles) {
        if (source.bottom() <= target.y()) {
            return vertical(source, target, true, sourceBlackBox, targetBlackBox, obstacles);
        }
        if (target.bottom() <= source.y()) {
            return vertical(source, target, false, sourceBlackBox, targetBlackBox, obstacles);
        }
        return horizontal(source, target, obstacles);
    }

    private List<Point> vertical(Bounds source, Bounds target, boolean down, boolean sourceBlackBox,
                                 boolean targetBlackBox, List<Bounds> obstacles) {
        double startX = source.centerX();
        double endX = target.centerX();
        if (targetBlackBox && !sourceBlackBox) {
            endX = clamp(startX, target.x(), target.right());
        } else if (sourceBlackBox && !targetBlackBox) {
            startX = clamp(endX, source.x(), source.right());
        }
        Point start = new Point(startX, down ? source.bottom() : source.y());
        Point end = new Point(endX, down ? target.y() : target.bottom());

        List<Point> route = new ArrayList<>();
        route.add(start);
        double dx = Math.abs(start.x() - end.x());
        if (dx > STRAIGHT_TOLERANCE) {
            double routeY = dx > config.messageFlowLongDistance()
                    ? end.y() + (down ? -config.messageFlowJog() : config.messageFlowJog())
                    : (start.y() + end.y()) / 2;
            route.add(new Point(start.x(), routeY));
            route.add(new Point(end.x(), routeY));
        }
        route.add(end);
        if (!blocked(route, obstacles)) {
            return route;
        }

        double jog = down ? config.messageFlowJog() : -config.messageFlowJog();
        double clearX = clearLane((start.x() + end.x()) / 2, start.y(), end.y(), obstacles);
        List<Point> detour = new ArrayList<>();
        detour.add(start);
        detour.add(new Point(start.x(), start.y() + jog));
        detour.add(new Point(clearX, start.y() + jog));
        detour.add(new Point(clearX, end.y() - jog));
        detour.add(new Point(end.x(), end.y() - jog));
        detour.add(end);
        return Geometry.simplify(detour);
    }

    private List<Point> horizontal(Bounds source, Bounds target, List<Bounds> obstacles) {
        boolean right = target.centerX() >= source.centerX();
        Point start = new Point(right ? source.right() : source.x(), source.centerY());
        Point end = new Point(right ? target.x() : target.right(), target.centerY());

        List<Point> route = new ArrayList<>();
        route.add(start);
        double midX = (start.x() + end.x()) / 2;
        if (Math.abs(start.y() - end.y()) > SAME_LEVEL_TOLERANCE) {
            Double clearX = Geometry.findClearHorizontalPath(start.y(), start.x(), end.x(), obstacles);
            if (clearX != null) {
                midX = clearX;
            }
            route.add(new Point(midX, start.y()));
            route.add(new Point(midX, end.y()));
        }
        route.add(end);
        return route;
    }

    private static boolean blocked(List<Point> route, List<Bounds> obstacles) {
        for (int i = 0; i < route.size() - 1; i++) {
            for (Bounds obstacle : obstacles) {
                if (Geometry.segmentCrossesNode(route.get(i), route.get(i + 1), obstacle)) {
                    return true;
                }
            }
        }
        return false;
    }

    private record Interval(double from, double to) {
    }

    /**
     * X closest to {@code desiredX} at which a vertical line between the two y values meets no
     * obstacle. The x ranges of the obstacles in that band are merged; candidates are the gaps
     * between them and the two sides of the whole row.
     */
    static double clearLane(double desiredX, double fromY, double toY, List<Bounds> obstacles) {
        double minY = Math.min(fromY, toY);
        double maxY = Math.max(fromY, toY);
        double margin = Geometry.COLLISION_MARGIN;
        List<Interval> intervals = new ArrayList<>();
        for (Bounds obstacle : obstacles) {
            if (obstacle.bottom() > minY && obstacle.y() < maxY) {
                intervals.add(new Interval(obstacle.x() - margin, obstacle.right() + margin));
            }
        }
        if (intervals.isEmpty()) {
            return desiredX;
        }
        intervals.sort(Comparator.comparingDouble(Interval::from));
        List<Interval> merged = new ArrayList<>();
        Interval current = intervals.get(0);
        for (Interval next : intervals.subList(1, intervals.size())) {
            if (next.from() <= current.to()) {
                current = new Interval(current.from(), Math.max(current.to(), next.to()));
            } else {
                merged.add(current);
                current = next;
            }
        }
        merged.add(current);
        if (merged.stream().noneMatch(i -> desiredX > i.from() && desiredX < i.to())) {
            return desiredX;
        }

        List<Double> candidates = new ArrayList<>();
        for (int i = 0; i < merged.size() - 1; i++) {
            double gapFrom = merged.get(i).to();
            double gapTo = merged.get(i + 1).from();
            if (gapTo - gapFrom >= 2 * margin) {
                candidates.add(clamp(desiredX, gapFrom + margin, gapTo - margin));
            }
        }
        candidates.add(merged.get(0).from());
        candidates.add(merged.get(merged.size() - 1).to());

        double best = candidates.get(0);
        for (double candidate : candidates) {
            if (Math.abs(candidate - desiredX) < Math.abs(best - desiredX)) {
                best = candidate;
            }
        }
        return best;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
