package org.camunda.bpm.getstarted.bpmnlayout.routing;

import org.camunda.bpm.getstarted.bpmnlayout.models.Bounds;
import org.camunda.bpm.getstarted.bpmnlayout.models.Point;

import java.util.ArrayList;
import java.util.List;

/**
 * Segment and rectangle helpers shared by the routing stages. Routes are lists of points,
 * start first, end last.
 */
public final class Geometry {
    public static final double COLLISION_MARGIN = 5;
    private static final double CLEAR_PATH_MARGIN = 10;
    private static final double AXIS_TOLERANCE = 1;
    private static final double CROSSING_PENALTY = 1000;
    private static final double LENGTH_WEIGHT = 0.1;

    private Geometry() {
    }

    public static double pathLength(List<Point> points) {
        double length = 0;
        for (int i = 0; i < points.size() - 1; i++) {
            length += points.get(i).distanceTo(points.get(i + 1));
        }
        return length;
    }

    /**
     * Whether the segment touches the rectangle grown by {@link #COLLISION_MARGIN}.
     * Segments that are neither horizontal nor vertical count as intersecting.
     */
    public static boolean segmentIntersectsRect(Point p1, Point p2, Bounds rect) {
        double left = rect.x() - COLLISION_MARGIN;
        double right = rect.right() + COLLISION_MARGIN;
        double top = rect.y() - COLLISION_MARGIN;
        double bottom = rect.bottom() + COLLISION_MARGIN;

        if ((p1.x() < left && p2.x() < left) || (p1.x() > right && p2.x() > right)) {
            return false;
        }
        if ((p1.y() < top && p2.y() < top) || (p1.y() > bottom && p2.y() > bottom)) {
            return false;
        }

        if (Math.abs(p1.x() - p2.x()) < AXIS_TOLERANCE) {
            double minY = Math.min(p1.y(), p2.y());
            double maxY = Math.max(p1.y(), p2.y());
            return p1.x() >= left && p1.x() <= right && maxY >= top && minY <= bottom;
        }
        if (Math.abs(p1.y() - p2.y()) < AXIS_TOLERANCE) {
            double minX = Math.min(p1.x(), p2.x());
            double maxX = Math.max(p1.x(), p2.x());
            return p1.y() >= top && p1.y() <= bottom && maxX >= left && minX <= right;
        }
        return true;
    }

    /**
     * Stricter than {@link #segmentIntersectsRect}: the segment has to pass through the node's
     * interior, touching its border is not enough.
     */
    public static boolean segmentCrossesNode(Point p1, Point p2, Bounds node) {
        double m = COLLISION_MARGIN;
        if (Math.abs(p1.y() - p2.y()) < AXIS_TOLERANCE) {
            double y = p1.y();
            double minX = Math.min(p1.x(), p2.x());
            double maxX = Math.max(p1.x(), p2.x());
            if (y > node.y() - m && y < node.bottom() + m && minX < node.right() + m && maxX > node.x() - m) {
                return minX < node.right() - m && maxX > node.x() + m;
            }
        }
        if (Math.abs(p1.x() - p2.x()) < AXIS_TOLERANCE) {
            double x = p1.x();
            double minY = Math.min(p1.y(), p2.y());
            double maxY = Math.max(p1.y(), p2.y());
            if (x > node.x() - m && x < node.right() + m && minY < node.bottom() + m && maxY > node.y() - m) {
                return minY < node.bottom() - m && maxY > node.y() + m;
            }
        }
        return false;
    }

    public static boolean routeIntersects(List<Point> route, Bounds rect) {
        for (int i = 0; i < route.size() - 1; i++) {
            if (segmentIntersectsRect(route.get(i), route.get(i + 1), rect)) {
                return true;
            }
        }
        return false;
    }

    public static int countCrossings(List<Point> route, List<Bounds> obstacles) {
        int crossings = 0;
        for (Bounds obstacle : obstacles) {
            for (int i = 0; i < route.size() - 1; i++) {
                if (segmentIntersectsRect(route.get(i), route.get(i + 1), obstacle)) {
                    crossings++;
                }
            }
        }
        return crossings;
    }

    /**
     * Lower is better: 1000 per segment crossing an obstacle plus a tenth of the route length.
     */
    public static double scoreRoute(List<Point> route, List<Bounds> obstacles) {
        return countCrossings(route, obstacles) * CROSSING_PENALTY + pathLength(route) * LENGTH_WEIGHT;
    }

    public static boolean boundsOverlap(Bounds a, Bounds b, double margin) {
        return !(a.right() + margin < b.x() || b.right() + margin < a.x()
                || a.bottom() + margin < b.y() || b.bottom() + margin < a.y());
    }

    /**
     * Leaving and entering sides chosen from the dominant axis of the centre-to-centre vector.
     */
    public static Side[] bestConnectionSides(Bounds source, Bounds target) {
        double dx = target.centerX() - source.centerX();
        double dy = target.centerY() - source.centerY();
        if (Math.abs(dx) > Math.abs(dy)) {
            return dx > 0 ? new Side[]{Side.RIGHT, Side.LEFT} : new Side[]{Side.LEFT, Side.RIGHT};
        }
        return dy > 0 ? new Side[]{Side.BOTTOM, Side.TOP} : new Side[]{Side.TOP, Side.BOTTOM};
    }

    /**
     * Straight when the points are (almost) aligned, otherwise a Z through the middle of the
     * primary axis.
     */
    public static List<Point> orthogonalPath(Point start, Point end, boolean horizontalFirst) {
        List<Point> points = new ArrayList<>();
        points.add(start);
        double dx = Math.abs(end.x() - start.x());
        double dy = Math.abs(end.y() - start.y());
        if (dx < 5 || dy < 5) {
            points.add(end);
            return points;
        }
        if (horizontalFirst) {
            double midX = (start.x() + end.x()) / 2;
            points.add(new Point(midX, start.y()));
            points.add(new Point(midX, end.y()));
        } else {
            double midY = (start.y() + end.y()) / 2;
            points.add(new Point(start.x(), midY));
            points.add(new Point(end.x(), midY));
        }
        points.add(end);
        return points;
    }

    /**
     * Y to detour through when an obstacle blocks the vertical line at x, or null when clear.
     */
    public static Double findClearVerticalPath(double x, double startY, double endY, List<Bounds> obstacles) {
        double minY = Math.min(startY, endY);
        double maxY = Math.max(startY, endY);
        for (Bounds obs : obstacles) {
            if (x >= obs.x() - CLEAR_PATH_MARGIN && x <= obs.right() + CLEAR_PATH_MARGIN
                    && obs.bottom() > minY && obs.y() < maxY) {
                double spaceAbove = obs.y() - minY;
                double spaceBelow = maxY - obs.bottom();
                if (spaceBelow > spaceAbove && obs.bottom() + CLEAR_PATH_MARGIN < maxY) {
                    return obs.bottom() + CLEAR_PATH_MARGIN;
                } else if (obs.y() - CLEAR_PATH_MARGIN > minY) {
                    return obs.y() - CLEAR_PATH_MARGIN;
                }
            }
        }
        return null;
    }

    /**
     * X to detour through when an obstacle blocks the horizontal line at y, or null when clear.
     */
    public static Double findClearHorizontalPath(double y, double startX, double endX, List<Bounds> obstacles) {
        double minX = Math.min(startX, endX);
        double maxX = Math.max(startX, endX);
        for (Bounds obs : obstacles) {
            if (y >= obs.y() - CLEAR_PATH_MARGIN && y <= obs.bottom() + CLEAR_PATH_MARGIN
                    && obs.right() > minX && obs.x() < maxX) {
                double spaceLeft = obs.x() - minX;
                double spaceRight = maxX - obs.right();
                if (spaceRight > spaceLeft && obs.right() + CLEAR_PATH_MARGIN < maxX) {
                    return obs.right() + CLEAR_PATH_MARGIN;
                } else if (obs.x() - CLEAR_PATH_MARGIN > minX) {
                    return obs.x() - CLEAR_PATH_MARGIN;
                }
            }
        }
        return null;
    }

    /**
     * Intersection of segments p1-p2 and p3-p4, or null if they do not meet.
     */
    public static Point lineIntersection(Point p1, Point p2, Point p3, Point p4) {
        double denom = (p4.y() - p3.y()) * (p2.x() - p1.x()) - (p4.x() - p3.x()) * (p2.y() - p1.y());
        if (Math.abs(denom) < 0.0001) {
            return null;
        }
        double ua = ((p4.x() - p3.x()) * (p1.y() - p3.y()) - (p4.y() - p3.y()) * (p1.x() - p3.x())) / denom;
        double ub = ((p2.x() - p1.x()) * (p1.y() - p3.y()) - (p2.y() - p1.y()) * (p1.x() - p3.x())) / denom;
        if (ua >= 0 && ua <= 1 && ub >= 0 && ub <= 1) {
            return new Point(p1.x() + ua * (p2.x() - p1.x()), p1.y() + ua * (p2.y() - p1.y()));
        }
        return null;
    }

    /**
     * Drops repeated points and middle points of straight runs.
     */
    public static List<Point> simplify(List<Point> route) {
        List<Point> deduplicated = new ArrayList<>();
        for (Point p : route) {
            if (deduplicated.isEmpty() || !samePoint(deduplicated.get(deduplicated.size() - 1), p)) {
                deduplicated.add(p);
            }
        }
        if (deduplicated.size() < 3) {
            return deduplicated;
        }
        List<Point> result = new ArrayList<>();
        result.add(deduplicated.get(0));
        for (int i = 1; i < deduplicated.size() - 1; i++) {
            Point prev = result.get(result.size() - 1);
            Point current = deduplicated.get(i);
            Point next = deduplicated.get(i + 1);
            boolean vertical = Math.abs(prev.x() - current.x()) < AXIS_TOLERANCE
                    && Math.abs(current.x() - next.x()) < AXIS_TOLERANCE;
            boolean horizontal = Math.abs(prev.y() - current.y()) < AXIS_TOLERANCE
                    && Math.abs(current.y() - next.y()) < AXIS_TOLERANCE;
            if (!vertical && !horizontal) {
                result.add(current);
            }
        }
        result.add(deduplicated.get(deduplicated.size() - 1));
        return result;
    }

    public static boolean isOrthogonal(List<Point> route) {
        for (int i = 0; i < route.size() - 1; i++) {
            Point a = route.get(i);
            Point b = route.get(i + 1);
            if (Math.abs(a.x() - b.x()) >= AXIS_TOLERANCE && Math.abs(a.y() - b.y()) >= AXIS_TOLERANCE) {
                return false;
            }
        }
        return true;
    }

    /**
     * Moves the first (or last) point of a route and keeps the adjacent segment axis-aligned by
     * dragging the neighbouring bend point along. A straight route gets a jog in the middle.
     */
    public static List<Point> moveEndpoint(List<Point> route, boolean atStart, double dx, double dy) {
        List<Point> points = new ArrayList<>(route);
        if (points.size() < 2) {
            return points;
        }
        int endIndex = atStart ? 0 : points.size() - 1;
        int neighbourIndex = atStart ? 1 : points.size() - 2;
        Point end = points.get(endIndex);
        Point neighbour = points.get(neighbourIndex);
        boolean horizontal = Math.abs(end.y() - neighbour.y()) < AXIS_TOLERANCE;
        boolean vertical = Math.abs(end.x() - neighbour.x()) < AXIS_TOLERANCE;
        Point moved = end.translate(dx, dy);
        points.set(endIndex, moved);

        if (points.size() == 2) {
            Point start = points.get(0);
            Point finish = points.get(1);
            return horizontal ? orthogonalPath(start, finish, true) : orthogonalPath(start, finish, !vertical);
        }
        if (horizontal) {
            points.set(neighbourIndex, neighbour.withY(moved.y()));
        } else if (vertical) {
            points.set(neighbourIndex, neighbour.withX(moved.x()));
        }
        return points;
    }

    private static boolean samePoint(Point a, Point b) {
        return Math.abs(a.x() - b.x()) < 0.01 && Math.abs(a.y() - b.y()) < 0.01;
    }
}
