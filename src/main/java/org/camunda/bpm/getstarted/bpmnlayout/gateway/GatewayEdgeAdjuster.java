package org.camunda.bpm.getstarted.bpmnlayout.gateway;

import org.camunda.bpm.getstarted.bpmnlayout.LayoutConfig;
import org.camunda.bpm.getstarted.bpmnlayout.LayoutTrace;
import org.camunda.bpm.getstarted.bpmnlayout.index.NodeIndex;
import org.camunda.bpm.getstarted.bpmnlayout.models.Bounds;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnEdge;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnTypes;
import org.camunda.bpm.getstarted.bpmnlayout.models.Point;
import org.camunda.bpm.getstarted.bpmnlayout.routing.Geometry;

import java.util.List;

/**
 * Moves edge endpoints at gateways from the bounding box onto the diamond: the four corners are the
 * midpoints of the box sides.
 */
public class GatewayEdgeAdjuster {
    private static final double ALIGNED = 5;

    private final double snapTolerance;
    private final double bendAlignTolerance;
    private final LayoutTrace trace;

    public GatewayEdgeAdjuster(LayoutConfig config, LayoutTrace trace) {
        this.snapTolerance = config.gatewaySnapTolerance();
        this.bendAlignTolerance = config.gatewayBendAlignTolerance();
        this.trace = trace;
    }

    public record Diamond(Point left, Point top, Point right, Point bottom) {
        public static Diamond of(Bounds bounds) {
            return new Diamond(
                    new Point(bounds.x(), bounds.centerY()),
                    new Point(bounds.centerX(), bounds.y()),
                    new Point(bounds.right(), bounds.centerY()),
                    new Point(bounds.centerX(), bounds.bottom()));
        }

        public List<Point> corners() {
            return List.of(left, top, right, bottom);
        }

        public Point closestCorner(Point point) {
            Point closest = left;
            for (Point corner : corners()) {
                if (corner.distanceTo(point) < closest.distanceTo(point)) {
                    closest = corner;
                }
            }
            return closest;
        }

        /**
         * Where the segment from-to crosses one of the four diamond sides, or null.
         */
        public Point intersection(Point from, Point to) {
            Point[][] sides = {{left, top}, {top, right}, {right, bottom}, {bottom, left}};
            for (Point[] side : sides) {
                Point hit = Geometry.lineIntersection(from, to, side[0], side[1]);
                if (hit != null) {
                    return hit;
                }
            }
            return null;
        }
    }

    public void adjust(BpmnNode graph) {
        NodeIndex index = NodeIndex.build(graph);
        for (NodeIndex.EdgeRef ref : index.edges()) {
            BpmnEdge edge = ref.edge();
            if (!edge.hasRoute()) {
                continue;
            }
            BpmnNode source = index.node(edge.sourceId());
            BpmnNode target = index.node(edge.targetId());
            boolean sourceIsGateway = source != null && BpmnTypes.isGateway(source.type());
            boolean targetIsGateway = target != null && BpmnTypes.isGateway(target.type());
            if (!sourceIsGateway && !targetIsGateway) {
                continue;
            }

            List<Point> route = index.absoluteWaypoints(edge);
            if (sourceIsGateway) {
                route = adjustStart(route, Diamond.of(index.absoluteBounds(source.id)));
            }
            if (targetIsGateway) {
                route = adjustEnd(route, Diamond.of(index.absoluteBounds(target.id)));
            }
            index.setAbsoluteRoute(edge, route);
            trace.trace("Edge {} attached to gateway diamond", edge.id);
        }
    }

    /**
     * The leaving point snaps to the nearest corner. A first bend close to the corner on one axis is
     * aligned with it.
     */
    List<Point> adjustStart(List<Point> route, Diamond diamond) {
        Point start = route.get(0);
        Point corner = diamond.closestCorner(start);
        if (route.size() > 2) {
            route.set(0, corner);
            Point firstBend = route.get(1);
            if (Math.abs(firstBend.x() - corner.x()) < bendAlignTolerance) {
                route.set(1, firstBend.withX(corner.x()));
            } else if (Math.abs(firstBend.y() - corner.y()) < bendAlignTolerance) {
                route.set(1, firstBend.withY(corner.y()));
            }
            return route;
        }
        return Geometry.moveEndpoint(route, true, corner.x() - start.x(), corner.y() - start.y());
    }

    /**
     * The entering corner follows the approach direction. Close enough endpoints snap to it, others
     * are cut at the diamond border.
     */
    List<Point> adjustEnd(List<Point> route, Diamond diamond) {
        int last = route.size() - 1;
        Point end = route.get(last);
        Point previous = route.get(last - 1);
        double dx = end.x() - previous.x();
        double dy = end.y() - previous.y();

        Point corner;
        if (Math.abs(dx) > Math.abs(dy)) {
            corner = dx > 0 ? diamond.left() : diamond.right();
        } else {
            corner = dy > 0 ? diamond.top() : diamond.bottom();
        }

        if (end.distanceTo(corner) < snapTolerance) {
            if (route.size() > 2) {
                route.set(last, corner);
                if (Math.abs(previous.y() - end.y()) < ALIGNED) {
                    route.set(last - 1, previous.withY(corner.y()));
                } else if (Math.abs(previous.x() - end.x()) < ALIGNED) {
                    route.set(last - 1, previous.withX(corner.x()));
                }
                return route;
            }
            return Geometry.moveEndpoint(route, false, corner.x() - end.x(), corner.y() - end.y());
        }

        Point hit = diamond.intersection(previous, end);
        if (hit != null) {
            route.set(last, hit);
            return route;
        }
        return Geometry.moveEndpoint(route, false, corner.x() - end.x(), corner.y() - end.y());
    }
}
