package org.camunda.bpm.getstarted.bpmnlayout.preparation;

import org.camunda.bpm.getstarted.bpmnlayout.LayoutConfig;
import org.camunda.bpm.getstarted.bpmnlayout.LayoutTrace;
import org.camunda.bpm.getstarted.bpmnlayout.boundary.BoundarySeats;
import org.camunda.bpm.getstarted.bpmnlayout.index.NodeIndex;
import org.camunda.bpm.getstarted.bpmnlayout.models.Bounds;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnEdge;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.camunda.bpm.getstarted.bpmnlayout.models.Label;
import org.camunda.bpm.getstarted.bpmnlayout.models.Point;
import org.camunda.bpm.getstarted.bpmnlayout.models.Port;

import java.util.ArrayList;
import java.util.List;

/**
 * Copies the geometry of the laid out tree back onto the caller's tree.
 * <p>
 * The laid out tree does not share the caller's structure (lanes and pools may have been dissolved
 * and rebuilt, boundary events are siblings of their host), so elements are matched by id and every
 * position goes through diagram coordinates. Boundary events are seated on the bottom edge of their
 * host, spread evenly over its width.
 */
public class ResultMerger {
    // boundary branch routes leave the event downwards before turning
    private static final double BOUNDARY_EXIT_LENGTH = 20;
    private static final double STRAIGHT_TOLERANCE = 10;

    private final LayoutConfig config;
    private final LayoutTrace trace;

    public ResultMerger(LayoutConfig config, LayoutTrace trace) {
        this.config = config;
        this.trace = trace;
    }

    /**
     * Writes positions, sizes, label positions and routes from {@code layouted} into
     * {@code original} and returns {@code original}.
     */
    public BpmnNode merge(BpmnNode original, BpmnNode layouted) {
        NodeIndex laidOut = NodeIndex.build(layouted);
        original.width = layouted.width;
        original.height = layouted.height;
        copyLabels(original.labels, layouted.labels, new Point(0, 0), new Point(0, 0));
        mergeChildren(original, new Point(original.xValue(), original.yValue()), laidOut);

        NodeIndex merged = NodeIndex.build(original);
        mergeEdges(original, laidOut, merged);
        return original;
    }

    private void mergeChildren(BpmnNode parent, Point parentOrigin, NodeIndex laidOut) {
        for (BpmnNode child : parent.childrenOrEmpty()) {
            Point origin;
            BpmnNode source = laidOut.node(child.id);
            if (source != null) {
                origin = laidOut.absoluteOrigin(child.id);
                child.setPosition(origin.x() - parentOrigin.x(), origin.y() - parentOrigin.y());
                child.setSize(source.widthValue(), source.heightValue());
                copyLabels(child.labels, source.labels, origin, origin);
                copyPorts(child.ports, source.ports);
            } else {
                trace.trace("[Merge] {} was not laid out, keeping its position", child.id);
                origin = parentOrigin.translate(child.xValue(), child.yValue());
            }
            seatBoundaryEvents(child);
            mergeChildren(child, origin, laidOut);
        }
    }

    private void seatBoundaryEvents(BpmnNode host) {
        List<BpmnNode> events = host.boundaryEventsOrEmpty();
        if (events.isEmpty()) {
            return;
        }
        for (int i = 0; i < events.size(); i++) {
            BpmnNode event = events.get(i);
            double width = event.width == null ? config.boundaryEventWidth() : event.width;
            double height = event.height == null ? config.boundaryEventWidth() : event.height;
            Bounds seat = BoundarySeats.seat(host.bounds(), i, events.size(), config.boundaryEventPitch(), width,
                    height);
            event.setSize(width, height);
            event.setPosition(seat.x(), seat.y());
        }
    }

    private void mergeEdges(BpmnNode owner, NodeIndex laidOut, NodeIndex merged) {
        for (BpmnEdge edge : owner.edgesOrEmpty()) {
            NodeIndex.EdgeRef source = laidOut.edge(edge.id);
            if (source == null || !source.edge().hasRoute()) {
                trace.trace("[Merge] edge {} has no route", edge.id);
                continue;
            }
            List<Point> route = laidOut.absoluteWaypoints(source.edge());
            edge.markCoordinateSpace(source.edge().coordinateSpace());

            if (merged.isBoundaryEvent(edge.sourceId()) && merged.contains(edge.targetId())) {
                route = seatedBoundaryRoute(route, merged.absoluteBounds(edge.sourceId()),
                        merged.absoluteBounds(edge.targetId()));
            }
            merged.setAbsoluteRoute(edge, route);
            copyLabels(edge.labels, source.edge().labels, laidOut.contentOrigin(source.owner().id),
                    merged.contentOrigin(owner.id));
        }
        for (BpmnNode child : owner.childrenOrEmpty()) {
            mergeEdges(child, laidOut, merged);
        }
    }

    /**
     * Keeps a route that already leaves the seated event from its bottom centre, otherwise routes
     * down from the event and into the side of the target facing it.
     */
    static List<Point> seatedBoundaryRoute(List<Point> route, Bounds event, Bounds target) {
        Point start = new Point(event.centerX(), event.bottom());
        if (!route.isEmpty() && route.get(0).distanceTo(start) < 1) {
            return route;
        }

        Point end;
        if (target.y() > event.bottom()) {
            end = new Point(target.centerX(), target.y());
        } else if (target.x() > event.right()) {
            end = new Point(target.x(), target.centerY());
        } else if (target.right() < event.x()) {
            end = new Point(target.right(), target.centerY());
        } else {
            end = new Point(target.centerX(), target.bottom());
        }

        List<Point> seated = new ArrayList<>();
        seated.add(start);
        if (Math.abs(start.x() - end.x()) > STRAIGHT_TOLERANCE && Math.abs(start.y() - end.y()) > STRAIGHT_TOLERANCE) {
            boolean entersFromTop = end.y() == target.y();
            if (entersFromTop) {
                double turnY = start.y() + BOUNDARY_EXIT_LENGTH;
                seated.add(new Point(start.x(), turnY));
                seated.add(new Point(end.x(), turnY));
            } else if (end.y() > start.y()) {
                seated.add(new Point(start.x(), end.y()));
            } else {
                double turnY = start.y() + BOUNDARY_EXIT_LENGTH;
                double midX = (start.x() + end.x()) / 2;
                seated.add(new Point(start.x(), turnY));
                seated.add(new Point(midX, turnY));
                seated.add(new Point(midX, end.y()));
            }
        }
        seated.add(end);
        return seated;
    }

    private static void copyLabels(List<Label> target, List<Label> source, Point sourceOrigin, Point targetOrigin) {
        if (target == null || source == null) {
            return;
        }
        for (int i = 0; i < target.size() && i < source.size(); i++) {
            Label from = source.get(i);
            Label to = target.get(i);
            if (from.x != null && from.y != null) {
                to.x = from.x + sourceOrigin.x() - targetOrigin.x();
                to.y = from.y + sourceOrigin.y() - targetOrigin.y();
            }
            to.width = from.width == null ? to.width : from.width;
            to.height = from.height == null ? to.height : from.height;
        }
    }

    private static void copyPorts(List<Port> target, List<Port> source) {
        if (target == null || source == null) {
            return;
        }
        for (Port to : target) {
            for (Port from : source) {
                if (to.id != null && to.id.equals(from.id)) {
                    to.x = from.x;
                    to.y = from.y;
                    to.width = from.width;
                    to.height = from.height;
                }
            }
        }
    }
}
