package org.camunda.bpm.getstarted.bpmnlayout.lane;

import org.camunda.bpm.getstarted.bpmnlayout.LayoutConfig;
import org.camunda.bpm.getstarted.bpmnlayout.LayoutTrace;
import org.camunda.bpm.getstarted.bpmnlayout.index.NodeIndex;
import org.camunda.bpm.getstarted.bpmnlayout.models.Bounds;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnEdge;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnTypes;
import org.camunda.bpm.getstarted.bpmnlayout.models.CoordinateSpace;
import org.camunda.bpm.getstarted.bpmnlayout.models.Point;
import org.camunda.bpm.getstarted.bpmnlayout.options.ElkOptions;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Puts lanes back into pools after layout.
 * <p>
 * The engine lays out a pool's content without its lanes. Afterwards every node goes back into its
 * innermost lane: lanes are stacked without gaps in partition order, each as high as its content
 * plus some air, with the content centred vertically. All lanes of a pool share the pool's content
 * width, nested lanes lose the parent lane's header. The pool's flows are then routed again from
 * side to side.
 */
public class LaneArranger {
    // flows whose ends differ less than this in y stay straight
    private static final double STRAIGHT_TOLERANCE = 10;

    private final LayoutConfig config;
    private final LayoutTrace trace;

    public LaneArranger(LayoutConfig config, LayoutTrace trace) {
        this.config = config;
        this.trace = trace;
    }

    /**
     * @param layouted      tree returned by the engine, pools still without lanes
     * @param original      caller's tree holding the lane structure
     * @param boundaryHosts boundary event id to host id, events join their host's lane
     */
    public void rearrange(BpmnNode layouted, BpmnNode original, Map<String, String> boundaryHosts) {
        NodeIndex index = NodeIndex.build(layouted);
        List<BpmnNode> pools = new ArrayList<>();
        collectPoolsWithLanes(original, pools);
        if (pools.isEmpty()) {
            return;
        }
        trace.stage("Lanes");
        for (BpmnNode originalPool : pools) {
            BpmnNode pool = index.node(originalPool.id);
            if (pool == null || !pool.isType(BpmnTypes.PARTICIPANT) || !pool.hasChildren()) {
                // dissolved into a collaboration with cross-pool flows
                continue;
            }
            arrangePool(pool, originalPool, boundaryHosts);
        }
        recalculatePoolEdges(layouted, pools);
    }

    private static void collectPoolsWithLanes(BpmnNode node, List<BpmnNode> pools) {
        for (BpmnNode child : node.childrenOrEmpty()) {
            if (child.isType(BpmnTypes.PARTICIPANT)) {
                if (hasLanes(child)) {
                    pools.add(child);
                }
            } else {
                collectPoolsWithLanes(child, pools);
            }
        }
    }

    static boolean hasLanes(BpmnNode node) {
        return node.childrenOrEmpty().stream().anyMatch(c -> c.isType(BpmnTypes.LANE));
    }

    private void arrangePool(BpmnNode pool, BpmnNode originalPool, Map<String, String> boundaryHosts) {
        Map<String, String> nodeToLane = new HashMap<>();
        mapNodesToLanes(originalPool.childrenOrEmpty(), nodeToLane);
        boundaryHosts.forEach((eventId, hostId) -> {
            String lane = nodeToLane.get(hostId);
            if (lane != null) {
                nodeToLane.put(eventId, lane);
            }
        });

        Map<String, List<BpmnNode>> laneContent = new LinkedHashMap<>();
        List<BpmnNode> unassigned = new ArrayList<>();
        double maxRight = 0;
        for (BpmnNode child : pool.childrenOrEmpty()) {
            maxRight = Math.max(maxRight, child.bounds().right());
            String lane = nodeToLane.get(child.id);
            if (lane == null) {
                unassigned.add(child);
            } else {
                laneContent.computeIfAbsent(lane, k -> new ArrayList<>()).add(child);
            }
        }

        double contentWidth = maxRight + config.laneExtraWidth();
        List<BpmnNode> lanes = new ArrayList<>();
        double height = stackLanes(originalPool.childrenOrEmpty(), laneContent, contentWidth, lanes);

        List<BpmnNode> children = new ArrayList<>(lanes);
        children.addAll(unassigned);
        pool.children = children;
        pool.setSize(config.laneHeaderWidth() + contentWidth, height);
        trace.trace("[Lanes] pool {} rebuilt with {} lanes, {}x{}", pool.id, lanes.size(), pool.width, pool.height);
    }

    /**
     * Maps every node to its innermost lane. Nodes sitting next to nested lanes go into the first
     * nested lane.
     */
    private static void mapNodesToLanes(List<BpmnNode> children, Map<String, String> nodeToLane) {
        for (BpmnNode lane : children) {
            if (!lane.isType(BpmnTypes.LANE)) {
                continue;
            }
            List<BpmnNode> nested = sortedLanes(lane.childrenOrEmpty());
            if (nested.isEmpty()) {
                for (BpmnNode node : lane.childrenOrEmpty()) {
                    nodeToLane.put(node.id, lane.id);
                }
                continue;
            }
            mapNodesToLanes(nested, nodeToLane);
            String first = innermostFirstLane(nested.get(0));
            for (BpmnNode node : lane.childrenOrEmpty()) {
                if (!node.isType(BpmnTypes.LANE)) {
                    nodeToLane.put(node.id, first);
                }
            }
        }
    }

    private static String innermostFirstLane(BpmnNode lane) {
        List<BpmnNode> nested = sortedLanes(lane.childrenOrEmpty());
        return nested.isEmpty() ? lane.id : innermostFirstLane(nested.get(0));
    }

    static List<BpmnNode> sortedLanes(List<BpmnNode> children) {
        List<BpmnNode> lanes = new ArrayList<>();
        for (BpmnNode child : children) {
            if (child.isType(BpmnTypes.LANE)) {
                lanes.add(child);
            }
        }
        lanes.sort(Comparator.comparingInt(lane -> ElkOptions.partition(lane.id, lane.layoutOptions)));
        return lanes;
    }

    /**
     * Builds the lanes found in {@code originalChildren} into {@code result}, stacked from y 0.
     *
     * @return total height of the stack
     */
    private double stackLanes(List<BpmnNode> originalChildren, Map<String, List<BpmnNode>> laneContent,
                              double width, List<BpmnNode> result) {
        double currentY = 0;
        for (BpmnNode originalLane : sortedLanes(originalChildren)) {
            BpmnNode lane = new BpmnNode();
            lane.id = originalLane.id;
            lane.bpmn = originalLane.bpmn;

            if (hasLanes(originalLane)) {
                double nestedWidth = width - config.laneHeaderWidth();
                List<BpmnNode> nested = new ArrayList<>();
                double nestedHeight = stackLanes(originalLane.childrenOrEmpty(), laneContent, nestedWidth, nested);
                for (BpmnNode nestedLane : nested) {
                    nestedLane.width = nestedWidth;
                }
                lane.children = nested;
                lane.setPosition(config.laneHeaderWidth(), currentY);
                lane.setSize(width, nestedHeight);
            } else {
                List<BpmnNode> content = laneContent.getOrDefault(originalLane.id, List.of());
                double minY = Double.POSITIVE_INFINITY;
                double maxY = Double.NEGATIVE_INFINITY;
                for (BpmnNode node : content) {
                    minY = Math.min(minY, node.yValue());
                    maxY = Math.max(maxY, node.bounds().bottom());
                }
                double contentHeight = content.isEmpty() ? config.emptyLaneContentHeight() : maxY - minY;
                if (!content.isEmpty()) {
                    double offset = config.laneExtraHeight() / 2 - minY;
                    for (BpmnNode node : content) {
                        node.y = node.yValue() + offset;
                    }
                    lane.children = new ArrayList<>(content);
                }
                lane.setPosition(config.laneHeaderWidth(), currentY);
                lane.setSize(width, contentHeight + config.laneExtraHeight());
            }
            result.add(lane);
            currentY += lane.heightValue();
        }
        return currentY;
    }

    /**
     * Routes the flows owned by a rebuilt pool from the source's right side to the target's left
     * side, with a vertical jog in the middle when they sit at different heights.
     */
    private void recalculatePoolEdges(BpmnNode layouted, List<BpmnNode> pools) {
        NodeIndex index = NodeIndex.build(layouted);
        for (BpmnNode originalPool : pools) {
            BpmnNode pool = index.node(originalPool.id);
            if (pool == null) {
                continue;
            }
            for (BpmnEdge edge : pool.edgesOrEmpty()) {
                if (!index.contains(edge.sourceId()) || !index.contains(edge.targetId())) {
                    continue;
                }
                List<Point> route = sideToSideRoute(index.absoluteBounds(edge.sourceId()),
                        index.absoluteBounds(edge.targetId()));
                if (!edge.coordinateSpaceMarked()) {
                    edge.markCoordinateSpace(CoordinateSpace.POOL);
                }
                index.setAbsoluteRoute(edge, route);
            }
        }
    }

    static List<Point> sideToSideRoute(Bounds source, Bounds target) {
        if (target.x() <= source.right()) {
            return overlappingRoute(source, target);
        }
        Point start = new Point(source.right(), source.centerY());
        Point end = new Point(target.x(), target.centerY());
        List<Point> route = new ArrayList<>();
        route.add(start);
        if (Math.abs(start.y() - end.y()) > STRAIGHT_TOLERANCE) {
            double midX = (start.x() + end.x()) / 2;
            route.add(new Point(midX, start.y()));
            route.add(new Point(midX, end.y()));
        }
        route.add(end);
        return route;
    }

    /**
     * Source and target overlap horizontally: leave through the bottom (or top) and enter the
     * facing side of the target.
     */
    private static List<Point> overlappingRoute(Bounds source, Bounds target) {
        boolean down = target.centerY() >= source.centerY();
        Point start = new Point(source.centerX(), down ? source.bottom() : source.y());
        Point end = new Point(target.centerX(), down ? target.y() : target.bottom());
        List<Point> route = new ArrayList<>();
        route.add(start);
        if (Math.abs(start.x() - end.x()) > STRAIGHT_TOLERANCE) {
            double midY = (start.y() + end.y()) / 2;
            route.add(new Point(start.x(), midY));
            route.add(new Point(end.x(), midY));
        }
        route.add(end);
        return route;
    }
}
