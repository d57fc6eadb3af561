package org.camunda.bpm.getstarted.bpmnlayout.normalization;

import org.camunda.bpm.getstarted.bpmnlayout.LayoutConfig;
import org.camunda.bpm.getstarted.bpmnlayout.LayoutTrace;
import org.camunda.bpm.getstarted.bpmnlayout.index.NodeIndex;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnEdge;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnTypes;
import org.camunda.bpm.getstarted.bpmnlayout.models.Point;
import org.camunda.bpm.getstarted.bpmnlayout.routing.Geometry;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keeps the main flow at the top of its container after the layout engine ran.
 * <p>
 * The engine may push the main flow down to make room for boundary branches. Main flow nodes in
 * front of a converging gateway are lifted to the target y, the converging gateway and everything
 * behind it is placed a fixed distance below them. A converging gateway is a main flow node joining
 * the main flow with a boundary branch.
 * <p>
 * Main flow nodes are normalized per container, since siblings share a coordinate system. Nodes
 * inside sub-processes keep their position.
 */
public class MainFlowNormalizer {
    private final LayoutConfig config;
    private final LayoutTrace trace;

    public MainFlowNormalizer(LayoutConfig config, LayoutTrace trace) {
        this.config = config;
        this.trace = trace;
    }

    /**
     * @param boundaryHosts boundary event id to host id
     */
    public void normalize(BpmnNode graph, Set<String> mainFlow, Set<String> boundaryTargetIds,
                          Map<String, String> boundaryHosts) {
        NodeIndex before = NodeIndex.build(graph);
        Map<String, List<String>> incoming = before.incomingSources();
        Map<String, List<Point>> routesBefore = new HashMap<>();
        for (NodeIndex.EdgeRef ref : before.edges()) {
            routesBefore.put(ref.edge().id, before.absoluteWaypoints(ref.edge()));
        }

        Set<String> converging = new LinkedHashSet<>();
        for (String id : mainFlow) {
            BpmnNode node = before.node(id);
            if (node != null && !node.isType(BpmnTypes.END_EVENT)
                    && isConvergingWithBoundaryInput(id, incoming, boundaryTargetIds, boundaryHosts)) {
                converging.add(id);
            }
        }
        Map<String, List<String>> outgoing = before.outgoingTargets();
        Set<String> downstream = new HashSet<>();
        for (String gateway : converging) {
            markDownstream(gateway, outgoing, mainFlow, downstream);
        }

        Map<String, List<BpmnNode>> byContainer = new LinkedHashMap<>();
        for (String id : mainFlow) {
            BpmnNode node = before.node(id);
            if (node == null || node.y == null || insideSubProcess(id, before)) {
                continue;
            }
            byContainer.computeIfAbsent(before.parentId(id), k -> new ArrayList<>()).add(node);
        }

        Set<String> normalizedHosts = new HashSet<>();
        for (List<BpmnNode> nodes : byContainer.values()) {
            if (normalizeContainer(nodes, downstream, converging, incoming, mainFlow, boundaryHosts)) {
                nodes.forEach(n -> normalizedHosts.add(n.id));
            }
        }
        if (normalizedHosts.isEmpty()) {
            return;
        }

        reseatBoundaryEvents(before, boundaryHosts, normalizedHosts);
        updateEdges(graph, before, routesBefore);
    }

    private boolean normalizeContainer(List<BpmnNode> nodes, Set<String> downstream, Set<String> converging,
                                       Map<String, List<String>> incoming, Set<String> mainFlow,
                                       Map<String, String> boundaryHosts) {
        List<BpmnNode> upstream = new ArrayList<>();
        List<BpmnNode> downstreamNodes = new ArrayList<>();
        List<BpmnNode> endEvents = new ArrayList<>();
        for (BpmnNode node : nodes) {
            if (downstream.contains(node.id)) {
                downstreamNodes.add(node);
            } else if (node.isType(BpmnTypes.END_EVENT)) {
                endEvents.add(node);
            } else {
                upstream.add(node);
            }
        }

        double minY = Double.POSITIVE_INFINITY;
        for (BpmnNode node : upstream) {
            minY = Math.min(minY, node.yValue());
        }
        if (minY == Double.POSITIVE_INFINITY || minY <= config.mainFlowTargetY()) {
            return false;
        }
        double offset = minY - config.mainFlowTargetY();
        trace.trace("[Normalize] lifting {} main flow nodes by {}", upstream.size(), offset);

        Map<String, BpmnNode> byId = new HashMap<>();
        nodes.forEach(n -> byId.put(n.id, n));
        for (BpmnNode node : upstream) {
            node.y = node.yValue() - offset;
        }
        for (BpmnNode end : endEvents) {
            BpmnNode predecessor = mainFlowPredecessor(end.id, incoming, mainFlow, boundaryHosts, byId);
            if (predecessor != null) {
                end.y = predecessor.bounds().centerY() - end.heightValue() / 2;
            } else {
                end.y = end.yValue() - offset;
            }
        }

        double mainFlowBottom = Double.NEGATIVE_INFINITY;
        for (BpmnNode node : upstream) {
            mainFlowBottom = Math.max(mainFlowBottom, node.bounds().bottom());
        }
        for (BpmnNode node : endEvents) {
            mainFlowBottom = Math.max(mainFlowBottom, node.bounds().bottom());
        }

        double gatewayY = Double.POSITIVE_INFINITY;
        for (BpmnNode node : downstreamNodes) {
            if (converging.contains(node.id)) {
                gatewayY = Math.min(gatewayY, node.yValue());
            }
        }
        if (gatewayY != Double.POSITIVE_INFINITY) {
            double shift = gatewayY - (mainFlowBottom + config.convergingGatewayOffset());
            for (BpmnNode node : downstreamNodes) {
                node.y = node.yValue() - shift;
            }
        }
        return true;
    }

    private static BpmnNode mainFlowPredecessor(String id, Map<String, List<String>> incoming, Set<String> mainFlow,
                                                Map<String, String> boundaryHosts, Map<String, BpmnNode> container) {
        for (String source : incoming.getOrDefault(id, List.of())) {
            if (mainFlow.contains(source) && !boundaryHosts.containsKey(source) && container.containsKey(source)) {
                return container.get(source);
            }
        }
        return null;
    }

    private static boolean isConvergingWithBoundaryInput(String id, Map<String, List<String>> incoming,
                                                         Set<String> boundaryTargetIds,
                                                         Map<String, String> boundaryHosts) {
        List<String> sources = incoming.getOrDefault(id, List.of());
        if (sources.size() <= 1) {
            return false;
        }
        boolean boundaryInput = false;
        boolean mainFlowInput = false;
        for (String source : sources) {
            if (isDownstreamOfBoundaryTarget(source, incoming, boundaryTargetIds, new HashSet<>())) {
                boundaryInput = true;
            } else if (!boundaryHosts.containsKey(source)) {
                mainFlowInput = true;
            }
        }
        return boundaryInput && mainFlowInput;
    }

    private static boolean isDownstreamOfBoundaryTarget(String id, Map<String, List<String>> incoming,
                                                        Set<String> boundaryTargetIds, Set<String> visited) {
        if (!visited.add(id)) {
            return false;
        }
        if (boundaryTargetIds.contains(id)) {
            return true;
        }
        for (String source : incoming.getOrDefault(id, List.of())) {
            if (isDownstreamOfBoundaryTarget(source, incoming, boundaryTargetIds, visited)) {
                return true;
            }
        }
        return false;
    }

    private static void markDownstream(String id, Map<String, List<String>> outgoing, Set<String> mainFlow,
                                       Set<String> downstream) {
        if (!downstream.add(id)) {
            return;
        }
        for (String target : outgoing.getOrDefault(id, List.of())) {
            if (mainFlow.contains(target)) {
                markDownstream(target, outgoing, mainFlow, downstream);
            }
        }
    }

    private static boolean insideSubProcess(String id, NodeIndex index) {
        return index.nearestAncestor(id, n -> BpmnTypes.isSubProcess(n.type())) != null;
    }

    private void reseatBoundaryEvents(NodeIndex index, Map<String, String> boundaryHosts, Set<String> normalized) {
        boundaryHosts.forEach((eventId, hostId) -> {
            BpmnNode event = index.node(eventId);
            BpmnNode host = index.node(hostId);
            if (event != null && host != null && normalized.contains(hostId)) {
                event.y = host.bounds().bottom() - event.heightValue() / 2;
            }
        });
    }

    /**
     * Moves routes with their endpoints. An edge whose endpoints moved by the same amount is shifted
     * as a whole, otherwise each end is dragged along on its own.
     */
    private void updateEdges(BpmnNode graph, NodeIndex before, Map<String, List<Point>> routesBefore) {
        NodeIndex after = NodeIndex.build(graph);
        for (NodeIndex.EdgeRef ref : after.edges()) {
            BpmnEdge edge = ref.edge();
            List<Point> route = routesBefore.get(edge.id);
            if (route == null || route.size() < 2) {
                continue;
            }
            Point sourceDelta = delta(edge.sourceId(), before, after);
            Point targetDelta = delta(edge.targetId(), before, after);
            if (sourceDelta.equals(targetDelta)) {
                List<Point> shifted = new ArrayList<>(route.size());
                for (Point p : route) {
                    shifted.add(p.translate(sourceDelta.x(), sourceDelta.y()));
                }
                route = shifted;
            } else {
                route = Geometry.moveEndpoint(route, true, sourceDelta.x(), sourceDelta.y());
                route = Geometry.moveEndpoint(route, false, targetDelta.x(), targetDelta.y());
            }
            after.setAbsoluteRoute(edge, route);
        }
    }

    private static Point delta(String id, NodeIndex before, NodeIndex after) {
        if (!before.contains(id) || !after.contains(id)) {
            return new Point(0, 0);
        }
        Point a = before.absoluteOrigin(id);
        Point b = after.absoluteOrigin(id);
        return new Point(b.x() - a.x(), b.y() - a.y());
    }
}
