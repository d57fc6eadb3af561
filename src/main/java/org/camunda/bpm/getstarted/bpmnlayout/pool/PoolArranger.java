package org.camunda.bpm.getstarted.bpmnlayout.pool;

import org.camunda.bpm.getstarted.bpmnlayout.LayoutConfig;
import org.camunda.bpm.getstarted.bpmnlayout.LayoutTrace;
import org.camunda.bpm.getstarted.bpmnlayout.artifact.ArtifactPositioner;
import org.camunda.bpm.getstarted.bpmnlayout.constraint.ConstraintSolver;
import org.camunda.bpm.getstarted.bpmnlayout.constraint.ConstraintStrength;
import org.camunda.bpm.getstarted.bpmnlayout.constraint.StackingConstraint;
import org.camunda.bpm.getstarted.bpmnlayout.index.NodeIndex;
import org.camunda.bpm.getstarted.bpmnlayout.models.ArtifactInfo;
import org.camunda.bpm.getstarted.bpmnlayout.models.Bounds;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnEdge;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnTypes;
import org.camunda.bpm.getstarted.bpmnlayout.models.CoordinateSpace;
import org.camunda.bpm.getstarted.bpmnlayout.models.Label;
import org.camunda.bpm.getstarted.bpmnlayout.models.Point;
import org.camunda.bpm.getstarted.bpmnlayout.options.ElkOptions;
import org.camunda.bpm.getstarted.bpmnlayout.preparation.GraphPreparer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stacks the pools of every collaboration on top of each other and reroutes the flows between them.
 * <p>
 * A collaboration whose pools went through the engine as pools keeps their content; the pools are
 * only widened to a common width and stacked. A collaboration with flows crossing pools was laid out
 * flat, so its pools are rebuilt here from the node to pool mapping of the caller's tree.
 */
public class PoolArranger {
    private static final double ARTIFACT_MIN_Y = 5;
    private static final double LABEL_GAP = 5;
    // sequence flows between pools: centres closer than this in y count as one level
    private static final double LEVEL_TOLERANCE = 30;
    private static final double STRAIGHT_TOLERANCE = 10;
    private static final double LOOP_CLEARANCE = 30;

    private final LayoutConfig config;
    private final LayoutTrace trace;
    private final MessageFlowRouter router;

    public PoolArranger(LayoutConfig config, LayoutTrace trace) {
        this.config = config;
        this.trace = trace;
        this.router = new MessageFlowRouter(config);
    }

    public void rearrange(BpmnNode layouted, BpmnNode original) {
        Map<String, BpmnNode> originals = new HashMap<>();
        for (BpmnNode child : original.childrenOrEmpty()) {
            originals.put(child.id, child);
        }
        for (BpmnNode collaboration : layouted.childrenOrEmpty()) {
            BpmnNode originalCollaboration = originals.get(collaboration.id);
            if (originalCollaboration == null || !originalCollaboration.isType(BpmnTypes.COLLABORATION)
                    || !collaboration.hasChildren()) {
                continue;
            }
            trace.stage("Pools of " + collaboration.id);
            if (GraphPreparer.isCrossPoolCollaboration(originalCollaboration)) {
                rebuildFlattenedPools(layouted, collaboration, originalCollaboration);
            } else {
                stackPools(layouted, collaboration, originalCollaboration);
            }
            recalculateCollaborationEdges(layouted, collaboration, originalCollaboration);
        }
    }

    private void stackPools(BpmnNode root, BpmnNode collaboration, BpmnNode originalCollaboration) {
        Map<String, BpmnNode> laidOut = new HashMap<>();
        for (BpmnNode child : collaboration.childrenOrEmpty()) {
            laidOut.put(child.id, child);
        }
        List<BpmnNode> pools = new ArrayList<>();
        Map<String, BpmnNode> originalPools = new HashMap<>();
        for (BpmnNode originalPool : originalCollaboration.childrenOrEmpty()) {
            BpmnNode pool = laidOut.get(originalPool.id);
            if (originalPool.isType(BpmnTypes.PARTICIPANT) && pool != null) {
                pools.add(pool);
                originalPools.put(pool.id, originalPool);
            }
        }
        if (pools.isEmpty()) {
            return;
        }
        RouteSnapshot routes = RouteSnapshot.capture(NodeIndex.build(root), pools);

        double maxWidth = 0;
        for (BpmnNode pool : pools) {
            boolean lanes = hasLanes(originalPools.get(pool.id));
            maxWidth = Math.max(maxWidth, pool.widthValue() + (lanes ? 0 : config.poolExtraWidth()));
        }

        Map<String, Point> contentShift = new HashMap<>();
        ConstraintSolver solver = new ConstraintSolver(trace);
        for (BpmnNode pool : pools) {
            BpmnNode originalPool = originalPools.get(pool.id);
            double height = pool.heightValue();
            if (isBlackBox(originalPool)) {
                height = config.blackBoxPoolHeight();
            } else if (!hasLanes(originalPool)) {
                height += config.poolExtraHeight();
                double offset = config.poolExtraHeight() / 2;
                for (BpmnNode child : pool.childrenOrEmpty()) {
                    child.y = child.yValue() + offset;
                }
                contentShift.put(pool.id, new Point(0, offset));
            }
            pool.setSize(maxWidth, height);
            solver.addNode(pool.id, 0, 0, maxWidth, height);
        }
        solver.addConstraint(StackingConstraint.fixedY(pools.get(0).id, 0, ConstraintStrength.REQUIRED));
        for (int i = 1; i < pools.size(); i++) {
            solver.addConstraint(StackingConstraint.below(pools.get(i).id, pools.get(i - 1).id, 0,
                    ConstraintStrength.REQUIRED));
        }

        Map<String, Bounds> solved = solver.solveWithBounds();
        double height = 0;
        for (BpmnNode pool : pools) {
            Bounds bounds = solved.get(pool.id);
            pool.setPosition(bounds.x(), bounds.y());
            height = Math.max(height, bounds.bottom());
            trace.trace("[Pool] {} stacked at {}", pool.id, pool);
        }
        collaboration.setSize(maxWidth, height);
        routes.restore(NodeIndex.build(root), contentShift);
    }

    /**
     * Regroups the flattened content of a collaboration into its pools. Every pool gets the width
     * of the widest content, its height from its tallest node, and its nodes centred on one row.
     * Artifacts sit right of their task.
     */
    private void rebuildFlattenedPools(BpmnNode root, BpmnNode collaboration, BpmnNode originalCollaboration) {
        Map<String, String> nodeToPool = new HashMap<>();
        Set<String> artifactIds = new HashSet<>();
        List<BpmnNode> originalPools = new ArrayList<>();
        for (BpmnNode child : originalCollaboration.childrenOrEmpty()) {
            if (child.isType(BpmnTypes.PARTICIPANT)) {
                originalPools.add(child);
                mapPoolContent(child.id, child.childrenOrEmpty(), nodeToPool, artifactIds);
            }
        }
        originalPools.sort(Comparator.comparingInt(p -> ElkOptions.partition(p.id, p.layoutOptions)));

        RouteSnapshot routes = RouteSnapshot.capture(NodeIndex.build(root), collaboration.childrenOrEmpty());
        Map<String, ArtifactInfo> artifacts = ArtifactPositioner.collectInfo(collaboration);

        Map<String, List<BpmnNode>> poolContent = new LinkedHashMap<>();
        List<BpmnNode> leftovers = new ArrayList<>();
        double minX = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        for (BpmnNode node : collaboration.childrenOrEmpty()) {
            String poolId = nodeToPool.get(node.id);
            if (poolId == null) {
                if (!node.isType(BpmnTypes.PARTICIPANT)) {
                    leftovers.add(node);
                }
                continue;
            }
            poolContent.computeIfAbsent(poolId, k -> new ArrayList<>()).add(node);
            if (!artifactIds.contains(node.id)) {
                minX = Math.min(minX, node.xValue());
                maxX = Math.max(maxX, node.bounds().right());
            }
        }
        if (minX > maxX) {
            minX = 0;
            maxX = 0;
        }
        double poolWidth = config.poolHeaderWidth() + (maxX - minX) + 2 * config.poolPaddingX();
        double shiftX = config.poolHeaderWidth() - minX + config.poolPaddingX();

        List<BpmnNode> pools = new ArrayList<>();
        double currentY = 0;
        for (BpmnNode originalPool : originalPools) {
            BpmnNode pool = new BpmnNode();
            pool.id = originalPool.id;
            pool.bpmn = originalPool.bpmn;
            pool.layoutOptions = originalPool.layoutOptions;
            pool.labels = originalPool.labels;

            double poolHeight;
            if (isBlackBox(originalPool)) {
                poolHeight = config.blackBoxPoolHeight();
            } else {
                List<BpmnNode> content = poolContent.getOrDefault(originalPool.id, List.of());
                double tallest = 0;
                for (BpmnNode node : content) {
                    if (!artifactIds.contains(node.id)) {
                        tallest = Math.max(tallest, node.heightValue());
                    }
                }
                poolHeight = Math.max(config.poolMinHeight(), tallest + 2 * config.poolPaddingY());
                pool.children = placeContent(content, artifactIds, artifacts, poolHeight, shiftX);
            }
            pool.setPosition(0, currentY);
            pool.setSize(poolWidth, poolHeight);
            pools.add(pool);
            currentY += poolHeight;
            trace.trace("[Pool] rebuilt {}", pool);
        }
        if (!leftovers.isEmpty()) {
            trace.trace("[Pool] {} nodes of {} belong to no pool", leftovers.size(), collaboration.id);
        }

        List<BpmnNode> children = new ArrayList<>(pools);
        children.addAll(leftovers);
        collaboration.children = children;
        collaboration.setSize(poolWidth, currentY);
        routes.restore(NodeIndex.build(root), Map.of());
    }

    private List<BpmnNode> placeContent(List<BpmnNode> content, Set<String> artifactIds,
                                        Map<String, ArtifactInfo> artifacts, double poolHeight, double shiftX) {
        List<BpmnNode> placed = new ArrayList<>();
        Map<String, BpmnNode> regular = new HashMap<>();
        for (BpmnNode node : content) {
            if (!artifactIds.contains(node.id)) {
                node.setPosition(node.xValue() + shiftX, (poolHeight - node.heightValue()) / 2);
                placed.add(node);
                regular.put(node.id, node);
            }
        }
        for (BpmnNode artifact : content) {
            if (!artifactIds.contains(artifact.id)) {
                continue;
            }
            ArtifactInfo info = artifacts.get(artifact.id);
            BpmnNode task = info == null ? null : regular.get(info.associatedTaskId());
            if (task != null) {
                double y = task.yValue() + (task.heightValue() - artifact.heightValue()) / 2;
                artifact.setPosition(task.bounds().right() + config.artifactSpacing(), Math.max(ARTIFACT_MIN_Y, y));
            } else {
                artifact.setPosition(artifact.xValue() + shiftX, (poolHeight - artifact.heightValue()) / 2);
            }
            placed.add(artifact);
        }
        return placed;
    }

    private static void mapPoolContent(String poolId, List<BpmnNode> children, Map<String, String> nodeToPool,
                                       Set<String> artifactIds) {
        for (BpmnNode child : children) {
            if (child.isType(BpmnTypes.LANE)) {
                mapPoolContent(poolId, child.childrenOrEmpty(), nodeToPool, artifactIds);
                continue;
            }
            nodeToPool.put(child.id, poolId);
            if (BpmnTypes.isArtifact(child.type())) {
                artifactIds.add(child.id);
            }
            for (BpmnNode event : child.boundaryEventsOrEmpty()) {
                nodeToPool.put(event.id, poolId);
            }
        }
    }

    private static boolean hasLanes(BpmnNode pool) {
        return pool.childrenOrEmpty().stream().anyMatch(c -> c.isType(BpmnTypes.LANE));
    }

    private static boolean isBlackBox(BpmnNode pool) {
        return (pool.bpmn != null && Boolean.TRUE.equals(pool.bpmn.isBlackBox)) || !pool.hasChildren();
    }

    /**
     * Reroutes the flows owned by the collaboration in diagram coordinates. Message flows and data
     * associations go through {@link MessageFlowRouter}, everything else gets a sequence flow route.
     */
    private void recalculateCollaborationEdges(BpmnNode root, BpmnNode collaboration,
                                               BpmnNode originalCollaboration) {
        NodeIndex index = NodeIndex.build(root);
        Set<String> blackBoxes = new HashSet<>();
        for (BpmnNode child : originalCollaboration.childrenOrEmpty()) {
            if (child.isType(BpmnTypes.PARTICIPANT) && isBlackBox(child)) {
                blackBoxes.add(child.id);
            }
        }
        List<String> flowNodes = new ArrayList<>();
        for (BpmnNode node : index.nodes()) {
            if (BpmnTypes.isFlowNode(node.type()) && !BpmnTypes.BOUNDARY_EVENT.equals(node.type())
                    && index.isDescendantOf(node.id, collaboration.id)) {
                flowNodes.add(node.id);
            }
        }

        Point origin = index.contentOrigin(collaboration.id);
        for (BpmnEdge edge : collaboration.edgesOrEmpty()) {
            String sourceId = edge.sourceId();
            String targetId = edge.targetId();
            if (sourceId == null || targetId == null || !index.contains(sourceId) || !index.contains(targetId)) {
                trace.trace("[Pool] edge {} has an unknown endpoint", edge.id);
                continue;
            }
            Bounds source = index.absoluteBounds(sourceId);
            Bounds target = index.absoluteBounds(targetId);
            List<Point> route;
            if (BpmnTypes.MESSAGE_FLOW.equals(edge.type()) || BpmnTypes.isDataAssociation(edge.type())) {
                List<Bounds> obstacles = new ArrayList<>();
                for (String id : flowNodes) {
                    if (!id.equals(sourceId) && !id.equals(targetId) && !index.isDescendantOf(sourceId, id)
                            && !index.isDescendantOf(targetId, id)) {
                        obstacles.add(index.absoluteBounds(id));
                    }
                }
                route = router.route(source, target, blackBoxes.contains(sourceId), blackBoxes.contains(targetId),
                        obstacles);
            } else {
                route = sequenceFlowRoute(source, target);
            }
            edge.markCoordinateSpace(CoordinateSpace.ABSOLUTE);
            index.setAbsoluteRoute(edge, route);
            placeLabels(edge, route, origin);
            trace.trace("[Pool] rerouted {} {}", edge.type(), edge.id);
        }
    }

    /**
     * Right from side to side when both ends are on one level, down or up out of the source's
     * bottom or top and into the target's left side otherwise. Backwards it loops below both nodes.
     */
    static List<Point> sequenceFlowRoute(Bounds source, Bounds target) {
        List<Point> route = new ArrayList<>();
        boolean right = target.centerX() > source.centerX();
        boolean down = target.centerY() > source.centerY() + LEVEL_TOLERANCE;
        boolean up = target.centerY() < source.centerY() - LEVEL_TOLERANCE;
        if (!right) {
            Point start = new Point(source.x(), source.centerY());
            Point end = new Point(target.right(), target.centerY());
            double loopY = Math.max(source.bottom(), target.bottom()) + LOOP_CLEARANCE;
            route.add(start);
            route.add(new Point(start.x(), loopY));
            route.add(new Point(end.x(), loopY));
            route.add(end);
            return route;
        }
        if (down || up) {
            Point start = new Point(source.centerX(), down ? source.bottom() : source.y());
            Point end = new Point(target.x(), target.centerY());
            route.add(start);
            route.add(new Point(start.x(), end.y()));
            route.add(end);
            return route;
        }
        Point start = new Point(source.right(), source.centerY());
        Point end = new Point(target.x(), target.centerY());
        route.add(start);
        if (Math.abs(start.y() - end.y()) > STRAIGHT_TOLERANCE) {
            double midX = (start.x() + end.x()) / 2;
            route.add(new Point(midX, start.y()));
            route.add(new Point(midX, end.y()));
        }
        route.add(end);
        return route;
    }

    private static void placeLabels(BpmnEdge edge, List<Point> route, Point origin) {
        if (edge.labels == null || edge.labels.isEmpty() || route.isEmpty()) {
            return;
        }
        Point anchor = route.get(route.size() / 2);
        for (Label label : edge.labels) {
            double width = label.width == null ? 0 : label.width;
            double height = label.height == null ? 0 : label.height;
            label.x = anchor.x() - width / 2 - origin.x();
            label.y = anchor.y() - height - LABEL_GAP - origin.y();
        }
    }

    /**
     * Absolute routes of the edges inside a set of subtrees, taken before the subtrees move, so they
     * can be shifted along once the new positions are known.
     */
    private static final class RouteSnapshot {
        private final Map<String, Point> origins = new HashMap<>();
        private final Map<BpmnEdge, String> units = new LinkedHashMap<>();
        private final Map<BpmnEdge, List<Point>> routes = new HashMap<>();

        static RouteSnapshot capture(NodeIndex index, Collection<BpmnNode> subtrees) {
            RouteSnapshot snapshot = new RouteSnapshot();
            for (BpmnNode subtree : subtrees) {
                snapshot.origins.put(subtree.id, index.absoluteOrigin(subtree.id));
            }
            for (NodeIndex.EdgeRef ref : index.edges()) {
                if (!ref.edge().hasRoute()) {
                    continue;
                }
                for (BpmnNode subtree : subtrees) {
                    if (ref.owner().id.equals(subtree.id) || index.isDescendantOf(ref.owner().id, subtree.id)) {
                        snapshot.units.put(ref.edge(), subtree.id);
                        snapshot.routes.put(ref.edge(), index.absoluteWaypoints(ref.edge()));
                        break;
                    }
                }
            }
            return snapshot;
        }

        /**
         * @param contentShift extra shift of a subtree's content relative to the subtree itself
         */
        void restore(NodeIndex index, Map<String, Point> contentShift) {
            units.forEach((edge, unit) -> {
                if (!index.contains(unit)) {
                    return;
                }
                Point before = origins.get(unit);
                Point after = index.absoluteOrigin(unit);
                Point extra = contentShift.getOrDefault(unit, new Point(0, 0));
                double dx = after.x() - before.x() + extra.x();
                double dy = after.y() - before.y() + extra.y();
                List<Point> shifted = new ArrayList<>();
                for (Point p : routes.get(edge)) {
                    shifted.add(p.translate(dx, dy));
                }
                index.setAbsoluteRoute(edge, shifted);
            });
        }
    }
}
