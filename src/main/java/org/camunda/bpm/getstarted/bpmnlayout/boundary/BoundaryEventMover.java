package org.camunda.bpm.getstarted.bpmnlayout.boundary;

import org.camunda.bpm.getstarted.bpmnlayout.LayoutConfig;
import org.camunda.bpm.getstarted.bpmnlayout.LayoutTrace;
import org.camunda.bpm.getstarted.bpmnlayout.index.NodeIndex;
import org.camunda.bpm.getstarted.bpmnlayout.models.BoundaryEventInfo;
import org.camunda.bpm.getstarted.bpmnlayout.models.Bounds;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnTypes;
import org.camunda.bpm.getstarted.bpmnlayout.models.MoveInfo;
import org.camunda.bpm.getstarted.bpmnlayout.models.Point;
import org.camunda.bpm.getstarted.bpmnlayout.tree.TreeLayoutOptions;
import org.camunda.bpm.getstarted.bpmnlayout.tree.TreeLayouter;
import org.camunda.bpm.getstarted.bpmnlayout.tree.TreeNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Moves the branches started by boundary events below the main flow.
 * <p>
 * Every branch is classified by where it ends: branches merging back into the main flow are placed
 * right below it, branches ending in an end event below those and branches running into nothing at
 * the bottom. A branch that overlaps an already placed one horizontally is pushed further down.
 * The nodes behind a branch's first node follow it to the right, a branch that splits up is laid out
 * as a tree. Merge points stay where they are.
 * <p>
 * Positions are computed in diagram coordinates and handed out as {@link MoveInfo}s relative to
 * each node's parent.
 */
public class BoundaryEventMover {
    private static final double DEFAULT_WIDTH = 100;
    private static final double DEFAULT_HEIGHT = 80;

    private final LayoutConfig config;
    private final LayoutTrace trace;
    private final TreeLayoutOptions branchTreeOptions;

    public BoundaryEventMover(LayoutConfig config, LayoutTrace trace) {
        this.config = config;
        this.trace = trace;
        this.branchTreeOptions = TreeLayoutOptions.from(config).toBuilder()
                .direction(TreeLayoutOptions.Direction.RIGHT)
                .build();
    }

    /**
     * @return node id to its new position, for the first node of every branch and the nodes following it
     */
    public Map<String, MoveInfo> identifyNodesToMove(BpmnNode graph, Map<String, BoundaryEventInfo> infos) {
        Placement placement = new Placement(graph, infos);
        placement.placeAll();
        return placement.toMoves();
    }

    /**
     * Finds gateways joining a moved branch with the main flow and moves them to the right of their
     * rightmost incoming node. The moves must already be applied or given in {@code moves}.
     *
     * @return gateway id to its new position, offset 0
     */
    public Map<String, MoveInfo> repositionConvergingGateways(BpmnNode graph, Map<String, MoveInfo> moves,
                                                              Map<String, BoundaryEventInfo> infos) {
        NodeIndex index = NodeIndex.build(graph);
        Map<String, List<String>> incoming = index.incomingSources();
        Set<String> targets = BoundaryEventCollector.targetIds(infos);
        Map<String, MoveInfo> gatewayMoves = new LinkedHashMap<>();

        for (BpmnNode node : index.nodes()) {
            List<String> sources = incoming.getOrDefault(node.id, List.of());
            if (sources.size() <= 1) {
                continue;
            }
            boolean branchInput = false;
            boolean mainFlowInput = false;
            for (String source : sources) {
                if (targets.contains(source) || moves.containsKey(source)) {
                    branchInput = true;
                } else if (!infos.containsKey(source)) {
                    mainFlowInput = true;
                }
            }
            if (!branchInput || !mainFlowInput) {
                continue;
            }

            double maxSourceRight = Double.NEGATIVE_INFINITY;
            for (String source : sources) {
                BpmnNode sourceNode = index.node(source);
                if (sourceNode == null) {
                    continue;
                }
                MoveInfo move = moves.get(source);
                double x = move != null && move.newX() != null
                        ? index.contentOrigin(index.parentId(source)).x() + move.newX()
                        : index.absoluteOrigin(source).x();
                maxSourceRight = Math.max(maxSourceRight, x + sourceNode.widthValue());
            }
            if (maxSourceRight == Double.NEGATIVE_INFINITY) {
                continue;
            }
            Point parentOrigin = index.contentOrigin(index.parentId(node.id));
            double newX = maxSourceRight + config.horizontalGap() - parentOrigin.x();
            if (newX > node.xValue()) {
                trace.trace("[Boundary] converging gateway {} x {} -> {}", node.id, node.xValue(), newX);
                gatewayMoves.put(node.id, MoveInfo.builder()
                        .nodeId(node.id)
                        .newY(node.yValue())
                        .offset(0)
                        .newX(newX)
                        .build());
            }
        }
        return gatewayMoves;
    }

    /**
     * Writes the moves into the tree, wherever the nodes are nested.
     */
    public void applyNodeMoves(BpmnNode graph, Map<String, MoveInfo> moves) {
        for (BpmnNode child : graph.childrenOrEmpty()) {
            MoveInfo move = moves.get(child.id);
            if (move != null && child.y != null) {
                child.y = move.newY();
                if (move.newX() != null) {
                    child.x = move.newX();
                }
            }
            applyNodeMoves(child, moves);
        }
    }

    private record PendingBranch(BoundaryEventInfo info, Bounds host, double eventX,
                                 BranchDestination destination) {
    }

    /**
     * State of one {@link #identifyNodesToMove} run. All bounds are in diagram coordinates.
     */
    private final class Placement {
        private final NodeIndex index;
        private final Map<String, BoundaryEventInfo> infos;
        private final Map<String, List<String>> outgoing;
        private final Map<String, List<String>> incoming;
        private final Set<String> boundaryTargets;
        private final Map<String, Bounds> placed = new LinkedHashMap<>();
        private final List<Bounds> branches = new ArrayList<>();
        // x of the last branch started at each host
        private final Map<String, Double> lastBranchX = new HashMap<>();

        Placement(BpmnNode graph, Map<String, BoundaryEventInfo> infos) {
            this.index = NodeIndex.build(graph);
            this.infos = infos;
            this.outgoing = index.outgoingTargets();
            this.incoming = index.incomingSources();
            this.boundaryTargets = BoundaryEventCollector.targetIds(infos);
        }

        void placeAll() {
            List<PendingBranch> pending = new ArrayList<>();
            for (BoundaryEventInfo info : infos.values()) {
                if (info.targets().isEmpty() || !index.contains(info.hostId())) {
                    continue;
                }
                Bounds host = index.absoluteBounds(info.hostId());
                double eventX = BoundarySeats.center(host, info.index(), info.total(), config.boundaryEventPitch());
                BranchDestination destination = destination(info.targets().get(0));
                trace.trace("[Boundary] branch {} -> {}: {}", info.boundaryEventId(), info.targets().get(0),
                        destination);
                pending.add(new PendingBranch(info, host, eventX, destination));
            }
            pending.sort(Comparator.comparing(PendingBranch::destination)
                    .thenComparing((a, b) -> Math.abs(a.eventX() - b.eventX()) > 1
                            ? Double.compare(a.eventX(), b.eventX())
                            : Integer.compare(a.info().index(), b.info().index())));

            Map<String, Double> mainFlowBottom = mainFlowBottomPerContainer(pending);
            for (PendingBranch branch : pending) {
                double bottom = mainFlowBottom.get(index.parentId(branch.info().hostId()));
                for (String targetId : branch.info().targets()) {
                    placeBranch(branch, targetId, bottom);
                }
            }
        }

        private Map<String, Double> mainFlowBottomPerContainer(List<PendingBranch> pending) {
            Map<String, Double> bottoms = new HashMap<>();
            for (PendingBranch branch : pending) {
                bottoms.merge(index.parentId(branch.info().hostId()), branch.host().bottom(), Math::max);
            }
            return bottoms;
        }

        private void placeBranch(PendingBranch branch, String targetId, double mainFlowBottom) {
            BpmnNode target = index.node(targetId);
            if (target == null || target.y == null) {
                return;
            }
            if (placed.containsKey(targetId)) {
                trace.trace("[Boundary] {} already placed by another branch", targetId);
                return;
            }

            double newX = switch (branch.destination()) {
                case MERGE_TO_MAIN -> branch.host().right() + config.branchMergeXOffset();
                case TO_END_EVENT -> branch.eventX() + config.branchToEndXOffset();
                case DEAD_END -> branch.eventX();
            };
            Double previous = lastBranchX.get(branch.info().hostId());
            if (previous != null) {
                newX = Math.max(newX, previous + config.boundaryEventPitch());
            }
            lastBranchX.put(branch.info().hostId(), newX);

            Set<String> members = branchMembers(targetId);
            TreeNode tree = fansOut(members) ? layoutTree(targetId, members) : null;

            Bounds extent;
            if (tree != null) {
                TreeLayouter layouter = new TreeLayouter(branchTreeOptions);
                Bounds treeBounds = layouter.treeBounds(tree);
                extent = new Bounds(newX, 0, treeBounds.width(), treeBounds.height());
            } else {
                extent = linearExtent(targetId, newX);
            }

            double newY = findY(extent, branch.destination(), mainFlowBottom);
            if (tree != null) {
                placeTree(tree, newX, newY);
            } else {
                placed.put(targetId, new Bounds(newX, newY, width(target), height(target)));
                propagate(targetId);
            }
            trace.trace("[Boundary] moving {} to ({}, {}) as {}", targetId, newX, newY, branch.destination());
            branches.add(new Bounds(extent.x(), newY, extent.width(), extent.height()));
        }

        private double findY(Bounds extent, BranchDestination destination, double mainFlowBottom) {
            double candidate = layerBase(destination, mainFlowBottom);
            for (Bounds other : branches) {
                if (xRangesOverlap(extent, other)) {
                    candidate = Math.max(candidate, other.bottom() + config.branchClearance());
                }
            }
            return candidate;
        }

        private double layerBase(BranchDestination destination, double mainFlowBottom) {
            double merge = mainFlowBottom + config.branchMergeLayerOffset();
            double toEnd = merge + config.branchToEndLayerOffset();
            return switch (destination) {
                case MERGE_TO_MAIN -> merge;
                case TO_END_EVENT -> toEnd;
                case DEAD_END -> toEnd + config.branchDeadEndLayerOffset();
            };
        }

        private boolean xRangesOverlap(Bounds a, Bounds b) {
            double gap = config.horizontalGap();
            return !(a.right() + gap < b.x() || b.right() + gap < a.x());
        }

        /**
         * Horizontal extent of a branch laid out as a chain: every following node adds its width and
         * the node gap, the height is that of the tallest node.
         */
        private Bounds linearExtent(String targetId, double newX) {
            BpmnNode target = index.node(targetId);
            double right = newX + width(target);
            double height = height(target);
            Set<String> visited = new HashSet<>();
            Deque<String> queue = new ArrayDeque<>(List.of(targetId));
            while (!queue.isEmpty()) {
                String id = queue.poll();
                if (!visited.add(id)) {
                    continue;
                }
                for (String next : outgoing.getOrDefault(id, List.of())) {
                    BpmnNode node = index.node(next);
                    if (node == null || visited.contains(next) || isMergePoint(next)) {
                        continue;
                    }
                    right += config.branchNodeGap() + width(node);
                    height = Math.max(height, height(node));
                    queue.add(next);
                }
            }
            return new Bounds(newX, 0, right - newX, height);
        }

        /**
         * Follows the branch from its first node up to merge points and nodes other branches took.
         */
        private Set<String> branchMembers(String targetId) {
            Set<String> members = new LinkedHashSet<>();
            Deque<String> queue = new ArrayDeque<>(List.of(targetId));
            while (!queue.isEmpty()) {
                String id = queue.poll();
                if (!members.add(id)) {
                    continue;
                }
                for (String next : outgoing.getOrDefault(id, List.of())) {
                    if (index.contains(next) && !placed.containsKey(next) && !isMergePoint(next)
                            && !members.contains(next)) {
                        queue.add(next);
                    }
                }
            }
            return members;
        }

        private boolean fansOut(Set<String> members) {
            for (String id : members) {
                long next = outgoing.getOrDefault(id, List.of()).stream().filter(members::contains).count();
                if (next > 1) {
                    return true;
                }
            }
            return false;
        }

        private TreeNode layoutTree(String rootId, Set<String> members) {
            Map<String, Bounds> nodes = new LinkedHashMap<>();
            for (String id : members) {
                BpmnNode node = index.node(id);
                nodes.put(id, new Bounds(0, 0, width(node), height(node)));
            }
            TreeNode tree = TreeLayouter.buildTree(rootId, nodes, outgoing);
            if (tree != null) {
                new TreeLayouter(branchTreeOptions).layout(tree);
            }
            return tree;
        }

        private void placeTree(TreeNode node, double dx, double dy) {
            placed.put(node.id, new Bounds(node.x + dx, node.y + dy, node.width, node.height));
            for (TreeNode child : node.children) {
                placeTree(child, dx, dy);
            }
        }

        /**
         * Lines the nodes behind {@code sourceId} up to its right, vertically centred on it. A node
         * that was already placed is only pushed further right if needed.
         */
        private void propagate(String sourceId) {
            Bounds source = placed.get(sourceId);
            for (String targetId : outgoing.getOrDefault(sourceId, List.of())) {
                double newX = source.right() + config.branchNodeGap();
                Bounds existing = placed.get(targetId);
                if (existing != null) {
                    if (newX > existing.x()) {
                        trace.trace("[Boundary] pushing {} right to {}", targetId, newX);
                        placed.put(targetId, new Bounds(newX, existing.y(), existing.width(), existing.height()));
                    }
                    continue;
                }
                if (isMergePoint(targetId)) {
                    continue;
                }
                BpmnNode target = index.node(targetId);
                if (target == null || target.y == null) {
                    continue;
                }
                double newY = source.y() + (source.height() - height(target)) / 2;
                placed.put(targetId, new Bounds(newX, newY, width(target), height(target)));
                propagate(targetId);
            }
        }

        /**
         * A node joined by the main flow: more than one incoming edge and at least one of them from a
         * node that is neither part of a branch nor already moved.
         */
        private boolean isMergePoint(String id) {
            List<String> sources = incoming.getOrDefault(id, List.of());
            if (sources.size() <= 1) {
                return false;
            }
            for (String source : sources) {
                if (!boundaryTargets.contains(source) && !placed.containsKey(source) && !infos.containsKey(source)) {
                    return true;
                }
            }
            return false;
        }

        private BranchDestination destination(String startId) {
            Set<String> visited = new HashSet<>();
            Deque<String> queue = new ArrayDeque<>(List.of(startId));
            while (!queue.isEmpty()) {
                String id = queue.poll();
                if (!visited.add(id)) {
                    continue;
                }
                BpmnNode node = index.node(id);
                if (node == null) {
                    continue;
                }
                if (isMergePoint(id)) {
                    return BranchDestination.MERGE_TO_MAIN;
                }
                List<String> next = outgoing.getOrDefault(id, List.of());
                if (next.isEmpty()) {
                    return node.isType(BpmnTypes.END_EVENT) ? BranchDestination.TO_END_EVENT
                            : BranchDestination.DEAD_END;
                }
                for (String targetId : next) {
                    if (visited.contains(targetId)) {
                        continue;
                    }
                    if (isMergePoint(targetId)) {
                        return BranchDestination.MERGE_TO_MAIN;
                    }
                    queue.add(targetId);
                }
            }
            return BranchDestination.DEAD_END;
        }

        Map<String, MoveInfo> toMoves() {
            Map<String, MoveInfo> moves = new LinkedHashMap<>();
            placed.forEach((id, bounds) -> {
                BpmnNode node = index.node(id);
                Point origin = index.contentOrigin(index.parentId(id));
                double newY = bounds.y() - origin.y();
                moves.put(id, MoveInfo.builder()
                        .nodeId(id)
                        .newY(newY)
                        .offset(newY - node.yValue())
                        .newX(bounds.x() - origin.x())
                        .build());
            });
            return moves;
        }

        private double width(BpmnNode node) {
            return node.width == null ? DEFAULT_WIDTH : node.width;
        }

        private double height(BpmnNode node) {
            return node.height == null ? DEFAULT_HEIGHT : node.height;
        }
    }
}
