package org.camunda.bpm.getstarted.bpmnlayout.tree;

import org.camunda.bpm.getstarted.bpmnlayout.models.Bounds;
import org.camunda.bpm.getstarted.bpmnlayout.models.Point;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Two pass tree layout in the Reingold-Tilford family, used for isolated boundary branches.
 * <p>
 * The first pass runs bottom-up and gives every node a preliminary centre relative to the left edge
 * of its subtree, plus a modifier holding where its children block starts. The second pass runs
 * top-down and turns these into coordinates. Sibling subtrees never overlap, parents are centred
 * over their children and all nodes of one level share the same depth coordinate.
 * <p>
 * With {@code DOWN} the breadth axis is x and levels grow downwards, with {@code RIGHT} the breadth
 * axis is y and levels grow to the right.
 */
public class TreeLayouter {
    private final TreeLayoutOptions options;

    public TreeLayouter() {
        this(TreeLayoutOptions.defaults());
    }

    public TreeLayouter(TreeLayoutOptions options) {
        this.options = options;
    }

    /**
     * Lays the tree out with its subtree's top-left corner at (0, 0).
     */
    public void layout(TreeNode root) {
        firstWalk(root);
        List<Double> levelDepths = new ArrayList<>();
        collectLevelDepths(root, 0, levelDepths);

        List<Double> levelStarts = new ArrayList<>(levelDepths.size());
        double start = 0;
        for (double depth : levelDepths) {
            levelStarts.add(start);
            start += depth + options.verticalGap();
        }
        secondWalk(root, 0, 0, levelStarts);
    }

    private void firstWalk(TreeNode node) {
        double breadth = breadth(node);
        if (node.isLeaf()) {
            node.subtreeBreadth = breadth;
            node.prelim = breadth / 2;
            node.modifier = 0;
            return;
        }

        double childrenBreadth = 0;
        for (TreeNode child : node.children) {
            firstWalk(child);
            childrenBreadth += child.subtreeBreadth;
        }
        childrenBreadth += options.horizontalGap() * (node.children.size() - 1);

        node.subtreeBreadth = Math.max(breadth, childrenBreadth);
        node.modifier = (node.subtreeBreadth - childrenBreadth) / 2;

        TreeNode first = node.children.get(0);
        TreeNode last = node.children.get(node.children.size() - 1);
        double firstCentre = node.modifier + first.prelim;
        double lastCentre = node.modifier + childrenBreadth - last.subtreeBreadth + last.prelim;
        double centre = (firstCentre + lastCentre) / 2;
        // keep the parent inside its own subtree
        node.prelim = Math.max(breadth / 2, Math.min(node.subtreeBreadth - breadth / 2, centre));
    }

    private void secondWalk(TreeNode node, double subtreeStart, int level, List<Double> levelStarts) {
        double centre = subtreeStart + node.prelim;
        double depthStart = levelStarts.get(level);
        if (options.direction() == TreeLayoutOptions.Direction.DOWN) {
            node.x = centre - node.width / 2;
            node.y = depthStart;
        } else {
            node.y = centre - node.height / 2;
            node.x = depthStart;
        }

        double childStart = subtreeStart + node.modifier;
        for (TreeNode child : node.children) {
            secondWalk(child, childStart, level + 1, levelStarts);
            childStart += child.subtreeBreadth + options.horizontalGap();
        }
    }

    private void collectLevelDepths(TreeNode node, int level, List<Double> depths) {
        double depth = options.direction() == TreeLayoutOptions.Direction.DOWN ? node.height : node.width;
        if (depths.size() <= level) {
            depths.add(depth);
        } else if (depths.get(level) < depth) {
            depths.set(level, depth);
        }
        for (TreeNode child : node.children) {
            collectLevelDepths(child, level + 1, depths);
        }
    }

    private double breadth(TreeNode node) {
        return options.direction() == TreeLayoutOptions.Direction.DOWN ? node.width : node.height;
    }

    public void applyOffset(TreeNode root, double dx, double dy) {
        root.x += dx;
        root.y += dy;
        for (TreeNode child : root.children) {
            applyOffset(child, dx, dy);
        }
    }

    public Bounds treeBounds(TreeNode root) {
        Bounds bounds = root.bounds();
        for (TreeNode child : root.children) {
            bounds = Bounds.union(bounds, treeBounds(child));
        }
        return bounds;
    }

    /**
     * Builds the tree reachable from {@code rootId}. A node reached a second time is not expanded
     * again and not added twice, so cycles and re-joining paths end where they meet the tree.
     *
     * @param nodes    bounds per node id
     * @param outgoing target ids per source id, in edge order
     * @return the tree, or null when the root is unknown
     */
    public static TreeNode buildTree(String rootId, Map<String, Bounds> nodes, Map<String, List<String>> outgoing) {
        return buildNode(rootId, nodes, outgoing, new HashSet<>());
    }

    private static TreeNode buildNode(String id, Map<String, Bounds> nodes, Map<String, List<String>> outgoing,
                                      Set<String> visited) {
        Bounds bounds = nodes.get(id);
        if (bounds == null || !visited.add(id)) {
            return null;
        }
        TreeNode node = new TreeNode(id, bounds);
        for (String childId : outgoing.getOrDefault(id, List.of())) {
            TreeNode child = buildNode(childId, nodes, outgoing, visited);
            if (child != null) {
                node.children.add(child);
            }
        }
        return node;
    }

    /**
     * Lays out the branch starting at {@code branchRootId} and centres it below {@code parent},
     * {@code parentGap} under the parent's bottom edge.
     *
     * @return new top-left corner per branch node, empty when the branch root is unknown
     */
    public Map<String, Point> layoutBoundaryBranch(String branchRootId, Map<String, Bounds> nodes,
                                                   Map<String, List<String>> outgoing, Bounds parent,
                                                   double parentGap) {
        Map<String, Point> positions = new LinkedHashMap<>();
        TreeNode tree = buildTree(branchRootId, nodes, outgoing);
        if (tree == null) {
            return positions;
        }
        layout(tree);
        Bounds bounds = treeBounds(tree);
        double dx = parent.centerX() - bounds.width() / 2 - bounds.x();
        double dy = parent.bottom() + parentGap - bounds.y();
        applyOffset(tree, dx, dy);
        collectPositions(tree, positions);
        return positions;
    }

    private static void collectPositions(TreeNode node, Map<String, Point> positions) {
        positions.put(node.id, new Point(node.x, node.y));
        for (TreeNode child : node.children) {
            collectPositions(child, positions);
        }
    }
}
