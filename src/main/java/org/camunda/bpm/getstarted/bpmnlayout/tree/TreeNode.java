package org.camunda.bpm.getstarted.bpmnlayout.tree;

import org.camunda.bpm.getstarted.bpmnlayout.models.Bounds;

import java.util.ArrayList;
import java.util.List;

/**
 * Node of a branch handed to the {@link TreeLayouter}. {@code x} and {@code y} hold the top-left
 * corner and are overwritten by the layout.
 */
public class TreeNode {
    public final String id;
    public double x;
    public double y;
    public final double width;
    public final double height;
    public final List<TreeNode> children = new ArrayList<>();

    // layout scratch values, relative to the left edge of the node's subtree
    double prelim;
    double modifier;
    double subtreeBreadth;

    public TreeNode(String id, double x, double y, double width, double height) {
        this.id = id;
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public TreeNode(String id, Bounds bounds) {
        this(id, bounds.x(), bounds.y(), bounds.width(), bounds.height());
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public Bounds bounds() {
        return new Bounds(x, y, width, height);
    }

    @Override
    public String toString() {
        return String.format("%s(%.1f,%.1f)", id, x, y);
    }
}
