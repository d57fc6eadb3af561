package org.camunda.bpm.getstarted.bpmnlayout.preparation;

import org.camunda.bpm.getstarted.bpmnlayout.LayoutConfig;
import org.camunda.bpm.getstarted.bpmnlayout.LayoutTrace;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnEdge;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnTypes;
import org.camunda.bpm.getstarted.bpmnlayout.models.CoordinateSpace;
import org.camunda.bpm.getstarted.bpmnlayout.models.Label;

import java.util.List;

/**
 * Grows containers bottom-up until they enclose their children plus padding. Lane stacks (all
 * children at the lane header offset) and pool stacks get no padding.
 * <p>
 * A child pushed to a negative position is brought back by moving the container's content by the
 * same amount in the opposite direction as the container, which keeps every absolute position.
 * Content above or left of the diagram origin (an artifact above a top-level task) moves the whole
 * diagram instead.
 */
public class ContainerBoundsUpdater {
    private final double padding;
    private final double laneHeaderWidth;
    private final LayoutTrace trace;

    public ContainerBoundsUpdater(LayoutConfig config, LayoutTrace trace) {
        this.padding = config.containerPadding();
        this.laneHeaderWidth = config.laneHeaderWidth();
        this.trace = trace;
    }

    public void update(BpmnNode graph) {
        updateNode(graph, true);
    }

    private void updateNode(BpmnNode node, boolean root) {
        if (!node.hasChildren()) {
            return;
        }
        for (BpmnNode child : node.children) {
            updateNode(child, false);
        }

        boolean stack = node.children.stream().allMatch(c -> c.xValue() == laneHeaderWidth)
                || node.children.stream().allMatch(c -> BpmnTypes.isPool(c.type()));
        double pad = stack ? 0 : padding;

        double minX = Double.MAX_VALUE;
        double minY = Double.MAX_VALUE;
        for (BpmnNode child : node.children) {
            minX = Math.min(minX, child.xValue());
            minY = Math.min(minY, child.yValue());
        }
        double shiftX = minX < 0 ? pad - minX : 0;
        double shiftY = minY < 0 ? pad - minY : 0;
        if (shiftX > 0 || shiftY > 0) {
            if (root) {
                shiftDiagram(node, shiftX, shiftY);
            } else {
                shiftContent(node, shiftX, shiftY);
            }
        }

        double requiredWidth = 0;
        double requiredHeight = 0;
        for (BpmnNode child : node.children) {
            requiredWidth = Math.max(requiredWidth, child.xValue() + child.widthValue() + pad);
            requiredHeight = Math.max(requiredHeight, child.yValue() + child.heightValue() + pad);
        }
        if (requiredWidth > node.widthValue()) {
            node.width = requiredWidth;
        }
        if (requiredHeight > node.heightValue()) {
            node.height = requiredHeight;
        }
    }

    private void shiftContent(BpmnNode container, double dx, double dy) {
        trace.trace("[Bounds] {} content shifted by ({}, {})", container.id, dx, dy);
        container.x = container.xValue() - dx;
        container.y = container.yValue() - dy;
        container.width = container.widthValue() + dx;
        container.height = container.heightValue() + dy;
        for (BpmnNode child : container.children) {
            child.x = child.xValue() + dx;
            child.y = child.yValue() + dy;
        }
        boolean pool = BpmnTypes.isPool(container.type());
        for (BpmnEdge edge : container.edgesOrEmpty()) {
            if (edge.coordinateSpace() == CoordinateSpace.CONTAINER
                    || (pool && edge.coordinateSpace() == CoordinateSpace.POOL)) {
                edge.translateRoute(dx, dy);
            }
        }
        if (pool) {
            shiftPoolRelativeEdges(container.children, dx, dy);
        }
    }

    /**
     * The root has no parent to grow into: its content moves instead, with every route that is not
     * relative to a moved container.
     */
    private void shiftDiagram(BpmnNode root, double dx, double dy) {
        trace.trace("[Bounds] diagram content shifted by ({}, {})", dx, dy);
        for (BpmnNode child : root.children) {
            child.x = child.xValue() + dx;
            child.y = child.yValue() + dy;
        }
        for (BpmnEdge edge : root.edgesOrEmpty()) {
            edge.translateRoute(dx, dy);
            translateLabels(edge, dx, dy);
        }
        shiftAbsoluteEdges(root.children, dx, dy);
    }

    private static void shiftAbsoluteEdges(List<BpmnNode> nodes, double dx, double dy) {
        for (BpmnNode node : nodes) {
            for (BpmnEdge edge : node.edgesOrEmpty()) {
                if (edge.coordinateSpace() == CoordinateSpace.ABSOLUTE) {
                    edge.translateRoute(dx, dy);
                }
            }
            shiftAbsoluteEdges(node.childrenOrEmpty(), dx, dy);
        }
    }

    private static void translateLabels(BpmnEdge edge, double dx, double dy) {
        if (edge.labels == null) {
            return;
        }
        for (Label label : edge.labels) {
            if (label.x != null && label.y != null) {
                label.x = label.x + dx;
                label.y = label.y + dy;
            }
        }
    }

    // edges below the pool that are written relative to it
    private void shiftPoolRelativeEdges(List<BpmnNode> nodes, double dx, double dy) {
        for (BpmnNode node : nodes) {
            if (BpmnTypes.isPool(node.type())) {
                continue;
            }
            for (BpmnEdge edge : node.edgesOrEmpty()) {
                if (edge.coordinateSpace() == CoordinateSpace.POOL) {
                    edge.translateRoute(dx, dy);
                }
            }
            shiftPoolRelativeEdges(node.childrenOrEmpty(), dx, dy);
        }
    }
}
