package org.camunda.bpm.getstarted.bpmnlayout.constraint;

import org.camunda.bpm.getstarted.bpmnlayout.LayoutTrace;
import org.camunda.bpm.getstarted.bpmnlayout.models.Bounds;
import org.camunda.bpm.getstarted.bpmnlayout.models.Point;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves stacking constraints between rectangles in one pass, in the order the constraints were
 * added. A node's y becomes the largest of its own y and every lower bound a {@code BELOW}
 * constraint puts on it, so constraints have to be declared top to bottom.
 * <p>
 * Once a {@code REQUIRED} or {@code FIXED_Y} constraint has set a coordinate, later constraints of
 * lower strength on the same coordinate are skipped.
 */
public class ConstraintSolver {
    private final LayoutTrace trace;
    private final Map<String, Bounds> nodes = new LinkedHashMap<>();
    private final List<StackingConstraint> constraints = new ArrayList<>();

    public ConstraintSolver() {
        this(LayoutTrace.disabled());
    }

    public ConstraintSolver(LayoutTrace trace) {
        this.trace = trace;
    }

    /**
     * Registers a node with its desired position. A second registration of the same id is ignored.
     */
    public void addNode(String id, double x, double y, double width, double height) {
        if (nodes.containsKey(id)) {
            trace.trace("[Constraint] node {} already registered", id);
            return;
        }
        nodes.put(id, new Bounds(x, y, width, height));
    }

    public void addNode(String id, Bounds bounds) {
        addNode(id, bounds.x(), bounds.y(), bounds.width(), bounds.height());
    }

    /**
     * @return false if the constraint refers to a node that was never added
     */
    public boolean addConstraint(StackingConstraint constraint) {
        if (!nodes.containsKey(constraint.nodeId())
                || (constraint.referenceId() != null && !nodes.containsKey(constraint.referenceId()))) {
            trace.trace("[Constraint] rejected {}: unknown node", constraint);
            return false;
        }
        constraints.add(constraint);
        return true;
    }

    public int addConstraints(List<StackingConstraint> batch) {
        int added = 0;
        for (StackingConstraint constraint : batch) {
            if (addConstraint(constraint)) {
                added++;
            }
        }
        return added;
    }

    /**
     * @return the solved top-left corner of every registered node, in registration order
     */
    public Map<String, Point> solve() {
        Map<String, Bounds> solved = solveWithBounds();
        Map<String, Point> positions = new LinkedHashMap<>();
        solved.forEach((id, b) -> positions.put(id, new Point(b.x(), b.y())));
        return positions;
    }

    public Map<String, Bounds> solveWithBounds() {
        Map<String, Bounds> current = new LinkedHashMap<>(nodes);
        Map<String, ConstraintStrength> yLockedBy = new HashMap<>();
        Map<String, ConstraintStrength> xLockedBy = new HashMap<>();

        for (StackingConstraint c : constraints) {
            Bounds node = current.get(c.nodeId());
            Bounds ref = c.referenceId() == null ? null : current.get(c.referenceId());

            switch (c.kind()) {
                case BELOW -> {
                    double minY = ref.bottom() + c.value();
                    if (node.y() < minY && mayMove(yLockedBy, c)) {
                        current.put(c.nodeId(), new Bounds(node.x(), minY, node.width(), node.height()));
                    }
                    lock(yLockedBy, c);
                }
                case ABOVE -> {
                    double maxY = ref.y() - c.value() - node.height();
                    if (node.y() > maxY && mayMove(yLockedBy, c)) {
                        current.put(c.nodeId(), new Bounds(node.x(), maxY, node.width(), node.height()));
                    }
                    lock(yLockedBy, c);
                }
                case ALIGN_X -> {
                    if (mayMove(xLockedBy, c)) {
                        current.put(c.nodeId(), new Bounds(ref.x(), node.y(), node.width(), node.height()));
                    }
                    lock(xLockedBy, c);
                }
                case FIXED_Y -> {
                    if (mayMove(yLockedBy, c)) {
                        current.put(c.nodeId(), new Bounds(node.x(), c.value(), node.width(), node.height()));
                    }
                    lock(yLockedBy, c);
                }
            }
        }

        if (trace.enabled()) {
            current.forEach((id, b) -> trace.trace("[Constraint] {} -> ({}, {})", id, b.x(), b.y()));
        }
        return current;
    }

    public void clear() {
        nodes.clear();
        constraints.clear();
    }

    private static boolean mayMove(Map<String, ConstraintStrength> locks, StackingConstraint c) {
        ConstraintStrength lock = locks.get(c.nodeId());
        return lock == null || c.strength().weight() >= lock.weight();
    }

    private static void lock(Map<String, ConstraintStrength> locks, StackingConstraint c) {
        locks.merge(c.nodeId(), c.strength(), (a, b) -> a.weight() >= b.weight() ? a : b);
    }
}
