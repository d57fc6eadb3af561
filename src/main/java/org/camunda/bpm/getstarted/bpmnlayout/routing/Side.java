package org.camunda.bpm.getstarted.bpmnlayout.routing;

import org.camunda.bpm.getstarted.bpmnlayout.models.Bounds;
import org.camunda.bpm.getstarted.bpmnlayout.models.Point;

/**
 * Side of a node an edge leaves or enters through.
 */
public enum Side {
    LEFT, RIGHT, TOP, BOTTOM;

    /**
     * Middle of this side of the given bounds.
     */
    public Point connectionPoint(Bounds bounds) {
        return switch (this) {
            case LEFT -> new Point(bounds.x(), bounds.centerY());
            case RIGHT -> new Point(bounds.right(), bounds.centerY());
            case TOP -> new Point(bounds.centerX(), bounds.y());
            case BOTTOM -> new Point(bounds.centerX(), bounds.bottom());
        };
    }

    public boolean isHorizontal() {
        return this == LEFT || this == RIGHT;
    }

    public Side opposite() {
        return switch (this) {
            case LEFT -> RIGHT;
            case RIGHT -> LEFT;
            case TOP -> BOTTOM;
            case BOTTOM -> TOP;
        };
    }
}
