package org.camunda.bpm.getstarted.bpmnlayout.models;

/**
 * Coordinate system an edge route is expressed in.
 */
public enum CoordinateSpace {
    /** Relative to the content origin of the node whose {@code edges} list holds the edge. */
    CONTAINER,
    /** Relative to the nearest participant enclosing the owning node. */
    POOL,
    /** Diagram coordinates, never re-offset. */
    ABSOLUTE
}
