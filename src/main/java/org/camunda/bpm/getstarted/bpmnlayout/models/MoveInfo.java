package org.camunda.bpm.getstarted.bpmnlayout.models;

import lombok.Builder;

/**
 * Position change for a single node, in the coordinate system of the node's parent.
 *
 * @param offset vertical distance the node travelled
 * @param newX   new x, or null to keep the current one
 */
@Builder
public record MoveInfo(
        String nodeId,
        double newY,
        double offset,
        Double newX
) {
    public MoveInfo withNewX(Double x) {
        return new MoveInfo(nodeId, newY, offset, x);
    }
}
