package org.camunda.bpm.getstarted.bpmnlayout.boundary;

/**
 * Where a boundary branch ends up. Branches are stacked below the main flow in this order, the ones
 * rejoining the main flow closest to it.
 */
public enum BranchDestination {
    MERGE_TO_MAIN,
    TO_END_EVENT,
    DEAD_END
}
