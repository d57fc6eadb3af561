package org.camunda.bpm.getstarted.bpmnlayout.models;

import java.util.List;

/**
 * A boundary event, its host and the first nodes of the branch it starts.
 *
 * @param index 0-based position among the events attached to the same host
 * @param total number of events attached to the host
 */
public record BoundaryEventInfo(
        String boundaryEventId,
        String hostId,
        List<String> targets,
        int index,
        int total
) {
    public BoundaryEventInfo {
        targets = targets == null ? List.of() : List.copyOf(targets);
    }
}
