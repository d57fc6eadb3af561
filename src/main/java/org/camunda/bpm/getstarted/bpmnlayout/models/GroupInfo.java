package org.camunda.bpm.getstarted.bpmnlayout.models;

import java.util.List;

public record GroupInfo(
        String groupId,
        List<String> groupedElements,
        double padding,
        String name,
        String parentId
) {
    public GroupInfo {
        groupedElements = groupedElements == null ? List.of() : List.copyOf(groupedElements);
    }
}
