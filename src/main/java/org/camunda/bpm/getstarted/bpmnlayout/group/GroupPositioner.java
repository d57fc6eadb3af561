package org.camunda.bpm.getstarted.bpmnlayout.group;

import org.camunda.bpm.getstarted.bpmnlayout.LayoutConfig;
import org.camunda.bpm.getstarted.bpmnlayout.LayoutTrace;
import org.camunda.bpm.getstarted.bpmnlayout.index.NodeIndex;
import org.camunda.bpm.getstarted.bpmnlayout.models.Bounds;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnTypes;
import org.camunda.bpm.getstarted.bpmnlayout.models.GroupInfo;
import org.camunda.bpm.getstarted.bpmnlayout.models.Point;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fits groups around the elements they group. Groups are visual overlays, the engine places them
 * like any other node; afterwards their bounds become the box around their elements plus padding.
 */
public class GroupPositioner {
    private final LayoutConfig config;
    private final LayoutTrace trace;

    public GroupPositioner(LayoutConfig config, LayoutTrace trace) {
        this.config = config;
        this.trace = trace;
    }

    /**
     * @return group id to its info, the parent being the node whose children list holds the group
     */
    public Map<String, GroupInfo> collectInfo(BpmnNode graph) {
        Map<String, GroupInfo> infos = new LinkedHashMap<>();
        collect(graph, infos);
        return infos;
    }

    private void collect(BpmnNode parent, Map<String, GroupInfo> infos) {
        for (BpmnNode child : parent.childrenOrEmpty()) {
            if (BpmnTypes.isGroup(child.type())) {
                double padding = child.bpmn.padding == null ? config.groupPadding() : child.bpmn.padding;
                infos.put(child.id, new GroupInfo(child.id, child.bpmn.groupedElements, padding, child.name(),
                        parent.id));
            }
            collect(child, infos);
        }
    }

    /**
     * Groups without elements, or whose elements are all unknown, keep their position.
     */
    public void reposition(BpmnNode graph, Map<String, GroupInfo> infos) {
        if (infos.isEmpty()) {
            return;
        }
        trace.stage("Groups");
        NodeIndex index = NodeIndex.build(graph);
        for (GroupInfo info : infos.values()) {
            BpmnNode group = index.node(info.groupId());
            if (group == null || info.groupedElements().isEmpty()) {
                continue;
            }
            Bounds box = null;
            for (String elementId : info.groupedElements()) {
                if (!index.contains(elementId)) {
                    trace.trace("[Group] {} refers to unknown element {}", info.groupId(), elementId);
                    continue;
                }
                Bounds element = index.absoluteBounds(elementId);
                box = box == null ? element : Bounds.union(box, element);
            }
            if (box == null) {
                continue;
            }
            Bounds padded = box.expand(info.padding());
            Point origin = index.contentOrigin(index.parentId(info.groupId()));
            group.setPosition(padded.x() - origin.x(), padded.y() - origin.y());
            group.setSize(padded.width(), padded.height());
            trace.trace("[Group] {} -> {}", info.groupId(), group);
        }
    }
}
