package org.camunda.bpm.getstarted.bpmnlayout.group;

import org.camunda.bpm.getstarted.bpmnlayout.LayoutConfig;
import org.camunda.bpm.getstarted.bpmnlayout.LayoutTrace;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.camunda.bpm.getstarted.bpmnlayout.models.GroupInfo;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.camunda.bpm.getstarted.bpmnlayout.TestGraphs.*;
import static org.junit.jupiter.api.Assertions.*;

class GroupPositionerTest {
    private final GroupPositioner positioner = new GroupPositioner(LayoutConfig.defaults(), LayoutTrace.disabled());

    private static BpmnNode group(String id, List<String> elements) {
        BpmnNode group = node(id, "group", 0, 0, 10, 10);
        group.bpmn.groupedElements = elements;
        return group;
    }

    @Test
    void shouldCollectGroupsWithDefaultPadding() {
        BpmnNode graph = root(container("SP", "subProcess", group("G", List.of("A"))));

        Map<String, GroupInfo> infos = positioner.collectInfo(graph);

        GroupInfo info = infos.get("G");
        assertEquals("SP", info.parentId());
        assertEquals(20, info.padding());
        assertEquals(List.of("A"), info.groupedElements());
    }

    @Test
    void shouldFitGroupAroundElements() {
        BpmnNode g = group("G", List.of("A", "B", "missing"));
        BpmnNode graph = root(node("A", "task", 0, 0, 100, 80), node("B", "task", 200, 50, 100, 80), g);

        positioner.reposition(graph, positioner.collectInfo(graph));

        assertEquals(-20, g.x);
        assertEquals(-20, g.y);
        assertEquals(340, g.width);
        assertEquals(170, g.height);
    }

    @Test
    void shouldUseOwnPaddingAndParentCoordinates() {
        BpmnNode g = group("G", List.of("A"));
        g.bpmn.padding = 5.0;
        BpmnNode subProcess = container("SP", "subProcess", node("A", "task", 10, 10, 100, 80), g);
        subProcess.setPosition(100, 100);
        BpmnNode graph = root(subProcess);

        positioner.reposition(graph, positioner.collectInfo(graph));

        assertEquals(5, g.x);
        assertEquals(5, g.y);
        assertEquals(110, g.width);
    }

    @Test
    void shouldKeepGroupWithoutKnownElements() {
        BpmnNode g = group("G", List.of("nope"));
        BpmnNode graph = root(node("A", "task", 0, 0, 100, 80), g);

        positioner.reposition(graph, positioner.collectInfo(graph));

        assertEquals(0, g.x);
        assertEquals(10, g.width);
    }
}
