package org.camunda.bpm.getstarted.bpmnlayout.sizing;

import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.camunda.bpm.getstarted.bpmnlayout.TestGraphs.*;
import static org.junit.jupiter.api.Assertions.*;

class SizeCalculatorTest {
    private final SizeCalculator calculator = new SizeCalculator();

    @Test
    void shouldPickSizeByCategory() {
        assertEquals(DefaultSizes.EVENT, calculator.defaultSizeFor("startEvent", null, null));
        assertEquals(DefaultSizes.GATEWAY, calculator.defaultSizeFor("exclusiveGateway", null, null));
        assertEquals(DefaultSizes.TASK, calculator.defaultSizeFor("userTask", "Review", null));
        assertEquals(DefaultSizes.DATA_OBJECT, calculator.defaultSizeFor("dataObjectReference", null, null));
        assertEquals(DefaultSizes.DATA_STORE, calculator.defaultSizeFor("dataStoreReference", null, null));
        assertEquals(DefaultSizes.OTHER, calculator.defaultSizeFor(null, null, null));
    }

    @Test
    void shouldWidenTasksWithLongNames() {
        assertEquals(DefaultSizes.TASK_WIDE, calculator.defaultSizeFor("task", "Approve it", null));
        assertEquals(DefaultSizes.TASK_WIDER, calculator.defaultSizeFor("task", "Approve the order", null));
    }

    @Test
    void shouldUseExpandedSizeForExpandedSubProcess() {
        assertEquals(DefaultSizes.SUBPROCESS_EXPANDED_MIN, calculator.defaultSizeFor("subProcess", null, true));
        assertEquals(DefaultSizes.SUBPROCESS_COLLAPSED, calculator.defaultSizeFor("subProcess", null, false));
    }

    @Test
    void shouldKeepExplicitSizes() {
        BpmnNode task = node("T", "task");
        task.width = 140.0;
        BpmnNode graph = root(task);

        calculator.applyDefaultSizes(graph);

        assertEquals(140, task.width);
        assertEquals(80, task.height);
    }

    @Test
    void shouldWidenHostForBoundaryEvents() {
        BpmnNode task = node("T", "task");
        task.boundaryEvents = new ArrayList<>(List.of(node("B1", "boundaryEvent"), node("B2", "boundaryEvent"),
                node("B3", "boundaryEvent")));

        calculator.applyDefaultSizes(root(task));

        // three events at a 56 px pitch plus one spacing
        assertEquals(188, task.width);
        assertEquals(36, task.boundaryEvents.get(0).width);
    }

    @Test
    void shouldEstimateLabelWidth() {
        assertEquals(50, SizeCalculator.estimateLabelWidth(""));
        assertEquals(30, SizeCalculator.estimateLabelWidth("ab"));
        assertEquals(70, SizeCalculator.estimateLabelWidth("0123456789"));
        assertEquals(200, SizeCalculator.estimateLabelWidth("x".repeat(100)));
    }
}
