package org.camunda.bpm.getstarted.bpmnlayout.preparation;

import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnEdge;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnTypes;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds the main flow: every node reachable from a start event without passing through a boundary
 * event or a node that starts a boundary branch. Several start events are supported, the result is
 * the union of what they reach.
 */
public final class MainFlowDetector {

    private MainFlowDetector() {
    }

    public static Set<String> detect(BpmnNode graph, Set<String> boundaryTargetIds) {
        Map<String, List<String>> outgoing = new HashMap<>();
        Set<String> boundaryEventIds = new HashSet<>();
        List<String> startEvents = new ArrayList<>();
        collect(graph, outgoing, boundaryEventIds, startEvents);

        Set<String> mainFlow = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        for (String start : startEvents) {
            stack.push(start);
            while (!stack.isEmpty()) {
                String id = stack.pop();
                if (mainFlow.contains(id) || boundaryTargetIds.contains(id) || boundaryEventIds.contains(id)) {
                    continue;
                }
                mainFlow.add(id);
                List<String> targets = outgoing.getOrDefault(id, List.of());
                for (int i = targets.size() - 1; i >= 0; i--) {
                    stack.push(targets.get(i));
                }
            }
        }
        return mainFlow;
    }

    /**
     * @return source id to target ids over every edge of the tree, in declaration order
     */
    public static Map<String, List<String>> outgoingEdges(BpmnNode graph) {
        Map<String, List<String>> outgoing = new HashMap<>();
        collect(graph, outgoing, new HashSet<>(), new ArrayList<>());
        return outgoing;
    }

    private static void collect(BpmnNode node, Map<String, List<String>> outgoing, Set<String> boundaryEventIds,
                                List<String> startEvents) {
        if (node.isType(BpmnTypes.START_EVENT)) {
            startEvents.add(node.id);
        }
        for (BpmnNode event : node.boundaryEventsOrEmpty()) {
            boundaryEventIds.add(event.id);
        }
        for (BpmnEdge edge : node.edgesOrEmpty()) {
            String source = edge.sourceId();
            String target = edge.targetId();
            if (source != null && target != null) {
                outgoing.computeIfAbsent(source, k -> new ArrayList<>()).add(target);
            }
        }
        for (BpmnNode child : node.childrenOrEmpty()) {
            collect(child, outgoing, boundaryEventIds, startEvents);
        }
    }
}
