package org.camunda.bpm.getstarted.bpmnlayout.boundary;

import org.camunda.bpm.getstarted.bpmnlayout.models.BoundaryEventInfo;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.camunda.bpm.getstarted.bpmnlayout.preparation.MainFlowDetector;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the boundary events of the caller's tree before it is prepared for the layout engine. After
 * preparation the events are plain siblings of their host, so the host relation has to be taken from
 * here.
 */
public final class BoundaryEventCollector {

    private BoundaryEventCollector() {
    }

    /**
     * @return boundary event id to its info, hosts in tree order and events in declaration order
     */
    public static Map<String, BoundaryEventInfo> collect(BpmnNode graph) {
        Map<String, List<String>> outgoing = MainFlowDetector.outgoingEdges(graph);
        Map<String, BoundaryEventInfo> infos = new LinkedHashMap<>();
        collect(graph, outgoing, infos);
        return infos;
    }

    private static void collect(BpmnNode node, Map<String, List<String>> outgoing,
                                Map<String, BoundaryEventInfo> infos) {
        List<BpmnNode> events = node.boundaryEventsOrEmpty();
        for (int i = 0; i < events.size(); i++) {
            BpmnNode event = events.get(i);
            if (event.id == null) {
                continue;
            }
            infos.put(event.id, new BoundaryEventInfo(event.id, node.id,
                    outgoing.getOrDefault(event.id, List.of()), i, events.size()));
        }
        for (BpmnNode child : node.childrenOrEmpty()) {
            collect(child, outgoing, infos);
        }
    }

    /**
     * Nodes a boundary event leads to directly.
     */
    public static Set<String> targetIds(Map<String, BoundaryEventInfo> infos) {
        Set<String> targets = new HashSet<>();
        for (BoundaryEventInfo info : infos.values()) {
            targets.addAll(info.targets());
        }
        return targets;
    }

    /**
     * @return boundary event id to host id
     */
    public static Map<String, String> hostMap(Map<String, BoundaryEventInfo> infos) {
        Map<String, String> hosts = new LinkedHashMap<>();
        infos.forEach((id, info) -> hosts.put(id, info.hostId()));
        return hosts;
    }
}
