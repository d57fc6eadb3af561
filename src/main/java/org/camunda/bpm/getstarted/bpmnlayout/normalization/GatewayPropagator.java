package org.camunda.bpm.getstarted.bpmnlayout.normalization;

import org.camunda.bpm.getstarted.bpmnlayout.LayoutConfig;
import org.camunda.bpm.getstarted.bpmnlayout.LayoutTrace;
import org.camunda.bpm.getstarted.bpmnlayout.index.NodeIndex;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.camunda.bpm.getstarted.bpmnlayout.models.MoveInfo;
import org.camunda.bpm.getstarted.bpmnlayout.preparation.MainFlowDetector;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pushes main flow nodes to the right after a converging gateway was moved, so the flow behind the
 * gateway keeps its spacing. Every node is moved at most once.
 */
public class GatewayPropagator {
    private final double horizontalGap;
    private final LayoutTrace trace;

    public GatewayPropagator(LayoutConfig config, LayoutTrace trace) {
        this.horizontalGap = config.horizontalGap();
        this.trace = trace;
    }

    /**
     * Moves the main flow successors of every gateway move that carries a new x.
     *
     * @return the moves applied to downstream nodes, offset 0, keyed by node id
     */
    public Map<String, MoveInfo> propagate(BpmnNode graph, Map<String, MoveInfo> gatewayMoves, Set<String> mainFlow) {
        NodeIndex index = NodeIndex.build(graph);
        Map<String, List<String>> outgoing = MainFlowDetector.outgoingEdges(graph);
        Map<String, MoveInfo> propagated = new LinkedHashMap<>();

        for (MoveInfo move : gatewayMoves.values()) {
            BpmnNode gateway = index.node(move.nodeId());
            if (move.newX() == null || gateway == null) {
                continue;
            }
            pushTargets(move.nodeId(), move.newX() + gateway.widthValue(), index, outgoing, mainFlow, gatewayMoves,
                    propagated);
        }
        return propagated;
    }

    private void pushTargets(String sourceId, double sourceRight, NodeIndex index, Map<String, List<String>> outgoing,
                             Set<String> mainFlow, Map<String, MoveInfo> gatewayMoves,
                             Map<String, MoveInfo> propagated) {
        for (String targetId : outgoing.getOrDefault(sourceId, List.of())) {
            if (!mainFlow.contains(targetId) || gatewayMoves.containsKey(targetId)
                    || propagated.containsKey(targetId)) {
                continue;
            }
            BpmnNode target = index.node(targetId);
            if (target == null) {
                continue;
            }
            double newX = sourceRight + horizontalGap;
            if (newX <= target.xValue()) {
                continue;
            }
            trace.trace("[Propagate] {} x {} -> {}", targetId, target.xValue(), newX);
            target.x = newX;
            propagated.put(targetId, MoveInfo.builder()
                    .nodeId(targetId)
                    .newY(target.yValue())
                    .offset(0)
                    .newX(newX)
                    .build());
            pushTargets(targetId, newX + target.widthValue(), index, outgoing, mainFlow, gatewayMoves, propagated);
        }
    }
}
