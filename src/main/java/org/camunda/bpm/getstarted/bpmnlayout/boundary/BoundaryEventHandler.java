package org.camunda.bpm.getstarted.bpmnlayout.boundary;

import org.camunda.bpm.getstarted.bpmnlayout.LayoutConfig;
import org.camunda.bpm.getstarted.bpmnlayout.LayoutTrace;
import org.camunda.bpm.getstarted.bpmnlayout.models.BoundaryEventInfo;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.camunda.bpm.getstarted.bpmnlayout.models.MoveInfo;
import org.camunda.bpm.getstarted.bpmnlayout.normalization.GatewayPropagator;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Places boundary branches below the main flow and repairs what that breaks: converging gateways
 * move behind the branches joining them, the main flow behind those gateways follows, and every edge
 * touching a moved node is rerouted.
 */
public class BoundaryEventHandler {
    private final BoundaryEventMover mover;
    private final BoundaryEdgeRecalculator recalculator;
    private final GatewayPropagator propagator;
    private final LayoutTrace trace;

    public BoundaryEventHandler(LayoutConfig config, LayoutTrace trace) {
        this.mover = new BoundaryEventMover(config, trace);
        this.recalculator = new BoundaryEdgeRecalculator(config, trace);
        this.propagator = new GatewayPropagator(config, trace);
        this.trace = trace;
    }

    /**
     * @param infos    boundary events of the caller's tree, see {@link BoundaryEventCollector}
     * @param mainFlow ids of the main flow nodes
     * @return every move applied, keyed by node id
     */
    public Map<String, MoveInfo> handle(BpmnNode graph, Map<String, BoundaryEventInfo> infos, Set<String> mainFlow) {
        if (infos.isEmpty()) {
            return Map.of();
        }
        trace.stage("Boundary events");
        Map<String, MoveInfo> moves = mover.identifyNodesToMove(graph, infos);
        mover.applyNodeMoves(graph, moves);

        Map<String, MoveInfo> gatewayMoves = mover.repositionConvergingGateways(graph, moves, infos);
        mover.applyNodeMoves(graph, gatewayMoves);
        Map<String, MoveInfo> propagated = propagator.propagate(graph, gatewayMoves, mainFlow);

        Map<String, MoveInfo> all = new LinkedHashMap<>(moves);
        all.putAll(gatewayMoves);
        all.putAll(propagated);
        if (all.isEmpty()) {
            trace.trace("[Boundary] nothing to move");
        }
        recalculator.recalculate(graph, all, infos);
        return all;
    }
}
