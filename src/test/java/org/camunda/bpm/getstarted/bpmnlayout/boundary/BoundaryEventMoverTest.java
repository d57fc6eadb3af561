package org.camunda.bpm.getstarted.bpmnlayout.boundary;

import org.camunda.bpm.getstarted.bpmnlayout.LayoutConfig;
import org.camunda.bpm.getstarted.bpmnlayout.LayoutTrace;
import org.camunda.bpm.getstarted.bpmnlayout.models.BoundaryEventInfo;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnEdge;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.camunda.bpm.getstarted.bpmnlayout.models.MoveInfo;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.camunda.bpm.getstarted.bpmnlayout.TestGraphs.*;
import static org.junit.jupiter.api.Assertions.*;

class BoundaryEventMoverTest {
    private final LayoutConfig config = LayoutConfig.defaults();
    private final BoundaryEventMover mover = new BoundaryEventMover(config, LayoutTrace.disabled());

    /**
     * Host T at (100, 0) 150 wide with one boundary event, the branch nodes as the engine left them.
     */
    private static BpmnNode graph(List<BpmnNode> branchNodes, BpmnEdge... edges) {
        BpmnNode host = node("T", "userTask", 100, 0, 150, 80);
        host.boundaryEvents = new ArrayList<>(List.of(node("BE", "boundaryEvent", 157, 62, 36, 36)));
        BpmnNode root = root(node("S", "startEvent", 0, 22, 36, 36), host);
        root.children.addAll(branchNodes);
        return withEdges(root, edges);
    }

    @Test
    void shouldPlaceDeadEndBranchAtBottomLayer() {
        BpmnNode graph = graph(List.of(node("H", "task", 400, 0, 100, 80)),
                edge("f1", "S", "T"), edge("f2", "BE", "H"));
        Map<String, BoundaryEventInfo> infos = BoundaryEventCollector.collect(graph);

        Map<String, MoveInfo> moves = mover.identifyNodesToMove(graph, infos);

        MoveInfo move = moves.get("H");
        // event centre 175, host bottom 80 plus the merge, end and dead end layer offsets
        assertEquals(175, move.newX());
        assertEquals(345, move.newY());
        assertEquals(345, move.offset());
    }

    @Test
    void shouldPlaceBranchToEndEventAndLineUpFollowers() {
        BpmnNode graph = graph(List.of(node("H", "task", 400, 0, 100, 80), node("E", "endEvent", 550, 22, 36, 36)),
                edge("f1", "S", "T"), edge("f2", "BE", "H"), edge("f3", "H", "E"));
        Map<String, BoundaryEventInfo> infos = BoundaryEventCollector.collect(graph);

        Map<String, MoveInfo> moves = mover.identifyNodesToMove(graph, infos);

        assertEquals(195, moves.get("H").newX());
        assertEquals(245, moves.get("H").newY());
        assertEquals(315, moves.get("E").newX());
        assertEquals(267, moves.get("E").newY());
    }

    @Test
    void shouldKeepMergePointAndMoveConvergingGateway() {
        BpmnNode graph = graph(List.of(node("H", "task", 400, 0, 100, 80), node("G", "exclusiveGateway", 300, 15, 50, 50)),
                edge("f1", "S", "T"), edge("f2", "BE", "H"), edge("f3", "H", "G"), edge("f4", "T", "G"));
        Map<String, BoundaryEventInfo> infos = BoundaryEventCollector.collect(graph);

        Map<String, MoveInfo> moves = mover.identifyNodesToMove(graph, infos);

        assertEquals(280, moves.get("H").newX());
        assertEquals(165, moves.get("H").newY());
        assertFalse(moves.containsKey("G"));

        Map<String, MoveInfo> gatewayMoves = mover.repositionConvergingGateways(graph, moves, infos);
        assertEquals(380 + config.horizontalGap(), gatewayMoves.get("G").newX());
        assertEquals(15, gatewayMoves.get("G").newY());
    }

    @Test
    void shouldApplyMovesToNestedNodes() {
        BpmnNode inner = node("H", "task", 10, 10, 100, 80);
        BpmnNode graph = root(container("SP", "subProcess", inner));

        mover.applyNodeMoves(graph, Map.of("H", MoveInfo.builder().nodeId("H").newY(200).offset(190).newX(50.0).build()));

        assertEquals(50, inner.x);
        assertEquals(200, inner.y);
    }

    @Test
    void shouldLayOutFanOutBranchAsTree() {
        BpmnNode graph = graph(List.of(node("H", "task", 400, 0, 100, 80), node("A", "task", 550, 0, 100, 80),
                        node("B", "task", 700, 0, 100, 80)),
                edge("f1", "S", "T"), edge("f2", "BE", "H"), edge("f3", "H", "A"), edge("f4", "H", "B"));
        Map<String, BoundaryEventInfo> infos = BoundaryEventCollector.collect(graph);

        Map<String, MoveInfo> moves = mover.identifyNodesToMove(graph, infos);

        MoveInfo h = moves.get("H");
        MoveInfo a = moves.get("A");
        MoveInfo b = moves.get("B");
        assertTrue(a.newX() > h.newX() + 100, "children grow to the right");
        assertEquals(a.newX(), b.newX());
        assertTrue(b.newY() >= a.newY() + 80, "siblings stacked");
    }
}
