package org.camunda.bpm.getstarted.bpmnlayout;

import org.camunda.bpm.getstarted.bpmnlayout.artifact.ArtifactPositioner;
import org.camunda.bpm.getstarted.bpmnlayout.boundary.BoundaryEventCollector;
import org.camunda.bpm.getstarted.bpmnlayout.boundary.BoundaryEventHandler;
import org.camunda.bpm.getstarted.bpmnlayout.engine.ElkLayoutEngine;
import org.camunda.bpm.getstarted.bpmnlayout.engine.LayoutEngine;
import org.camunda.bpm.getstarted.bpmnlayout.gateway.GatewayEdgeAdjuster;
import org.camunda.bpm.getstarted.bpmnlayout.group.GroupPositioner;
import org.camunda.bpm.getstarted.bpmnlayout.json.GraphJson;
import org.camunda.bpm.getstarted.bpmnlayout.lane.LaneArranger;
import org.camunda.bpm.getstarted.bpmnlayout.models.ArtifactInfo;
import org.camunda.bpm.getstarted.bpmnlayout.models.BoundaryEventInfo;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.camunda.bpm.getstarted.bpmnlayout.models.GroupInfo;
import org.camunda.bpm.getstarted.bpmnlayout.normalization.MainFlowNormalizer;
import org.camunda.bpm.getstarted.bpmnlayout.pool.PoolArranger;
import org.camunda.bpm.getstarted.bpmnlayout.preparation.ContainerBoundsUpdater;
import org.camunda.bpm.getstarted.bpmnlayout.preparation.GraphPreparer;
import org.camunda.bpm.getstarted.bpmnlayout.preparation.MainFlowDetector;
import org.camunda.bpm.getstarted.bpmnlayout.preparation.ResultMerger;
import org.camunda.bpm.getstarted.bpmnlayout.routing.EdgeFixer;
import org.camunda.bpm.getstarted.bpmnlayout.sizing.SizeCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a BPMN graph without coordinates into a laid out diagram.
 * <p>
 * The graph goes through the layout engine once; every other stage corrects the engine's result
 * for BPMN: main flow on one row, boundary branches below their host, artifacts above their task,
 * lanes and pools stacked, groups fitted and edges kept clear of nodes. The caller's graph is never
 * modified, every call works on its own copy.
 */
public class BpmnLayouter {
    private final LayoutConfig config;
    private final LayoutEngine engine;
    private final LayoutTrace trace;

    public BpmnLayouter(LayoutConfig config, LayoutEngine engine, Logger logger) {
        this.config = config;
        this.engine = engine;
        this.trace = new LayoutTrace(logger, config.debug());
    }

    public static BpmnLayouter withElk(LayoutConfig config) {
        Logger logger = LoggerFactory.getLogger(BpmnLayouter.class);
        return new BpmnLayouter(config, new ElkLayoutEngine(new LayoutTrace(logger, config.debug())), logger);
    }

    public BpmnNode layout(BpmnNode graph) {
        return layout(graph, Map.of());
    }

    /**
     * @param userOptions engine options overriding the defaults and the graph's own options
     * @return a laid out copy of {@code graph}
     * @throws org.camunda.bpm.getstarted.bpmnlayout.engine.LayoutEngineException when the engine fails
     */
    public BpmnNode layout(BpmnNode graph, Map<String, String> userOptions) {
        BpmnNode working = GraphJson.deepCopy(graph);
        new SizeCalculator(config.boundaryEventWidth(), config.boundaryEventSpacing()).applyDefaultSizes(working);

        Map<String, BoundaryEventInfo> boundaryInfos = BoundaryEventCollector.collect(working);
        Set<String> boundaryTargets = BoundaryEventCollector.targetIds(boundaryInfos);
        Map<String, String> boundaryHosts = BoundaryEventCollector.hostMap(boundaryInfos);
        Map<String, ArtifactInfo> artifactInfos = ArtifactPositioner.collectInfo(working);
        GroupPositioner groups = new GroupPositioner(config, trace);
        Map<String, GroupInfo> groupInfos = groups.collectInfo(working);
        trace.trace("[Layout] {} boundary events, {} artifacts, {} groups", boundaryInfos.size(),
                artifactInfos.size(), groupInfos.size());

        trace.stage("Prepare");
        BpmnNode prepared = new GraphPreparer(config, trace).prepare(working, userOptions, boundaryTargets);
        trace.stage("Engine");
        BpmnNode layouted = engine.layout(prepared);

        Set<String> mainFlow = MainFlowDetector.detect(working, boundaryTargets);
        new MainFlowNormalizer(config, trace).normalize(layouted, mainFlow, boundaryTargets, boundaryHosts);
        new BoundaryEventHandler(config, trace).handle(layouted, boundaryInfos, mainFlow);

        ArtifactPositioner artifacts = new ArtifactPositioner(config, trace);
        artifacts.reposition(layouted, artifactInfos);
        new LaneArranger(config, trace).rearrange(layouted, working, boundaryHosts);
        new PoolArranger(config, trace).rearrange(layouted, working);
        groups.reposition(layouted, groupInfos);
        artifacts.recalculateWithObstacleAvoidance(layouted, artifactInfos);

        trace.stage("Edges");
        List<String> rerouted = new EdgeFixer(config, trace).fix(layouted);
        trace.trace("[Layout] edge fixer rerouted {}", rerouted);
        new GatewayEdgeAdjuster(config, trace).adjust(layouted);
        new ContainerBoundsUpdater(config, trace).update(layouted);

        trace.stage("Merge");
        return new ResultMerger(config, trace).merge(working, layouted);
    }

    /**
     * JSON in, JSON out.
     *
     * @throws IllegalArgumentException if {@code json} is not a valid graph document
     */
    public String layoutJson(String json) {
        return GraphJson.write(layout(GraphJson.read(json)));
    }
}
