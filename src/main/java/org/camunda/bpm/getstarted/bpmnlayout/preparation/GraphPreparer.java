package org.camunda.bpm.getstarted.bpmnlayout.preparation;

import org.camunda.bpm.getstarted.bpmnlayout.LayoutConfig;
import org.camunda.bpm.getstarted.bpmnlayout.LayoutTrace;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnEdge;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnTypes;
import org.camunda.bpm.getstarted.bpmnlayout.models.Label;
import org.camunda.bpm.getstarted.bpmnlayout.models.LayerConstraint;
import org.camunda.bpm.getstarted.bpmnlayout.models.LayoutPriority;
import org.camunda.bpm.getstarted.bpmnlayout.models.Padding;
import org.camunda.bpm.getstarted.bpmnlayout.models.Port;
import org.camunda.bpm.getstarted.bpmnlayout.options.ElkOptions;
import org.camunda.bpm.getstarted.bpmnlayout.sizing.SizeCalculator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a sized BPMN tree into the tree handed to the layout engine.
 * <p>
 * Lanes never reach the engine: their contents are hoisted to the pool. When a collaboration has
 * flows crossing its pools, the pools are dissolved as well so the engine can route those flows.
 * Boundary events become siblings placed right after their host. Start and end events are pinned to
 * the first and last layer, main flow nodes get a higher priority than boundary branches.
 * <p>
 * The returned tree is a new structure; the input is not modified. Element metadata is shared.
 */
public class GraphPreparer {
    private static final double DEFAULT_BOUNDARY_EVENT_SIZE = 36;
    private static final double EDGE_LABEL_WIDTH = 50;
    private static final double LABEL_HEIGHT = 14;
    private static final double PORT_SIZE = 10;
    private static final Padding EXPANDED_SUBPROCESS_PADDING = new Padding(30, 12, 30, 12);

    private final LayoutConfig config;
    private final LayoutTrace trace;

    public GraphPreparer(LayoutConfig config, LayoutTrace trace) {
        this.config = config;
        this.trace = trace;
    }

    public BpmnNode prepare(BpmnNode graph, Map<String, String> userOptions, Set<String> boundaryTargetIds) {
        Map<String, String> options = ElkOptions.merge(userOptions, graph.layoutOptions);
        if (hasCrossPoolCollaboration(graph)) {
            options.put(ElkOptions.DIRECTION, "RIGHT");
        }
        Set<String> mainFlow = MainFlowDetector.detect(graph, boundaryTargetIds);
        trace.trace("[Prepare] main flow: {}", mainFlow);

        BpmnNode root = new BpmnNode();
        root.id = graph.id == null ? "root" : graph.id;
        root.layoutOptions = options;
        root.labels = copyLabels(graph.labels, false);
        Context context = new Context(boundaryTargetIds, mainFlow);
        for (BpmnNode child : graph.childrenOrEmpty()) {
            addWithBoundaryEvents(child, root.mutableChildren(), context);
        }
        root.edges = copyEdges(graph.edges);
        return root;
    }

    private record Context(Set<String> boundaryTargets, Set<String> mainFlow) {
    }

    /**
     * True for a collaboration holding more than one pool and at least one sequence flow or data
     * association at collaboration level, i.e. a flow that crosses pools.
     */
    public static boolean hasCrossPoolCollaboration(BpmnNode graph) {
        for (BpmnNode child : graph.childrenOrEmpty()) {
            if (isCrossPoolCollaboration(child)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isCrossPoolCollaboration(BpmnNode node) {
        if (!node.isType(BpmnTypes.COLLABORATION)) {
            return false;
        }
        long pools = node.childrenOrEmpty().stream().filter(c -> c.isType(BpmnTypes.PARTICIPANT)).count();
        if (pools <= 1) {
            return false;
        }
        return node.edgesOrEmpty().stream().anyMatch(e -> BpmnTypes.SEQUENCE_FLOW.equals(e.type())
                || BpmnTypes.isDataAssociation(e.type()));
    }

    private void addWithBoundaryEvents(BpmnNode source, List<BpmnNode> target, Context context) {
        target.add(prepareNode(source, context));
        for (BpmnNode event : source.boundaryEventsOrEmpty()) {
            target.add(boundaryEventSibling(event));
        }
    }

    private BpmnNode prepareNode(BpmnNode source, Context context) {
        BpmnNode node = shallowCopy(source);
        applyFlowHints(node, context);

        if (isCrossPoolCollaboration(source)) {
            node.layoutOptions.put(ElkOptions.ALGORITHM, "layered");
            node.layoutOptions.put(ElkOptions.DIRECTION, "RIGHT");
            node.layoutOptions.put(ElkOptions.HIERARCHY_HANDLING, "INCLUDE_CHILDREN");
            node.layoutOptions.remove(ElkOptions.PADDING);
            node.padding = Padding.uniform(config.flattenedPoolPadding());
            List<BpmnEdge> hoisted = new ArrayList<>();
            flattenPools(source, node.mutableChildren(), hoisted, context);
            node.edges = copyEdges(source.edges);
            node.mutableEdges().addAll(hoisted);
            trace.trace("[Prepare] flattened pools of collaboration {}", source.id);
            return node;
        }

        boolean pool = source.isType(BpmnTypes.PARTICIPANT);
        boolean withLanes = pool && source.childrenOrEmpty().stream().anyMatch(c -> c.isType(BpmnTypes.LANE));
        if (pool) {
            node.layoutOptions.put(ElkOptions.ALGORITHM, "layered");
            node.layoutOptions.put(ElkOptions.DIRECTION, "RIGHT");
            node.layoutOptions.remove(ElkOptions.PADDING);
            double padding = config.containerPadding();
            if (withLanes) {
                node.layoutOptions.put(ElkOptions.PARTITIONING_ACTIVATE, "false");
                node.layoutOptions.put(ElkOptions.HIERARCHY_HANDLING, "INCLUDE_CHILDREN");
                node.padding = new Padding(padding, config.laneHeaderWidth(), padding, padding);
            } else {
                node.padding = new Padding(padding, config.poolHeaderWidth(), padding, padding);
            }
        } else if (source.isType(BpmnTypes.LANE)) {
            // the pool lays out lane content, a lane only keeps its padding
            node.layoutOptions.clear();
            node.padding = Padding.uniform(config.containerPadding());
        } else if (BpmnTypes.isSubProcess(source.type()) && BpmnTypes.isExpandedSubProcess(source)
                && source.option(ElkOptions.PADDING) == null) {
            node.padding = EXPANDED_SUBPROCESS_PADDING;
        }

        if (withLanes) {
            List<BpmnEdge> hoisted = new ArrayList<>();
            flattenLanes(source.childrenOrEmpty(), node.mutableChildren(), hoisted, context);
            node.edges = copyEdges(source.edges);
            node.mutableEdges().addAll(hoisted);
        } else {
            for (BpmnNode child : source.childrenOrEmpty()) {
                addWithBoundaryEvents(child, node.mutableChildren(), context);
            }
            node.edges = copyEdges(source.edges);
        }
        if (node.children != null && node.children.isEmpty()) {
            node.children = null;
        }
        return node;
    }

    private void flattenPools(BpmnNode collaboration, List<BpmnNode> result, List<BpmnEdge> hoisted, Context context) {
        for (BpmnNode child : collaboration.childrenOrEmpty()) {
            if (!child.isType(BpmnTypes.PARTICIPANT)) {
                addWithBoundaryEvents(child, result, context);
                continue;
            }
            if (!child.hasChildren()) {
                // black-box pool stays as a plain node so message flows can still reach it
                BpmnNode blackBox = shallowCopy(child);
                blackBox.layoutOptions.clear();
                blackBox.height = config.blackBoxPoolHeight();
                result.add(blackBox);
                continue;
            }
            hoisted.addAll(copyEdges(child.edgesOrEmpty()));
            if (child.childrenOrEmpty().stream().anyMatch(c -> c.isType(BpmnTypes.LANE))) {
                flattenLanes(child.childrenOrEmpty(), result, hoisted, context);
            } else {
                for (BpmnNode poolChild : child.childrenOrEmpty()) {
                    addWithBoundaryEvents(poolChild, result, context);
                }
            }
        }
    }

    private void flattenLanes(List<BpmnNode> children, List<BpmnNode> result, List<BpmnEdge> hoisted,
                              Context context) {
        for (BpmnNode child : children) {
            if (child.isType(BpmnTypes.LANE)) {
                hoisted.addAll(copyEdges(child.edgesOrEmpty()));
                flattenLanes(child.childrenOrEmpty(), result, hoisted, context);
            } else {
                addWithBoundaryEvents(child, result, context);
            }
        }
    }

    private void applyFlowHints(BpmnNode node, Context context) {
        if (node.isType(BpmnTypes.START_EVENT)) {
            node.layerConstraint = LayerConstraint.FIRST;
        } else if (node.isType(BpmnTypes.END_EVENT)) {
            node.layerConstraint = LayerConstraint.LAST;
        }
        if (context.boundaryTargets().contains(node.id)) {
            node.priority = LayoutPriority.BOUNDARY_BRANCH;
        } else if (context.mainFlow().contains(node.id)) {
            node.priority = LayoutPriority.MAIN_FLOW;
        }
    }

    private BpmnNode boundaryEventSibling(BpmnNode event) {
        BpmnNode sibling = new BpmnNode();
        sibling.id = event.id;
        sibling.bpmn = event.bpmn;
        sibling.width = event.width == null ? DEFAULT_BOUNDARY_EVENT_SIZE : event.width;
        sibling.height = event.height == null ? DEFAULT_BOUNDARY_EVENT_SIZE : event.height;
        return sibling;
    }

    private BpmnNode shallowCopy(BpmnNode source) {
        BpmnNode node = new BpmnNode();
        node.id = source.id;
        node.bpmn = source.bpmn;
        node.width = source.width;
        node.height = source.height;
        node.layoutOptions = source.layoutOptions == null
                ? new LinkedHashMap<>()
                : new LinkedHashMap<>(source.layoutOptions);
        node.labels = copyLabels(source.labels, false);
        if (source.ports != null) {
            node.ports = new ArrayList<>();
            for (Port port : source.ports) {
                Port copy = new Port();
                copy.id = port.id;
                copy.width = port.width == null ? PORT_SIZE : port.width;
                copy.height = port.height == null ? PORT_SIZE : port.height;
                node.ports.add(copy);
            }
        }
        return node;
    }

    private List<BpmnEdge> copyEdges(List<BpmnEdge> edges) {
        if (edges == null) {
            return null;
        }
        List<BpmnEdge> copies = new ArrayList<>(edges.size());
        for (BpmnEdge edge : edges) {
            BpmnEdge copy = new BpmnEdge();
            copy.id = edge.id;
            copy.sources = edge.sources == null ? null : new ArrayList<>(edge.sources);
            copy.targets = edge.targets == null ? null : new ArrayList<>(edge.targets);
            copy.bpmn = edge.bpmn;
            copy.layoutOptions = edge.layoutOptions == null ? null : new LinkedHashMap<>(edge.layoutOptions);
            copy.labels = copyLabels(edge.labels, true);
            copies.add(copy);
        }
        return copies;
    }

    private static List<Label> copyLabels(List<Label> labels, boolean edgeLabels) {
        if (labels == null) {
            return null;
        }
        List<Label> copies = new ArrayList<>(labels.size());
        for (Label label : labels) {
            Label copy = new Label(label.text);
            if (edgeLabels) {
                copy.width = label.width == null ? EDGE_LABEL_WIDTH : label.width;
            } else {
                copy.width = label.width == null ? SizeCalculator.estimateLabelWidth(label.text) : label.width;
            }
            copy.height = label.height == null ? LABEL_HEIGHT : label.height;
            copies.add(copy);
        }
        return copies;
    }
}
