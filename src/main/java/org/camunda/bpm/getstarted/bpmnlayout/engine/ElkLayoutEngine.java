package org.camunda.bpm.getstarted.bpmnlayout.engine;

import org.camunda.bpm.getstarted.bpmnlayout.LayoutTrace;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnEdge;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.camunda.bpm.getstarted.bpmnlayout.models.Label;
import org.camunda.bpm.getstarted.bpmnlayout.models.LayerConstraint;
import org.camunda.bpm.getstarted.bpmnlayout.models.Padding;
import org.camunda.bpm.getstarted.bpmnlayout.models.Point;
import org.camunda.bpm.getstarted.bpmnlayout.models.Port;
import org.camunda.bpm.getstarted.bpmnlayout.options.ElkOptions;
import org.eclipse.elk.alg.layered.options.LayeredOptions;
import org.eclipse.elk.core.RecursiveGraphLayoutEngine;
import org.eclipse.elk.core.data.LayoutMetaDataService;
import org.eclipse.elk.core.data.LayoutOptionData;
import org.eclipse.elk.core.math.ElkPadding;
import org.eclipse.elk.core.options.CoreOptions;
import org.eclipse.elk.core.util.BasicProgressMonitor;
import org.eclipse.elk.graph.ElkBendPoint;
import org.eclipse.elk.graph.ElkConnectableShape;
import org.eclipse.elk.graph.ElkEdge;
import org.eclipse.elk.graph.ElkEdgeSection;
import org.eclipse.elk.graph.ElkGraphElement;
import org.eclipse.elk.graph.ElkLabel;
import org.eclipse.elk.graph.ElkNode;
import org.eclipse.elk.graph.ElkPort;
import org.eclipse.elk.graph.util.ElkGraphUtil;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link LayoutEngine} backed by ELK Layered. The prepared tree is converted into an ELK graph,
 * laid out with the recursive layout engine and the coordinates are copied back.
 * <p>
 * ELK keeps edge sections and edge labels relative to the edge's containing node (the lowest
 * common ancestor of both ends); they are translated into the coordinate system of the node owning
 * the edge.
 */
public class ElkLayoutEngine implements LayoutEngine {
    private static boolean metaDataRegistered;

    private final LayoutTrace trace;

    public ElkLayoutEngine() {
        this(LayoutTrace.disabled());
    }

    public ElkLayoutEngine(LayoutTrace trace) {
        this.trace = trace;
        registerMetaData();
    }

    private static synchronized void registerMetaData() {
        if (!metaDataRegistered) {
            LayoutMetaDataService.getInstance().registerLayoutMetaDataProviders(new LayeredOptions());
            metaDataRegistered = true;
        }
    }

    @Override
    public BpmnNode layout(BpmnNode prepared) {
        Conversion conversion = new Conversion();
        ElkNode root = conversion.toElk(prepared);
        try {
            new RecursiveGraphLayoutEngine().layout(root, new BasicProgressMonitor());
        } catch (RuntimeException e) {
            throw new LayoutEngineException(String.format("ELK layout of graph '%s' failed: %s",
                    prepared.id, e.getMessage()), e);
        }
        conversion.copyBack();
        return prepared;
    }

    /**
     * State of one conversion: which ELK element mirrors which tree element.
     */
    private final class Conversion {
        private final Map<String, ElkNode> elkNodes = new HashMap<>();
        private final Map<String, ElkPort> elkPorts = new HashMap<>();
        private final Map<BpmnNode, ElkNode> nodePairs = new HashMap<>();
        private final Map<Port, ElkPort> portPairs = new HashMap<>();
        private final Map<Label, ElkLabel> labelPairs = new HashMap<>();
        private final List<EdgePair> edgePairs = new ArrayList<>();

        private record EdgePair(BpmnEdge edge, BpmnNode owner, ElkEdge elkEdge) {
        }

        ElkNode toElk(BpmnNode root) {
            ElkNode elkRoot = ElkGraphUtil.createGraph();
            elkRoot.setIdentifier(root.id);
            register(root, elkRoot);
            applyOptions(root, elkRoot);
            for (BpmnNode child : root.childrenOrEmpty()) {
                createNode(child, elkRoot);
            }
            createEdges(root);
            return elkRoot;
        }

        private void createNode(BpmnNode node, ElkNode parent) {
            ElkNode elkNode = ElkGraphUtil.createNode(parent);
            elkNode.setIdentifier(node.id);
            elkNode.setDimensions(node.widthValue(), node.heightValue());
            register(node, elkNode);
            applyOptions(node, elkNode);

            if (node.labels != null) {
                for (Label label : node.labels) {
                    labelPairs.put(label, createLabel(label, elkNode));
                }
            }
            if (node.ports != null) {
                for (Port port : node.ports) {
                    ElkPort elkPort = ElkGraphUtil.createPort(elkNode);
                    elkPort.setIdentifier(port.id);
                    elkPort.setDimensions(port.width == null ? 10 : port.width, port.height == null ? 10 : port.height);
                    portPairs.put(port, elkPort);
                    if (port.id != null) {
                        elkPorts.put(port.id, elkPort);
                    }
                }
            }
            for (BpmnNode child : node.childrenOrEmpty()) {
                createNode(child, elkNode);
            }
        }

        private void register(BpmnNode node, ElkNode elkNode) {
            nodePairs.put(node, elkNode);
            if (node.id != null) {
                elkNodes.put(node.id, elkNode);
            }
        }

        private ElkLabel createLabel(Label label, ElkNode owner) {
            ElkLabel elkLabel = ElkGraphUtil.createLabel(label.text == null ? "" : label.text, owner);
            elkLabel.setDimensions(label.width == null ? 0 : label.width, label.height == null ? 0 : label.height);
            return elkLabel;
        }

        // runs after every node exists, edges may point anywhere in the tree
        private void createEdges(BpmnNode owner) {
            for (BpmnEdge edge : owner.edgesOrEmpty()) {
                ElkConnectableShape source = shape(edge.sourceId());
                ElkConnectableShape target = shape(edge.targetId());
                if (source == null || target == null) {
                    trace.trace("[ELK] skipping edge {}: endpoint {} -> {} not in graph", edge.id,
                            edge.sourceId(), edge.targetId());
                    continue;
                }
                ElkEdge elkEdge = ElkGraphUtil.createSimpleEdge(source, target);
                elkEdge.setIdentifier(edge.id);
                applyOptions(edge.layoutOptions, elkEdge, edge.id);
                if (edge.labels != null) {
                    for (Label label : edge.labels) {
                        ElkLabel elkLabel = ElkGraphUtil.createLabel(label.text == null ? "" : label.text, elkEdge);
                        elkLabel.setDimensions(label.width == null ? 0 : label.width,
                                label.height == null ? 0 : label.height);
                        labelPairs.put(label, elkLabel);
                    }
                }
                edgePairs.add(new EdgePair(edge, owner, elkEdge));
            }
            for (BpmnNode child : owner.childrenOrEmpty()) {
                createEdges(child);
            }
        }

        private ElkConnectableShape shape(String id) {
            if (id == null) {
                return null;
            }
            ElkNode node = elkNodes.get(id);
            return node != null ? node : elkPorts.get(id);
        }

        private void applyOptions(BpmnNode node, ElkNode elkNode) {
            applyOptions(node.layoutOptions, elkNode, node.id);
            if (node.layerConstraint != null) {
                elkNode.setProperty(LayeredOptions.LAYERING_LAYER_CONSTRAINT, toElk(node.layerConstraint));
            }
            if (node.priority != null) {
                elkNode.setProperty(LayeredOptions.PRIORITY, node.priority.value());
            }
            if (node.padding != null && node.option(ElkOptions.PADDING) == null) {
                Padding p = node.padding;
                elkNode.setProperty(CoreOptions.PADDING, new ElkPadding(p.top(), p.right(), p.bottom(), p.left()));
            }
        }

        private void applyOptions(Map<String, String> options, ElkGraphElement element,
                                  String ownerId) {
            if (options == null) {
                return;
            }
            LayoutMetaDataService service = LayoutMetaDataService.getInstance();
            options.forEach((key, value) -> {
                LayoutOptionData data = service.getOptionDataBySuffix(key);
                if (data == null) {
                    trace.warn("Unknown layout option '{}' on '{}' ignored", key, ownerId);
                    return;
                }
                Object parsed = data.parseValue(value);
                if (parsed == null) {
                    throw new LayoutEngineException(String.format(
                            "Invalid value '%s' for layout option '%s' on '%s'", value, key, ownerId));
                }
                element.setProperty(data, parsed);
            });
        }

        private org.eclipse.elk.alg.layered.options.LayerConstraint toElk(LayerConstraint constraint) {
            return switch (constraint) {
                case FIRST -> org.eclipse.elk.alg.layered.options.LayerConstraint.FIRST;
                case LAST -> org.eclipse.elk.alg.layered.options.LayerConstraint.LAST;
            };
        }

        void copyBack() {
            nodePairs.forEach((node, elkNode) -> {
                if (elkNode.getParent() != null) {
                    node.setPosition(elkNode.getX(), elkNode.getY());
                }
                node.setSize(elkNode.getWidth(), elkNode.getHeight());
            });
            portPairs.forEach((port, elkPort) -> {
                port.x = elkPort.getX();
                port.y = elkPort.getY();
            });
            labelPairs.forEach((label, elkLabel) -> {
                label.x = elkLabel.getX();
                label.y = elkLabel.getY();
                label.width = elkLabel.getWidth();
                label.height = elkLabel.getHeight();
            });
            for (EdgePair pair : edgePairs) {
                copyRoute(pair);
            }
        }

        private void copyRoute(EdgePair pair) {
            Point container = absolute(pair.elkEdge().getContainingNode());
            Point owner = absolute(nodePairs.get(pair.owner()));
            double dx = container.x() - owner.x();
            double dy = container.y() - owner.y();
            if (pair.edge().labels != null) {
                for (Label label : pair.edge().labels) {
                    label.x = label.x + dx;
                    label.y = label.y + dy;
                }
            }

            List<ElkEdgeSection> sections = pair.elkEdge().getSections();
            if (sections.isEmpty()) {
                trace.trace("[ELK] edge {} came back without a route", pair.edge().id);
                return;
            }

            List<Point> points = new ArrayList<>();
            for (ElkEdgeSection section : sections) {
                points.add(new Point(section.getStartX() + dx, section.getStartY() + dy));
                for (ElkBendPoint bend : section.getBendPoints()) {
                    points.add(new Point(bend.getX() + dx, bend.getY() + dy));
                }
                points.add(new Point(section.getEndX() + dx, section.getEndY() + dy));
            }
            pair.edge().setRoute(points);
        }

        private Point absolute(ElkNode node) {
            double x = 0;
            double y = 0;
            for (ElkNode current = node; current != null && current.getParent() != null; current = current.getParent()) {
                x += current.getX();
                y += current.getY();
            }
            return new Point(x, y);
        }
    }
}
