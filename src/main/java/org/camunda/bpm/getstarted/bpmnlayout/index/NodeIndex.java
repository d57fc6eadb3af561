package org.camunda.bpm.getstarted.bpmnlayout.index;

import org.camunda.bpm.getstarted.bpmnlayout.models.Bounds;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnEdge;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnTypes;
import org.camunda.bpm.getstarted.bpmnlayout.models.Point;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Snapshot of a layout tree: every node by id with its parent and absolute origin, and every edge
 * with the node that owns it. Built in one pass; rebuild it after nodes were moved.
 * <p>
 * Boundary events kept in their host's {@code boundaryEvents} list are positioned in the coordinate
 * system of the host's parent, so that is the parent they are indexed with.
 */
public final class NodeIndex {
    private final BpmnNode root;
    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final Map<String, String> hosts = new HashMap<>();
    private final Map<String, EdgeRef> edges = new LinkedHashMap<>();

    private record Entry(BpmnNode node, String parentId, Point origin) {
    }

    /**
     * An edge together with the node whose {@code edges} list holds it.
     */
    public record EdgeRef(BpmnEdge edge, BpmnNode owner) {
    }

    private NodeIndex(BpmnNode root) {
        this.root = root;
    }

    public static NodeIndex build(BpmnNode root) {
        NodeIndex index = new NodeIndex(root);
        Point rootOrigin = new Point(root.xValue(), root.yValue());
        index.entries.put(root.id, new Entry(root, null, rootOrigin));
        index.indexChildren(root, rootOrigin);
        return index;
    }

    private void indexChildren(BpmnNode parent, Point parentOrigin) {
        for (BpmnEdge edge : parent.edgesOrEmpty()) {
            if (edge.id != null) {
                edges.put(edge.id, new EdgeRef(edge, parent));
            }
        }
        for (BpmnNode child : parent.childrenOrEmpty()) {
            if (child.id == null) {
                continue;
            }
            Point origin = parentOrigin.translate(child.xValue(), child.yValue());
            entries.put(child.id, new Entry(child, parent.id, origin));
            indexChildren(child, origin);
        }
        for (BpmnNode child : parent.childrenOrEmpty()) {
            for (BpmnNode event : child.boundaryEventsOrEmpty()) {
                if (event.id == null) {
                    continue;
                }
                hosts.put(event.id, child.id);
                // already present as a layout sibling in a prepared tree
                if (!entries.containsKey(event.id)) {
                    entries.put(event.id, new Entry(event, parent.id,
                            parentOrigin.translate(event.xValue(), event.yValue())));
                }
            }
        }
    }

    public BpmnNode root() {
        return root;
    }

    public boolean contains(String id) {
        return id != null && entries.containsKey(id);
    }

    /**
     * @return the node, or null if the id is unknown
     */
    public BpmnNode node(String id) {
        Entry entry = id == null ? null : entries.get(id);
        return entry == null ? null : entry.node();
    }

    public BpmnNode parent(String id) {
        Entry entry = entries.get(id);
        return entry == null || entry.parentId() == null ? null : entries.get(entry.parentId()).node();
    }

    public String parentId(String id) {
        Entry entry = entries.get(id);
        return entry == null ? null : entry.parentId();
    }

    /**
     * Host activity of a boundary event, or null if the id is not a boundary event.
     */
    public String hostOf(String boundaryEventId) {
        return hosts.get(boundaryEventId);
    }

    public boolean isBoundaryEvent(String id) {
        return hosts.containsKey(id);
    }

    public Collection<BpmnNode> nodes() {
        List<BpmnNode> nodes = new ArrayList<>(entries.size());
        for (Entry entry : entries.values()) {
            nodes.add(entry.node());
        }
        return nodes;
    }

    public Collection<EdgeRef> edges() {
        return Collections.unmodifiableCollection(edges.values());
    }

    public EdgeRef edge(String edgeId) {
        return edges.get(edgeId);
    }

    /**
     * Top-left corner of the node in diagram coordinates.
     */
    public Point absoluteOrigin(String id) {
        Entry entry = entries.get(id);
        if (entry == null) {
            throw new IllegalArgumentException(String.format("Unknown node '%s'", id));
        }
        return entry.origin();
    }

    /**
     * Origin of the coordinate system the node's children are positioned in.
     */
    public Point contentOrigin(String id) {
        return absoluteOrigin(id);
    }

    public Bounds absoluteBounds(String id) {
        Entry entry = entries.get(id);
        if (entry == null) {
            throw new IllegalArgumentException(String.format("Unknown node '%s'", id));
        }
        BpmnNode node = entry.node();
        return new Bounds(entry.origin().x(), entry.origin().y(), node.widthValue(), node.heightValue());
    }

    /**
     * Closest ancestor matching the predicate, the node itself excluded.
     */
    public BpmnNode nearestAncestor(String id, Predicate<BpmnNode> predicate) {
        String current = parentId(id);
        while (current != null) {
            BpmnNode candidate = entries.get(current).node();
            if (predicate.test(candidate)) {
                return candidate;
            }
            current = parentId(current);
        }
        return null;
    }

    public boolean isDescendantOf(String id, String ancestorId) {
        String current = parentId(id);
        while (current != null) {
            if (current.equals(ancestorId)) {
                return true;
            }
            current = parentId(current);
        }
        return false;
    }

    /**
     * Absolute offset the edge's route has to be shifted by to become diagram coordinates.
     */
    public Point edgeOffset(BpmnEdge edge, BpmnNode owner) {
        return switch (edge.coordinateSpace()) {
            case ABSOLUTE -> new Point(0, 0);
            case POOL -> {
                BpmnNode pool = BpmnTypes.isPool(owner.type())
                        ? owner
                        : nearestAncestor(owner.id, n -> BpmnTypes.isPool(n.type()));
                yield pool == null ? contentOrigin(owner.id) : absoluteOrigin(pool.id);
            }
            case CONTAINER -> contentOrigin(owner.id);
        };
    }

    public Point edgeOffset(BpmnEdge edge) {
        EdgeRef ref = edges.get(edge.id);
        if (ref == null) {
            throw new IllegalArgumentException(String.format("Edge '%s' is not part of the graph", edge.id));
        }
        return edgeOffset(edge, ref.owner());
    }

    /**
     * Route of the edge in diagram coordinates, empty if the edge has none.
     */
    public List<Point> absoluteWaypoints(BpmnEdge edge) {
        List<Point> points = edge.waypoints();
        if (points.isEmpty()) {
            return points;
        }
        Point offset = edgeOffset(edge);
        points.replaceAll(p -> p.translate(offset.x(), offset.y()));
        return points;
    }

    /**
     * Writes a route given in diagram coordinates into the edge's own coordinate space.
     */
    public void setAbsoluteRoute(BpmnEdge edge, List<Point> absolutePoints) {
        Point offset = edgeOffset(edge);
        List<Point> local = new ArrayList<>(absolutePoints.size());
        for (Point p : absolutePoints) {
            local.add(p.translate(-offset.x(), -offset.y()));
        }
        edge.setRoute(local);
    }

    /**
     * @return target id to the source ids of its incoming edges, in edge order
     */
    public Map<String, List<String>> incomingSources() {
        Map<String, List<String>> incoming = new HashMap<>();
        for (EdgeRef ref : edges.values()) {
            String source = ref.edge().sourceId();
            String target = ref.edge().targetId();
            if (source != null && target != null) {
                incoming.computeIfAbsent(target, k -> new ArrayList<>()).add(source);
            }
        }
        return incoming;
    }

    /**
     * @return source id to the target ids of its outgoing edges, in edge order
     */
    public Map<String, List<String>> outgoingTargets() {
        Map<String, List<String>> outgoing = new HashMap<>();
        for (EdgeRef ref : edges.values()) {
            String source = ref.edge().sourceId();
            String target = ref.edge().targetId();
            if (source != null && target != null) {
                outgoing.computeIfAbsent(source, k -> new ArrayList<>()).add(target);
            }
        }
        return outgoing;
    }
}
