package org.camunda.bpm.getstarted.bpmnlayout.artifact;

import org.camunda.bpm.getstarted.bpmnlayout.LayoutConfig;
import org.camunda.bpm.getstarted.bpmnlayout.LayoutTrace;
import org.camunda.bpm.getstarted.bpmnlayout.index.NodeIndex;
import org.camunda.bpm.getstarted.bpmnlayout.models.ArtifactInfo;
import org.camunda.bpm.getstarted.bpmnlayout.models.Bounds;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnEdge;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnTypes;
import org.camunda.bpm.getstarted.bpmnlayout.models.Point;
import org.camunda.bpm.getstarted.bpmnlayout.routing.Geometry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Places data objects, data stores and text annotations above the task they are associated with
 * and routes their associations.
 * <p>
 * Input artifacts line up from the task's left edge to the right, output artifacts start right of
 * the task. Both sit a fixed gap above the task.
 */
public class ArtifactPositioner {
    // bend points closer than this to an endpoint are dropped
    private static final double BEND_TOLERANCE = 5;

    private final LayoutConfig config;
    private final LayoutTrace trace;

    public ArtifactPositioner(LayoutConfig config, LayoutTrace trace) {
        this.config = config;
        this.trace = trace;
    }

    /**
     * Finds, per container, the artifacts among its children and the task each one is associated
     * with. An artifact that is the source of an association is an input, one that is the target an
     * output. Associations between two artifacts are ignored.
     *
     * @return artifact id to its info, in association order
     */
    public static Map<String, ArtifactInfo> collectInfo(BpmnNode graph) {
        Map<String, ArtifactInfo> infos = new LinkedHashMap<>();
        collect(graph, infos);
        return infos;
    }

    private static void collect(BpmnNode container, Map<String, ArtifactInfo> infos) {
        Set<String> artifacts = new HashSet<>();
        for (BpmnNode child : container.childrenOrEmpty()) {
            if (BpmnTypes.isArtifact(child.type())) {
                artifacts.add(child.id);
            }
        }
        for (BpmnEdge edge : container.edgesOrEmpty()) {
            String source = edge.sourceId();
            String target = edge.targetId();
            if (source == null || target == null || !isAssociation(edge.type())) {
                continue;
            }
            if (artifacts.contains(source) && artifacts.contains(target)) {
                continue;
            }
            if (artifacts.contains(source)) {
                infos.put(source, new ArtifactInfo(source, target, true));
            } else if (artifacts.contains(target)) {
                infos.put(target, new ArtifactInfo(target, source, false));
            }
        }
        for (BpmnNode child : container.childrenOrEmpty()) {
            collect(child, infos);
        }
    }

    private static boolean isAssociation(String edgeType) {
        return BpmnTypes.ASSOCIATION.equals(edgeType) || BpmnTypes.isDataAssociation(edgeType);
    }

    /**
     * Moves every artifact above its task and gives its associations a direct route.
     */
    public void reposition(BpmnNode graph, Map<String, ArtifactInfo> infos) {
        if (infos.isEmpty()) {
            return;
        }
        trace.stage("Artifacts");
        NodeIndex index = NodeIndex.build(graph);
        Map<String, Double> inputOffsets = new HashMap<>();
        Map<String, Double> outputOffsets = new HashMap<>();

        for (ArtifactInfo info : infos.values()) {
            BpmnNode artifact = index.node(info.artifactId());
            if (artifact == null || !index.contains(info.associatedTaskId())) {
                continue;
            }
            Bounds task = index.absoluteBounds(info.associatedTaskId());
            double spacing = config.artifactSpacing();
            double x;
            if (info.input()) {
                double offset = inputOffsets.getOrDefault(info.associatedTaskId(), 0.0);
                x = task.x() + offset;
                inputOffsets.put(info.associatedTaskId(), offset + artifact.widthValue() + spacing);
            } else {
                double offset = outputOffsets.getOrDefault(info.associatedTaskId(), 0.0);
                x = task.right() + spacing + offset;
                outputOffsets.put(info.associatedTaskId(), offset + artifact.widthValue() + spacing);
            }
            double y = task.y() - artifact.heightValue() - config.artifactVerticalGap();

            Point origin = index.contentOrigin(index.parentId(info.artifactId()));
            artifact.setPosition(x - origin.x(), y - origin.y());
            trace.trace("[Artifact] {} placed {} {}", info.artifactId(), info.input() ? "before" : "after",
                    info.associatedTaskId());
        }

        NodeIndex moved = NodeIndex.build(graph);
        for (NodeIndex.EdgeRef ref : moved.edges()) {
            BpmnEdge edge = ref.edge();
            boolean fromArtifact = infos.containsKey(edge.sourceId());
            if (!fromArtifact && !infos.containsKey(edge.targetId())) {
                continue;
            }
            if (!moved.contains(edge.sourceId()) || !moved.contains(edge.targetId())) {
                continue;
            }
            moved.setAbsoluteRoute(edge, directRoute(moved.absoluteBounds(edge.sourceId()),
                    moved.absoluteBounds(edge.targetId()), fromArtifact));
        }
    }

    /**
     * Artifact above the task: from the artifact's bottom into the task's top, clamped to the task's
     * width. Task below the artifact: from the task's top into the artifact's bottom.
     */
    static List<Point> directRoute(Bounds source, Bounds target, boolean fromArtifact) {
        if (fromArtifact) {
            double x = Math.min(Math.max(source.centerX(), target.x()), target.right());
            return List.of(new Point(source.centerX(), source.bottom()), new Point(x, target.y()));
        }
        double artifactCenter = target.centerX();
        return List.of(new Point(Math.min(source.right(), artifactCenter), source.y()),
                new Point(artifactCenter, target.bottom()));
    }

    /**
     * Reroutes every association of a known artifact around the nodes placed since. Groups, other
     * artifacts and containers are not obstacles.
     */
    public void recalculateWithObstacleAvoidance(BpmnNode graph, Map<String, ArtifactInfo> infos) {
        if (infos.isEmpty()) {
            return;
        }
        NodeIndex index = NodeIndex.build(graph);
        Map<String, Bounds> obstacles = new LinkedHashMap<>();
        for (BpmnNode node : index.nodes()) {
            if (node != graph && isObstacle(node)) {
                obstacles.put(node.id, index.absoluteBounds(node.id));
            }
        }

        for (NodeIndex.EdgeRef ref : index.edges()) {
            BpmnEdge edge = ref.edge();
            String sourceId = edge.sourceId();
            String targetId = edge.targetId();
            boolean fromArtifact = infos.containsKey(sourceId);
            if (!fromArtifact && !infos.containsKey(targetId)) {
                continue;
            }
            if (!index.contains(sourceId) || !index.contains(targetId)) {
                continue;
            }
            List<Bounds> others = new ArrayList<>();
            obstacles.forEach((id, bounds) -> {
                if (!id.equals(sourceId) && !id.equals(targetId) && !index.isDescendantOf(sourceId, id)
                        && !index.isDescendantOf(targetId, id)) {
                    others.add(bounds);
                }
            });
            List<Point> route = routeAround(index.absoluteBounds(sourceId), index.absoluteBounds(targetId),
                    fromArtifact, others);
            index.setAbsoluteRoute(edge, route);
        }
    }

    private static boolean isObstacle(BpmnNode node) {
        String type = node.type();
        return type != null && !BpmnTypes.isArtifact(type) && !BpmnTypes.isGroup(type) && !BpmnTypes.isPool(type)
                && !BpmnTypes.isLane(type) && !BpmnTypes.COLLABORATION.equals(type);
    }

    /**
     * Leaves and enters on the sides facing each other. Vertical connections get a Z through the
     * middle (an artifact feeding a task from above detours around what blocks the straight line),
     * horizontal ones take the best of the five candidate routes.
     */
    List<Point> routeAround(Bounds source, Bounds target, boolean fromArtifact, List<Bounds> obstacles) {
        boolean right = target.centerX() > source.centerX() + source.width() / 2;
        boolean down = target.centerY() > source.centerY() + source.height() / 2;
        boolean up = target.centerY() < source.centerY() - source.height() / 2;

        Point start;
        Point end;
        List<Point> bends = new ArrayList<>();
        if (down) {
            start = new Point(source.centerX(), source.bottom());
            end = new Point(target.centerX(), target.y());
            Double clearY = fromArtifact ? Geometry.findClearVerticalPath(start.x(), start.y(), end.y(), obstacles)
                    : null;
            if (clearY != null && clearY != start.y() && clearY != end.y()) {
                bends.add(new Point(start.x(), clearY));
                bends.add(new Point(end.x(), clearY));
            } else if (Math.abs(start.x() - end.x()) > BEND_TOLERANCE) {
                double midY = (start.y() + end.y()) / 2;
                bends.add(new Point(start.x(), midY));
                bends.add(new Point(end.x(), midY));
            }
        } else if (up) {
            start = new Point(source.centerX(), source.y());
            end = new Point(target.centerX(), target.bottom());
            if (Math.abs(start.x() - end.x()) > BEND_TOLERANCE) {
                double midY = (start.y() + end.y()) / 2;
                bends.add(new Point(start.x(), midY));
                bends.add(new Point(end.x(), midY));
            }
        } else if (right) {
            start = new Point(source.right(), source.centerY());
            end = new Point(target.x(), target.centerY());
            bends.addAll(bestBends(start, end, obstacles));
        } else {
            start = new Point(source.x(), source.centerY());
            end = new Point(target.right(), target.centerY());
            bends.addAll(bestBends(start, end, obstacles));
        }

        List<Point> route = new ArrayList<>();
        route.add(start);
        route.addAll(bends);
        route.add(end);
        return route;
    }

    private record Candidate(List<Point> bends, double score) {
    }

    /**
     * Scores horizontal-first, vertical-first, above, below and right of all obstacles and returns
     * the bend points of the cheapest, without bends sitting on an endpoint.
     */
    List<Point> bestBends(Point start, Point end, List<Bounds> obstacles) {
        double margin = config.artifactRouteMargin();
        double midX = (start.x() + end.x()) / 2;
        double midY = (start.y() + end.y()) / 2;
        double top = Math.min(start.y(), end.y());
        double bottom = Math.max(start.y(), end.y());
        double rightmost = Math.max(start.x(), end.x());
        for (Bounds obstacle : obstacles) {
            top = Math.min(top, obstacle.y());
            bottom = Math.max(bottom, obstacle.bottom());
            rightmost = Math.max(rightmost, obstacle.right());
        }

        List<List<Point>> strategies = List.of(
                List.of(new Point(midX, start.y()), new Point(midX, end.y())),
                List.of(new Point(start.x(), midY), new Point(end.x(), midY)),
                List.of(new Point(start.x(), top - margin), new Point(end.x(), top - margin)),
                List.of(new Point(start.x(), bottom + margin), new Point(end.x(), bottom + margin)),
                List.of(new Point(rightmost + margin, start.y()), new Point(rightmost + margin, end.y())));

        List<Candidate> candidates = new ArrayList<>();
        for (List<Point> bends : strategies) {
            List<Point> route = new ArrayList<>();
            route.add(start);
            route.addAll(bends);
            route.add(end);
            candidates.add(new Candidate(bends, Geometry.scoreRoute(route, obstacles)));
        }
        Candidate best = candidates.stream().min(Comparator.comparingDouble(Candidate::score)).orElseThrow();

        List<Point> kept = new ArrayList<>();
        for (Point bend : best.bends()) {
            if (!near(bend, start) && !near(bend, end)) {
                kept.add(bend);
            }
        }
        return kept;
    }

    private static boolean near(Point a, Point b) {
        return Math.abs(a.x() - b.x()) <= BEND_TOLERANCE && Math.abs(a.y() - b.y()) <= BEND_TOLERANCE;
    }
}
