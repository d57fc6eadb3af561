package org.camunda.bpm.getstarted.bpmnlayout.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A flow between two nodes. Only the first source and the first target are used.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BpmnEdge {
    public String id;
    public List<String> sources;
    public List<String> targets;
    public BpmnElement bpmn;
    public List<Label> labels;
    public Map<String, String> layoutOptions;
    public List<EdgeSection> sections;

    private CoordinateSpace coordinateSpace = CoordinateSpace.CONTAINER;
    // not serialized, a fresh copy of the graph may be marked again
    private boolean coordinateSpaceMarked;

    public BpmnEdge() {
    }

    public BpmnEdge(String id, String source, String target, String type) {
        this.id = id;
        this.sources = new ArrayList<>(List.of(source));
        this.targets = new ArrayList<>(List.of(target));
        this.bpmn = new BpmnElement(type, null);
    }

    public String sourceId() {
        return sources == null || sources.isEmpty() ? null : sources.get(0);
    }

    public String targetId() {
        return targets == null || targets.isEmpty() ? null : targets.get(0);
    }

    public String type() {
        return bpmn == null ? null : bpmn.type;
    }

    public boolean hasRoute() {
        return sections != null && !sections.isEmpty() && sections.get(0).startPoint != null
                && sections.get(0).endPoint != null;
    }

    /**
     * All points of all sections, in order. Empty when the edge has no route yet.
     */
    public List<Point> waypoints() {
        List<Point> points = new ArrayList<>();
        if (!hasRoute()) {
            return points;
        }
        for (EdgeSection section : sections) {
            points.addAll(section.waypoints());
        }
        return points;
    }

    /**
     * Replaces the route by a single section through the given points (at least two).
     */
    public void setRoute(List<Point> waypoints) {
        if (waypoints == null || waypoints.size() < 2) {
            throw new IllegalArgumentException(String.format("Edge '%s' needs at least two waypoints", id));
        }
        List<Point> bends = new ArrayList<>(waypoints.subList(1, waypoints.size() - 1));
        sections = new ArrayList<>(List.of(
                new EdgeSection(id + "_s0", waypoints.get(0), bends, waypoints.get(waypoints.size() - 1))));
    }

    public void translateRoute(double dx, double dy) {
        if (sections != null) {
            for (EdgeSection section : sections) {
                section.translate(dx, dy);
            }
        }
    }

    @JsonProperty("coordinateSpace")
    public CoordinateSpace coordinateSpace() {
        return coordinateSpace;
    }

    @JsonProperty("coordinateSpace")
    void restoreCoordinateSpace(CoordinateSpace space) {
        this.coordinateSpace = space == null ? CoordinateSpace.CONTAINER : space;
    }

    /**
     * Records which coordinate system the route is written in. An edge is marked at most once per
     * layout run; marking it again with the same space is a no-op.
     *
     * @throws IllegalStateException when the edge was already marked with a different space
     */
    public void markCoordinateSpace(CoordinateSpace space) {
        if (coordinateSpaceMarked && coordinateSpace != space) {
            throw new IllegalStateException(String.format(
                    "Edge '%s' is already in %s coordinates, cannot switch to %s", id, coordinateSpace, space));
        }
        coordinateSpace = space;
        coordinateSpaceMarked = true;
    }

    public boolean coordinateSpaceMarked() {
        return coordinateSpaceMarked;
    }
}
