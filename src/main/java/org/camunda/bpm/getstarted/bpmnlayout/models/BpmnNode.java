package org.camunda.bpm.getstarted.bpmnlayout.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A node of the layout tree. The root graph is a node without {@code bpmn} metadata.
 * <p>
 * Positions are relative to the parent node, sizes are filled in by the size calculator when absent.
 * <p>
 * Example:
 * {
 * "id": "task_review",
 * "bpmn": { "type": "userTask", "name": "Review order" },
 * "width": 100,
 * "height": 80,
 * "boundaryEvents": [ { "id": "timer_1", "bpmn": { "type": "boundaryEvent" } } ]
 * }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BpmnNode {
    public String id;
    public BpmnElement bpmn;
    public Double x;
    public Double y;
    public Double width;
    public Double height;
    public List<BpmnNode> children;
    public List<BpmnEdge> edges;
    public List<BpmnNode> boundaryEvents;
    public List<Label> labels;
    public List<Port> ports;
    public Map<String, String> layoutOptions;

    // engine hints, set by the preparer only
    @JsonIgnore
    public LayerConstraint layerConstraint;
    @JsonIgnore
    public LayoutPriority priority;
    @JsonIgnore
    public Padding padding;

    public BpmnNode() {
    }

    public BpmnNode(String id, String type, String name) {
        this.id = id;
        this.bpmn = new BpmnElement(type, name);
    }

    public double xValue() {
        return x == null ? 0 : x;
    }

    public double yValue() {
        return y == null ? 0 : y;
    }

    public double widthValue() {
        return width == null ? 0 : width;
    }

    public double heightValue() {
        return height == null ? 0 : height;
    }

    public void setPosition(double newX, double newY) {
        this.x = newX;
        this.y = newY;
    }

    public void setSize(double newWidth, double newHeight) {
        this.width = newWidth;
        this.height = newHeight;
    }

    /**
     * Bounds in the parent's coordinate system.
     */
    public Bounds bounds() {
        return new Bounds(xValue(), yValue(), widthValue(), heightValue());
    }

    public String type() {
        return bpmn == null ? null : bpmn.type;
    }

    public String name() {
        return bpmn == null ? null : bpmn.name;
    }

    public boolean isType(String expected) {
        return expected.equals(type());
    }

    public List<BpmnNode> childrenOrEmpty() {
        return children == null ? List.of() : children;
    }

    public List<BpmnEdge> edgesOrEmpty() {
        return edges == null ? List.of() : edges;
    }

    public List<BpmnNode> boundaryEventsOrEmpty() {
        return boundaryEvents == null ? List.of() : boundaryEvents;
    }

    public boolean hasChildren() {
        return children != null && !children.isEmpty();
    }

    public List<BpmnNode> mutableChildren() {
        if (children == null) {
            children = new ArrayList<>();
        }
        return children;
    }

    public List<BpmnEdge> mutableEdges() {
        if (edges == null) {
            edges = new ArrayList<>();
        }
        return edges;
    }

    public String option(String key) {
        return layoutOptions == null ? null : layoutOptions.get(key);
    }

    @Override
    public String toString() {
        return String.format("%s[%s](%.1f,%.1f %.1fx%.1f)", id, type(), xValue(), yValue(), widthValue(),
                heightValue());
    }
}
