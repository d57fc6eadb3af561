package org.camunda.bpm.getstarted.bpmnlayout.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/**
 * One orthogonal route piece: start point, bend points, end point.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class EdgeSection {
    public String id;
    public Point startPoint;
    public Point endPoint;
    public List<Point> bendPoints = new ArrayList<>();

    public EdgeSection() {
    }

    public EdgeSection(String id, Point startPoint, List<Point> bendPoints, Point endPoint) {
        this.id = id;
        this.startPoint = startPoint;
        this.endPoint = endPoint;
        this.bendPoints = bendPoints == null ? new ArrayList<>() : new ArrayList<>(bendPoints);
    }

    public List<Point> waypoints() {
        List<Point> points = new ArrayList<>();
        points.add(startPoint);
        if (bendPoints != null) {
            points.addAll(bendPoints);
        }
        points.add(endPoint);
        return points;
    }

    public void translate(double dx, double dy) {
        startPoint = startPoint.translate(dx, dy);
        endPoint = endPoint.translate(dx, dy);
        if (bendPoints != null) {
            bendPoints.replaceAll(p -> p.translate(dx, dy));
        }
    }
}
