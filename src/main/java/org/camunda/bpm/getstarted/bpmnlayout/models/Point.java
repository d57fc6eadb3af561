package org.camunda.bpm.getstarted.bpmnlayout.models;

public record Point(double x, double y) {

    public Point translate(double dx, double dy) {
        return new Point(x + dx, y + dy);
    }

    public Point withX(double newX) {
        return new Point(newX, y);
    }

    public Point withY(double newY) {
        return new Point(x, newY);
    }

    public double distanceTo(Point other) {
        return Math.hypot(other.x - x, other.y - y);
    }
}
