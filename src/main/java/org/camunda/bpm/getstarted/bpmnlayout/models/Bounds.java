package org.camunda.bpm.getstarted.bpmnlayout.models;

/**
 * Axis-aligned rectangle. Whether it is absolute or relative depends on where it came from.
 */
public record Bounds(double x, double y, double width, double height) {

    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + height;
    }

    public double centerX() {
        return x + width / 2;
    }

    public double centerY() {
        return y + height / 2;
    }

    public Point center() {
        return new Point(centerX(), centerY());
    }

    public Bounds translate(double dx, double dy) {
        return new Bounds(x + dx, y + dy, width, height);
    }

    public Bounds expand(double margin) {
        return new Bounds(x - margin, y - margin, width + margin * 2, height + margin * 2);
    }

    public boolean overlapsHorizontally(Bounds other) {
        return x < other.right() && right() > other.x;
    }

    public boolean contains(Bounds other) {
        return other.x >= x && other.y >= y && other.right() <= right() && other.bottom() <= bottom();
    }

    public static Bounds union(Bounds a, Bounds b) {
        double minX = Math.min(a.x, b.x);
        double minY = Math.min(a.y, b.y);
        double maxX = Math.max(a.right(), b.right());
        double maxY = Math.max(a.bottom(), b.bottom());
        return new Bounds(minX, minY, maxX - minX, maxY - minY);
    }
}
