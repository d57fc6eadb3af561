package org.camunda.bpm.getstarted.bpmnlayout.boundary;

import org.camunda.bpm.getstarted.bpmnlayout.models.Bounds;

/**
 * Where boundary events sit on the bottom edge of their host. The events are spread evenly over the
 * host's width; a narrow host pushes later events to the right so that neighbours keep at least
 * {@code pitch} between their centres.
 */
public final class BoundarySeats {

    private BoundarySeats() {
    }

    /**
     * @return x of the event centre per index, in the coordinate system of {@code host}
     */
    public static double[] centers(Bounds host, int total, double pitch) {
        double[] centers = new double[Math.max(total, 0)];
        double spacing = host.width() / (total + 1);
        for (int i = 0; i < centers.length; i++) {
            double x = host.x() + spacing * (i + 1);
            if (i > 0) {
                x = Math.max(x, centers[i - 1] + pitch);
            }
            centers[i] = x;
        }
        return centers;
    }

    public static double center(Bounds host, int index, int total, double pitch) {
        return centers(host, total, pitch)[index];
    }

    /**
     * Bounds of the seated event, vertically centred on the host's bottom edge.
     */
    public static Bounds seat(Bounds host, int index, int total, double pitch, double width, double height) {
        double centerX = center(host, index, total, pitch);
        return new Bounds(centerX - width / 2, host.bottom() - height / 2, width, height);
    }
}
