package org.camunda.bpm.getstarted.bpmnlayout.routing;

import org.camunda.bpm.getstarted.bpmnlayout.LayoutConfig;
import org.camunda.bpm.getstarted.bpmnlayout.models.Bounds;
import org.camunda.bpm.getstarted.bpmnlayout.models.Point;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Obstacle-avoiding router on a uniform grid. Searches with A* over the four axis directions and
 * charges every change of direction, so routes come out with few bends.
 * <p>
 * The search visits every grid state at most once, which bounds the work by the grid size even when
 * the target is enclosed.
 */
public class PathfindingRouter {
    private static final int MAX_CELLS = 250_000;
    private static final int BEND_PENALTY = 3;
    private static final int[] DX = {1, -1, 0, 0};
    private static final int[] DY = {0, 0, 1, -1};

    private final double cellSize;
    private final double obstacleMargin;
    private final double gridPadding;

    private List<Bounds> obstacles = List.of();

    /**
     * @param path    route from the source port to the target port
     * @param success false when no grid path existed and {@code path} is the simple fallback
     */
    public record RouteResult(List<Point> path, boolean success) {
    }

    public PathfindingRouter(double cellSize, double obstacleMargin, double gridPadding) {
        if (cellSize <= 0) {
            throw new IllegalArgumentException(String.format("Cell size must be positive, got %s", cellSize));
        }
        this.cellSize = cellSize;
        this.obstacleMargin = obstacleMargin;
        this.gridPadding = gridPadding;
    }

    public static PathfindingRouter from(LayoutConfig config) {
        return new PathfindingRouter(config.gridCellSize(), config.gridObstacleMargin(), config.gridPadding());
    }

    public void setObstacles(List<Bounds> obstacleBounds) {
        List<Bounds> expanded = new ArrayList<>(obstacleBounds.size());
        for (Bounds bounds : obstacleBounds) {
            expanded.add(bounds.expand(obstacleMargin));
        }
        this.obstacles = expanded;
    }

    /**
     * Routes from the best side of {@code source} to the best side of {@code target}, both chosen
     * from the dominant direction between their centres.
     */
    public RouteResult routeEdge(Bounds source, Bounds target) {
        Side[] sides = Geometry.bestConnectionSides(source, target);
        return routeEdge(source, target, sides[0], sides[1]);
    }

    public RouteResult routeEdge(Bounds source, Bounds target, Side sourceSide, Side targetSide) {
        return findOrthogonalPath(sourceSide.connectionPoint(source), targetSide.connectionPoint(target));
    }

    public RouteResult findOrthogonalPath(Point start, Point end) {
        Grid grid = buildGrid(start, end);
        List<int[]> cells = grid.search(grid.toCell(start), grid.toCell(end));
        if (cells.isEmpty()) {
            return new RouteResult(simpleOrthogonalPath(start, end), false);
        }

        List<Point> corners = new ArrayList<>();
        for (int i = 0; i < cells.size(); i++) {
            boolean keep = i == 0 || i == cells.size() - 1 || changesDirection(cells.get(i - 1), cells.get(i),
                    cells.get(i + 1));
            if (keep) {
                corners.add(grid.toPoint(cells.get(i)));
            }
        }
        return new RouteResult(Geometry.simplify(attachEndpoints(corners, start, end)), true);
    }

    /**
     * Replaces the snapped grid ends by the exact ports and drags the first and last bend along so
     * the end segments stay axis-aligned.
     */
    private static List<Point> attachEndpoints(List<Point> corners, Point start, Point end) {
        List<Point> path = new ArrayList<>(corners);
        if (path.size() == 1) {
            path.add(path.get(0));
        }
        int last = path.size() - 1;
        if (path.size() > 2) {
            boolean firstHorizontal = path.get(0).y() == path.get(1).y();
            path.set(1, firstHorizontal ? path.get(1).withY(start.y()) : path.get(1).withX(start.x()));
            boolean lastHorizontal = path.get(last).y() == path.get(last - 1).y();
            path.set(last - 1, lastHorizontal ? path.get(last - 1).withY(end.y()) : path.get(last - 1).withX(end.x()));
        }
        path.set(0, start);
        path.set(last, end);
        return orthogonalize(path);
    }

    private static List<Point> orthogonalize(List<Point> path) {
        List<Point> result = new ArrayList<>();
        result.add(path.get(0));
        for (int i = 1; i < path.size(); i++) {
            Point prev = result.get(result.size() - 1);
            Point current = path.get(i);
            if (prev.x() != current.x() && prev.y() != current.y()) {
                result.add(new Point(current.x(), prev.y()));
            }
            result.add(current);
        }
        return result;
    }

    /**
     * Route used when the grid has no path: straight when aligned, otherwise a Z through the middle.
     */
    public static List<Point> simpleOrthogonalPath(Point start, Point end) {
        if (start.y() == end.y() || start.x() == end.x()) {
            return new ArrayList<>(List.of(start, end));
        }
        double midX = (start.x() + end.x()) / 2;
        return new ArrayList<>(List.of(start, new Point(midX, start.y()), new Point(midX, end.y()), end));
    }

    private static boolean changesDirection(int[] prev, int[] current, int[] next) {
        return Integer.signum(current[0] - prev[0]) != Integer.signum(next[0] - current[0])
                || Integer.signum(current[1] - prev[1]) != Integer.signum(next[1] - current[1]);
    }

    private Grid buildGrid(Point start, Point end) {
        double minX = Math.min(start.x(), end.x());
        double minY = Math.min(start.y(), end.y());
        double maxX = Math.max(start.x(), end.x());
        double maxY = Math.max(start.y(), end.y());
        for (Bounds obstacle : obstacles) {
            minX = Math.min(minX, obstacle.x());
            minY = Math.min(minY, obstacle.y());
            maxX = Math.max(maxX, obstacle.right());
            maxY = Math.max(maxY, obstacle.bottom());
        }
        minX -= gridPadding;
        minY -= gridPadding;
        maxX += gridPadding;
        maxY += gridPadding;

        double cell = cellSize;
        double area = (maxX - minX) * (maxY - minY);
        if (area / (cell * cell) > MAX_CELLS) {
            cell = Math.ceil(Math.sqrt(area / MAX_CELLS));
        }
        int width = (int) Math.ceil((maxX - minX) / cell) + 1;
        int height = (int) Math.ceil((maxY - minY) / cell) + 1;

        Grid grid = new Grid(minX, minY, cell, width, height);
        for (Bounds obstacle : obstacles) {
            grid.block(obstacle);
        }
        return grid;
    }

    private static final class Grid {
        private final double originX;
        private final double originY;
        private final double cell;
        private final int width;
        private final int height;
        private final boolean[] blocked;

        private Grid(double originX, double originY, double cell, int width, int height) {
            this.originX = originX;
            this.originY = originY;
            this.cell = cell;
            this.width = width;
            this.height = height;
            this.blocked = new boolean[width * height];
        }

        // a grid point is blocked when it lies inside the (already expanded) obstacle
        private void block(Bounds obstacle) {
            int fromX = Math.max(0, (int) Math.ceil((obstacle.x() - originX) / cell));
            int toX = Math.min(width - 1, (int) Math.floor((obstacle.right() - originX) / cell));
            int fromY = Math.max(0, (int) Math.ceil((obstacle.y() - originY) / cell));
            int toY = Math.min(height - 1, (int) Math.floor((obstacle.bottom() - originY) / cell));
            for (int gy = fromY; gy <= toY; gy++) {
                for (int gx = fromX; gx <= toX; gx++) {
                    blocked[gy * width + gx] = true;
                }
            }
        }

        private int[] toCell(Point p) {
            int gx = (int) Math.round((p.x() - originX) / cell);
            int gy = (int) Math.round((p.y() - originY) / cell);
            return new int[]{Math.max(0, Math.min(width - 1, gx)), Math.max(0, Math.min(height - 1, gy))};
        }

        private Point toPoint(int[] c) {
            return new Point(originX + c[0] * cell, originY + c[1] * cell);
        }

        /**
         * A* over (cell, incoming direction) states. Returns the cells from start to end, or an
         * empty list when the end cannot be reached.
         */
        private List<int[]> search(int[] start, int[] end) {
            int startIndex = start[1] * width + start[0];
            int endIndex = end[1] * width + end[0];
            int states = width * height * 4;
            int[] cost = new int[states];
            int[] previous = new int[states];
            boolean[] closed = new boolean[states];
            Arrays.fill(cost, Integer.MAX_VALUE);
            Arrays.fill(previous, -1);

            PriorityQueue<int[]> open = new PriorityQueue<>((a, b) -> Integer.compare(a[1], b[1]));
            for (int dir = 0; dir < 4; dir++) {
                int state = startIndex * 4 + dir;
                cost[state] = 0;
                open.add(new int[]{state, heuristic(startIndex, endIndex)});
            }

            while (!open.isEmpty()) {
                int state = open.poll()[0];
                if (closed[state]) {
                    continue;
                }
                closed[state] = true;
                int index = state / 4;
                int dir = state % 4;
                if (index == endIndex) {
                    return reconstruct(previous, state);
                }
                int x = index % width;
                int y = index / width;
                for (int next = 0; next < 4; next++) {
                    int nx = x + DX[next];
                    int ny = y + DY[next];
                    if (nx < 0 || ny < 0 || nx >= width || ny >= height) {
                        continue;
                    }
                    int nextIndex = ny * width + nx;
                    if (blocked[nextIndex] && nextIndex != endIndex) {
                        continue;
                    }
                    int nextState = nextIndex * 4 + next;
                    int stepCost = cost[state] + 1 + (next != dir && index != startIndex ? BEND_PENALTY : 0);
                    if (!closed[nextState] && stepCost < cost[nextState]) {
                        cost[nextState] = stepCost;
                        previous[nextState] = state;
                        open.add(new int[]{nextState, stepCost + heuristic(nextIndex, endIndex)});
                    }
                }
            }
            return List.of();
        }

        private int heuristic(int from, int to) {
            return Math.abs(from % width - to % width) + Math.abs(from / width - to / width);
        }

        private List<int[]> reconstruct(int[] previous, int endState) {
            List<int[]> cells = new ArrayList<>();
            int state = endState;
            while (state != -1) {
                int index = state / 4;
                cells.add(new int[]{index % width, index / width});
                state = previous[state];
            }
            Collections.reverse(cells);
            return cells;
        }
    }
}
