package eu.toolchain.epidemic.topology;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import lombok.RequiredArgsConstructor;

/**
 * Spring layout used for visualization only.
 *
 * The largest component is laid out on the right hand side of the canvas, every other component gets a cell in a
 * grid on the left hand side so partitions stand out.
 */
@RequiredArgsConstructor
public class ForceDirectedLayout {
    public static final int ITERATIONS = 200;
    public static final double REPULSION = 500.0;
    public static final double ATTRACTION = 0.1;
    public static final double DAMPING = 0.9;
    public static final double STEP = 0.01;
    public static final double MARGIN = 10;

    private static final double MAIN_SHARE = 0.6;
    private static final int GRID_COLUMNS = 4;
    private static final int PADDING = 25;

    private final Random random;
    private final int width;
    private final int height;

    public Map<Integer, Position> layoutWithIslands(final PeerGraph graph, final List<List<Integer>> clusters) {
        final Map<Integer, Position> positions = new HashMap<>();

        if (clusters.isEmpty())
            return positions;

        final int largest = ConnectivityAnalyzer.largest(clusters);

        final int mainWidth = (int) (width * MAIN_SHARE);
        final int mainStartX = width - mainWidth;

        final Map<Integer, Position> main = layoutCluster(clusters.get(largest), graph, mainWidth, height);

        for (final int nodeId : clusters.get(largest))
            positions.put(nodeId, main.get(nodeId).translate(mainStartX, 0));

        final List<List<Integer>> isolated = new ArrayList<>();

        for (int i = 0; i < clusters.size(); i++) {
            if (i != largest)
                isolated.add(clusters.get(i));
        }

        if (isolated.isEmpty())
            return positions;

        final int isolatedWidth = width - mainWidth - 2 * PADDING;
        final int rows = (isolated.size() + GRID_COLUMNS - 1) / GRID_COLUMNS;

        final int cellWidth = isolatedWidth / GRID_COLUMNS;
        final int cellHeight = height / rows;

        for (int i = 0; i < isolated.size(); i++) {
            final List<Integer> cluster = isolated.get(i);

            final int cellX = (i % GRID_COLUMNS) * cellWidth + PADDING;
            final int cellY = (i / GRID_COLUMNS) * cellHeight + PADDING;
            final int w = cellWidth - 2 * PADDING;
            final int h = cellHeight - 2 * PADDING;

            if (cluster.size() == 1) {
                positions.put(cluster.get(0), new Position(cellX + w / 2, cellY + h / 2));
                continue;
            }

            final Map<Integer, Position> local = layoutCluster(cluster, graph, w, h);

            for (final int nodeId : cluster)
                positions.put(nodeId, local.get(nodeId).translate(cellX, cellY));
        }

        return positions;
    }

    /**
     * Run the simulation for a single cluster inside a {@code w} by {@code h} box with its origin at zero.
     */
    public Map<Integer, Position> layoutCluster(final List<Integer> cluster, final PeerGraph graph, final int w,
            final int h) {
        final int size = cluster.size();
        final Set<Integer> members = new HashSet<>(cluster);

        final double[] x = new double[size];
        final double[] y = new double[size];
        final double[] vx = new double[size];
        final double[] vy = new double[size];

        final Map<Integer, Integer> index = new HashMap<>();

        for (int i = 0; i < size; i++) {
            index.put(cluster.get(i), i);
            x[i] = random.nextDouble() * w;
            y[i] = random.nextDouble() * h;
        }

        for (int iteration = 0; iteration < ITERATIONS; iteration++) {
            final double[] fx = new double[size];
            final double[] fy = new double[size];

            // repulsion between every pair.
            for (int a = 0; a < size; a++) {
                for (int b = a + 1; b < size; b++) {
                    final double dx = x[a] - x[b];
                    final double dy = y[a] - y[b];
                    final double dist = Math.max(Math.sqrt(dx * dx + dy * dy), 1);

                    final double force = REPULSION / (dist * dist);
                    final double px = (dx / dist) * force;
                    final double py = (dy / dist) * force;

                    fx[a] += px;
                    fy[a] += py;
                    fx[b] -= px;
                    fy[b] -= py;
                }
            }

            // attraction along edges inside of the cluster.
            for (int a = 0; a < size; a++) {
                for (final int neighbour : graph.neighbours(cluster.get(a))) {
                    if (!members.contains(neighbour))
                        continue;

                    final int b = index.get(neighbour);
                    final double dx = x[b] - x[a];
                    final double dy = y[b] - y[a];
                    final double dist = Math.sqrt(dx * dx + dy * dy);

                    if (dist <= 0)
                        continue;

                    final double force = ATTRACTION * dist;
                    fx[a] += (dx / dist) * force;
                    fy[a] += (dy / dist) * force;
                }
            }

            for (int i = 0; i < size; i++) {
                vx[i] = vx[i] * DAMPING + fx[i] * STEP;
                vy[i] = vy[i] * DAMPING + fy[i] * STEP;
                x[i] = clamp(x[i] + vx[i], MARGIN, w - MARGIN);
                y[i] = clamp(y[i] + vy[i], MARGIN, h - MARGIN);
            }
        }

        final Map<Integer, Position> positions = new HashMap<>();

        for (int i = 0; i < size; i++)
            positions.put(cluster.get(i), new Position(x[i], y[i]));

        return positions;
    }

    /* lower bound wins when the box is smaller than the margins */
    private static double clamp(final double value, final double low, final double high) {
        return Math.max(low, Math.min(value, high));
    }
}
