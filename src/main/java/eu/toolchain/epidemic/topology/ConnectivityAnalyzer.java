package eu.toolchain.epidemic.topology;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Clusters a {@link PeerGraph} into connected components and lays it out for visualization.
 *
 * Components are computed over the symmetrized peer relation, every directed edge counts as a connection in both
 * directions. Edges are reported exactly as directed.
 */
@Slf4j
@RequiredArgsConstructor
public class ConnectivityAnalyzer {
    private final PeerGraph graph;
    private final ForceDirectedLayout layout;

    /**
     * Assign every node to exactly one component, isolated nodes included.
     *
     * Components are ordered by their lowest node id, members in depth-first visiting order.
     */
    public List<List<Integer>> findConnectedComponents() {
        final int size = graph.size();
        final boolean[] visited = new boolean[size];
        final List<List<Integer>> components = new ArrayList<>();

        for (int start = 0; start < size; start++) {
            if (visited[start])
                continue;

            final List<Integer> component = new ArrayList<>();
            final Deque<Integer> stack = new ArrayDeque<>();
            stack.push(start);

            while (!stack.isEmpty()) {
                final int current = stack.pop();

                if (visited[current])
                    continue;

                visited[current] = true;
                component.add(current);

                final List<Integer> neighbours = graph.neighbours(current);

                // reverse, so neighbours are visited in adjacency order.
                for (int i = neighbours.size() - 1; i >= 0; i--) {
                    if (!visited[neighbours.get(i)])
                        stack.push(neighbours.get(i));
                }
            }

            components.add(Collections.unmodifiableList(component));
        }

        return components;
    }

    /**
     * @return index of the largest component, the first one wins ties. -1 if there are no components.
     */
    public static int largest(final List<List<Integer>> components) {
        int largest = -1;
        int largestSize = -1;

        for (int i = 0; i < components.size(); i++) {
            if (components.get(i).size() > largestSize) {
                largestSize = components.get(i).size();
                largest = i;
            }
        }

        return largest;
    }

    public NetworkTopology generateTopology() {
        final List<List<Integer>> clusters = findConnectedComponents();
        final Map<Integer, Position> positions = layout.layoutWithIslands(graph, clusters);

        final int[] clusterOf = new int[graph.size()];

        for (int clusterId = 0; clusterId < clusters.size(); clusterId++) {
            for (final int nodeId : clusters.get(clusterId))
                clusterOf[nodeId] = clusterId;
        }

        final List<NodeInfo> nodes = new ArrayList<>();

        for (int id = 0; id < graph.size(); id++) {
            final Position p = positions.get(id);
            nodes.add(new NodeInfo(id, graph.address(id), (int) p.getX(), (int) p.getY(), clusterOf[id]));
        }

        final List<ClusterInfo> clusterInfos = clusterInfo(clusters, positions);

        log.debug("topology: {} node(s), {} cluster(s)", nodes.size(), clusterInfos.size());
        return new NetworkTopology(nodes, graph.edges(), clusterInfos);
    }

    private List<ClusterInfo> clusterInfo(final List<List<Integer>> clusters, final Map<Integer, Position> positions) {
        final int largest = largest(clusters);
        final List<ClusterInfo> result = new ArrayList<>();

        for (int i = 0; i < clusters.size(); i++) {
            final List<Integer> cluster = clusters.get(i);

            double totalX = 0;
            double totalY = 0;

            for (final int nodeId : cluster) {
                final Position p = positions.get(nodeId);
                totalX += p.getX();
                totalY += p.getY();
            }

            final int centerX = (int) (totalX / cluster.size());
            final int centerY = (int) (totalY / cluster.size());

            result.add(new ClusterInfo(i, cluster, cluster.size(), centerX, centerY, i != largest));
        }

        return result;
    }
}
