package eu.toolchain.epidemic.topology;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import eu.toolchain.epidemic.SimulationConfig;
import eu.toolchain.epidemic.gossip.GossipNode;
import eu.toolchain.epidemic.transport.Address;

/**
 * Snapshot of the peer relation between nodes {@code 0..size-1}.
 *
 * Keeps both the directed graph (who forwards to whom) and its symmetrized closure (who is connected to whom). Peer
 * lists are not guaranteed to be reciprocal, so the two may differ.
 */
public class PeerGraph {
    private final List<String> addresses;
    private final List<List<Integer>> successors;
    private final List<List<Integer>> neighbours;

    public PeerGraph(final List<String> addresses, final List<List<Integer>> successors) {
        if (addresses.size() != successors.size())
            throw new IllegalArgumentException("addresses and successors must be of equal size");

        this.addresses = new ArrayList<>(addresses);
        this.successors = new ArrayList<>();

        for (final List<Integer> s : successors)
            this.successors.add(Collections.unmodifiableList(new ArrayList<>(s)));

        this.neighbours = symmetrize(this.successors);
    }

    /**
     * Build a graph from the current peer lists, peers outside of the node id range are ignored.
     */
    public static PeerGraph of(final List<GossipNode> nodes, final SimulationConfig config) {
        final List<String> addresses = new ArrayList<>();
        final List<List<Integer>> successors = new ArrayList<>();

        for (final GossipNode node : nodes) {
            addresses.add(node.getAddress().toString());

            final List<Integer> targets = new ArrayList<>();

            for (final Address peer : node.getPeers()) {
                final int peerId = config.nodeId(peer);

                if (peerId >= 0 && peerId < nodes.size())
                    targets.add(peerId);
            }

            successors.add(targets);
        }

        return new PeerGraph(addresses, successors);
    }

    private static List<List<Integer>> symmetrize(final List<List<Integer>> successors) {
        final List<Set<Integer>> sets = new ArrayList<>();

        for (int i = 0; i < successors.size(); i++)
            sets.add(new LinkedHashSet<Integer>());

        for (int from = 0; from < successors.size(); from++) {
            for (final int to : successors.get(from)) {
                sets.get(from).add(to);
                sets.get(to).add(from);
            }
        }

        final List<List<Integer>> result = new ArrayList<>();

        for (final Set<Integer> set : sets)
            result.add(Collections.unmodifiableList(new ArrayList<>(set)));

        return result;
    }

    public int size() {
        return successors.size();
    }

    public String address(final int id) {
        return addresses.get(id);
    }

    /**
     * Nodes that {@code id} lists as peers, in peer list order.
     */
    public List<Integer> successors(final int id) {
        return successors.get(id);
    }

    /**
     * Nodes connected to {@code id} in either direction.
     */
    public List<Integer> neighbours(final int id) {
        return neighbours.get(id);
    }

    /**
     * Every directed edge, exactly as recorded in the peer lists.
     */
    public List<EdgeInfo> edges() {
        final List<EdgeInfo> edges = new ArrayList<>();

        for (int from = 0; from < successors.size(); from++) {
            for (final int to : successors.get(from))
                edges.add(new EdgeInfo(from, to));
        }

        return edges;
    }

    /**
     * Directed edges which have no edge in the opposite direction.
     */
    public List<EdgeInfo> asymmetricEdges() {
        final List<EdgeInfo> result = new ArrayList<>();

        for (final EdgeInfo edge : edges()) {
            if (!successors.get(edge.getTo()).contains(edge.getFrom()))
                result.add(edge);
        }

        return result;
    }

    public boolean isSymmetric() {
        return asymmetricEdges().isEmpty();
    }

    /**
     * Nodes reachable from {@code id} by following directed edges, including {@code id} itself.
     */
    public Set<Integer> reachableFrom(final int id) {
        final Set<Integer> visited = new LinkedHashSet<>();
        final Deque<Integer> queue = new ArrayDeque<>();

        visited.add(id);
        queue.add(id);

        while (!queue.isEmpty()) {
            final int current = queue.poll();

            for (final int next : successors.get(current)) {
                if (visited.add(next))
                    queue.add(next);
            }
        }

        return visited;
    }
}
