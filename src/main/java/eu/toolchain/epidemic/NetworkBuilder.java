package eu.toolchain.epidemic;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import lombok.extern.slf4j.Slf4j;
import eu.toolchain.epidemic.gossip.GossipNode;
import eu.toolchain.epidemic.statistics.NoopReporter;
import eu.toolchain.epidemic.statistics.Reporter;
import eu.toolchain.epidemic.topology.ConnectivityAnalyzer;
import eu.toolchain.epidemic.topology.ForceDirectedLayout;
import eu.toolchain.epidemic.topology.NetworkTopology;
import eu.toolchain.epidemic.topology.PeerGraph;
import eu.toolchain.epidemic.topology.TraceLog;
import eu.toolchain.epidemic.topology.VisualizationData;
import eu.toolchain.epidemic.topology.VisualizationExporter;
import eu.toolchain.epidemic.transport.Address;
import eu.toolchain.epidemic.transport.AddressInUseException;
import eu.toolchain.epidemic.transport.Transport;

/**
 * Builds and drives a network of gossip nodes over a shared transport.
 *
 * Nodes get sequential ids and addresses, node {@code i} listens on {@code basePort + i}.
 */
@Slf4j
public class NetworkBuilder {
    private final Transport transport;
    private final SimulationConfig config;
    private final Random random;
    private final Reporter reporter;
    private final TraceLog traces = new TraceLog();
    private final ExecutorService executor;

    private final List<GossipNode> nodes = new ArrayList<>();

    public NetworkBuilder(final Transport transport, final SimulationConfig config, final Random random,
            final Reporter reporter) {
        this.transport = transport;
        this.config = config;
        this.random = random;
        this.reporter = reporter;
        this.executor = Executors.newFixedThreadPool(config.getFanOutThreads(), new ThreadFactory() {
            private final AtomicInteger count = new AtomicInteger();

            @Override
            public Thread newThread(final Runnable r) {
                final Thread thread = new Thread(r, "fan-out-" + count.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }
        });
    }

    public NetworkBuilder(final Transport transport, final Random random) {
        this(transport, SimulationConfig.defaults(), random, new NoopReporter());
    }

    public void createNodes(final int count) throws AddressInUseException {
        log.info("creating {} gossip nodes...", count);

        final int first = nodes.size();

        for (int id = first; id < first + count; id++)
            nodes.add(new GossipNode(id, transport, config, executor, reporter, traces));
    }

    /**
     * Give every node up to {@code peersPerNode} distinct random peers.
     *
     * Selection has a bounded number of attempts, so a node may end up with fewer peers when {@code peersPerNode}
     * gets close to the number of nodes.
     */
    public void buildRandomTopology(final int peersPerNode) {
        log.info("building random topology ({} peers per node)...", peersPerNode);

        for (final GossipNode node : nodes) {
            for (final int peerId : selectRandomPeers(node.getId(), peersPerNode))
                node.addPeer(config.address(peerId));
        }
    }

    public List<Integer> selectRandomPeers(final int nodeId, final int count) {
        final List<Integer> peers = new ArrayList<>();

        if (nodes.isEmpty())
            return peers;

        int attempts = count * config.getSelectionAttempts();

        while (peers.size() < count && attempts > 0) {
            attempts--;

            final int candidate = random.nextInt(nodes.size());

            if (candidate == nodeId || peers.contains(candidate))
                continue;

            peers.add(candidate);
        }

        return peers;
    }

    public void startAllNodes() {
        log.info("starting {} nodes...", nodes.size());

        for (final GossipNode node : nodes)
            node.start();
    }

    /**
     * Originate gossip from a node picked uniformly at random.
     *
     * @return the originating node, or {@code null} if there are no nodes.
     */
    public GossipNode initiateGossip(final String content) {
        if (nodes.isEmpty())
            return null;

        final GossipNode starter = nodes.get(random.nextInt(nodes.size()));
        starter.gossip(content);
        return starter;
    }

    /**
     * Originate gossip from a specific node.
     *
     * @return id of the new message.
     */
    public String initiateGossip(final int nodeId, final String content) {
        return getNode(nodeId).gossip(content);
    }

    public List<GossipNode> getNodes() {
        return Collections.unmodifiableList(new ArrayList<>(nodes));
    }

    public GossipNode getNode(final int nodeId) {
        if (nodeId < 0 || nodeId >= nodes.size())
            throw new IllegalArgumentException("no such node: " + nodeId);

        return nodes.get(nodeId);
    }

    public int nodeId(final Address address) {
        return config.nodeId(address);
    }

    public TraceLog getTraceLog() {
        return traces;
    }

    public SimulationConfig getConfig() {
        return config;
    }

    /**
     * Close every node, then stop the fan-out executor.
     */
    public void closeAllNodes() {
        for (final GossipNode node : nodes)
            node.close();

        executor.shutdown();

        try {
            if (!executor.awaitTermination(config.getCloseTimeout(), TimeUnit.MILLISECONDS))
                log.warn("fan-out executor did not terminate in time");
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public PeerGraph peerGraph() {
        return PeerGraph.of(nodes, config);
    }

    public ConnectivityAnalyzer analyzer() {
        return new ConnectivityAnalyzer(peerGraph(),
                new ForceDirectedLayout(random, config.getCanvasWidth(), config.getCanvasHeight()));
    }

    public NetworkTopology generateTopology() {
        return analyzer().generateTopology();
    }

    public VisualizationData visualizationData() {
        return new VisualizationData(generateTopology(), traces.getTraces(), traces.getStartTime());
    }

    /**
     * Write topology and message traces into {@code outputDirectory}.
     */
    public Path exportVisualizationData(final Path outputDirectory) throws IOException {
        return new VisualizationExporter().export(visualizationData(), outputDirectory);
    }
}
