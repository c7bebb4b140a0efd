package eu.toolchain.epidemic.gossip;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import eu.toolchain.epidemic.Await;
import eu.toolchain.epidemic.SimulationConfig;
import eu.toolchain.epidemic.node.MessageHandler;
import eu.toolchain.epidemic.node.MessageKind;
import eu.toolchain.epidemic.node.Node;
import eu.toolchain.epidemic.serializers.Serializer;
import eu.toolchain.epidemic.serializers.Serializers;
import eu.toolchain.epidemic.statistics.TallyReporter;
import eu.toolchain.epidemic.topology.MessageTrace;
import eu.toolchain.epidemic.topology.TraceLog;
import eu.toolchain.epidemic.transport.Message;
import eu.toolchain.epidemic.transport.simulator.SimulatedTransport;

public class TestGossipNode {
    private static final long TIMEOUT = 5;

    private final SimulationConfig config = SimulationConfig.defaults();
    private final Serializer<GossipMessage> serializer = new Serializers().gossip();

    private SimulatedTransport transport;
    private ExecutorService executor;
    private TallyReporter reporter;
    private TraceLog traces;

    private final List<GossipNode> gossipNodes = new ArrayList<>();
    private final List<Node> nodes = new ArrayList<>();

    @Before
    public void setup() {
        transport = new SimulatedTransport(new Random(0));
        executor = Executors.newFixedThreadPool(2);
        reporter = new TallyReporter();
        traces = new TraceLog();
    }

    @After
    public void teardown() {
        for (final GossipNode node : gossipNodes)
            node.close();

        for (final Node node : nodes)
            node.close();

        executor.shutdownNow();
    }

    private GossipNode gossipNode(final int id) throws Exception {
        final GossipNode node = new GossipNode(id, transport, config, executor, reporter, traces);
        gossipNodes.add(node);
        return node;
    }

    /**
     * A plain node at the address of {@code id}, capturing every gossip copy it receives.
     */
    private BlockingQueue<GossipMessage> capture(final int id) throws Exception {
        final BlockingQueue<GossipMessage> queue = new LinkedBlockingQueue<>();
        final Node node = new Node(transport, config.address(id));

        node.handle(MessageKind.GOSSIP, new MessageHandler() {
            @Override
            public void handle(final Message message) throws Exception {
                queue.add(serializer.deserialize(message.body()));
            }
        });

        node.start();
        nodes.add(node);
        return queue;
    }

    private static GossipMessage message(final String id, final int sender, final int ttl) {
        return new GossipMessage(id, "content of " + id, sender, Instant.now(), ttl);
    }

    @Test
    public void testAddPeer() throws Exception {
        final GossipNode node = gossipNode(0);

        Assert.assertFalse(node.addPeer(config.address(0)));
        Assert.assertTrue(node.addPeer(config.address(1)));
        Assert.assertFalse(node.addPeer(config.address(1)));
        Assert.assertTrue(node.addPeer(config.address(2)));

        Assert.assertEquals(2, node.getStats().getPeers());
        Assert.assertEquals(config.address(1), node.getPeers().get(0));
    }

    @Test
    public void testDuplicateDeliveryIsIdempotent() throws Exception {
        final GossipNode node = gossipNode(0);
        final BlockingQueue<GossipMessage> peer = capture(1);

        node.addPeer(config.address(1));
        node.start();

        final GossipMessage m = message("a", 5, 3);

        Assert.assertTrue(node.handleGossipMessage(m, 5));
        Assert.assertFalse(node.handleGossipMessage(m, 6));
        Assert.assertFalse(node.handleGossipMessage(m.withTtl(10), 7));

        Assert.assertNotNull(peer.poll(TIMEOUT, TimeUnit.SECONDS));
        Assert.assertNull(peer.poll(200, TimeUnit.MILLISECONDS));

        final GossipStats stats = node.getStats();
        Assert.assertEquals(1, stats.getReceivedMessages());
        Assert.assertEquals(1, stats.getMessagesReceived());
        Assert.assertEquals(1, node.getReceivedMessages().size());
        Assert.assertEquals(2, reporter.getDuplicateGossip());
        Assert.assertEquals(1, traces.size());
    }

    @Test
    public void testForwardedCopyLosesOneHop() throws Exception {
        final GossipNode node = gossipNode(0);
        final BlockingQueue<GossipMessage> peer = capture(1);

        node.addPeer(config.address(1));
        node.start();

        node.handleGossipMessage(message("a", 3, 5), 3);

        final GossipMessage forwarded = peer.poll(TIMEOUT, TimeUnit.SECONDS);
        Assert.assertNotNull(forwarded);
        Assert.assertEquals("a", forwarded.getId());
        Assert.assertEquals(4, forwarded.getTtl());
        Assert.assertEquals(3, forwarded.getSender());
    }

    @Test
    public void testNoForwardAtZeroTtl() throws Exception {
        final GossipNode node = gossipNode(0);
        final BlockingQueue<GossipMessage> peer = capture(1);

        node.addPeer(config.address(1));
        node.start();

        Assert.assertTrue(node.handleGossipMessage(message("last hop", 3, 0), 3));

        Assert.assertNull(peer.poll(300, TimeUnit.MILLISECONDS));
        Assert.assertEquals(1, node.getStats().getReceivedMessages());
        Assert.assertEquals(0, node.getStats().getMessagesSent());
    }

    @Test
    public void testOriginateFansOutToAllPeers() throws Exception {
        final GossipNode node = gossipNode(0);
        final BlockingQueue<GossipMessage> first = capture(1);
        final BlockingQueue<GossipMessage> second = capture(2);

        node.addPeer(config.address(1));
        node.addPeer(config.address(2));
        node.start();

        final String id = node.gossip("hello");

        Assert.assertEquals(32, id.length());
        Assert.assertTrue(node.hasSeen(id));

        for (final BlockingQueue<GossipMessage> peer : Arrays.asList(first, second)) {
            final GossipMessage m = peer.poll(TIMEOUT, TimeUnit.SECONDS);
            Assert.assertNotNull(m);
            Assert.assertEquals(id, m.getId());
            Assert.assertEquals("hello", m.getContent());
            Assert.assertEquals(0, m.getSender());
            Assert.assertEquals(SimulationConfig.DEFAULT_MAX_TTL, m.getTtl());
        }

        Assert.assertTrue(Await.until(TIMEOUT * 1000, new Await.Condition() {
            @Override
            public boolean check() {
                return node.getStats().getMessagesSent() == 2;
            }
        }));

        // the originator keeps its own message, but it was never delivered to it.
        Assert.assertEquals(1, node.getStats().getReceivedMessages());
        Assert.assertEquals(0, node.getStats().getMessagesReceived());
    }

    @Test
    public void testOriginatorIgnoresReturningCopy() throws Exception {
        final GossipNode a = gossipNode(0);
        final GossipNode b = gossipNode(1);

        a.addPeer(b.getAddress());
        b.addPeer(a.getAddress());

        a.start();
        b.start();

        final String id = a.gossip("ring");

        Assert.assertTrue(Await.until(TIMEOUT * 1000, new Await.Condition() {
            @Override
            public boolean check() {
                return reporter.getDuplicateGossip() == 1;
            }
        }));

        Assert.assertEquals(1, a.getReceivedMessages().size());
        Assert.assertEquals(1, b.getReceivedMessages().size());
        Assert.assertEquals(id, b.getReceivedMessages().get(0).getId());
    }

    @Test
    public void testTraceClassifiesHops() throws Exception {
        final GossipNode a = gossipNode(0);
        final GossipNode b = gossipNode(1);
        final GossipNode c = gossipNode(2);

        a.addPeer(b.getAddress());
        b.addPeer(c.getAddress());

        a.start();
        b.start();
        c.start();

        final String id = a.gossip("chain");

        Assert.assertTrue(Await.until(TIMEOUT * 1000, new Await.Condition() {
            @Override
            public boolean check() {
                return traces.size() == 2;
            }
        }));

        final List<MessageTrace> all = traces.getTraces();

        final MessageTrace first = all.get(0);
        Assert.assertEquals(id, first.getMessageId());
        Assert.assertEquals(1, first.getReceiver());
        Assert.assertEquals(0, first.getImmediateForwarder());
        Assert.assertEquals(SimulationConfig.DEFAULT_MAX_TTL, first.getTtl());
        Assert.assertTrue(first.isDirect());

        final MessageTrace second = all.get(1);
        Assert.assertEquals(2, second.getReceiver());
        Assert.assertEquals(1, second.getImmediateForwarder());
        Assert.assertEquals(0, second.getOriginalSender());
        Assert.assertEquals(SimulationConfig.DEFAULT_MAX_TTL - 1, second.getTtl());
        Assert.assertFalse(second.isDirect());
    }

    @Test
    public void testUnreachablePeerIsTolerated() throws Exception {
        final GossipNode node = gossipNode(0);
        final BlockingQueue<GossipMessage> peer = capture(2);

        // nobody listens on the address of node 1.
        node.addPeer(config.address(1));
        node.addPeer(config.address(2));
        node.start();

        node.gossip("partial");

        Assert.assertNotNull(peer.poll(TIMEOUT, TimeUnit.SECONDS));
        Assert.assertTrue(Await.until(TIMEOUT * 1000, new Await.Condition() {
            @Override
            public boolean check() {
                return reporter.getFailedSends() == 1;
            }
        }));

        Assert.assertEquals(1, node.getStats().getMessagesSent());
    }

    @Test
    public void testPeerExchange() throws Exception {
        final GossipNode a = gossipNode(0);
        final GossipNode b = gossipNode(1);

        b.addPeer(config.address(0));
        b.addPeer(config.address(2));
        b.addPeer(config.address(3));

        a.start();
        b.start();

        a.requestPeers(b.getAddress());

        Assert.assertTrue(Await.until(TIMEOUT * 1000, new Await.Condition() {
            @Override
            public boolean check() {
                return a.getPeers().size() == 2;
            }
        }));

        // own address is never added.
        Assert.assertFalse(a.getPeers().contains(a.getAddress()));
        Assert.assertTrue(a.getPeers().contains(config.address(2)));
        Assert.assertTrue(a.getPeers().contains(config.address(3)));
    }

    @Test
    public void testMalformedGossipIsReported() throws Exception {
        final GossipNode node = gossipNode(0);
        node.start();

        transport.send(Message.of(config.address(5), node.getAddress(), "gossip", "not json".getBytes(StandardCharsets.UTF_8)));

        Assert.assertTrue(Await.until(TIMEOUT * 1000, new Await.Condition() {
            @Override
            public boolean check() {
                return reporter.getHandlerErrors() == 1;
            }
        }));

        Assert.assertEquals(0, node.getStats().getReceivedMessages());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeTtl() {
        message("a", 0, 0).withTtl(-1);
    }

    @Test
    public void testCloseIsIdempotent() throws Exception {
        final GossipNode node = gossipNode(0);
        node.start();
        node.close();
        node.close();

        Assert.assertFalse(transport.isListening(node.getAddress()));
    }
}
