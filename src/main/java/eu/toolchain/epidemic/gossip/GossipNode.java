package eu.toolchain.epidemic.gossip;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import eu.toolchain.epidemic.SimulationConfig;
import eu.toolchain.epidemic.node.HandlerException;
import eu.toolchain.epidemic.node.MessageHandler;
import eu.toolchain.epidemic.node.MessageKind;
import eu.toolchain.epidemic.node.Node;
import eu.toolchain.epidemic.serializers.Serializer;
import eu.toolchain.epidemic.serializers.Serializers;
import eu.toolchain.epidemic.statistics.Reporter;
import eu.toolchain.epidemic.transport.Address;
import eu.toolchain.epidemic.transport.AddressInUseException;
import eu.toolchain.epidemic.transport.Message;
import eu.toolchain.epidemic.transport.Transport;
import eu.toolchain.epidemic.transport.TransportException;

/**
 * Epidemic dissemination on top of a {@link Node}.
 *
 * Every message id moves from unseen to seen exactly once per node. Only the first copy of an id is logged and
 * forwarded, later copies are ignored, which is what stops flooding on cyclic topologies. Forwarded copies carry one
 * hop less and nothing is forwarded once the ttl reaches zero.
 *
 * Peers, seen ids, the received log and the counters are guarded by a read/write lock which is never held across a
 * send.
 */
@Slf4j
@ToString(of = { "id", "address" })
public class GossipNode {
    private final int id;
    private final Address address;
    private final SimulationConfig config;
    private final ExecutorService executor;
    private final Reporter reporter;
    private final GossipListener listener;
    private final Node node;

    private final Serializers s = new Serializers();
    private final Serializer<GossipMessage> gossip = s.gossip();
    private final Serializer<List<Address>> peerList = s.peers();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<Address> peers = new ArrayList<>();
    private final Set<String> seen = new HashSet<>();
    private final List<GossipMessage> received = new ArrayList<>();
    private long messagesSent = 0;
    private long messagesReceived = 0;

    /* outstanding fan-out sends, awaited on close */
    private final Set<Future<?>> pending = ConcurrentHashMap.newKeySet();
    private volatile boolean closing = false;

    public GossipNode(final int id, final Transport transport, final SimulationConfig config,
            final ExecutorService executor, final Reporter reporter, final GossipListener listener)
            throws AddressInUseException {
        this.id = id;
        this.address = config.address(id);
        this.config = config;
        this.executor = executor;
        this.reporter = reporter;
        this.listener = listener;
        this.node = new Node(transport, address, config.getQueueCapacity(), reporter);

        setupHandlers();
    }

    private void setupHandlers() {
        node.handle(MessageKind.GOSSIP, new MessageHandler() {
            @Override
            public void handle(final Message message) throws Exception {
                final GossipMessage g;

                try {
                    g = gossip.deserialize(message.body());
                } catch (final IOException e) {
                    throw new HandlerException("failed to decode gossip message from " + message.getFrom(), e);
                }

                handleGossipMessage(g, config.nodeId(message.getFrom()));
            }
        });

        node.handle(MessageKind.DISCOVER, new MessageHandler() {
            @Override
            public void handle(final Message message) throws Exception {
                node.send(message.getFrom(), MessageKind.PEERS, peerList.serialize(getPeers()));
            }
        });

        node.handle(MessageKind.PEERS, new MessageHandler() {
            @Override
            public void handle(final Message message) throws Exception {
                final List<Address> discovered;

                try {
                    discovered = peerList.deserialize(message.body());
                } catch (final IOException e) {
                    throw new HandlerException("failed to decode peer list from " + message.getFrom(), e);
                }

                for (final Address peer : discovered)
                    addPeer(peer);
            }
        });
    }

    public int getId() {
        return id;
    }

    public Address getAddress() {
        return address;
    }

    /**
     * Add a peer, ignoring our own address and addresses which are already known.
     *
     * @return {@code true} if the peer was added.
     */
    public boolean addPeer(final Address peer) {
        if (peer.equals(address))
            return false;

        lock.writeLock().lock();

        try {
            if (peers.contains(peer))
                return false;

            peers.add(peer);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void start() {
        node.start();
    }

    /**
     * Originate a new message and send it to every known peer.
     *
     * The originator counts as having seen its own message, and keeps it in its received log, so it will never
     * forward it again if a copy travels back.
     *
     * @return id of the new message.
     */
    public String gossip(final String content) {
        final GossipMessage message = new GossipMessage(generateMessageId(), content, id, Instant.now(),
                config.getMaxTtl());

        lock.writeLock().lock();

        try {
            seen.add(message.getId());
            received.add(message);
        } finally {
            lock.writeLock().unlock();
        }

        log.info("node {} starting gossip: '{}'", id, content);
        spread(message);
        return message.getId();
    }

    /**
     * Accept a copy of a message.
     *
     * @param immediateForwarder id of the node that sent this copy.
     * @return {@code true} if this was the first copy of the message.
     */
    public boolean handleGossipMessage(final GossipMessage message, final int immediateForwarder) {
        lock.writeLock().lock();

        try {
            if (!seen.add(message.getId())) {
                reporter.reportDuplicateGossip(address, message);
                return false;
            }

            received.add(message);
            messagesReceived++;
        } finally {
            lock.writeLock().unlock();
        }

        reporter.reportReceivedGossip(address, message);
        listener.gossipReceived(this, message, immediateForwarder);

        if (message.getSender() == immediateForwarder) {
            log.debug("node {} received gossip from node {}: '{}'", id, message.getSender(), message.getContent());
        } else {
            log.debug("node {} received gossip from node {} (via node {}): '{}'", id, message.getSender(),
                    immediateForwarder, message.getContent());
        }

        if (message.getTtl() > 0)
            spread(message.withTtl(message.getTtl() - 1));

        return true;
    }

    /**
     * Ask another node for its peer list, the answer is merged into ours.
     */
    public void requestPeers(final Address target) throws TransportException {
        node.send(target, MessageKind.DISCOVER, new byte[0]);
    }

    private void spread(final GossipMessage message) {
        if (closing) {
            log.debug("node {}: closing, not spreading {}", id, message.getId());
            return;
        }

        final byte[] body;

        try {
            body = gossip.serialize(message);
        } catch (final IOException e) {
            log.error("node {}: failed to serialize gossip message {}", id, message.getId(), e);
            return;
        }

        for (final Address target : getPeers()) {
            final Runnable task = new Runnable() {
                @Override
                public void run() {
                    sendTo(target, message, body);
                }
            };

            try {
                pending.add(executor.submit(task));
            } catch (final RejectedExecutionException e) {
                log.debug("node {}: fan-out to {} rejected", id, target);
            }
        }

        prunePending();
    }

    private void sendTo(final Address target, final GossipMessage message, final byte[] body) {
        try {
            node.send(target, MessageKind.GOSSIP, body);
        } catch (final TransportException e) {
            // peer might be down or partitioned, which is expected in an epidemic protocol.
            reporter.reportFailedSend(target, e);
            log.debug("node {}: failed to send {} to {}: {}", id, message.getId(), target, e.getMessage());
            return;
        }

        lock.writeLock().lock();

        try {
            messagesSent++;
        } finally {
            lock.writeLock().unlock();
        }

        reporter.reportSentGossip(target, message);
    }

    private void prunePending() {
        final Iterator<Future<?>> it = pending.iterator();

        while (it.hasNext()) {
            if (it.next().isDone())
                it.remove();
        }
    }

    private void awaitPending(final long deadline) {
        for (final Future<?> future : new ArrayList<>(pending)) {
            final long remaining = deadline - System.currentTimeMillis();

            try {
                future.get(Math.max(remaining, 0), TimeUnit.MILLISECONDS);
            } catch (final TimeoutException e) {
                log.warn("node {}: fan-out task did not finish in time, cancelling", id);
                future.cancel(true);
            } catch (final ExecutionException e) {
                log.error("node {}: fan-out task failed", id, e.getCause());
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }

            pending.remove(future);
        }
    }

    public String generateMessageId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public GossipStats getStats() {
        lock.readLock().lock();

        try {
            return new GossipStats(peers.size(), received.size(), messagesSent, messagesReceived);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<GossipMessage> getReceivedMessages() {
        lock.readLock().lock();

        try {
            return new ArrayList<>(received);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Address> getPeers() {
        lock.readLock().lock();

        try {
            return new ArrayList<>(peers);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean hasSeen(final String messageId) {
        lock.readLock().lock();

        try {
            return seen.contains(messageId);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Stop spreading, wait for outstanding sends, then close the underlying node.
     */
    public void close() {
        if (closing)
            return;

        closing = true;

        final long deadline = System.currentTimeMillis() + config.getCloseTimeout();
        awaitPending(deadline);
        node.close();
        awaitPending(deadline);
    }
}
