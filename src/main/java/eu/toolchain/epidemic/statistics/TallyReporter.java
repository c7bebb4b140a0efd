package eu.toolchain.epidemic.statistics;

import java.util.concurrent.atomic.AtomicLong;

import eu.toolchain.epidemic.gossip.GossipMessage;
import eu.toolchain.epidemic.transport.Address;
import eu.toolchain.epidemic.transport.Message;
import eu.toolchain.epidemic.transport.NetworkPartitionedException;
import eu.toolchain.epidemic.transport.TransportException;

/**
 * Network wide counters, shared by every node in a simulation.
 */
public class TallyReporter implements Reporter {
    private final AtomicLong sentGossip = new AtomicLong();
    private final AtomicLong receivedGossip = new AtomicLong();
    private final AtomicLong duplicateGossip = new AtomicLong();
    private final AtomicLong failedSends = new AtomicLong();
    private final AtomicLong partitionedSends = new AtomicLong();
    private final AtomicLong unhandled = new AtomicLong();
    private final AtomicLong handlerErrors = new AtomicLong();

    public long getSentGossip() {
        return sentGossip.get();
    }

    public long getReceivedGossip() {
        return receivedGossip.get();
    }

    public long getDuplicateGossip() {
        return duplicateGossip.get();
    }

    public long getFailedSends() {
        return failedSends.get();
    }

    public long getPartitionedSends() {
        return partitionedSends.get();
    }

    public long getUnhandled() {
        return unhandled.get();
    }

    public long getHandlerErrors() {
        return handlerErrors.get();
    }

    @Override
    public void reportSentGossip(Address target, GossipMessage gossip) {
        sentGossip.incrementAndGet();
    }

    @Override
    public void reportReceivedGossip(Address receiver, GossipMessage gossip) {
        receivedGossip.incrementAndGet();
    }

    @Override
    public void reportDuplicateGossip(Address receiver, GossipMessage gossip) {
        duplicateGossip.incrementAndGet();
    }

    @Override
    public void reportFailedSend(Address target, TransportException e) {
        failedSends.incrementAndGet();

        if (e instanceof NetworkPartitionedException)
            partitionedSends.incrementAndGet();
    }

    @Override
    public void reportUnhandled(Message message) {
        unhandled.incrementAndGet();
    }

    @Override
    public void reportHandlerError(Message message, Exception e) {
        handlerErrors.incrementAndGet();
    }
}
