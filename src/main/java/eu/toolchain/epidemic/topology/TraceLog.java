package eu.toolchain.epidemic.topology;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import eu.toolchain.epidemic.gossip.GossipListener;
import eu.toolchain.epidemic.gossip.GossipMessage;
import eu.toolchain.epidemic.gossip.GossipNode;

/**
 * Collects a trace event for every message a node accepts.
 */
public class TraceLog implements GossipListener {
    private static final Comparator<MessageTrace> BY_TIMESTAMP = new Comparator<MessageTrace>() {
        @Override
        public int compare(final MessageTrace a, final MessageTrace b) {
            return a.getTimestamp().compareTo(b.getTimestamp());
        }
    };

    private final Instant startTime;
    private final List<MessageTrace> traces = new ArrayList<>();

    public TraceLog() {
        this(Instant.now());
    }

    public TraceLog(final Instant startTime) {
        this.startTime = startTime;
    }

    @Override
    public void gossipReceived(final GossipNode node, final GossipMessage message, final int immediateForwarder) {
        record(new MessageTrace(Instant.now(), message.getId(), message.getSender(), immediateForwarder,
                node.getId(), message.getContent(), message.getTtl(), message.getSender() == immediateForwarder));
    }

    public void record(final MessageTrace trace) {
        synchronized (traces) {
            traces.add(trace);
        }
    }

    public Instant getStartTime() {
        return startTime;
    }

    /**
     * @return a copy of all traces, ordered by time.
     */
    public List<MessageTrace> getTraces() {
        final List<MessageTrace> copy;

        synchronized (traces) {
            copy = new ArrayList<>(traces);
        }

        Collections.sort(copy, BY_TIMESTAMP);
        return copy;
    }

    public int size() {
        synchronized (traces) {
            return traces.size();
        }
    }
}
