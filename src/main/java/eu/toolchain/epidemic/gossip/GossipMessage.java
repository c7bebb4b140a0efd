package eu.toolchain.epidemic.gossip;

import java.time.Instant;

import lombok.Data;

/**
 * A piece of information spreading through the network.
 *
 * Immutable, a forwarded copy is created with {@link #withTtl(int)}.
 */
@Data
public class GossipMessage {
    private final String id;
    private final String content;
    // id of the originating node.
    private final int sender;
    private final Instant timestamp;
    // hops remaining.
    private final int ttl;

    public GossipMessage withTtl(final int ttl) {
        if (ttl < 0)
            throw new IllegalArgumentException("ttl must not be negative: " + ttl);

        return new GossipMessage(id, content, sender, timestamp, ttl);
    }
}
