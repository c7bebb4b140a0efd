package eu.toolchain.epidemic.gossip;

import lombok.Data;

@Data
public class GossipStats {
    private final int peers;
    private final int receivedMessages;
    private final long messagesSent;
    private final long messagesReceived;
}
