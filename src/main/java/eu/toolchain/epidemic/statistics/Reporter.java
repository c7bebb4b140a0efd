package eu.toolchain.epidemic.statistics;

import eu.toolchain.epidemic.gossip.GossipMessage;
import eu.toolchain.epidemic.transport.Address;
import eu.toolchain.epidemic.transport.Message;
import eu.toolchain.epidemic.transport.TransportException;

public interface Reporter {
    void reportSentGossip(Address target, GossipMessage gossip);

    void reportReceivedGossip(Address receiver, GossipMessage gossip);

    void reportDuplicateGossip(Address receiver, GossipMessage gossip);

    void reportFailedSend(Address target, TransportException e);

    void reportUnhandled(Message message);

    void reportHandlerError(Message message, Exception e);
}
