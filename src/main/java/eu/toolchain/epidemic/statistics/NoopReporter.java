package eu.toolchain.epidemic.statistics;

import eu.toolchain.epidemic.gossip.GossipMessage;
import eu.toolchain.epidemic.transport.Address;
import eu.toolchain.epidemic.transport.Message;
import eu.toolchain.epidemic.transport.TransportException;

public class NoopReporter implements Reporter {
    @Override
    public void reportSentGossip(Address target, GossipMessage gossip) {
    }

    @Override
    public void reportReceivedGossip(Address receiver, GossipMessage gossip) {
    }

    @Override
    public void reportDuplicateGossip(Address receiver, GossipMessage gossip) {
    }

    @Override
    public void reportFailedSend(Address target, TransportException e) {
    }

    @Override
    public void reportUnhandled(Message message) {
    }

    @Override
    public void reportHandlerError(Message message, Exception e) {
    }
}
