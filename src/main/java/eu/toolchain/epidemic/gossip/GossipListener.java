package eu.toolchain.epidemic.gossip;

public interface GossipListener {
    /**
     * Fires once for every message a node accepts for the first time.
     *
     * @param immediateForwarder id of the node the copy arrived from.
     */
    public void gossipReceived(GossipNode node, GossipMessage message, int immediateForwarder);
}
