package eu.toolchain.epidemic.transport;

/**
 * Lightweight handle returned by {@link Transport#dial(Address)}.
 */
public interface OutboundChannel {
    Address getTarget();

    void send(final Address source, final byte[] payload) throws TransportException;

    void close();
}
