package eu.toolchain.epidemic.transport;

import java.util.Collection;

public interface Transport {
    /**
     * Register an address exclusively.
     */
    Connection listen(final Address address) throws AddressInUseException;

    /**
     * Register an address exclusively, with an inbound queue holding at most {@code queueCapacity} messages.
     */
    Connection listen(final Address address, final int queueCapacity) throws AddressInUseException;

    OutboundChannel dial(final Address address) throws AddressNotFoundException;

    /**
     * Enqueue a message in the receivers inbound queue. Never blocks.
     */
    void send(final Message message) throws TransportException;

    /**
     * Mark every address in both groups as unreachable.
     *
     * Marks apply to addresses, not pairs. A marked address can neither send to nor receive from anyone until
     * {@link #heal()}.
     */
    void partition(final Collection<Address> a, final Collection<Address> b);

    void heal();

    boolean isPartitioned(final Address address);

    boolean isListening(final Address address);
}
