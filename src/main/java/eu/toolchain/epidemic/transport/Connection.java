package eu.toolchain.epidemic.transport;

import java.util.concurrent.TimeUnit;

/**
 * Inbound side of a listener, bound to a bounded queue.
 */
public interface Connection {
    Address getAddress();

    /**
     * Wait for the next inbound message.
     *
     * @return the next message, or {@code null} if none arrived within the timeout.
     * @throws ConnectionClosedException if the connection is closed.
     */
    Message receive(long timeout, TimeUnit unit) throws ConnectionClosedException, InterruptedException;

    boolean isClosed();

    /**
     * Deregister the address and release the queue. Safe to call more than once.
     */
    void close();
}
