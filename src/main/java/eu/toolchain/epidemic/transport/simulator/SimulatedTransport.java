package eu.toolchain.epidemic.transport.simulator;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import eu.toolchain.epidemic.transport.Address;
import eu.toolchain.epidemic.transport.AddressInUseException;
import eu.toolchain.epidemic.transport.AddressNotFoundException;
import eu.toolchain.epidemic.transport.Connection;
import eu.toolchain.epidemic.transport.ConnectionClosedException;
import eu.toolchain.epidemic.transport.Message;
import eu.toolchain.epidemic.transport.NetworkPartitionedException;
import eu.toolchain.epidemic.transport.OutboundChannel;
import eu.toolchain.epidemic.transport.QueueFullException;
import eu.toolchain.epidemic.transport.Transport;
import eu.toolchain.epidemic.transport.TransportException;

/**
 * In-process address space.
 *
 * All registry, partition and filter state is guarded by a single lock which is held for the whole of a send, so a
 * destination can not be closed while a message is being delivered to it.
 */
@Slf4j
@RequiredArgsConstructor
public class SimulatedTransport implements Transport {
    public static final int DEFAULT_QUEUE_CAPACITY = 100;

    /* wakes up a receiver blocked on a closed connection */
    private static final Message CLOSED = new Message(null, null, new byte[0]);

    private final Random random;
    private final int queueCapacity;

    private final Object lock = new Object();
    private final Map<Address, Listener> listeners = new HashMap<>();
    private final Set<Address> partitioned = new HashSet<>();
    private final Set<PacketFilter> filters = new HashSet<>();

    private int packetLoss = 0;

    public SimulatedTransport(final Random random) {
        this(random, DEFAULT_QUEUE_CAPACITY);
    }

    @Override
    public Connection listen(final Address address) throws AddressInUseException {
        return listen(address, queueCapacity);
    }

    @Override
    public Connection listen(final Address address, final int queueCapacity) throws AddressInUseException {
        if (queueCapacity <= 0)
            throw new IllegalArgumentException("queue capacity must be positive");

        synchronized (lock) {
            if (listeners.containsKey(address))
                throw new AddressInUseException(address);

            final Listener listener = new Listener(address, new ArrayBlockingQueue<Message>(queueCapacity));
            listeners.put(address, listener);
            return listener;
        }
    }

    @Override
    public OutboundChannel dial(final Address address) throws AddressNotFoundException {
        synchronized (lock) {
            if (!listeners.containsKey(address))
                throw new AddressNotFoundException(address);
        }

        return new OutboundChannel() {
            private volatile boolean closed = false;

            @Override
            public Address getTarget() {
                return address;
            }

            @Override
            public void send(final Address source, final byte[] payload) throws TransportException {
                if (closed)
                    throw new ConnectionClosedException(address);

                SimulatedTransport.this.send(new Message(source, address, payload));
            }

            @Override
            public void close() {
                closed = true;
            }
        };
    }

    @Override
    public void send(final Message message) throws TransportException {
        synchronized (lock) {
            if (partitioned.contains(message.getFrom()) || partitioned.contains(message.getTo()))
                throw new NetworkPartitionedException(message.getTo());

            final Listener listener = listeners.get(message.getTo());

            if (listener == null)
                throw new AddressNotFoundException(message.getTo());

            final Message filtered = applyFilters(message);

            // dropped, same as a lost datagram.
            if (filtered == null) {
                log.trace("{} -> {}: dropped", message.getFrom(), message.getTo());
                return;
            }

            if (!listener.queue.offer(filtered))
                throw new QueueFullException(message.getTo());
        }
    }

    private Message applyFilters(final Message message) {
        // simulate global packet loss.
        if (packetLoss > 0 && random.nextInt(100) < packetLoss)
            return null;

        Message m = message;

        for (final PacketFilter f : filters) {
            m = f.filter(m);

            if (m == null)
                return null;
        }

        return m;
    }

    @Override
    public void partition(final Collection<Address> a, final Collection<Address> b) {
        synchronized (lock) {
            partitioned.addAll(a);
            partitioned.addAll(b);
        }

        log.info("partitioned {} from {}", a, b);
    }

    @Override
    public void heal() {
        synchronized (lock) {
            partitioned.clear();
        }

        log.info("healed all partitions");
    }

    @Override
    public boolean isPartitioned(final Address address) {
        synchronized (lock) {
            return partitioned.contains(address);
        }
    }

    @Override
    public boolean isListening(final Address address) {
        synchronized (lock) {
            return listeners.containsKey(address);
        }
    }

    public void setPacketLoss(final int n) {
        if (n > 100 || n < 0)
            throw new IllegalArgumentException("packet loss must be a percentage between 0 and 100");

        synchronized (lock) {
            this.packetLoss = n;
        }
    }

    /**
     * Silently drop everything sent from a to b. Traffic from b to a is unaffected.
     */
    public PacketFilter block(final Address a, final Address b) {
        final PacketFilter filter = new PacketFilter() {
            @Override
            public Message filter(final Message m) {
                if (m.getFrom().equals(a) && m.getTo().equals(b))
                    return null;

                return m;
            }
        };

        synchronized (lock) {
            filters.add(filter);
        }

        return filter;
    }

    public void cancel(final PacketFilter... filters) {
        synchronized (lock) {
            for (final PacketFilter filter : filters) {
                this.filters.remove(filter);
            }
        }
    }

    @RequiredArgsConstructor
    private class Listener implements Connection {
        private final Address address;
        private final BlockingQueue<Message> queue;

        private volatile boolean closed = false;

        @Override
        public Address getAddress() {
            return address;
        }

        @Override
        public Message receive(final long timeout, final TimeUnit unit)
                throws ConnectionClosedException, InterruptedException {
            if (closed)
                throw new ConnectionClosedException(address);

            final Message message = queue.poll(timeout, unit);

            if (message == CLOSED || (message == null && closed))
                throw new ConnectionClosedException(address);

            return message;
        }

        @Override
        public boolean isClosed() {
            return closed;
        }

        @Override
        public void close() {
            synchronized (lock) {
                if (closed)
                    return;

                closed = true;

                if (listeners.get(address) == this)
                    listeners.remove(address);

                queue.clear();
                queue.offer(CLOSED);
            }
        }
    }
}
