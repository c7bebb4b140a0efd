package eu.toolchain.epidemic.node;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import eu.toolchain.epidemic.statistics.NoopReporter;
import eu.toolchain.epidemic.statistics.Reporter;
import eu.toolchain.epidemic.transport.Address;
import eu.toolchain.epidemic.transport.AddressInUseException;
import eu.toolchain.epidemic.transport.Connection;
import eu.toolchain.epidemic.transport.ConnectionClosedException;
import eu.toolchain.epidemic.transport.Message;
import eu.toolchain.epidemic.transport.OutboundChannel;
import eu.toolchain.epidemic.transport.Transport;
import eu.toolchain.epidemic.transport.TransportException;

/**
 * Message dispatch for a single address.
 *
 * Runs one receive loop which looks up a handler by the payload tag. Closing a node is terminal.
 */
@Slf4j
@ToString(of = { "address" })
public class Node {
    private static final long POLL_INTERVAL = 50;

    private final Transport transport;
    private final Address address;
    private final Reporter reporter;
    private final Connection connection;

    private final Map<MessageKind, MessageHandler> handlers = Collections
            .synchronizedMap(new EnumMap<MessageKind, MessageHandler>(MessageKind.class));

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    private volatile Thread receiver;

    public Node(final Transport transport, final Address address, final Reporter reporter)
            throws AddressInUseException {
        this(transport, transport.listen(address), reporter);
    }

    /**
     * @param queueCapacity bound of the inbound queue, overriding the transport default.
     */
    public Node(final Transport transport, final Address address, final int queueCapacity, final Reporter reporter)
            throws AddressInUseException {
        this(transport, transport.listen(address, queueCapacity), reporter);
    }

    private Node(final Transport transport, final Connection connection, final Reporter reporter) {
        this.transport = transport;
        this.address = connection.getAddress();
        this.reporter = reporter;
        this.connection = connection;
    }

    public Node(final Transport transport, final Address address) throws AddressInUseException {
        this(transport, address, new NoopReporter());
    }

    public Address getAddress() {
        return address;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Register a handler, replacing any earlier handler for the same kind.
     */
    public void handle(final MessageKind kind, final MessageHandler handler) {
        handlers.put(kind, handler);
    }

    public void start() {
        if (closed.get())
            throw new IllegalStateException(address + ": node is closed");

        if (!started.compareAndSet(false, true))
            return;

        final Thread thread = new Thread(new Runnable() {
            @Override
            public void run() {
                receiveLoop();
            }
        }, "node-" + address);

        thread.setDaemon(true);
        receiver = thread;
        thread.start();
    }

    private void receiveLoop() {
        while (!closed.get()) {
            final Message message;

            try {
                message = connection.receive(POLL_INTERVAL, TimeUnit.MILLISECONDS);
            } catch (final ConnectionClosedException e) {
                break;
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            if (message == null)
                continue;

            dispatch(message);
        }

        log.debug("{}: receive loop stopped", address);
    }

    void dispatch(final Message message) {
        final String tag = message.kind();
        final MessageKind kind = MessageKind.fromTag(tag);

        MessageHandler handler = kind != null ? handlers.get(kind) : null;

        if (handler == null)
            handler = handlers.get(MessageKind.DEFAULT);

        if (handler == null) {
            log.warn("{}: no handler for '{}' from {}, dropping", address, tag, message.getFrom());
            reporter.reportUnhandled(message);
            return;
        }

        try {
            handler.handle(message);
        } catch (final Exception e) {
            final HandlerException error = new HandlerException(address + ": handler for '" + tag + "' failed", e);
            log.error("{}: failed to handle message from {}", address, message.getFrom(), error);
            reporter.reportHandlerError(message, error);
        }
    }

    /**
     * Send a tagged payload. Dials the target for every send, there is no connection reuse.
     */
    public void send(final Address target, final MessageKind kind, final byte[] data) throws TransportException {
        if (closed.get())
            throw new ConnectionClosedException(address);

        final OutboundChannel channel = transport.dial(target);

        try {
            channel.send(address, Message.encode(kind.tag(), data));
        } finally {
            channel.close();
        }
    }

    public void sendString(final Address target, final MessageKind kind, final String data)
            throws TransportException {
        send(target, kind, data.getBytes(StandardCharsets.UTF_8));
    }

    public void reply(final Message message, final MessageKind kind, final String data) throws TransportException {
        sendString(message.getFrom(), kind, data);
    }

    /**
     * Stop the receive loop and deregister the address. Safe to call more than once.
     */
    public void close() {
        if (!closed.compareAndSet(false, true))
            return;

        connection.close();

        final Thread thread = receiver;

        if (thread == null || thread == Thread.currentThread())
            return;

        try {
            thread.join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{}: interrupted while waiting for receive loop", address);
        }
    }
}
