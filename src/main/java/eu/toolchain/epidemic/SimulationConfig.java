package eu.toolchain.epidemic;

import lombok.Data;
import eu.toolchain.epidemic.transport.Address;
import eu.toolchain.epidemic.transport.simulator.SimulatedTransport;

/**
 * Settings shared by every node of a simulated network.
 *
 * Instances are immutable, every setter-like method returns a modified copy.
 */
@Data
public class SimulationConfig {
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_BASE_PORT = 8000;
    public static final int DEFAULT_MAX_TTL = 20;
    public static final int DEFAULT_SELECTION_ATTEMPTS = 3;
    public static final int DEFAULT_FAN_OUT_THREADS = 8;
    public static final long DEFAULT_CLOSE_TIMEOUT = 5000;
    public static final int DEFAULT_CANVAS_WIDTH = 1200;
    public static final int DEFAULT_CANVAS_HEIGHT = 800;

    private final String host;
    private final int basePort;
    private final int queueCapacity;
    private final int maxTtl;
    // random peer picks allowed per requested peer.
    private final int selectionAttempts;
    private final int fanOutThreads;
    // milliseconds to wait for outstanding fan-out tasks when closing a node.
    private final long closeTimeout;
    private final int canvasWidth;
    private final int canvasHeight;

    public static SimulationConfig defaults() {
        return new SimulationConfig(DEFAULT_HOST, DEFAULT_BASE_PORT, SimulatedTransport.DEFAULT_QUEUE_CAPACITY,
                DEFAULT_MAX_TTL, DEFAULT_SELECTION_ATTEMPTS, DEFAULT_FAN_OUT_THREADS, DEFAULT_CLOSE_TIMEOUT,
                DEFAULT_CANVAS_WIDTH, DEFAULT_CANVAS_HEIGHT);
    }

    public SimulationConfig host(final String host) {
        return new SimulationConfig(host, basePort, queueCapacity, maxTtl, selectionAttempts, fanOutThreads,
                closeTimeout, canvasWidth, canvasHeight);
    }

    public SimulationConfig basePort(final int basePort) {
        return new SimulationConfig(host, basePort, queueCapacity, maxTtl, selectionAttempts, fanOutThreads,
                closeTimeout, canvasWidth, canvasHeight);
    }

    public SimulationConfig queueCapacity(final int queueCapacity) {
        if (queueCapacity <= 0)
            throw new IllegalArgumentException("queue capacity must be positive");

        return new SimulationConfig(host, basePort, queueCapacity, maxTtl, selectionAttempts, fanOutThreads,
                closeTimeout, canvasWidth, canvasHeight);
    }

    public SimulationConfig maxTtl(final int maxTtl) {
        if (maxTtl < 0)
            throw new IllegalArgumentException("ttl must not be negative");

        return new SimulationConfig(host, basePort, queueCapacity, maxTtl, selectionAttempts, fanOutThreads,
                closeTimeout, canvasWidth, canvasHeight);
    }

    public SimulationConfig selectionAttempts(final int selectionAttempts) {
        if (selectionAttempts <= 0)
            throw new IllegalArgumentException("selection attempts must be positive");

        return new SimulationConfig(host, basePort, queueCapacity, maxTtl, selectionAttempts, fanOutThreads,
                closeTimeout, canvasWidth, canvasHeight);
    }

    public SimulationConfig fanOutThreads(final int fanOutThreads) {
        if (fanOutThreads <= 0)
            throw new IllegalArgumentException("fan-out threads must be positive");

        return new SimulationConfig(host, basePort, queueCapacity, maxTtl, selectionAttempts, fanOutThreads,
                closeTimeout, canvasWidth, canvasHeight);
    }

    public SimulationConfig closeTimeout(final long closeTimeout) {
        if (closeTimeout < 0)
            throw new IllegalArgumentException("close timeout must not be negative");

        return new SimulationConfig(host, basePort, queueCapacity, maxTtl, selectionAttempts, fanOutThreads,
                closeTimeout, canvasWidth, canvasHeight);
    }

    public SimulationConfig canvas(final int canvasWidth, final int canvasHeight) {
        return new SimulationConfig(host, basePort, queueCapacity, maxTtl, selectionAttempts, fanOutThreads,
                closeTimeout, canvasWidth, canvasHeight);
    }

    public Address address(final int nodeId) {
        return new Address(host, basePort + nodeId);
    }

    /**
     * Reverse of {@link #address(int)}.
     *
     * @return the node id for an address, or -1 if the address is not on this networks host.
     */
    public int nodeId(final Address address) {
        if (!host.equals(address.getHost()) || address.getPort() < basePort)
            return -1;

        return address.getPort() - basePort;
    }
}
