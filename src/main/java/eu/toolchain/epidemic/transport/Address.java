package eu.toolchain.epidemic.transport;

import lombok.Data;

/**
 * Logical address of a simulated listener, the only identity used for routing.
 */
@Data
public class Address {
    private final String host;
    private final int port;

    public static Address of(final String host, final int port) {
        return new Address(host, port);
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
