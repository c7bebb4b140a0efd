package eu.toolchain.epidemic.transport;

public class ConnectionClosedException extends TransportException {
    private final Address address;

    public ConnectionClosedException(final Address address) {
        super("connection closed: " + address);
        this.address = address;
    }

    public Address getAddress() {
        return address;
    }
}
