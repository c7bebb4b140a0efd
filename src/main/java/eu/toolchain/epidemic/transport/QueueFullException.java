package eu.toolchain.epidemic.transport;

public class QueueFullException extends TransportException {
    private final Address address;

    public QueueFullException(final Address address) {
        super("inbound queue full: " + address);
        this.address = address;
    }

    public Address getAddress() {
        return address;
    }
}
