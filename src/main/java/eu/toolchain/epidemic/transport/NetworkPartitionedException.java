package eu.toolchain.epidemic.transport;

public class NetworkPartitionedException extends TransportException {
    private final Address address;

    public NetworkPartitionedException(final Address address) {
        super("network partitioned: " + address);
        this.address = address;
    }

    public Address getAddress() {
        return address;
    }
}
