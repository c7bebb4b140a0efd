package eu.toolchain.epidemic.transport;

public class AddressInUseException extends TransportException {
    private final Address address;

    public AddressInUseException(final Address address) {
        super("address already in use: " + address);
        this.address = address;
    }

    public Address getAddress() {
        return address;
    }
}
