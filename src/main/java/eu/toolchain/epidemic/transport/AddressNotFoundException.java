package eu.toolchain.epidemic.transport;

public class AddressNotFoundException extends TransportException {
    private final Address address;

    public AddressNotFoundException(final Address address) {
        super("no listener for address: " + address);
        this.address = address;
    }

    public Address getAddress() {
        return address;
    }
}
