package eu.toolchain.epidemic.transport;

public class TransportException extends Exception {
    public TransportException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public TransportException(final String message) {
        super(message);
    }
}
