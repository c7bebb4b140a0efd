package eu.toolchain.epidemic.node;

/**
 * Failure inside a message handler. Never fatal for the receive loop.
 */
public class HandlerException extends Exception {
    public HandlerException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public HandlerException(final String message) {
        super(message);
    }
}
