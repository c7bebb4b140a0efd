package eu.toolchain.epidemic.node;

import eu.toolchain.epidemic.transport.Message;

public interface MessageHandler {
    /**
     * Fires for every inbound message of the kind this handler is registered for.
     */
    void handle(Message message) throws Exception;
}
