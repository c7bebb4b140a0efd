package eu.toolchain.epidemic.transport.simulator;

import eu.toolchain.epidemic.transport.Message;

public interface PacketFilter {
    /**
     * @return the message to deliver, or {@code null} if it should be silently dropped.
     */
    Message filter(Message message);
}
