package eu.toolchain.epidemic.topology;

import java.time.Instant;

import lombok.Data;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single accepted hop of a gossip message.
 */
@Data
public class MessageTrace {
    private final Instant timestamp;
    private final String messageId;
    private final int originalSender;
    private final int immediateForwarder;
    private final int receiver;
    private final String content;
    private final int ttl;
    // the hop came straight from the original sender.
    @JsonProperty("isDirect")
    private final boolean direct;
}
