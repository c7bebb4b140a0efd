package eu.toolchain.epidemic.transport;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import lombok.Data;

/**
 * Envelope carried by the transport.
 *
 * The payload is a tagged body on the form {@code <kind>:<body>}, only the first colon is a delimiter.
 */
@Data
public class Message {
    public static final char DELIMITER = ':';

    private final Address from;
    private final Address to;
    private final byte[] payload;

    public Message(final Address from, final Address to, final byte[] payload) {
        this.from = from;
        this.to = to;
        this.payload = payload.clone();
    }

    public static Message of(final Address from, final Address to, final String kind, final byte[] body) {
        return new Message(from, to, encode(kind, body));
    }

    public static byte[] encode(final String kind, final byte[] body) {
        final byte[] tag = kind.getBytes(StandardCharsets.UTF_8);
        final byte[] payload = new byte[tag.length + 1 + body.length];
        System.arraycopy(tag, 0, payload, 0, tag.length);
        payload[tag.length] = DELIMITER;
        System.arraycopy(body, 0, payload, tag.length + 1, body.length);
        return payload;
    }

    public byte[] getPayload() {
        return payload.clone();
    }

    /**
     * The tag in front of the first delimiter, or the whole payload if there is no delimiter.
     */
    public String kind() {
        final int index = delimiterIndex();

        if (index < 0)
            return new String(payload, StandardCharsets.UTF_8);

        return new String(payload, 0, index, StandardCharsets.UTF_8);
    }

    public byte[] body() {
        final int index = delimiterIndex();

        if (index < 0)
            return new byte[0];

        return Arrays.copyOfRange(payload, index + 1, payload.length);
    }

    public String bodyAsString() {
        return new String(body(), StandardCharsets.UTF_8);
    }

    private int delimiterIndex() {
        for (int i = 0; i < payload.length; i++) {
            if (payload[i] == DELIMITER)
                return i;
        }

        return -1;
    }
}
