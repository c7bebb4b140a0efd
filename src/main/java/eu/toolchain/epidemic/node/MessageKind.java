package eu.toolchain.epidemic.node;

/**
 * Known payload tags, used as keys into a nodes handler table.
 */
public enum MessageKind {
    GOSSIP("gossip"), DISCOVER("discover"), PEERS("peers"),
    /** General purpose request and response tags, for direct exchanges between two nodes. */
    PING("ping"), PONG("pong"),
    DEFAULT("default");

    private final String tag;

    private MessageKind(final String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * @return the kind with the given tag, or {@code null} if the tag is unknown.
     */
    public static MessageKind fromTag(final String tag) {
        for (final MessageKind kind : values()) {
            if (kind.tag.equals(tag))
                return kind;
        }

        return null;
    }
}
