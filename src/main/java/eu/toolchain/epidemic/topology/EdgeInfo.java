package eu.toolchain.epidemic.topology;

import lombok.Data;

/**
 * Directed peer relation, {@code from} lists {@code to} as a peer.
 */
@Data
public class EdgeInfo {
    private final int from;
    private final int to;
}
