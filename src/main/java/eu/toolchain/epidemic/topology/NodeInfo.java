package eu.toolchain.epidemic.topology;

import lombok.Data;

@Data
public class NodeInfo {
    private final int id;
    private final String addr;
    private final int x;
    private final int y;
    private final int clusterId;
}
