package eu.toolchain.epidemic.topology;

import java.util.List;

import lombok.Data;

@Data
public class NetworkTopology {
    private final List<NodeInfo> nodes;
    private final List<EdgeInfo> edges;
    private final List<ClusterInfo> clusters;
}
