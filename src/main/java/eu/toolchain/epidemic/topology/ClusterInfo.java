package eu.toolchain.epidemic.topology;

import java.util.List;

import lombok.Data;

import com.fasterxml.jackson.annotation.JsonProperty;

@Data
public class ClusterInfo {
    private final int id;
    private final List<Integer> nodeIds;
    private final int size;
    private final int centerX;
    private final int centerY;
    // every component except the largest one.
    @JsonProperty("isIsolated")
    private final boolean isolated;
}
