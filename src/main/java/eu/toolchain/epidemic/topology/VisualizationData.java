package eu.toolchain.epidemic.topology;

import java.time.Instant;
import java.util.List;

import lombok.Data;

@Data
public class VisualizationData {
    private final NetworkTopology topology;
    private final List<MessageTrace> traces;
    private final Instant startTime;
}
