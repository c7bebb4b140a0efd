package eu.toolchain.epidemic.topology;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class TestVisualizationExporter {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final ObjectMapper mapper = new ObjectMapper();

    private VisualizationData data() {
        final Instant start = Instant.parse("2024-01-01T00:00:00Z");

        final TraceLog log = new TraceLog(start);
        // recorded out of order.
        log.record(new MessageTrace(start.plusMillis(20), "m", 0, 1, 2, "x", 19, false));
        log.record(new MessageTrace(start.plusMillis(10), "m", 0, 0, 1, "x", 20, true));

        final List<List<Integer>> successors = new ArrayList<>();
        successors.add(Arrays.asList(1));
        successors.add(Arrays.asList(2));
        successors.add(new ArrayList<Integer>());
        successors.add(new ArrayList<Integer>());

        final PeerGraph graph = new PeerGraph(Arrays.asList("127.0.0.1:8000", "127.0.0.1:8001", "127.0.0.1:8002",
                "127.0.0.1:8003"), successors);

        final NetworkTopology topology = new ConnectivityAnalyzer(graph,
                new ForceDirectedLayout(new Random(0), 1200, 800)).generateTopology();

        return new VisualizationData(topology, log.getTraces(), log.getStartTime());
    }

    @Test
    public void testExport() throws Exception {
        final Path dir = folder.getRoot().toPath().resolve("out");
        final Path file = new VisualizationExporter().export(data(), dir);

        Assert.assertEquals(VisualizationExporter.FILE_NAME, file.getFileName().toString());
        Assert.assertTrue(Files.exists(file));

        final JsonNode root = mapper.readTree(file.toFile());

        Assert.assertEquals("2024-01-01T00:00:00Z", root.get("startTime").asText());

        final JsonNode topology = root.get("topology");
        Assert.assertEquals(4, topology.get("nodes").size());
        Assert.assertEquals(2, topology.get("edges").size());
        Assert.assertEquals(2, topology.get("clusters").size());

        final JsonNode node = topology.get("nodes").get(0);
        for (final String field : Arrays.asList("id", "addr", "x", "y", "clusterId"))
            Assert.assertTrue("missing node field " + field, node.has(field));

        final JsonNode edge = topology.get("edges").get(0);
        Assert.assertEquals(0, edge.get("from").asInt());
        Assert.assertEquals(1, edge.get("to").asInt());

        final JsonNode main = topology.get("clusters").get(0);
        Assert.assertEquals(3, main.get("size").asInt());
        Assert.assertFalse(main.get("isIsolated").asBoolean());
        Assert.assertTrue(topology.get("clusters").get(1).get("isIsolated").asBoolean());
        for (final String field : Arrays.asList("id", "nodeIds", "centerX", "centerY"))
            Assert.assertTrue("missing cluster field " + field, main.has(field));

        final JsonNode traces = root.get("traces");
        Assert.assertEquals(2, traces.size());
        Assert.assertTrue(traces.get(0).get("isDirect").asBoolean());
        Assert.assertEquals(1, traces.get(0).get("receiver").asInt());
        Assert.assertEquals(20, traces.get(0).get("ttl").asInt());
        Assert.assertEquals("2024-01-01T00:00:00.010Z", traces.get(0).get("timestamp").asText());
        Assert.assertFalse(traces.get(1).get("isDirect").asBoolean());

        for (final String field : Arrays.asList("messageId", "originalSender", "immediateForwarder", "content"))
            Assert.assertTrue("missing trace field " + field, traces.get(0).has(field));

        Assert.assertFalse(traces.get(0).has("direct"));
    }

    @Test
    public void testToJsonIsIndented() throws Exception {
        final String json = new VisualizationExporter().toJson(data());

        Assert.assertTrue(json.contains("\n  \"topology\""));
    }
}
