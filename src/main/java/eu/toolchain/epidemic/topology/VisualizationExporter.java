package eu.toolchain.epidemic.topology;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import lombok.extern.slf4j.Slf4j;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import eu.toolchain.epidemic.serializers.ObjectMappers;

/**
 * Writes the document read by the replay front-end.
 */
@Slf4j
public class VisualizationExporter {
    public static final String FILE_NAME = "network_visualization.json";

    private final ObjectMapper mapper = ObjectMappers.create().enable(SerializationFeature.INDENT_OUTPUT);

    public String toJson(final VisualizationData data) throws IOException {
        return mapper.writeValueAsString(data);
    }

    /**
     * Write {@value #FILE_NAME} into the given directory, creating it if needed.
     *
     * @return path of the written file.
     */
    public Path export(final VisualizationData data, final Path outputDirectory) throws IOException {
        Files.createDirectories(outputDirectory);

        final Path file = outputDirectory.resolve(FILE_NAME);
        mapper.writeValue(file.toFile(), data);

        log.info("exported visualization data to {}", file);
        log.info("total nodes: {}, total message traces: {}", data.getTopology().getNodes().size(),
                data.getTraces().size());
        return file;
    }
}
