package io.csvchange.error;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.csvchange.json.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Appends one JSON object per failure to a file.
 */
public class FileFailureSink implements FailureSink {
    private static final Logger log = LoggerFactory.getLogger(FileFailureSink.class);

    private final Path file;
    private final Clock clock;
    private final ObjectMapper mapper = Json.compactMapper();

    public FileFailureSink(Path file) throws IOException {
        this(file, Clock.systemUTC());
    }

    public FileFailureSink(Path file, Clock clock) throws IOException {
        this.file = file;
        this.clock = clock;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        if (!Files.exists(file)) {
            Files.writeString(file, "", StandardCharsets.UTF_8, StandardOpenOption.CREATE);
        }
    }

    public Path file() { return file; }

    @Override
    public synchronized void acceptFailure(String stage, Path path, Exception e) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("ts", clock.instant().toString());
        line.put("stage", stage);
        line.put("path", path == null ? null : path.toString());
        line.put("error", e.toString());
        try {
            Files.writeString(file, mapper.writeValueAsString(line) + "\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException io) {
            log.warn("Could not append failure to {}: {}", file, io.toString());
        }
    }
}
