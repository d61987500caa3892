package io.csvchange.error;

import com.fasterxml.jackson.databind.JsonNode;
import io.csvchange.MutableClock;
import io.csvchange.TestFiles;
import io.csvchange.json.Json;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FailureSinkTest {
    private Path dir;
    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));

    @BeforeEach
    void setUp() throws Exception {
        dir = Files.createTempDirectory("failure-test");
    }

    @AfterEach
    void tearDown() {
        TestFiles.deleteRecursively(dir);
    }

    @Test
    void recent_errors_keep_only_the_newest() {
        RecentErrors errors = new RecentErrors(2, clock);
        errors.acceptFailure("backup", Path.of("/data/a.csv"), new IOException("disk full"));
        errors.acceptFailure("diff", null, new IllegalStateException());
        errors.add("third");

        assertEquals(List.of(
                "[2024-01-01T00:00:00Z] diff: java.lang.IllegalStateException",
                "[2024-01-01T00:00:00Z] third"), errors.snapshot());
        assertEquals(2, errors.size());
    }

    @Test
    void file_sink_appends_one_json_line_per_failure() throws Exception {
        FileFailureSink sink = new FileFailureSink(dir.resolve("logs/failures.jsonl"), clock);
        sink.acceptFailure("changelog", Path.of("/data/a.csv"), new IOException("read-only"));
        sink.acceptFailure("monitor", null, new IOException("gone"));

        List<String> lines = Files.readAllLines(sink.file());
        assertEquals(2, lines.size());
        JsonNode first = Json.compactMapper().readTree(lines.get(0));
        assertEquals("changelog", first.path("stage").asText());
        assertEquals("/data/a.csv", first.path("path").asText());
        assertEquals("java.io.IOException: read-only", first.path("error").asText());
        assertEquals("2024-01-01T00:00:00Z", first.path("ts").asText());
        assertTrue(Json.compactMapper().readTree(lines.get(1)).path("path").isNull());
    }

    @Test
    void fan_out_survives_a_throwing_sink() {
        RecentErrors errors = new RecentErrors(10, clock);
        FailureSink broken = (stage, path, e) -> {
            throw new IllegalStateException("sink down");
        };
        FailureSink.fanOut(broken, errors).acceptFailure("hook", null, new RuntimeException("boom"));
        assertEquals(List.of("[2024-01-01T00:00:00Z] hook: boom"), errors.snapshot());
    }
}
