package io.csvchange.cli;

import io.csvchange.runtime.UpdateManager;
import io.csvchange.runtime.UpdateManagerBuilder;
import io.csvchange.monitor.MonitorOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class StatusServerTest {
    private Path dir;
    private UpdateManager manager;
    private StatusServer server;
    private final HttpClient client = HttpClient.newHttpClient();

    @BeforeEach
    void setUp() throws Exception {
        dir = Files.createTempDirectory("status-test");
        manager = new UpdateManagerBuilder()
                .workDir(dir)
                .monitor(MonitorOptions.defaults().withNativeNotifications(false))
                .build();
        manager.start();
        server = new StatusServer(0, manager);
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.close();
        manager.close();
        try (Stream<Path> s = Files.walk(dir)) {
            s.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        }
    }

    private HttpResponse<String> send(String method, String path) throws Exception {
        HttpRequest req = HttpRequest.newBuilder(URI.create("http://localhost:" + server.port() + path))
                .method(method, HttpRequest.BodyPublishers.noBody())
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void status_lists_hooks_and_counters() throws Exception {
        HttpResponse<String> r = send("GET", "/status");
        assertEquals(200, r.statusCode());
        assertTrue(r.headers().firstValue("Content-Type").orElse("").startsWith("application/json"));
        assertTrue(r.body().contains("\"totalChanges\" : 0"));
        assertTrue(r.body().contains("\"regenerate-json\" : true"));
    }

    @Test
    void metrics_are_served_as_json() throws Exception {
        HttpResponse<String> r = send("GET", "/metrics");
        assertEquals(200, r.statusCode());
        assertTrue(r.body().trim().startsWith("{"));
    }

    @Test
    void only_get_is_allowed() throws Exception {
        assertEquals(405, send("POST", "/status").statusCode());
    }
}
