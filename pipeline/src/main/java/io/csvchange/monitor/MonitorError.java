package io.csvchange.monitor;

import java.nio.file.Path;
import java.time.Instant;

public record MonitorError(Path path, Exception error, Instant at) {
}
