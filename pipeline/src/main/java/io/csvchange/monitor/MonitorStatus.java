package io.csvchange.monitor;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

public record MonitorStatus(List<Path> watched, Instant lastActivity) {
}
