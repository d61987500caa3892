package io.csvchange.backup;

import java.time.Instant;
import java.util.Map;

public record BackupStats(int totalBackups, long totalSize, Instant oldest, Instant newest, Map<String, Integer> byOriginalPath) {
}
