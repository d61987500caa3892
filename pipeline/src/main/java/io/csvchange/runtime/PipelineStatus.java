package io.csvchange.runtime;

import io.csvchange.backup.BackupStats;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of the orchestrator. {@code validators} is null when auto-validation is off and
 * {@code backups} is null when auto-backup is off.
 */
public record PipelineStatus(List<Path> activeWatches,
                             Map<Path, FileState> fileStates,
                             long totalChanges,
                             Instant lastChange,
                             Map<String, Boolean> hooks,
                             List<String> recentErrors,
                             Map<String, String> validators,
                             BackupStats backups) {
}
