package io.csvchange.backup;

import java.nio.file.Path;

/**
 * Outcome of a restore. On failure {@code rollbackError} is set only if the target could not be put back
 * from its safety backup.
 */
public record RestoreResult(boolean success,
                            String backupId,
                            Path restoredPath,
                            String safetyBackupId,
                            String error,
                            String rollbackError) {

    static RestoreResult ok(String backupId, Path restoredPath, String safetyBackupId) {
        return new RestoreResult(true, backupId, restoredPath, safetyBackupId, null, null);
    }

    static RestoreResult failed(String backupId, Path target, String safetyBackupId, String error, String rollbackError) {
        return new RestoreResult(false, backupId, target, safetyBackupId, error, rollbackError);
    }
}
