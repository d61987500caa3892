package io.csvchange.backup;

import java.time.Duration;

public record BackupResult(boolean success, BackupRecord record, String error, Duration duration) {

    public static BackupResult ok(BackupRecord record, Duration duration) {
        return new BackupResult(true, record, null, duration);
    }

    public static BackupResult failed(String error, Duration duration) {
        return new BackupResult(false, null, error, duration);
    }
}
