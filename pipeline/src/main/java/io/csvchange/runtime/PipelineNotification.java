package io.csvchange.runtime;

import java.nio.file.Path;
import java.time.Instant;

public record PipelineNotification(Type type, Path path, Instant at, String message) {

    public enum Type {
        CYCLE_STARTED,
        BACKUP_CREATED,
        VALIDATION_FAILED,
        CHANGE_LOGGED,
        HOOK_FAILED,
        REPORT_WRITTEN,
        CYCLE_COMPLETED,
        ERROR
    }
}
