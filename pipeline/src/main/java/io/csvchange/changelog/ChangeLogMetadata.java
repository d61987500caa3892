package io.csvchange.changelog;

import java.util.List;

/**
 * What the pipeline learned about the file while handling one change. Absent facts are null.
 */
public record ChangeLogMetadata(Integer rowCount,
                                Integer columnCount,
                                List<String> headers,
                                Boolean valid,
                                List<String> validationErrors,
                                List<String> validationWarnings,
                                String backupId,
                                String validationFailureBackupId) {

    public static ChangeLogMetadata empty() {
        return new ChangeLogMetadata(null, null, null, null, null, null, null, null);
    }
}
