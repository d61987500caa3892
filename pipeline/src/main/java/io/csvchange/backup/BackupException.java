package io.csvchange.backup;

/**
 * Wraps I/O failures that leave the backup store unusable, such as an uncreatable directory or an unreadable index.
 */
public class BackupException extends RuntimeException {

    public BackupException(String message, Throwable cause) {
        super(message, cause);
    }

    public BackupException(String message) {
        super(message);
    }
}
