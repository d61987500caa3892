package io.csvchange.changelog;

import io.csvchange.monitor.ChangeKind;

import java.time.Instant;

/**
 * @param sequence position in processing order, starting at 1 and never reused
 */
public record ChangeLogEntry(String id,
                             long sequence,
                             Instant timestamp,
                             String filename,
                             ChangeKind changeType,
                             String previousHash,
                             String currentHash,
                             Long fileSize,
                             ChangeLogMetadata metadata,
                             String description) {
}
