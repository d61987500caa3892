package io.csvchange.monitor;

import java.nio.file.Path;
import java.time.Instant;

/**
 * One coalesced disturbance of a watched file. Digests are present only when checksum strictness is enabled;
 * {@code size} and {@code modifiedAt} describe the file after the change (0 and null for deletions).
 */
public record ChangeEvent(ChangeKind kind,
                          Path path,
                          Instant timestamp,
                          String previousDigest,
                          String currentDigest,
                          long size,
                          Instant modifiedAt) {
}
