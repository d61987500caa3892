package io.csvchange.backup;

import io.csvchange.hash.ChecksumAlgorithm;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Index entry for one stored copy. {@code checksum} is over the original (uncompressed) bytes;
 * {@code fileSize} is the original size.
 */
public record BackupRecord(String id,
                           String originalPath,
                           String backupPath,
                           Instant timestamp,
                           long fileSize,
                           String checksum,
                           ChecksumAlgorithm checksumAlgorithm,
                           boolean compressed,
                           int version,
                           String context,
                           List<String> tags) {

    public BackupRecord {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public Path original() { return Path.of(originalPath); }

    public Path payload() { return Path.of(backupPath); }

    public boolean hasAnyTag(List<String> wanted) {
        for (String t : wanted) {
            if (tags.contains(t)) return true;
        }
        return false;
    }
}
