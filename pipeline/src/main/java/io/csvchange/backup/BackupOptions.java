package io.csvchange.backup;

import io.csvchange.hash.ChecksumAlgorithm;

import java.nio.file.Path;

public record BackupOptions(Path backupDir,
                            RetentionPolicy retention,
                            boolean compression,
                            int compressionLevel,
                            ChecksumAlgorithm checksumAlgorithm) {

    public static final String INDEX_FILE = "backup-metadata.json";
    public static final String VERSIONS_FILE = "backup-versions.json";

    public BackupOptions {
        if (compressionLevel < 0 || compressionLevel > 9) {
            throw new IllegalArgumentException("compressionLevel must be 0..9, got " + compressionLevel);
        }
    }

    public static BackupOptions defaults(Path backupDir) {
        return new BackupOptions(backupDir, RetentionPolicy.defaults(), true, 6, ChecksumAlgorithm.SHA256);
    }

    public BackupOptions withRetention(RetentionPolicy r) { return new BackupOptions(backupDir, r, compression, compressionLevel, checksumAlgorithm); }
    public BackupOptions withCompression(boolean c) { return new BackupOptions(backupDir, retention, c, compressionLevel, checksumAlgorithm); }
    public BackupOptions withChecksumAlgorithm(ChecksumAlgorithm a) { return new BackupOptions(backupDir, retention, compression, compressionLevel, a); }
}
