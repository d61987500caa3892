package io.csvchange.backup;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Filter and ordering for {@link BackupManager#listBackups}. Tags match when any of them is present.
 */
public record BackupQuery(Path originalPath,
                          Instant from,
                          Instant to,
                          List<String> tags,
                          SortBy sortBy,
                          boolean descending,
                          int limit) {

    public enum SortBy { TIMESTAMP, SIZE, VERSION }

    public BackupQuery {
        tags = tags == null ? List.of() : List.copyOf(tags);
        sortBy = sortBy == null ? SortBy.TIMESTAMP : sortBy;
    }

    public static BackupQuery all() {
        return new BackupQuery(null, null, null, List.of(), SortBy.TIMESTAMP, true, 0);
    }

    public static BackupQuery forPath(Path original) { return all().withPath(original); }

    public BackupQuery withPath(Path p) { return new BackupQuery(p, from, to, tags, sortBy, descending, limit); }
    public BackupQuery between(Instant f, Instant t) { return new BackupQuery(originalPath, f, t, tags, sortBy, descending, limit); }
    public BackupQuery withTags(List<String> t) { return new BackupQuery(originalPath, from, to, t, sortBy, descending, limit); }
    public BackupQuery sorted(SortBy s, boolean desc) { return new BackupQuery(originalPath, from, to, tags, s, desc, limit); }
    public BackupQuery limit(int n) { return new BackupQuery(originalPath, from, to, tags, sortBy, descending, n); }
}
