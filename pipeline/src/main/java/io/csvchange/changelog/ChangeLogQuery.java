package io.csvchange.changelog;

import io.csvchange.monitor.ChangeKind;

import java.time.Instant;

/**
 * Filter over the change log. {@code filename} matches as a substring of the logged path; a {@code limit} of 0
 * means no limit. Results are newest first.
 */
public record ChangeLogQuery(String filename, ChangeKind changeType, Instant from, Instant to, int limit, int offset) {

    public static ChangeLogQuery all() { return new ChangeLogQuery(null, null, null, null, 0, 0); }

    public ChangeLogQuery forFile(String f) { return new ChangeLogQuery(f, changeType, from, to, limit, offset); }
    public ChangeLogQuery ofType(ChangeKind k) { return new ChangeLogQuery(filename, k, from, to, limit, offset); }
    public ChangeLogQuery between(Instant f, Instant t) { return new ChangeLogQuery(filename, changeType, f, t, limit, offset); }
    public ChangeLogQuery page(int l, int o) { return new ChangeLogQuery(filename, changeType, from, to, l, o); }

    boolean matches(ChangeLogEntry e) {
        if (filename != null && !e.filename().contains(filename)) return false;
        if (changeType != null && e.changeType() != changeType) return false;
        if (from != null && e.timestamp().isBefore(from)) return false;
        return to == null || !e.timestamp().isAfter(to);
    }
}
