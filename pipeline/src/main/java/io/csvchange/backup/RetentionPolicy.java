package io.csvchange.backup;

import java.time.Duration;

/**
 * Per-file retention: at most {@code maxBackups} copies, none older than {@code maxAge},
 * but never fewer than {@code minBackups}.
 */
public record RetentionPolicy(int maxBackups, Duration maxAge, int minBackups) {

    public static RetentionPolicy defaults() {
        return new RetentionPolicy(50, Duration.ofDays(30), 5);
    }

    public RetentionPolicy {
        if (maxBackups < 1) throw new IllegalArgumentException("maxBackups must be >= 1");
        if (minBackups < 0) throw new IllegalArgumentException("minBackups must be >= 0");
    }
}
