package io.csvchange.error;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded ring of the most recent failures, formatted as {@code [timestamp] message}.
 */
public class RecentErrors implements FailureSink {
    public static final int DEFAULT_CAPACITY = 50;

    private final int capacity;
    private final Clock clock;
    private final Deque<String> ring = new ArrayDeque<>();

    public RecentErrors() { this(DEFAULT_CAPACITY, Clock.systemUTC()); }

    public RecentErrors(int capacity, Clock clock) {
        this.capacity = Math.max(1, capacity);
        this.clock = clock;
    }

    public synchronized void add(String message) {
        ring.addLast("[" + clock.instant() + "] " + message);
        while (ring.size() > capacity) ring.removeFirst();
    }

    @Override
    public void acceptFailure(String stage, Path path, Exception e) {
        String where = path == null ? stage : stage + " " + path;
        add(where + ": " + (e.getMessage() == null ? e.toString() : e.getMessage()));
    }

    /** Oldest first. */
    public synchronized List<String> snapshot() { return new ArrayList<>(ring); }

    public synchronized int size() { return ring.size(); }
}
