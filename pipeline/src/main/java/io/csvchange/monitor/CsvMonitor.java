package io.csvchange.monitor;

import io.csvchange.event.Notifier;
import io.csvchange.hash.ChecksumAlgorithm;
import io.csvchange.retry.Retries;
import io.csvchange.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Watches individual files and turns bursts of raw notifications into one {@link ChangeEvent} per quiet period.
 * <p>
 * Each watched path owns a debounce timer that is reset on every notification. When it fires, the path is
 * classified against its baseline under the path's own lock, then the baseline moves forward.
 */
public class CsvMonitor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CsvMonitor.class);

    private final MonitorOptions options;
    private final RetryPolicy retry;
    private final Clock clock;
    private final Notifier<ChangeEvent> changes = new Notifier<>("monitor.changes");
    private final Notifier<MonitorError> errors = new Notifier<>("monitor.errors");

    private final Map<Path, Watched> watched = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;

    private final Object nativeLock = new Object();
    private final Map<Path, WatchKey> dirKeys = new HashMap<>();
    private final Map<Path, Integer> dirRefs = new HashMap<>();
    private WatchService watchService;
    private Thread pollThread;

    private volatile Instant lastActivity;
    private volatile boolean closed;

    public CsvMonitor(MonitorOptions options, RetryPolicy retry, Clock clock) {
        this.options = Objects.requireNonNull(options);
        this.retry = Objects.requireNonNull(retry);
        this.clock = Objects.requireNonNull(clock);
        AtomicInteger n = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "csv-monitor-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public Notifier<ChangeEvent> changes() { return changes; }
    public Notifier<MonitorError> errors() { return errors; }
    public MonitorOptions options() { return options; }

    /**
     * Starts watching {@code file}. A file that does not exist yet is awaited; its creation surfaces as ADDED.
     *
     * @throws WatchException if the parent directory is missing, unreadable or cannot be registered
     */
    public void watch(Path file) {
        Path path = normalize(file);
        if (closed) throw new WatchException(path, "Monitor is closed");
        Path dir = path.getParent();
        if (dir == null || !Files.isDirectory(dir)) throw new WatchException(path, "Parent directory does not exist");
        if (!Files.isReadable(dir)) throw new WatchException(path, "Parent directory is not readable");

        Watched w = new Watched(path);
        if (watched.putIfAbsent(path, w) != null) return;
        try {
            w.baseline = snapshot(path);
        } catch (NoSuchFileException e) {
            w.baseline = null;
        } catch (IOException e) {
            watched.remove(path);
            throw new WatchException(path, "Cannot read file", e);
        }
        if (options.nativeNotifications()) {
            try {
                registerDirectory(dir);
            } catch (IOException e) {
                watched.remove(path);
                throw new WatchException(path, "Cannot register directory watch", e);
            }
        }
        touch();
        log.info("Watching {} ({})", path, w.baseline == null ? "awaiting creation" : w.baseline.size() + " bytes");
    }

    /** Stops watching; a pending debounce timer is cancelled. Unknown paths are ignored. */
    public void unwatch(Path file) {
        Path path = normalize(file);
        Watched w = watched.remove(path);
        if (w == null) return;
        w.lock.lock();
        try {
            if (w.pending != null) w.pending.cancel(false);
            w.pending = null;
        } finally {
            w.lock.unlock();
        }
        if (options.nativeNotifications()) releaseDirectory(path.getParent());
        log.info("Stopped watching {}", path);
    }

    public void unwatchAll() {
        for (Path p : new ArrayList<>(watched.keySet())) unwatch(p);
    }

    public boolean isWatching(Path file) { return watched.containsKey(normalize(file)); }

    public List<Path> watchedPaths() {
        List<Path> out = new ArrayList<>(watched.keySet());
        out.sort(null);
        return out;
    }

    public MonitorStatus status() { return new MonitorStatus(watchedPaths(), lastActivity); }

    /**
     * Feeds one raw notification for {@code file}. Notifications for unwatched paths are dropped.
     */
    public void onRawNotification(Path file, RawKind kind) {
        Watched w = watched.get(normalize(file));
        if (w == null || closed) return;
        w.lock.lock();
        try {
            if (kind == RawKind.RENAME || (kind == RawKind.CREATE && w.baseline != null)) {
                w.renameSignal = true;
            }
            if (w.pending != null) w.pending.cancel(false);
            w.pending = scheduler.schedule(() -> classify(w), options.debounce().toMillis(), TimeUnit.MILLISECONDS);
        } finally {
            w.lock.unlock();
        }
        touch();
    }

    private void classify(Watched w) {
        ChangeEvent event;
        w.lock.lock();
        try {
            if (watched.get(w.path) != w) return;
            w.pending = null;
            FileBaseline previous = w.baseline;
            FileBaseline current;
            try {
                current = snapshot(w.path);
            } catch (NoSuchFileException e) {
                current = null;
            } catch (IOException e) {
                log.warn("Cannot read {}: {}", w.path, e.toString());
                errors.publish(new MonitorError(w.path, e, clock.instant()));
                return;
            }
            boolean rename = w.renameSignal;
            w.renameSignal = false;

            ChangeKind kind;
            if (current == null) {
                if (previous == null) return;
                kind = ChangeKind.DELETED;
            } else if (previous == null) {
                kind = ChangeKind.ADDED;
            } else if (rename) {
                kind = ChangeKind.RENAMED;
            } else if (differs(previous, current)) {
                kind = ChangeKind.CHANGED;
            } else {
                log.debug("Notification for {} without content change", w.path);
                return;
            }
            w.baseline = current;
            event = new ChangeEvent(kind, w.path, clock.instant(),
                    previous == null ? null : previous.digest(),
                    current == null ? null : current.digest(),
                    current == null ? 0 : current.size(),
                    current == null ? null : current.modifiedAt());
        } finally {
            w.lock.unlock();
        }
        touch();
        log.info("{} {}", event.kind(), event.path());
        changes.publish(event);
    }

    private boolean differs(FileBaseline a, FileBaseline b) {
        if (options.useChecksum()) return !Objects.equals(a.digest(), b.digest());
        return a.size() != b.size() || !Objects.equals(a.modifiedAt(), b.modifiedAt());
    }

    private FileBaseline snapshot(Path path) throws IOException {
        return Retries.withRetry(retry, () -> {
            BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
            String digest = options.useChecksum() ? ChecksumAlgorithm.SHA256.hex(path) : null;
            return new FileBaseline(attrs.size(), attrs.lastModifiedTime().toInstant(), digest);
        });
    }

    private void registerDirectory(Path dir) throws IOException {
        synchronized (nativeLock) {
            if (watchService == null) {
                watchService = FileSystems.getDefault().newWatchService();
                pollThread = new Thread(this::pollNative, "csv-monitor-watch");
                pollThread.setDaemon(true);
                pollThread.start();
            }
            if (!dirKeys.containsKey(dir)) {
                dirKeys.put(dir, dir.register(watchService,
                        StandardWatchEventKinds.ENTRY_CREATE,
                        StandardWatchEventKinds.ENTRY_MODIFY,
                        StandardWatchEventKinds.ENTRY_DELETE));
            }
            dirRefs.merge(dir, 1, Integer::sum);
        }
    }

    private void releaseDirectory(Path dir) {
        synchronized (nativeLock) {
            Integer refs = dirRefs.get(dir);
            if (refs == null) return;
            if (refs > 1) {
                dirRefs.put(dir, refs - 1);
                return;
            }
            dirRefs.remove(dir);
            WatchKey key = dirKeys.remove(dir);
            if (key != null) key.cancel();
        }
    }

    private void pollNative() {
        WatchService ws;
        synchronized (nativeLock) { ws = watchService; }
        while (!closed) {
            WatchKey key;
            try {
                key = ws.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }
            Path dir = (Path) key.watchable();
            for (WatchEvent<?> ev : key.pollEvents()) {
                WatchEvent.Kind<?> k = ev.kind();
                if (k == StandardWatchEventKinds.OVERFLOW) {
                    for (Path p : watchedPaths()) {
                        if (dir.equals(p.getParent())) onRawNotification(p, RawKind.MODIFY);
                    }
                    continue;
                }
                Path child = dir.resolve((Path) ev.context());
                RawKind raw = k == StandardWatchEventKinds.ENTRY_CREATE ? RawKind.CREATE
                        : k == StandardWatchEventKinds.ENTRY_DELETE ? RawKind.DELETE
                        : RawKind.MODIFY;
                onRawNotification(child, raw);
            }
            if (!key.reset()) {
                log.warn("Directory watch on {} is no longer valid", dir);
                for (Path p : watchedPaths()) {
                    if (dir.equals(p.getParent())) {
                        errors.publish(new MonitorError(p, new IOException("Directory watch invalidated: " + dir), clock.instant()));
                    }
                }
            }
        }
    }

    private void touch() { lastActivity = clock.instant(); }

    private static Path normalize(Path p) { return p.toAbsolutePath().normalize(); }

    @Override
    public void close() {
        if (closed) return;
        unwatchAll();
        closed = true;
        scheduler.shutdownNow();
        synchronized (nativeLock) {
            if (watchService != null) {
                try {
                    watchService.close();
                } catch (IOException e) {
                    log.debug("Closing watch service: {}", e.toString());
                }
            }
        }
    }

    private static final class Watched {
        final Path path;
        final ReentrantLock lock = new ReentrantLock();
        FileBaseline baseline;
        boolean renameSignal;
        ScheduledFuture<?> pending;

        Watched(Path path) { this.path = path; }
    }
}
