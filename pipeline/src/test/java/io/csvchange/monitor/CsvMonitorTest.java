package io.csvchange.monitor;

import io.csvchange.TestFiles;
import io.csvchange.retry.RetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class CsvMonitorTest {
    private Path dir;
    private CsvMonitor monitor;
    private final BlockingQueue<ChangeEvent> events = new LinkedBlockingQueue<>();

    @BeforeEach
    void setUp() throws Exception {
        dir = Files.createTempDirectory("monitor-test");
        MonitorOptions opts = MonitorOptions.defaults()
                .withDebounce(Duration.ofMillis(100))
                .withNativeNotifications(false);
        monitor = new CsvMonitor(opts, RetryPolicy.none(), Clock.systemUTC());
        monitor.changes().subscribe(events::add);
    }

    @AfterEach
    void tearDown() {
        monitor.close();
        TestFiles.deleteRecursively(dir);
    }

    private ChangeEvent next() throws InterruptedException {
        ChangeEvent e = events.poll(3, TimeUnit.SECONDS);
        assertNotNull(e, "expected a change event");
        return e;
    }

    private void assertQuiet() throws InterruptedException {
        assertNull(events.poll(400, TimeUnit.MILLISECONDS));
    }

    @Test
    void burst_of_notifications_coalesces_into_one_changed_event() throws Exception {
        Path f = Files.writeString(dir.resolve("stores.csv"), "name\nA\n");
        monitor.watch(f);

        Files.writeString(f, "name\nA\nB\n");
        monitor.onRawNotification(f, RawKind.MODIFY);
        monitor.onRawNotification(f, RawKind.MODIFY);
        monitor.onRawNotification(f, RawKind.MODIFY);

        ChangeEvent e = next();
        assertEquals(ChangeKind.CHANGED, e.kind());
        assertEquals(f.toAbsolutePath().normalize(), e.path());
        assertNotNull(e.previousDigest());
        assertNotEquals(e.previousDigest(), e.currentDigest());
        assertEquals(Files.size(f), e.size());
        assertQuiet();
    }

    @Test
    void notification_without_content_change_is_dropped() throws Exception {
        Path f = Files.writeString(dir.resolve("same.csv"), "name\nA\n");
        monitor.watch(f);
        monitor.onRawNotification(f, RawKind.MODIFY);
        assertQuiet();
    }

    @Test
    void creation_of_awaited_file_is_added() throws Exception {
        Path f = dir.resolve("new.csv");
        monitor.watch(f);
        assertTrue(monitor.isWatching(f));

        Files.writeString(f, "a\n1\n");
        monitor.onRawNotification(f, RawKind.CREATE);

        ChangeEvent e = next();
        assertEquals(ChangeKind.ADDED, e.kind());
        assertNull(e.previousDigest());
        assertNotNull(e.currentDigest());
    }

    @Test
    void removal_is_deleted_and_then_recreation_is_added() throws Exception {
        Path f = Files.writeString(dir.resolve("gone.csv"), "a\n1\n");
        monitor.watch(f);

        Files.delete(f);
        monitor.onRawNotification(f, RawKind.DELETE);
        ChangeEvent deleted = next();
        assertEquals(ChangeKind.DELETED, deleted.kind());
        assertEquals(0, deleted.size());
        assertNull(deleted.currentDigest());

        Files.writeString(f, "a\n2\n");
        monitor.onRawNotification(f, RawKind.CREATE);
        assertEquals(ChangeKind.ADDED, next().kind());
    }

    @Test
    void rename_signal_wins_over_content_comparison() throws Exception {
        Path f = Files.writeString(dir.resolve("moved.csv"), "a\n1\n");
        monitor.watch(f);

        monitor.onRawNotification(f, RawKind.RENAME);
        assertEquals(ChangeKind.RENAMED, next().kind());

        // create over a file that already had a baseline is treated as a rename as well
        Files.writeString(f, "a\n9\n");
        monitor.onRawNotification(f, RawKind.CREATE);
        assertEquals(ChangeKind.RENAMED, next().kind());
    }

    @Test
    void unwatch_cancels_the_pending_timer() throws Exception {
        Path f = Files.writeString(dir.resolve("cancel.csv"), "a\n1\n");
        monitor.watch(f);
        Files.writeString(f, "a\n2\n");
        monitor.onRawNotification(f, RawKind.MODIFY);
        monitor.unwatch(f);
        assertFalse(monitor.isWatching(f));
        assertQuiet();

        monitor.unwatch(f);
        monitor.onRawNotification(f, RawKind.MODIFY);
        assertQuiet();
    }

    @Test
    void metadata_mode_detects_size_change_without_digests() throws Exception {
        monitor.close();
        monitor = new CsvMonitor(MonitorOptions.defaults().withDebounce(Duration.ofMillis(50))
                .withNativeNotifications(false).withChecksum(false), RetryPolicy.none(), Clock.systemUTC());
        monitor.changes().subscribe(events::add);
        Path f = Files.writeString(dir.resolve("meta.csv"), "a\n1\n");
        monitor.watch(f);
        Files.writeString(f, "a\n1\n2\n");
        monitor.onRawNotification(f, RawKind.MODIFY);
        ChangeEvent e = next();
        assertEquals(ChangeKind.CHANGED, e.kind());
        assertNull(e.currentDigest());
    }

    @Test
    void missing_parent_directory_is_a_watch_error() {
        assertThrows(WatchException.class, () -> monitor.watch(dir.resolve("nope").resolve("x.csv")));
        assertTrue(monitor.watchedPaths().isEmpty());
    }

    @Test
    void status_lists_watched_paths() throws Exception {
        Path a = Files.writeString(dir.resolve("a.csv"), "x\n1\n");
        Path b = dir.resolve("b.csv");
        monitor.watch(b);
        monitor.watch(a);
        MonitorStatus s = monitor.status();
        assertEquals(2, s.watched().size());
        assertEquals(a.toAbsolutePath().normalize(), s.watched().get(0));
        assertNotNull(s.lastActivity());
        monitor.unwatchAll();
        assertTrue(monitor.watchedPaths().isEmpty());
    }

    @Test
    void native_notifications_pick_up_real_writes() throws Exception {
        monitor.close();
        monitor = new CsvMonitor(MonitorOptions.defaults().withDebounce(Duration.ofMillis(100)),
                RetryPolicy.none(), Clock.systemUTC());
        monitor.changes().subscribe(events::add);
        Path f = Files.writeString(dir.resolve("native.csv"), "a\n1\n");
        monitor.watch(f);
        Files.writeString(f, "a\n1\n2\n3\n");
        ChangeEvent e = events.poll(20, TimeUnit.SECONDS);
        assertNotNull(e);
        assertEquals(ChangeKind.CHANGED, e.kind());
    }
}
