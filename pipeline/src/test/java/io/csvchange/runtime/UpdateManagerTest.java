package io.csvchange.runtime;

import io.csvchange.MutableClock;
import io.csvchange.TestFiles;
import io.csvchange.backup.BackupQuery;
import io.csvchange.backup.BackupRecord;
import io.csvchange.backup.BackupResult;
import io.csvchange.changelog.ChangeLogEntry;
import io.csvchange.changelog.ChangeLogSummary;
import io.csvchange.changelog.ExportFormat;
import io.csvchange.diff.DiffResult;
import io.csvchange.monitor.ChangeEvent;
import io.csvchange.monitor.ChangeKind;
import io.csvchange.monitor.MonitorOptions;
import io.csvchange.validation.ValidationResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class UpdateManagerTest {
    private static final String GOOD = "name,email,latitude\nCafe,cafe@example.com,48.8\n";
    private static final String GOOD_V2 = "name,email,latitude\nCafe,cafe@example.com,48.8\nBar,bar@example.com,45.7\n";
    private static final String BAD = "name,email,latitude\nCafe,cafe@example.com,95.0\n";

    private Path dir;
    private Path file;
    private MutableClock clock;
    private HookRegistry hooks;
    private List<String> hookCalls;
    private List<PipelineNotification> notifications;
    private UpdateManager manager;

    @BeforeEach
    void setUp() throws Exception {
        dir = Files.createTempDirectory("update-test");
        file = Files.createDirectories(dir.resolve("data")).resolve("stores.csv");
        clock = new MutableClock(Instant.parse("2024-06-01T12:00:00Z"));
        hookCalls = new CopyOnWriteArrayList<>();
        notifications = new CopyOnWriteArrayList<>();
        hooks = new HookRegistry();
        hooks.register(RebuildHook.of("record", "records calls", (event, entry) ->
                hookCalls.add(event.kind() + " " + (entry == null ? "-" : entry.sequence()))));
        manager = build(UpdateOptions.defaults(dir));
    }

    private UpdateManager build(UpdateOptions options) throws Exception {
        UpdateManager m = new UpdateManagerBuilder()
                .workDir(dir)
                .monitor(MonitorOptions.defaults().withNativeNotifications(false).withDebounce(Duration.ofMillis(50)))
                .update(options)
                .hooks(hooks)
                .clock(clock)
                .workers(2)
                .build();
        m.start();
        m.notifications().subscribe(notifications::add);
        return m;
    }

    @AfterEach
    void tearDown() {
        manager.close();
        TestFiles.deleteRecursively(dir);
    }

    private ChangeLogEntry change(ChangeKind kind, String content) throws Exception {
        clock.advance(Duration.ofSeconds(1));
        if (content != null) Files.writeString(file, content);
        long size = content == null ? 0 : Files.size(file);
        return manager.submit(new ChangeEvent(kind, file, clock.instant(), null, null, size, null)).get(10, TimeUnit.SECONDS);
    }

    private List<PipelineNotification.Type> types() {
        return notifications.stream().map(PipelineNotification::type).toList();
    }

    @Test
    void added_file_is_backed_up_validated_logged_and_hooked() throws Exception {
        ChangeLogEntry entry = change(ChangeKind.ADDED, GOOD);

        assertEquals(1, entry.sequence());
        assertEquals(Boolean.TRUE, entry.metadata().valid());
        assertEquals(1, entry.metadata().rowCount());
        assertEquals(List.of("name", "email", "latitude"), entry.metadata().headers());
        assertNotNull(entry.metadata().backupId());
        assertNull(entry.metadata().validationFailureBackupId());

        List<BackupRecord> backups = manager.listBackups(BackupQuery.forPath(file)).get().value();
        assertEquals(1, backups.size());
        assertEquals(List.of(UpdateManager.AUTO_BACKUP_TAG, "added"), backups.get(0).tags());
        assertEquals("Auto-backup before added event", backups.get(0).context());

        assertEquals(List.of("ADDED 1"), hookCalls);
        assertEquals(PipelineNotification.Type.CYCLE_STARTED, types().get(0));
        assertTrue(types().containsAll(List.of(PipelineNotification.Type.BACKUP_CREATED,
                PipelineNotification.Type.CHANGE_LOGGED, PipelineNotification.Type.CYCLE_COMPLETED)));
        assertFalse(types().contains(PipelineNotification.Type.REPORT_WRITTEN));

        PipelineStatus status = manager.statusNow();
        assertEquals(1, status.totalChanges());
        assertEquals(clock.instant(), status.lastChange());
        assertEquals(FileState.IDLE, status.fileStates().get(file.toAbsolutePath().normalize()));
        assertNotNull(status.validators());
        assertEquals(1, status.backups().totalBackups());
        assertTrue(status.recentErrors().isEmpty());
    }

    @Test
    void second_change_is_diffed_against_the_previous_backup() throws Exception {
        change(ChangeKind.ADDED, GOOD);
        ChangeLogEntry second = change(ChangeKind.CHANGED, GOOD_V2);

        assertEquals(2, second.sequence());
        assertEquals(2, manager.listBackups(BackupQuery.forPath(file)).get().value().size());
        List<String> reports;
        try (Stream<Path> s = Files.list(dir.resolve("diff-reports"))) {
            reports = s.map(p -> p.getFileName().toString()).sorted().toList();
        }
        String base = "stores-diff-" + clock.millis();
        assertEquals(List.of(base + ".html", base + ".json"), reports);
        assertEquals(2, types().stream().filter(t -> t == PipelineNotification.Type.REPORT_WRITTEN).count());
        assertTrue(Files.readString(dir.resolve("diff-reports").resolve(base + ".json")).contains("\"added\" : 1"));
    }

    @Test
    void invalid_file_without_auto_backup_gets_a_failure_backup() throws Exception {
        manager.close();
        manager = build(UpdateOptions.defaults(dir).withAutoBackup(false));

        ChangeLogEntry entry = change(ChangeKind.CHANGED, BAD);

        assertEquals(Boolean.FALSE, entry.metadata().valid());
        assertNull(entry.metadata().backupId());
        assertNotNull(entry.metadata().validationFailureBackupId());
        assertFalse(entry.metadata().validationErrors().isEmpty());
        assertTrue(types().contains(PipelineNotification.Type.VALIDATION_FAILED));

        List<BackupRecord> backups = manager.listBackups(BackupQuery.all().withTags(List.of(UpdateManager.VALIDATION_FAILURE_TAG)))
                .get().value();
        assertEquals(1, backups.size());
        assertEquals("Backup due to validation failure", backups.get(0).context());
        assertNull(manager.statusNow().backups());
    }

    @Test
    void invalid_file_with_auto_backup_is_not_backed_up_twice() throws Exception {
        ChangeLogEntry entry = change(ChangeKind.ADDED, BAD);
        assertEquals(Boolean.FALSE, entry.metadata().valid());
        assertNotNull(entry.metadata().backupId());
        assertNull(entry.metadata().validationFailureBackupId());
        assertEquals(1, manager.listBackups(BackupQuery.all()).get().value().size());
    }

    @Test
    void deletion_is_logged_without_backup_or_validation() throws Exception {
        change(ChangeKind.ADDED, GOOD);
        Files.delete(file);
        ChangeLogEntry gone = change(ChangeKind.DELETED, null);

        assertNull(gone.fileSize());
        assertNull(gone.metadata().valid());
        assertNull(gone.metadata().backupId());
        assertEquals(1, manager.listBackups(BackupQuery.all()).get().value().size());
        assertEquals(List.of("ADDED 1", "DELETED 2"), hookCalls);
    }

    @Test
    void failing_hook_is_reported_and_later_hooks_still_run() throws Exception {
        manager.registerHook(RebuildHook.of("explode", "always fails", (e, entry) -> {
            throw new IllegalStateException("renderer offline");
        }), true).get();
        manager.registerHook(RebuildHook.of("after", "runs last", (e, entry) -> hookCalls.add("after")), true).get();

        ChangeLogEntry entry = change(ChangeKind.ADDED, GOOD);

        assertNotNull(entry);
        assertEquals(List.of("ADDED 1", "after"), hookCalls);
        assertEquals(1, manager.metrics().counter("hooks.failed").getCount());
        assertTrue(types().contains(PipelineNotification.Type.HOOK_FAILED));
        List<String> errors = manager.statusNow().recentErrors();
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).contains("hook explode"));
        assertTrue(errors.get(0).contains("renderer offline"));
    }

    @Test
    void events_for_one_file_are_logged_in_arrival_order() throws Exception {
        Files.writeString(file, GOOD);
        List<CompletableFuture<ChangeLogEntry>> futures = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            futures.add(manager.submit(new ChangeEvent(ChangeKind.CHANGED, file, clock.instant(), null, null, 10, null)));
        }
        List<Long> sequences = new ArrayList<>();
        for (CompletableFuture<ChangeLogEntry> f : futures) sequences.add(f.get(10, TimeUnit.SECONDS).sequence());
        assertEquals(List.of(1L, 2L, 3L, 4L, 5L), sequences);
    }

    @Test
    void hook_operations_return_results_instead_of_throwing() throws Exception {
        OpResult<Boolean> unknown = manager.toggleHook("missing").get();
        assertFalse(unknown.success());
        assertEquals("Unknown hook: missing", unknown.error());

        assertEquals(Boolean.FALSE, manager.toggleHook("record").get().value());
        change(ChangeKind.ADDED, GOOD);
        assertTrue(hookCalls.isEmpty());
        assertFalse(manager.statusNow().hooks().get("record"));

        assertTrue(manager.unregisterHook("record").get().value());
        assertFalse(manager.statusNow().hooks().containsKey("record"));
    }

    @Test
    void caller_operations_cover_validation_backups_diffs_and_the_log() throws Exception {
        Files.writeString(file, GOOD);
        OpResult<ValidationResult> validated = manager.validate(file).get();
        assertTrue(validated.success());
        assertTrue(validated.value().valid());

        BackupResult manual = manager.createBackup(file, "Manual backup", List.of("manual")).get();
        assertTrue(manual.success());
        String id = manual.record().id();
        assertTrue(manager.verifyBackup(id).get());

        Files.writeString(file, GOOD_V2);
        OpResult<DiffResult> diff = manager.compareWithBackup(id, file).get();
        assertTrue(diff.success(), diff.error());
        assertEquals("backup-" + id, diff.value().sourceFiles().old());
        assertEquals(1, diff.value().statistics().changes().added());

        OpResult<DiffResult> missing = manager.compareWithBackup("nope", file).get();
        assertFalse(missing.success());
        assertTrue(missing.error().contains("nope"));

        assertTrue(manager.restoreBackup(id, null).get().success());
        assertEquals(GOOD, Files.readString(file));

        clock.advance(Duration.ofSeconds(1));
        manager.submit(new ChangeEvent(ChangeKind.CHANGED, file, clock.instant(), null, null, Files.size(file), null))
                .get(10, TimeUnit.SECONDS);
        assertEquals(1, manager.recentChanges(10).get().value().size());
        assertEquals(1, manager.fileChanges(file, 10).get().value().size());
        ChangeLogSummary summary = manager.changeLogSummary().get().value();
        assertEquals(1, summary.totalChanges());
        assertTrue(manager.exportChangeLog(ExportFormat.CSV).get().value().startsWith("ID,Timestamp,"));

        assertTrue(manager.unregisterValidator("email-format").get().value());
        assertFalse(manager.statusNow().validators().containsKey("email-format"));
        assertTrue(manager.deleteBackup(id).get().value());
    }

    @Test
    void watch_tracks_state_and_rejects_missing_directories() throws Exception {
        Files.writeString(file, GOOD);
        OpResult<Path> watched = manager.watch(file).get();
        assertTrue(watched.success());
        assertEquals(List.of(file.toAbsolutePath().normalize()), manager.statusNow().activeWatches());
        assertEquals(FileState.WATCH_STARTED, manager.statusNow().fileStates().get(watched.value()));

        ChangeLogEntry entry = change(ChangeKind.CHANGED, GOOD_V2);
        assertNotNull(entry);
        assertEquals(FileState.WATCH_STARTED, manager.statusNow().fileStates().get(watched.value()));

        assertTrue(manager.unwatch(file).get().success());
        assertTrue(manager.statusNow().activeWatches().isEmpty());

        assertFalse(manager.watch(dir.resolve("no-such-dir/x.csv")).get().success());
    }
}
