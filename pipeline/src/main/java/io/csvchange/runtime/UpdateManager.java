package io.csvchange.runtime;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.csvchange.backup.BackupManager;
import io.csvchange.backup.BackupQuery;
import io.csvchange.backup.BackupRecord;
import io.csvchange.backup.BackupResult;
import io.csvchange.backup.BackupStats;
import io.csvchange.backup.RestoreResult;
import io.csvchange.changelog.ChangeLog;
import io.csvchange.changelog.ChangeLogEntry;
import io.csvchange.changelog.ChangeLogMetadata;
import io.csvchange.changelog.ChangeLogQuery;
import io.csvchange.changelog.ChangeLogSummary;
import io.csvchange.changelog.ExportFormat;
import io.csvchange.diff.CsvDiffEngine;
import io.csvchange.diff.DiffException;
import io.csvchange.diff.DiffResult;
import io.csvchange.error.FailureSink;
import io.csvchange.error.RecentErrors;
import io.csvchange.event.Notifier;
import io.csvchange.metrics.Metrics;
import io.csvchange.monitor.ChangeEvent;
import io.csvchange.monitor.CsvMonitor;
import io.csvchange.monitor.MonitorError;
import io.csvchange.report.DiffReportGenerator;
import io.csvchange.report.ReportFormat;
import io.csvchange.report.ReportOptions;
import io.csvchange.validation.CsvValidationPipeline;
import io.csvchange.validation.FieldValidator;
import io.csvchange.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Wires the monitor, backup store, validation, diff engine, change log and rebuild hooks into one update cycle
 * per change event.
 * <p>
 * Events for the same file are handled strictly in arrival order on a {@link KeyedSerialExecutor}; different files
 * proceed in parallel. The monitor thread only enqueues. Every caller operation returns a future of an explicit
 * result and never completes exceptionally.
 */
public class UpdateManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(UpdateManager.class);
    static final String AUTO_BACKUP_TAG = "auto-backup";
    static final String VALIDATION_FAILURE_TAG = "validation-failure";

    private final CsvMonitor monitor;
    private final BackupManager backups;
    private final CsvValidationPipeline validation;
    private final CsvDiffEngine diffEngine;
    private final DiffReportGenerator reports;
    private final ChangeLog changeLog;
    private final HookRegistry hooks;
    private final UpdateOptions options;
    private final Clock clock;
    private final RecentErrors recentErrors;
    private final FailureSink failures;
    private final FailureSink failureFile;
    private final KeyedSerialExecutor<Path> executor;
    private final Notifier<PipelineNotification> notifications = new Notifier<>("pipeline");

    private final Map<Path, FileState> states = new ConcurrentHashMap<>();
    private final AtomicLong totalChanges = new AtomicLong();
    private volatile Instant lastChange;
    private final List<AutoCloseable> subscriptions = new ArrayList<>();

    private final Timer cycleTimer;
    private final Meter changeMeter;
    private final Meter errorMeter;
    private final Metrics metrics;

    UpdateManager(CsvMonitor monitor,
                  BackupManager backups,
                  CsvValidationPipeline validation,
                  CsvDiffEngine diffEngine,
                  DiffReportGenerator reports,
                  ChangeLog changeLog,
                  HookRegistry hooks,
                  UpdateOptions options,
                  Clock clock,
                  Metrics metrics,
                  RecentErrors recentErrors,
                  FailureSink failures,
                  KeyedSerialExecutor<Path> executor) {
        this.monitor = monitor;
        this.backups = backups;
        this.validation = validation;
        this.diffEngine = diffEngine;
        this.reports = reports;
        this.changeLog = changeLog;
        this.hooks = hooks;
        this.options = options;
        this.clock = clock;
        this.metrics = metrics;
        this.recentErrors = recentErrors;
        this.failureFile = failures;
        this.failures = FailureSink.fanOut(recentErrors, failures);
        this.executor = executor;
        this.cycleTimer = metrics.timer("cycle.time");
        this.changeMeter = metrics.meter("changes");
        this.errorMeter = metrics.meter("errors");
    }

    public Notifier<PipelineNotification> notifications() { return notifications; }
    public HookRegistry hooks() { return hooks; }
    public UpdateOptions options() { return options; }
    public Metrics metrics() { return metrics; }

    /**
     * Loads the backup index and the change log and subscribes to the monitor.
     *
     * @throws IOException if the change log cannot be read
     */
    public void start() throws IOException {
        backups.initialize();
        changeLog.initialize();
        Files.createDirectories(options.reportDir());
        subscriptions.add(monitor.changes().subscribe(this::enqueue));
        subscriptions.add(monitor.errors().subscribe(this::onMonitorError));
        subscriptions.add(backups.retentionFailures().subscribe(f -> recordError("retention", f.original(), f.error())));
        log.info("Update manager started (backup={}, validate={}, diff={})",
                options.autoBackup(), options.autoValidate(), options.diffEnabled());
    }

    private void enqueue(ChangeEvent event) {
        submit(event).exceptionally(e -> null);
    }

    /**
     * Queues one update cycle for {@code event} behind any earlier cycle of the same file.
     *
     * @return the change-log entry, or null if the append failed
     */
    public CompletableFuture<ChangeLogEntry> submit(ChangeEvent event) {
        Path path = key(event.path());
        states.put(path, FileState.CHANGE_PENDING);
        return executor.submit(path, () -> process(path, event));
    }

    private ChangeLogEntry process(Path path, ChangeEvent event) {
        try (Timer.Context ignored = cycleTimer.time()) {
            changeMeter.mark();
            totalChanges.incrementAndGet();
            lastChange = event.timestamp();
            notify(PipelineNotification.Type.CYCLE_STARTED, path, event.kind().name());
            log.info("Processing {} for {}", event.kind(), path);

            ChangeLogMetadata metadata = ChangeLogMetadata.empty();
            String backupId = null;
            if (event.kind().carriesContent()) {
                String kind = event.kind().name().toLowerCase(Locale.ROOT);
                if (options.autoBackup()) {
                    states.put(path, FileState.BACKING_UP);
                    backupId = backup(path, "Auto-backup before " + kind + " event", List.of(AUTO_BACKUP_TAG, kind));
                }
                ValidationResult result = null;
                String failureBackupId = null;
                if (options.autoValidate()) {
                    states.put(path, FileState.VALIDATING);
                    result = validation.validateFile(path);
                    if (!result.valid()) {
                        notify(PipelineNotification.Type.VALIDATION_FAILED, path,
                                result.errors().size() + " validation error(s)");
                        log.warn("Validation failed for {}: {}", path, result.errorMessages());
                        if (options.backupOnValidationFailure() && backupId == null) {
                            states.put(path, FileState.BACKING_UP);
                            failureBackupId = backup(path, "Backup due to validation failure",
                                    List.of(VALIDATION_FAILURE_TAG, kind));
                        }
                    }
                }
                metadata = metadata(result, backupId, failureBackupId);
            }

            ChangeLogEntry entry = null;
            try {
                entry = changeLog.log(event, metadata);
                notify(PipelineNotification.Type.CHANGE_LOGGED, path, entry.id());
            } catch (IOException e) {
                recordError("changelog", path, e);
            }
            states.put(path, FileState.LOGGED);

            runHooks(event, entry);
            states.put(path, FileState.HOOKS_RUN);

            if (backupId != null && options.diffEnabled() && options.compareWithBackups()) {
                states.put(path, FileState.DIFFING);
                diffAgainstPrevious(path, backupId);
            }
            states.put(path, monitor.isWatching(path) ? FileState.WATCH_STARTED : FileState.IDLE);
            notify(PipelineNotification.Type.CYCLE_COMPLETED, path, event.kind().name());
            return entry;
        } catch (RuntimeException e) {
            recordError("cycle", path, e);
            states.put(path, FileState.IDLE);
            throw e;
        }
    }

    private String backup(Path path, String context, List<String> tags) {
        BackupResult r = backups.createBackup(path, context, tags);
        if (r.success()) {
            notify(PipelineNotification.Type.BACKUP_CREATED, path, r.record().id());
            return r.record().id();
        }
        recordError("backup", path, new IOException(r.error()));
        return null;
    }

    private static ChangeLogMetadata metadata(ValidationResult result, String backupId, String failureBackupId) {
        if (result == null) {
            return new ChangeLogMetadata(null, null, null, null, null, null, backupId, failureBackupId);
        }
        return new ChangeLogMetadata(result.rowCount(),
                result.metadata() == null ? null : result.metadata().columnCount(),
                result.headers(),
                result.valid(),
                result.errorMessages(),
                result.warningMessages(),
                backupId,
                failureBackupId);
    }

    private void runHooks(ChangeEvent event, ChangeLogEntry entry) {
        for (RebuildHook hook : hooks.enabled()) {
            try {
                hook.handle(event, entry);
                log.debug("Hook {} completed for {}", hook.name(), event.path());
            } catch (Exception e) {
                metrics.counter("hooks.failed").inc();
                notify(PipelineNotification.Type.HOOK_FAILED, event.path(), hook.name());
                recordError("hook " + hook.name(), event.path(), e);
            }
        }
    }

    private void diffAgainstPrevious(Path path, String currentBackupId) {
        Optional<BackupRecord> previous = backups.listBackups(BackupQuery.forPath(path)).stream()
                .filter(r -> !r.id().equals(currentBackupId))
                .findFirst();
        if (previous.isEmpty()) {
            log.debug("No earlier backup of {} to compare with", path);
            return;
        }
        try {
            DiffResult diff = compareWithBackupNow(previous.get().id(), path);
            String base = stripExtension(path.getFileName().toString()) + "-diff-" + clock.millis();
            for (ReportFormat format : options.reportFormats()) {
                Path out = options.reportDir().resolve(base + "." + format.extension());
                reports.render(diff, ReportOptions.defaults(format).withOutputPath(out));
                notify(PipelineNotification.Type.REPORT_WRITTEN, path, out.toString());
            }
            log.info("Diff of {} against {}: {} row change(s), {} schema change(s)", path, previous.get().id(),
                    diff.statistics().changes().total(), diff.schemaChanges().size());
        } catch (DiffException | IOException | RuntimeException e) {
            recordError("diff", path, e);
        }
    }

    private DiffResult compareWithBackupNow(String backupId, Path current) throws IOException, DiffException {
        BackupRecord record = backups.getBackup(backupId)
                .orElseThrow(() -> new DiffException("Backup not found: " + backupId));
        Path tmpDir = Files.createTempDirectory("csvchange-backup-");
        Path materialised = tmpDir.resolve(record.original().getFileName());
        try {
            Files.write(materialised, backups.readPayload(record));
            return diffEngine.compareFiles(materialised, current).withOldSource("backup-" + backupId);
        } finally {
            Files.deleteIfExists(materialised);
            Files.deleteIfExists(tmpDir);
        }
    }

    private void onMonitorError(MonitorError e) {
        recordError("monitor", e.path(), e.error());
    }

    private void recordError(String stage, Path path, Exception e) {
        errorMeter.mark();
        log.warn("{} failed for {}: {}", stage, path, e.toString());
        failures.acceptFailure(stage, path, e);
        notify(PipelineNotification.Type.ERROR, path, stage + ": " + e.getMessage());
    }

    private void notify(PipelineNotification.Type type, Path path, String message) {
        notifications.publish(new PipelineNotification(type, path, clock.instant(), message));
    }

    // Caller operations

    public CompletableFuture<OpResult<Path>> watch(Path file) {
        return op(null, () -> {
            monitor.watch(file);
            Path p = key(file);
            states.put(p, FileState.WATCH_STARTED);
            return p;
        });
    }

    public CompletableFuture<OpResult<Path>> unwatch(Path file) {
        return op(null, () -> {
            monitor.unwatch(file);
            Path p = key(file);
            states.remove(p);
            return p;
        });
    }

    public CompletableFuture<PipelineStatus> status() {
        return CompletableFuture.supplyAsync(this::statusNow, executor.pool());
    }

    public PipelineStatus statusNow() {
        return new PipelineStatus(monitor.watchedPaths(),
                new LinkedHashMap<>(states),
                totalChanges.get(),
                lastChange,
                hooks.states(),
                recentErrors.snapshot(),
                options.autoValidate() ? validation.validators() : null,
                options.autoBackup() ? backupStatsOrNull() : null);
    }

    private BackupStats backupStatsOrNull() {
        try {
            return backups.getBackupStats();
        } catch (RuntimeException e) {
            log.warn("Backup stats unavailable: {}", e.toString());
            return null;
        }
    }

    public CompletableFuture<OpResult<ValidationResult>> validate(Path file) {
        return op(key(file), () -> validation.validateFile(file));
    }

    public CompletableFuture<BackupResult> createBackup(Path file, String context, List<String> tags) {
        return executor.submit(key(file), () -> backups.createBackup(file, context, tags));
    }

    public CompletableFuture<OpResult<List<BackupRecord>>> listBackups(BackupQuery query) {
        return op(null, () -> backups.listBackups(query));
    }

    public CompletableFuture<Boolean> verifyBackup(String id) {
        return CompletableFuture.supplyAsync(() -> backups.verifyBackup(id), executor.pool());
    }

    public CompletableFuture<RestoreResult> restoreBackup(String id, Path target) {
        Path k = target != null ? key(target)
                : backups.getBackup(id).map(r -> key(r.original())).orElse(null);
        if (k == null) return CompletableFuture.supplyAsync(() -> backups.restoreFromBackup(id, target), executor.pool());
        return executor.submit(k, () -> backups.restoreFromBackup(id, target));
    }

    public CompletableFuture<OpResult<Boolean>> deleteBackup(String id) {
        return op(null, () -> backups.deleteBackup(id));
    }

    public CompletableFuture<OpResult<DiffResult>> compareFiles(Path oldFile, Path newFile) {
        return op(null, () -> diffEngine.compareFiles(oldFile, newFile));
    }

    /** Compares backup {@code backupId} (as the old side, labelled {@code backup-<id>}) with {@code current}. */
    public CompletableFuture<OpResult<DiffResult>> compareWithBackup(String backupId, Path current) {
        return op(null, () -> compareWithBackupNow(backupId, current));
    }

    public CompletableFuture<OpResult<String>> generateDiffReport(DiffResult result, ReportOptions reportOptions) {
        return op(null, () -> reports.render(result, reportOptions));
    }

    public CompletableFuture<OpResult<String>> registerValidator(FieldValidator validator) {
        return op(null, () -> {
            validation.registerCustomValidator(validator);
            return validator.name();
        });
    }

    public CompletableFuture<OpResult<Boolean>> unregisterValidator(String name) {
        return op(null, () -> validation.unregisterCustomValidator(name));
    }

    public CompletableFuture<OpResult<String>> registerHook(RebuildHook hook, boolean enabled) {
        return op(null, () -> {
            hooks.register(hook, enabled);
            return hook.name();
        });
    }

    public CompletableFuture<OpResult<Boolean>> unregisterHook(String name) {
        return op(null, () -> hooks.unregister(name));
    }

    /** Completes with the hook's new enabled state, or a failed result for an unknown name. */
    public CompletableFuture<OpResult<Boolean>> toggleHook(String name) {
        return op(null, () -> hooks.toggle(name));
    }

    public CompletableFuture<OpResult<List<ChangeLogEntry>>> recentChanges(int limit) {
        return op(null, () -> changeLog.recent(limit));
    }

    public CompletableFuture<OpResult<List<ChangeLogEntry>>> fileChanges(Path file, int limit) {
        return op(null, () -> changeLog.fileChanges(file, limit));
    }

    public CompletableFuture<OpResult<List<ChangeLogEntry>>> queryChanges(ChangeLogQuery query) {
        return op(null, () -> changeLog.query(query));
    }

    public CompletableFuture<OpResult<String>> exportChangeLog(ExportFormat format) {
        return op(null, () -> changeLog.export(format));
    }

    public CompletableFuture<OpResult<ChangeLogSummary>> changeLogSummary() {
        return op(null, changeLog::summary);
    }

    private <T> CompletableFuture<OpResult<T>> op(Path key, Callable<T> task) {
        CompletableFuture<T> f = key == null
                ? CompletableFuture.supplyAsync(() -> callUnchecked(task), executor.pool())
                : executor.submit(key, task);
        return f.handle((v, e) -> {
            if (e == null) return OpResult.ok(v);
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            log.debug("Operation failed: {}", cause.toString());
            return OpResult.<T>failed(cause.getMessage() == null ? cause.toString() : cause.getMessage());
        });
    }

    private static <T> T callUnchecked(Callable<T> task) {
        try {
            return task.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new CompletionException(e);
        }
    }

    private static Path key(Path p) { return p.toAbsolutePath().normalize(); }

    private static String stripExtension(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    @Override
    public void close() {
        for (AutoCloseable s : subscriptions) {
            try {
                s.close();
            } catch (Exception e) {
                log.debug("Unsubscribe failed: {}", e.toString());
            }
        }
        monitor.close();
        executor.close();
        failureFile.close();
        log.info("Update manager stopped after {} change(s)", totalChanges.get());
    }
}
