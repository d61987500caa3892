package io.csvchange.runtime;

import com.codahale.metrics.MetricRegistry;
import io.csvchange.backup.BackupManager;
import io.csvchange.backup.BackupOptions;
import io.csvchange.changelog.ChangeLog;
import io.csvchange.diff.CsvDiffEngine;
import io.csvchange.diff.DiffOptions;
import io.csvchange.error.FailureSink;
import io.csvchange.error.RecentErrors;
import io.csvchange.metrics.Metrics;
import io.csvchange.monitor.CsvMonitor;
import io.csvchange.monitor.MonitorOptions;
import io.csvchange.report.DiffReportGenerator;
import io.csvchange.retry.ExponentialBackoffRetryPolicy;
import io.csvchange.retry.RetryPolicy;
import io.csvchange.validation.CsvValidationPipeline;
import io.csvchange.validation.ValidationOptions;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

public class UpdateManagerBuilder {
    private Path workDir;
    private MonitorOptions monitorOptions = MonitorOptions.defaults();
    private BackupOptions backupOptions;
    private ValidationOptions validationOptions = ValidationOptions.defaults();
    private DiffOptions diffOptions = DiffOptions.defaults();
    private UpdateOptions updateOptions;
    private HookRegistry hooks = RebuildHooks.defaults();
    private RetryPolicy retryPolicy = new ExponentialBackoffRetryPolicy(3, 20, 500);
    private MetricRegistry metricRegistry = new MetricRegistry();
    private FailureSink failureSink = FailureSink.discard();
    private Clock clock = Clock.systemUTC();
    private int workers = 4;

    /** Base directory for backups, logs and reports unless set individually. */
    public UpdateManagerBuilder workDir(Path dir) { this.workDir = dir; return this; }
    public UpdateManagerBuilder monitor(MonitorOptions o) { this.monitorOptions = o; return this; }
    public UpdateManagerBuilder backup(BackupOptions o) { this.backupOptions = o; return this; }
    public UpdateManagerBuilder validation(ValidationOptions o) { this.validationOptions = o; return this; }
    public UpdateManagerBuilder diff(DiffOptions o) { this.diffOptions = o; return this; }
    public UpdateManagerBuilder update(UpdateOptions o) { this.updateOptions = o; return this; }
    public UpdateManagerBuilder hooks(HookRegistry h) { this.hooks = h; return this; }
    public UpdateManagerBuilder retry(RetryPolicy r) { this.retryPolicy = r; return this; }
    public UpdateManagerBuilder metrics(MetricRegistry r) { this.metricRegistry = r; return this; }
    public UpdateManagerBuilder failureSink(FailureSink s) { this.failureSink = s; return this; }
    public UpdateManagerBuilder clock(Clock c) { this.clock = c; return this; }
    public UpdateManagerBuilder workers(int w) { this.workers = Math.max(1, w); return this; }

    public UpdateManager build() {
        if (backupOptions == null || updateOptions == null) {
            Objects.requireNonNull(workDir, "workDir (or explicit backup and update options)");
        }
        BackupOptions bo = backupOptions != null ? backupOptions : BackupOptions.defaults(workDir.resolve("backups"));
        UpdateOptions uo = updateOptions != null ? updateOptions : UpdateOptions.defaults(workDir);
        Metrics metrics = new Metrics(metricRegistry);

        AtomicInteger n = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "csv-update-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        return new UpdateManager(
                new CsvMonitor(monitorOptions, retryPolicy, clock),
                new BackupManager(bo, clock, metrics),
                new CsvValidationPipeline(validationOptions, metrics),
                new CsvDiffEngine(diffOptions, clock, metrics),
                new DiffReportGenerator(),
                new ChangeLog(uo.logDir(), clock),
                hooks,
                uo,
                clock,
                metrics,
                new RecentErrors(RecentErrors.DEFAULT_CAPACITY, clock),
                failureSink,
                new KeyedSerialExecutor<>(pool));
    }
}
