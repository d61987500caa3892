package io.csvchange.cli;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.csvchange.backup.BackupManager;
import io.csvchange.changelog.ChangeLog;
import io.csvchange.config.PipelineConfig;
import io.csvchange.diff.CsvDiffEngine;
import io.csvchange.error.FailureSink;
import io.csvchange.error.FileFailureSink;
import io.csvchange.metrics.Metrics;
import io.csvchange.report.DiffReportGenerator;
import io.csvchange.runtime.RebuildHooks;
import io.csvchange.runtime.UpdateManager;
import io.csvchange.runtime.UpdateManagerBuilder;
import io.csvchange.validation.CsvValidationPipeline;

import java.io.IOException;
import java.time.Clock;

public class CsvChangeModule extends AbstractModule {
    static final String FAILURE_FILE = "failures.jsonl";

    private final PipelineConfig config;

    public CsvChangeModule(PipelineConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(PipelineConfig.class).toInstance(config);
        bind(Clock.class).toInstance(Clock.systemUTC());
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton BackupManager backupManager(Clock clock, Metrics metrics) {
        return new BackupManager(config.backup(), clock, metrics);
    }

    @Provides @Singleton CsvValidationPipeline validation(Metrics metrics) {
        return new CsvValidationPipeline(config.validation(), metrics);
    }

    @Provides @Singleton CsvDiffEngine diffEngine(Clock clock, Metrics metrics) {
        return new CsvDiffEngine(config.diff(), clock, metrics);
    }

    @Provides @Singleton DiffReportGenerator reportGenerator() { return new DiffReportGenerator(); }

    @Provides @Singleton ChangeLog changeLog(Clock clock) { return new ChangeLog(config.update().logDir(), clock); }

    @Provides @Singleton FailureSink failureSink() throws IOException {
        return new FileFailureSink(config.update().logDir().resolve(FAILURE_FILE));
    }

    @Provides @Singleton UpdateManager updateManager(MetricRegistry registry, FailureSink failures, Clock clock) {
        return new UpdateManagerBuilder()
                .workDir(config.workDir())
                .monitor(config.monitor())
                .backup(config.backup())
                .validation(config.validation())
                .diff(config.diff())
                .update(config.update())
                .hooks(RebuildHooks.defaults())
                .metrics(registry)
                .failureSink(failures)
                .clock(clock)
                .workers(config.workers())
                .build();
    }
}
