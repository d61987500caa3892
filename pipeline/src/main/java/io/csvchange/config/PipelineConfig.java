package io.csvchange.config;

import io.csvchange.backup.BackupOptions;
import io.csvchange.backup.RetentionPolicy;
import io.csvchange.csv.CsvFormat;
import io.csvchange.diff.DiffMode;
import io.csvchange.diff.DiffOptions;
import io.csvchange.hash.ChecksumAlgorithm;
import io.csvchange.monitor.MonitorOptions;
import io.csvchange.report.ReportFormat;
import io.csvchange.runtime.UpdateOptions;
import io.csvchange.validation.ValidationOptions;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Settings for every component. {@link #fromEnv()} reads {@code csvchange.*} system properties, falling back to
 * the matching {@code CSVCHANGE_*} environment variable ({@code csvchange.backup.max} is {@code CSVCHANGE_BACKUP_MAX}).
 */
public record PipelineConfig(
        Path workDir,
        MonitorOptions monitor,
        BackupOptions backup,
        ValidationOptions validation,
        DiffOptions diff,
        UpdateOptions update,
        int workers,
        int adminPort
) {
    public static PipelineConfig defaults(Path workDir) {
        return new PipelineConfig(workDir,
                MonitorOptions.defaults(),
                BackupOptions.defaults(workDir.resolve("backups")),
                ValidationOptions.defaults(),
                DiffOptions.defaults(),
                UpdateOptions.defaults(workDir),
                4,
                8080);
    }

    public static PipelineConfig fromEnv() {
        Path work = Path.of(get("csvchange.dir", "."));

        MonitorOptions monitor = new MonitorOptions(
                Duration.ofMillis(Long.parseLong(get("csvchange.debounce.ms", "500"))),
                Boolean.parseBoolean(get("csvchange.checksum", "true")),
                true);

        RetentionPolicy retention = new RetentionPolicy(
                Integer.parseInt(get("csvchange.backup.max", "50")),
                Duration.ofDays(Long.parseLong(get("csvchange.backup.max.age.days", "30"))),
                Integer.parseInt(get("csvchange.backup.min", "5")));
        BackupOptions backup = new BackupOptions(
                Path.of(get("csvchange.backup.dir", work.resolve("backups").toString())),
                retention,
                Boolean.parseBoolean(get("csvchange.backup.compress", "true")),
                Integer.parseInt(get("csvchange.backup.compress.level", "6")),
                ChecksumAlgorithm.fromId(get("csvchange.backup.checksum", "sha256")));

        CsvFormat format = CsvFormat.DEFAULT
                .withDelimiter(charOf(get("csvchange.csv.delimiter", ",")))
                .withQuote(charOf(get("csvchange.csv.quote", "\"")))
                .withEscape(charOf(get("csvchange.csv.escape", "\"")));

        ValidationOptions validation = ValidationOptions.defaults()
                .withStrictMode(Boolean.parseBoolean(get("csvchange.validation.strict", "false")))
                .withMaxErrors(Integer.parseInt(get("csvchange.validation.max.errors", "100")))
                .withFormat(format);

        DiffOptions diff = DiffOptions.defaults()
                .withMode(DiffMode.valueOf(get("csvchange.diff.mode", "HYBRID").toUpperCase(Locale.ROOT)))
                .withKeyColumns(list(get("csvchange.diff.keys", "")))
                .withMaxRows(Integer.parseInt(get("csvchange.diff.max.rows", "100000")))
                .withFormat(format);

        List<ReportFormat> formats = new ArrayList<>();
        for (String f : list(get("csvchange.report.formats", "html,json"))) formats.add(ReportFormat.parse(f));
        UpdateOptions update = new UpdateOptions(
                Boolean.parseBoolean(get("csvchange.auto.backup", "true")),
                Boolean.parseBoolean(get("csvchange.auto.validate", "true")),
                Boolean.parseBoolean(get("csvchange.backup.on.validation.failure", "true")),
                Boolean.parseBoolean(get("csvchange.diff.enabled", "true")),
                Boolean.parseBoolean(get("csvchange.diff.with.backups", "true")),
                formats,
                Path.of(get("csvchange.report.dir", work.resolve("diff-reports").toString())),
                Path.of(get("csvchange.log.dir", work.resolve("logs").toString())));

        int workers = Integer.parseInt(get("csvchange.workers", "4"));
        int port = Integer.parseInt(get("csvchange.port", "8080"));
        return new PipelineConfig(work, monitor, backup, validation, diff, update, workers, port);
    }

    static String envName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_');
    }

    private static String get(String key, String def) {
        return System.getProperty(key, System.getenv().getOrDefault(envName(key), def));
    }

    private static char charOf(String s) {
        if (s.equals("\\t")) return '\t';
        if (s.length() != 1) throw new IllegalArgumentException("Expected a single character, got '" + s + "'");
        return s.charAt(0);
    }

    private static List<String> list(String csv) {
        List<String> out = new ArrayList<>();
        for (String s : csv.split(",")) {
            if (!s.isBlank()) out.add(s.trim());
        }
        return out;
    }
}
