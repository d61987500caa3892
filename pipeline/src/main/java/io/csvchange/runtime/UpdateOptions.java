package io.csvchange.runtime;

import io.csvchange.report.ReportFormat;

import java.nio.file.Path;
import java.util.List;

/**
 * Which steps an update cycle runs and where its artifacts go.
 */
public record UpdateOptions(boolean autoBackup,
                            boolean autoValidate,
                            boolean backupOnValidationFailure,
                            boolean diffEnabled,
                            boolean compareWithBackups,
                            List<ReportFormat> reportFormats,
                            Path reportDir,
                            Path logDir) {

    public UpdateOptions {
        reportFormats = List.copyOf(reportFormats);
    }

    public static UpdateOptions defaults(Path workDir) {
        return new UpdateOptions(true, true, true, true, true,
                List.of(ReportFormat.HTML, ReportFormat.JSON), workDir.resolve("diff-reports"), workDir.resolve("logs"));
    }

    public UpdateOptions withAutoBackup(boolean b) { return new UpdateOptions(b, autoValidate, backupOnValidationFailure, diffEnabled, compareWithBackups, reportFormats, reportDir, logDir); }
    public UpdateOptions withAutoValidate(boolean b) { return new UpdateOptions(autoBackup, b, backupOnValidationFailure, diffEnabled, compareWithBackups, reportFormats, reportDir, logDir); }
    public UpdateOptions withBackupOnValidationFailure(boolean b) { return new UpdateOptions(autoBackup, autoValidate, b, diffEnabled, compareWithBackups, reportFormats, reportDir, logDir); }
    public UpdateOptions withDiff(boolean enabled, boolean withBackups) { return new UpdateOptions(autoBackup, autoValidate, backupOnValidationFailure, enabled, withBackups, reportFormats, reportDir, logDir); }
    public UpdateOptions withReports(List<ReportFormat> formats, Path dir) { return new UpdateOptions(autoBackup, autoValidate, backupOnValidationFailure, diffEnabled, compareWithBackups, formats, dir, logDir); }
    public UpdateOptions withLogDir(Path dir) { return new UpdateOptions(autoBackup, autoValidate, backupOnValidationFailure, diffEnabled, compareWithBackups, reportFormats, reportDir, dir); }
}
