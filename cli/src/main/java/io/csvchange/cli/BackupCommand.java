package io.csvchange.cli;

import com.google.inject.Inject;
import io.csvchange.backup.BackupManager;
import io.csvchange.backup.BackupQuery;
import io.csvchange.backup.BackupRecord;
import io.csvchange.backup.BackupResult;
import io.csvchange.backup.BackupStats;
import io.csvchange.backup.RestoreResult;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "backup", mixinStandardHelpOptions = true, description = "Manage backups",
        subcommands = {
                BackupCommand.Create.class,
                BackupCommand.ListBackups.class,
                BackupCommand.Verify.class,
                BackupCommand.Restore.class,
                BackupCommand.Delete.class,
                BackupCommand.Stats.class
        })
public class BackupCommand implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    /** Shared plumbing: an initialised manager and the command's output stream. */
    abstract static class BackupTask implements Callable<Integer> {
        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        final BackupManager backups;

        BackupTask(BackupManager backups) { this.backups = backups; }

        @Override
        public Integer call() throws Exception {
            backups.initialize();
            PrintWriter out = spec.commandLine().getOut();
            try {
                return run(out);
            } finally {
                out.flush();
            }
        }

        abstract int run(PrintWriter out) throws Exception;

        PrintWriter err() { return spec.commandLine().getErr(); }
    }

    @CommandLine.Command(name = "create", description = "Back up a file")
    static class Create extends BackupTask {
        @CommandLine.Parameters(index = "0", description = "File to back up")
        Path file;

        @CommandLine.Option(names = "--context", description = "Free-text reason stored with the backup", defaultValue = "Manual backup")
        String context;

        @CommandLine.Option(names = "--tag", description = "Tag (repeatable)")
        List<String> tags = new ArrayList<>();

        @Inject Create(BackupManager backups) { super(backups); }

        @Override
        int run(PrintWriter out) {
            BackupResult r = backups.createBackup(file, context, tags);
            if (!r.success()) {
                err().println("Backup failed: " + r.error());
                return 1;
            }
            BackupRecord rec = r.record();
            out.printf("Created backup %s (v%d, %d bytes)%n", rec.id(), rec.version(), rec.fileSize());
            return 0;
        }
    }

    @CommandLine.Command(name = "list", description = "List backups, newest first by default")
    static class ListBackups extends BackupTask {
        @CommandLine.Option(names = "--file", description = "Only backups of this file")
        Path file;

        @CommandLine.Option(names = "--tag", description = "Only backups carrying any of these tags")
        List<String> tags = new ArrayList<>();

        @CommandLine.Option(names = "--sort", description = "${COMPLETION-CANDIDATES}", defaultValue = "TIMESTAMP")
        BackupQuery.SortBy sort;

        @CommandLine.Option(names = "--asc", description = "Ascending order")
        boolean ascending;

        @CommandLine.Option(names = {"-n", "--limit"}, description = "At most this many", defaultValue = "0")
        int limit;

        @Inject ListBackups(BackupManager backups) { super(backups); }

        @Override
        int run(PrintWriter out) {
            BackupQuery q = BackupQuery.all().withTags(tags).sorted(sort, !ascending).limit(limit);
            if (file != null) q = q.withPath(file);
            List<BackupRecord> records = backups.listBackups(q);
            for (BackupRecord r : records) {
                out.printf("%s  v%-3d %s  %8d  %s  %s%n", r.id(), r.version(), r.timestamp(), r.fileSize(),
                        r.originalPath(), String.join(",", r.tags()));
            }
            out.printf("%d backup(s)%n", records.size());
            return 0;
        }
    }

    @CommandLine.Command(name = "verify", description = "Check a backup's payload against its checksum")
    static class Verify extends BackupTask {
        @CommandLine.Parameters(index = "0", description = "Backup id")
        String id;

        @Inject Verify(BackupManager backups) { super(backups); }

        @Override
        int run(PrintWriter out) {
            boolean ok = backups.verifyBackup(id);
            out.println((ok ? "OK " : "CORRUPT ") + id);
            return ok ? 0 : 1;
        }
    }

    @CommandLine.Command(name = "restore", description = "Restore a backup onto its original path or --to")
    static class Restore extends BackupTask {
        @CommandLine.Parameters(index = "0", description = "Backup id")
        String id;

        @CommandLine.Option(names = "--to", description = "Restore target instead of the original path")
        Path target;

        @Inject Restore(BackupManager backups) { super(backups); }

        @Override
        int run(PrintWriter out) {
            RestoreResult r = backups.restoreFromBackup(id, target);
            if (!r.success()) {
                err().println("Restore failed: " + r.error());
                if (r.rollbackError() != null) err().println("Rollback failed: " + r.rollbackError());
                return 1;
            }
            out.printf("Restored %s to %s%n", id, r.restoredPath());
            if (r.safetyBackupId() != null) out.printf("Previous content saved as %s%n", r.safetyBackupId());
            return 0;
        }
    }

    @CommandLine.Command(name = "delete", description = "Delete a backup")
    static class Delete extends BackupTask {
        @CommandLine.Parameters(index = "0", description = "Backup id")
        String id;

        @Inject Delete(BackupManager backups) { super(backups); }

        @Override
        int run(PrintWriter out) {
            if (!backups.deleteBackup(id)) {
                err().println("No such backup: " + id);
                return 1;
            }
            out.println("Deleted " + id);
            return 0;
        }
    }

    @CommandLine.Command(name = "stats", description = "Backup counts and sizes")
    static class Stats extends BackupTask {
        @CommandLine.Option(names = "--cleanup", description = "Apply the retention policy to every file first")
        boolean cleanup;

        @Inject Stats(BackupManager backups) { super(backups); }

        @Override
        int run(PrintWriter out) {
            if (cleanup) out.printf("Removed %d backup(s)%n", backups.cleanupOldBackups());
            BackupStats s = backups.getBackupStats();
            out.printf("Total backups: %d%n", s.totalBackups());
            out.printf("Total size: %d bytes%n", s.totalSize());
            if (s.oldest() != null) out.printf("Oldest: %s%nNewest: %s%n", s.oldest(), s.newest());
            s.byOriginalPath().forEach((p, n) -> out.printf("  %s: %d%n", p, n));
            return 0;
        }
    }
}
