package io.csvchange.cli;

import com.google.inject.Inject;
import io.csvchange.changelog.ChangeLog;
import io.csvchange.changelog.ChangeLogEntry;
import io.csvchange.changelog.ChangeLogQuery;
import io.csvchange.changelog.ExportFormat;
import io.csvchange.monitor.ChangeKind;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "log", mixinStandardHelpOptions = true, description = "Inspect the change log",
        subcommands = {LogCommand.Recent.class, LogCommand.Export.class, LogCommand.Summary.class})
public class LogCommand implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    @CommandLine.Command(name = "recent", description = "Most recent changes, newest first")
    static class Recent implements Callable<Integer> {
        @CommandLine.Option(names = {"-n", "--limit"}, defaultValue = "20")
        int limit;

        @CommandLine.Option(names = "--file", description = "Only entries whose path contains this text")
        String file;

        @CommandLine.Option(names = "--type", description = "${COMPLETION-CANDIDATES}")
        ChangeKind type;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        private final ChangeLog changeLog;

        @Inject Recent(ChangeLog changeLog) { this.changeLog = changeLog; }

        @Override
        public Integer call() throws Exception {
            List<ChangeLogEntry> entries = changeLog.query(ChangeLogQuery.all().forFile(file).ofType(type).page(limit, 0));
            PrintWriter out = spec.commandLine().getOut();
            if (entries.isEmpty()) out.println("No changes recorded");
            for (ChangeLogEntry e : entries) out.println(ChangeLog.format(e));
            out.flush();
            return 0;
        }
    }

    @CommandLine.Command(name = "export", description = "Export the whole change log")
    static class Export implements Callable<Integer> {
        @CommandLine.Option(names = {"-f", "--format"}, description = "${COMPLETION-CANDIDATES}", defaultValue = "JSON")
        ExportFormat format;

        @CommandLine.Option(names = {"-o", "--output"}, description = "Write to this file instead of stdout")
        Path output;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        private final ChangeLog changeLog;

        @Inject Export(ChangeLog changeLog) { this.changeLog = changeLog; }

        @Override
        public Integer call() throws Exception {
            String text = changeLog.export(format);
            PrintWriter out = spec.commandLine().getOut();
            if (output != null) {
                Files.writeString(output, text, StandardCharsets.UTF_8);
                out.println("Exported change log to " + output);
            } else {
                out.print(text);
            }
            out.flush();
            return 0;
        }
    }

    @CommandLine.Command(name = "summary", description = "Change counts by type and file")
    static class Summary implements Callable<Integer> {
        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        private final ChangeLog changeLog;

        @Inject Summary(ChangeLog changeLog) { this.changeLog = changeLog; }

        @Override
        public Integer call() throws Exception {
            PrintWriter out = spec.commandLine().getOut();
            out.print(changeLog.summary().format());
            out.flush();
            return 0;
        }
    }
}
