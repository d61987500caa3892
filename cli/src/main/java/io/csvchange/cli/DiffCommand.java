package io.csvchange.cli;

import com.google.inject.Inject;
import io.csvchange.diff.ChangeType;
import io.csvchange.diff.CsvDiffEngine;
import io.csvchange.diff.DiffException;
import io.csvchange.diff.DiffFilter;
import io.csvchange.diff.DiffMode;
import io.csvchange.diff.DiffOptions;
import io.csvchange.diff.DiffResult;
import io.csvchange.report.DiffReportGenerator;
import io.csvchange.report.ReportFormat;
import io.csvchange.report.ReportOptions;
import io.csvchange.report.Theme;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Exit code 0 when the files are equivalent, 1 when they differ, 2 when they could not be compared.
 */
@CommandLine.Command(name = "diff", mixinStandardHelpOptions = true, description = "Compare two CSV files")
public class DiffCommand implements Callable<Integer> {

    @CommandLine.Parameters(index = "0", description = "Old version")
    Path oldFile;

    @CommandLine.Parameters(index = "1", description = "New version")
    Path newFile;

    @CommandLine.Option(names = "--mode", description = "${COMPLETION-CANDIDATES}")
    DiffMode mode;

    @CommandLine.Option(names = {"-k", "--key"}, split = ",", description = "Key columns identifying a row")
    List<String> keys = new ArrayList<>();

    @CommandLine.Option(names = {"-f", "--format"}, description = "${COMPLETION-CANDIDATES}", defaultValue = "CONSOLE")
    ReportFormat format;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Also write the report to this file")
    Path output;

    @CommandLine.Option(names = "--theme", description = "HTML theme: ${COMPLETION-CANDIDATES}", defaultValue = "LIGHT")
    Theme theme;

    @CommandLine.Option(names = "--ignore-case")
    boolean ignoreCase;

    @CommandLine.Option(names = "--ignore-whitespace")
    boolean ignoreWhitespace;

    @CommandLine.Option(names = "--columns", split = ",", description = "Only report changes in these columns")
    List<String> columns = new ArrayList<>();

    @CommandLine.Option(names = "--exclude", split = ",", description = "Ignore changes in these columns")
    List<String> excluded = new ArrayList<>();

    @CommandLine.Option(names = "--only", split = ",", description = "Only these change types: ${COMPLETION-CANDIDATES}")
    List<ChangeType> only = new ArrayList<>();

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final CsvDiffEngine engine;
    private final DiffReportGenerator reports;

    @Inject
    DiffCommand(CsvDiffEngine engine, DiffReportGenerator reports) {
        this.engine = engine;
        this.reports = reports;
    }

    @Override
    public Integer call() {
        DiffOptions opts = engine.options();
        if (mode != null) opts = opts.withMode(mode);
        if (!keys.isEmpty()) opts = opts.withKeyColumns(keys);
        DiffFilter filter = opts.filter()
                .withIgnoreCase(ignoreCase)
                .withIgnoreWhitespace(ignoreWhitespace)
                .includingColumns(columns)
                .excludingColumns(excluded)
                .onlyTypes(only.isEmpty() ? EnumSet.noneOf(ChangeType.class) : EnumSet.copyOf(only));
        opts = opts.withFilter(filter);

        DiffResult result;
        try {
            result = engine.compareFiles(oldFile, newFile, opts);
        } catch (DiffException e) {
            spec.commandLine().getErr().println("Diff failed: " + e.getMessage());
            return 2;
        }
        ReportOptions ro = ReportOptions.defaults(format).withTheme(theme).withOutputPath(output);
        PrintWriter out = spec.commandLine().getOut();
        out.print(reports.render(result, ro));
        out.flush();
        return result.hasChanges() ? 1 : 0;
    }
}
