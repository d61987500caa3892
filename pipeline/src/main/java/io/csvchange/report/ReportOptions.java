package io.csvchange.report;

import java.nio.file.Path;

/**
 * @param outputPath    when set, the rendered report is also written there
 * @param maxRowsToShow row changes beyond this many are summarised as a count
 */
public record ReportOptions(ReportFormat format,
                            Path outputPath,
                            boolean includeStatistics,
                            boolean includeRowDetails,
                            boolean includeSchemaChanges,
                            int maxRowsToShow,
                            Theme theme,
                            String title,
                            String description) {

    public static ReportOptions defaults(ReportFormat format) {
        return new ReportOptions(format, null, true, true, true, 100, Theme.LIGHT, "CSV Diff Report",
                "Comprehensive comparison between CSV file versions");
    }

    public ReportOptions withOutputPath(Path p) { return new ReportOptions(format, p, includeStatistics, includeRowDetails, includeSchemaChanges, maxRowsToShow, theme, title, description); }
    public ReportOptions withTheme(Theme t) { return new ReportOptions(format, outputPath, includeStatistics, includeRowDetails, includeSchemaChanges, maxRowsToShow, t, title, description); }
    public ReportOptions withMaxRows(int n) { return new ReportOptions(format, outputPath, includeStatistics, includeRowDetails, includeSchemaChanges, n, theme, title, description); }
    public ReportOptions withTitle(String t, String d) { return new ReportOptions(format, outputPath, includeStatistics, includeRowDetails, includeSchemaChanges, maxRowsToShow, theme, t, d); }
    public ReportOptions withSections(boolean stats, boolean rows, boolean schema) { return new ReportOptions(format, outputPath, stats, rows, schema, maxRowsToShow, theme, title, description); }
}
