package io.csvchange.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.csvchange.diff.CellChange;
import io.csvchange.diff.ColumnChangeCount;
import io.csvchange.diff.DiffResult;
import io.csvchange.diff.DiffStatistics;
import io.csvchange.diff.RowChange;
import io.csvchange.diff.SchemaChange;
import io.csvchange.json.Json;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a {@link DiffResult}. Output depends only on the result and the options: the "generated" time is the
 * diff's own timestamp, numbers use a fixed locale, and JSON keys come out in a fixed order.
 */
public class DiffReportGenerator {
    public static final String GENERATOR = "csv-change-pipeline diff report";
    public static final String VERSION = "1.0";
    private static final int CELLS_PER_ROW = 3;

    private final ObjectMapper mapper = Json.prettyMapper();

    public String render(DiffResult result, ReportOptions options) {
        String text = switch (options.format()) {
            case CONSOLE -> console(result, options);
            case HTML -> html(result, options);
            case JSON -> json(result, options);
            case MARKDOWN -> markdown(result, options);
        };
        if (options.outputPath() != null) {
            try {
                Path parent = options.outputPath().toAbsolutePath().getParent();
                if (parent != null) Files.createDirectories(parent);
                Files.writeString(options.outputPath(), text, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot write report to " + options.outputPath(), e);
            }
        }
        return text;
    }

    private String console(DiffResult r, ReportOptions o) {
        StringBuilder sb = new StringBuilder();
        String rule = "=".repeat(80);
        String thin = "-".repeat(40);
        line(sb, rule);
        line(sb, o.title());
        line(sb, rule);
        line(sb, "Files: " + name(r.sourceFiles().old()) + " -> " + name(r.sourceFiles().current()));
        line(sb, "Mode: " + lower(r.mode()));
        line(sb, "Generated: " + r.timestamp());
        line(sb, "");
        if (o.includeStatistics()) {
            DiffStatistics s = r.statistics();
            line(sb, "STATISTICS");
            line(sb, thin);
            line(sb, "Total Rows: " + s.totalRows().old() + " -> " + s.totalRows().current());
            line(sb, "Total Columns: " + s.totalColumns().old() + " -> " + s.totalColumns().current());
            line(sb, "Change Rate: " + pct(s.changePercentage()));
            line(sb, "");
            line(sb, "Changes by Type:");
            line(sb, "  + Added: " + s.changes().added());
            line(sb, "  - Removed: " + s.changes().removed());
            line(sb, "  ~ Modified: " + s.changes().modified());
            line(sb, "  > Moved: " + s.changes().moved());
            line(sb, "  = Unchanged: " + s.changes().unchanged());
            line(sb, "");
            line(sb, "Affected Columns: " + s.affectedColumns().size());
            if (!s.mostChangedColumns().isEmpty()) {
                line(sb, "");
                line(sb, "Most Changed Columns:");
                for (ColumnChangeCount c : s.mostChangedColumns().subList(0, Math.min(5, s.mostChangedColumns().size()))) {
                    line(sb, "  " + c.column() + ": " + c.changeCount() + " changes (" + pct(c.changePercentage()) + ")");
                }
            }
            line(sb, "");
        }
        if (o.includeSchemaChanges() && !r.schemaChanges().isEmpty()) {
            line(sb, "SCHEMA CHANGES");
            line(sb, thin);
            for (SchemaChange c : r.schemaChanges()) {
                line(sb, marker(c.changeType().name()) + " " + c.changeType() + ": " + c.columnName());
                if (c.oldIndex() != null) line(sb, "    Previous position: " + c.oldIndex());
                if (c.newIndex() != null) line(sb, "    New position: " + c.newIndex());
            }
            line(sb, "");
        }
        if (o.includeRowDetails() && !r.rowChanges().isEmpty()) {
            List<RowChange> shown = shown(r, o);
            line(sb, "ROW CHANGES");
            line(sb, thin);
            line(sb, "Showing " + shown.size() + " of " + r.rowChanges().size() + " changes");
            line(sb, "");
            for (RowChange c : shown) {
                line(sb, marker(c.changeType().name()) + " Row " + c.rowIndex() + " (" + c.changeType() + ")");
                if (c.rowId() != null) line(sb, "    ID: " + c.rowId());
                if (!c.cellChanges().isEmpty()) {
                    line(sb, "    Cell changes: " + c.cellChanges().size());
                    for (CellChange cell : c.cellChanges().subList(0, Math.min(CELLS_PER_ROW, c.cellChanges().size()))) {
                        line(sb, "      " + cell.column() + ": \"" + nz(cell.oldValue()) + "\" -> \"" + nz(cell.newValue()) + "\"");
                    }
                    if (c.cellChanges().size() > CELLS_PER_ROW) {
                        line(sb, "      ... and " + (c.cellChanges().size() - CELLS_PER_ROW) + " more");
                    }
                }
                line(sb, "");
            }
            if (r.rowChanges().size() > shown.size()) {
                line(sb, "... and " + (r.rowChanges().size() - shown.size()) + " more changes");
                line(sb, "");
            }
        }
        line(sb, "METADATA");
        line(sb, thin);
        line(sb, "Processing Time: " + num(r.metadata().processingMillis()) + "ms");
        if (r.metadata().truncated()) line(sb, "Truncated: only the first " + r.metadata().maxRowsToProcess() + " rows were compared");
        line(sb, "Generator: " + GENERATOR + " v" + VERSION);
        line(sb, rule);
        return sb.toString();
    }

    private String markdown(DiffResult r, ReportOptions o) {
        StringBuilder sb = new StringBuilder();
        line(sb, "# " + o.title());
        line(sb, "");
        line(sb, o.description());
        line(sb, "");
        line(sb, "**Comparison:** `" + name(r.sourceFiles().old()) + "` -> `" + name(r.sourceFiles().current()) + "`");
        line(sb, "**Mode:** " + lower(r.mode()));
        line(sb, "**Generated:** " + r.timestamp());
        line(sb, "");
        if (o.includeStatistics()) {
            DiffStatistics s = r.statistics();
            line(sb, "## Statistics Overview");
            line(sb, "");
            line(sb, "| Metric | Value |");
            line(sb, "|--------|-------|");
            line(sb, "| Change Rate | " + pct(s.changePercentage()) + " |");
            line(sb, "| Total Rows | " + s.totalRows().old() + " -> " + s.totalRows().current() + " |");
            line(sb, "| Total Columns | " + s.totalColumns().old() + " -> " + s.totalColumns().current() + " |");
            line(sb, "| Added Rows | " + s.changes().added() + " |");
            line(sb, "| Removed Rows | " + s.changes().removed() + " |");
            line(sb, "| Modified Rows | " + s.changes().modified() + " |");
            line(sb, "| Moved Rows | " + s.changes().moved() + " |");
            line(sb, "| Unchanged Rows | " + s.changes().unchanged() + " |");
            line(sb, "| Affected Columns | " + s.affectedColumns().size() + " |");
            line(sb, "");
            if (!s.mostChangedColumns().isEmpty()) {
                line(sb, "### Most Changed Columns");
                line(sb, "");
                line(sb, "| Column | Changes | Percentage |");
                line(sb, "|--------|---------|------------|");
                for (ColumnChangeCount c : s.mostChangedColumns()) {
                    line(sb, "| " + md(c.column()) + " | " + c.changeCount() + " | " + pct(c.changePercentage()) + " |");
                }
                line(sb, "");
            }
        }
        if (o.includeSchemaChanges() && !r.schemaChanges().isEmpty()) {
            line(sb, "## Schema Changes");
            line(sb, "");
            line(sb, "| Change | Column | Old Position | New Position |");
            line(sb, "|--------|--------|--------------|--------------|");
            for (SchemaChange c : r.schemaChanges()) {
                line(sb, "| " + lower(c.changeType()) + " | " + md(c.columnName()) + " | " + opt(c.oldIndex()) + " | " + opt(c.newIndex()) + " |");
            }
            line(sb, "");
        }
        if (o.includeRowDetails() && !r.rowChanges().isEmpty()) {
            List<RowChange> shown = shown(r, o);
            line(sb, "## Row Changes");
            line(sb, "");
            line(sb, "Showing " + shown.size() + " of " + r.rowChanges().size() + " changes.");
            line(sb, "");
            for (RowChange c : shown) {
                line(sb, "### Row " + c.rowIndex() + " (" + lower(c.changeType()) + ")" + (c.rowId() == null ? "" : " `" + c.rowId() + "`"));
                line(sb, "");
                if (!c.cellChanges().isEmpty()) {
                    line(sb, "| Column | Old Value | New Value |");
                    line(sb, "|--------|-----------|-----------|");
                    for (CellChange cell : c.cellChanges()) {
                        line(sb, "| " + md(cell.column()) + " | " + md(nz(cell.oldValue())) + " | " + md(nz(cell.newValue())) + " |");
                    }
                    line(sb, "");
                }
            }
            if (r.rowChanges().size() > shown.size()) {
                line(sb, "_... and " + (r.rowChanges().size() - shown.size()) + " more changes_");
                line(sb, "");
            }
        }
        if (r.textDiff() != null && !r.textDiff().isEmpty() && o.includeRowDetails()) {
            line(sb, "## Text Diff");
            line(sb, "");
            line(sb, "```diff");
            sb.append(r.textDiff());
            line(sb, "```");
            line(sb, "");
        }
        line(sb, "---");
        line(sb, "_Generated by " + GENERATOR + " v" + VERSION + "_");
        return sb.toString();
    }

    private String json(DiffResult r, ReportOptions o) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("generatedAt", r.timestamp().toString());
        meta.put("generator", GENERATOR);
        meta.put("version", VERSION);
        meta.put("title", o.title());
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("metadata", meta);
        doc.put("diffResult", r);
        try {
            return mapper.writeValueAsString(doc) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise diff result", e);
        }
    }

    private String html(DiffResult r, ReportOptions o) {
        Theme t = o.theme();
        StringBuilder sb = new StringBuilder();
        line(sb, "<!DOCTYPE html>");
        line(sb, "<html lang=\"en\">");
        line(sb, "<head>");
        line(sb, "<meta charset=\"utf-8\">");
        line(sb, "<title>" + esc(o.title()) + "</title>");
        line(sb, "<style>");
        line(sb, "body{font-family:-apple-system,Segoe UI,Helvetica,Arial,sans-serif;margin:2rem;background:" + t.background + ";color:" + t.text + "}");
        line(sb, "section{background:" + t.panel + ";border:1px solid " + t.border + ";border-radius:6px;padding:1rem;margin-bottom:1rem}");
        line(sb, "table{border-collapse:collapse;width:100%}td,th{border:1px solid " + t.border + ";padding:4px 8px;text-align:left}");
        line(sb, ".added{color:#1a7f37}.removed{color:#cf222e}.modified{color:#9a6700}.moved{color:#0969da}");
        line(sb, "pre{overflow:auto}");
        line(sb, "</style>");
        line(sb, "</head>");
        line(sb, "<body>");
        line(sb, "<h1>" + esc(o.title()) + "</h1>");
        line(sb, "<p>" + esc(o.description()) + "</p>");
        line(sb, "<p><strong>Comparison:</strong> <code>" + esc(name(r.sourceFiles().old())) + "</code> &rarr; <code>"
                + esc(name(r.sourceFiles().current())) + "</code> &middot; <strong>Mode:</strong> " + lower(r.mode())
                + " &middot; <strong>Generated:</strong> " + r.timestamp() + "</p>");
        if (o.includeStatistics()) {
            DiffStatistics s = r.statistics();
            line(sb, "<section id=\"statistics\"><h2>Statistics</h2><table>");
            row(sb, "Change Rate", pct(s.changePercentage()));
            row(sb, "Total Rows", s.totalRows().old() + " &rarr; " + s.totalRows().current());
            row(sb, "Total Columns", s.totalColumns().old() + " &rarr; " + s.totalColumns().current());
            row(sb, "<span class=\"added\">Added</span>", String.valueOf(s.changes().added()));
            row(sb, "<span class=\"removed\">Removed</span>", String.valueOf(s.changes().removed()));
            row(sb, "<span class=\"modified\">Modified</span>", String.valueOf(s.changes().modified()));
            row(sb, "<span class=\"moved\">Moved</span>", String.valueOf(s.changes().moved()));
            row(sb, "Unchanged", String.valueOf(s.changes().unchanged()));
            line(sb, "</table></section>");
        }
        if (o.includeSchemaChanges() && !r.schemaChanges().isEmpty()) {
            line(sb, "<section id=\"schema\"><h2>Schema Changes</h2><table>");
            line(sb, "<tr><th>Change</th><th>Column</th><th>Old Position</th><th>New Position</th></tr>");
            for (SchemaChange c : r.schemaChanges()) {
                line(sb, "<tr class=\"" + lower(c.changeType()) + "\"><td>" + lower(c.changeType()) + "</td><td>" + esc(c.columnName())
                        + "</td><td>" + opt(c.oldIndex()) + "</td><td>" + opt(c.newIndex()) + "</td></tr>");
            }
            line(sb, "</table></section>");
        }
        if (o.includeRowDetails() && !r.rowChanges().isEmpty()) {
            List<RowChange> shown = shown(r, o);
            line(sb, "<section id=\"rows\"><h2>Row Changes</h2>");
            line(sb, "<p>Showing " + shown.size() + " of " + r.rowChanges().size() + " changes</p><table>");
            line(sb, "<tr><th>Row</th><th>Change</th><th>ID</th><th>Cells</th></tr>");
            for (RowChange c : shown) {
                StringBuilder cells = new StringBuilder();
                for (CellChange cell : c.cellChanges()) {
                    cells.append(esc(cell.column())).append(": <del>").append(esc(nz(cell.oldValue())))
                            .append("</del> <ins>").append(esc(nz(cell.newValue()))).append("</ins><br>");
                }
                line(sb, "<tr class=\"" + lower(c.changeType()) + "\"><td>" + c.rowIndex() + "</td><td>" + lower(c.changeType())
                        + "</td><td>" + (c.rowId() == null ? "" : esc(c.rowId())) + "</td><td>" + cells + "</td></tr>");
            }
            line(sb, "</table></section>");
        }
        if (r.textDiff() != null && !r.textDiff().isEmpty() && o.includeRowDetails()) {
            line(sb, "<section id=\"text\"><h2>Text Diff</h2><pre>" + esc(r.textDiff()) + "</pre></section>");
        }
        line(sb, "<footer><small>" + GENERATOR + " v" + VERSION + "</small></footer>");
        line(sb, "</body>");
        line(sb, "</html>");
        return sb.toString();
    }

    private static List<RowChange> shown(DiffResult r, ReportOptions o) {
        int n = Math.max(0, Math.min(o.maxRowsToShow(), r.rowChanges().size()));
        return r.rowChanges().subList(0, n);
    }

    private static void row(StringBuilder sb, String label, String value) {
        line(sb, "<tr><th>" + label + "</th><td>" + value + "</td></tr>");
    }

    private static void line(StringBuilder sb, String s) { sb.append(s).append('\n'); }

    private static String marker(String type) {
        return switch (type) {
            case "ADDED" -> "+";
            case "REMOVED" -> "-";
            case "MODIFIED" -> "~";
            case "MOVED" -> ">";
            default -> "=";
        };
    }

    private static String pct(double v) { return String.format(Locale.ROOT, "%.1f%%", v); }
    private static String num(double v) { return String.format(Locale.ROOT, "%.2f", v); }
    private static String lower(Enum<?> e) { return e.name().toLowerCase(Locale.ROOT); }
    private static String opt(Integer i) { return i == null ? "" : String.valueOf(i); }
    private static String nz(String s) { return s == null ? "" : s; }

    private static String name(String path) {
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    private static String md(String s) { return s.replace("|", "\\|").replace("\n", " "); }

    private static String esc(String s) {
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;");
    }
}
