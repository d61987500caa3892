package io.csvchange.report;

import com.fasterxml.jackson.databind.JsonNode;
import io.csvchange.TestFiles;
import io.csvchange.diff.CsvDiffEngine;
import io.csvchange.diff.DiffMode;
import io.csvchange.diff.DiffOptions;
import io.csvchange.diff.DiffResult;
import io.csvchange.json.Json;
import io.csvchange.metrics.Metrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DiffReportGeneratorTest {
    private Path dir;
    private DiffResult result;
    private final DiffReportGenerator generator = new DiffReportGenerator();

    @BeforeEach
    void setUp() throws Exception {
        dir = Files.createTempDirectory("report-test");
        CsvDiffEngine engine = new CsvDiffEngine(DiffOptions.defaults(),
                Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC), Metrics.standalone());
        result = engine.compareText(
                "name,city\nAlice,Paris\nBob,Lyon\nCarol,Nice\n",
                "name,city,zip\nAlice,Paris,75\nBob,<Lille>,69\nDave,Nan|tes,44\n",
                "/data/old/people.csv", "/data/people.csv",
                DiffOptions.defaults().withMode(DiffMode.HYBRID).withKeyColumns(List.of("name")));
    }

    @AfterEach
    void tearDown() {
        TestFiles.deleteRecursively(dir);
    }

    @Test
    void same_result_renders_byte_identical_output() {
        for (ReportFormat f : ReportFormat.values()) {
            ReportOptions o = ReportOptions.defaults(f);
            assertEquals(generator.render(result, o), generator.render(result, o), f.name());
        }
    }

    @Test
    void console_report_lists_statistics_schema_and_rows() {
        String text = generator.render(result, ReportOptions.defaults(ReportFormat.CONSOLE));

        assertTrue(text.startsWith("=".repeat(80) + "\nCSV Diff Report\n"));
        assertTrue(text.contains("Files: people.csv -> people.csv\n"));
        assertTrue(text.contains("Mode: hybrid\n"));
        assertTrue(text.contains("Generated: 2024-03-01T10:00:00Z\n"));
        assertTrue(text.contains("  + Added: 1\n  - Removed: 1\n  ~ Modified: 1\n"));
        assertTrue(text.contains("+ ADDED: zip\n    New position: 2\n"));
        assertTrue(text.contains("~ Row 1 (MODIFIED)\n    ID: Bob\n    Cell changes: 1\n      city: \"Lyon\" -> \"<Lille>\"\n"));
        assertTrue(text.contains("Generator: " + DiffReportGenerator.GENERATOR + " v1.0\n"));
    }

    @Test
    void row_details_are_capped() {
        String text = generator.render(result, ReportOptions.defaults(ReportFormat.CONSOLE).withMaxRows(1));
        assertTrue(text.contains("Showing 1 of 3 changes\n"));
        assertTrue(text.contains("... and 2 more changes\n"));

        String md = generator.render(result, ReportOptions.defaults(ReportFormat.MARKDOWN).withMaxRows(1));
        assertTrue(md.contains("_... and 2 more changes_\n"));
    }

    @Test
    void sections_can_be_left_out() {
        String text = generator.render(result,
                ReportOptions.defaults(ReportFormat.CONSOLE).withSections(false, false, false));
        assertFalse(text.contains("STATISTICS"));
        assertFalse(text.contains("SCHEMA CHANGES"));
        assertFalse(text.contains("ROW CHANGES"));
        assertTrue(text.contains("METADATA"));
    }

    @Test
    void html_escapes_values_and_applies_theme() {
        String html = generator.render(result, ReportOptions.defaults(ReportFormat.HTML).withTheme(Theme.DARK)
                .withTitle("Stores <weekly>", "Nightly import"));

        assertTrue(html.startsWith("<!DOCTYPE html>\n"));
        assertTrue(html.contains("<title>Stores &lt;weekly&gt;</title>"));
        assertTrue(html.contains("background:#0d1117"));
        assertTrue(html.contains("<del>Lyon</del> <ins>&lt;Lille&gt;</ins>"));
        assertFalse(html.contains("<Lille>"));
        assertTrue(html.contains("<section id=\"text\">"));
    }

    @Test
    void markdown_lists_schema_rows_and_patch() {
        String md = generator.render(result, ReportOptions.defaults(ReportFormat.MARKDOWN));
        assertTrue(md.startsWith("# CSV Diff Report\n\nComprehensive comparison between CSV file versions\n"));
        assertTrue(md.contains("| added | zip |  | 2 |\n"));
        assertTrue(md.contains("### Row 2 (added) `Dave`"));
        assertTrue(md.contains("```diff\n--- people.csv\n+++ people.csv\n"));
    }

    @Test
    void json_report_wraps_the_full_result() throws Exception {
        String json = generator.render(result, ReportOptions.defaults(ReportFormat.JSON));
        JsonNode root = Json.compactMapper().readTree(json);

        assertEquals("2024-03-01T10:00:00Z", root.path("metadata").path("generatedAt").asText());
        assertEquals(DiffReportGenerator.GENERATOR, root.path("metadata").path("generator").asText());
        JsonNode diff = root.path("diffResult");
        assertEquals("HYBRID", diff.path("mode").asText());
        assertEquals(1, diff.path("statistics").path("changes").path("added").asInt());
        assertEquals(3, diff.path("rowChanges").size());
        assertEquals("/data/old/people.csv", diff.path("sourceFiles").path("old").asText());
    }

    @Test
    void writes_the_report_when_an_output_path_is_given() throws Exception {
        Path out = dir.resolve("reports/nested/diff.md");
        String md = generator.render(result, ReportOptions.defaults(ReportFormat.MARKDOWN).withOutputPath(out));
        assertEquals(md, Files.readString(out));
    }

    @Test
    void format_names_parse_case_insensitively() {
        assertEquals(ReportFormat.HTML, ReportFormat.parse(" html "));
        assertEquals("md", ReportFormat.MARKDOWN.extension());
        assertThrows(IllegalArgumentException.class, () -> ReportFormat.parse("pdf"));
    }
}
