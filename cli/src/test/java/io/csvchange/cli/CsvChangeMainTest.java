package io.csvchange.cli;

import io.csvchange.config.PipelineConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class CsvChangeMainTest {
    private static final String GOOD = "name,email,latitude\nCafe,cafe@example.com,48.8\n";
    private static final String BAD = "name,email,latitude\nCafe,cafe@example.com,95.0\n";

    private Path dir;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws Exception {
        dir = Files.createTempDirectory("cli-test");
    }

    @AfterEach
    void tearDown() throws Exception {
        try (Stream<Path> s = Files.walk(dir)) {
            s.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        }
    }

    private int run(String... args) {
        out = new StringWriter();
        err = new StringWriter();
        CommandLine cmd = CsvChangeMain.commandLine(PipelineConfig.defaults(dir));
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    private Path csv(String name, String content) throws IOException {
        return Files.writeString(dir.resolve(name), content);
    }

    @Test
    void no_arguments_prints_usage() {
        assertEquals(0, run());
        assertTrue(out.toString().contains("Usage: csv-change"));
        assertTrue(out.toString().contains("validate"));
    }

    @Test
    void validate_reports_findings_and_exit_code() throws Exception {
        Path good = csv("good.csv", GOOD);
        assertEquals(0, run("validate", good.toString()));
        assertTrue(out.toString().startsWith("VALID: " + good + "\n  1 rows, 3 columns\n"));

        Path bad = csv("bad.csv", BAD);
        assertEquals(1, run("validate", bad.toString()));
        assertTrue(out.toString().startsWith("INVALID: " + bad));
        assertTrue(out.toString().contains("[ERROR] LATITUDE_OUT_OF_RANGE row 2 column latitude:"));

        assertEquals(1, run("validate", "--schema", "STORE_DIRECTORY", good.toString()));
        assertTrue(out.toString().contains("SCHEMA_VALIDATION_FAILED"));

        assertEquals(0, run("validate", "--json", good.toString()));
        assertTrue(out.toString().contains("\"valid\" : true"));
    }

    @Test
    void diff_exit_code_reflects_changes() throws Exception {
        Path a = csv("a.csv", GOOD);
        Path b = csv("b.csv", GOOD + "Bar,bar@example.com,45.7\n");

        assertEquals(0, run("diff", a.toString(), a.toString()));
        assertEquals(1, run("diff", "--key", "name", a.toString(), b.toString()));
        assertTrue(out.toString().contains("  + Added: 1\n"));

        Path report = dir.resolve("out/report.md");
        assertEquals(1, run("diff", "-f", "MARKDOWN", "-o", report.toString(), a.toString(), b.toString()));
        assertEquals(out.toString(), Files.readString(report));

        assertEquals(0, run("diff", "--only", "REMOVED", a.toString(), b.toString()));

        assertEquals(2, run("diff", a.toString(), dir.resolve("missing.csv").toString()));
        assertTrue(err.toString().startsWith("Diff failed: Cannot read"));
    }

    @Test
    void backup_lifecycle() throws Exception {
        Path file = csv("stores.csv", GOOD);

        assertEquals(0, run("backup", "create", file.toString(), "--tag", "manual"));
        Matcher m = Pattern.compile("Created backup (\\S+) \\(v1, (\\d+) bytes\\)").matcher(out.toString());
        assertTrue(m.find(), out.toString());
        String id = m.group(1);

        assertEquals(0, run("backup", "list", "--tag", "manual"));
        assertTrue(out.toString().contains(id));
        assertTrue(out.toString().endsWith("1 backup(s)\n") || out.toString().endsWith("1 backup(s)" + System.lineSeparator()));

        assertEquals(0, run("backup", "verify", id));
        assertTrue(out.toString().startsWith("OK " + id));

        Files.writeString(file, "changed\n");
        assertEquals(0, run("backup", "restore", id));
        assertEquals(GOOD, Files.readString(file));
        assertTrue(out.toString().contains("Previous content saved as "));

        assertEquals(0, run("backup", "stats"));
        assertTrue(out.toString().contains("Total backups: 2"));

        assertEquals(0, run("backup", "delete", id));
        assertEquals(1, run("backup", "delete", id));
        assertTrue(err.toString().contains("No such backup: " + id));
    }

    @Test
    void backup_of_missing_file_fails() {
        assertEquals(1, run("backup", "create", dir.resolve("nope.csv").toString()));
        assertTrue(err.toString().startsWith("Backup failed: File not found"));
    }

    @Test
    void empty_change_log_is_reported() {
        assertEquals(0, run("log", "recent"));
        assertTrue(out.toString().contains("No changes recorded"));

        assertEquals(0, run("log", "summary"));
        assertTrue(out.toString().startsWith("Total Changes: 0"));

        assertEquals(0, run("log", "export", "-f", "CSV"));
        assertTrue(out.toString().startsWith("ID,Timestamp,Filename,"));
    }

    @Test
    void watch_rejects_a_file_in_a_missing_directory() {
        assertEquals(2, run("watch", "--seconds", "1", dir.resolve("missing/x.csv").toString()));
        assertTrue(err.toString().startsWith("Cannot watch "));
    }
}
