package io.csvchange.config;

import io.csvchange.diff.DiffMode;
import io.csvchange.hash.ChecksumAlgorithm;
import io.csvchange.report.ReportFormat;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class PipelineConfigTest {
    private static final Map<String, String> PROPS = Map.ofEntries(
            Map.entry("csvchange.dir", "/srv/data"),
            Map.entry("csvchange.debounce.ms", "250"),
            Map.entry("csvchange.backup.max", "7"),
            Map.entry("csvchange.backup.min", "2"),
            Map.entry("csvchange.backup.checksum", "md5"),
            Map.entry("csvchange.backup.compress", "false"),
            Map.entry("csvchange.csv.delimiter", "\\t"),
            Map.entry("csvchange.diff.mode", "text"),
            Map.entry("csvchange.diff.keys", "id, name"),
            Map.entry("csvchange.report.formats", "markdown, console"),
            Map.entry("csvchange.auto.backup", "false"),
            Map.entry("csvchange.port", "9090"));

    @AfterEach
    void clearProperties() {
        PROPS.keySet().forEach(System::clearProperty);
    }

    @Test
    void defaults_place_everything_under_the_work_dir() {
        Path work = Path.of("/srv/data");
        PipelineConfig c = PipelineConfig.defaults(work);

        assertEquals(work.resolve("backups"), c.backup().backupDir());
        assertEquals(work.resolve("logs"), c.update().logDir());
        assertEquals(work.resolve("diff-reports"), c.update().reportDir());
        assertEquals(List.of(ReportFormat.HTML, ReportFormat.JSON), c.update().reportFormats());
        assertEquals(4, c.workers());
        assertEquals(8080, c.adminPort());
    }

    @Test
    void system_properties_override_defaults() {
        PROPS.forEach(System::setProperty);
        PipelineConfig c = PipelineConfig.fromEnv();

        assertEquals(Path.of("/srv/data"), c.workDir());
        assertEquals(Duration.ofMillis(250), c.monitor().debounce());
        assertEquals(7, c.backup().retention().maxBackups());
        assertEquals(2, c.backup().retention().minBackups());
        assertEquals(ChecksumAlgorithm.MD5, c.backup().checksumAlgorithm());
        assertFalse(c.backup().compression());
        assertEquals(Path.of("/srv/data/backups"), c.backup().backupDir());
        assertEquals('\t', c.validation().format().delimiter());
        assertEquals('\t', c.diff().format().delimiter());
        assertEquals(DiffMode.TEXT, c.diff().mode());
        assertEquals(List.of("id", "name"), c.diff().keyColumns());
        assertEquals(List.of(ReportFormat.MARKDOWN, ReportFormat.CONSOLE), c.update().reportFormats());
        assertFalse(c.update().autoBackup());
        assertTrue(c.update().autoValidate());
        assertEquals(9090, c.adminPort());
    }

    @Test
    void multi_character_delimiter_is_rejected() {
        System.setProperty("csvchange.csv.delimiter", ";;");
        try {
            assertThrows(IllegalArgumentException.class, PipelineConfig::fromEnv);
        } finally {
            System.clearProperty("csvchange.csv.delimiter");
        }
    }

    @Test
    void environment_names_are_upper_snake_case() {
        assertEquals("CSVCHANGE_BACKUP_MAX_AGE_DAYS", PipelineConfig.envName("csvchange.backup.max.age.days"));
    }
}
