package io.csvchange.validation;

import io.csvchange.TestFiles;
import io.csvchange.metrics.Metrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class CsvValidationPipelineTest {
    private Path dir;
    private Metrics metrics;
    private CsvValidationPipeline pipeline;

    @BeforeEach
    void setUp() throws Exception {
        dir = Files.createTempDirectory("validation-test");
        metrics = Metrics.standalone();
        pipeline = new CsvValidationPipeline(ValidationOptions.defaults(), metrics);
    }

    @AfterEach
    void tearDown() {
        TestFiles.deleteRecursively(dir);
    }

    private Path csv(String name, String content) throws Exception {
        return Files.writeString(dir.resolve(name), content);
    }

    @Test
    void clean_file_is_valid_and_described() throws Exception {
        Path f = csv("stores.csv", "name,email,latitude,longitude\nA,a@x.com,48.8,2.3\nB,b@y.org,45.7,4.8\n");
        ValidationResult r = pipeline.validateFile(f);

        assertTrue(r.valid(), r.errorMessages().toString());
        assertEquals(2, r.rowCount());
        assertEquals(List.of("name", "email", "latitude", "longitude"), r.headers());
        assertTrue(r.errors().isEmpty());
        ValidationMetadata m = r.metadata();
        assertEquals(4, m.columnCount());
        assertEquals(Files.size(f), m.fileSize());
        assertEquals(",", m.delimiter());
        assertEquals("utf-8", m.encoding());
        assertEquals(Map.of("name", "string", "email", "email", "latitude", "number", "longitude", "number"), m.dataTypes());
        assertNotNull(r.performance());
        assertEquals(1, metrics.counter("validation.valid").getCount());
    }

    @Test
    void latitude_out_of_range_invalidates_the_file() throws Exception {
        Path f = csv("geo.csv", "name,latitude,longitude\nA,95.0,2.3\n");
        ValidationResult r = pipeline.validateFile(f);

        assertFalse(r.valid());
        ValidationError e = r.errors().get(0);
        assertEquals("LATITUDE_OUT_OF_RANGE", e.code());
        assertEquals(Severity.ERROR, e.severity());
        assertEquals(2, e.row());
        assertEquals("latitude", e.column());
        assertEquals("95.0", e.value());
    }

    @Test
    void unchanged_file_gives_identical_findings() throws Exception {
        Path f = csv("mixed.csv", "name,email,phone,website,latitude\nA,bad,abc,ftp://x,x\nA,bad,abc,ftp://x,x\n");
        ValidationResult first = pipeline.validateFile(f);
        ValidationResult second = pipeline.validateFile(f);

        assertFalse(first.errors().isEmpty());
        assertEquals(first.errors(), second.errors());
        assertEquals(first.warnings(), second.warnings());
        assertEquals(first.metadata(), second.metadata());
        assertEquals(1, first.metadata().duplicateRows());
    }

    @Test
    void header_only_file_has_no_data() throws Exception {
        ValidationResult r = pipeline.validateFile(csv("empty.csv", "name,city\n"));
        assertFalse(r.valid());
        assertTrue(r.hasErrorCode("NO_DATA"));
        assertEquals(Severity.CRITICAL, r.errors().get(0).severity());
    }

    @Test
    void unreadable_and_unparseable_files_are_critical() throws Exception {
        ValidationResult missing = pipeline.validateFile(dir.resolve("absent.csv"));
        assertFalse(missing.valid());
        assertTrue(missing.hasErrorCode("FILE_READ_ERROR"));

        ValidationResult broken = pipeline.validateFile(csv("broken.csv", "a,b\n\"open,1\n"));
        assertFalse(broken.valid());
        assertTrue(broken.hasErrorCode("PARSE_ERROR"));
        assertEquals(2, metrics.counter("validation.invalid").getCount());
    }

    @Test
    void structural_problems_are_errors() throws Exception {
        ValidationResult r = pipeline.validateFile(csv("dup.csv", "id,name,name,\n1,a,b,c\n2,x\n"));
        assertFalse(r.valid());
        assertTrue(r.hasErrorCode("DUPLICATE_HEADER"));
        assertTrue(r.hasErrorCode("EMPTY_HEADER"));
        ValidationError mismatch = r.errors().stream()
                .filter(e -> e.code().equals("COLUMN_COUNT_MISMATCH")).findFirst().orElseThrow();
        assertEquals(3, mismatch.row());
        assertEquals("4", mismatch.expected());
    }

    @Test
    void warning_severity_findings_do_not_invalidate() throws Exception {
        ValidationResult r = pipeline.validateFile(csv("phones.csv", "name,phone,website\nA,call me,example.com\n"));
        assertTrue(r.valid());
        assertTrue(r.hasErrorCode("UNUSUAL_PHONE_FORMAT"));
        assertTrue(r.hasErrorCode("INVALID_URL_FORMAT"));
    }

    @Test
    void error_cap_stops_collection_and_says_so() throws Exception {
        StringBuilder sb = new StringBuilder("email\n");
        for (int i = 0; i < 10; i++) sb.append("bad").append(i).append('\n');
        CsvValidationPipeline capped = new CsvValidationPipeline(ValidationOptions.defaults().withMaxErrors(3), metrics);

        ValidationResult r = capped.validateFile(csv("emails.csv", sb.toString()));

        assertEquals(3, r.errors().size());
        assertTrue(r.warnings().stream().anyMatch(w -> w.type() == WarningType.PERFORMANCE
                && w.message().contains("stopped after 3 errors")));
    }

    @Test
    void throwing_validator_becomes_a_warning() throws Exception {
        pipeline.registerCustomValidator(FieldValidator.of("boom", "always fails", (v, row, i, c) -> {
            throw new IllegalStateException("kaboom");
        }));
        ValidationResult r = pipeline.validateFile(csv("one.csv", "a\n1\n"));

        assertTrue(r.valid());
        assertEquals(1, r.warnings().size());
        assertTrue(r.warnings().get(0).message().contains("\"boom\""));
        assertTrue(r.warnings().get(0).message().contains("kaboom"));
    }

    @Test
    void custom_validators_run_in_registration_order_and_can_be_removed() throws Exception {
        pipeline.registerCustomValidator(FieldValidator.of("no-x", "rejects x", (v, row, i, c) ->
                "x".equals(v) ? Optional.of(ValidationError.of(ErrorType.DATA, Severity.ERROR, "NO_X", "x found")) : Optional.empty()));
        assertEquals(List.of("email-format", "phone-format", "url-format", "coordinate-range", "no-x"),
                List.copyOf(pipeline.validators().keySet()));

        Path f = csv("x.csv", "email,val\nnot-an-email,x\n");
        ValidationResult r = pipeline.validateFile(f);
        assertEquals(List.of("INVALID_EMAIL_FORMAT", "NO_X"), r.errors().stream().map(ValidationError::code).toList());
        assertEquals(2, r.errors().get(1).row());
        assertEquals("val", r.errors().get(1).column());

        assertTrue(pipeline.unregisterCustomValidator("email-format"));
        assertFalse(pipeline.unregisterCustomValidator("email-format"));
        assertEquals(List.of("NO_X"), pipeline.validateFile(f).errors().stream().map(ValidationError::code).toList());
    }

    @Test
    void schema_checks_required_undeclared_and_column_rules() throws Exception {
        ValidationSchema schema = ValidationSchema.builder()
                .require("name", "city")
                .column("rating", ColumnRule.matching("^[0-5]$"))
                .additionalColumns(false)
                .build();
        CsvValidationPipeline withSchema = new CsvValidationPipeline(ValidationOptions.defaults().withSchema(schema), metrics);

        ValidationResult r = withSchema.validateFile(csv("s.csv", "name,rating,extra\nA,7,x\n"));

        assertFalse(r.valid());
        assertEquals(3, r.errors().size());
        assertTrue(r.errors().stream().allMatch(e -> e.type() == ErrorType.SCHEMA));
        assertEquals(List.of("city", "extra", "rating"), r.errors().stream().map(ValidationError::column).toList());
    }

    @Test
    void store_directory_schema_accepts_a_well_formed_listing() throws Exception {
        CsvValidationPipeline stores = new CsvValidationPipeline(
                ValidationOptions.defaults().withSchema(ValidationSchemas.storeDirectory()), metrics);
        Path ok = csv("dir.csv", "name,category,city,full_address,latitude,longitude,site,rating\n"
                + "Cafe,Food,Paris,1 Rue X,48.85,2.35,https://cafe.example,4.5\n");
        assertTrue(stores.validateFile(ok).valid());

        Path bad = csv("dir-bad.csv", "name,category,city,full_address,site\nCafe,,Paris,1 Rue X,not a uri\n");
        ValidationResult r = stores.validateFile(bad);
        assertFalse(r.valid());
        assertEquals(List.of("category", "site"), r.errors().stream().map(ValidationError::column).toList());
    }

    @Test
    void metadata_counts_empty_and_duplicate_rows() throws Exception {
        ValidationResult r = pipeline.validateFile(csv("rows.csv", "a,b\n1,2\n1,2\n,\n"));
        assertEquals(3, r.rowCount());
        assertEquals(1, r.metadata().emptyRows());
        assertEquals(1, r.metadata().duplicateRows());
        assertEquals("number", r.metadata().dataTypes().get("a"));
    }
}
