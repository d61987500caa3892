package io.csvchange.validation;

import com.codahale.metrics.Timer;
import io.csvchange.csv.CsvFormat;
import io.csvchange.csv.CsvParseException;
import io.csvchange.csv.CsvParser;
import io.csvchange.csv.CsvTable;
import io.csvchange.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Structural, schema and cell-level checks over one file. Findings are data: this class never throws for bad input.
 * <p>
 * Checks run in a fixed order (structure, schema, field validators in registration order, metadata), so an
 * unchanged file always yields the same errors and warnings.
 */
public class CsvValidationPipeline {
    private static final Logger log = LoggerFactory.getLogger(CsvValidationPipeline.class);
    private static final Pattern NON_ASCII = Pattern.compile("[^\\x00-\\x7F]");
    private static final Pattern LATIN_START = Pattern.compile("^[\\u00C0-\\u017F]");

    private final ValidationOptions options;
    private final Map<String, FieldValidator> validators = new LinkedHashMap<>();
    private final Timer timer;
    private final Metrics metrics;

    public CsvValidationPipeline(ValidationOptions options, Metrics metrics) {
        this(options, metrics, true);
    }

    public CsvValidationPipeline(ValidationOptions options, Metrics metrics, boolean builtIns) {
        this.options = Objects.requireNonNull(options);
        this.metrics = Objects.requireNonNull(metrics);
        this.timer = metrics.timer("validation.time");
        if (builtIns) BuiltInValidators.all().forEach(this::registerCustomValidator);
    }

    public ValidationOptions options() { return options; }

    /** Registers or replaces the validator with the same name; replacement keeps the original position. */
    public synchronized void registerCustomValidator(FieldValidator validator) {
        validators.put(validator.name(), validator);
        log.debug("Registered validator {}", validator.name());
    }

    public synchronized boolean unregisterCustomValidator(String name) {
        return validators.remove(name) != null;
    }

    /** Name to description, in execution order. */
    public synchronized Map<String, String> validators() {
        Map<String, String> out = new LinkedHashMap<>();
        validators.values().forEach(v -> out.put(v.name(), v.description()));
        return out;
    }

    public ValidationResult validateFile(Path file) {
        long start = System.nanoTime();
        try (Timer.Context ignored = timer.time()) {
            byte[] bytes;
            try {
                bytes = Files.readAllBytes(file);
            } catch (IOException e) {
                log.warn("Cannot read {}: {}", file, e.toString());
                return fail(ValidationError.of(ErrorType.STRUCTURE, Severity.CRITICAL, "FILE_READ_ERROR",
                        "Failed to validate file: " + describe(e)));
            }
            String text = new String(bytes, StandardCharsets.UTF_8);
            CsvTable table;
            long parseStart = System.nanoTime();
            try {
                table = new CsvParser(options.format()).parse(text);
            } catch (CsvParseException e) {
                return fail(ValidationError.of(ErrorType.STRUCTURE, Severity.CRITICAL, "PARSE_ERROR",
                        "CSV parsing failed: " + e.getMessage()));
            }
            long parseNanos = System.nanoTime() - parseStart;
            ValidationResult result = validate(table, bytes.length, parseNanos, start);
            metrics.counter(result.valid() ? "validation.valid" : "validation.invalid").inc();
            return result;
        }
    }

    /** Validates an already parsed table; {@code fileSize} is reported in the metadata only. */
    public ValidationResult validateTable(CsvTable table, long fileSize) {
        long start = System.nanoTime();
        return validate(table, fileSize, 0, start);
    }

    private ValidationResult validate(CsvTable table, long fileSize, long parseNanos, long start) {
        if (table.rowCount() == 0) {
            return new ValidationResult(false, table.headers(), 0,
                    List.of(ValidationError.of(ErrorType.STRUCTURE, Severity.CRITICAL, "NO_DATA", "No data records found")),
                    List.of(), null, null);
        }
        long checkStart = System.nanoTime();
        Findings f = new Findings(options.maxErrors());
        List<Map<String, String>> rows = new ArrayList<>(table.rowCount());
        for (int i = 0; i < table.rowCount(); i++) rows.add(table.rowAsMap(i));

        checkStructure(table, rows, f);
        if (options.schema() != null || options.strictMode()) checkSchema(table, rows, f);
        runValidators(table.headers(), rows, f);
        ValidationMetadata metadata = metadata(table, rows, fileSize);

        if (f.capped()) {
            f.warn(new ValidationWarning(WarningType.PERFORMANCE,
                    "Validation stopped after " + options.maxErrors() + " errors. There may be additional issues.",
                    null, null, null, "Fix current errors and re-validate"));
        }
        boolean valid = f.errors.stream().noneMatch(ValidationError::blocking);
        ValidationPerformance perf = null;
        if (options.performanceTracking()) {
            long end = System.nanoTime();
            perf = new ValidationPerformance(parseNanos / 1e6, (end - checkStart) / 1e6, (end - start) / 1e6);
        }
        return new ValidationResult(valid, table.headers(), table.rowCount(), f.errors,
                options.enableWarnings() ? f.warnings : List.of(), metadata, perf);
    }

    private void checkStructure(CsvTable table, List<Map<String, String>> rows, Findings f) {
        List<String> headers = table.headers();
        for (int c = 0; c < headers.size(); c++) {
            if (headers.get(c).isBlank()) {
                f.error(new ValidationError(ErrorType.STRUCTURE, Severity.ERROR, "EMPTY_HEADER",
                        "Empty header at column " + (c + 1), null, String.valueOf(c), null, null));
            }
        }
        Map<String, Integer> counts = new LinkedHashMap<>();
        headers.forEach(h -> counts.merge(h, 1, Integer::sum));
        counts.forEach((h, n) -> {
            if (n > 1) {
                f.error(new ValidationError(ErrorType.STRUCTURE, Severity.ERROR, "DUPLICATE_HEADER",
                        "Duplicate header: \"" + h + "\" appears " + n + " times", null, h, null, null));
            }
        });
        for (int i = 0; i < table.rowCount(); i++) {
            int fields = table.rows().get(i).size();
            boolean blankLine = fields == 1 && table.rows().get(i).get(0).isEmpty();
            if (fields != headers.size() && !blankLine) {
                f.error(new ValidationError(ErrorType.STRUCTURE, Severity.ERROR, "COLUMN_COUNT_MISMATCH",
                        "Row has " + fields + " fields, header has " + headers.size(), i + 2, null, null,
                        String.valueOf(headers.size())));
            }
        }
        if (!options.enableWarnings()) return;
        for (int i = 0; i < rows.size(); i++) {
            for (Map.Entry<String, String> e : rows.get(i).entrySet()) {
                String v = e.getValue();
                if (NON_ASCII.matcher(v).find() && !LATIN_START.matcher(v).find()) {
                    f.warn(new ValidationWarning(WarningType.DATA_QUALITY,
                            "Potential encoding issue in field \"" + e.getKey() + "\"", i + 2, e.getKey(), v,
                            "Check file encoding"));
                }
            }
        }
    }

    private void checkSchema(CsvTable table, List<Map<String, String>> rows, Findings f) {
        ValidationSchema schema = options.schema() != null ? options.schema() : ValidationSchema.builder().build();
        Set<String> present = new HashSet<>(table.headers());
        for (String req : schema.required()) {
            if (!present.contains(req)) {
                f.error(new ValidationError(ErrorType.SCHEMA, Severity.ERROR, "SCHEMA_VALIDATION_FAILED",
                        "Schema validation failed: must have required property '" + req + "'", null, req, null, "required"));
            }
        }
        boolean closed = !schema.additionalColumns() || options.strictMode();
        if (closed && options.schema() != null) {
            for (String h : table.headers()) {
                if (!schema.columns().containsKey(h)) {
                    f.error(new ValidationError(ErrorType.SCHEMA, Severity.ERROR, "SCHEMA_VALIDATION_FAILED",
                            "Schema validation failed: must NOT have additional properties", null, h, null, "additionalProperties"));
                }
            }
        }
        for (int i = 0; i < rows.size() && !f.capped(); i++) {
            for (Map.Entry<String, ColumnRule> rule : schema.columns().entrySet()) {
                String column = rule.getKey();
                if (!present.contains(column)) continue;
                String value = rows.get(i).get(column);
                int row = i + 2;
                rule.getValue().check(value).ifPresent(msg -> f.error(new ValidationError(ErrorType.SCHEMA, Severity.ERROR,
                        "SCHEMA_VALIDATION_FAILED", "Schema validation failed: " + msg, row, column, value, null)));
            }
        }
    }

    private void runValidators(List<String> headers, List<Map<String, String>> rows, Findings f) {
        List<FieldValidator> active;
        synchronized (this) {
            active = List.copyOf(validators.values());
        }
        for (int i = 0; i < rows.size() && !f.capped(); i++) {
            Map<String, String> row = rows.get(i);
            int line = i + 2;
            for (String column : headers) {
                String value = row.get(column);
                for (FieldValidator v : active) {
                    try {
                        v.validate(value, row, i, column).ifPresent(e -> f.error(e.at(line, column)));
                    } catch (RuntimeException e) {
                        f.warn(new ValidationWarning(WarningType.PERFORMANCE,
                                "Custom validator \"" + v.name() + "\" failed: " + describe(e), line, column, null, null));
                    }
                }
            }
        }
    }

    private ValidationMetadata metadata(CsvTable table, List<Map<String, String>> rows, long fileSize) {
        Map<String, String> types = new LinkedHashMap<>();
        for (String h : table.headers()) {
            List<String> values = new ArrayList<>();
            for (Map<String, String> r : rows) values.add(r.get(h));
            types.put(h, ValueType.infer(values).id());
        }
        int empty = 0;
        for (List<String> r : table.rows()) {
            if (r.stream().allMatch(String::isBlank)) empty++;
        }
        Map<List<String>, Boolean> distinct = new HashMap<>();
        for (List<String> r : table.rows()) distinct.put(r, Boolean.TRUE);
        CsvFormat fmt = options.format();
        return new ValidationMetadata(fileSize, "utf-8", String.valueOf(fmt.delimiter()), String.valueOf(fmt.quote()),
                String.valueOf(fmt.escape()), true, table.columnCount(), empty, table.rowCount() - distinct.size(), types);
    }

    private ValidationResult fail(ValidationError error) {
        metrics.counter("validation.invalid").inc();
        return ValidationResult.failed(error);
    }

    private static String describe(Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    private static final class Findings {
        final int max;
        final List<ValidationError> errors = new ArrayList<>();
        final List<ValidationWarning> warnings = new ArrayList<>();

        Findings(int max) { this.max = Math.max(1, max); }

        void error(ValidationError e) {
            if (errors.size() < max) errors.add(e);
        }

        void warn(ValidationWarning w) { warnings.add(w); }

        boolean capped() { return errors.size() >= max; }
    }
}
