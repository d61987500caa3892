package io.csvchange.cli;

import com.google.inject.Inject;
import io.csvchange.config.PipelineConfig;
import io.csvchange.json.Json;
import io.csvchange.metrics.Metrics;
import io.csvchange.validation.CsvValidationPipeline;
import io.csvchange.validation.ValidationError;
import io.csvchange.validation.ValidationOptions;
import io.csvchange.validation.ValidationResult;
import io.csvchange.validation.ValidationSchemas;
import io.csvchange.validation.ValidationWarning;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Exit code 0 when the file is valid, 1 when it is not.
 */
@CommandLine.Command(name = "validate", mixinStandardHelpOptions = true, description = "Validate a CSV file")
public class ValidateCommand implements Callable<Integer> {

    @CommandLine.Parameters(index = "0", description = "CSV file")
    Path file;

    @CommandLine.Option(names = "--strict", description = "Reject columns the schema does not declare")
    boolean strict;

    @CommandLine.Option(names = "--max-errors", description = "Stop collecting errors after this many")
    Integer maxErrors;

    @CommandLine.Option(names = "--schema", description = "Built-in schema to enforce: ${COMPLETION-CANDIDATES}")
    SchemaName schema;

    @CommandLine.Option(names = "--json", description = "Print the full result as JSON")
    boolean json;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    enum SchemaName { STORE_DIRECTORY }

    private final PipelineConfig config;
    private final CsvValidationPipeline configured;
    private final Metrics metrics;

    @Inject
    ValidateCommand(PipelineConfig config, CsvValidationPipeline configured, Metrics metrics) {
        this.config = config;
        this.configured = configured;
        this.metrics = metrics;
    }

    @Override
    public Integer call() throws Exception {
        ValidationResult result = pipeline().validateFile(file);
        PrintWriter out = spec.commandLine().getOut();
        if (json) {
            out.println(Json.prettyMapper().writeValueAsString(result));
        } else {
            print(out, result);
        }
        out.flush();
        return result.valid() ? 0 : 1;
    }

    private CsvValidationPipeline pipeline() {
        if (!strict && maxErrors == null && schema == null) return configured;
        ValidationOptions opts = config.validation();
        if (strict) opts = opts.withStrictMode(true);
        if (maxErrors != null) opts = opts.withMaxErrors(maxErrors);
        if (schema == SchemaName.STORE_DIRECTORY) opts = opts.withSchema(ValidationSchemas.storeDirectory());
        return new CsvValidationPipeline(opts, metrics);
    }

    private void print(PrintWriter out, ValidationResult r) {
        out.printf("%s: %s%n", r.valid() ? "VALID" : "INVALID", file);
        if (r.rowCount() != null) {
            out.printf("  %d rows, %d columns%n", r.rowCount(), r.headers() == null ? 0 : r.headers().size());
        }
        for (ValidationError e : r.errors()) {
            out.printf("  [%s] %s%s: %s%n", e.severity(), e.code(), where(e.row(), e.column()), e.message());
        }
        for (ValidationWarning w : r.warnings()) {
            out.printf("  [WARNING] %s%s%n", where(w.row(), w.column()), w.message());
        }
    }

    private static String where(Integer row, String column) {
        StringBuilder sb = new StringBuilder();
        if (row != null) sb.append(" row ").append(row);
        if (column != null) sb.append(" column ").append(column);
        return sb.toString();
    }
}
