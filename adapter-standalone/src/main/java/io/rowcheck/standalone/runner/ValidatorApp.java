package io.rowcheck.standalone.runner;

import io.rowcheck.core.engine.RecordValidator;
import io.rowcheck.core.engine.ValidationRun;
import io.rowcheck.core.error.RecordReadException;
import io.rowcheck.core.error.SchemaLoadException;
import io.rowcheck.core.model.RunStats;
import io.rowcheck.core.model.Schema;
import io.rowcheck.core.schema.SchemaReader;
import io.rowcheck.core.schema.SchemaValidator;
import io.rowcheck.core.spi.RecordSink;
import io.rowcheck.core.spi.RecordSource;
import io.rowcheck.standalone.config.ConfigLoadException;
import io.rowcheck.standalone.config.ConfigLoader;
import io.rowcheck.standalone.config.RunConfig;
import io.rowcheck.standalone.csv.CsvDialect;
import io.rowcheck.standalone.csv.CsvRecordSink;
import io.rowcheck.standalone.csv.CsvRecordSource;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates one validation run.
 *
 * <p>Lifecycle:
 * <ol>
 * <li>Load configuration from YAML + env overlay</li>
 * <li>Configure Logback</li>
 * <li>Read and validate the schema (fatal on error, before any record is read)</li>
 * <li>Open the input and the valid/invalid outputs</li>
 * <li>Stream every record through the {@link RecordValidator}</li>
 * <li>Map the tallies to an {@link ExitStatus}</li>
 * </ol>
 *
 * <p>Separate from {@link io.rowcheck.standalone.StandaloneMain} so it can be tested without
 * going through {@code main()}.
 */
public final class ValidatorApp {

    private static final Logger LOG = LoggerFactory.getLogger(ValidatorApp.class);

    private final RunConfig config;
    private final PrintStream stdout;
    private final PrintStream stderr;

    public ValidatorApp(RunConfig config) {
        this(config, System.out, System.err);
    }

    /** Creates an app whose {@code -} outputs go to the given streams. */
    public ValidatorApp(RunConfig config, PrintStream stdout, PrintStream stderr) {
        this.config = config;
        this.stdout = stdout;
        this.stderr = stderr;
    }

    /**
     * Loads configuration from the command line and runs.
     *
     * @param args command-line arguments (e.g. {@code --config path/to/rowcheck.yaml})
     * @return the process exit status
     */
    public static ExitStatus start(String[] args) {
        RunConfig config;
        Path configPath;
        try {
            configPath = ConfigLoader.resolveConfigPath(args);
            config = ConfigLoader.load(configPath);
        } catch (ConfigLoadException | IllegalArgumentException e) {
            LOG.error("Configuration error: {}", e.getMessage());
            return ExitStatus.CONFIG_ERROR;
        }
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("Configuration loaded from {}", configPath);
        return new ValidatorApp(config).run();
    }

    /**
     * Executes the run.
     *
     * @return the process exit status; never throws for configuration, schema or I/O failures
     */
    public ExitStatus run() {
        RecordValidator validator;
        try {
            validator = RecordValidator.builder()
                    .schema(loadSchema().orElse(null))
                    .expectedFieldCount(config.fieldCount())
                    .build();
            requireInput();
        } catch (SchemaLoadException e) {
            LOG.error("Schema rejected: {}", e.getMessage());
            return ExitStatus.CONFIG_ERROR;
        } catch (ConfigLoadException e) {
            LOG.error("Configuration error: {}", e.getMessage());
            return ExitStatus.CONFIG_ERROR;
        }

        CsvDialect dialect = config.dialect();
        try (RecordSource source = openSource(dialect);
                RecordSink valid = openSink(config.validOutput(), stdout, dialect);
                RecordSink invalid = openSink(config.invalidOutput(), stderr, dialect)) {
            RunStats stats = new ValidationRun(validator, valid, invalid, config.appendErrorMessage()).run(source);
            ExitStatus status = ExitStatus.of(stats);
            if (status == ExitStatus.NO_DATA) {
                LOG.warn("No records found in input {}", config.input());
            }
            return status;
        } catch (RecordReadException e) {
            LOG.error("Processing stopped: {}", e.getMessage());
            return ExitStatus.IO_ERROR;
        } catch (IOException e) {
            LOG.error("Failed to close input or output: {}", e.getMessage());
            return ExitStatus.IO_ERROR;
        }
    }

    private Optional<Schema> loadSchema() {
        if (config.schema() == null) {
            LOG.info("No schema configured");
            return Optional.empty();
        }
        Path schemaPath = Path.of(config.schema());
        return new SchemaReader()
                .read(schemaPath)
                .flatMap(root -> new SchemaValidator().validate(root, schemaPath.toString()));
    }

    private void requireInput() {
        if (!RunConfig.STANDARD_STREAM.equals(config.input()) && !Files.isRegularFile(Path.of(config.input()))) {
            throw new ConfigLoadException("Input file not found: " + config.input());
        }
    }

    private RecordSource openSource(CsvDialect dialect) {
        if (RunConfig.STANDARD_STREAM.equals(config.input())) {
            return CsvRecordSource.stdin(dialect);
        }
        return CsvRecordSource.open(Path.of(config.input()), dialect);
    }

    private static RecordSink openSink(String output, PrintStream standard, CsvDialect dialect) {
        if (output == null || RunConfig.DISCARD.equalsIgnoreCase(output)) {
            return RecordSink.discard();
        }
        if (RunConfig.STANDARD_STREAM.equals(output)) {
            return CsvRecordSink.standardStream(standard, dialect);
        }
        return CsvRecordSink.create(Path.of(output), dialect);
    }
}
