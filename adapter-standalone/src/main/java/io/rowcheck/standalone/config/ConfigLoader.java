package io.rowcheck.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link RunConfig} from a YAML file with an environment variable overlay.
 *
 * <p>Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code rowcheck.yaml} from the current directory</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path</li>
 * </ul>
 *
 * <p>YAML layout:
 * <pre>
 * input: data.csv
 * schema: schema.yaml
 * field-count: 3
 * dialect:
 *   delimiter: ","
 *   quote-char: "\""
 *   has-header: true
 * output:
 *   valid: "-"
 *   invalid: invalid.csv
 *   append-error-message: true
 * logging:
 *   format: text
 *   level: INFO
 * </pre>
 *
 * <p>Every key can be overridden by a {@code ROWCHECK_*} environment variable. An env var is
 * "set" if and only if it is defined AND its trimmed value is non-empty.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_CONFIG_FILE = "rowcheck.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link RunConfig} from the given YAML file, applying overrides from
     * {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, contains invalid YAML, or yields an
     *                             incomplete configuration
     */
    public static RunConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link RunConfig} from the given YAML file, applying overrides from the supplied
     * lookup function. Returning {@code null} from {@code envLookup} means "not defined".
     *
     * @throws ConfigLoadException if the file is missing, contains invalid YAML, or yields an
     *                             incomplete configuration
     */
    public static RunConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        if (root == null || root.isMissingNode()) {
            root = YAML_MAPPER.createObjectNode();
        }
        if (!root.isObject()) {
            throw new ConfigLoadException("Configuration must be a YAML mapping: " + configPath);
        }
        return mapToConfig(root, envLookup);
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @throws IllegalArgumentException if {@code --config} has no value
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static RunConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        RunConfig.Builder builder = RunConfig.builder();

        // --- YAML mapping ---

        if (root.hasNonNull("input")) builder.input(root.get("input").asText());
        if (root.hasNonNull("schema")) builder.schema(root.get("schema").asText());
        if (root.hasNonNull("field-count")) builder.fieldCount(intValue(root, "field-count"));

        JsonNode dialect = root.path("dialect");
        if (dialect.hasNonNull("delimiter"))
            builder.delimiter(singleChar("dialect.delimiter", dialect.get("delimiter").asText()));
        if (dialect.hasNonNull("quote-char"))
            builder.quoteChar(singleChar("dialect.quote-char", dialect.get("quote-char").asText()));
        if (dialect.hasNonNull("has-header"))
            builder.hasHeader(dialect.get("has-header").asBoolean());

        JsonNode output = root.path("output");
        if (output.hasNonNull("valid")) builder.validOutput(output.get("valid").asText());
        if (output.hasNonNull("invalid")) builder.invalidOutput(output.get("invalid").asText());
        if (output.hasNonNull("append-error-message"))
            builder.appendErrorMessage(output.get("append-error-message").asBoolean());

        JsonNode logging = root.path("logging");
        if (logging.hasNonNull("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.hasNonNull("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Environment variable overlay ---

        envString(envLookup, "ROWCHECK_INPUT", builder::input);
        envString(envLookup, "ROWCHECK_SCHEMA", builder::schema);
        envString(envLookup, "ROWCHECK_DELIMITER", v -> builder.delimiter(singleChar("ROWCHECK_DELIMITER", v)));
        envString(envLookup, "ROWCHECK_QUOTE_CHAR", v -> builder.quoteChar(singleChar("ROWCHECK_QUOTE_CHAR", v)));
        envBool(envLookup, "ROWCHECK_HAS_HEADER", builder::hasHeader);
        envString(envLookup, "ROWCHECK_FIELD_COUNT", v -> builder.fieldCount(parseInt("ROWCHECK_FIELD_COUNT", v)));
        envString(envLookup, "ROWCHECK_VALID_OUTPUT", builder::validOutput);
        envString(envLookup, "ROWCHECK_INVALID_OUTPUT", builder::invalidOutput);
        envBool(envLookup, "ROWCHECK_APPEND_ERROR_MESSAGE", builder::appendErrorMessage);
        envString(envLookup, "ROWCHECK_LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "ROWCHECK_LOG_LEVEL", builder::loggingLevel);

        return builder.build();
    }

    /**
     * Resolves a one-character setting. {@code \t} and {@code tab} both mean a tab character;
     * YAML may already have unescaped it.
     */
    static char singleChar(String setting, String value) {
        if ("\\t".equals(value) || "tab".equalsIgnoreCase(value)) {
            return '\t';
        }
        if (value.length() != 1) {
            throw new ConfigLoadException("'" + setting + "' must be a single character but is: '" + value + "'");
        }
        return value.charAt(0);
    }

    private static Integer intValue(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value.isIntegralNumber()) {
            return value.intValue();
        }
        return parseInt(field, value.asText());
    }

    private static Integer parseInt(String setting, String value) {
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigLoadException("'" + setting + "' must be an integer but is: '" + value + "'", e);
        }
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is "set": defined AND non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    /** Applies a string env var override if set. */
    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    /** Applies a boolean env var override if set. */
    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
