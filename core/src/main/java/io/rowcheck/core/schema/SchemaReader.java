package io.rowcheck.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.rowcheck.core.error.SchemaParseException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads a schema document (YAML, or JSON as a YAML subset) into a {@link JsonNode} tree. File and
 * syntax errors surface as {@link SchemaParseException}; the tree itself is not interpreted here.
 *
 * <p>An empty document yields {@link Optional#empty()}, meaning "no schema configured".
 *
 * <p>Thread-safe.
 */
public final class SchemaReader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Reads the schema document at the given path.
     *
     * @param path path to a YAML or JSON schema file
     * @return the parsed tree, or empty if the document has no content
     * @throws SchemaParseException if the file is missing, unreadable or syntactically invalid
     */
    public Optional<JsonNode> read(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        if (!Files.isRegularFile(path)) {
            throw new SchemaParseException("Schema file not found: " + source, source);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return present(YAML_MAPPER.readTree(in));
        } catch (IOException e) {
            throw new SchemaParseException("Failed to read or parse schema: " + e.getMessage(), e, source);
        }
    }

    /**
     * Parses a schema document held in memory.
     *
     * @param content YAML or JSON text
     * @param source  label used in error messages (may be {@code null})
     * @return the parsed tree, or empty if the document has no content
     * @throws SchemaParseException if the text is not valid YAML/JSON
     */
    public Optional<JsonNode> read(String content, String source) {
        Objects.requireNonNull(content, "content must not be null");
        try {
            return present(YAML_MAPPER.readTree(content));
        } catch (IOException e) {
            throw new SchemaParseException("Failed to parse schema: " + e.getMessage(), e, source);
        }
    }

    private static Optional<JsonNode> present(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return Optional.empty();
        }
        return Optional.of(root);
    }
}
