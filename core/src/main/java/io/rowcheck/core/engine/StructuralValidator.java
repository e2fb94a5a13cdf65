package io.rowcheck.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaException;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Adapter over the networknt JSON Schema engine for the generic checks (type, length, pattern,
 * enum, required). Records are validated as JSON arrays of strings against a draft-07 tuple schema
 * ({@code items} as an array), so the engine never sees numbers.
 *
 * <p>Thread-safe once compiled.
 */
public final class StructuralValidator {

    private static final JsonSchemaFactory SCHEMA_FACTORY = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final JsonSchema schema;

    private StructuralValidator(JsonSchema schema) {
        this.schema = schema;
    }

    /**
     * Compiles an array schema.
     *
     * @throws IllegalArgumentException if the engine rejects the schema
     */
    public static StructuralValidator compile(JsonNode schemaNode) {
        Objects.requireNonNull(schemaNode, "schemaNode must not be null");
        try {
            JsonSchema compiled = SCHEMA_FACTORY.getSchema(schemaNode.deepCopy());
            // Validators are built lazily; force it so a bad schema fails at load time.
            compiled.initializeValidators();
            return new StructuralValidator(compiled);
        } catch (JsonSchemaException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }

    /**
     * Validates one record.
     *
     * @return the engine's first violation message, or empty if the record conforms
     */
    public Optional<String> firstViolation(List<String> fields) {
        ArrayNode instance = NODES.arrayNode(fields.size());
        fields.forEach(instance::add);
        Set<ValidationMessage> errors = schema.validate(instance);
        return errors.stream().findFirst().map(ValidationMessage::getMessage);
    }
}
