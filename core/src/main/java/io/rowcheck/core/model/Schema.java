package io.rowcheck.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.rowcheck.core.engine.StructuralValidator;
import java.util.List;
import java.util.Objects;

/**
 * A validated schema: one {@link FieldRule} per expected column, in column order, plus the JSON
 * Schema document for the generic structural validator built from those rules, together with its
 * compiled form. Immutable: the JSON document is copied in and handed out only as a copy, so the
 * compiled validator always matches the rules.
 *
 * <p>Instances are produced by {@link io.rowcheck.core.schema.SchemaValidator}; a {@code Schema}
 * object is trusted by construction.
 */
public final class Schema {

    private final List<FieldRule> rules;
    private final JsonNode structuralSchema;
    private final StructuralValidator structuralValidator;
    private final String source;

    public Schema(
            List<FieldRule> rules, JsonNode structuralSchema, StructuralValidator structuralValidator, String source) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules must not be null"));
        this.structuralSchema =
                Objects.requireNonNull(structuralSchema, "structuralSchema must not be null").deepCopy();
        this.structuralValidator =
                Objects.requireNonNull(structuralValidator, "structuralValidator must not be null");
        this.source = source;
    }

    /** Field rules in column order. */
    public List<FieldRule> rules() {
        return rules;
    }

    /** Number of columns the schema describes. */
    public int size() {
        return rules.size();
    }

    /** Array schema for the generic structural validator ({@code items} as a tuple). */
    public JsonNode structuralSchema() {
        return structuralSchema.deepCopy();
    }

    /** The structural schema, compiled once at load time. Thread-safe. */
    public StructuralValidator structuralValidator() {
        return structuralValidator;
    }

    /** Where the schema was loaded from, or {@code null}. */
    public String source() {
        return source;
    }

    @Override
    public String toString() {
        return "Schema{rules=" + rules.size() + ", source=" + source + "}";
    }
}
