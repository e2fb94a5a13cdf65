package io.rowcheck.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.rowcheck.core.engine.StructuralValidator;
import io.rowcheck.core.error.SchemaDefinitionException;
import io.rowcheck.core.model.FieldRule;
import io.rowcheck.core.model.NumericKind;
import io.rowcheck.core.model.Schema;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks a raw schema tree for internal consistency and turns it into a typed {@link Schema}.
 * Runs once, at startup; any violation is a fatal {@link SchemaDefinitionException} and no record
 * may be processed afterwards.
 *
 * <p>Checks run in this order and the first violation wins:
 * <ol>
 * <li>the document holds exactly one top-level attribute, {@code items}, a sequence of rules;</li>
 * <li>every rule key is recognized; look-alike generic-engine keys such as {@code minimum} are
 * reported as <em>unsupported</em>, anything else as <em>unknown</em>;</li>
 * <li>{@code required} and {@code blank} are booleans;</li>
 * <li>{@code numericKind} is one of {@code integer}, {@code float}, {@code string};</li>
 * <li>{@code numericMinimum}/{@code numericMaximum} have a numeric {@code numericKind} and coerce
 * to it.</li>
 * </ol>
 *
 * <p>Stateless and thread-safe.
 */
public final class SchemaValidator {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaValidator.class);

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    /** The single top-level attribute of a schema document. */
    public static final String ITEMS = "items";

    static final String TYPE = "type";
    static final String TITLE = "title";
    static final String DESCRIPTION = "description";
    static final String MIN_LENGTH = "minLength";
    static final String MAX_LENGTH = "maxLength";
    static final String PATTERN = "pattern";
    static final String ENUM = "enum";
    static final String REQUIRED = "required";
    static final String BLANK = "blank";
    static final String NUMERIC_KIND = "numericKind";
    static final String NUMERIC_MINIMUM = "numericMinimum";
    static final String NUMERIC_MAXIMUM = "numericMaximum";

    /** Recognized field-rule keys. */
    static final Set<String> KNOWN_RULE_KEYS = Set.of(
            TYPE,
            TITLE,
            DESCRIPTION,
            MIN_LENGTH,
            MAX_LENGTH,
            PATTERN,
            ENUM,
            REQUIRED,
            BLANK,
            NUMERIC_KIND,
            NUMERIC_MINIMUM,
            NUMERIC_MAXIMUM);

    // Generic-engine keywords that look valid but cannot work on text values.
    // Mapped to the replacement key, or "" when there is none.
    static final Map<String, String> UNSUPPORTED_RULE_KEYS = Map.of(
            "minimum", NUMERIC_MINIMUM,
            "maximum", NUMERIC_MAXIMUM,
            "exclusiveMinimum", "",
            "exclusiveMaximum", "",
            "multipleOf", "",
            "divisibleBy", "",
            "format", "");

    private static final Set<String> JSON_SCHEMA_TYPES =
            Set.of("string", "number", "integer", "boolean", "array", "object", "null");

    /**
     * Validates a raw schema tree.
     *
     * @param root   the parsed schema document, or {@code null} when no schema is configured
     * @param source file path or label used in error messages (may be {@code null})
     * @return the typed schema, or empty when {@code root} is absent
     * @throws SchemaDefinitionException on the first consistency violation
     */
    public Optional<Schema> validate(JsonNode root, String source) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            LOG.debug("No schema configured; records are checked for field count only");
            return Optional.empty();
        }
        JsonNode items = requireItems(root, source);

        List<FieldRule> rules = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            rules.add(validateRule(items.get(i), i, source));
        }

        JsonNode structuralSchema = buildStructuralSchema(rules);
        StructuralValidator structuralValidator;
        try {
            structuralValidator = StructuralValidator.compile(structuralSchema);
        } catch (IllegalArgumentException e) {
            throw new SchemaDefinitionException(
                    "Schema is not usable by the structural validator: " + e.getMessage(), e, -1, null, source);
        }

        Schema schema = new Schema(rules, structuralSchema, structuralValidator, source);
        LOG.info(
                "Schema accepted: rules={}, numeric={}, source={}",
                rules.size(),
                rules.stream().filter(FieldRule::isNumeric).count(),
                source);
        return Optional.of(schema);
    }

    private JsonNode requireItems(JsonNode root, String source) {
        if (!root.isObject()) {
            throw new SchemaDefinitionException(
                    "Schema must be a mapping with a single '" + ITEMS + "' attribute but is a "
                            + root.getNodeType().name().toLowerCase(Locale.ROOT),
                    -1,
                    null,
                    source);
        }
        List<String> topLevel = fieldNames(root);
        if (topLevel.size() != 1) {
            throw new SchemaDefinitionException(
                    "Schema must have exactly one top-level attribute ('" + ITEMS + "') but has "
                            + topLevel.size() + ": " + topLevel,
                    -1,
                    null,
                    source);
        }
        String key = topLevel.get(0);
        if (!ITEMS.equals(key)) {
            throw new SchemaDefinitionException(
                    "Unknown top-level attribute '" + key + "': expected '" + ITEMS + "'", -1, key, source);
        }
        JsonNode items = root.get(ITEMS);
        if (!items.isArray()) {
            throw new SchemaDefinitionException(
                    "'" + ITEMS + "' must be a sequence of field rules", -1, ITEMS, source);
        }
        return items;
    }

    private FieldRule validateRule(JsonNode ruleNode, int index, String source) {
        if (ruleNode == null || !ruleNode.isObject()) {
            throw new SchemaDefinitionException(
                    "Field rule " + index + " must be a mapping", index, null, source);
        }
        String label = ruleLabel(ruleNode, index);

        for (String key : fieldNames(ruleNode)) {
            if (KNOWN_RULE_KEYS.contains(key)) {
                continue;
            }
            String replacement = UNSUPPORTED_RULE_KEYS.get(key);
            if (replacement != null) {
                String hint = replacement.isEmpty() ? "" : "; use '" + replacement + "' with '" + NUMERIC_KIND + "'";
                throw new SchemaDefinitionException(
                        "Unsupported key '" + key + "' in " + label
                                + ": this generic-engine keyword cannot be evaluated on text values"
                                + hint,
                        index,
                        key,
                        source);
            }
            throw new SchemaDefinitionException(
                    "Unknown key '" + key + "' in " + label + "; recognized keys are: " + sorted(KNOWN_RULE_KEYS),
                    index,
                    key,
                    source);
        }

        requireBoolean(ruleNode, REQUIRED, label, index, source);
        requireBoolean(ruleNode, BLANK, label, index, source);

        NumericKind kind = null;
        JsonNode kindNode = ruleNode.get(NUMERIC_KIND);
        if (kindNode != null) {
            kind = (kindNode.isTextual() ? NumericKind.fromKeyword(kindNode.asText()) : Optional.<NumericKind>empty())
                    .orElseThrow(() -> invalidValue(
                            NUMERIC_KIND, "must be one of [integer, float, string]", kindNode, label, index, source));
        }

        BigDecimal minimum = parseLimit(ruleNode, NUMERIC_MINIMUM, kind, label, index, source);
        BigDecimal maximum = parseLimit(ruleNode, NUMERIC_MAXIMUM, kind, label, index, source);
        if (minimum != null && maximum != null && minimum.compareTo(maximum) > 0) {
            throw new SchemaDefinitionException(
                    "'" + NUMERIC_MINIMUM + "' (" + minimum.toPlainString() + ") is greater than '" + NUMERIC_MAXIMUM
                            + "' (" + maximum.toPlainString() + ") in " + label,
                    index,
                    NUMERIC_MINIMUM,
                    source);
        }

        ObjectNode structural = delegatedConstraints(ruleNode, label, index, source);
        String title = optionalText(ruleNode, TITLE);
        String description = optionalText(ruleNode, DESCRIPTION);
        boolean required = ruleNode.path(REQUIRED).booleanValue();
        return new FieldRule(index, title, description, required, kind, minimum, maximum, structural);
    }

    /** Limits are pre-parsed here so the per-record range check only compares. */
    private BigDecimal parseLimit(
            JsonNode ruleNode, String key, NumericKind kind, String label, int index, String source) {
        JsonNode limitNode = ruleNode.get(key);
        if (limitNode == null) {
            return null;
        }
        if (kind == null) {
            throw new SchemaDefinitionException(
                    "'" + key + "' in " + label + " requires '" + NUMERIC_KIND + "' to be declared", index, key, source);
        }
        if (!kind.isNumeric()) {
            throw new SchemaDefinitionException(
                    "'" + key + "' in " + label + " requires '" + NUMERIC_KIND + "' of integer or float but is: "
                            + kind.keyword(),
                    index,
                    key,
                    source);
        }
        BigDecimal value = coerceLimit(limitNode, kind);
        if (value == null) {
            throw new SchemaDefinitionException(
                    "'" + key + "' in " + label + " is not a valid " + kind.keyword() + ": " + limitNode,
                    index,
                    key,
                    source);
        }
        return value;
    }

    private static BigDecimal coerceLimit(JsonNode limitNode, NumericKind kind) {
        if (limitNode.isTextual()) {
            return kind.coerce(limitNode.asText());
        }
        if (!limitNode.isNumber()) {
            return null;
        }
        if (kind == NumericKind.INTEGER) {
            if (limitNode.isIntegralNumber()) {
                return new BigDecimal(limitNode.bigIntegerValue());
            }
            BigDecimal decimal = limitNode.decimalValue().stripTrailingZeros();
            return decimal.scale() <= 0 ? decimal : null;
        }
        return limitNode.decimalValue();
    }

    /**
     * Copies the keys the generic structural validator evaluates into a per-column JSON Schema.
     * {@code blank: false} becomes a minimum length of one.
     */
    private ObjectNode delegatedConstraints(JsonNode ruleNode, String label, int index, String source) {
        ObjectNode structural = NODES.objectNode();

        JsonNode type = ruleNode.get(TYPE);
        if (type != null) {
            if (!isValidType(type)) {
                throw invalidValue(TYPE, "must be a JSON Schema type name", type, label, index, source);
            }
            structural.set(TYPE, type);
        }

        Integer minLength = optionalLength(ruleNode, MIN_LENGTH, label, index, source);
        Integer maxLength = optionalLength(ruleNode, MAX_LENGTH, label, index, source);
        if (minLength != null && maxLength != null && minLength > maxLength) {
            throw new SchemaDefinitionException(
                    "'" + MIN_LENGTH + "' (" + minLength + ") is greater than '" + MAX_LENGTH + "' (" + maxLength
                            + ") in " + label,
                    index,
                    MIN_LENGTH,
                    source);
        }
        JsonNode blank = ruleNode.get(BLANK);
        if (blank != null && !blank.booleanValue()) {
            minLength = minLength == null ? 1 : Math.max(minLength, 1);
        }
        if (minLength != null) {
            structural.put(MIN_LENGTH, minLength);
        }
        if (maxLength != null) {
            structural.put(MAX_LENGTH, maxLength);
        }

        JsonNode pattern = ruleNode.get(PATTERN);
        if (pattern != null) {
            if (!pattern.isTextual()) {
                throw invalidValue(PATTERN, "must be a regular expression string", pattern, label, index, source);
            }
            try {
                Pattern.compile(pattern.asText());
            } catch (PatternSyntaxException e) {
                throw new SchemaDefinitionException(
                        "Invalid value for '" + PATTERN + "' in " + label + ": " + e.getDescription(),
                        e,
                        index,
                        PATTERN,
                        source);
            }
            structural.set(PATTERN, pattern);
        }

        JsonNode enumNode = ruleNode.get(ENUM);
        if (enumNode != null) {
            if (!enumNode.isArray() || enumNode.isEmpty()) {
                throw invalidValue(ENUM, "must be a non-empty sequence", enumNode, label, index, source);
            }
            ArrayNode values = NODES.arrayNode();
            enumNode.forEach(value -> values.add(value.isValueNode() ? value.asText() : value.toString()));
            structural.set(ENUM, values);
        }

        copyText(ruleNode, TITLE, structural);
        copyText(ruleNode, DESCRIPTION, structural);
        return structural;
    }

    /**
     * Wraps the per-column schemas into a tuple-style array schema. The last {@code required} rule
     * sets the minimum record length.
     */
    private static JsonNode buildStructuralSchema(List<FieldRule> rules) {
        ObjectNode root = NODES.objectNode();
        root.put(TYPE, "array");
        ArrayNode items = root.putArray(ITEMS);
        int minItems = 0;
        for (FieldRule rule : rules) {
            items.add(rule.structural());
            if (rule.required()) {
                minItems = rule.index() + 1;
            }
        }
        if (minItems > 0) {
            root.put("minItems", minItems);
        }
        return root;
    }

    // --- helpers ---

    private static void requireBoolean(JsonNode ruleNode, String key, String label, int index, String source) {
        JsonNode value = ruleNode.get(key);
        if (value != null && !value.isBoolean()) {
            throw invalidValue(key, "must be true or false", value, label, index, source);
        }
    }

    private static Integer optionalLength(JsonNode ruleNode, String key, String label, int index, String source) {
        JsonNode value = ruleNode.get(key);
        if (value == null) {
            return null;
        }
        if (!value.canConvertToInt() || !value.isIntegralNumber() || value.intValue() < 0) {
            throw invalidValue(key, "must be a non-negative integer", value, label, index, source);
        }
        return value.intValue();
    }

    private static boolean isValidType(JsonNode type) {
        if (type.isTextual()) {
            return JSON_SCHEMA_TYPES.contains(type.asText());
        }
        if (type.isArray() && !type.isEmpty()) {
            for (JsonNode member : type) {
                if (!member.isTextual() || !JSON_SCHEMA_TYPES.contains(member.asText())) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    private static SchemaDefinitionException invalidValue(
            String key, String expectation, JsonNode actual, String label, int index, String source) {
        return new SchemaDefinitionException(
                "Invalid value for '" + key + "' in " + label + ": " + expectation + " but is: " + actual,
                index,
                key,
                source);
    }

    private static String ruleLabel(JsonNode ruleNode, int index) {
        JsonNode title = ruleNode.get(TITLE);
        return title != null && title.isValueNode() && !title.isNull()
                ? "field rule " + index + " (" + title.asText() + ")"
                : "field rule " + index;
    }

    private static String optionalText(JsonNode node, String key) {
        JsonNode value = node.get(key);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static void copyText(JsonNode from, String key, ObjectNode to) {
        String value = optionalText(from, key);
        if (value != null) {
            to.put(key, value);
        }
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }

    private static List<String> sorted(Set<String> keys) {
        return keys.stream().sorted().collect(Collectors.toList());
    }
}
