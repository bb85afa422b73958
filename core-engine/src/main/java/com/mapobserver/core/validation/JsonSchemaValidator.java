package com.mapobserver.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.LongNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Validates Jackson trees against the JSON-Schema subset used by rule
 * configurations.
 *
 * <h3>Supported keywords</h3>
 * <p>
 * {@code type}, {@code properties}, {@code items}, {@code required},
 * {@code additionalProperties} (boolean or schema), {@code minItems},
 * {@code maxItems}, {@code uniqueItems}, {@code minimum}, {@code enum},
 * {@code pattern} and {@code minProperties}. Unknown keywords such as
 * {@code description} are ignored.
 * </p>
 *
 * <h3>Type coercion</h3>
 * <p>
 * Primitive mismatches are coerced before any other check: numeric strings
 * satisfy {@code integer} / {@code number}, and {@code "true"} /
 * {@code "false"} satisfy {@code boolean}. The instance itself is never
 * modified.
 * </p>
 *
 * <h3>Messages</h3>
 * <p>
 * Every violation yields one message of the form {@code [path] message},
 * where {@code path} uses {@code a.b[0]} notation.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Instances are thread-safe; compiled patterns are cached in a concurrent
 * map.
 * </p>
 *
 * @since 1.0.0
 */
public final class JsonSchemaValidator {

    private static final Pattern INTEGER_TEXT = Pattern.compile("^-?\\d+$");
    private static final Pattern NUMBER_TEXT = Pattern.compile("^-?\\d+(\\.\\d+)?([eE][+-]?\\d+)?$");

    private final Map<String, Pattern> patternCache = new ConcurrentHashMap<>();

    /**
     * Validate {@code instance} against {@code schema}, reporting paths
     * relative to the root.
     *
     * @param instance the value to validate; must not be {@code null}
     * @param schema   the schema; must not be {@code null}
     * @return every violation found, empty if valid
     */
    public List<String> validate(JsonNode instance, JsonNode schema) {
        return validate(instance, schema, "");
    }

    /**
     * Validate {@code instance} against {@code schema}, prefixing every
     * reported path with {@code rootPath}.
     *
     * @param instance the value to validate; must not be {@code null}
     * @param schema   the schema; must not be {@code null}
     * @param rootPath path of {@code instance} inside its enclosing document
     * @return every violation found, empty if valid
     */
    public List<String> validate(JsonNode instance, JsonNode schema, String rootPath) {
        Objects.requireNonNull(instance, "Instance must not be null");
        Objects.requireNonNull(schema, "Schema must not be null");
        List<String> errors = new ArrayList<>();
        check(instance, schema, rootPath == null ? "" : rootPath, errors);
        return errors;
    }

    // ---------------------------------------------------------------
    // Keyword checks
    // ---------------------------------------------------------------

    private void check(JsonNode instance, JsonNode schema, String path, List<String> errors) {
        if (!schema.isObject() || schema.isEmpty()) {
            return;
        }

        JsonNode value = instance;
        JsonNode type = schema.get("type");
        if (type != null && type.isTextual()) {
            Optional<JsonNode> coerced = coerce(instance, type.asText());
            if (coerced.isEmpty()) {
                errors.add(message(path, describe(instance) + " value found, but "
                        + withArticle(type.asText()) + " is required"));
                return;
            }
            value = coerced.get();
        }

        checkEnum(value, schema.get("enum"), path, errors);
        checkPattern(value, schema.get("pattern"), path, errors);
        checkMinimum(value, schema.get("minimum"), path, errors);

        if (value.isArray()) {
            checkArray(value, schema, path, errors);
        } else if (value.isObject()) {
            checkObject(value, schema, path, errors);
        }
    }

    private void checkEnum(JsonNode value, JsonNode allowed, String path, List<String> errors) {
        if (allowed == null || !allowed.isArray()) {
            return;
        }
        for (JsonNode candidate : allowed) {
            if (sameValue(candidate, value)) {
                return;
            }
        }
        errors.add(message(path, "Does not have a value in the enumeration " + allowed));
    }

    private void checkPattern(JsonNode value, JsonNode pattern, String path, List<String> errors) {
        if (pattern == null || !pattern.isTextual() || !value.isTextual()) {
            return;
        }
        Pattern compiled;
        try {
            compiled = patternCache.computeIfAbsent(pattern.asText(), Pattern::compile);
        } catch (PatternSyntaxException e) {
            errors.add(message(path, "Schema pattern is not a valid regex: " + pattern.asText()));
            return;
        }
        if (!compiled.matcher(value.asText()).find()) {
            errors.add(message(path, "Does not match the regex pattern " + pattern.asText()));
        }
    }

    private void checkMinimum(JsonNode value, JsonNode minimum, String path, List<String> errors) {
        if (minimum == null || !minimum.isNumber() || !value.isNumber()) {
            return;
        }
        if (value.decimalValue().compareTo(minimum.decimalValue()) < 0) {
            errors.add(message(path,
                    "Must have a minimum value greater than or equal to " + minimum.asText()));
        }
    }

    private void checkArray(JsonNode array, JsonNode schema, String path, List<String> errors) {
        JsonNode minItems = schema.get("minItems");
        if (minItems != null && minItems.canConvertToInt() && array.size() < minItems.asInt()) {
            errors.add(message(path,
                    "There must be a minimum of " + minItems.asInt() + " items in the array"));
        }
        JsonNode maxItems = schema.get("maxItems");
        if (maxItems != null && maxItems.canConvertToInt() && array.size() > maxItems.asInt()) {
            errors.add(message(path,
                    "There must be a maximum of " + maxItems.asInt() + " items in the array"));
        }
        if (schema.path("uniqueItems").asBoolean(false) && hasDuplicates(array)) {
            errors.add(message(path, "There are no duplicates allowed in the array"));
        }
        JsonNode items = schema.get("items");
        if (items != null && items.isObject()) {
            for (int i = 0; i < array.size(); i++) {
                check(array.get(i), items, path + "[" + i + "]", errors);
            }
        }
    }

    private void checkObject(JsonNode object, JsonNode schema, String path, List<String> errors) {
        JsonNode minProperties = schema.get("minProperties");
        if (minProperties != null && minProperties.canConvertToInt()
                && object.size() < minProperties.asInt()) {
            errors.add(message(path,
                    "Must contain a minimum of " + minProperties.asInt() + " properties"));
        }

        JsonNode required = schema.get("required");
        if (required != null && required.isArray()) {
            for (JsonNode name : required) {
                if (!object.has(name.asText())) {
                    errors.add(message(child(path, name.asText()),
                            "The property " + name.asText() + " is required"));
                }
            }
        }

        JsonNode properties = schema.path("properties");
        JsonNode additional = schema.get("additionalProperties");
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String fieldPath = child(path, field.getKey());
            JsonNode propertySchema = properties.get(field.getKey());
            if (propertySchema != null) {
                check(field.getValue(), propertySchema, fieldPath, errors);
            } else if (additional != null && additional.isBoolean() && !additional.asBoolean()) {
                errors.add(message(path, "The property " + field.getKey()
                        + " is not defined and the definition does not allow additional properties"));
            } else if (additional != null && additional.isObject()) {
                check(field.getValue(), additional, fieldPath, errors);
            }
        }
    }

    // ---------------------------------------------------------------
    // Coercion & comparison
    // ---------------------------------------------------------------

    private static Optional<JsonNode> coerce(JsonNode value, String type) {
        switch (type) {
            case "object":
                return value.isObject() ? Optional.of(value) : Optional.empty();
            case "array":
                return value.isArray() ? Optional.of(value) : Optional.empty();
            case "string":
                return value.isTextual() ? Optional.of(value) : Optional.empty();
            case "null":
                return value.isNull() ? Optional.of(value) : Optional.empty();
            case "integer":
                if (value.isNumber() && value.canConvertToExactIntegral()) {
                    return Optional.of(value);
                }
                if (value.isTextual() && INTEGER_TEXT.matcher(value.asText().trim()).matches()
                        && value.asText().trim().length() < 19) {
                    return Optional.of(LongNode.valueOf(Long.parseLong(value.asText().trim())));
                }
                return Optional.empty();
            case "number":
                if (value.isNumber()) {
                    return Optional.of(value);
                }
                if (value.isTextual() && NUMBER_TEXT.matcher(value.asText().trim()).matches()) {
                    return Optional.of(DecimalNode.valueOf(new BigDecimal(value.asText().trim())));
                }
                return Optional.empty();
            case "boolean":
                if (value.isBoolean()) {
                    return Optional.of(value);
                }
                if (value.isTextual() && ("true".equals(value.asText()) || "false".equals(value.asText()))) {
                    return Optional.of(BooleanNode.valueOf(Boolean.parseBoolean(value.asText())));
                }
                return Optional.empty();
            default:
                // Unknown type keyword: not enforced
                return Optional.of(value);
        }
    }

    private static boolean sameValue(JsonNode a, JsonNode b) {
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue()) == 0;
        }
        return a.equals(b);
    }

    private static boolean hasDuplicates(JsonNode array) {
        Set<String> seen = new HashSet<>();
        for (JsonNode element : array) {
            String key = element.isNumber()
                    ? "n:" + element.decimalValue().stripTrailingZeros().toPlainString()
                    : element.toString();
            if (!seen.add(key)) {
                return true;
            }
        }
        return false;
    }

    // ---------------------------------------------------------------
    // Formatting
    // ---------------------------------------------------------------

    private static String describe(JsonNode node) {
        String type;
        if (node.isIntegralNumber()) {
            type = "integer";
        } else if (node.isNumber()) {
            type = "number";
        } else if (node.isTextual()) {
            type = "string";
        } else {
            type = node.getNodeType().name().toLowerCase(Locale.ROOT);
        }
        return Character.toUpperCase(type.charAt(0)) + type.substring(1);
    }

    private static String withArticle(String type) {
        char first = type.isEmpty() ? 'x' : Character.toLowerCase(type.charAt(0));
        boolean vowel = "aeiou".indexOf(first) >= 0;
        return (vowel ? "an " : "a ") + type;
    }

    private static String child(String path, String name) {
        return path.isEmpty() ? name : path + "." + name;
    }

    private static String message(String path, String text) {
        return "[" + path + "] " + text;
    }
}
