package com.mapobserver.core.rule;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads rule schemas from {@code schemas/<ruleName>.schema.json} on the
 * classpath. Each schema is parsed once.
 */
final class RuleSchemas {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Map<String, JsonNode> CACHE = new ConcurrentHashMap<>();

    private RuleSchemas() {
        // utility class
    }

    /**
     * @param ruleName rule whose schema to load
     * @return a copy of the parsed schema
     * @throws IllegalStateException if the resource is missing or malformed
     */
    static JsonNode forRule(String ruleName) {
        Objects.requireNonNull(ruleName, "Rule name must not be null");
        return CACHE.computeIfAbsent(ruleName, RuleSchemas::load).deepCopy();
    }

    private static JsonNode load(String ruleName) {
        String resource = "schemas/" + ruleName + ".schema.json";
        InputStream is = RuleSchemas.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalStateException("Schema resource not found for rule '"
                    + ruleName + "': " + resource);
        }
        try (is) {
            JsonNode schema = MAPPER.readTree(is);
            if (schema == null || !schema.isObject()) {
                throw new IllegalStateException("Schema for rule '" + ruleName + "' is not a JSON object");
            }
            return schema;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read schema for rule '" + ruleName + "'", e);
        }
    }
}
