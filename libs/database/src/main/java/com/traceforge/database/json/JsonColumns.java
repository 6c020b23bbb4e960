package com.traceforge.database.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.traceforge.database.model.PlanLimits;
import com.traceforge.database.model.UsageMetric;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Conversion between Jackson trees and PostgreSQL {@code JSON} column text.
 * <p>
 * Writes bind the JSON text as a string and rely on a {@code ?::json} cast in the statement.
 */
public final class JsonColumns {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonColumns() {
        // utility class
    }

    /** Serializes a tree to column text; {@code null} stays {@code null}. */
    public static String write(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new JsonColumnException("Failed to serialize JSON column value", e);
        }
    }

    /** Parses column text; {@code null} stays {@code null}. */
    public static JsonNode read(String text) {
        if (text == null) {
            return null;
        }
        try {
            return MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new JsonColumnException("Failed to parse JSON column value", e);
        }
    }

    /** Creates an empty object node, handy for building column values. */
    public static ObjectNode object() {
        return MAPPER.createObjectNode();
    }

    /**
     * Reads a {@code plans.limits} document such as {@code {"uploads": 5, "api_calls": -1}}.
     * Unknown keys are ignored.
     */
    public static PlanLimits readLimits(String text) {
        JsonNode node = read(text);
        Map<UsageMetric, Integer> limits = new EnumMap<>(UsageMetric.class);
        if (node != null) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                UsageMetric.fromString(field.getKey())
                        .ifPresent(metric -> limits.put(metric, field.getValue().asInt()));
            }
        }
        return new PlanLimits(limits);
    }

    /** Writes limits back in the {@code plans.limits} document shape. */
    public static String writeLimits(PlanLimits limits) {
        ObjectNode node = object();
        for (UsageMetric metric : UsageMetric.values()) {
            limits.limitFor(metric).ifPresent(limit -> node.put(metric.value(), limit));
        }
        return write(node);
    }
}
