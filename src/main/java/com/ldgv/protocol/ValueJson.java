package com.ldgv.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ldgv.script.parser.Value;

/**
 * JSON-safe rendering of evaluation results for host transport.
 *
 * Shape:
 *   {"type":"unit"}
 *   {"type":"label","value":"Ok"}
 *   {"type":"int","value":42}
 *   {"type":"pair","first":{...},"second":{...}}
 *   {"type":"function"} / {"type":"channel","id":"..."}
 *
 * Functions and channels have no portable representation; only their kind
 * (and a channel identity for correlation) is exported.
 */
public final class ValueJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ValueJson() {}

    public static JsonNode toJson(Value v) {
        ObjectNode node = MAPPER.createObjectNode();
        switch (v.getType()) {
            case UNIT:
                node.put("type", "unit");
                break;
            case LABEL:
                node.put("type", "label");
                node.put("value", v.asLabel());
                break;
            case INT:
                node.put("type", "int");
                node.put("value", v.asInt());
                break;
            case PAIR: {
                Value.Pair p = v.asPair();
                node.put("type", "pair");
                node.set("first", toJson(p.first));
                node.set("second", toJson(p.second));
                break;
            }
            case FUNC:
                node.put("type", "function");
                break;
            case CHANNEL:
                node.put("type", "channel");
                node.put("id", v.asChannel().toString());
                break;
            default:
                throw new IllegalArgumentException("Value has no JSON form: " + v.getType());
        }
        return node;
    }

    public static String toJsonString(Value v) {
        try {
            return MAPPER.writeValueAsString(toJson(v));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize value: " + e.getMessage(), e);
        }
    }

    /** Inverse of {@link #toJson} for the data-only kinds (unit, label, int, pair). */
    public static Value fromJson(JsonNode node) {
        String type = node.path("type").asText("");
        switch (type) {
            case "unit":
                return Value.unit();
            case "label":
                return Value.label(node.path("value").asText());
            case "int":
                if (!node.path("value").canConvertToLong()) {
                    throw new IllegalArgumentException("int value out of range: " + node.path("value"));
                }
                return Value.integer(node.path("value").asLong());
            case "pair":
                return Value.pair(fromJson(node.path("first")), fromJson(node.path("second")));
            default:
                throw new IllegalArgumentException("Cannot import value of type '" + type + "'");
        }
    }

    public static Value fromJsonString(String json) {
        try {
            return fromJson(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed value JSON: " + e.getOriginalMessage(), e);
        }
    }
}
