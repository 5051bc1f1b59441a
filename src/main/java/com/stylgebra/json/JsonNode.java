package com.stylgebra.json;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.MutableMap;

/**
 * A parsed JSON document. Object fields keep their document order, which rule tables
 * depend on.
 */
public sealed interface JsonNode {
    record JsonObject(MutableMap<String, JsonNode> fields) implements JsonNode {
        public JsonNode get(String key) {
            return fields.get(key);
        }
    }

    record JsonArray(ImmutableList<JsonNode> elements) implements JsonNode {}

    record JsonString(String value) implements JsonNode {}

    sealed interface JsonNumber extends JsonNode {
        Number numberValue();

        record JsonLong(long value) implements JsonNumber {
            @Override
            public Number numberValue() {
                return value;
            }
        }

        record JsonDouble(double value) implements JsonNumber {
            @Override
            public Number numberValue() {
                return value;
            }
        }

        static JsonNumber of(long value) {
            return new JsonLong(value);
        }

        static JsonNumber of(double value) {
            return new JsonDouble(value);
        }
    }

    record JsonBoolean(boolean value) implements JsonNode {}

    record JsonNull() implements JsonNode {}

    /**
     * The scalar as a plain Java value: string, long, double, boolean or null.
     *
     * @throws IllegalArgumentException for objects and arrays
     */
    static Object scalarValue(JsonNode node) {
        if (node instanceof JsonString s) {
            return s.value();
        }
        if (node instanceof JsonNumber n) {
            return n.numberValue();
        }
        if (node instanceof JsonBoolean b) {
            return b.value();
        }
        if (node instanceof JsonNull) {
            return null;
        }
        throw new IllegalArgumentException("Not a JSON scalar: " + node);
    }
}
