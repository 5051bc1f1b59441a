package com.stylgebra.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.map.mutable.MapAdapter;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;

public class JsonTreeParser {
    private final JsonFactory factory = new JsonFactory();

    public JsonNode parse(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            return parseValue(parser, parser.nextToken());
        }
    }

    public JsonNode parse(String json) throws IOException {
        try (JsonParser parser = factory.createParser(json)) {
            return parseValue(parser, parser.nextToken());
        }
    }

    private JsonNode parseValue(JsonParser parser, JsonToken token) throws IOException {
        if (token == null) {
            throw new IOException("Unexpected end of JSON input");
        }
        return switch (token) {
            case START_OBJECT -> parseObject(parser);
            case START_ARRAY -> parseArray(parser);
            case VALUE_STRING -> new JsonNode.JsonString(parser.getText());
            case VALUE_NUMBER_INT -> JsonNode.JsonNumber.of(parser.getLongValue());
            case VALUE_NUMBER_FLOAT -> JsonNode.JsonNumber.of(parser.getDoubleValue());
            case VALUE_TRUE -> new JsonNode.JsonBoolean(true);
            case VALUE_FALSE -> new JsonNode.JsonBoolean(false);
            case VALUE_NULL -> new JsonNode.JsonNull();
            default -> throw new IOException("Unexpected JSON token: " + token);
        };
    }

    private JsonNode.JsonObject parseObject(JsonParser parser) throws IOException {
        MutableMap<String, JsonNode> fields = MapAdapter.adapt(new LinkedHashMap<>());

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.getCurrentName();
            fields.put(fieldName, parseValue(parser, parser.nextToken()));
        }

        return new JsonNode.JsonObject(fields);
    }

    private JsonNode.JsonArray parseArray(JsonParser parser) throws IOException {
        MutableList<JsonNode> elements = Lists.mutable.empty();

        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            elements.add(parseValue(parser, token));
        }

        return new JsonNode.JsonArray(elements.toImmutable());
    }
}
