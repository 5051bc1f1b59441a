package com.stylgebra.json;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

public class JsonTreeParserTest {
    private final JsonTreeParser parser = new JsonTreeParser();

    @Test
    public void testObjectKeepsKeyOrder() throws IOException {
        JsonNode node = parser.parse("{\"z\": 1, \"a\": 2, \"m\": 3}");
        JsonNode.JsonObject obj = assertInstanceOf(JsonNode.JsonObject.class, node);
        assertEquals("z, a, m", obj.fields().keysView().makeString());
    }

    @Test
    public void testScalars() throws IOException {
        JsonNode.JsonArray array = (JsonNode.JsonArray) parser.parse("[7, 2.5, \"s\", true, null]");
        assertEquals(5, array.elements().size());
        assertEquals(7L, JsonNode.scalarValue(array.elements().get(0)));
        assertEquals(2.5, JsonNode.scalarValue(array.elements().get(1)));
        assertEquals("s", JsonNode.scalarValue(array.elements().get(2)));
        assertEquals(true, JsonNode.scalarValue(array.elements().get(3)));
        assertNull(JsonNode.scalarValue(array.elements().get(4)));
        assertThrows(IllegalArgumentException.class, () -> JsonNode.scalarValue(array));
    }

    @Test
    public void testNested() throws IOException {
        JsonNode.JsonObject obj = (JsonNode.JsonObject) parser.parse("{\"Add\": [\"x\", {\"Mul\": [-1, \"y\"]}]}");
        JsonNode.JsonArray args = (JsonNode.JsonArray) obj.get("Add");
        assertEquals(new JsonNode.JsonString("x"), args.elements().get(0));
        JsonNode.JsonObject mul = (JsonNode.JsonObject) args.elements().get(1);
        assertEquals(JsonNode.JsonNumber.of(-1L), ((JsonNode.JsonArray) mul.get("Mul")).elements().get(0));
    }

    @Test
    public void testBadInput() {
        assertThrows(IOException.class, () -> parser.parse(""));
        assertThrows(IOException.class, () -> parser.parse("{\"a\": 1"));
    }
}
