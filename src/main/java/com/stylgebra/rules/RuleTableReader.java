package com.stylgebra.rules;

import com.stylgebra.adapt.SymbolicAdapter;
import com.stylgebra.adapt.SymbolicExprParser;
import com.stylgebra.error.StylgebraException;
import com.stylgebra.json.JsonNode;
import com.stylgebra.json.JsonTreeParser;
import com.stylgebra.node.Nodes;
import com.stylgebra.style.Style;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Reads rule tables and styles from JSON.
 *
 * <p>A rule table is an object mapping selector chains to styles, tried in document order:
 *
 * <pre>
 * {
 *   "@term[i]": {"form": "value"},
 *   "#x": {"subst": {"Add": ["y", 1]}},
 *   "#n": 7
 * }
 * </pre>
 *
 * An object value is an option map; a {@code subst} key in it makes a substitution. A scalar
 * value is shorthand for substituting that scalar. Substituted integers become integer
 * nodes and substituted objects are read as symbolic expressions.
 */
public class RuleTableReader {
    private final JsonTreeParser jsonParser = new JsonTreeParser();
    private final SymbolicExprParser exprParser = new SymbolicExprParser();
    private final SymbolicAdapter adapter = new SymbolicAdapter();

    public RuleTable read(InputStream input) throws IOException {
        return rules(jsonParser.parse(input));
    }

    public RuleTable read(String json) throws IOException {
        return rules(jsonParser.parse(json));
    }

    public Style readStyle(InputStream input) throws IOException {
        return style(jsonParser.parse(input));
    }

    public Style readStyle(String json) throws IOException {
        return style(jsonParser.parse(json));
    }

    RuleTable rules(JsonNode json) {
        JsonNode.JsonObject obj = requireObject(json, "rule table");
        RuleTable table = RuleTable.EMPTY;
        for (Map.Entry<String, JsonNode> entry : obj.fields().entrySet()) {
            table = table.with(entry.getKey(), style(entry.getValue()));
        }
        return table;
    }

    Style style(JsonNode json) {
        if (!(json instanceof JsonNode.JsonObject obj)) {
            return Style.subst(substValue(json));
        }
        MutableMap<String, Object> options = Maps.mutable.empty();
        for (Map.Entry<String, JsonNode> entry : obj.fields().entrySet()) {
            String key = entry.getKey();
            options.put(key, Style.SUBST.equals(key) ? substValue(entry.getValue()) : optionValue(key, entry.getValue()));
        }
        return Style.options(options);
    }

    private Object substValue(JsonNode json) {
        if (json instanceof JsonNode.JsonNumber.JsonLong n) {
            return Nodes.integer(n.value());
        }
        if (json instanceof JsonNode.JsonObject) {
            return adapter.adapt(exprParser.fromJson(json));
        }
        if (json instanceof JsonNode.JsonArray) {
            throw new StylgebraException("Cannot substitute an array");
        }
        return JsonNode.scalarValue(json);
    }

    private static Object optionValue(String key, JsonNode json) {
        if (json instanceof JsonNode.JsonObject || json instanceof JsonNode.JsonArray) {
            throw new StylgebraException("Option " + key + " must be a scalar");
        }
        return JsonNode.scalarValue(json);
    }

    private static JsonNode.JsonObject requireObject(JsonNode json, String what) {
        if (json instanceof JsonNode.JsonObject obj) {
            return obj;
        }
        throw new StylgebraException("Expected a JSON object for the " + what);
    }
}
