package com.stylgebra.adapt;

import com.stylgebra.error.StylgebraException;
import com.stylgebra.json.JsonNode;
import com.stylgebra.json.JsonTreeParser;
import org.eclipse.collections.api.list.ImmutableList;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Reads a symbolic expression from JSON. A number is an integer, a string is a symbol, and
 * an object with a single key names the head of a compound:
 *
 * <pre>
 * {"Add": ["x", {"Mul": [-1, "y"]}, 3]}
 * {"Pow": ["x", -2]}
 * {"Rational": [1, 3]}
 * </pre>
 */
public class SymbolicExprParser {
    private final JsonTreeParser jsonParser = new JsonTreeParser();

    public SymbolicExpr parse(InputStream input) throws IOException {
        return fromJson(jsonParser.parse(input));
    }

    public SymbolicExpr parse(String json) throws IOException {
        return fromJson(jsonParser.parse(json));
    }

    public SymbolicExpr fromJson(JsonNode node) {
        if (node instanceof JsonNode.JsonNumber.JsonLong n) {
            return new SymbolicExpr.IntegerLit(n.value());
        }
        if (node instanceof JsonNode.JsonString s) {
            return new SymbolicExpr.Symbol(s.value());
        }
        if (node instanceof JsonNode.JsonObject obj && obj.fields().size() == 1) {
            Map.Entry<String, JsonNode> head = obj.fields().entrySet().iterator().next();
            return compound(head.getKey(), head.getValue());
        }
        throw new StylgebraException("Not a symbolic expression: " + node);
    }

    private SymbolicExpr compound(String head, JsonNode body) {
        return switch (head) {
            case "Add" -> new SymbolicExpr.Add(args(head, body));
            case "Mul" -> new SymbolicExpr.Mul(args(head, body));
            case "Pow" -> {
                ImmutableList<SymbolicExpr> a = args(head, body);
                requireArity(head, a, 2);
                yield new SymbolicExpr.Pow(a.get(0), a.get(1));
            }
            case "Symbol" -> new SymbolicExpr.Symbol(((JsonNode.JsonString) body).value());
            case "Integer" -> fromJson(body);
            case "Rational" -> {
                ImmutableList<SymbolicExpr> a = args(head, body);
                requireArity(head, a, 2);
                if (!(a.get(0) instanceof SymbolicExpr.IntegerLit n) || !(a.get(1) instanceof SymbolicExpr.IntegerLit d)) {
                    throw new StylgebraException("Rational needs two integers: " + body);
                }
                yield new SymbolicExpr.RationalLit(n.value(), d.value());
            }
            default -> throw new StylgebraException("Unsupported symbolic expression head: " + head);
        };
    }

    private ImmutableList<SymbolicExpr> args(String head, JsonNode body) {
        if (!(body instanceof JsonNode.JsonArray array)) {
            throw new StylgebraException(head + " needs an array of arguments, got " + body);
        }
        return array.elements().collect(this::fromJson);
    }

    private static void requireArity(String head, ImmutableList<SymbolicExpr> args, int arity) {
        if (args.size() != arity) {
            throw new StylgebraException(head + " takes " + arity + " arguments, got " + args.size());
        }
    }
}
