package dumb.calculus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dumb.calculus.util.Json;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static dumb.calculus.Expr.X;

/**
 * Trees as tagged JSON objects:
 * <pre>
 * {"type": "mul", "const": "1/2", "expr": {"type": "power", "base": {"type": "var"}, "exp": 2}}
 * </pre>
 * Whole rationals are written as JSON integers, others as {@code "n/d"} strings. Decoding yields a raw
 * tree that still has to be normalized.
 */
public final class ExprJson {

    private ExprJson() {
    }

    public static ObjectNode toJson(Expr e) {
        var o = Json.node().put("type", e.kind().name().toLowerCase(Locale.ROOT));
        switch (e.kind()) {
            case CONST -> putRational(o, "value", ((Expr.Const) e).value());
            case VAR -> {
            }
            case POWER -> {
                o.set("base", toJson(X));
                o.put("exp", ((Expr.Power) e).exponent());
            }
            case MUL -> {
                putRational(o, "const", e.coefficient());
                o.set("expr", toJson(e.body()));
            }
            case PROD -> {
                var factors = o.putArray("factors");
                ((Expr.Prod) e).factors().forEach(f -> factors.add(toJson(f)));
            }
            case SUM -> {
                var terms = o.putArray("terms");
                ((Expr.Sum) e).terms().forEach(t -> terms.add(toJson(t)));
            }
            case FUNC -> {
                o.put("name", ((Expr.Func) e).fn().label);
                o.set("arg", toJson(((Expr.Func) e).arg()));
            }
        }
        return o;
    }

    /**
     * @throws CalculusException.Malformed             on invalid JSON or an unknown node shape
     * @throws CalculusException.UnsupportedExpression on unknown functions or negative exponents
     */
    public static Expr fromJson(String json) {
        try {
            return fromJson(Json.node(json));
        } catch (JsonProcessingException e) {
            throw new CalculusException.Malformed("Invalid JSON: " + e.getOriginalMessage());
        }
    }

    public static Expr fromJson(JsonNode n) {
        if (n == null || !n.isObject()) throw new CalculusException.Malformed("Expected a node object, found " + n);
        var type = n.path("type").asText("");
        return switch (type) {
            case "const" -> Expr.constant(rational(field(n, "value")));
            case "var" -> X;
            case "power" -> {
                if (!"var".equals(field(n, "base").path("type").asText()))
                    throw new CalculusException.Malformed("Power base must be the variable: " + n);
                var exp = field(n, "exp");
                if (!exp.isIntegralNumber() || !exp.canConvertToInt())
                    throw new CalculusException.Malformed("Power exponent must be an integer: " + exp);
                if (exp.intValue() < 0)
                    throw new CalculusException.UnsupportedExpression("Negative exponents are not supported: " + exp);
                yield new Expr.Power(X, exp.intValue());
            }
            case "mul" -> new Expr.Mul(rational(field(n, "const")), fromJson(field(n, "expr")));
            case "prod" -> new Expr.Prod(children(n, "factors"));
            case "sum" -> new Expr.Sum(children(n, "terms"));
            case "func" -> new Expr.Func(Expr.Fn.of(field(n, "name").asText()), fromJson(field(n, "arg")));
            default -> throw new CalculusException.Malformed("Unknown node type '" + type + "' in " + n);
        };
    }

    private static void putRational(ObjectNode o, String key, Rational r) {
        if (r.isInteger()) o.put(key, r.numerator());
        else o.put(key, r.toString());
    }

    private static JsonNode field(JsonNode n, String key) {
        var v = n.get(key);
        if (v == null || v.isNull()) throw new CalculusException.Malformed("Missing '" + key + "' in " + n);
        return v;
    }

    private static List<Expr> children(JsonNode n, String key) {
        var array = field(n, key);
        if (!array.isArray() || array.size() < 2)
            throw new CalculusException.Malformed("'" + key + "' must be an array of at least two nodes in " + n);
        var out = new ArrayList<Expr>(array.size());
        array.forEach(c -> out.add(fromJson(c)));
        return out;
    }

    private static Rational rational(JsonNode v) {
        try {
            if (v.isIntegralNumber()) return Rational.of(v.bigIntegerValue(), BigInteger.ONE);
            if (v.isNumber()) return Rational.parse(v.decimalValue().toPlainString());
            if (v.isTextual()) return Rational.parse(v.asText());
        } catch (NumberFormatException e) {
            throw new CalculusException.Malformed("Invalid number '" + v.asText() + "'");
        }
        throw new CalculusException.Malformed("Expected a number, found " + v);
    }
}
