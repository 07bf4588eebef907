package dumb.calculus;

import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;

import static dumb.calculus.Expr.X;

/**
 * Text to raw tree. Checks syntax and the numeric shape of exponents and divisors; canonical
 * structure is left to {@link Normalizer}.
 * <pre>
 * expr  := mul (('+' | '-') mul)*
 * mul   := unary (('*' | '/') unary | power)*
 * unary := '-' unary | power
 * power := term ('^' unary)?
 * term  := NUMBER | VAR | NAME ('^' DIGITS)? '(' expr ')' | '(' expr ')'
 * </pre>
 * {@code sin^2(x)} means {@code (sin(x))^2}.
 */
public final class ExprParser {
    private static final int CONTEXT_BUFFER_SIZE = 20;
    private static final int MAX_REPEAT = 64;
    private static final int MAX_CONSTANT_EXPONENT = 1024;

    private final String src;
    private final StringBuilder contextBuffer = new StringBuilder(CONTEXT_BUFFER_SIZE);
    private int pos = 0;
    @Nullable
    private String variable;

    private ExprParser(String src) {
        this.src = src;
    }

    /** A raw tree plus the letter the input used for its variable. */
    public record Parsed(Expr tree, String variable) {
    }

    /**
     * @throws CalculusException.Malformed             on syntax errors
     * @throws CalculusException.UnsupportedExpression on unknown functions or unusable exponents and divisors
     * @throws CalculusException.DivisionByZero        on division by a zero constant
     */
    public static Parsed parse(String text) {
        var parser = new ExprParser(text);
        var tree = parser.parseExpr();
        parser.skipWhitespace();
        if (parser.peek() != -1)
            throw parser.createParseException("Unexpected trailing input", "'" + (char) parser.peek() + "'");
        return new Parsed(tree, parser.variable != null ? parser.variable : "x");
    }

    private int peek() {
        return pos < src.length() ? src.charAt(pos) : -1;
    }

    private int consumeChar() {
        var c = peek();
        if (c != -1) {
            pos++;
            if (contextBuffer.length() >= CONTEXT_BUFFER_SIZE) contextBuffer.deleteCharAt(0);
            contextBuffer.append((char) c);
        }
        return c;
    }

    private void consumeChar(char expected) {
        var actual = consumeChar();
        if (actual != expected)
            throw createParseException("Expected '" + expected + "'", actual == -1 ? "end of input" : "'" + (char) actual + "'");
    }

    private void skipWhitespace() {
        while (peek() != -1 && Character.isWhitespace(peek())) consumeChar();
    }

    private Expr parseExpr() {
        var terms = new ArrayList<Expr>();
        terms.add(parseMul());
        skipWhitespace();
        while (peek() == '+' || peek() == '-') {
            var op = consumeChar();
            var rhs = parseMul();
            terms.add(op == '-' ? negate(rhs) : rhs);
            skipWhitespace();
        }
        return terms.size() == 1 ? terms.get(0) : new Expr.Sum(terms);
    }

    private Expr parseMul() {
        var factors = new ArrayList<Expr>();
        var coefficient = addFactor(factors, Rational.ONE, parseUnary());
        while (true) {
            skipWhitespace();
            var c = peek();
            if (c == '*') {
                consumeChar();
                coefficient = addFactor(factors, coefficient, parseUnary());
            } else if (c == '/') {
                consumeChar();
                coefficient = coefficient.divide(divisor(parseUnary()));
            } else if (c != -1 && (Character.isLetterOrDigit(c) || c == '.' || c == '(')) {
                coefficient = addFactor(factors, coefficient, parsePower());
            } else {
                break;
            }
        }
        if (factors.isEmpty()) return Expr.constant(coefficient);
        var body = factors.size() == 1 ? factors.get(0) : new Expr.Prod(factors);
        return coefficient.isOne() ? body : new Expr.Mul(coefficient, body);
    }

    private static Rational addFactor(ArrayList<Expr> factors, Rational coefficient, Expr f) {
        if (f instanceof Expr.Const c) return coefficient.multiply(c.value());
        factors.add(f);
        return coefficient;
    }

    private Rational divisor(Expr raw) {
        var d = Normalizer.normalize(raw);
        if (!(d instanceof Expr.Const c))
            throw new CalculusException.UnsupportedExpression("Division is only supported by a constant, not " + d);
        if (c.value().isZero())
            throw new CalculusException.DivisionByZero("Division by zero near '" + contextBuffer + "'");
        return c.value();
    }

    private Expr parseUnary() {
        skipWhitespace();
        if (peek() == '-') {
            consumeChar();
            return negate(parseUnary());
        }
        return parsePower();
    }

    private static Expr negate(Expr e) {
        return e instanceof Expr.Const c ? Expr.constant(c.value().negate()) : new Expr.Mul(Rational.MINUS_ONE, e);
    }

    private Expr parsePower() {
        var base = parseTerm();
        skipWhitespace();
        if (peek() != '^') return base;
        consumeChar();
        return raise(base, exponent(parseUnary()));
    }

    private int exponent(Expr raw) {
        var e = Normalizer.normalize(raw);
        if (!(e instanceof Expr.Const c))
            throw new CalculusException.UnsupportedExpression("Exponent must be a constant, not " + e);
        var v = c.value();
        if (!v.isInteger())
            throw new CalculusException.UnsupportedExpression("Exponent must be an integer: " + v);
        if (v.signum() < 0)
            throw new CalculusException.UnsupportedExpression("Negative exponents are not supported: " + v);
        if (v.numerator().compareTo(BigInteger.valueOf(Integer.MAX_VALUE)) > 0)
            throw new CalculusException.UnsupportedExpression("Exponent too large: " + v);
        return v.numerator().intValue();
    }

    private static Expr raise(Expr base, int n) {
        if (base instanceof Expr.Var) return new Expr.Power(X, n);
        if (base instanceof Expr.Const c) return Expr.constant(constantPower(c.value(), n));
        if (n == 0) return Expr.ONE;
        if (n == 1) return base;
        if (n > MAX_REPEAT)
            throw new CalculusException.UnsupportedExpression("Exponent " + n + " too large for a non-variable base");
        return new Expr.Prod(Collections.nCopies(n, base));
    }

    private static Rational constantPower(Rational b, int n) {
        if (n == 0) return Rational.ONE;
        if (b.isZero() || b.isOne()) return b;
        if (b.equals(Rational.MINUS_ONE)) return n % 2 == 0 ? Rational.ONE : b;
        if (n > MAX_CONSTANT_EXPONENT)
            throw new CalculusException.UnsupportedExpression("Exponent " + n + " too large for constant base " + b);
        return b.pow(n);
    }

    private Expr parseTerm() {
        skipWhitespace();
        var c = peek();
        if (c == -1) throw createParseException("Unexpected end of input");
        if (Character.isDigit(c) || c == '.') return parseNumber();
        if (Character.isLetter(c)) return parseName();
        if (c == '(') {
            consumeChar('(');
            var inner = parseExpr();
            skipWhitespace();
            consumeChar(')');
            return inner;
        }
        throw createParseException("Unexpected character", "'" + (char) c + "'");
    }

    private Expr.Const parseNumber() {
        var sb = new StringBuilder();
        var dot = false;
        while (peek() != -1 && (Character.isDigit(peek()) || (peek() == '.' && !dot))) {
            if (peek() == '.') dot = true;
            sb.append((char) consumeChar());
        }
        var text = sb.toString();
        if (text.equals(".")) throw createParseException("Expected digits around '.'");
        if (peek() == '.') throw createParseException("Invalid number '" + text + "'", "'.'");
        try {
            return Expr.constant(Rational.parse(text));
        } catch (NumberFormatException e) {
            throw createParseException("Invalid number '" + text + "'");
        }
    }

    private Expr parseName() {
        var sb = new StringBuilder();
        while (peek() != -1 && Character.isLetter(peek())) sb.append((char) consumeChar());
        var name = sb.toString();
        if (name.length() == 1) {
            if (variable == null) variable = name;
            else if (!variable.equals(name))
                throw createParseException("Multiple variables not supported: " + variable + ", " + name);
            return X;
        }
        skipWhitespace();
        var power = 1;
        if (peek() == '^') {
            consumeChar();
            skipWhitespace();
            if (peek() == -1 || !Character.isDigit(peek()))
                throw createParseException("Expected digits after " + name + "^");
            power = exponent(parseNumber());
            skipWhitespace();
        }
        if (peek() != '(') throw createParseException("Expected '(' after function name " + name);
        var fn = Expr.Fn.of(name);
        consumeChar('(');
        var arg = parseExpr();
        skipWhitespace();
        consumeChar(')');
        return raise(new Expr.Func(fn, arg), power);
    }

    private CalculusException.Malformed createParseException(String message) {
        return new CalculusException.Malformed(message, pos + 1, contextBuffer.toString());
    }

    private CalculusException.Malformed createParseException(String message, @Nullable String foundToken) {
        var foundInfo = foundToken != null ? " found " + foundToken : "";
        return new CalculusException.Malformed(message + foundInfo, pos + 1, contextBuffer.toString());
    }
}
