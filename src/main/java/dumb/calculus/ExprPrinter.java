package dumb.calculus;

import java.math.BigInteger;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Canonical tree to text, using the variable letter the user typed.
 * In {@link Mode#FRACTION} a fractional coefficient is written as a trailing divisor ({@code x^4/4}), so
 * the output parses back to the same tree; {@link Mode#DECIMAL} is for display only.
 */
public final class ExprPrinter {

    public enum Mode {
        FRACTION, DECIMAL
    }

    private final String variable;
    private final Mode mode;
    private final int decimalPlaces;

    public ExprPrinter(String variable, Mode mode, int decimalPlaces) {
        this.variable = requireNonNull(variable);
        this.mode = requireNonNull(mode);
        if (decimalPlaces < 0) throw new IllegalArgumentException("Decimal places must be non-negative");
        this.decimalPlaces = decimalPlaces;
    }

    public ExprPrinter(String variable) {
        this(variable, Mode.FRACTION, 6);
    }

    /**
     * @throws IllegalArgumentException when {@code canonical} is not in canonical form
     */
    public String print(Expr canonical) {
        Invariants.check(canonical).ifPresent(v -> {
            throw new IllegalArgumentException("Only canonical trees can be printed: " + v);
        });
        return render(canonical);
    }

    public String print(Step step) {
        return "  ".repeat(step.depth()) + step.rule() + ": " + render(step.from()) + " -> " + render(step.to());
    }

    private String render(Expr e) {
        return switch (e.kind()) {
            case CONST -> number(((Expr.Const) e).value());
            case VAR -> variable;
            case POWER -> variable + '^' + ((Expr.Power) e).exponent();
            case FUNC -> ((Expr.Func) e).fn().label + '(' + render(((Expr.Func) e).arg()) + ')';
            case MUL -> scaled(e.coefficient(), render(e.body()));
            case PROD -> ((Expr.Prod) e).factors().stream().map(this::render).collect(Collectors.joining("*"));
            case SUM -> {
                var terms = ((Expr.Sum) e).terms();
                var sb = new StringBuilder(render(terms.get(0)));
                for (var t : terms.subList(1, terms.size())) {
                    var negative = t.kind() == Expr.Kind.CONST ? ((Expr.Const) t).value().signum() < 0 : t.coefficient().signum() < 0;
                    sb.append(negative ? " - " : " + ").append(negative ? render(negated(t)) : render(t));
                }
                yield sb.toString();
            }
        };
    }

    private static Expr negated(Expr t) {
        return Normalizer.scale(Rational.MINUS_ONE, t);
    }

    private String scaled(Rational c, String body) {
        if (mode == Mode.DECIMAL) {
            if (c.equals(Rational.MINUS_ONE)) return "-" + body;
            return c.toDecimalString(decimalPlaces) + body;
        }
        var num = Rational.of(c.numerator(), BigInteger.ONE);
        var prefix = num.isOne() ? "" : num.equals(Rational.MINUS_ONE) ? "-" : num.toString();
        return c.isInteger() ? prefix + body : prefix + body + '/' + c.denominator();
    }

    private String number(Rational r) {
        return mode == Mode.DECIMAL ? r.toDecimalString(decimalPlaces) : r.toString();
    }
}
