package dumb.calculus;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

import static dumb.calculus.Expr.X;

/**
 * Rewrites a raw tree into the unique canonical tree for its value. Bottom-up: children are
 * normalized before their parent is rebuilt.
 */
public final class Normalizer {

    private Normalizer() {
    }

    /**
     * @throws CalculusException.UnsupportedExpression when the tree leaves the supported domain
     *                                                 (a function of a composite argument, a product containing a sum)
     * @throws InvariantViolation                      if the result is not canonical
     */
    public static Expr normalize(Expr raw) {
        return Invariants.require(canon(raw), "normalize");
    }

    static Expr canon(Expr e) {
        return switch (e.kind()) {
            case CONST, VAR -> e;
            case POWER -> power(((Expr.Power) e).exponent());
            case FUNC -> func((Expr.Func) e);
            case MUL -> scale(e.coefficient(), canon(e.body()));
            case PROD -> product(((Expr.Prod) e).factors());
            case SUM -> sum(((Expr.Sum) e).terms().stream().map(Normalizer::canon).toList());
        };
    }

    static Expr power(int exponent) {
        return switch (exponent) {
            case 0 -> Expr.ONE;
            case 1 -> X;
            default -> Expr.power(exponent);
        };
    }

    /**
     * @throws CalculusException.UnsupportedExpression when the sum does not fit an {@code int} exponent
     */
    static int addExponents(int a, int b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw new CalculusException.UnsupportedExpression("Exponent too large: x^" + a + " * x^" + b);
        }
    }

    private static Expr func(Expr.Func f) {
        var arg = canon(f.arg());
        if (arg.kind() != Expr.Kind.VAR)
            throw new CalculusException.UnsupportedExpression(
                    f.fn().label + " must be applied to the bare variable, not " + arg + " (no chain rule)");
        return new Expr.Func(f.fn(), X);
    }

    /** Multiplies a canonical tree by {@code c}, distributing over sums. */
    static Expr scale(Rational c, Expr n) {
        if (c.isZero()) return Expr.ZERO;
        return switch (n.kind()) {
            case CONST -> Expr.constant(c.multiply(((Expr.Const) n).value()));
            case MUL -> scale(c.multiply(n.coefficient()), n.body());
            case SUM -> sum(((Expr.Sum) n).terms().stream().map(t -> scale(c, t)).toList());
            default -> c.isOne() ? n : new Expr.Mul(c, n);
        };
    }

    private static Expr product(List<Expr> rawFactors) {
        var acc = new Factors();
        for (var f : rawFactors) acc.add(canon(f));
        return acc.build();
    }

    /** Combines already-canonical terms: flattens, merges like terms and constants, sorts. */
    static Expr sum(List<Expr> terms) {
        var bodies = new TreeMap<Expr, Rational>(Order.the);
        var constant = collectTerms(terms, bodies, Rational.ZERO);

        var out = new ArrayList<Expr>(bodies.size() + 1);
        bodies.forEach((body, coefficient) -> {
            if (!coefficient.isZero()) out.add(scale(coefficient, body));
        });
        if (!constant.isZero()) out.add(Expr.constant(constant));

        return switch (out.size()) {
            case 0 -> Expr.ZERO;
            case 1 -> out.get(0);
            default -> new Expr.Sum(out);
        };
    }

    private static Rational collectTerms(List<Expr> terms, TreeMap<Expr, Rational> bodies, Rational constant) {
        for (var t : terms) {
            switch (t.kind()) {
                case SUM -> constant = collectTerms(((Expr.Sum) t).terms(), bodies, constant);
                case CONST -> constant = constant.add(((Expr.Const) t).value());
                default -> bodies.merge(t.body(), t.coefficient(), Rational::add);
            }
        }
        return constant;
    }

    /** Running state while flattening a product. */
    private static final class Factors {
        private final List<Expr> funcs = new ArrayList<>();
        private Rational coefficient = Rational.ONE;
        private int degree;

        void add(Expr f) {
            switch (f.kind()) {
                case CONST -> coefficient = coefficient.multiply(((Expr.Const) f).value());
                case VAR -> degree = addExponents(degree, 1);
                case POWER -> degree = addExponents(degree, ((Expr.Power) f).exponent());
                case FUNC -> funcs.add(f);
                case MUL -> {
                    coefficient = coefficient.multiply(f.coefficient());
                    add(f.body());
                }
                case PROD -> ((Expr.Prod) f).factors().forEach(this::add);
                case SUM -> throw new CalculusException.UnsupportedExpression(
                        "Products of sums are not supported: " + f);
            }
        }

        Expr build() {
            if (coefficient.isZero()) return Expr.ZERO;
            var factors = new ArrayList<>(funcs);
            if (degree > 0) factors.add(power(degree));
            factors.sort(Order.the);
            return switch (factors.size()) {
                case 0 -> Expr.constant(coefficient);
                case 1 -> scale(coefficient, factors.get(0));
                default -> scale(coefficient, new Expr.Prod(factors));
            };
        }
    }
}
