package dumb.calculus;

import java.util.List;
import java.util.Optional;

/**
 * Canonical-form checker. A pure bottom-up walk that reports the first broken rule, if any.
 * <p>
 * Function names need no rule of their own: {@link Expr.Fn} only admits sin, cos and exp.
 */
public final class Invariants {

    private Invariants() {
    }

    public enum Rule {
        NO_NESTED_MUL("a Mul never wraps another Mul"),
        MUL_OVER_CONST("a Mul never wraps a Const"),
        MUL_COEFFICIENT("a Mul coefficient is neither 0 nor 1"),
        MUL_OPERAND("a Mul wraps an atomic node or a Prod"),
        POWER_EXPONENT("a Power exponent is at least 2"),
        PROD_FACTORS("a Prod holds at least two atomic factors"),
        PROD_VARIABLE("a Prod holds at most one power of the variable"),
        SUM_FLAT("a Sum never holds a Sum"),
        SUM_CONSTANT("a Sum holds at most one non-zero Const, placed last"),
        LIKE_TERMS("like terms of a Sum are combined"),
        FUNC_ARGUMENT("a Func argument is the bare variable"),
        ORDER("factors and terms follow the canonical order");

        public final String description;

        Rule(String description) {
            this.description = description;
        }
    }

    public record Violation(Rule rule, Expr node, String detail) {
        @Override
        public String toString() {
            return rule + " (" + rule.description + "): " + detail + " at " + node;
        }
    }

    public static boolean canonical(Expr tree) {
        return check(tree).isEmpty();
    }

    public static Optional<Violation> check(Expr tree) {
        return switch (tree.kind()) {
            case CONST, VAR -> Optional.empty();
            case POWER -> {
                var p = (Expr.Power) tree;
                yield p.exponent() < 2
                        ? fail(Rule.POWER_EXPONENT, p, "exponent " + p.exponent())
                        : Optional.empty();
            }
            case FUNC -> {
                var f = (Expr.Func) tree;
                yield f.arg().kind() != Expr.Kind.VAR
                        ? fail(Rule.FUNC_ARGUMENT, f, "argument " + f.arg())
                        : Optional.empty();
            }
            case MUL -> checkMul((Expr.Mul) tree);
            case PROD -> checkProd((Expr.Prod) tree);
            case SUM -> checkSum((Expr.Sum) tree);
        };
    }

    /**
     * Checks a tree produced by {@code producer}.
     *
     * @throws InvariantViolation when the tree is not canonical
     */
    public static Expr require(Expr tree, String producer) {
        var v = check(tree);
        if (v.isPresent()) throw new InvariantViolation(producer, v.get(), tree);
        return tree;
    }

    private static Optional<Violation> checkMul(Expr.Mul m) {
        var inner = check(m.expr());
        if (inner.isPresent()) return inner;
        return switch (m.expr().kind()) {
            case MUL -> fail(Rule.NO_NESTED_MUL, m, "inner " + m.expr());
            case CONST -> fail(Rule.MUL_OVER_CONST, m, "inner " + m.expr());
            case SUM -> fail(Rule.MUL_OPERAND, m, "inner " + m.expr());
            default -> m.coefficient().isZero() || m.coefficient().isOne()
                    ? fail(Rule.MUL_COEFFICIENT, m, "coefficient " + m.coefficient())
                    : Optional.empty();
        };
    }

    private static Optional<Violation> checkProd(Expr.Prod p) {
        var factors = p.factors();
        var variables = 0;
        for (var f : factors) {
            var inner = check(f);
            if (inner.isPresent()) return inner;
            if (!f.atomic()) return fail(Rule.PROD_FACTORS, p, "non-atomic factor " + f);
            if (f.kind() != Expr.Kind.FUNC) variables++;
        }
        if (factors.size() < 2) return fail(Rule.PROD_FACTORS, p, factors.size() + " factor(s)");
        if (variables > 1) return fail(Rule.PROD_VARIABLE, p, variables + " variable factors");
        for (var i = 1; i < factors.size(); i++) {
            if (Order.the.compare(factors.get(i - 1), factors.get(i)) > 0)
                return fail(Rule.ORDER, p, factors.get(i - 1) + " before " + factors.get(i));
        }
        return Optional.empty();
    }

    private static Optional<Violation> checkSum(Expr.Sum s) {
        List<Expr> terms = s.terms();
        for (var t : terms) {
            var inner = check(t);
            if (inner.isPresent()) return inner;
            if (t.kind() == Expr.Kind.SUM) return fail(Rule.SUM_FLAT, s, "nested " + t);
        }
        for (var i = 0; i < terms.size(); i++) {
            var t = terms.get(i);
            if (t.kind() == Expr.Kind.CONST) {
                if (((Expr.Const) t).value().isZero()) return fail(Rule.SUM_CONSTANT, s, "zero term");
                if (i != terms.size() - 1) return fail(Rule.SUM_CONSTANT, s, t + " is not the last term");
            }
            if (i > 0) {
                var c = Order.the.compare(terms.get(i - 1).body(), t.body());
                if (c == 0) return fail(Rule.LIKE_TERMS, s, terms.get(i - 1) + " and " + t);
                if (c > 0) return fail(Rule.ORDER, s, terms.get(i - 1) + " before " + t);
            }
        }
        if (terms.size() < 2) return fail(Rule.SUM_FLAT, s, terms.size() + " term(s)");
        return Optional.empty();
    }

    private static Optional<Violation> fail(Rule rule, Expr node, String detail) {
        return Optional.of(new Violation(rule, node, detail));
    }
}
