package dumb.calculus;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Immutable expression tree over the single variable {@link #X}.
 * <p>
 * The same node types describe raw trees (as produced by {@link ExprParser} or {@link ExprJson})
 * and canonical trees (as produced by {@link Normalizer}); {@link Invariants} tells them apart.
 */
sealed public interface Expr permits Expr.Const, Expr.Var, Expr.Power, Expr.Mul, Expr.Prod, Expr.Sum, Expr.Func {

    Var X = new Var();

    Const ZERO = new Const(Rational.ZERO);
    Const ONE = new Const(Rational.ONE);

    static Const constant(long value) {
        return new Const(Rational.of(value));
    }

    static Const constant(Rational value) {
        return new Const(value);
    }

    static Power power(int exponent) {
        return new Power(X, exponent);
    }

    static Mul mul(long coefficient, Expr expr) {
        return new Mul(Rational.of(coefficient), expr);
    }

    static Mul mul(Rational coefficient, Expr expr) {
        return new Mul(coefficient, expr);
    }

    static Prod prod(Expr... factors) {
        return new Prod(Arrays.asList(factors));
    }

    static Sum sum(Expr... terms) {
        return new Sum(Arrays.asList(terms));
    }

    static Func func(Fn fn) {
        return new Func(fn, X);
    }

    static Func func(Fn fn, Expr arg) {
        return new Func(fn, arg);
    }

    Kind kind();

    /** Var, Power and Func: the only nodes allowed as Prod factors or under a Mul. */
    default boolean atomic() {
        return false;
    }

    /** Scalar multiplier carried by this node: a Mul's coefficient, otherwise one. */
    default Rational coefficient() {
        return Rational.ONE;
    }

    /** This node with its scalar multiplier stripped. */
    default Expr body() {
        return this;
    }

    enum Kind {
        CONST, VAR, POWER, MUL, PROD, SUM, FUNC
    }

    /** Supported elementary functions, declared in their canonical order. */
    enum Fn {
        SIN("sin"), COS("cos"), EXP("exp");

        public final String label;

        Fn(String label) {
            this.label = label;
        }

        /**
         * @throws CalculusException.UnsupportedExpression for names other than sin, cos and exp
         */
        public static Fn of(String name) {
            for (var f : values())
                if (f.label.equals(name)) return f;
            throw new CalculusException.UnsupportedExpression("Unsupported function: " + name);
        }
    }

    record Const(Rational value) implements Expr {
        public Const {
            requireNonNull(value);
        }

        @Override
        public Kind kind() {
            return Kind.CONST;
        }

        @Override
        public String toString() {
            return "Const(" + value + ')';
        }
    }

    record Var() implements Expr {
        @Override
        public Kind kind() {
            return Kind.VAR;
        }

        @Override
        public boolean atomic() {
            return true;
        }

        @Override
        public String toString() {
            return "Var";
        }
    }

    record Power(Var base, int exponent) implements Expr {
        public Power {
            requireNonNull(base);
            if (exponent < 0)
                throw new IllegalArgumentException("Power exponent must be non-negative: " + exponent);
        }

        @Override
        public Kind kind() {
            return Kind.POWER;
        }

        @Override
        public boolean atomic() {
            return true;
        }

        @Override
        public String toString() {
            return "Power(Var," + exponent + ')';
        }
    }

    record Mul(Rational coefficient, Expr expr) implements Expr {
        public Mul {
            requireNonNull(coefficient);
            requireNonNull(expr);
        }

        @Override
        public Kind kind() {
            return Kind.MUL;
        }

        @Override
        public Expr body() {
            return expr;
        }

        @Override
        public String toString() {
            return "Mul(" + coefficient + ',' + expr + ')';
        }
    }

    record Prod(List<Expr> factors) implements Expr {
        public Prod {
            factors = List.copyOf(factors);
            if (factors.size() < 2)
                throw new IllegalArgumentException("Prod needs at least two factors: " + factors);
        }

        @Override
        public Kind kind() {
            return Kind.PROD;
        }

        @Override
        public String toString() {
            return factors.stream().map(Expr::toString).collect(Collectors.joining(", ", "Prod([", "])"));
        }
    }

    record Sum(List<Expr> terms) implements Expr {
        public Sum {
            terms = List.copyOf(terms);
            if (terms.size() < 2)
                throw new IllegalArgumentException("Sum needs at least two terms: " + terms);
        }

        @Override
        public Kind kind() {
            return Kind.SUM;
        }

        @Override
        public String toString() {
            return terms.stream().map(Expr::toString).collect(Collectors.joining(", ", "Sum([", "])"));
        }
    }

    record Func(Fn fn, Expr arg) implements Expr {
        public Func {
            requireNonNull(fn);
            requireNonNull(arg);
        }

        @Override
        public Kind kind() {
            return Kind.FUNC;
        }

        @Override
        public boolean atomic() {
            return true;
        }

        @Override
        public String toString() {
            return "Func(" + fn.label + ',' + arg + ')';
        }
    }
}
