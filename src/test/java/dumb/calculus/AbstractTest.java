package dumb.calculus;

import org.junit.jupiter.api.BeforeEach;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.fail;

abstract class AbstractTest {

    static final Expr X = Expr.X;
    static final Expr SIN = Expr.func(Expr.Fn.SIN);
    static final Expr COS = Expr.func(Expr.Fn.COS);
    static final Expr EXP = Expr.func(Expr.Fn.EXP);

    protected Calculus calculus;

    @BeforeEach
    void setUp() {
        calculus = new Calculus(new Calculus.Configuration());
    }

    static Expr c(long value) {
        return Expr.constant(value);
    }

    static Expr c(long num, long den) {
        return Expr.constant(Rational.of(num, den));
    }

    static Expr pow(int exponent) {
        return Expr.power(exponent);
    }

    static Expr mul(long coefficient, Expr e) {
        return Expr.mul(coefficient, e);
    }

    static Expr mul(long num, long den, Expr e) {
        return Expr.mul(Rational.of(num, den), e);
    }

    static Expr sum(Expr... terms) {
        return Expr.sum(terms);
    }

    static Expr prod(Expr... factors) {
        return Expr.prod(factors);
    }

    static Expr raw(String text) {
        return ExprParser.parse(text).tree();
    }

    static Expr canon(String text) {
        return Normalizer.normalize(raw(text));
    }

    static Expr d(String text) {
        return Differentiator.differentiate(canon(text));
    }

    static Expr i(String text) {
        return Integrator.integrate(canon(text));
    }

    static void assertCanonical(Expr e) {
        Invariants.check(e).ifPresent(v -> fail("Expected a canonical tree but " + v + "\n in " + e));
    }

    static void assertNotCanonical(Expr e, Invariants.Rule expected) {
        var v = Invariants.check(e);
        if (v.isEmpty()) fail("Expected " + expected + " to reject " + e);
        if (v.get().rule() != expected)
            fail("Expected " + expected + " but got " + v.get() + "\n rules: " + Arrays.toString(Invariants.Rule.values()));
    }
}
