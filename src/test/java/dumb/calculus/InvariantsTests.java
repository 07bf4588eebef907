package dumb.calculus;

import org.junit.jupiter.api.Test;

import static dumb.calculus.Invariants.Rule.*;
import static org.junit.jupiter.api.Assertions.*;

public class InvariantsTests extends AbstractTest {

    @Test
    void acceptsCanonicalTrees() {
        assertCanonical(X);
        assertCanonical(c(0));
        assertCanonical(c(-7, 3));
        assertCanonical(pow(2));
        assertCanonical(SIN);
        assertCanonical(mul(2, X));
        assertCanonical(mul(-1, 2, prod(X, SIN, COS)));
        assertCanonical(prod(pow(3), EXP, EXP));
        assertCanonical(sum(X, pow(2), SIN, c(1)));
        assertCanonical(sum(mul(3, X), mul(4, pow(2)), mul(7, pow(3)), COS, c(10)));
    }

    @Test
    void mulRules() {
        assertNotCanonical(mul(2, mul(3, X)), NO_NESTED_MUL);
        assertNotCanonical(mul(2, c(3)), MUL_OVER_CONST);
        assertNotCanonical(mul(1, X), MUL_COEFFICIENT);
        assertNotCanonical(mul(0, SIN), MUL_COEFFICIENT);
        assertNotCanonical(mul(2, sum(X, c(1))), MUL_OPERAND);
    }

    @Test
    void powerExponent() {
        assertNotCanonical(pow(1), POWER_EXPONENT);
        assertNotCanonical(pow(0), POWER_EXPONENT);
        assertNotCanonical(mul(3, pow(1)), POWER_EXPONENT);
    }

    @Test
    void prodRules() {
        assertNotCanonical(prod(X, c(2)), PROD_FACTORS);
        assertNotCanonical(prod(SIN, mul(2, X)), PROD_FACTORS);
        assertNotCanonical(prod(X, pow(2)), PROD_VARIABLE);
        assertNotCanonical(prod(SIN, X), ORDER);
        assertNotCanonical(prod(X, EXP, COS), ORDER);
    }

    @Test
    void sumRules() {
        assertNotCanonical(sum(X, sum(SIN, c(1))), SUM_FLAT);
        assertNotCanonical(sum(c(1), X), SUM_CONSTANT);
        assertNotCanonical(sum(X, c(0)), SUM_CONSTANT);
        assertNotCanonical(sum(X, c(1), c(2)), SUM_CONSTANT);
        assertNotCanonical(sum(X, mul(2, X)), LIKE_TERMS);
        assertNotCanonical(sum(EXP, mul(-1, EXP)), LIKE_TERMS);
        assertNotCanonical(sum(pow(2), X), ORDER);
        assertNotCanonical(sum(COS, SIN), ORDER);
        assertNotCanonical(sum(prod(X, SIN), SIN), ORDER);
    }

    @Test
    void funcArgument() {
        assertNotCanonical(Expr.func(Expr.Fn.SIN, pow(2)), FUNC_ARGUMENT);
        assertNotCanonical(sum(X, Expr.func(Expr.Fn.EXP, mul(2, X))), FUNC_ARGUMENT);
    }

    @Test
    void reportsTheOffendingNode() {
        var bad = mul(1, X);
        var v = Invariants.check(sum(bad, c(4))).orElseThrow();
        assertEquals(MUL_COEFFICIENT, v.rule());
        assertEquals(bad, v.node());
        assertTrue(v.toString().contains(MUL_COEFFICIENT.description), v.toString());
    }

    @Test
    void requireReturnsCanonicalTree() {
        var tree = sum(X, c(1));
        assertSame(tree, Invariants.require(tree, "test"));
        assertTrue(Invariants.canonical(tree));
    }

    @Test
    void requireRaisesInvariantViolation() {
        var tree = sum(pow(2), X);
        var e = assertThrows(InvariantViolation.class, () -> Invariants.require(tree, "integrate"));
        assertEquals("integrate", e.producer);
        assertEquals(ORDER, e.rule());
        assertEquals(tree, e.tree);
        assertTrue(e.getMessage().startsWith("Internal defect: integrate"), e.getMessage());
        assertInstanceOf(AssertionError.class, e);
        assertFalse(Invariants.canonical(tree));
    }
}
