package dumb.calculus;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OrderTest extends AbstractTest {

    @Test
    void kindsRank() {
        var sorted = new ArrayList<>(List.of(c(5), prod(X, SIN), EXP, pow(2), X, sum(X, c(1))));
        sorted.sort(Order.the);
        assertEquals(List.of(X, pow(2), EXP, prod(X, SIN), c(5), sum(X, c(1))), sorted);
    }

    @Test
    void powersByExponent() {
        assertTrue(Order.the.compare(pow(2), pow(10)) < 0);
        assertTrue(Order.the.compare(pow(3), pow(2)) > 0);
        assertEquals(0, Order.the.compare(pow(4), pow(4)));
    }

    @Test
    void functionsSinCosExp() {
        assertTrue(Order.the.compare(SIN, COS) < 0);
        assertTrue(Order.the.compare(COS, EXP) < 0);
        assertTrue(Order.the.compare(EXP, SIN) > 0);
    }

    @Test
    void productsLexicographic() {
        assertTrue(Order.the.compare(prod(X, SIN), prod(X, COS)) < 0);
        assertTrue(Order.the.compare(prod(X, SIN), prod(pow(2), SIN)) < 0);
        assertTrue(Order.the.compare(prod(SIN, SIN), prod(SIN, SIN, SIN)) < 0);
    }

    @Test
    void mulOrderedByBodyThenCoefficient() {
        assertTrue(Order.the.compare(mul(100, X), pow(2)) < 0);
        assertTrue(Order.the.compare(mul(-3, pow(3)), mul(2, pow(2))) > 0);
        assertTrue(Order.the.compare(X, mul(2, X)) < 0);
        assertTrue(Order.the.compare(mul(-1, X), X) < 0);
        assertEquals(0, Order.the.compare(mul(2, SIN), mul(2, SIN)));
    }

    @Test
    void constantsByValue() {
        assertTrue(Order.the.compare(c(1, 2), c(1)) < 0);
        assertTrue(Order.the.compare(c(-1), c(0)) < 0);
    }
}
