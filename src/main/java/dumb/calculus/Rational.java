package dumb.calculus;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

import static java.util.Objects.requireNonNull;

/**
 * Exact fraction, always reduced with a positive denominator. Zero is 0/1.
 */
public final class Rational implements Comparable<Rational> {

    public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);
    public static final Rational ONE = new Rational(BigInteger.ONE, BigInteger.ONE);
    public static final Rational MINUS_ONE = new Rational(BigInteger.ONE.negate(), BigInteger.ONE);

    private final BigInteger num;
    private final BigInteger den;

    private Rational(BigInteger num, BigInteger den) {
        this.num = num;
        this.den = den;
    }

    public static Rational of(long value) {
        return of(BigInteger.valueOf(value), BigInteger.ONE);
    }

    public static Rational of(long num, long den) {
        return of(BigInteger.valueOf(num), BigInteger.valueOf(den));
    }

    /**
     * @throws CalculusException.DivisionByZero when {@code den} is zero
     */
    public static Rational of(BigInteger num, BigInteger den) {
        requireNonNull(num, "numerator");
        requireNonNull(den, "denominator");
        if (den.signum() == 0)
            throw new CalculusException.DivisionByZero("Zero denominator in " + num + "/0");
        if (den.signum() < 0) {
            num = num.negate();
            den = den.negate();
        }
        var g = num.gcd(den);
        if (g.signum() != 0 && !g.equals(BigInteger.ONE)) {
            num = num.divide(g);
            den = den.divide(g);
        }
        if (num.signum() == 0) return ZERO;
        return new Rational(num, den);
    }

    /**
     * Parses {@code "n"}, {@code "n/d"} or a decimal literal such as {@code "0.25"}; decimals convert exactly.
     *
     * @throws NumberFormatException on anything else
     */
    public static Rational parse(String text) {
        var t = text.trim();
        var slash = t.indexOf('/');
        if (slash >= 0)
            return of(new BigInteger(t.substring(0, slash).trim()), new BigInteger(t.substring(slash + 1).trim()));
        if (t.indexOf('.') >= 0) {
            var d = new BigDecimal(t);
            return d.scale() <= 0
                    ? of(d.toBigIntegerExact(), BigInteger.ONE)
                    : of(d.unscaledValue(), BigInteger.TEN.pow(d.scale()));
        }
        return of(new BigInteger(t), BigInteger.ONE);
    }

    public BigInteger numerator() {
        return num;
    }

    public BigInteger denominator() {
        return den;
    }

    public Rational add(Rational o) {
        return of(num.multiply(o.den).add(o.num.multiply(den)), den.multiply(o.den));
    }

    public Rational subtract(Rational o) {
        return add(o.negate());
    }

    public Rational multiply(Rational o) {
        return of(num.multiply(o.num), den.multiply(o.den));
    }

    /**
     * @throws CalculusException.DivisionByZero when {@code o} is zero
     */
    public Rational divide(Rational o) {
        if (o.isZero())
            throw new CalculusException.DivisionByZero("Division of " + this + " by zero");
        return of(num.multiply(o.den), den.multiply(o.num));
    }

    public Rational negate() {
        return isZero() ? this : new Rational(num.negate(), den);
    }

    public Rational reciprocal() {
        return ONE.divide(this);
    }

    /** Non-negative integer powers only. */
    public Rational pow(int exponent) {
        if (exponent < 0) throw new IllegalArgumentException("Negative exponent: " + exponent);
        return exponent == 0 ? ONE : new Rational(num.pow(exponent), den.pow(exponent));
    }

    public int signum() {
        return num.signum();
    }

    public boolean isZero() {
        return num.signum() == 0;
    }

    public boolean isOne() {
        return equals(ONE);
    }

    public boolean isInteger() {
        return den.equals(BigInteger.ONE);
    }

    /** Rounds half-up to {@code places} digits and strips trailing zeros. */
    public String toDecimalString(int places) {
        var d = new BigDecimal(num).divide(new BigDecimal(den), places, RoundingMode.HALF_UP).stripTrailingZeros();
        return d.signum() == 0 ? "0" : d.toPlainString();
    }

    @Override
    public int compareTo(Rational o) {
        return num.multiply(o.den).compareTo(o.num.multiply(den));
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Rational r && num.equals(r.num) && den.equals(r.den));
    }

    @Override
    public int hashCode() {
        return 31 * num.hashCode() + den.hashCode();
    }

    @Override
    public String toString() {
        return isInteger() ? num.toString() : num + "/" + den;
    }
}
