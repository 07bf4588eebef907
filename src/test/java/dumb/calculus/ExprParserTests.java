package dumb.calculus;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class ExprParserTests extends AbstractTest {

    @Test
    void parsesRawTrees() {
        assertEquals(sum(mul(2, X), c(3)), raw("2x + 3"));
        assertEquals(pow(3), raw("x^3"));
        assertEquals(SIN, raw("sin(x)"));
        assertEquals(prod(X, SIN), raw("x*sin(x)"));
        assertEquals(prod(X, SIN), raw("x sin(x)"));
        assertEquals(mul(-1, pow(2)), raw("-x^2"));
        assertEquals(c(-4), raw("-4"));
        assertEquals(mul(1, 4, X), raw("0.25x"));
        assertEquals(c(8), raw("2^3"));
        assertEquals(pow(8), raw("x^2^3"));
    }

    @Test
    void subtractionNegatesTheTerm() {
        assertEquals(sum(X, mul(-1, SIN), c(-2)), raw("x - sin(x) - 2"));
    }

    @Test
    void divisionByConstantsFoldsIntoCoefficient() {
        assertEquals(mul(1, 2, pow(2)), raw("x^2/2"));
        assertEquals(mul(3, 4, X), raw("3x/4"));
        assertEquals(mul(2, X), raw("x/(1/2)"));
        assertEquals(c(1, 3), raw("1/3"));
    }

    @Test
    void divisionErrors() {
        assertThrows(CalculusException.DivisionByZero.class, () -> raw("x/0"));
        assertThrows(CalculusException.DivisionByZero.class, () -> raw("x/(1 - 1)"));
        var e = assertThrows(CalculusException.UnsupportedExpression.class, () -> raw("1/x"));
        assertTrue(e.getMessage().contains("constant"), e.getMessage());
    }

    @Test
    void exponentErrors() {
        assertThrows(CalculusException.UnsupportedExpression.class, () -> raw("x^-1"));
        assertThrows(CalculusException.UnsupportedExpression.class, () -> raw("x^0.5"));
        assertThrows(CalculusException.UnsupportedExpression.class, () -> raw("x^x"));
        assertThrows(CalculusException.UnsupportedExpression.class, () -> raw("(x + 1)^100"));
        assertThrows(CalculusException.UnsupportedExpression.class, () -> raw("x^99999999999"));
    }

    @Test
    void nonVariableBasesRepeat() {
        assertEquals(prod(SIN, SIN, SIN), raw("sin(x)^3"));
        assertEquals(c(1), raw("sin(x)^0"));
        assertEquals(mul(8, pow(3)), canon("(2x)^3"));
        assertEquals(pow(6), canon("(x^2)^3"));
    }

    @Test
    void functionPowerSugar() {
        assertEquals(sum(prod(SIN, SIN), prod(COS, COS)), raw("sin^2(x) + cos^2(x)"));
        assertEquals(prod(SIN, SIN), raw("sin^2(x)"));
        assertEquals(prod(X, EXP, EXP, EXP), canon("x exp^3(x)"));
        assertEquals(COS, raw("cos^1(x)"));
        assertThrows(CalculusException.UnsupportedExpression.class, () -> canon("sin^2(x^2)"));
    }

    @Test
    void functionPowerSugarKeepsInputColumns() {
        var e = assertThrows(CalculusException.Malformed.class, () -> raw("sin^2(x) + )"));
        assertEquals(12, e.col());
        assertTrue(e.getMessage().contains("near 'sin^2(x) + '"), e.getMessage());
        assertTrue(malformed("sin^(x)").contains("Expected digits after sin^"));
        assertTrue(malformed("sin^2 x").contains("Expected '(' after function name sin"));
    }

    @Test
    void constantPowersAreBounded() {
        assertEquals(c(1024), raw("2^10"));
        assertEquals(c(1, 8), raw("(1/2)^3"));
        assertEquals(c(1), raw("1^2147483647"));
        assertEquals(c(-1), raw("(-1)^2147483647"));
        assertEquals(c(0), raw("0^5000"));
        assertEquals(c(1), raw("0^0"));
        assertThrows(CalculusException.UnsupportedExpression.class, () -> raw("2^2147483647"));
        assertThrows(CalculusException.UnsupportedExpression.class, () -> raw("2^100000000"));
    }

    @Test
    void numbersHaveOneDecimalPoint() {
        var e = assertThrows(CalculusException.Malformed.class, () -> raw("1.2.3"));
        assertTrue(e.getMessage().startsWith("Invalid number '1.2' found '.'"), e.getMessage());
        assertEquals(4, e.col());
        assertThrows(CalculusException.Malformed.class, () -> raw("2..5"));
        assertThrows(CalculusException.Malformed.class, () -> raw("x + 0.5.1x"));
        assertEquals(c(6, 5), raw("1.2"));
    }

    @Test
    void capturesTheVariableLetter() {
        assertEquals("t", ExprParser.parse("3t^2 + t").variable());
        assertEquals("x", ExprParser.parse("5").variable());
        assertEquals("y", ExprParser.parse("sin(y)").variable());
        assertEquals(sum(mul(3, pow(2)), X), ExprParser.parse("3t^2 + t").tree());
    }

    @Test
    void multipleVariablesAreMalformed() {
        var e = assertThrows(CalculusException.Malformed.class, () -> raw("x + y"));
        assertTrue(e.getMessage().contains("Multiple variables"), e.getMessage());
    }

    @Test
    void unknownFunctionIsUnsupported() {
        assertThrows(CalculusException.UnsupportedExpression.class, () -> raw("tan(x)"));
        assertThrows(CalculusException.UnsupportedExpression.class, () -> raw("log(x)"));
    }

    @Test
    void reportsColumnAndContext() {
        var e = assertThrows(CalculusException.Malformed.class, () -> raw("2x + )"));
        assertEquals(6, e.col());
        assertTrue(e.getMessage().startsWith("Unexpected character found ')'"), e.getMessage());
        assertTrue(e.getMessage().contains("at col 6"), e.getMessage());
        assertTrue(e.getMessage().contains("near '2x + '"), e.getMessage());
    }

    @Test
    void syntaxErrorMessages() {
        assertTrue(malformed("2x +").contains("Unexpected end of input"));
        assertTrue(malformed("").contains("Unexpected end of input"));
        assertTrue(malformed("(x + 1").contains("Expected ')' found end of input"));
        assertTrue(malformed("x)").contains("Unexpected trailing input"));
        assertTrue(malformed("sin x").contains("Expected '(' after function name sin"));
        assertTrue(malformed("x # 2").contains("found '#'"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"2x + )", "x^", "*x", "((x)", "sin()", "x + + ", "3 ."})
    void malformedInput(String text) {
        assertThrows(CalculusException.Malformed.class, () -> raw(text));
    }

    private static String malformed(String text) {
        return assertThrows(CalculusException.Malformed.class, () -> raw(text)).getMessage();
    }
}
