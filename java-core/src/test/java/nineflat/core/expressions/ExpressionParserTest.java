package nineflat.core.expressions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

class ExpressionParserTest {

    @Test
    void testPrecedence() {
        var e = Expression.parse("a + b * c");
        assertEquals(new BinaryOperation(BinaryOperation.Operator.ADD, new Symbol("a"),
                new BinaryOperation(BinaryOperation.Operator.MULTIPLY, new Symbol("b"), new Symbol("c"))), e);
        assertEquals("a + b * c", e.toString());
        assertEquals("(a + b) * c", Expression.parse("(a + b) * c").toString());
    }

    @Test
    void testRenderingKeepsStructure() {
        for (var text : new String[] { "a - (b - c)", "a / (b * c)", "-x ^ 2", "2 ^ 3 ^ 2", "(2 ^ 3) ^ 2",
                "exp(-t / tau) * w", "v > 1 && !(r == 0)", "x - -y" }) {
            var parsed = Expression.parse(text);
            assertEquals(parsed, Expression.parse(parsed.toString()), text);
        }
    }

    @Test
    void testUnaryMinusBindsLooserThanPower() {
        assertEquals(new UnaryOperation(UnaryOperation.Operator.NEGATE,
                new BinaryOperation(BinaryOperation.Operator.POWER, new Constant(2), new Constant(2))),
                Expression.parse("-2^2"));
    }

    @Test
    void testNumbers() {
        assertEquals(new Constant(1.5e-3), Expression.parse("1.5e-3"));
        assertEquals("3", new Constant(3.0).toString());
        assertEquals("0.25", new Constant(0.25).toString());
    }

    @Test
    void testSymbolsRenameAndSubstitute() {
        var e = Expression.parse("g * (v - E) + sin(t)");
        assertEquals(Set.of("E", "g", "t", "v"), e.symbols());
        assertEquals("g__psr * (v__psr - E__psr) + sin(t)",
                e.rename(s -> s.equals("t") ? s : s + "__psr").toString());
        assertEquals("(a + b) * (v - E) + sin(t)",
                e.substitute(Map.of("g", Expression.parse("a + b"))).toString());
    }

    @Test
    void testMalformed() {
        var error = assertThrows(ExpressionParseException.class, () -> Expression.parse("a + * b"));
        assertEquals("a + * b", error.getText());
        assertThrows(ExpressionParseException.class, () -> Expression.parse("(a + b"));
        assertThrows(ExpressionParseException.class, () -> Expression.parse("a b"));
        assertThrows(ExpressionParseException.class, () -> Expression.parse(""));
        var unexpected = assertThrows(ExpressionParseException.class, () -> Expression.parse("a $ b"));
        assertEquals(2, unexpected.getPosition());
    }

    @Test
    void testNumbersOutOfRangeAreRejected() {
        var error = assertThrows(ExpressionParseException.class, () -> Expression.parse("2 * 1e999"));
        assertEquals(4, error.getPosition());
        assertThrows(ExpressionParseException.class, () -> Expression.parse("-1e400"));
        assertEquals(new Constant(1e300), Expression.parse("1e300"));
    }
}
