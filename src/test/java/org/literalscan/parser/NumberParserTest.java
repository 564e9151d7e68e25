package org.literalscan.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.literalscan.astnode.NumberKind;
import org.literalscan.astnode.NumberNode;
import org.literalscan.lexer.ScanState;

import static org.junit.jupiter.api.Assertions.*;

public class NumberParserTest {

    private static NumberNode parse(String input) {
        return NumberParser.numberLiteral().parse(new ScanState(input));
    }

    @ParameterizedTest(name = "{0} is the integer {1}")
    @CsvSource({
            "42, 42",
            "+5, 5",
            "-17, -17",
            "0, 0",
            "007, 7",
            "9223372036854775807, 9223372036854775807",
            "-9223372036854775808, -9223372036854775808",
    })
    void testIntegers(String input, long expected) {
        NumberNode node = parse(input);
        assertNotNull(node);
        assertEquals(NumberKind.INTEGER, node.kind);
        assertEquals(expected, node.getLong());
        assertEquals(0, node.start);
        assertEquals(input.length(), node.end);
    }

    @ParameterizedTest(name = "{0} is the float {1}")
    @CsvSource({
            "-3.14, -3.14",
            "1e10, 1e10",
            "1E-3, 0.001",
            "2.5e+2, 250",
            ".5, 0.5",
            "5., 5",
            "-.25, -0.25",
            "1.e2, 100",
    })
    void testFloats(String input, double expected) {
        NumberNode node = parse(input);
        assertNotNull(node);
        assertEquals(NumberKind.FLOAT, node.kind);
        assertEquals(expected, node.getDouble(), 1e-12);
        assertEquals(input.length(), node.end);
    }

    @ParameterizedTest(name = "\"{0}\" is not a number")
    @ValueSource(strings = {".", "-", "+", "-.", "", "abc", "e5", "1e", "1e+", "9223372036854775808", "1e400"})
    void testRejected(String input) {
        ScanState state = new ScanState(input);
        assertNull(NumberParser.numberLiteral().parse(state));
        assertEquals(NumberParser.EXPECTED_NUMBER, state.getError().getExpected());
        assertEquals(0, state.getError().getPos());
        assertEquals(0, state.pos, "Nothing may be consumed on failure");
    }

    @Test
    public void testStopsAtFirstNonNumberCharacter() {
        ScanState state = new ScanState("  12abc");
        NumberNode node = NumberParser.numberLiteral().parse(state);
        assertEquals(12, node.getLong());
        assertEquals(2, node.start);
        assertEquals(4, node.end);
        assertEquals(4, state.pos);
    }

    @Test
    public void testErrorIsReportedAfterWhitespace() {
        ScanState state = new ScanState("   -x");
        assertNull(NumberParser.numberLiteral().parse(state));
        assertEquals(3, state.getError().getPos());
        assertEquals(0, state.pos);
    }

    @Test
    public void testIntegerAccessorsOnFloat() {
        NumberNode node = parse("1.5");
        assertFalse(node.isInteger());
        assertThrows(IllegalStateException.class, node::getLong);
        assertEquals(1.5, node.getValue());
    }

    @Test
    public void testValueIsBoxedByKind() {
        assertEquals(Long.valueOf(42), parse("42").getValue());
        assertEquals(Double.valueOf(4.0), parse("4e0").getValue());
    }
}
