package org.literalscan.parser;

import org.junit.jupiter.api.Test;
import org.literalscan.astnode.StringNode;
import org.literalscan.lexer.ScanState;

import static org.junit.jupiter.api.Assertions.*;

public class StringParserTest {

    @Test
    public void testQuotedString() {
        ScanState state = new ScanState("  'it works' rest");
        StringNode node = StringParser.stringLiteral("\"'").parse(state);

        assertNotNull(node);
        assertEquals("it works", node.getValue());
        assertEquals(3, node.start);
        assertEquals(11, node.end);
        assertEquals(12, state.pos);
    }

    @Test
    public void testQuoteMustCloseWithItself() {
        ScanState state = new ScanState("\"it's\"");
        StringNode node = StringParser.stringLiteral("\"'").parse(state);
        assertEquals("it's", node.getValue());
    }

    @Test
    public void testDisallowedQuote() {
        ScanState state = new ScanState("  `x`");
        assertNull(StringParser.stringLiteral("\"'").parse(state));

        assertEquals("\"'", state.getError().getExpected());
        assertEquals(2, state.getError().getPos());
        assertEquals(0, state.pos, "Nothing may be consumed on failure");
    }

    @Test
    public void testEmptyInput() {
        ScanState state = new ScanState("");
        assertNull(StringParser.stringLiteral("\"").parse(state));
        assertEquals("\"", state.getError().getExpected());
        assertEquals(0, state.getError().getPos());
    }

    @Test
    public void testUnterminatedStringKeepsScannerError() {
        ScanState state = new ScanState("\"abc");
        assertNull(StringParser.stringLiteral("\"").parse(state));
        assertEquals("\"", state.getError().getExpected());
        assertEquals(4, state.getError().getPos());
        assertEquals(0, state.pos);
    }

    @Test
    public void testUnicodeStringLiteralPairs() {
        assertEquals("foo", StringParser.unicodeStringLiteral().parse(new ScanState("(foo)")).getValue());
        assertEquals("foo", StringParser.unicodeStringLiteral().parse(new ScanState("«foo»")).getValue());
        assertEquals("foo", StringParser.unicodeStringLiteral().parse(new ScanState("/foo/")).getValue());
        assertEquals("a\"b", StringParser.unicodeStringLiteral().parse(new ScanState("\"a\\\"b\"")).getValue());
    }

    @Test
    public void testPairedDelimiterDoesNotCloseWithOpener() {
        ScanState state = new ScanState("(foo(");
        assertNull(StringParser.unicodeStringLiteral().parse(state));
        assertEquals(")", state.getError().getExpected());
        assertEquals(5, state.getError().getPos());
    }

    @Test
    public void testUnicodeStringLiteralRejectsLetter() {
        ScanState state = new ScanState("foo");
        assertNull(StringParser.unicodeStringLiteral().parse(state));
        assertEquals(StringParser.STRING_DELIMITER, state.getError().getExpected());
        assertEquals(0, state.getError().getPos());
    }

    @Test
    public void testInnerErrorSurvivesDelimiterLabel() {
        ScanState state = new ScanState("[abc\\u00g0]");
        assertNull(StringParser.unicodeStringLiteral().parse(state));
        assertEquals(SegmentScanner.EXPECTED_HEX_DIGIT, state.getError().getExpected());
        assertEquals(8, state.getError().getPos());
    }

    @Test
    public void testCustomStringLiteral() {
        LiteralParser<StringNode> parser = StringParser.customStringLiteral(new QuoteSet("|"), EscapeTable.EMPTY);
        ScanState state = new ScanState("|a\\nb\\|c|");
        StringNode node = parser.parse(state);
        assertEquals("a\\nb|c", node.getValue());
        assertEquals("string literal", parser.name());
    }

    @Test
    public void testFurthestErrorAcrossAlternatives() {
        ScanState state = new ScanState("'unterminated");
        assertNull(StringParser.stringLiteral("\"'").parse(state));
        // a later alternative failing at the start must not hide the deeper failure
        assertNull(NumberParser.numberLiteral().parse(state));

        assertEquals("'", state.getError().getExpected());
        assertEquals(13, state.getError().getPos());
    }
}
