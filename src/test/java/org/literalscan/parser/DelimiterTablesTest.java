package org.literalscan.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class DelimiterTablesTest {

    @ParameterizedTest(name = "{0} closes with {1}")
    @CsvSource({
            "(, )",
            "[, ]",
            "{, }",
            "<, >",
            "«, »",
            "“, ”",
            "‚, ’",
            "„, ”",
            "「, 」",
            "（, ）",
            "⸨, ⸩",
    })
    void testPairedDelimiters(char opener, char closer) {
        DelimiterMatcher.Match match = DelimiterTables.UNICODE.match(opener);
        assertTrue(match.valid());
        assertEquals(closer, match.closer());
        assertFalse(match.isSymmetric(opener));
    }

    @ParameterizedTest(name = "{0} closes with itself")
    @ValueSource(chars = {'/', '!', '#', '%', '"', '\'', '-', '_', '>', ')', '»', '؟'})
    void testSelfClosingPunctuation(char opener) {
        DelimiterMatcher.Match match = DelimiterTables.UNICODE.match(opener);
        assertTrue(match.valid());
        assertEquals(opener, match.closer());
        assertTrue(match.isSymmetric(opener));
    }

    @ParameterizedTest(name = "{0} is rejected")
    @ValueSource(chars = {'a', 'Z', '7', ' ', '+', '$', '=', '~', '^', '|'})
    void testRejectedOpeners(char opener) {
        assertFalse(DelimiterTables.UNICODE.match(opener).valid());
        assertEquals(DelimiterMatcher.Match.NONE, DelimiterTables.UNICODE.match(opener));
    }

    @Test
    public void testEndOfInputIsRejected() {
        assertFalse(DelimiterTables.UNICODE.match(-1).valid());
    }

    @Test
    public void testTablesAreReadOnly() {
        assertThrows(UnsupportedOperationException.class, () -> DelimiterTables.OPEN_CLOSE.put((int) 'x', (int) 'y'));
        assertEquals(61, DelimiterTables.OPEN_CLOSE.size());
        assertEquals(10, DelimiterTables.INITIAL_FINAL.size());
    }

    @Test
    public void testQuoteSet() {
        QuoteSet quotes = new QuoteSet("\"'`");
        assertEquals(DelimiterMatcher.Match.of('`'), quotes.match('`'));
        assertFalse(quotes.match('(').valid());
        assertFalse(quotes.contains(-1));
        assertThrows(IllegalArgumentException.class, () -> new QuoteSet(""));
    }

    @Test
    public void testCustomMatcherLambda() {
        DelimiterMatcher onlyBraces = opener -> opener == '{' ? DelimiterMatcher.Match.of('}') : DelimiterMatcher.Match.NONE;
        assertEquals('}', onlyBraces.match('{').closer());
        assertFalse(onlyBraces.match('(').valid());
    }
}
