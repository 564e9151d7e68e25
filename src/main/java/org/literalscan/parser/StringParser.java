package org.literalscan.parser;

import org.literalscan.astnode.StringNode;
import org.literalscan.lexer.ScanState;

import static org.literalscan.runtime.ScalarUtils.printable;

/**
 * Parsers for single-segment string literals.
 * <p>
 * Every parser skips whitespace, reads one opening code point, validates it and hands
 * the rest to {@link SegmentScanner}. A failed parse leaves the cursor where it was.
 */
public class StringParser {

    public static final String STRING_DELIMITER = "string delimiter";

    /**
     * Matches a string quoted by one of {@code allowedQuotes}; the closing quote is the
     * same character as the opening one. Escapes are decoded with
     * {@link EscapeTable#DEFAULT}.
     * <p>
     * If the opener is not an allowed quote, the expectation is the quote set itself.
     *
     * @param allowedQuotes the allowed quote characters, e.g. {@code "\"'"}
     */
    public static LiteralParser<StringNode> stringLiteral(String allowedQuotes) {
        return stringLiteral(allowedQuotes, EscapeTable.DEFAULT);
    }

    /**
     * Same as {@link #stringLiteral(String)} with a caller-supplied escape table. A bad
     * opener still reports the quote set.
     */
    public static LiteralParser<StringNode> stringLiteral(String allowedQuotes, EscapeTable escapes) {
        QuoteSet quotes = new QuoteSet(allowedQuotes);
        return LiteralParser.of("string literal", state -> {
            int startPos = state.pos;
            state.skipWhitespace();

            int opener = state.codePointAt(state.pos);
            if (!quotes.contains(opener)) {
                state.errorHere(quotes.getQuotes());
                state.pos = startPos;
                return null;
            }
            StringNode node = SegmentScanner.scan(state, state.pos + Character.charCount(opener), opener, escapes);
            if (node == null) {
                state.pos = startPos;
                return null;
            }
            logLiteral(state, "string literal", node);
            return node;
        });
    }

    /**
     * Matches a string whose delimiters are any matched pair of Unicode quotes or
     * brackets, or a punctuation character closed by itself.
     *
     * @see DelimiterTables#UNICODE
     */
    public static LiteralParser<StringNode> unicodeStringLiteral() {
        return customStringLiteral(DelimiterTables.UNICODE, EscapeTable.DEFAULT);
    }

    /**
     * Matches a string whose delimiters are validated by {@code delimiters}. Recognized
     * escapes are those in {@code escapes} plus the closer itself.
     */
    public static LiteralParser<StringNode> customStringLiteral(DelimiterMatcher delimiters, EscapeTable escapes) {
        return LiteralParser.of("string literal",
                state -> parseDelimited(state, "string literal", delimiters, escapes, STRING_DELIMITER, false));
    }

    /**
     * Shared body of the single-segment delimited forms.
     * <p>
     * After a scan failure a second expectation is recorded at the opener: either the
     * delimiter label or, when {@code closerOnFailure} is set, the closer. Being earlier
     * than the scanner's own error it only survives if nothing further was recorded.
     */
    static StringNode parseDelimited(ScanState state, String name, DelimiterMatcher delimiters, EscapeTable escapes,
                                     String delimiterLabel, boolean closerOnFailure) {
        int startPos = state.pos;
        state.skipWhitespace();

        int opener = state.codePointAt(state.pos);
        DelimiterMatcher.Match match = delimiters.match(opener);
        if (!match.valid()) {
            state.errorHere(delimiterLabel);
            state.pos = startPos;
            return null;
        }

        StringNode node = SegmentScanner.scan(state, state.pos + Character.charCount(opener), match.closer(), escapes);
        if (node == null) {
            state.errorHere(closerOnFailure ? SegmentScanner.closerLabel(match.closer()) : delimiterLabel);
            state.pos = startPos;
            return null;
        }
        logLiteral(state, name, node);
        return node;
    }

    static void logLiteral(ScanState state, String name, StringNode node) {
        if (state.isDebugEnabled()) {
            state.logDebug(name + ": <" + printable(node.getValue()) + "> at " + node.start + ".." + node.end
                    + (node.isRawSlice() ? "" : " (decoded)"));
        }
    }
}
