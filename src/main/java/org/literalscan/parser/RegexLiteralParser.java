package org.literalscan.parser;

import org.literalscan.astnode.RegexReplaceNode;
import org.literalscan.astnode.StringNode;
import org.literalscan.lexer.ScanState;

/*
 * Parsers for regular expression literals: a match literal is one delimited segment
 * (/foo/, {foo}), a replace literal is two (/foo/bar/, {foo}{bar}).
 *
 * The pattern is not validated; these parsers only find where it ends.
 */
public class RegexLiteralParser {

    public static final String REGEXP_DELIMITER = "regexp delimiter";

    /**
     * Matches a regexp match literal with Unicode delimiters and the default escapes.
     */
    public static LiteralParser<StringNode> unicodeRegexpMatchLiteral() {
        return regexpMatchLiteral(DelimiterTables.UNICODE, EscapeTable.DEFAULT);
    }

    public static LiteralParser<StringNode> regexpMatchLiteral(DelimiterMatcher delimiters, EscapeTable escapes) {
        return LiteralParser.of("regexp match literal",
                state -> StringParser.parseDelimited(state, "regexp match literal", delimiters, escapes, REGEXP_DELIMITER, true));
    }

    /**
     * Matches a regexp replace literal with Unicode delimiters and the default escapes.
     */
    public static LiteralParser<RegexReplaceNode> unicodeRegexpReplaceLiteral() {
        return regexpReplaceLiteral(DelimiterTables.UNICODE, EscapeTable.DEFAULT);
    }

    /**
     * Matches a regexp replace literal.
     * <p>
     * With a self-closing delimiter the closer of the pattern also opens the
     * replacement: {@code /foo/bar/}. With a bracket pair the replacement needs its own
     * opener right after the pattern's closer, validated through
     * {@link DelimiterTables#UNICODE}: {@code (foo)[bar]}. The replacement always uses
     * {@link EscapeTable#DEFAULT}.
     * <p>
     * Unlike the single-segment parsers, a failure leaves the cursor as far as scanning
     * got, so the enclosing grammar can see how much of the literal was read.
     *
     * @param delimiters validates the pattern's opener
     * @param escapes    escapes recognized in the pattern
     */
    public static LiteralParser<RegexReplaceNode> regexpReplaceLiteral(DelimiterMatcher delimiters, EscapeTable escapes) {
        return LiteralParser.of("regexp replace literal", state -> parseReplace(state, delimiters, escapes));
    }

    static RegexReplaceNode parseReplace(ScanState state, DelimiterMatcher delimiters, EscapeTable escapes) {
        state.skipWhitespace();

        int opener = state.codePointAt(state.pos);
        DelimiterMatcher.Match match = delimiters.match(opener);
        if (!match.valid()) {
            state.errorHere(REGEXP_DELIMITER);
            return null;
        }
        state.pos += Character.charCount(opener);

        int closer = match.closer();
        StringNode pattern = SegmentScanner.scan(state, state.pos, closer, escapes);
        if (pattern == null) {
            state.errorHere(SegmentScanner.closerLabel(closer));
            return null;
        }

        if (closer != opener) {
            int secondOpener = state.codePointAt(state.pos);
            DelimiterMatcher.Match secondMatch = DelimiterTables.UNICODE.match(secondOpener);
            if (!secondMatch.valid()) {
                state.errorHere(REGEXP_DELIMITER);
                return null;
            }
            state.pos += Character.charCount(secondOpener);
            closer = secondMatch.closer();
        }

        StringNode replacement = SegmentScanner.scan(state, state.pos, closer, EscapeTable.DEFAULT);
        if (replacement == null) {
            state.errorHere(SegmentScanner.closerLabel(closer));
            return null;
        }

        state.logDebug("regexp replace literal: pattern " + pattern.start + ".." + pattern.end
                + " replacement " + replacement.start + ".." + replacement.end);
        return new RegexReplaceNode(pattern, replacement);
    }
}
