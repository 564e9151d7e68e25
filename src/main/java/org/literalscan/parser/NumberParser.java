package org.literalscan.parser;

import org.literalscan.astnode.NumberNode;
import org.literalscan.lexer.ScanState;

/**
 * Parser for decimal integer and floating point literals.
 * <p>
 * Accepted forms: an optional sign, digits, an optional fraction, and an optional
 * exponent. A fraction or an exponent makes the literal a float. No escapes,
 * underscores or radix prefixes.
 */
public class NumberParser {

    public static final String EXPECTED_NUMBER = "number";

    /**
     * Matches a number and returns it as a 64-bit integer or a 64-bit float.
     */
    public static LiteralParser<NumberNode> numberLiteral() {
        return LiteralParser.of("number literal", NumberParser::parseNumber);
    }

    static NumberNode parseNumber(ScanState state) {
        int startPos = state.pos;
        state.skipWhitespace();

        String input = state.input;
        int length = state.length;
        int start = state.pos;
        int end = start;
        int digits = 0;
        boolean isFloat = false;

        if (end < length && isSign(input.charAt(end))) {
            end++;
        }
        while (end < length && isDigit(input.charAt(end))) {
            end++;
            digits++;
        }

        if (end < length && input.charAt(end) == '.') {
            isFloat = true;
            end++;
            while (end < length && isDigit(input.charAt(end))) {
                end++;
                digits++;
            }
        }

        // An exponent is only meaningful after a mantissa
        if (digits > 0 && end < length && (input.charAt(end) == 'e' || input.charAt(end) == 'E')) {
            isFloat = true;
            end++;
            if (end < length && isSign(input.charAt(end))) {
                end++;
            }
            while (end < length && isDigit(input.charAt(end))) {
                end++;
            }
        }

        if (digits == 0) {
            return fail(state, startPos, start);
        }

        String text = input.substring(start, end);
        NumberNode node;
        try {
            if (isFloat) {
                double value = Double.parseDouble(text);
                if (Double.isInfinite(value)) {
                    return fail(state, startPos, start);
                }
                node = NumberNode.ofFloat(value, start, end);
            } else {
                node = NumberNode.ofInteger(Long.parseLong(text), start, end);
            }
        } catch (NumberFormatException e) {
            return fail(state, startPos, start);
        }

        state.pos = end;
        state.logDebug("number literal: " + text + " -> " + node.kind);
        return node;
    }

    private static NumberNode fail(ScanState state, int startPos, int start) {
        state.errorAt(EXPECTED_NUMBER, start);
        state.pos = startPos;
        return null;
    }

    private static boolean isSign(char c) {
        return c == '-' || c == '+';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
