package org.literalscan.parser;

import org.literalscan.astnode.StringNode;
import org.literalscan.lexer.ScanState;

/**
 * Scans one delimited segment: the text between an opening delimiter, already consumed
 * by the caller, and the first unescaped closer.
 * <p>
 * Escapes:
 * <ul>
 *   <li>backslash, {@code u} and exactly four hex digits - decoded as one code point; a
 *   surrogate code unit, which cannot stand alone, decodes as U+FFFD</li>
 *   <li>backslash + closer - the closer itself</li>
 *   <li>backslash + a letter of the escape table - the mapped character</li>
 *   <li>anything else - the backslash and the character, unchanged</li>
 * </ul>
 * No buffer is allocated until the first escape: a segment without escapes yields a
 * {@link StringNode} that is a view of the source.
 */
public final class SegmentScanner {

    public static final String EXPECTED_HEX_DIGITS = "[a-f0-9]{4}";
    public static final String EXPECTED_HEX_DIGIT = "[a-f0-9]";

    static final int REPLACEMENT_CHARACTER = 0xFFFD;

    private SegmentScanner() {
    }

    /**
     * Scans from {@code start} up to the closer.
     * <p>
     * On success the cursor is moved past the closer and the node covers
     * {@code [start, closerOffset)}. On failure the cursor is left alone, the error is
     * recorded in the state and null is returned.
     *
     * @param state   the scan state
     * @param start   offset of the first content character
     * @param closer  the closing code point
     * @param escapes escape letters recognized in this segment
     * @return the segment, or null if the closer was not found or an escape is malformed
     */
    public static StringNode scan(ScanState state, int start, int closer, EscapeTable escapes) {
        String input = state.input;
        int length = state.length;
        int end = start;
        StringBuilder buffer = null;

        while (end < length) {
            int current = state.codePointAt(end);
            int size = Character.charCount(current);

            if (current == '\\') {
                if (end + size >= length) {
                    // a dangling backslash is an unterminated literal
                    state.errorAt(closerLabel(closer), end);
                    return null;
                }
                if (buffer == null) {
                    buffer = new StringBuilder(end - start + 16);
                    buffer.append(input, start, end);
                }

                int next = state.codePointAt(end + size);
                int nextSize = Character.charCount(next);
                if (next == 'u') {
                    int digits = end + size + nextSize;
                    int value = 0;
                    for (int i = 0; i < 4; i++) {
                        int at = digits + i;
                        if (at >= length) {
                            state.errorAt(EXPECTED_HEX_DIGITS, at);
                            return null;
                        }
                        int digit = hexValue(input.charAt(at));
                        if (digit < 0) {
                            state.errorAt(EXPECTED_HEX_DIGIT, at);
                            return null;
                        }
                        value = (value << 4) | digit;
                    }
                    buffer.appendCodePoint(Character.isSurrogate((char) value) ? REPLACEMENT_CHARACTER : value);
                    end = digits + 4;
                } else {
                    if (next == closer) {
                        buffer.appendCodePoint(next);
                    } else {
                        int replacement = escapes.lookup(next);
                        if (replacement >= 0) {
                            buffer.appendCodePoint(replacement);
                        } else {
                            buffer.append('\\').appendCodePoint(next);
                        }
                    }
                    end += size + nextSize;
                }
            } else if (current == closer) {
                state.pos = end + size;
                if (buffer == null) {
                    return new StringNode(input, start, end);
                }
                return new StringNode(input, start, end, buffer.toString());
            } else {
                if (buffer != null) {
                    buffer.appendCodePoint(current);
                }
                end += size;
            }
        }

        state.errorAt(closerLabel(closer), length);
        return null;
    }

    /**
     * The expectation recorded when a closer is missing: the closer itself.
     */
    public static String closerLabel(int closer) {
        return new String(Character.toChars(closer));
    }

    static int hexValue(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        }
        if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        return -1;
    }
}
