package org.literalscan.lexer;

import org.literalscan.parser.Whitespace;

/**
 * Shared state of one parse attempt: the immutable source text, the scan cursor and the
 * furthest-error sink.
 * <p>
 * Offsets are UTF-16 code unit indices into {@link #input}. Supplementary code points
 * are read through {@link #codePointAt(int)} and always advance the cursor by
 * {@link Character#charCount(int)}.
 * <p>
 * A ScanState is not thread-safe and must not be shared between concurrent attempts.
 */
public class ScanState {
    // Source text
    public final String input;
    // Length of the source text
    public final int length;
    // Current position in the source text
    public int pos;

    private final ScanError error = new ScanError();
    private final Whitespace whitespace;
    private boolean debugEnabled;

    public ScanState(String input) {
        this(input, Whitespace.ASCII);
    }

    public ScanState(String input, Whitespace whitespace) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
        this.whitespace = whitespace;
    }

    /**
     * Returns the code point starting at the given offset, or -1 at end of input.
     * A lone surrogate is returned as is.
     */
    public int codePointAt(int offset) {
        if (offset >= length) {
            return -1;
        }
        char c1 = input.charAt(offset);
        if (Character.isHighSurrogate(c1) && offset + 1 < length) {
            char c2 = input.charAt(offset + 1);
            if (Character.isLowSurrogate(c2)) {
                return Character.toCodePoint(c1, c2);
            }
        }
        return c1;
    }

    /**
     * Runs the whitespace hook from the current position.
     */
    public void skipWhitespace() {
        pos = whitespace.skip(input, pos);
    }

    /**
     * Records a failure at the current cursor position.
     */
    public void errorHere(String expected) {
        error.record(expected, pos);
    }

    public void errorAt(String expected, int offset) {
        error.record(expected, offset);
    }

    public ScanError getError() {
        return error;
    }

    public boolean isAtEnd() {
        return pos >= length;
    }

    public boolean isDebugEnabled() {
        return debugEnabled;
    }

    public void setDebugEnabled(boolean debugEnabled) {
        this.debugEnabled = debugEnabled;
    }

    public void logDebug(String message) {
        if (debugEnabled) {
            System.out.println(message);
        }
    }

    @Override
    public String toString() {
        return "ScanState{" +
                "pos=" + pos +
                ", length=" + length +
                ", error=" + error +
                '}';
    }
}
