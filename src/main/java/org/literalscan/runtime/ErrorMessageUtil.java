package org.literalscan.runtime;

import org.literalscan.lexer.ScanError;

/**
 * Utility class for turning a source offset into a user facing error message with
 * line, column and the offending source line.
 */
public class ErrorMessageUtil {
    private final String fileName;
    private final String source;

    /**
     * @param fileName the name shown in messages, e.g. {@code -e} for inline code
     * @param source   the source text the offsets refer to
     */
    public ErrorMessageUtil(String fileName, String source) {
        this.fileName = fileName;
        this.source = source;
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * Quotes the specified string for inclusion in an error message.
     * Escapes special characters such as newlines, tabs, and backslashes.
     */
    static String errorMessageQuote(String str) {
        StringBuilder escaped = new StringBuilder();
        for (char c : str.toCharArray()) {
            switch (c) {
                case '\n':
                    escaped.append("\\n");
                    break;
                case '\t':
                    escaped.append("\\t");
                    break;
                case '\\':
                    escaped.append("\\\\");
                    break;
                case '\"':
                    escaped.append("\\\"");
                    break;
                default:
                    escaped.append(c);
            }
        }
        return "\"" + escaped + "\"";
    }

    // Labels made of words read better unquoted: expected number, expected string delimiter
    static String formatExpected(String expected) {
        for (int i = 0; i < expected.length(); i++) {
            char c = expected.charAt(i);
            if (!Character.isLetter(c) && c != ' ') {
                return errorMessageQuote(expected);
            }
        }
        return expected;
    }

    /**
     * Returns the 1-based line number of the offset.
     */
    public int lineNumber(int offset) {
        int line = 1;
        int limit = Math.min(offset, source.length());
        for (int i = 0; i < limit; i++) {
            if (source.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    /**
     * Returns the 1-based column of the offset, counted in code points.
     */
    public int columnNumber(int offset) {
        int limit = Math.min(offset, source.length());
        int lineStart = source.lastIndexOf('\n', limit - 1) + 1;
        return source.codePointCount(lineStart, limit) + 1;
    }

    /**
     * Formats "file: line L, column C: expected X", followed by the source line and a
     * caret under the column.
     */
    public String errorMessage(int offset, String expected) {
        int limit = Math.min(Math.max(offset, 0), source.length());
        int line = lineNumber(limit);
        int column = columnNumber(limit);

        int lineStart = source.lastIndexOf('\n', limit - 1) + 1;
        int lineEnd = source.indexOf('\n', limit);
        if (lineEnd < 0) {
            lineEnd = source.length();
        }
        String sourceLine = source.substring(lineStart, lineEnd);

        return fileName + ": line " + line + ", column " + column + ": expected " + formatExpected(expected) + "\n"
                + caretSafe(sourceLine) + "\n"
                + " ".repeat(column - 1) + "^\n";
    }

    // Control characters become spaces so the caret stays under the column
    private static String caretSafe(String line) {
        StringBuilder sb = new StringBuilder(line.length());
        for (char c : line.toCharArray()) {
            sb.append(Character.isISOControl(c) ? ' ' : c);
        }
        return sb.toString();
    }

    public String errorMessage(ScanError error) {
        return errorMessage(error.getPos(), error.getExpected());
    }
}
