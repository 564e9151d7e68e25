package org.literalscan.runtime;

public class ScalarUtils {

    /**
     * Renders a string for diagnostics: control characters become {@code \xHH}.
     */
    public static String printable(String string) {
        if (string == null) {
            return "null";
        }
        if (string.isEmpty()) {
            return "empty";
        }

        StringBuilder result = new StringBuilder();
        for (char c : string.toCharArray()) {
            if (Character.isISOControl(c)) {
                result.append(String.format("\\x%02X", (int) c));
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }

    /**
     * Renders a single code point, using {@code EOF} for -1.
     */
    public static String printableCodePoint(int codePoint) {
        if (codePoint < 0) {
            return "EOF";
        }
        return printable(new String(Character.toChars(codePoint)));
    }
}
