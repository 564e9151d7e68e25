package org.literalscan.parser;

import com.ibm.icu.lang.UCharacter;

import java.util.Locale;

/**
 * Whitespace policy invoked once at the start of every literal parse.
 * <p>
 * Implementations return the offset of the first character that is not whitespace,
 * starting from {@code pos}. They never move backwards and never run past the input.
 */
@FunctionalInterface
public interface Whitespace {

    /**
     * Space, tab, carriage return and line feed.
     */
    Whitespace ASCII = (input, pos) -> {
        int length = input.length();
        while (pos < length) {
            char c = input.charAt(pos);
            if (c != ' ' && c != '\t' && c != '\r' && c != '\n') {
                break;
            }
            pos++;
        }
        return pos;
    };

    /**
     * Any code point with the Unicode White_Space property.
     */
    Whitespace UNICODE = (input, pos) -> {
        int length = input.length();
        while (pos < length) {
            int cp = input.codePointAt(pos);
            if (!UCharacter.isUWhiteSpace(cp)) {
                break;
            }
            pos += Character.charCount(cp);
        }
        return pos;
    };

    Whitespace NONE = (input, pos) -> pos;

    int skip(String input, int pos);

    /**
     * Looks up a policy by its configuration name.
     *
     * @param name one of {@code ascii}, {@code unicode} or {@code none}
     * @throws IllegalArgumentException if the name is unknown
     */
    static Whitespace forName(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "ascii" -> ASCII;
            case "unicode" -> UNICODE;
            case "none" -> NONE;
            default -> throw new IllegalArgumentException("Unknown whitespace policy: " + name);
        };
    }
}
