package org.literalscan.parser;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps the letter following a backslash to the character it stands for.
 * <p>
 * Tables are immutable; {@link #with(int, int)} returns a copy.
 */
public final class EscapeTable {

    public static final EscapeTable DEFAULT = new EscapeTable(Map.of(
            (int) 'a', 0x07,
            (int) 'b', (int) '\b',
            (int) 'f', (int) '\f',
            (int) 'n', (int) '\n',
            (int) 'r', (int) '\r',
            (int) 't', (int) '\t',
            (int) 'v', 0x0B
    ));

    public static final EscapeTable EMPTY = new EscapeTable(Map.of());

    private final Map<Integer, Integer> escapes;

    private EscapeTable(Map<Integer, Integer> escapes) {
        this.escapes = escapes;
    }

    public static EscapeTable of(Map<Integer, Integer> escapes) {
        return new EscapeTable(Collections.unmodifiableMap(new HashMap<>(escapes)));
    }

    /**
     * @return the replacement code point, or -1 if the letter is not an escape
     */
    public int lookup(int letter) {
        Integer replacement = escapes.get(letter);
        return replacement == null ? -1 : replacement;
    }

    public boolean contains(int letter) {
        return escapes.containsKey(letter);
    }

    public EscapeTable with(int letter, int replacement) {
        Map<Integer, Integer> copy = new HashMap<>(escapes);
        copy.put(letter, replacement);
        return new EscapeTable(Collections.unmodifiableMap(copy));
    }

    public Map<Integer, Integer> asMap() {
        return escapes;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("EscapeTable{");
        escapes.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> sb.append(' ')
                        .appendCodePoint(e.getKey())
                        .append("=U+")
                        .append(String.format("%04X", e.getValue())));
        return sb.append(" }").toString();
    }
}
