package org.literalscan.parser;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.lang.UCharacterCategory;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Delimiter pairing tables for literals with Unicode delimiters.
 * <p>
 * Well known quotes and brackets close with their partner. Any other punctuation
 * character, and {@code >}, closes with itself, which lets {@code /}, {@code #} or
 * {@code !} serve as ad hoc delimiters. Math symbols such as {@code |} and {@code +}
 * are not punctuation and are rejected.
 */
public final class DelimiterTables {

    // Initial quote punctuation closed by final quote punctuation (Pi/Pf)
    public static final Map<Integer, Integer> INITIAL_FINAL = pairs(
            "«‘“‹⸂⸄⸉⸌⸜⸠",
            "»’”›⸃⸅⸊⸍⸝⸡");

    // Low-9 quotes are open punctuation but close with a final quote (Ps/Pf)
    public static final Map<Integer, Integer> OPEN_FINAL = pairs(
            "‚„",
            "’”");

    // Open punctuation closed by close punctuation (Ps/Pe)
    public static final Map<Integer, Integer> OPEN_CLOSE = pairs(
            "([{༺༼᚛⁅⁽₍❨❪❬❮❰"
                    + "❲❴⟅⟦⟨⟪⦃⦅⦇⦉⦋"
                    + "⦑⦓⦕⦗⧘⧚⧼〈《「『"
                    + "【〔〖〘〚〝︗︵︷︹︻"
                    + "︽︿﹁﹃﹇﹙﹛﹝（［｛"
                    + "｟｢⸨",
            ")]}༻༽᚜⁆⁾₎❩❫❭❯❱"
                    + "❳❵⟆⟧⟩⟫⦄⦆⦈⦊⦌"
                    + "⦒⦔⦖⦘⧙⧛⧽〉》」』"
                    + "】〕〗〙〛〞︘︶︸︺︼"
                    + "︾﹀﹂﹄﹈﹚﹜﹞）］｝"
                    + "｠｣⸩");

    // Math symbols used as brackets (Sm/Sm)
    public static final Map<Integer, Integer> SYMBOL_PAIRS = pairs("<", ">");

    // Lookup order matters: the first table holding the opener wins
    private static final List<Map<Integer, Integer>> LOOKUP_ORDER =
            List.of(INITIAL_FINAL, OPEN_FINAL, OPEN_CLOSE, SYMBOL_PAIRS);

    /**
     * Paired quotes and brackets from the tables, falling back to any Unicode
     * punctuation character or {@code >} as a self-closing delimiter.
     */
    public static final DelimiterMatcher UNICODE = DelimiterTables::matchUnicode;

    private DelimiterTables() {
    }

    private static DelimiterMatcher.Match matchUnicode(int opener) {
        if (opener < 0) {
            return DelimiterMatcher.Match.NONE;
        }
        for (Map<Integer, Integer> table : LOOKUP_ORDER) {
            Integer closer = table.get(opener);
            if (closer != null) {
                return DelimiterMatcher.Match.of(closer);
            }
        }
        if (isPunctuation(opener) || opener == '>') {
            return DelimiterMatcher.Match.of(opener);
        }
        return DelimiterMatcher.Match.NONE;
    }

    /**
     * True for the Unicode general categories Pc, Pd, Ps, Pe, Pi, Pf and Po.
     */
    public static boolean isPunctuation(int codePoint) {
        switch (UCharacter.getType(codePoint)) {
            case UCharacterCategory.CONNECTOR_PUNCTUATION:
            case UCharacterCategory.DASH_PUNCTUATION:
            case UCharacterCategory.START_PUNCTUATION:
            case UCharacterCategory.END_PUNCTUATION:
            case UCharacterCategory.INITIAL_PUNCTUATION:
            case UCharacterCategory.FINAL_PUNCTUATION:
            case UCharacterCategory.OTHER_PUNCTUATION:
                return true;
            default:
                return false;
        }
    }

    private static Map<Integer, Integer> pairs(String openers, String closers) {
        if (openers.length() != closers.length()) {
            throw new IllegalStateException("Unbalanced delimiter table: " + openers);
        }
        Map<Integer, Integer> map = new HashMap<>();
        for (int i = 0; i < openers.length(); i++) {
            map.put((int) openers.charAt(i), (int) closers.charAt(i));
        }
        return Collections.unmodifiableMap(map);
    }
}
