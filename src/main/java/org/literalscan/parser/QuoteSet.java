package org.literalscan.parser;

import java.util.Arrays;

/**
 * Fixed set of quote characters. Each quote closes with itself.
 */
public final class QuoteSet implements DelimiterMatcher {
    private final String quotes;
    private final int[] codePoints;

    public QuoteSet(String quotes) {
        if (quotes == null || quotes.isEmpty()) {
            throw new IllegalArgumentException("Quote set must not be empty");
        }
        this.quotes = quotes;
        this.codePoints = quotes.codePoints().sorted().distinct().toArray();
    }

    public boolean contains(int codePoint) {
        return codePoint >= 0 && Arrays.binarySearch(codePoints, codePoint) >= 0;
    }

    @Override
    public Match match(int opener) {
        return contains(opener) ? Match.of(opener) : Match.NONE;
    }

    /**
     * The quotes as given; used as the expectation label when no quote is found.
     */
    public String getQuotes() {
        return quotes;
    }

    @Override
    public String toString() {
        return "QuoteSet(" + quotes + ")";
    }
}
