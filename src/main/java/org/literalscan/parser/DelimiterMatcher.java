package org.literalscan.parser;

/**
 * Decides whether a code point may open a delimited literal, and which code point
 * closes it.
 *
 * @see QuoteSet
 * @see DelimiterTables#UNICODE
 */
@FunctionalInterface
public interface DelimiterMatcher {

    /**
     * @param opener the candidate opening code point, or -1 at end of input
     * @return the matched closer, or {@link Match#NONE} if the opener is rejected
     */
    Match match(int opener);

    /**
     * Result of a delimiter lookup.
     *
     * @param valid  whether the opener was accepted
     * @param closer the closing code point, -1 when not valid
     */
    record Match(boolean valid, int closer) {
        public static final Match NONE = new Match(false, -1);

        public static Match of(int closer) {
            return new Match(true, closer);
        }

        public boolean isSymmetric(int opener) {
            return valid && closer == opener;
        }
    }
}
