package org.literalscan.lexer;

/**
 * Records the furthest failure seen during one parse attempt.
 * <p>
 * A failure replaces the current one only when its offset is at or beyond the offset
 * already recorded. Failures further back are dropped, so after the grammar has
 * backtracked through many alternatives the sink still holds the most informative
 * expectation.
 */
public class ScanError {
    private String expected;
    private int pos = -1;

    /**
     * Records a failure if it is not behind the furthest one recorded so far.
     *
     * @param expected human readable description of what was expected
     * @param pos      offset into the source where the expectation failed
     * @return true if the failure replaced the previous one
     */
    public boolean record(String expected, int pos) {
        if (pos < this.pos) {
            return false;
        }
        this.expected = expected;
        this.pos = pos;
        return true;
    }

    public boolean isSet() {
        return expected != null;
    }

    public String getExpected() {
        return expected;
    }

    public int getPos() {
        return pos;
    }

    @Override
    public String toString() {
        if (expected == null) {
            return "no error";
        }
        return "offset " + pos + ": expected " + expected;
    }
}
