package org.literalscan.lexer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ScanErrorTest {

    @Test
    public void testEmptySink() {
        ScanError error = new ScanError();
        assertFalse(error.isSet());
        assertNull(error.getExpected());
        assertEquals("no error", error.toString());
    }

    @Test
    public void testFurthestErrorWins() {
        ScanError error = new ScanError();
        assertTrue(error.record("number", 3));
        assertTrue(error.record("\"", 10));
        assertFalse(error.record("string delimiter", 0), "Earlier failure must be discarded");

        assertEquals("\"", error.getExpected());
        assertEquals(10, error.getPos());
        assertEquals("offset 10: expected \"", error.toString());
    }

    @Test
    public void testSamePositionOverwrites() {
        ScanError error = new ScanError();
        error.record("number", 4);
        assertTrue(error.record("regexp delimiter", 4));
        assertEquals("regexp delimiter", error.getExpected());
    }

    @Test
    public void testFirstRecordAtOffsetZero() {
        ScanError error = new ScanError();
        assertTrue(error.record("number", 0));
        assertTrue(error.isSet());
        assertEquals(0, error.getPos());
    }
}
