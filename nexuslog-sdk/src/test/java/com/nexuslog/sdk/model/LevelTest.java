package com.nexuslog.sdk.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LevelTest {

    @Test
    void levelsAreOrderedBySeverity() {
        assertTrue(Level.TRACE.compareTo(Level.DEBUG) < 0);
        assertTrue(Level.DEBUG.compareTo(Level.INFO) < 0);
        assertTrue(Level.INFO.compareTo(Level.WARN) < 0);
        assertTrue(Level.WARN.compareTo(Level.ERROR) < 0);
    }

    @Test
    void isAtLeastComparesAgainstThreshold() {
        assertTrue(Level.ERROR.isAtLeast(Level.WARN));
        assertTrue(Level.INFO.isAtLeast(Level.INFO));
        assertFalse(Level.DEBUG.isAtLeast(Level.INFO));
    }

    @Test
    void getValueIsLowercaseLabel() {
        assertEquals("trace", Level.TRACE.getValue());
        assertEquals("debug", Level.DEBUG.getValue());
        assertEquals("info", Level.INFO.getValue());
        assertEquals("warn", Level.WARN.getValue());
        assertEquals("error", Level.ERROR.getValue());
    }

    @Test
    void fromValueCaseInsensitive() {
        assertEquals(Level.INFO, Level.fromValue("INFO"));
        assertEquals(Level.DEBUG, Level.fromValue("Debug"));
        assertEquals(Level.WARN, Level.fromValue("warning"));
    }

    @Test
    void fromValueThrowsOnUnknown() {
        assertThrows(IllegalArgumentException.class, () -> Level.fromValue("FATAL"));
    }
}
