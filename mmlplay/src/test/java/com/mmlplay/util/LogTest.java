package com.mmlplay.util;

import static org.junit.jupiter.api.Assertions.*;

import java.util.EnumSet;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

public class LogTest {

    @AfterEach
    public void restore() {
        Log.setLevel(Log.Level.INFO);
        Log.setCategories(EnumSet.allOf(Log.Cat.class));
        Log.setTimestamps(false);
    }

    @Test
    public void levelFiltering() {
        Log.setLevel(Log.Level.WARN);
        assertFalse(Log.isEnabled(Log.Level.INFO, Log.Cat.PARSER));
        assertTrue(Log.isEnabled(Log.Level.ERROR, Log.Cat.PARSER));
    }

    @Test
    public void configure_levelAndCategories() {
        Log.configure("trace", "parser, sound", false);
        assertEquals(Log.Level.TRACE, Log.getLevel());
        assertTrue(Log.isEnabled(Log.Level.TRACE, Log.Cat.SOUND));
        assertFalse(Log.isEnabled(Log.Level.ERROR, Log.Cat.CONFIG));
    }

    @Test
    public void configure_invalidValues_keepCurrent() {
        Log.setLevel(Log.Level.DEBUG);
        Log.configure("LOUD", "NOPE", false);
        assertEquals(Log.Level.DEBUG, Log.getLevel());
        assertTrue(Log.isEnabled(Log.Level.DEBUG, Log.Cat.GENERAL));
    }

    @Test
    public void configure_all_reenablesEverything() {
        Log.setCategories(EnumSet.of(Log.Cat.PARSER));
        Log.configure(null, "ALL", false);
        for (Log.Cat c : Log.Cat.values())
            assertTrue(Log.isEnabled(Log.Level.ERROR, c));
    }
}
