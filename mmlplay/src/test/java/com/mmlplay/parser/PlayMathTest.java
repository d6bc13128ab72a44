package com.mmlplay.parser;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

public class PlayMathTest {

    @Test
    public void concertA_andOctaveAbove() {
        assertEquals(440, PlayMath.frequencyHz(49));
        assertEquals(880, PlayMath.frequencyHz(61));
        assertEquals(220, PlayMath.frequencyHz(37));
    }

    @Test
    public void middleC_roundsTo262() {
        // 261.6256 Hz
        assertEquals(262, PlayMath.frequencyHz(40));
    }

    @Test
    public void audibleThreshold() {
        assertFalse(PlayMath.isAudible(PlayMath.PAUSE));
        assertFalse(PlayMath.isAudible(5));
        assertTrue(PlayMath.isAudible(6));
    }

    @Test
    public void duration_quarterAtDefaultTempo() {
        // 500ms * 0.875 = 437.5 -> half-up
        assertEquals(438, PlayMath.durationMs(120, 4, 1.0, Articulation.NORMAL));
        assertEquals(500, PlayMath.durationMs(120, 4, 1.0, Articulation.LEGATO));
        assertEquals(375, PlayMath.durationMs(120, 4, 1.0, Articulation.STACCATO));
    }

    @Test
    public void duration_scalesWithLengthAndDots() {
        assertEquals(219, PlayMath.durationMs(120, 8, 1.0, Articulation.NORMAL));
        assertEquals(656, PlayMath.durationMs(120, 4, 1.5, Articulation.NORMAL));
        assertEquals(766, PlayMath.durationMs(120, 4, 1.75, Articulation.NORMAL));
        assertEquals(3500, PlayMath.durationMs(120, 1, 1.75, Articulation.LEGATO));
    }

    @Test
    public void duration_tempoBounds() {
        assertEquals(1641, PlayMath.durationMs(32, 4, 1.0, Articulation.NORMAL));
        assertEquals(206, PlayMath.durationMs(255, 4, 1.0, Articulation.NORMAL));
    }

    @Test
    public void dotMultiplier_values() {
        assertEquals(1.0, PlayMath.dotMultiplier(0));
        assertEquals(1.5, PlayMath.dotMultiplier(1));
        assertEquals(1.75, PlayMath.dotMultiplier(2));
        assertThrows(IllegalArgumentException.class, () -> PlayMath.dotMultiplier(3));
    }
}
