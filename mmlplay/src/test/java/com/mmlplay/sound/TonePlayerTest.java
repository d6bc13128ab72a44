package com.mmlplay.sound;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/**
 * PCM rendering checks. The output line is never opened here so the tests run
 * on machines without a sound card.
 */
public class TonePlayerTest {

    private static int sampleAt(byte[] pcm, int frame) {
        return (short) ((pcm[frame * 2] & 0xFF) | (pcm[frame * 2 + 1] << 8));
    }

    @Test
    public void renderTone_frameCountMatchesDuration() {
        TonePlayer p = new TonePlayer(8000, 1.0);
        byte[] pcm = p.renderTone(440, 250);
        assertEquals(2000 * 2, pcm.length);
    }

    @Test
    public void renderTone_fadesInAndOut() {
        TonePlayer p = new TonePlayer(8000, 1.0);
        byte[] pcm = p.renderTone(1000, 100);
        int frames = pcm.length / 2;
        assertEquals(0, sampleAt(pcm, 0));
        assertEquals(0, sampleAt(pcm, frames - 1));
    }

    @Test
    public void renderTone_volumeBoundsAmplitude() {
        TonePlayer p = new TonePlayer(8000, 0.25);
        byte[] pcm = p.renderTone(440, 200);
        int peak = 0;
        for (int i = 0; i < pcm.length / 2; i++)
            peak = Math.max(peak, Math.abs(sampleAt(pcm, i)));
        assertTrue(peak > 7000, "peak " + peak);
        assertTrue(peak <= 8192, "peak " + peak);
    }

    @Test
    public void renderTone_zeroDuration_isEmpty() {
        assertEquals(0, new TonePlayer().renderTone(440, 0).length);
    }

    @Test
    public void withoutLine_fallsBackToTiming() {
        TonePlayer p = new TonePlayer();
        assertFalse(p.isOpen());
        long start = System.nanoTime();
        p.sound(440, 20);
        p.rest(20);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000L;
        assertTrue(elapsedMs >= 35, "elapsed " + elapsedMs);
        p.close(); // no-op when never opened
    }
}
