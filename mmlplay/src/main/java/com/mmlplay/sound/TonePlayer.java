package com.mmlplay.sound;

import javax.sound.sampled.*;

import com.mmlplay.sound.interfaces.SoundSink;
import com.mmlplay.util.Log;
import static com.mmlplay.util.Log.Cat.*;

/**
 * Simple JavaSound player that synthesizes a sine tone per event, converts it
 * to 16-bit PCM signed mono and writes it to a SourceDataLine. Writes block, so
 * each call returns roughly when the event has been rendered. When the line
 * cannot be opened the player keeps timing by sleeping instead.
 */
public class TonePlayer extends SleepingSink implements AutoCloseable {

    public static final int DEFAULT_SAMPLE_RATE = 44100;
    public static final double DEFAULT_VOLUME = 0.5;

    // short linear fade at both ends to avoid clicks
    private static final int FADE_MS = 4;

    private final int sampleRate;
    private final double volume;
    private SourceDataLine line;

    public TonePlayer() {
        this(DEFAULT_SAMPLE_RATE, DEFAULT_VOLUME);
    }

    public TonePlayer(int sampleRate, double volume) {
        this.sampleRate = sampleRate;
        this.volume = Math.max(0.0, Math.min(1.0, volume));
    }

    /**
     * Opens the default output line.
     *
     * @return true when audio output is available
     */
    public synchronized boolean open() {
        if (line != null)
            return true;
        try {
            AudioFormat fmt = new AudioFormat(sampleRate, 16, 1, true, false);
            DataLine.Info info = new DataLine.Info(SourceDataLine.class, fmt);
            line = (SourceDataLine) AudioSystem.getLine(info);
            line.open(fmt, 4096);
            line.start();
            Log.info(SOUND, "Saída de áudio aberta (%d Hz, volume %.2f)", sampleRate, volume);
            return true;
        } catch (LineUnavailableException | IllegalArgumentException | SecurityException e) {
            Log.warn(SOUND, "Falha ao iniciar áudio: %s (usando temporização silenciosa)", e.getMessage());
            line = null;
            return false;
        }
    }

    public synchronized boolean isOpen() {
        return line != null;
    }

    @Override
    public synchronized void sound(int frequencyHz, int durationMs) {
        if (line == null) {
            super.sound(frequencyHz, durationMs);
            return;
        }
        write(renderTone(frequencyHz, durationMs));
    }

    @Override
    public synchronized void rest(int durationMs) {
        if (line == null) {
            super.rest(durationMs);
            return;
        }
        write(new byte[frameCount(durationMs) * 2]);
    }

    /** Builds the PCM bytes for one tone (little endian, signed 16-bit). */
    byte[] renderTone(int frequencyHz, int durationMs) {
        int frames = frameCount(durationMs);
        int fade = Math.min(frames / 2, sampleRate * FADE_MS / 1000);
        byte[] out = new byte[frames * 2];
        double step = 2.0 * Math.PI * frequencyHz / sampleRate;
        int idx = 0;
        for (int i = 0; i < frames; i++) {
            double env = 1.0;
            if (fade > 0) {
                if (i < fade)
                    env = (double) i / fade;
                else if (i >= frames - fade)
                    env = (double) (frames - 1 - i) / fade;
            }
            int s = (int) Math.round(Math.sin(step * i) * env * volume * 32767.0);
            if (s < -32768)
                s = -32768;
            if (s > 32767)
                s = 32767;
            out[idx++] = (byte) (s & 0xFF);
            out[idx++] = (byte) ((s >>> 8) & 0xFF);
        }
        return out;
    }

    private int frameCount(int durationMs) {
        if (durationMs <= 0)
            return 0;
        return (int) ((long) sampleRate * durationMs / 1000L);
    }

    private void write(byte[] pcm) {
        if (pcm.length > 0)
            line.write(pcm, 0, pcm.length);
    }

    @Override
    public synchronized void close() {
        if (line == null)
            return;
        try {
            line.drain();
            line.stop();
        } finally {
            line.close();
            line = null;
            Log.info(SOUND, "Saída de áudio fechada");
        }
    }
}
