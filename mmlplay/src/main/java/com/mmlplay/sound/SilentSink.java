package com.mmlplay.sound;

import com.mmlplay.sound.interfaces.SoundSink;

/** Reference sink when no device is wanted: accepts every event, does nothing. */
public final class SilentSink implements SoundSink {

    public static final SilentSink INSTANCE = new SilentSink();

    private SilentSink() {
    }

    @Override
    public void sound(int frequencyHz, int durationMs) {
    }

    @Override
    public void rest(int durationMs) {
    }
}
