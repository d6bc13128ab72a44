package com.mmlplay.sound;

import com.mmlplay.sound.interfaces.SoundSink;
import com.mmlplay.util.Log;
import static com.mmlplay.util.Log.Cat.*;

/**
 * Keeps the notation's timing without producing sound: every event blocks the
 * caller for its duration.
 */
public class SleepingSink implements SoundSink {

    @Override
    public void sound(int frequencyHz, int durationMs) {
        Log.trace(SOUND, "(mudo) %dHz por %dms", frequencyHz, durationMs);
        pause(durationMs);
    }

    @Override
    public void rest(int durationMs) {
        pause(durationMs);
    }

    protected void pause(int durationMs) {
        if (durationMs <= 0)
            return;
        try {
            Thread.sleep(durationMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
