package com.mmlplay.sound;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.mmlplay.sound.interfaces.SoundSink;

/**
 * Collects events instead of playing them. Used for dry runs and tests.
 */
public class RecordingSink implements SoundSink {

    private final List<PlayEvent> events = new ArrayList<>();

    @Override
    public void sound(int frequencyHz, int durationMs) {
        events.add(PlayEvent.tone(frequencyHz, durationMs));
    }

    @Override
    public void rest(int durationMs) {
        events.add(PlayEvent.silence(durationMs));
    }

    public List<PlayEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public List<PlayEvent> getTones() {
        List<PlayEvent> out = new ArrayList<>();
        for (PlayEvent e : events)
            if (e.isTone())
                out.add(e);
        return out;
    }

    /** Sum of all event durations in milliseconds. */
    public long getTotalDurationMs() {
        long total = 0;
        for (PlayEvent e : events)
            total += e.getDurationMs();
        return total;
    }

    public void clear() {
        events.clear();
    }
}
