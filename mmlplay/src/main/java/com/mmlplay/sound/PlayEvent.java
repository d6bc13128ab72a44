package com.mmlplay.sound;

import java.util.Objects;

/**
 * One externally observable event: a tone with a frequency, or silence.
 */
public final class PlayEvent {

    public enum Kind {
        TONE, SILENCE
    }

    private final Kind kind;
    private final int frequencyHz; // 0 for silence
    private final int durationMs;

    private PlayEvent(Kind kind, int frequencyHz, int durationMs) {
        this.kind = kind;
        this.frequencyHz = frequencyHz;
        this.durationMs = durationMs;
    }

    public static PlayEvent tone(int frequencyHz, int durationMs) {
        return new PlayEvent(Kind.TONE, frequencyHz, durationMs);
    }

    public static PlayEvent silence(int durationMs) {
        return new PlayEvent(Kind.SILENCE, 0, durationMs);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isTone() {
        return kind == Kind.TONE;
    }

    public int getFrequencyHz() {
        return frequencyHz;
    }

    public int getDurationMs() {
        return durationMs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PlayEvent))
            return false;
        PlayEvent other = (PlayEvent) o;
        return kind == other.kind && frequencyHz == other.frequencyHz && durationMs == other.durationMs;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, frequencyHz, durationMs);
    }

    @Override
    public String toString() {
        if (kind == Kind.TONE)
            return "Tone{" + frequencyHz + "Hz, " + durationMs + "ms}";
        return "Silence{" + durationMs + "ms}";
    }
}
