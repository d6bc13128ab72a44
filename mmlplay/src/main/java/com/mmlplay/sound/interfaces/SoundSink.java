package com.mmlplay.sound.interfaces;

/**
 * Output boundary of the interpreter. Called once per event, strictly in
 * order. Real implementations block until the event's nominal duration has
 * elapsed; recording implementations may return immediately.
 */
public interface SoundSink {

    /** Sound a tone. Values are already rounded. */
    void sound(int frequencyHz, int durationMs);

    /** Stay silent for the given time (pause or sub-audible pitch). */
    void rest(int durationMs);
}
