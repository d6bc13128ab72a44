package com.mmlplay.parser;

/**
 * Mutable per-call interpreter state. One instance lives for exactly one
 * {@link PlayInterpreter#interpret(String)} invocation.
 */
public final class InterpreterState {

    public static final int MIN_OCTAVE = 0;
    public static final int MAX_OCTAVE = 6;
    public static final int MIN_TEMPO = 32;
    public static final int MAX_TEMPO = 255;
    public static final int MIN_NOTE_LENGTH = 1;
    public static final int MAX_NOTE_LENGTH = 64;

    public static final int DEFAULT_OCTAVE = 3;
    public static final int DEFAULT_TEMPO = 120;
    public static final int DEFAULT_NOTE_LENGTH = 4;

    private int octave = DEFAULT_OCTAVE;
    private int tempo = DEFAULT_TEMPO; // quarter notes per minute
    private int noteLength = DEFAULT_NOTE_LENGTH; // denominator of a whole note
    private Articulation articulation = Articulation.NORMAL;

    public int getOctave() {
        return octave;
    }

    void setOctave(int octave) {
        this.octave = octave;
    }

    public int getTempo() {
        return tempo;
    }

    void setTempo(int tempo) {
        this.tempo = tempo;
    }

    public int getNoteLength() {
        return noteLength;
    }

    void setNoteLength(int noteLength) {
        this.noteLength = noteLength;
    }

    public Articulation getArticulation() {
        return articulation;
    }

    void setArticulation(Articulation articulation) {
        this.articulation = articulation;
    }
}
