package com.mmlplay.parser;

import java.util.Objects;

import com.mmlplay.sound.interfaces.SoundSink;
import com.mmlplay.util.Log;
import static com.mmlplay.util.Log.Cat.*;

/**
 * Single-pass interpreter for PLAY-style music notation.
 *
 * Recognized tokens (case-insensitive):
 * - {@code O<d>} set octave, {@code <} / {@code >} step octave
 * - {@code A..G} notes with optional {@code +}/{@code #}/{@code -}, inline
 * length and dots
 * - {@code N<n>} explicit note number 0..84 with optional dots
 * - {@code P<n>} pause of length n with optional dots
 * - {@code L<n>} default note length, {@code T<n>} tempo
 * - {@code MB MF MN ML MS} mode/articulation
 *
 * Each token is evaluated as soon as it is scanned; events go straight to the
 * {@link SoundSink}. The first error aborts the call.
 */
public class PlayInterpreter {

    // pitch class of each letter A..G inside a C-based octave (A=1 .. G=11)
    private static final int[] NOTE_OFFSET = { 1, 3, 4, 6, 8, 9, 11 };

    // the explicit note number convention is shifted by 5 relative to the pitch index
    private static final int NOTE_NUMBER_OFFSET = 5;
    private static final int MAX_NOTE_NUMBER = 84;

    private static final char VERTICAL_TAB = 0x0B;

    private final SoundSink sink;

    public PlayInterpreter(SoundSink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Interprets the whole text, emitting every event in order.
     *
     * @param text notation to play
     * @throws PlaySyntaxException on the first malformed or out-of-range token
     */
    public void interpret(String text) {
        Objects.requireNonNull(text, "text");
        run(new Cursor(text), new InterpreterState());
    }

    void run(Cursor cursor, InterpreterState state) {
        while (cursor.hasCurrent()) {
            char c = cursor.current();
            switch (c) {
                case '\t', '\n', VERTICAL_TAB, '\f', '\r', ' ' -> {
                    // ignored
                }
                case 'O' -> {
                    state.setOctave(parseOctave(cursor));
                    Log.debug(PARSER, "octave=%d @%d", state.getOctave(), cursor.getIndex());
                }
                case '<' -> stepOctave(cursor, state, -1);
                case '>' -> stepOctave(cursor, state, +1);
                case 'A', 'B', 'C', 'D', 'E', 'F', 'G' -> playLetter(cursor, state, c);
                case 'N' -> playNumber(cursor, state);
                case 'P' -> playPause(cursor, state);
                case 'L' -> {
                    state.setNoteLength(parseNoteLength(cursor));
                    Log.debug(PARSER, "noteLength=%d @%d", state.getNoteLength(), cursor.getIndex());
                }
                case 'T' -> {
                    state.setTempo(parseTempo(cursor));
                    Log.debug(PARSER, "tempo=%d @%d", state.getTempo(), cursor.getIndex());
                }
                case 'M' -> parseMode(cursor, state);
                default -> throw cursor.fail(PlayError.UNEXPECTED_CHARACTER);
            }
            cursor.advance();
        }
    }

    private void stepOctave(Cursor cursor, InterpreterState state, int delta) {
        int octave = state.getOctave() + delta;
        if (octave < InterpreterState.MIN_OCTAVE || octave > InterpreterState.MAX_OCTAVE)
            throw cursor.fail(PlayError.OCTAVE_OUT_OF_RANGE);
        state.setOctave(octave);
        Log.debug(PARSER, "octave=%d @%d", octave, cursor.getIndex());
    }

    private void playLetter(Cursor cursor, InterpreterState state, char letter) {
        int note = state.getOctave() * 12 + NOTE_OFFSET[letter - 'A'];

        char modifier = cursor.peekNext();
        if (modifier == '+' || modifier == '#') {
            // B and E have no sharp slot in this scale
            if (letter != 'B' && letter != 'E')
                note++;
            cursor.advance();
        } else if (modifier == '-') {
            // C and F have no flat slot
            if (letter != 'C' && letter != 'F')
                note--;
            cursor.advance();
        }

        int length = state.getNoteLength();
        if (Cursor.isDigit(cursor.peekNext()))
            length = parseNoteLength(cursor); // this note only
        double dots = parseDots(cursor);
        emit(state, note, length, dots);
    }

    private void playNumber(Cursor cursor, InterpreterState state) {
        int note = parseNoteNumber(cursor) + NOTE_NUMBER_OFFSET;
        double dots = parseDots(cursor);
        emit(state, note, state.getNoteLength(), dots);
    }

    private void playPause(Cursor cursor, InterpreterState state) {
        int length = parseNoteLength(cursor);
        double dots = parseDots(cursor);
        emit(state, PlayMath.PAUSE, length, dots);
    }

    private void parseMode(Cursor cursor, InterpreterState state) {
        char c = cursor.advanceAndRead();
        switch (c) {
            case 'B', 'F' -> Log.debug(PARSER, "M%c ignorado (modo background/foreground não suportado) @%d", c,
                    cursor.getIndex());
            case 'L' -> state.setArticulation(Articulation.LEGATO);
            case 'N' -> state.setArticulation(Articulation.NORMAL);
            case 'S' -> state.setArticulation(Articulation.STACCATO);
            default -> throw cursor.fail(PlayError.UNEXPECTED_CHARACTER);
        }
        Log.debug(PARSER, "articulation=%s @%d", state.getArticulation(), cursor.getIndex());
    }

    private int parseOctave(Cursor cursor) {
        char c = cursor.advanceAndRead();
        if (!Cursor.isDigit(c) || c - '0' > InterpreterState.MAX_OCTAVE)
            throw cursor.fail(PlayError.OCTAVE_OUT_OF_RANGE);
        return c - '0';
    }

    private int parseNoteLength(Cursor cursor) {
        char c = cursor.advanceAndRead();
        if (!Cursor.isDigit(c) || c == '0')
            throw cursor.fail(PlayError.NOTE_LENGTH_OUT_OF_RANGE);
        int value = c - '0';
        char next = cursor.peekNext();
        if (Cursor.isDigit(next)) {
            value = value * 10 + (next - '0');
            cursor.advance();
        }
        if (value < InterpreterState.MIN_NOTE_LENGTH || value > InterpreterState.MAX_NOTE_LENGTH)
            throw cursor.fail(PlayError.NOTE_LENGTH_OUT_OF_RANGE);
        return value;
    }

    private int parseNoteNumber(Cursor cursor) {
        char c = cursor.advanceAndRead();
        if (!Cursor.isDigit(c))
            throw cursor.fail(PlayError.NOTE_NUMBER_OUT_OF_RANGE);
        int value = c - '0';
        char next = cursor.peekNext();
        if (Cursor.isDigit(next)) {
            value = value * 10 + (next - '0');
            cursor.advance();
        }
        if (value > MAX_NOTE_NUMBER)
            throw cursor.fail(PlayError.NOTE_NUMBER_OUT_OF_RANGE);
        return value;
    }

    private int parseTempo(Cursor cursor) {
        char c = cursor.advanceAndRead();
        char next = cursor.peekNext();
        // first digit 1..9 and a mandatory second digit
        if (c < '1' || c > '9' || !Cursor.isDigit(next))
            throw cursor.fail(PlayError.TEMPO_OUT_OF_RANGE);
        int value = (c - '0') * 10 + (next - '0');
        cursor.advance();
        next = cursor.peekNext();
        if (Cursor.isDigit(next)) {
            value = value * 10 + (next - '0');
            cursor.advance();
        }
        if (value < InterpreterState.MIN_TEMPO || value > InterpreterState.MAX_TEMPO)
            throw cursor.fail(PlayError.TEMPO_OUT_OF_RANGE);
        return value;
    }

    private double parseDots(Cursor cursor) {
        int count = 0;
        while (cursor.peekNext() == '.') {
            cursor.advance();
            if (++count > 2)
                throw cursor.fail(PlayError.INVALID_DOTTED_COUNT);
        }
        return PlayMath.dotMultiplier(count);
    }

    private void emit(InterpreterState state, int pitchIndex, int noteLength, double dotMultiplier) {
        int duration = PlayMath.durationMs(state.getTempo(), noteLength, dotMultiplier, state.getArticulation());
        if (PlayMath.isAudible(pitchIndex)) {
            int frequency = PlayMath.frequencyHz(pitchIndex);
            Log.trace(PARSER, "TONE pitch=%d freq=%dHz dur=%dms", pitchIndex, frequency, duration);
            sink.sound(frequency, duration);
        } else {
            Log.trace(PARSER, "REST pitch=%d dur=%dms", pitchIndex, duration);
            sink.rest(duration);
        }
    }
}
