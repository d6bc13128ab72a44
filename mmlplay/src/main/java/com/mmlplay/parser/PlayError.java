package com.mmlplay.parser;

/**
 * Failure kinds raised while interpreting PLAY notation. Each carries the
 * human readable detail appended to the exception message.
 */
public enum PlayError {
    UNEXPECTED_END_OF_INPUT("Unexpected end of input."),
    UNEXPECTED_CHARACTER("Unexpected character."),
    OCTAVE_OUT_OF_RANGE("Octave must be between 0 and 6 (inclusive)."),
    NOTE_LENGTH_OUT_OF_RANGE("Note length must be between 1 and 64 (inclusive)."),
    NOTE_NUMBER_OUT_OF_RANGE("Note must be between 0 and 84 (inclusive)."),
    TEMPO_OUT_OF_RANGE("Tempo must be between 32 and 255 (inclusive)."),
    INVALID_DOTTED_COUNT("The dotted count must be between 0 and 2 (inclusive).");

    private final String detail;

    PlayError(String detail) {
        this.detail = detail;
    }

    public String getDetail() {
        return detail;
    }
}
