package com.mmlplay.parser;

/**
 * Thrown when PLAY notation cannot be interpreted. Aborts the whole
 * {@link PlayInterpreter#interpret(String)} call; events emitted before the
 * failure have already reached the sink.
 */
public class PlaySyntaxException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final PlayError error;
    private final int index;
    private final Character offending; // null at end of input

    public PlaySyntaxException(PlayError error, int index, Character offending) {
        super(buildMessage(error, index, offending));
        this.error = error;
        this.index = index;
        this.offending = offending;
    }

    private static String buildMessage(PlayError error, int index, Character offending) {
        String token = offending == null ? "<end of input>" : "'" + offending + "'";
        return "Invalid token at " + index + ": " + token + ". " + error.getDetail();
    }

    public PlayError getError() {
        return error;
    }

    /** Character index (0-based) where the problem was detected. */
    public int getIndex() {
        return index;
    }

    /** Offending character as read from the input, or null past the end. */
    public Character getOffendingCharacter() {
        return offending;
    }
}
