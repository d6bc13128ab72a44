package com.mmlplay.parser;

/**
 * Bounded, case-normalizing view over the notation text.
 * Mandatory reads past the end fail with
 * {@link PlayError#UNEXPECTED_END_OF_INPUT}; lookahead past the end yields
 * {@link #NONE}.
 */
public final class Cursor {

    /** Returned by {@link #peekNext()} when no character follows. */
    public static final char NONE = '\0';

    private final String text;
    private int index;

    public Cursor(String text) {
        this.text = text;
        this.index = 0;
    }

    public int getIndex() {
        return index;
    }

    public boolean hasCurrent() {
        return index < text.length();
    }

    /** Upper-cased character at the active index. */
    public char current() {
        if (index >= text.length())
            throw new PlaySyntaxException(PlayError.UNEXPECTED_END_OF_INPUT, index, null);
        return Character.toUpperCase(text.charAt(index));
    }

    /** Moves one position forward then reads like {@link #current()}. */
    public char advanceAndRead() {
        index++;
        return current();
    }

    /** Reads one position ahead without moving. */
    public char peekNext() {
        int next = index + 1;
        if (next >= text.length())
            return NONE;
        return Character.toUpperCase(text.charAt(next));
    }

    /** Commits a previously peeked character. */
    public void advance() {
        index++;
    }

    /** Raises {@code error} at the active index, quoting the raw character. */
    public PlaySyntaxException fail(PlayError error) {
        Character c = index < text.length() ? Character.valueOf(text.charAt(index)) : null;
        return new PlaySyntaxException(error, index, c);
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
