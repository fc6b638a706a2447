package com.lox.playground.lexer;

/**
 * Read position over a character buffer. Knows nothing about newlines: the lexer decides
 * when a line ends and calls {@link #nextLine()}.
 */
final class Cursor {

    /** Returned by the peek methods once the buffer is exhausted. */
    static final char NONE = '\uFFFF';

    private final String chars;
    private int readIndex = 0;
    private int line = Position.START.line();
    private int column = Position.START.column();

    Cursor(String chars) {
        this.chars = chars;
    }

    char peek() {
        return charAt(readIndex);
    }

    char peekNext() {
        return charAt(readIndex + 1);
    }

    void consume() {
        readIndex++;
        column++;
    }

    void nextLine() {
        line++;
        column = 0;
    }

    /**
     * Counts a line break inside a comment or string literal. The column keeps running.
     */
    void countLine() {
        line++;
    }

    /**
     * True while both the current and the following character exist. The scan loop stops as
     * soon as this turns false, so the last character of the buffer is never classified.
     */
    boolean hasLookahead() {
        return readIndex + 1 < chars.length();
    }

    boolean isAtEnd() {
        return readIndex >= chars.length();
    }

    Position position() {
        return new Position(line, column);
    }

    private char charAt(int index) {
        if (index >= chars.length()) {
            return NONE;
        }
        return chars.charAt(index);
    }
}
