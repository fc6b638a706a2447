package com.lox.playground.lexer;

/**
 * Line and column as counted by the scanner: lines start at 0, columns at 1.
 */
public record Position(int line, int column) {

    public static final Position START = new Position(0, 1);

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
