package com.lox.playground.lexer;

import java.util.Objects;

/**
 * A recoverable scanning failure. {@code offendingText} is only set for {@link LexerError#UNKNOWN_TOKEN}.
 */
public record Diagnostic(LexerError kind, Position position, String offendingText) {

    public Diagnostic {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(position, "position");
    }

    public static Diagnostic unknownToken(char offending, Position position) {
        return new Diagnostic(LexerError.UNKNOWN_TOKEN, position, String.valueOf(offending));
    }

    public static Diagnostic of(LexerError kind, Position position) {
        return new Diagnostic(kind, position, null);
    }

    public int line() {
        return position.line();
    }

    public int column() {
        return position.column();
    }
}
