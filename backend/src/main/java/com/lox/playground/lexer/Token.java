package com.lox.playground.lexer;

import java.util.Objects;

/**
 * A classified unit of source text. Only identifiers, strings and numbers carry a value;
 * for every other type {@code value} is {@code null}.
 */
public record Token(TokenType type, String value, Position position) {

    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(position, "position");
        if (type.hasValue() && value == null) {
            throw new IllegalArgumentException(type + " token requires a value");
        }
        if (!type.hasValue() && value != null) {
            throw new IllegalArgumentException(type + " token cannot carry a value");
        }
    }

    public static Token of(TokenType type, Position position) {
        return new Token(type, null, position);
    }

    public static Token withValue(TokenType type, String value, Position position) {
        return new Token(type, value, position);
    }

    public int line() {
        return position.line();
    }

    public int column() {
        return position.column();
    }

    @Override
    public String toString() {
        return value == null
                ? type + " @" + position
                : type + " " + value + " @" + position;
    }
}
