package com.lox.playground.lexer;

public enum LexerError {
    UNKNOWN_TOKEN,
    UNTERMINATED_STRING,
    UNTERMINATED_MULTILINE_COMMENT
}
