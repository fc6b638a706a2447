package com.lox.playground.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.lox.playground.lexer.Token;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScannedToken(
    String tokenType,
    String value,
    int line,
    int column
) {

    public static ScannedToken from(Token token) {
        return new ScannedToken(token.type().name(), token.value(), token.line(), token.column());
    }
}
