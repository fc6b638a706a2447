package com.lox.playground.lexer;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.lox.playground.lexer.TokenType.*;

/**
 * Reserved words of the language, matched by exact spelling.
 */
public final class Keywords {

    private static final Map<String, TokenType> RESERVED = Map.ofEntries(
            Map.entry("and", AND),
            Map.entry("class", CLASS),
            Map.entry("else", ELSE),
            Map.entry("false", FALSE),
            Map.entry("fun", FUN),
            Map.entry("for", FOR),
            Map.entry("if", IF),
            Map.entry("nil", NIL),
            Map.entry("or", OR),
            Map.entry("print", PRINT),
            Map.entry("return", RETURN),
            Map.entry("super", SUPER),
            Map.entry("this", THIS),
            Map.entry("true", TRUE),
            Map.entry("var", VAR),
            Map.entry("while", WHILE));

    private Keywords() {
    }

    public static Optional<TokenType> lookup(String spelling) {
        return Optional.ofNullable(RESERVED.get(spelling));
    }

    public static boolean isReserved(String spelling) {
        return RESERVED.containsKey(spelling);
    }

    public static Set<String> spellings() {
        return RESERVED.keySet();
    }
}
