package com.lox.playground.lexer;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class KeywordsTest {

    @Test
    void sixteenReservedWords() {
        assertEquals(16, Keywords.spellings().size());
    }

    @Test
    void lookupIsExactAndCaseSensitive() {
        assertEquals(Optional.of(TokenType.WHILE), Keywords.lookup("while"));
        assertEquals(Optional.empty(), Keywords.lookup("While"));
        assertEquals(Optional.empty(), Keywords.lookup("whilex"));
        assertTrue(Keywords.isReserved("nil"));
        assertFalse(Keywords.isReserved("null"));
    }
}
