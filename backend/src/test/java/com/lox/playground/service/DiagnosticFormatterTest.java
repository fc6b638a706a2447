package com.lox.playground.service;

import com.lox.playground.lexer.Diagnostic;
import com.lox.playground.lexer.Lexer;
import com.lox.playground.lexer.LexerError;
import com.lox.playground.lexer.Position;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticFormatterTest {

    @Test
    void unknownTokenNamesCharacter() {
        Diagnostic diagnostic = new Lexer("var x = 10; @\0").scan().diagnostics().get(0);

        assertEquals("[0:13] Unknown token found @", DiagnosticFormatter.format(diagnostic));
    }

    @Test
    void unterminatedString() {
        Diagnostic diagnostic = new Lexer("var name = \"John Doe;\0").scan().diagnostics().get(0);

        assertEquals("[0:22] Unterminated string", DiagnosticFormatter.format(diagnostic));
    }

    @Test
    void unterminatedComment() {
        Diagnostic diagnostic = Diagnostic.of(LexerError.UNTERMINATED_MULTILINE_COMMENT, new Position(3, 4));

        assertEquals("Unterminated multiline comment", DiagnosticFormatter.message(diagnostic));
        assertEquals("[3:4] Unterminated multiline comment", DiagnosticFormatter.format(diagnostic));
    }
}
