package com.lox.playground.service;

import com.lox.playground.config.LoxScannerProperties;
import com.lox.playground.dto.ScanDiagnostic;
import com.lox.playground.dto.ScanRequest;
import com.lox.playground.dto.ScanResponse;
import com.lox.playground.dto.ScannedToken;
import com.lox.playground.lexer.ScanResult;
import com.lox.playground.lexer.Token;
import com.lox.playground.lexer.TokenType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LoxScanServiceTest {

    private final LoxScanService service = new LoxScanService(LoxScannerProperties.defaults());

    @Test
    void terminatorIsAppendedForCaller() {
        ScanResponse response = service.scan(new ScanRequest("var x = 10;"));

        assertTrue(response.success());
        assertFalse(response.hasErrors());
        assertEquals(6, response.tokens().size());
        assertEquals(new ScannedToken("NUMBER", "10", 0, 9), response.tokens().get(3));
        assertEquals("SEMICOLON", response.tokens().get(4).tokenType());
        assertEquals("EOF", response.tokens().get(5).tokenType());
    }

    @Test
    void diagnosticsAreRendered() {
        ScanResponse response = service.scan(new ScanRequest("@"));

        assertTrue(response.success());
        assertTrue(response.hasErrors());
        assertEquals(List.of(new ScanDiagnostic("UNKNOWN_TOKEN", 0, 1, "[0:1] Unknown token found @")),
                response.diagnostics());
    }

    @Test
    void windowsLineEndingsAreNormalised() {
        ScanResponse response = service.scan(new ScanRequest("print a;\r\nprint b;"));

        assertFalse(response.hasErrors());
        ScannedToken secondPrint = response.tokens().get(3);
        assertEquals("PRINT", secondPrint.tokenType());
        assertEquals(1, secondPrint.line());
        assertEquals(1, secondPrint.column());
    }

    @Test
    void strayNulCharactersAreStripped() {
        ScanResult result = service.scanSource("\"abc\0def\"");

        assertFalse(result.hasErrors());
        assertEquals("abcdef", result.tokens().get(0).value());
    }

    @Test
    void oversizedSourceIsRejected() {
        LoxScanService strict = new LoxScanService(new LoxScannerProperties(5, true, false));

        ScanResponse response = strict.scan(new ScanRequest("var x = 10;"));

        assertFalse(response.success());
        assertTrue(response.error().contains("maximum length of 5"));
        assertTrue(response.tokens().isEmpty());
    }

    @Test
    void terminatorCanBeLeftToCaller() {
        LoxScanService raw = new LoxScanService(new LoxScannerProperties(100, false, true));

        List<TokenType> types = raw.scanSource("x;").tokens().stream().map(Token::type).toList();

        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.EOF), types);
    }
}
