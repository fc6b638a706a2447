package com.lox.playground.service;

import com.lox.playground.config.LoxScannerProperties;
import com.lox.playground.dto.ScanDiagnostic;
import com.lox.playground.dto.ScanRequest;
import com.lox.playground.dto.ScanResponse;
import com.lox.playground.dto.ScannedToken;
import com.lox.playground.lexer.Diagnostic;
import com.lox.playground.lexer.Lexer;
import com.lox.playground.lexer.ScanResult;
import com.lox.playground.lexer.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;

import java.util.List;

@Service
public class LoxScanService {

    private static final Logger logger = LoggerFactory.getLogger(LoxScanService.class);

    private final LoxScannerProperties properties;

    public LoxScanService(LoxScannerProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        logger.info("LoxScanService ready (maxSourceLength={}, appendTerminator={}, logTokenMapping={})",
                properties.maxSourceLength(), properties.appendTerminator(), properties.logTokenMapping());
    }

    public ScanResponse scan(ScanRequest request) {
        long startTime = System.currentTimeMillis();

        try {
            String source = request.sanitizedSourceCode();

            if (source.length() > properties.maxSourceLength()) {
                logger.warn("Rejected source of {} characters (limit {})",
                        source.length(), properties.maxSourceLength());
                return ScanResponse.error(
                        "Source code exceeds maximum length of " + properties.maxSourceLength() + " characters",
                        System.currentTimeMillis() - startTime);
            }

            ScanResult result = scanSanitized(source);

            List<ScannedToken> tokens = result.tokens().stream()
                    .map(ScannedToken::from)
                    .toList();
            List<ScanDiagnostic> diagnostics = result.diagnostics().stream()
                    .map(LoxScanService::toDto)
                    .toList();

            long analysisTime = System.currentTimeMillis() - startTime;
            logger.debug("Scan completed in {}ms with {} tokens and {} diagnostics",
                    analysisTime, tokens.size(), diagnostics.size());

            return ScanResponse.success(tokens, diagnostics, analysisTime);

        } catch (Exception e) {
            long analysisTime = System.currentTimeMillis() - startTime;
            logger.error("Scan failed", e);
            return ScanResponse.error("Scan failed: " + e.getMessage(), analysisTime);
        }
    }

    /**
     * Scans raw source text without a length limit. Line endings are normalised first.
     */
    public ScanResult scanSource(String source) {
        return scanSanitized(new ScanRequest(source).sanitizedSourceCode());
    }

    private ScanResult scanSanitized(String source) {
        String input = properties.appendTerminator() ? Lexer.terminate(source) : source;
        ScanResult result = new Lexer(input).scan();

        if (properties.logTokenMapping()) {
            logTokenMapping(result.tokens());
        }
        for (Diagnostic diagnostic : result.diagnostics()) {
            logger.debug("Diagnostic: {}", DiagnosticFormatter.format(diagnostic));
        }
        return result;
    }

    private void logTokenMapping(List<Token> tokens) {
        logger.debug("=== TOKEN MAPPING ===");
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            logger.debug("Token {}: {} '{}' at [{}:{}]",
                    i, token.type(), token.value(), token.line(), token.column());
        }
        logger.debug("=== END TOKEN MAPPING ===");
    }

    private static ScanDiagnostic toDto(Diagnostic diagnostic) {
        return new ScanDiagnostic(
                diagnostic.kind().name(),
                diagnostic.line(),
                diagnostic.column(),
                DiagnosticFormatter.format(diagnostic));
    }
}
