package com.lox.playground.service;

import com.lox.playground.lexer.Diagnostic;

/**
 * Renders diagnostics for people: {@code [line:column] message}.
 */
public final class DiagnosticFormatter {

    private DiagnosticFormatter() {
    }

    public static String format(Diagnostic diagnostic) {
        return "[" + diagnostic.line() + ":" + diagnostic.column() + "] " + message(diagnostic);
    }

    public static String message(Diagnostic diagnostic) {
        return switch (diagnostic.kind()) {
            case UNKNOWN_TOKEN -> "Unknown token found " + diagnostic.offendingText();
            case UNTERMINATED_STRING -> "Unterminated string";
            case UNTERMINATED_MULTILINE_COMMENT -> "Unterminated multiline comment";
        };
    }
}
