package com.lox.playground.dto;

public record ScanDiagnostic(
    String kind,
    int line,
    int column,
    String message
) {
}
