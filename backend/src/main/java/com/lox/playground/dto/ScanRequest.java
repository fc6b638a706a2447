package com.lox.playground.dto;

import com.lox.playground.lexer.Lexer;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ScanRequest(
        @NotNull(message = "Source code cannot be null")
        @Size(max = 10_000, message = "Source code cannot exceed 10,000 characters")
        String sourceCode) {

    public String sanitizedSourceCode() {
        if (sourceCode == null) {
            return "";
        }

        return sourceCode
            .replace(String.valueOf(Lexer.TERMINATOR), "")
            .replace("\r\n", "\n")
            .replace("\r", "\n");
    }
}
