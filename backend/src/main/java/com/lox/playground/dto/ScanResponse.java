package com.lox.playground.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScanResponse(
        boolean success,
        List<ScannedToken> tokens,
        List<ScanDiagnostic> diagnostics,
        boolean hasErrors,
        String error,
        long analysisTimeMs) {

    public static ScanResponse success(List<ScannedToken> tokens, List<ScanDiagnostic> diagnostics,
                                       long analysisTimeMs) {
        return new ScanResponse(true, tokens, diagnostics, !diagnostics.isEmpty(), null, analysisTimeMs);
    }

    public static ScanResponse error(String error, long analysisTimeMs) {
        return new ScanResponse(false, List.of(), List.of(), true, error, analysisTimeMs);
    }
}
