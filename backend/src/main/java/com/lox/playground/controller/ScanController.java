package com.lox.playground.controller;

import com.lox.playground.dto.ScanRequest;
import com.lox.playground.dto.ScanResponse;
import com.lox.playground.lexer.Keywords;
import com.lox.playground.service.LoxScanService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

import java.util.List;

@RestController
@RequestMapping("/api/scan")
@Validated
public class ScanController {

    private static final Logger logger = LoggerFactory.getLogger(ScanController.class);

    private final LoxScanService scanService;

    public ScanController(LoxScanService scanService) {
        this.scanService = scanService;
    }

    @PostMapping
    public ResponseEntity<ScanResponse> scan(@Valid @RequestBody ScanRequest request) {
        logger.info("Received scan request (length: {} chars)", request.sourceCode().length());

        try {
            ScanResponse response = scanService.scan(request);

            logger.info("Scan completed - Success: {}, Tokens: {}, Diagnostics: {}",
                    response.success(), response.tokens().size(), response.diagnostics().size());

            return ResponseEntity.ok(response);

        } catch (Exception e) {
            logger.error("Unexpected error during scan: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError()
                .body(ScanResponse.error("Internal server error: " + e.getMessage(), 0));
        }
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Lox scan service is running");
    }

    @GetMapping("/keywords")
    public ResponseEntity<List<String>> keywords() {
        return ResponseEntity.ok(Keywords.spellings().stream().sorted().toList());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ScanResponse> handleValidationException(MethodArgumentNotValidException e) {
        StringBuilder errorMessage = new StringBuilder("Validation error: ");

        e.getBindingResult().getFieldErrors().forEach(error ->
            errorMessage.append(error.getField())
                       .append(" - ")
                       .append(error.getDefaultMessage())
                       .append("; ")
        );

        logger.warn("Validation error: {}", errorMessage);

        return ResponseEntity.badRequest().body(ScanResponse.error(errorMessage.toString(), 0));
    }
}
