package com.lox.playground.cli;

import com.lox.playground.config.LoxScannerProperties;
import com.lox.playground.exception.SourceReadException;
import com.lox.playground.lexer.Diagnostic;
import com.lox.playground.lexer.ScanResult;
import com.lox.playground.lexer.Token;
import com.lox.playground.service.DiagnosticFormatter;
import com.lox.playground.service.LoxScanService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command-line front end: scans a script file, or every line typed at the prompt, and prints
 * the tokens.
 * <p>
 * Exit statuses follow sysexits: 64 for bad usage, 65 when the script has lexical errors,
 * 66 when the script cannot be read and 74 when the prompt input fails.
 */
public class LoxCli {

    private static final Logger logger = LoggerFactory.getLogger(LoxCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 64;
    static final int EXIT_DATA_ERROR = 65;
    static final int EXIT_NO_INPUT = 66;
    static final int EXIT_IO_ERROR = 74;

    private final LoxScanService scanService;
    private final PrintStream out;
    private final PrintStream err;

    public LoxCli(LoxScanService scanService, PrintStream out, PrintStream err) {
        this.scanService = scanService;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        LoxCli cli = new LoxCli(new LoxScanService(LoxScannerProperties.defaults()), System.out, System.err);
        System.exit(cli.run(args, System.in));
    }

    public int run(String[] args, InputStream in) {
        if (args.length > 1) {
            err.println("Usage: lox-playground [script]");
            return EXIT_USAGE;
        } else if (args.length == 1) {
            return runFile(Path.of(args[0]));
        } else {
            return runPrompt(in);
        }
    }

    private int runFile(Path path) {
        String source;
        try {
            source = readSource(path);
        } catch (SourceReadException e) {
            logger.error("Cannot read script {}", e.getPath(), e);
            err.println(e.getMessage());
            return EXIT_NO_INPUT;
        }

        ScanResult result = run(source);
        return result.hasErrors() ? EXIT_DATA_ERROR : EXIT_OK;
    }

    private int runPrompt(InputStream in) {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        try {
            for (;;) {
                out.print("> ");
                out.flush();
                String line = reader.readLine();
                if (line == null) {
                    break;
                }
                run(line);
            }
        } catch (IOException e) {
            logger.error("Failed to read from the prompt", e);
            err.println(e.getMessage());
            return EXIT_IO_ERROR;
        }
        return EXIT_OK;
    }

    private ScanResult run(String source) {
        ScanResult result = scanService.scanSource(source);

        for (Token token : result.tokens()) {
            out.println(token);
        }
        for (Diagnostic diagnostic : result.diagnostics()) {
            err.println(DiagnosticFormatter.format(diagnostic));
        }
        return result;
    }

    private static String readSource(Path path) throws SourceReadException {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SourceReadException(path, e);
        }
    }
}
