package com.lox.playground.exception;

import java.nio.file.Path;

public class SourceReadException extends Exception {

    private final Path path;

    public SourceReadException(Path path, Throwable cause) {
        super("Failed to read " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
