package com.lox.playground.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only record of everything that went wrong during a scan.
 */
public final class Diagnostics {

    private final List<Diagnostic> entries = new ArrayList<>();
    private boolean hasError = false;

    public void report(Diagnostic diagnostic) {
        entries.add(diagnostic);
        hasError = true;
    }

    public boolean hasError() {
        return hasError;
    }

    public List<Diagnostic> all() {
        return Collections.unmodifiableList(entries);
    }

    public int size() {
        return entries.size();
    }
}
