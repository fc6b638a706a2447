package com.lox.playground.lexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.lox.playground.lexer.TokenType.*;

/**
 * Single-pass scanner turning Lox source text into tokens.
 * <p>
 * The source must end with {@link #TERMINATOR}: the scan loop only classifies a character when
 * another one follows it, so without the terminator the true last character is dropped.
 * Callers reading files or prompt lines use {@link #terminate(String)} before scanning.
 * <p>
 * Malformed input never stops the scan. Each problem is recorded as a {@link Diagnostic} and
 * scanning resumes with the next character.
 */
public class Lexer {

    private static final Logger logger = LoggerFactory.getLogger(Lexer.class);

    public static final char TERMINATOR = '\0';

    private final Cursor cursor;
    private final List<Token> tokens = new ArrayList<>();
    private final Diagnostics diagnostics = new Diagnostics();
    private boolean scanned = false;

    public Lexer(String source) {
        this.cursor = new Cursor(Objects.requireNonNull(source, "source"));
    }

    /**
     * Appends the terminator unless the source already ends with one.
     */
    public static String terminate(String source) {
        if (!source.isEmpty() && source.charAt(source.length() - 1) == TERMINATOR) {
            return source;
        }
        return source + TERMINATOR;
    }

    public ScanResult scan() {
        if (scanned) {
            throw new IllegalStateException("Lexer instances scan their source only once");
        }
        scanned = true;

        while (cursor.hasLookahead()) {
            scanToken();
        }
        tokens.add(Token.of(EOF, cursor.position()));

        logger.debug("Scanned {} tokens with {} diagnostics", tokens.size(), diagnostics.size());
        return new ScanResult(tokens, diagnostics.all());
    }

    private void scanToken() {
        char c = cursor.peek();
        switch (c) {
            case ' ', '\t', '\r', TERMINATOR -> cursor.consume();
            case '\n' -> newline();
            case '(' -> single(LEFT_PAREN);
            case ')' -> single(RIGHT_PAREN);
            case '{' -> single(LEFT_BRACE);
            case '}' -> single(RIGHT_BRACE);
            case ',' -> single(COMMA);
            case '.' -> single(DOT);
            case '-' -> single(MINUS);
            case '+' -> single(PLUS);
            case ';' -> single(SEMICOLON);
            case '*' -> single(STAR);
            case '/' -> slash();
            case '!' -> oneOrTwo(BANG, BANG_EQUAL);
            case '=' -> oneOrTwo(EQUAL, EQUAL_EQUAL);
            case '<' -> oneOrTwo(LESS, LESS_EQUAL);
            case '>' -> oneOrTwo(GREATER, GREATER_EQUAL);
            case '"' -> string();
            default -> {
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    report(Diagnostic.unknownToken(c, cursor.position()));
                    cursor.consume();
                }
            }
        }
    }

    private void newline() {
        cursor.nextLine();
        cursor.consume();
    }

    private void single(TokenType type) {
        tokens.add(Token.of(type, cursor.position()));
        cursor.consume();
    }

    private void oneOrTwo(TokenType single, TokenType withEqual) {
        Position start = cursor.position();
        cursor.consume();
        if (cursor.peek() == '=') {
            cursor.consume();
            tokens.add(Token.of(withEqual, start));
        } else {
            tokens.add(Token.of(single, start));
        }
    }

    private void slash() {
        Position start = cursor.position();
        cursor.consume();
        if (cursor.peek() == '/') {
            lineComment();
        } else if (cursor.peek() == '*') {
            blockComment();
        } else {
            tokens.add(Token.of(SLASH, start));
        }
    }

    // Stops in front of the newline, which the main loop then counts as well.
    private void lineComment() {
        while (!cursor.isAtEnd() && cursor.peek() != '\n' && cursor.peek() != TERMINATOR) {
            cursor.consume();
        }
        cursor.nextLine();
    }

    // The first "*/" closes the comment, nesting is not tracked.
    private void blockComment() {
        cursor.consume();
        while (true) {
            if (cursor.isAtEnd() || cursor.peek() == TERMINATOR) {
                report(Diagnostic.of(LexerError.UNTERMINATED_MULTILINE_COMMENT, cursor.position()));
                return;
            }
            char c = cursor.peek();
            if (c == '*') {
                cursor.consume();
                if (cursor.peek() == '/') {
                    cursor.consume();
                    return;
                }
            } else if (c == '\n') {
                cursor.countLine();
                cursor.consume();
            } else {
                cursor.consume();
            }
        }
    }

    private void string() {
        Position start = cursor.position();
        cursor.consume();

        StringBuilder text = new StringBuilder();
        while (true) {
            if (cursor.isAtEnd()) {
                report(Diagnostic.of(LexerError.UNTERMINATED_STRING, cursor.position()));
                break;
            }
            char c = cursor.peek();
            if (c == '"') {
                cursor.consume();
                break;
            }
            if (c == TERMINATOR) {
                report(Diagnostic.of(LexerError.UNTERMINATED_STRING, cursor.position()));
                cursor.consume();
                break;
            }
            text.append(c);
            if (c == '\n') {
                cursor.countLine();
            }
            cursor.consume();
        }

        tokens.add(Token.withValue(STRING, text.toString(), start));
    }

    private void number() {
        Position start = cursor.position();
        StringBuilder spelling = new StringBuilder();
        takeDigits(spelling);

        if (cursor.peek() == '.' && isDigit(cursor.peekNext())) {
            spelling.append('.');
            cursor.consume();
            takeDigits(spelling);
        }

        tokens.add(Token.withValue(NUMBER, spelling.toString(), start));
    }

    private void takeDigits(StringBuilder spelling) {
        while (isDigit(cursor.peek())) {
            spelling.append(cursor.peek());
            cursor.consume();
        }
    }

    private void identifier() {
        Position start = cursor.position();
        StringBuilder spelling = new StringBuilder();
        while (isAlphaNumeric(cursor.peek())) {
            spelling.append(cursor.peek());
            cursor.consume();
        }

        String text = spelling.toString();
        tokens.add(Keywords.lookup(text)
                .map(keyword -> Token.of(keyword, start))
                .orElseGet(() -> Token.withValue(IDENTIFIER, text, start)));
    }

    private void report(Diagnostic diagnostic) {
        logger.debug("{} at {}", diagnostic.kind(), diagnostic.position());
        diagnostics.report(diagnostic);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z')
                || (c >= 'A' && c <= 'Z')
                || c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
