package io.tradeflow.core.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Single-pass scanner turning TradeFlow source text into tokens.
///
/// Keeps a `start` cursor at the beginning of the lexeme being scanned, a
/// `current` cursor one past the last consumed character, and a line counter
/// starting at 1. Whitespace (newlines included) produces no tokens.
///
/// ### Contracts
/// - **Postcondition**: a successful scan always ends with exactly one
///   {@link TokenType#EOF} token
/// - **Postcondition**: the first unterminated string or unexpected character
///   throws {@link LexException}; no partial stream is returned
///
/// ### Usage
/// {@snippet :
/// List<Token> tokens = new Lexer("workflow \"W\" { }").tokenize();
/// }
///
/// @implNote **Not thread-safe**. A lexer instance holds cursor state and is
/// meant to scan its source once.
public final class Lexer {

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start;
    private int current;
    private int line = 1;

    public Lexer(String source) {
        this.source = Objects.requireNonNull(source, "source must not be null");
    }

    /// Scans the whole source.
    ///
    /// @return immutable token list terminated by `EOF`, never null
    /// @throws LexException on an unterminated string or illegal character
    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(Token.of(TokenType.EOF, "", line));
        return List.copyOf(tokens);
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(' -> addToken(TokenType.LEFT_PAREN);
            case ')' -> addToken(TokenType.RIGHT_PAREN);
            case '{' -> addToken(TokenType.LEFT_BRACE);
            case '}' -> addToken(TokenType.RIGHT_BRACE);
            case ':' -> addToken(TokenType.COLON);
            case ';' -> addToken(TokenType.SEMICOLON);
            case ',' -> addToken(TokenType.COMMA);
            case '.' -> addToken(TokenType.DOT);
            case '+' -> addToken(TokenType.PLUS);
            case '=' -> addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL);
            case '<' -> addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
            case '>' -> addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
            case '!' -> {
                if (!match('=')) {
                    throw new LexException("Unexpected character: '!'", line);
                }
                addToken(TokenType.NOT_EQUAL);
            }
            case '"', '\'' -> string(c);
            case '\n' -> line++;
            case ' ', '\r', '\t' -> {}
            default -> {
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else if (!isWhitespace(c)) {
                    throw new LexException("Unexpected character: '" + c + "'", line);
                }
            }
        }
    }

    private void string(char quote) {
        int startLine = line;
        while (peek() != quote && !isAtEnd()) {
            if (peek() == '\n') {
                line++;
            }
            advance();
        }
        if (isAtEnd()) {
            throw new LexException("Unterminated string", startLine);
        }
        advance(); // closing quote
        // a multi-line string carries the line it opens on
        addToken(TokenType.STRING, source.substring(start + 1, current - 1), startLine);
    }

    private void number() {
        while (isDigit(peek())) {
            advance();
        }
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) {
                advance();
            }
        }
        addToken(TokenType.NUMBER, source.substring(start, current), line);
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) {
            advance();
        }
        String text = source.substring(start, current);
        addToken(TokenType.keyword(text).orElse(TokenType.IDENTIFIER));
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) {
            return false;
        }
        current++;
        return true;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(current);
    }

    private char peekNext() {
        return current + 1 >= source.length() ? '\0' : source.charAt(current + 1);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private void addToken(TokenType type) {
        tokens.add(Token.of(type, source.substring(start, current), line));
    }

    private void addToken(TokenType type, String literal, int tokenLine) {
        tokens.add(new Token(type, source.substring(start, current), literal, tokenLine));
    }

    private static boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
