package io.tradeflow.core.lexer;

import java.util.Map;
import java.util.Optional;

/// Token kinds produced by {@link Lexer}.
public enum TokenType {
    // Keywords
    WORKFLOW,
    STEP,
    LET,
    VAR,
    CONST,
    IF,
    ELSE,
    PRINT,
    LOG,
    FETCH,
    SEND_EMAIL,
    NOTIFY,

    // Literals
    STRING,
    NUMBER,
    IDENTIFIER,

    // Operators
    PLUS,
    EQUAL,
    EQUAL_EQUAL,
    NOT_EQUAL,
    GREATER,
    LESS,
    GREATER_EQUAL,
    LESS_EQUAL,
    DOT,

    // Punctuation
    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_BRACE,
    RIGHT_BRACE,
    COLON,
    SEMICOLON,
    COMMA,

    EOF;

    private static final Map<String, TokenType> KEYWORDS =
            Map.ofEntries(
                    Map.entry("workflow", WORKFLOW),
                    Map.entry("step", STEP),
                    Map.entry("let", LET),
                    Map.entry("var", VAR),
                    Map.entry("const", CONST),
                    Map.entry("if", IF),
                    Map.entry("else", ELSE),
                    Map.entry("print", PRINT),
                    Map.entry("log", LOG),
                    Map.entry("fetch", FETCH),
                    Map.entry("send_email", SEND_EMAIL),
                    Map.entry("notify", NOTIFY));

    /// Looks up a reserved word. Matching is case-sensitive.
    ///
    /// @param text candidate identifier text, not null
    /// @return the keyword type, or empty if `text` is an ordinary identifier
    public static Optional<TokenType> keyword(String text) {
        return Optional.ofNullable(KEYWORDS.get(text));
    }

    /// Returns whether this type is one of the built-in command keywords
    /// (`print`, `log`, `fetch`, `send_email`, `notify`).
    public boolean isCommandKeyword() {
        return this == PRINT
                || this == LOG
                || this == FETCH
                || this == SEND_EMAIL
                || this == NOTIFY;
    }

    /// Returns whether this type is a binary operator accepted inside expressions.
    public boolean isBinaryOperator() {
        return this == PLUS
                || this == EQUAL_EQUAL
                || this == NOT_EQUAL
                || this == GREATER
                || this == LESS
                || this == GREATER_EQUAL
                || this == LESS_EQUAL;
    }
}
