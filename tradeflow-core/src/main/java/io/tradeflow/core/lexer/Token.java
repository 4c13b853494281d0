package io.tradeflow.core.lexer;

import java.util.Objects;

/// A single lexical token.
///
/// @param type token kind, not null
/// @param lexeme exact source text of the token, not null (empty for `EOF`)
/// @param literal unescaped payload for string and number tokens, null otherwise
/// @param line 1-based source line the token ends on
public record Token(TokenType type, String lexeme, String literal, int line) {

    public Token {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(lexeme, "lexeme must not be null");
    }

    /// Creates a token without a literal payload.
    public static Token of(TokenType type, String lexeme, int line) {
        return new Token(type, lexeme, null, line);
    }

    @Override
    public String toString() {
        return literal != null
                ? type + " '" + lexeme + "' (" + literal + ") @" + line
                : type + " '" + lexeme + "' @" + line;
    }
}
