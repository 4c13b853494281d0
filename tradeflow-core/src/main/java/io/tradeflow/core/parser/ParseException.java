package io.tradeflow.core.parser;

import io.tradeflow.core.exception.TradeFlowException;
import io.tradeflow.core.lexer.Token;
import io.tradeflow.core.lexer.TokenType;
import java.io.Serial;

/// Thrown when the token stream does not match the grammar.
///
/// Carries the token the parser stopped on. Parsing never recovers: the first
/// failure ends parsing of the whole source and no partial tree is returned.
public class ParseException extends TradeFlowException {

    @Serial private static final long serialVersionUID = 7013624883915202476L;

    private final transient Token token;

    public ParseException(String message, Token token) {
        super(message + " " + describe(token));
        this.token = token;
    }

    /// Returns the offending token, never null.
    public Token getToken() {
        return token;
    }

    /// Returns the 1-based line of the offending token.
    public int getLine() {
        return token.line();
    }

    private static String describe(Token token) {
        if (token.type() == TokenType.EOF) {
            return "but reached end of input at line " + token.line();
        }
        return "but found '" + token.lexeme() + "' at line " + token.line();
    }
}
