package io.tradeflow.core.lexer;

import io.tradeflow.core.exception.TradeFlowException;
import java.io.Serial;

/// Thrown when source text cannot be tokenized.
///
/// Raised for the first unterminated string literal or unrecognized character.
/// No partial token stream is produced.
public class LexException extends TradeFlowException {

    @Serial private static final long serialVersionUID = -2217398834601259318L;

    private final int line;

    public LexException(String message, int line) {
        super(message + " at line " + line);
        this.line = line;
    }

    /// Returns the 1-based line where scanning stopped.
    public int getLine() {
        return line;
    }
}
