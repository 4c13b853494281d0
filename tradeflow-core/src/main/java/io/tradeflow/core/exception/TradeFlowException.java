package io.tradeflow.core.exception;

import java.io.Serial;

/// Root of the TradeFlow error hierarchy.
///
/// Every fatal failure raised by one of the three phases (tokenizing, parsing,
/// executing) extends this type, so callers that only care whether a program
/// ran can catch a single exception.
///
/// ### Permitted Subtypes
/// - {@link io.tradeflow.core.lexer.LexException}
/// - {@link io.tradeflow.core.parser.ParseException}
/// - {@link io.tradeflow.core.execution.WorkflowRuntimeException}
public abstract class TradeFlowException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4471928305127734610L;

    protected TradeFlowException(String message) {
        super(message);
    }

    protected TradeFlowException(String message, Throwable cause) {
        super(message, cause);
    }
}
