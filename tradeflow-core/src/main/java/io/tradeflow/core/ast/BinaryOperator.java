package io.tradeflow.core.ast;

import java.util.Optional;

/// Operators that may join two primaries in an expression.
///
/// All share one precedence level and associate left to right.
public enum BinaryOperator {
    CONCAT("+", false),
    EQUAL("==", true),
    NOT_EQUAL("!=", true),
    GREATER(">", true),
    LESS("<", true),
    GREATER_EQUAL(">=", true),
    LESS_EQUAL("<=", true);

    private final String symbol;
    private final boolean comparison;

    BinaryOperator(String symbol, boolean comparison) {
        this.symbol = symbol;
        this.comparison = comparison;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isComparison() {
        return comparison;
    }

    /// Resolves an operator lexeme.
    ///
    /// @param symbol operator text such as `>=`, not null
    /// @return the operator, or empty for anything outside the grammar
    public static Optional<BinaryOperator> fromSymbol(String symbol) {
        for (BinaryOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
