package io.tradeflow.core.execution;

import java.io.Serial;

/// Thrown when an operator reaches a code path that cannot evaluate it.
///
/// String evaluation only understands `+`; a comparison nested inside another
/// expression (for example the left side of `a == b == c`, or a comparison
/// passed as a command argument) ends up here.
public class UnknownOperatorException extends WorkflowRuntimeException {

    @Serial private static final long serialVersionUID = 6619372201845530917L;

    private final String operator;

    public UnknownOperatorException(String operator) {
        super("Unknown binary operator: " + operator);
        this.operator = operator;
    }

    public String getOperator() {
        return operator;
    }
}
