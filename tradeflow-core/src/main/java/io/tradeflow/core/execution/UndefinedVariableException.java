package io.tradeflow.core.execution;

import java.io.Serial;

/// Thrown when an identifier is read before any declaration bound it.
public class UndefinedVariableException extends WorkflowRuntimeException {

    @Serial private static final long serialVersionUID = 2841173360950861245L;

    private final String variableName;

    public UndefinedVariableException(String variableName) {
        super("Undefined variable: " + variableName);
        this.variableName = variableName;
    }

    public String getVariableName() {
        return variableName;
    }
}
