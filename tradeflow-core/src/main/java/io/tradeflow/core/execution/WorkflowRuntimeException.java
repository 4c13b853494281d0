package io.tradeflow.core.execution;

import io.tradeflow.core.exception.TradeFlowException;
import java.io.Serial;

/// Fatal error raised while executing a parsed program.
///
/// Aborts the whole run. Trace lines and step results produced before the
/// failure stay readable on the {@link ProgramExecutor} that threw.
///
/// ### Permitted Subtypes
/// - {@link UndefinedVariableException}
/// - {@link StepNotFoundException}
/// - {@link UnknownOperatorException}
///
/// Unknown commands are not runtime errors: they become a failed
/// {@link StepResult} with status 400 and execution continues.
public abstract class WorkflowRuntimeException extends TradeFlowException {

    @Serial private static final long serialVersionUID = -5012954326380126693L;

    protected WorkflowRuntimeException(String message) {
        super(message);
    }
}
