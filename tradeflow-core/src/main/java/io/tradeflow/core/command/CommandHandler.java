package io.tradeflow.core.command;

import io.tradeflow.core.execution.StepResult;
import java.util.List;

/// Handler for one named command.
///
/// Handlers are registered with a {@link CommandRegistry} and receive the
/// command's arguments already evaluated to strings, left to right.
///
/// ### Contracts
/// - **Precondition**: `arguments` and `output` are not null
/// - **Postcondition**: returns a non-null {@link StepResult}; never touches
///   the variable environment or the step result table
///
/// @implNote Thread-safe. One handler instance serves every run of an
/// environment, so implementations must be stateless.
///
/// @see CommandRegistry for registration and dispatch
/// @see SimulatedCommands for the built-in set
public interface CommandHandler {

    /// Returns the command name this handler answers to, e.g. `print`.
    ///
    /// @return command name, not null
    String getName();

    /// Runs the command.
    ///
    /// @param arguments evaluated arguments, possibly empty, not null
    /// @param output sink for trace lines, not null
    /// @return the step result, never null
    StepResult handle(List<String> arguments, CommandOutput output);
}
