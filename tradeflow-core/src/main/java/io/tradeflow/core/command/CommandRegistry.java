package io.tradeflow.core.command;

import io.tradeflow.core.execution.StepResult;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/// Registry of {@link CommandHandler}s keyed by command name.
///
/// Replaces a hard-coded command switch: adding a command means registering a
/// handler, the executor's control flow stays untouched.
///
/// ### Permitted Subtypes
/// - {@link DefaultCommandRegistry} - default mutable implementation
///
/// @implNote Thread-safety is implementation-specific. See individual
/// implementations for their concurrency guarantees.
///
/// @see CommandHandler for the handler contract
/// @see io.tradeflow.core.execution.ProgramExecutor for how dispatch is used
public interface CommandRegistry {

    /// Registers a handler under its declared name.
    ///
    /// @apiNote **Side effects**: overwrites any handler previously registered
    /// under the same name.
    ///
    /// @param handler the handler to register, not null
    void register(CommandHandler handler);

    /// Returns the handler registered under `name`.
    ///
    /// @param name command name, not null
    /// @return the handler, or empty if none registered
    Optional<CommandHandler> getHandler(String name);

    /// Returns every registered command name.
    ///
    /// @return immutable set of names, never null
    Set<String> commandNames();

    /// Returns whether a handler is registered under `name`.
    default boolean contains(String name) {
        return getHandler(name).isPresent();
    }

    /// Dispatches a command to its handler.
    ///
    /// Returns `StepResult{success=false, data="", status=400,
    /// message="Unknown command: <name>"}` when no handler is registered.
    ///
    /// @param name command name, not null
    /// @param arguments evaluated arguments, not null
    /// @param output sink for handler trace lines, not null
    /// @return the step result, never null
    StepResult dispatch(String name, List<String> arguments, CommandOutput output);
}
