package io.tradeflow.core;

import io.tradeflow.core.command.CommandRegistry;
import io.tradeflow.core.execution.ExecutionListener;
import io.tradeflow.core.execution.ProgramExecutor;
import io.tradeflow.core.validation.ProgramValidator;
import java.util.Objects;

/// Shared, read-only wiring for running TradeFlow programs.
///
/// Holds the command registry and configuration. Per-run state lives in the
/// {@link ProgramExecutor} returned by {@link #newExecutor}, never here, so a
/// single environment can back any number of concurrent runs.
///
/// ### Contracts
/// - **Precondition**: constructor parameters must be non-null
/// - **Invariant**: component references are immutable after construction
///
/// @implNote Safe for concurrent use once the registry is no longer modified.
///
/// @apiNote Create instances via {@link TradeFlowFactory} rather than direct
/// construction.
///
/// @see TradeFlowFactory#createEnvironment()
public final class TradeFlowEnvironment {

    private final TradeFlowConfig config;
    private final CommandRegistry commandRegistry;

    public TradeFlowEnvironment(TradeFlowConfig config, CommandRegistry commandRegistry) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.commandRegistry =
                Objects.requireNonNull(commandRegistry, "commandRegistry must not be null");
    }

    /// Creates a fresh executor with its own, empty environment and result table.
    ///
    /// @param listener receives trace events of the run, not null
    /// @return new executor, never null
    public ProgramExecutor newExecutor(ExecutionListener listener) {
        return new ProgramExecutor(commandRegistry, listener, config.isLogTrace());
    }

    /// Creates a fresh executor without an external listener.
    public ProgramExecutor newExecutor() {
        return newExecutor(ExecutionListener.NOOP);
    }

    /// Creates a validator that knows this environment's command names.
    public ProgramValidator newValidator() {
        return new ProgramValidator(commandRegistry.commandNames());
    }

    public TradeFlowConfig getConfig() {
        return config;
    }

    public CommandRegistry getCommandRegistry() {
        return commandRegistry;
    }
}
