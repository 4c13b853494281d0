package io.tradeflow.core.command;

/// Sink for the trace lines a {@link CommandHandler} writes while it runs.
@FunctionalInterface
public interface CommandOutput {

    /// Emits one human-readable line.
    ///
    /// @param line the line, not null
    void emit(String line);

    /// Output that discards every line.
    CommandOutput DISCARD = line -> {};
}
