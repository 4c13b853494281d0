package io.tradeflow.core.command;

import io.tradeflow.core.execution.StepResult;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Default mutable implementation of {@link CommandRegistry}.
///
/// Handlers are stored in a plain {@link HashMap}; registration is not
/// thread-safe and must be completed before the registry is shared across
/// threads. Dispatch (read-only after setup) is safe from multiple threads.
///
/// ### Contracts
/// - **Precondition**: all handlers must be registered before
///   {@link #dispatch} is first called
/// - **Postcondition**: {@link #dispatch} never returns null; returns a
///   failure {@link StepResult} with status 400 for unknown commands
///
/// @see CommandRegistry
public class DefaultCommandRegistry implements CommandRegistry {

    private static final Logger logger = Logger.getLogger(DefaultCommandRegistry.class.getName());

    private final Map<String, CommandHandler> registry = new HashMap<>();

    @Override
    public void register(CommandHandler handler) {
        registry.put(handler.getName(), handler);
    }

    @Override
    public Optional<CommandHandler> getHandler(String name) {
        return Optional.ofNullable(registry.get(name));
    }

    @Override
    public Set<String> commandNames() {
        return Set.copyOf(registry.keySet());
    }

    @Override
    public StepResult dispatch(String name, List<String> arguments, CommandOutput output) {
        CommandHandler handler = registry.get(name);
        if (handler == null) {
            logger.warning("Unknown command: " + name);
            output.emit("Unknown command: " + name);
            return StepResult.failure(StepResult.STATUS_BAD_REQUEST, "Unknown command: " + name);
        }
        return handler.handle(arguments, output);
    }
}
