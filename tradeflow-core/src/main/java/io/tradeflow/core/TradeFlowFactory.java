package io.tradeflow.core;

import io.tradeflow.core.command.CommandHandler;
import io.tradeflow.core.command.CommandRegistry;
import io.tradeflow.core.command.DefaultCommandRegistry;
import io.tradeflow.core.command.SimulatedCommands;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.logging.Logger;

/// Factory for creating and wiring TradeFlow execution environments.
///
/// ### Usage Patterns
///
/// **Defaults** (built-in simulated commands, default configuration):
/// {@snippet :
/// TradeFlowEnvironment env = TradeFlowFactory.createEnvironment();
/// }
///
/// **Builder** (custom configuration and extra commands):
/// {@snippet :
/// TradeFlowEnvironment env = TradeFlowFactory.builder()
///     .config(TradeFlowConfig.builder().defaultFetchUrl("https://internal").build())
///     .command(myHandler)
///     .build();
/// }
///
/// @implNote This is a utility class with only static methods.
///
/// @see TradeFlowEnvironment
/// @see TradeFlowConfig
public final class TradeFlowFactory {

    private static final Logger logger = Logger.getLogger(TradeFlowFactory.class.getName());

    private TradeFlowFactory() {}

    /// Creates an environment with default configuration and the built-in commands.
    ///
    /// @return a fully wired environment, never null
    public static TradeFlowEnvironment createEnvironment() {
        return createEnvironment(new TradeFlowConfig());
    }

    /// Creates an environment with the built-in commands.
    ///
    /// @param config configuration, not null
    /// @return a fully wired environment, never null
    public static TradeFlowEnvironment createEnvironment(TradeFlowConfig config) {
        return builder().config(config).build();
    }

    /// Creates an environment configured from `tradeflow.*` properties.
    ///
    /// @param properties configuration source, not null
    /// @return a fully wired environment, never null
    /// @see TradeFlowConfig#fromProperties(Properties)
    public static TradeFlowEnvironment createEnvironment(Properties properties) {
        return createEnvironment(TradeFlowConfig.fromProperties(properties));
    }

    /// Creates a new builder.
    ///
    /// @return new builder, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link TradeFlowEnvironment}.
    ///
    /// Built-in commands are registered first, then every handler added through
    /// {@link #command(CommandHandler)}, so extra handlers may replace built-ins.
    public static class Builder {
        private TradeFlowConfig config = new TradeFlowConfig();
        private CommandRegistry commandRegistry;
        private boolean builtIns = true;
        private final List<CommandHandler> extraHandlers = new ArrayList<>();

        /// Sets the configuration options.
        ///
        /// @param config the configuration, not null
        /// @return this builder for chaining, never null
        public Builder config(TradeFlowConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        /// Uses an existing registry instead of a fresh {@link DefaultCommandRegistry}.
        ///
        /// @param commandRegistry the registry, not null
        /// @return this builder for chaining, never null
        public Builder commandRegistry(CommandRegistry commandRegistry) {
            this.commandRegistry = Objects.requireNonNull(commandRegistry);
            return this;
        }

        /// Enables or disables registration of {@link SimulatedCommands}.
        ///
        /// @param builtIns `false` to start from an empty command set
        /// @return this builder for chaining, never null
        public Builder builtInCommands(boolean builtIns) {
            this.builtIns = builtIns;
            return this;
        }

        /// Adds a command handler.
        ///
        /// @param handler the handler, not null
        /// @return this builder for chaining, never null
        public Builder command(CommandHandler handler) {
            extraHandlers.add(Objects.requireNonNull(handler, "handler must not be null"));
            return this;
        }

        /// Adds several command handlers.
        ///
        /// @param handlers the handlers, not null
        /// @return this builder for chaining, never null
        public Builder commands(List<? extends CommandHandler> handlers) {
            handlers.forEach(this::command);
            return this;
        }

        /// Wires the environment.
        ///
        /// @return new environment, never null
        public TradeFlowEnvironment build() {
            CommandRegistry registry =
                    commandRegistry != null ? commandRegistry : new DefaultCommandRegistry();
            if (builtIns) {
                SimulatedCommands.registerDefaults(registry, config);
            }
            for (CommandHandler handler : extraHandlers) {
                registry.register(handler);
            }
            logger.fine("Registered commands: " + registry.commandNames());
            return new TradeFlowEnvironment(config, registry);
        }
    }
}
