package io.tradeflow.cli.producers;

import io.tradeflow.core.TradeFlowConfig;
import io.tradeflow.core.TradeFlowEnvironment;
import io.tradeflow.core.TradeFlowFactory;
import io.tradeflow.core.command.CommandHandler;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import java.util.Properties;
import java.util.logging.Logger;
import org.eclipse.microprofile.config.Config;

/// CDI producer for the TradeFlow runtime environment.
///
/// Builds the environment from `tradeflow.*` configuration and registers every
/// {@link CommandHandler} bean discovered via CDI on top of the built-in
/// simulated commands, so a deployment can add or replace commands without
/// touching the executor.
///
/// ### Configuration Properties
/// | Property | Type | Default | Description |
/// |----------|------|---------|-------------|
/// | `tradeflow.fetch.default-url` | String | `https://api.example.com` | URL for `fetch` without arguments |
/// | `tradeflow.email.default-recipient` | String | `user@example.com` | Recipient for `send_email` |
/// | `tradeflow.email.default-subject` | String | `Notification` | Subject for `send_email` |
/// | `tradeflow.generate.default-model` | String | `mistral-small-latest` | Model reported by `generate` |
/// | `tradeflow.generate.default-temperature` | String | `0.7` | Temperature reported by `generate` |
/// | `tradeflow.trace.log` | Boolean | `false` | Also log every trace line at `FINE` |
///
/// @implNote Application-scoped singleton. Thread-safe after initialization; each
/// command run creates its own executor from the shared environment.
///
/// @see io.tradeflow.core.TradeFlowEnvironment
@ApplicationScoped
public class TradeFlowEnvironmentProducer {

    private static final Logger logger =
            Logger.getLogger(TradeFlowEnvironmentProducer.class.getName());

    private static final String PREFIX = "tradeflow.";

    @Inject Config config;

    @Inject Instance<CommandHandler> commandHandlers;

    /// Produces the TradeFlow runtime environment for CDI injection.
    ///
    /// @return configured environment singleton, never null
    @Produces
    @ApplicationScoped
    public TradeFlowEnvironment tradeFlowEnvironment() {
        TradeFlowFactory.Builder builder =
                TradeFlowFactory.builder()
                        .config(TradeFlowConfig.fromProperties(extractTradeFlowProperties()));
        for (CommandHandler handler : commandHandlers) {
            builder.command(handler);
            logger.info("Registered command handler: " + handler.getName());
        }
        TradeFlowEnvironment environment = builder.build();
        logger.fine(
                "Configured TradeFlowEnvironment with commands "
                        + environment.getCommandRegistry().commandNames());
        return environment;
    }

    /// Extracts `tradeflow.*` properties from Quarkus config.
    private Properties extractTradeFlowProperties() {
        Properties properties = new Properties();
        for (String propertyName : config.getPropertyNames()) {
            if (propertyName.startsWith(PREFIX)) {
                config.getOptionalValue(propertyName, String.class)
                        .ifPresent(value -> properties.setProperty(propertyName, value));
            }
        }
        return properties;
    }
}
