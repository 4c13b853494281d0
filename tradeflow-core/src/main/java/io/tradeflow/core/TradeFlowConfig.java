package io.tradeflow.core;

import java.util.Properties;

/// Configuration options for a TradeFlow execution environment.
///
/// Holds the fallback values the simulated commands use when a script omits
/// an argument, and whether trace lines are echoed to the logger. Use the
/// {@link Builder} for fluent configuration, {@link #fromProperties} to read
/// `tradeflow.*` keys, or construct directly and use setters.
///
/// ### Default Values
/// - `defaultFetchUrl`: `"https://api.example.com"`
/// - `defaultEmailRecipient`: `"user@example.com"`
/// - `defaultEmailSubject`: `"Notification"`
/// - `defaultModel`: `"mistral-small-latest"`
/// - `defaultTemperature`: `"0.7"`
/// - `logTrace`: `false`
///
/// @implNote **Not thread-safe**. This is a mutable configuration object
/// intended to be configured before passing to {@link TradeFlowFactory}.
/// Do not modify after environment creation.
///
/// @see TradeFlowFactory#createEnvironment(TradeFlowConfig)
/// @see Builder
public class TradeFlowConfig {

    static final String PREFIX = "tradeflow.";

    private String defaultFetchUrl = "https://api.example.com";
    private String defaultEmailRecipient = "user@example.com";
    private String defaultEmailSubject = "Notification";
    private String defaultModel = "mistral-small-latest";
    private String defaultTemperature = "0.7";
    private boolean logTrace = false;

    /// Creates a configuration with default values.
    public TradeFlowConfig() {}

    /// Reads configuration from properties, falling back to defaults for
    /// missing keys.
    ///
    /// | Key                                      | Field                   |
    /// |------------------------------------------|-------------------------|
    /// | `tradeflow.fetch.default-url`            | `defaultFetchUrl`       |
    /// | `tradeflow.email.default-recipient`      | `defaultEmailRecipient` |
    /// | `tradeflow.email.default-subject`        | `defaultEmailSubject`   |
    /// | `tradeflow.generate.default-model`       | `defaultModel`          |
    /// | `tradeflow.generate.default-temperature` | `defaultTemperature`    |
    /// | `tradeflow.trace.log`                    | `logTrace`              |
    ///
    /// @param properties source properties, not null
    /// @return new configuration, never null
    public static TradeFlowConfig fromProperties(Properties properties) {
        TradeFlowConfig config = new TradeFlowConfig();
        config.defaultFetchUrl =
                properties.getProperty(PREFIX + "fetch.default-url", config.defaultFetchUrl);
        config.defaultEmailRecipient =
                properties.getProperty(
                        PREFIX + "email.default-recipient", config.defaultEmailRecipient);
        config.defaultEmailSubject =
                properties.getProperty(
                        PREFIX + "email.default-subject", config.defaultEmailSubject);
        config.defaultModel =
                properties.getProperty(PREFIX + "generate.default-model", config.defaultModel);
        config.defaultTemperature =
                properties.getProperty(
                        PREFIX + "generate.default-temperature", config.defaultTemperature);
        config.logTrace =
                Boolean.parseBoolean(
                        properties.getProperty(PREFIX + "trace.log", Boolean.toString(false)));
        return config;
    }

    /// Returns the URL `fetch` uses when called without arguments.
    public String getDefaultFetchUrl() {
        return defaultFetchUrl;
    }

    public void setDefaultFetchUrl(String defaultFetchUrl) {
        this.defaultFetchUrl = defaultFetchUrl;
    }

    /// Returns the recipient `send_email` uses when called without arguments.
    public String getDefaultEmailRecipient() {
        return defaultEmailRecipient;
    }

    public void setDefaultEmailRecipient(String defaultEmailRecipient) {
        this.defaultEmailRecipient = defaultEmailRecipient;
    }

    /// Returns the subject `send_email` uses when no second argument is given.
    public String getDefaultEmailSubject() {
        return defaultEmailSubject;
    }

    public void setDefaultEmailSubject(String defaultEmailSubject) {
        this.defaultEmailSubject = defaultEmailSubject;
    }

    /// Returns the model name `generate` reports when none is given.
    public String getDefaultModel() {
        return defaultModel;
    }

    public void setDefaultModel(String defaultModel) {
        this.defaultModel = defaultModel;
    }

    /// Returns the temperature `generate` reports when none is given.
    public String getDefaultTemperature() {
        return defaultTemperature;
    }

    public void setDefaultTemperature(String defaultTemperature) {
        this.defaultTemperature = defaultTemperature;
    }

    /// Returns whether every trace line is also written to the executor's
    /// logger at `FINE` level.
    public boolean isLogTrace() {
        return logTrace;
    }

    public void setLogTrace(boolean logTrace) {
        this.logTrace = logTrace;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link TradeFlowConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns
    /// it on {@link #build()}.
    public static class Builder {
        private final TradeFlowConfig config = new TradeFlowConfig();

        public Builder defaultFetchUrl(String defaultFetchUrl) {
            config.defaultFetchUrl = defaultFetchUrl;
            return this;
        }

        public Builder defaultEmailRecipient(String defaultEmailRecipient) {
            config.defaultEmailRecipient = defaultEmailRecipient;
            return this;
        }

        public Builder defaultEmailSubject(String defaultEmailSubject) {
            config.defaultEmailSubject = defaultEmailSubject;
            return this;
        }

        public Builder defaultModel(String defaultModel) {
            config.defaultModel = defaultModel;
            return this;
        }

        public Builder defaultTemperature(String defaultTemperature) {
            config.defaultTemperature = defaultTemperature;
            return this;
        }

        public Builder logTrace(boolean logTrace) {
            config.logTrace = logTrace;
            return this;
        }

        /// Builds and returns the configured {@link TradeFlowConfig} instance.
        ///
        /// @return the configured instance, never null
        public TradeFlowConfig build() {
            return config;
        }
    }
}
