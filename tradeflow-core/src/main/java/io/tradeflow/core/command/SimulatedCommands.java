package io.tradeflow.core.command;

import io.tradeflow.core.TradeFlowConfig;
import io.tradeflow.core.execution.StepResult;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;

/// Built-in command set.
///
/// Every handler is a deterministic stand-in for an external service: no
/// network, mail or notification I/O takes place. All of them succeed with
/// status 200.
///
/// | Command      | Arguments                          | `data`                                   |
/// |--------------|------------------------------------|------------------------------------------|
/// | `print`      | any                                | arguments joined by a space              |
/// | `log`        | any                                | arguments joined by a space              |
/// | `notify`     | any                                | arguments joined by a space              |
/// | `fetch`      | url                                | `{"data": "Sample data from <url>"}`     |
/// | `send_email` | to, subject                        | `Email sent to <to>`                     |
/// | `input`      | variable, type, placeholder        | JSON-like echo of the request            |
/// | `generate`   | prompt, model, temperature         | JSON-like echo with generated content    |
/// | `output`     | data, format, file                 | JSON-like export receipt                 |
/// | `transform`  | data, transformation               | JSON-like transform receipt              |
/// | `validate`   | data, validation type              | JSON-like receipt with `"valid": true`   |
///
/// Missing arguments fall back to fixed defaults or to the values in
/// {@link TradeFlowConfig}.
///
/// @see CommandRegistry
public final class SimulatedCommands {

    /// Names of all built-in commands, in registration order.
    public static final List<String> NAMES =
            List.of(
                    "print",
                    "log",
                    "fetch",
                    "send_email",
                    "notify",
                    "input",
                    "generate",
                    "output",
                    "transform",
                    "validate");

    private SimulatedCommands() {}

    /// Registers every built-in command.
    ///
    /// @apiNote **Side effects**: replaces any handler already registered under
    /// one of the built-in names.
    ///
    /// @param registry target registry, not null
    /// @param config supplies fallback argument values, not null
    public static void registerDefaults(CommandRegistry registry, TradeFlowConfig config) {
        Objects.requireNonNull(registry, "registry must not be null");
        Objects.requireNonNull(config, "config must not be null");

        registry.register(echo("print", "Print", "Print executed successfully"));
        registry.register(echo("log", "Log", "Log executed successfully"));
        registry.register(echo("notify", "Notify", "Notification sent successfully"));

        registry.register(
                of(
                        "fetch",
                        (args, out) -> {
                            String url = arg(args, 0, config.getDefaultFetchUrl());
                            out.emit("Fetch: " + url);
                            return StepResult.success(
                                    "{\"data\": \"Sample data from " + url + "\"}",
                                    "Fetch completed successfully");
                        }));

        registry.register(
                of(
                        "send_email",
                        (args, out) -> {
                            String to = arg(args, 0, config.getDefaultEmailRecipient());
                            String subject = arg(args, 1, config.getDefaultEmailSubject());
                            out.emit("Send Email: " + to + " - " + subject);
                            return StepResult.success(
                                    "Email sent to " + to, "Email sent successfully");
                        }));

        registry.register(
                of(
                        "input",
                        (args, out) -> {
                            String variable = arg(args, 0, "user_input");
                            String type = arg(args, 1, "text");
                            String placeholder = arg(args, 2, "Enter value");
                            out.emit(
                                    "Input: Collect '"
                                            + variable
                                            + "' as "
                                            + type
                                            + " ("
                                            + placeholder
                                            + ")");
                            return StepResult.success(
                                    "{\"variable\": \""
                                            + variable
                                            + "\", \"type\": \""
                                            + type
                                            + "\", \"placeholder\": \""
                                            + placeholder
                                            + "\"}",
                                    "Input collected successfully");
                        }));

        registry.register(
                of(
                        "generate",
                        (args, out) -> {
                            String prompt = arg(args, 0, "Generate content");
                            String model = arg(args, 1, config.getDefaultModel());
                            String temperature = arg(args, 2, config.getDefaultTemperature());
                            out.emit(
                                    "Generate: Using "
                                            + model
                                            + " (temp: "
                                            + temperature
                                            + ") with prompt: '"
                                            + prompt
                                            + "'");
                            return StepResult.success(
                                    "{\"content\": \"Generated content for: "
                                            + prompt
                                            + "\", \"model\": \""
                                            + model
                                            + "\", \"temperature\": \""
                                            + temperature
                                            + "\"}",
                                    "Content generated successfully");
                        }));

        registry.register(
                of(
                        "output",
                        (args, out) -> {
                            String data = arg(args, 0, "data");
                            String format = arg(args, 1, "text");
                            String file = arg(args, 2, "output");
                            out.emit("Output: Export " + data + " as " + format + " to " + file);
                            return StepResult.success(
                                    "{\"exported\": \""
                                            + data
                                            + "\", \"format\": \""
                                            + format
                                            + "\", \"file\": \""
                                            + file
                                            + "\"}",
                                    "Output exported successfully");
                        }));

        registry.register(
                of(
                        "transform",
                        (args, out) -> {
                            String data = arg(args, 0, "data");
                            String transformation = arg(args, 1, "format");
                            out.emit("Transform: Apply " + transformation + " to " + data);
                            return StepResult.success(
                                    "{\"transformed\": \""
                                            + data
                                            + "\", \"type\": \""
                                            + transformation
                                            + "\"}",
                                    "Data transformed successfully");
                        }));

        registry.register(
                of(
                        "validate",
                        (args, out) -> {
                            String data = arg(args, 0, "data");
                            String validation = arg(args, 1, "required");
                            out.emit("Validate: Check " + data + " for " + validation);
                            return StepResult.success(
                                    "{\"validated\": \""
                                            + data
                                            + "\", \"type\": \""
                                            + validation
                                            + "\", \"valid\": true}",
                                    "Validation completed successfully");
                        }));
    }

    /// Wraps a function as a named handler.
    ///
    /// @param name command name, not null
    /// @param body handler body, not null
    /// @return handler delegating to `body`, never null
    public static CommandHandler of(
            String name, BiFunction<List<String>, CommandOutput, StepResult> body) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(body, "body must not be null");
        return new CommandHandler() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public StepResult handle(List<String> arguments, CommandOutput output) {
                return body.apply(arguments, output);
            }
        };
    }

    private static CommandHandler echo(String name, String label, String message) {
        return of(
                name,
                (args, out) -> {
                    String joined = String.join(" ", args);
                    out.emit(label + ": " + joined);
                    return StepResult.success(joined, message);
                });
    }

    private static String arg(List<String> args, int index, String fallback) {
        return index < args.size() ? args.get(index) : fallback;
    }
}
