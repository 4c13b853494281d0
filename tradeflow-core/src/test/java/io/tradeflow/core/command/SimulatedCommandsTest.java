package io.tradeflow.core.command;

import static org.assertj.core.api.Assertions.assertThat;

import io.tradeflow.core.TradeFlowConfig;
import io.tradeflow.core.execution.StepResult;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SimulatedCommandsTest {

    private CommandRegistry registry;
    private List<String> lines;

    @BeforeEach
    void setUp() {
        registry = new DefaultCommandRegistry();
        SimulatedCommands.registerDefaults(registry, new TradeFlowConfig());
        lines = new ArrayList<>();
    }

    private StepResult dispatch(String name, String... arguments) {
        return registry.dispatch(name, List.of(arguments), lines::add);
    }

    @Test
    void shouldRegisterEveryBuiltInCommand() {
        assertThat(registry.commandNames())
                .containsExactlyInAnyOrderElementsOf(SimulatedCommands.NAMES);
    }

    @ParameterizedTest
    @ValueSource(
            strings = {
                "print", "log", "fetch", "send_email", "notify",
                "input", "generate", "output", "transform", "validate"
            })
    void shouldSucceedWithoutArguments(String name) {
        StepResult result = dispatch(name);

        assertThat(result.success()).isTrue();
        assertThat(result.status()).isEqualTo(200);
        assertThat(lines).hasSize(1);
    }

    @Nested
    class EchoCommandsTest {

        @Test
        void shouldJoinPrintArgumentsWithSpace() {
            StepResult result = dispatch("print", "hello", "world");

            assertThat(result.data()).isEqualTo("hello world");
            assertThat(result.message()).isEqualTo("Print executed successfully");
            assertThat(lines).containsExactly("Print: hello world");
        }

        @Test
        void shouldLogAndNotifyWithOwnLabels() {
            dispatch("log", "entry");
            StepResult notify = dispatch("notify", "ping");

            assertThat(lines).containsExactly("Log: entry", "Notify: ping");
            assertThat(notify.message()).isEqualTo("Notification sent successfully");
        }
    }

    @Nested
    class ServiceCommandsTest {

        @Test
        void shouldFetchFromGivenUrl() {
            StepResult result = dispatch("fetch", "https://prices.example.com");

            assertThat(result.data())
                    .isEqualTo("{\"data\": \"Sample data from https://prices.example.com\"}");
            assertThat(result.message()).isEqualTo("Fetch completed successfully");
            assertThat(lines).containsExactly("Fetch: https://prices.example.com");
        }

        @Test
        void shouldFetchFromConfiguredDefaultUrl() {
            // Given
            CommandRegistry configured = new DefaultCommandRegistry();
            SimulatedCommands.registerDefaults(
                    configured,
                    TradeFlowConfig.builder().defaultFetchUrl("https://feed.local").build());

            // When
            StepResult result = configured.dispatch("fetch", List.of(), CommandOutput.DISCARD);

            // Then
            assertThat(result.data()).contains("https://feed.local");
        }

        @Test
        void shouldSendEmailWithDefaultSubject() {
            StepResult result = dispatch("send_email", "ops@example.com");

            assertThat(result.data()).isEqualTo("Email sent to ops@example.com");
            assertThat(lines).containsExactly("Send Email: ops@example.com - Notification");
        }

        @Test
        void shouldEchoGenerateRequest() {
            StepResult result = dispatch("generate", "Summarize", "small", "0.2");

            assertThat(result.data())
                    .isEqualTo(
                            "{\"content\": \"Generated content for: Summarize\", \"model\": \"small\", \"temperature\": \"0.2\"}");
        }

        @Test
        void shouldUseGenerateDefaults() {
            dispatch("generate");

            assertThat(lines)
                    .containsExactly(
                            "Generate: Using mistral-small-latest (temp: 0.7) with prompt: 'Generate content'");
        }

        @Test
        void shouldReportValidationAsValid() {
            StepResult result = dispatch("validate", "order", "schema");

            assertThat(result.data())
                    .isEqualTo("{\"validated\": \"order\", \"type\": \"schema\", \"valid\": true}");
        }

        @Test
        void shouldIgnoreSurplusArguments() {
            StepResult result = dispatch("transform", "rows", "csv", "extra");

            assertThat(result.data()).isEqualTo("{\"transformed\": \"rows\", \"type\": \"csv\"}");
        }
    }

    @Test
    void shouldWrapFunctionAsHandler() {
        CommandHandler handler =
                SimulatedCommands.of("ping", (args, out) -> StepResult.success("pong", "ok"));

        assertThat(handler.getName()).isEqualTo("ping");
        assertThat(handler.handle(List.of(), CommandOutput.DISCARD).data()).isEqualTo("pong");
    }
}
