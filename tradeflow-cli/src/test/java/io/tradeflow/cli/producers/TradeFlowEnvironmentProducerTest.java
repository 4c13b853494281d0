package io.tradeflow.cli.producers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import io.tradeflow.core.TradeFlow;
import io.tradeflow.core.TradeFlowEnvironment;
import io.tradeflow.core.command.CommandHandler;
import io.tradeflow.core.command.CommandOutput;
import io.tradeflow.core.execution.ExecutionResult;
import io.tradeflow.core.execution.StepResult;
import jakarta.enterprise.inject.Instance;
import java.util.List;
import java.util.Optional;
import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TradeFlowEnvironmentProducerTest {

    @Mock private Config config;

    @Mock private Instance<CommandHandler> commandHandlers;

    private TradeFlowEnvironmentProducer producer;

    @BeforeEach
    void setUp() {
        producer = new TradeFlowEnvironmentProducer();
        producer.config = config;
        producer.commandHandlers = commandHandlers;
    }

    @Test
    void shouldApplyTradeFlowPropertiesFromConfig() {
        // Given
        when(config.getPropertyNames())
                .thenReturn(List.of("tradeflow.email.default-recipient", "quarkus.log.level"));
        when(config.getOptionalValue("tradeflow.email.default-recipient", String.class))
                .thenReturn(Optional.of("desk@example.com"));
        when(commandHandlers.iterator()).thenReturn(List.<CommandHandler>of().iterator());

        // When
        TradeFlowEnvironment environment = producer.tradeFlowEnvironment();

        // Then
        assertThat(environment.getConfig().getDefaultEmailRecipient())
                .isEqualTo("desk@example.com");
        assertThat(environment.getCommandRegistry().contains("print")).isTrue();
    }

    @Test
    void shouldRegisterDiscoveredCommandHandlers() {
        // Given
        CommandHandler quote =
                new CommandHandler() {
                    @Override
                    public String getName() {
                        return "quote";
                    }

                    @Override
                    public StepResult handle(List<String> arguments, CommandOutput output) {
                        output.emit("Quote: " + String.join(" ", arguments));
                        return StepResult.success("101.25", "Quote retrieved");
                    }
                };
        when(config.getPropertyNames()).thenReturn(List.of());
        when(commandHandlers.iterator()).thenReturn(List.of(quote).iterator());

        // When
        TradeFlowEnvironment environment = producer.tradeFlowEnvironment();
        ExecutionResult result =
                environment
                        .newExecutor()
                        .execute(TradeFlow.parse("workflow \"W\" { step 1: quote(\"ACME\") }"));

        // Then
        assertThat(result.stepResults().get(1).data()).isEqualTo("101.25");
        assertThat(result.traceLines()).contains("Quote: ACME");
    }
}
