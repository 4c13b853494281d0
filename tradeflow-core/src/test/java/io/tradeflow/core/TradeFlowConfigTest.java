package io.tradeflow.core;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Properties;
import org.junit.jupiter.api.Test;

class TradeFlowConfigTest {

    @Test
    void shouldHaveDefaults() {
        TradeFlowConfig config = new TradeFlowConfig();

        assertThat(config.getDefaultFetchUrl()).isEqualTo("https://api.example.com");
        assertThat(config.getDefaultEmailRecipient()).isEqualTo("user@example.com");
        assertThat(config.getDefaultEmailSubject()).isEqualTo("Notification");
        assertThat(config.getDefaultModel()).isEqualTo("mistral-small-latest");
        assertThat(config.getDefaultTemperature()).isEqualTo("0.7");
        assertThat(config.isLogTrace()).isFalse();
    }

    @Test
    void shouldReadPrefixedProperties() {
        Properties properties = new Properties();
        properties.setProperty("tradeflow.fetch.default-url", "https://feed.local");
        properties.setProperty("tradeflow.generate.default-model", "large");
        properties.setProperty("tradeflow.trace.log", "true");

        TradeFlowConfig config = TradeFlowConfig.fromProperties(properties);

        assertThat(config.getDefaultFetchUrl()).isEqualTo("https://feed.local");
        assertThat(config.getDefaultModel()).isEqualTo("large");
        assertThat(config.isLogTrace()).isTrue();
        assertThat(config.getDefaultEmailSubject()).isEqualTo("Notification");
    }

    @Test
    void shouldBuildFluently() {
        TradeFlowConfig config =
                TradeFlowConfig.builder()
                        .defaultEmailRecipient("desk@example.com")
                        .defaultEmailSubject("Fill")
                        .defaultTemperature("0.1")
                        .logTrace(true)
                        .build();

        assertThat(config.getDefaultEmailRecipient()).isEqualTo("desk@example.com");
        assertThat(config.getDefaultEmailSubject()).isEqualTo("Fill");
        assertThat(config.getDefaultTemperature()).isEqualTo("0.1");
        assertThat(config.isLogTrace()).isTrue();
    }
}
