package com.forecastalpha.analysis.datasource;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ConnectionRegistryTest {

    private final ConnectionRegistry registry = new ConnectionRegistry();

    @Test
    void registersResolvesAndRemovesConnections() {
        ConnectionDescriptor descriptor = new ConnectionDescriptor("jdbc:h2:mem:registry", "sa", "");

        String first = registry.register(descriptor);
        String second = registry.register(descriptor);

        assertThat(first).isNotEqualTo(second);
        assertThat(registry.resolve(first)).contains(descriptor);
        assertThat(registry.remove(first)).isTrue();
        assertThat(registry.resolve(first)).isEmpty();
        assertThat(registry.remove(first)).isFalse();
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void unknownOrNullTokensResolveToNothing() {
        assertThat(registry.resolve("nope")).isEmpty();
        assertThat(registry.resolve(null)).isEmpty();
    }
}
