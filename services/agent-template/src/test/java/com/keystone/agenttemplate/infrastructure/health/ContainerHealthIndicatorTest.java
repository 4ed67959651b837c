package com.keystone.agenttemplate.infrastructure.health;

import static org.assertj.core.api.Assertions.assertThat;

import com.keystone.container.DIContainer;
import com.keystone.container.bootstrap.UtilityDescriptor;
import com.keystone.container.config.ConfigurationLoader;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

@DisplayName("ContainerHealthIndicator")
class ContainerHealthIndicatorTest {

    private static DIContainer container(UtilityDescriptor... descriptors) {
        DIContainer.Builder builder = DIContainer.builder("health-check")
                .configurationLoader(ConfigurationLoader.fixed(Map.of()));
        for (UtilityDescriptor descriptor : descriptors) {
            builder.utility(descriptor);
        }
        return builder.build();
    }

    @Test
    @DisplayName("is DOWN before the container is initialized and after shutdown")
    void downWhenNotRunning() {
        DIContainer container = container(UtilityDescriptor.of("clock", ctx -> "tick"));
        var indicator = new ContainerHealthIndicator(container);

        assertThat(indicator.health().getStatus()).isEqualTo(Status.DOWN);

        container.initialize();
        assertThat(indicator.health().getStatus()).isEqualTo(Status.UP);

        container.shutdown();
        assertThat(indicator.health().getStatus()).isEqualTo(Status.DOWN);
    }

    @Test
    @DisplayName("is DEGRADED when a utility failed")
    void degradedWhenUtilityFailed() {
        DIContainer container = container(
                UtilityDescriptor.of("clock", ctx -> "tick"),
                UtilityDescriptor.of("mailer", ctx -> {
                    throw new IllegalStateException("smtp down");
                }));
        container.initialize();
        try {
            Health health = new ContainerHealthIndicator(container).health();

            assertThat(health.getStatus()).isEqualTo(ContainerHealthIndicator.DEGRADED);
            assertThat(health.getDetails()).containsEntry("lifecycle", "RUNNING");
            assertThat((Iterable<String>) health.getDetails().get("degraded")).containsExactly("mailer");
        } finally {
            container.shutdown();
        }
    }
}
