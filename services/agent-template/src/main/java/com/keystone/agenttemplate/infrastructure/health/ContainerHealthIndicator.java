package com.keystone.agenttemplate.infrastructure.health;

import com.keystone.container.ContainerLifecycleState;
import com.keystone.container.DIContainer;
import java.util.Map;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * Reports the Keystone container on {@code /actuator/health}: UP when every utility is ready,
 * DEGRADED when some failed, DOWN when the container is not running.
 */
@Component("keystone")
public class ContainerHealthIndicator implements HealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED", "Some utilities are unavailable");

    private final DIContainer container;

    public ContainerHealthIndicator(DIContainer container) {
        this.container = container;
    }

    @Override
    public Health health() {
        ContainerLifecycleState lifecycle = container.lifecycleState();
        Map<String, ?> degraded = container.degradedUtilities();
        Health.Builder builder;
        if (lifecycle != ContainerLifecycleState.RUNNING) {
            builder = Health.down();
        } else if (!degraded.isEmpty()) {
            builder = Health.status(DEGRADED);
        } else {
            builder = Health.up();
        }
        return builder
                .withDetail("lifecycle", lifecycle.name())
                .withDetail("generation", container.generation())
                .withDetail("degraded", degraded.keySet())
                .build();
    }
}
