package com.keystone.agenttemplate.config;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service properties bound from {@code keystone.service.*}:
 *
 * <pre>
 * keystone:
 *   service:
 *     name: echo-agent
 *     environment: production
 *     platform-admins: ops-lead,sre-oncall
 *     init-timeout: 30s
 *     container:
 *       tenancy.default.type: enterprise
 * </pre>
 *
 * @param name           service name used for logging, metrics and tracing. Required.
 * @param environment    deployment environment (development, staging, production)
 * @param description    human-readable summary for {@code /api/v1/status}
 * @param platformAdmins comma-separated user IDs granted platform-admin
 * @param initTimeout    bound on container initialization
 * @param container      extra container configuration, applied as overrides
 */
@ConfigurationProperties(prefix = "keystone.service")
@Validated
public record AgentTemplateProperties(
        @NotBlank String name,
        String environment,
        String description,
        String platformAdmins,
        Duration initTimeout,
        Map<String, String> container) {

    public AgentTemplateProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (description == null) {
            description = "";
        }
        if (platformAdmins == null) {
            platformAdmins = "";
        }
        if (initTimeout == null || initTimeout.isNegative() || initTimeout.isZero()) {
            initTimeout = Duration.ofSeconds(30);
        }
        container = container == null ? Map.of() : Map.copyOf(container);
    }
}
