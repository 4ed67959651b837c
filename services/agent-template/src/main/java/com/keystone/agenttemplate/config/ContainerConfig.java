package com.keystone.agenttemplate.config;

import com.keystone.agent.PlatformUtilities;
import com.keystone.container.DIContainer;
import com.keystone.container.InitResult;
import com.keystone.container.config.ConfigurationLoader;
import com.keystone.utilities.security.SecurityUtility;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the Keystone container into the Spring context. The container is initialized once at
 * startup and shut down with the context.
 */
@Configuration
public class ContainerConfig {

    private static final Logger log = LoggerFactory.getLogger(ContainerConfig.class);

    @Bean
    public ConfigurationLoader keystoneConfigurationLoader() {
        return ConfigurationLoader.standard();
    }

    @Bean(destroyMethod = "shutdown")
    public DIContainer keystoneContainer(AgentTemplateProperties properties, ConfigurationLoader loader) {
        DIContainer container = PlatformUtilities.container(properties.name())
                .configurationLoader(loader)
                .initTimeout(properties.initTimeout())
                .build();

        InitResult result = container.initialize(overrides(properties));
        if (result.configFailure().isPresent()) {
            log.error("Keystone container for '{}' has no configuration: {}", properties.name(),
                    result.configFailure().get().getMessage());
        } else if (result.isDegraded()) {
            log.warn("Keystone container for '{}' started degraded: {}", properties.name(),
                    container.degradedUtilities());
        } else {
            log.info("Keystone container for '{}' ready (generation {})", properties.name(), result.generation());
        }
        return container;
    }

    static Map<String, String> overrides(AgentTemplateProperties properties) {
        Map<String, String> overrides = new HashMap<>(properties.container());
        overrides.put(ConfigurationLoader.ENVIRONMENT_KEY, properties.environment());
        if (!properties.platformAdmins().isBlank()) {
            overrides.put(SecurityUtility.PLATFORM_ADMINS_KEY, properties.platformAdmins());
        }
        return overrides;
    }
}
