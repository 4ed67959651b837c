package com.keystone.agenttemplate;

import com.keystone.agenttemplate.config.AgentTemplateProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Reference agent service. Boots a Keystone container with the standard utility catalog and
 * exposes one agent over HTTP.
 *
 * <p>To start a new agent service, copy this module, rename the package, set
 * {@code keystone.service.name} and replace {@code EchoAgentService} with the real agent.
 */
@SpringBootApplication
@EnableConfigurationProperties(AgentTemplateProperties.class)
public class AgentTemplateApplication {

    private static final Logger log = LoggerFactory.getLogger(AgentTemplateApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AgentTemplateApplication.class, args);
        log.info("Keystone agent template started");
    }
}
