package com.keystone.agenttemplate.api;

import com.keystone.agenttemplate.config.AgentTemplateProperties;
import com.keystone.container.DIContainer;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Runtime view of the service and its Keystone container.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceStatusController {

    private final AgentTemplateProperties properties;
    private final DIContainer container;

    public ServiceStatusController(AgentTemplateProperties properties, DIContainer container) {
        this.properties = properties;
        this.container = container;
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        Map<String, String> utilities = new LinkedHashMap<>();
        container.healthSummary().forEach((name, state) -> utilities.put(name, state.toString()));

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("name", properties.name());
        status.put("environment", properties.environment());
        status.put("description", properties.description());
        status.put("lifecycle", container.lifecycleState().name());
        status.put("generation", container.generation());
        status.put("utilities", utilities);
        status.put("degraded", container.degradedUtilities().keySet());
        status.put("timestamp", Instant.now().toString());
        return status;
    }
}
