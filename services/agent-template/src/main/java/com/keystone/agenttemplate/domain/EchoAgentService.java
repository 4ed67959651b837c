package com.keystone.agenttemplate.domain;

import com.keystone.agent.AgentCapability;
import com.keystone.agent.AgentDescription;
import com.keystone.agent.AgentRequest;
import com.keystone.agent.AgentResponse;
import com.keystone.agent.AgentServiceBase;
import com.keystone.container.DIContainer;
import com.keystone.utilities.UtilityNames;
import com.keystone.utilities.validation.ValidationResult;
import com.keystone.utilities.validation.ValidationUtility;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Sample agent with one open and one feature-gated capability.
 */
@Service
public class EchoAgentService extends AgentServiceBase {

    public static final AgentCapability ECHO = AgentCapability.of("echo", "Returns the text it was sent");
    public static final AgentCapability SUMMARIZE = AgentCapability.of("summarize", "Counts words and sentences")
            .requiringFeature("advanced_insights");

    static final int MAX_TEXT_LENGTH = 10_000;

    private static final AgentDescription DESCRIPTION =
            new AgentDescription("echo-agent", "0.1.0", "Reference agent for new Keystone services");

    public EchoAgentService(DIContainer container) {
        super(container);
    }

    @Override
    public AgentResponse processRequest(AgentRequest request) {
        String text = text(request);
        if (SUMMARIZE.name().equals(request.capability())) {
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("words", text.isBlank() ? 0 : text.trim().split("\\s+").length);
            summary.put("sentences", Arrays.stream(text.split("[.!?]+")).filter(s -> !s.isBlank()).count());
            return AgentResponse.success(request.requestId(), summary);
        }
        return AgentResponse.success(request.requestId(), Map.of("text", text));
    }

    private String text(AgentRequest request) {
        Object raw = request.payload().get("text");
        String text = raw == null ? "" : raw.toString();
        ValidationResult result = utility(UtilityNames.VALIDATION, ValidationUtility.class).check()
                .notBlank("text", text)
                .maxLength("text", text, MAX_TEXT_LENGTH)
                .result();
        if (!result.valid()) {
            throw new IllegalArgumentException(result.message());
        }
        return text;
    }

    @Override
    public List<AgentCapability> getAgentCapabilities() {
        return List.of(ECHO, SUMMARIZE);
    }

    @Override
    public AgentDescription getAgentDescription() {
        return DESCRIPTION;
    }
}
