package com.keystone.agent;

import com.keystone.utilities.validation.ValidationResult;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks that an agent service implements the whole capability contract.
 */
public final class ProtocolCompliance {

    private ProtocolCompliance() {
        // utility class
    }

    /**
     * A service is compliant when it describes itself, declares at least one capability, uses
     * unique capability names and is bound to a tenant protocol enforcer.
     */
    public static ValidationResult check(AgentService service) {
        if (service == null) {
            return ValidationResult.fail("service must not be null");
        }
        List<String> errors = new ArrayList<>();
        if (service.getAgentDescription() == null) {
            errors.add("agent description is missing");
        }
        List<AgentCapability> capabilities = service.getAgentCapabilities();
        if (capabilities == null || capabilities.isEmpty()) {
            errors.add("agent declares no capabilities");
        } else {
            Set<String> seen = new HashSet<>();
            for (AgentCapability capability : capabilities) {
                if (!seen.add(capability.name())) {
                    errors.add("capability '%s' is declared more than once".formatted(capability.name()));
                }
            }
        }
        if (service.tenants() == null) {
            errors.add("agent is not bound to a tenant protocol enforcer");
        }
        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }
}
