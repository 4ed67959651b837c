package com.keystone.agent;

import com.keystone.tenancy.protocol.TenantProtocolEnforcer;
import java.util.List;

/**
 * The capability contract of an agent service. Business logic lives only in
 * {@link #processRequest}; the tenant protocol is delegated to a shared
 * {@link TenantProtocolEnforcer}.
 */
public interface AgentService {

    /**
     * Runs one capability. Called only after the caller's tenant access and the capability's
     * feature entitlement have been validated.
     */
    AgentResponse processRequest(AgentRequest request);

    List<AgentCapability> getAgentCapabilities();

    AgentDescription getAgentDescription();

    /** The tenant protocol this service delegates to. */
    TenantProtocolEnforcer tenants();
}
