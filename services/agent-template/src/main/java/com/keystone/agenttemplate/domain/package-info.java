/**
 * Agent business logic. Agents extend {@code AgentServiceBase} and only implement their
 * capabilities; tenant access, feature gating, auditing and error classification happen in the
 * base class.
 */
package com.keystone.agenttemplate.domain;
