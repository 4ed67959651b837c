package com.keystone.container.bootstrap;

/**
 * Receives every utility state transition. Acts as the health-check sink for a container.
 */
@FunctionalInterface
public interface UtilityStateListener {

    void onTransition(String serviceName, String utilityName, UtilityState state);
}
