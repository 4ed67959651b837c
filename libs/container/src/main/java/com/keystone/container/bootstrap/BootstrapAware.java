package com.keystone.container.bootstrap;

/**
 * Implemented by utilities that want to see the outcome of the bootstrap they were built in,
 * for example to report the state of their siblings.
 */
public interface BootstrapAware {

    /**
     * Called once per generation, after every utility reached its final state. Exceptions are
     * logged and ignored.
     */
    void onBootstrapComplete(BootstrapResult result);
}
