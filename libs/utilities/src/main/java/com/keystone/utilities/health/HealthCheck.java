package com.keystone.utilities.health;

import java.util.concurrent.CompletableFuture;

/**
 * A lightweight check of one component, completed asynchronously.
 */
@FunctionalInterface
public interface HealthCheck {

    CompletableFuture<ComponentHealth> check();
}
