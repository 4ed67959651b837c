package com.keystone.container.bootstrap;

/**
 * Constructs one utility instance from its context. Any exception marks the utility
 * {@link FailureKind#CONSTRUCTION_FAILED}.
 */
@FunctionalInterface
public interface UtilityFactory {

    Object create(UtilityContext context) throws Exception;
}
