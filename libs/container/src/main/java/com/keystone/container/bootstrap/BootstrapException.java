package com.keystone.container.bootstrap;

import java.util.List;

/**
 * Thrown when a container cannot be bootstrapped at all. Failures of individual utilities are
 * never thrown; they are reported in {@link BootstrapResult}.
 */
public class BootstrapException extends RuntimeException {

    /** Kind of bootstrap failure. */
    public enum Kind {

        /** The declared dependencies contain a cycle. */
        CYCLIC_DEPENDENCY,

        /** Duplicate utility names or dependencies on undeclared utilities. */
        INVALID_GRAPH,

        /** The container could not start a generation before its deadline. */
        TIMEOUT
    }

    private final Kind kind;
    private final List<String> utilities;

    public BootstrapException(Kind kind, List<String> utilities, String message) {
        super(message);
        this.kind = kind;
        this.utilities = List.copyOf(utilities);
    }

    public static BootstrapException cyclic(List<String> members) {
        return new BootstrapException(Kind.CYCLIC_DEPENDENCY, members,
                "Cyclic dependency between utilities " + members);
    }

    public static BootstrapException invalidGraph(List<String> utilities, String reason) {
        return new BootstrapException(Kind.INVALID_GRAPH, utilities, reason);
    }

    public static BootstrapException timeout(String serviceName, String reason) {
        return new BootstrapException(Kind.TIMEOUT, List.of(),
                "Container '%s' timed out: %s".formatted(serviceName, reason));
    }

    public Kind kind() {
        return kind;
    }

    /** Utilities involved in the failure (cycle members, duplicates or dangling references). */
    public List<String> utilities() {
        return utilities;
    }
}
