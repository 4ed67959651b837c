package com.keystone.container.bootstrap;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates utility descriptors and orders them so every utility follows its dependencies.
 */
public final class DependencyGraph {

    private DependencyGraph() {
        // utility class
    }

    /**
     * Returns the construction order. Among utilities whose dependencies are satisfied, the one
     * declared first goes first, so the order is stable for a given declaration list.
     *
     * @throws BootstrapException INVALID_GRAPH on duplicate or unknown names, CYCLIC_DEPENDENCY
     *                            when no order exists
     */
    public static List<String> order(List<UtilityDescriptor> descriptors) {
        Map<String, UtilityDescriptor> byName = index(descriptors);

        Map<String, Integer> unmet = new LinkedHashMap<>();
        for (UtilityDescriptor descriptor : descriptors) {
            unmet.put(descriptor.name(), new LinkedHashSet<>(descriptor.dependencies()).size());
        }

        List<String> order = new ArrayList<>(descriptors.size());
        boolean progressed = true;
        while (progressed && order.size() < descriptors.size()) {
            progressed = false;
            for (Map.Entry<String, Integer> entry : unmet.entrySet()) {
                if (entry.getValue() == 0) {
                    String next = entry.getKey();
                    order.add(next);
                    unmet.remove(next);
                    for (UtilityDescriptor candidate : descriptors) {
                        if (unmet.containsKey(candidate.name())
                                && new LinkedHashSet<>(candidate.dependencies()).contains(next)) {
                            unmet.merge(candidate.name(), -1, Integer::sum);
                        }
                    }
                    progressed = true;
                    break;
                }
            }
        }

        if (!unmet.isEmpty()) {
            throw BootstrapException.cyclic(cycleMembers(unmet.keySet(), byName));
        }
        return List.copyOf(order);
    }

    private static Map<String, UtilityDescriptor> index(List<UtilityDescriptor> descriptors) {
        Map<String, UtilityDescriptor> byName = new HashMap<>();
        List<String> duplicates = new ArrayList<>();
        for (UtilityDescriptor descriptor : descriptors) {
            if (byName.putIfAbsent(descriptor.name(), descriptor) != null) {
                duplicates.add(descriptor.name());
            }
        }
        if (!duplicates.isEmpty()) {
            throw BootstrapException.invalidGraph(duplicates, "Duplicate utility names " + duplicates);
        }

        List<String> dangling = new ArrayList<>();
        for (UtilityDescriptor descriptor : descriptors) {
            for (String dependency : descriptor.dependencies()) {
                if (!byName.containsKey(dependency)) {
                    dangling.add(descriptor.name() + " -> " + dependency);
                }
            }
        }
        if (!dangling.isEmpty()) {
            throw BootstrapException.invalidGraph(dangling, "Unknown utility dependencies " + dangling);
        }
        return byName;
    }

    /**
     * Narrows the unordered set down to utilities on a cycle by repeatedly dropping those that
     * nothing else in the set depends on.
     */
    private static List<String> cycleMembers(Set<String> unordered, Map<String, UtilityDescriptor> byName) {
        Set<String> remaining = new LinkedHashSet<>(unordered);
        boolean pruned = true;
        while (pruned) {
            pruned = false;
            for (String name : List.copyOf(remaining)) {
                boolean required = remaining.stream()
                        .anyMatch(other -> byName.get(other).dependencies().contains(name));
                if (!required) {
                    remaining.remove(name);
                    pruned = true;
                }
            }
        }
        return List.copyOf(remaining);
    }
}
