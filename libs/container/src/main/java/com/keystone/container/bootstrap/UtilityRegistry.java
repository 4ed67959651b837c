package com.keystone.container.bootstrap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ready utility instances keyed by name, in construction order.
 * <p>
 * Filled by the sequencer and then frozen. A frozen registry is read without locking; the only
 * later mutation is {@link #release()} during shutdown.
 */
public final class UtilityRegistry {

    private Map<String, Object> building = new LinkedHashMap<>();
    private volatile Map<String, Object> published = Map.of();
    private volatile boolean frozen;

    /**
     * Adds a ready instance. Only allowed before {@link #freeze()}.
     */
    public void register(String name, Object instance) {
        if (frozen) {
            throw new IllegalStateException("registry is frozen");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (instance == null) {
            throw new IllegalArgumentException("instance must not be null");
        }
        if (building.putIfAbsent(name, instance) != null) {
            throw new IllegalStateException("utility '%s' is already registered".formatted(name));
        }
    }

    /** Publishes the registered instances for concurrent reads. */
    public void freeze() {
        if (frozen) {
            return;
        }
        published = Collections.unmodifiableMap(new LinkedHashMap<>(building));
        building = null;
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public Optional<Object> get(String name) {
        return Optional.ofNullable(view().get(name));
    }

    public boolean contains(String name) {
        return view().containsKey(name);
    }

    /** Names of registered utilities, in construction order. */
    public Set<String> names() {
        return view().keySet();
    }

    public int size() {
        return view().size();
    }

    /**
     * Empties the registry and returns its entries in reverse construction order, ready for
     * teardown.
     */
    public List<Map.Entry<String, Object>> release() {
        Map<String, Object> current = view();
        published = Map.of();
        if (!frozen) {
            building = new LinkedHashMap<>();
        }
        List<Map.Entry<String, Object>> entries = new ArrayList<>(current.entrySet());
        Collections.reverse(entries);
        return entries;
    }

    private Map<String, Object> view() {
        return frozen ? published : building;
    }
}
