package com.keystone.tenancy;

import com.keystone.container.config.ConfigKey;
import com.keystone.container.config.ConfigSlice;
import com.keystone.container.config.ConfigType;
import com.keystone.tenancy.model.TenantType;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-tier defaults applied when a tenant is created: the user limit, the feature set and the
 * tier used when a request names none.
 */
public record TenantTierPolicy(TenantType defaultType, Map<TenantType, Integer> maxUsers,
                               Map<TenantType, Set<String>> features) {

    public static final String DEFAULT_TYPE_KEY = "tenancy.default.type";
    public static final String MAX_USERS_KEY_PREFIX = "tenancy.max.users.";
    public static final String FEATURES_KEY_PREFIX = "tenancy.features.";

    private static final Map<TenantType, String> DEFAULT_MAX_USERS = Map.of(
            TenantType.INDIVIDUAL, "1",
            TenantType.ORGANIZATION, "50",
            TenantType.ENTERPRISE, "1000");

    private static final Map<TenantType, String> DEFAULT_FEATURES = Map.of(
            TenantType.INDIVIDUAL, "basic_analytics,file_upload",
            TenantType.ORGANIZATION, "basic_analytics,file_upload,team_collaboration,advanced_insights",
            TenantType.ENTERPRISE,
            "basic_analytics,file_upload,team_collaboration,advanced_insights,custom_integrations,audit_logs");

    public TenantTierPolicy {
        if (defaultType == null) {
            throw new IllegalArgumentException("defaultType must not be null");
        }
        for (TenantType type : TenantType.values()) {
            Integer limit = maxUsers.get(type);
            if (limit == null || limit <= 0) {
                throw new IllegalArgumentException("max users for " + type.value() + " must be positive");
            }
        }
        maxUsers = Map.copyOf(maxUsers);
        Map<TenantType, Set<String>> copied = new EnumMap<>(TenantType.class);
        features.forEach((type, set) -> copied.put(type, Set.copyOf(set)));
        features = Map.copyOf(copied);
    }

    /** Built-in tier defaults. */
    public static TenantTierPolicy defaults() {
        Map<TenantType, Integer> limits = new EnumMap<>(TenantType.class);
        Map<TenantType, Set<String>> featureSets = new EnumMap<>(TenantType.class);
        for (TenantType type : TenantType.values()) {
            limits.put(type, Integer.parseInt(DEFAULT_MAX_USERS.get(type)));
            featureSets.put(type, Set.of(DEFAULT_FEATURES.get(type).split(",")));
        }
        return new TenantTierPolicy(TenantType.ORGANIZATION, limits, featureSets);
    }

    /** The configuration keys {@link #fromConfig} reads. */
    public static List<ConfigKey> configKeys() {
        List<ConfigKey> keys = new ArrayList<>();
        keys.add(ConfigKey.optional(DEFAULT_TYPE_KEY, ConfigType.STRING, TenantType.ORGANIZATION.value()));
        for (TenantType type : TenantType.values()) {
            keys.add(ConfigKey.optional(MAX_USERS_KEY_PREFIX + type.value(), ConfigType.INT, DEFAULT_MAX_USERS.get(type)));
            keys.add(ConfigKey.optional(FEATURES_KEY_PREFIX + type.value(), ConfigType.LIST, DEFAULT_FEATURES.get(type)));
        }
        return keys;
    }

    /**
     * @throws IllegalArgumentException if the default tier names no known tier
     */
    public static TenantTierPolicy fromConfig(ConfigSlice config) {
        String typeName = config.getString(DEFAULT_TYPE_KEY, TenantType.ORGANIZATION.value());
        TenantType defaultType = TenantType.fromString(typeName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown tenant type '" + typeName + "'"));
        Map<TenantType, Integer> limits = new EnumMap<>(TenantType.class);
        Map<TenantType, Set<String>> featureSets = new EnumMap<>(TenantType.class);
        for (TenantType type : TenantType.values()) {
            limits.put(type, config.getInt(MAX_USERS_KEY_PREFIX + type.value(),
                    Integer.parseInt(DEFAULT_MAX_USERS.get(type))));
            featureSets.put(type, Set.copyOf(config.getList(FEATURES_KEY_PREFIX + type.value())));
        }
        return new TenantTierPolicy(defaultType, limits, featureSets);
    }

    public int maxUsersFor(TenantType type) {
        return maxUsers.get(type);
    }

    public Set<String> featuresFor(TenantType type) {
        return features.getOrDefault(type, Set.of());
    }
}
