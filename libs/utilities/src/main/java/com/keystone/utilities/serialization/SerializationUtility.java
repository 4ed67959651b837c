package com.keystone.utilities.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.keystone.container.bootstrap.UtilityDescriptor;
import com.keystone.container.config.ConfigKey;
import com.keystone.container.config.ConfigSlice;
import com.keystone.container.config.ConfigType;
import com.keystone.utilities.UtilityNames;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@code serialization} utility: JSON through Jackson, with {@code java.time} values written
 * as ISO-8601 strings.
 */
public final class SerializationUtility {

    private static final Logger log = LoggerFactory.getLogger(SerializationUtility.class);

    public static final String PRETTY_KEY = "serialization.pretty";
    public static final String FAIL_ON_UNKNOWN_KEY = "serialization.fail.on.unknown";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() { };

    private final ObjectMapper mapper;

    public SerializationUtility(boolean pretty, boolean failOnUnknown) {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .configure(SerializationFeature.INDENT_OUTPUT, pretty)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, failOnUnknown);
    }

    public SerializationUtility() {
        this(false, false);
    }

    static SerializationUtility fromConfig(ConfigSlice config) {
        return new SerializationUtility(config.getBoolean(PRETTY_KEY, false), config.getBoolean(FAIL_ON_UNKNOWN_KEY, false));
    }

    /** Standard descriptor: depends on config and logger. */
    public static UtilityDescriptor descriptor() {
        return UtilityDescriptor.of(UtilityNames.SERIALIZATION, ctx -> fromConfig(ctx.config()))
                .dependsOn(UtilityNames.CONFIG, UtilityNames.LOGGER)
                .reads(ConfigKey.optional(PRETTY_KEY, ConfigType.BOOLEAN, "false"),
                        ConfigKey.optional(FAIL_ON_UNKNOWN_KEY, ConfigType.BOOLEAN, "false"));
    }

    /**
     * @throws SerializationException if the value cannot be written
     */
    public String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to serialize " + typeName(value), e);
        }
    }

    /**
     * @throws SerializationException if the JSON is malformed or does not fit the type
     */
    public <T> T fromJson(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }

    /** Like {@link #fromJson}, but empty instead of throwing. */
    public <T> Optional<T> tryFromJson(String json, Class<T> type) {
        try {
            return Optional.of(fromJson(json, type));
        } catch (SerializationException e) {
            log.debug("Ignoring unreadable {} payload: {}", type.getSimpleName(), e.getMessage());
            return Optional.empty();
        }
    }

    /** Converts a value to a generic JSON object map. */
    public Map<String, Object> toMap(Object value) {
        try {
            return mapper.convertValue(value, MAP_TYPE);
        } catch (IllegalArgumentException e) {
            throw new SerializationException("Failed to convert " + typeName(value) + " to a map", e);
        }
    }

    /** Converts a generic map (e.g., a request payload) to a typed value. */
    public <T> T fromMap(Map<String, ?> map, Class<T> type) {
        try {
            return mapper.convertValue(map, type);
        } catch (IllegalArgumentException e) {
            throw new SerializationException("Failed to convert map to " + type.getSimpleName(), e);
        }
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
