package com.keystone.utilities.logging;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks values of sensitive fields in structured log data. Field names are matched
 * case-insensitively by substring; nested maps and lists of maps are walked.
 */
public final class SensitiveDataRedactor {

    public static final String REDACTED = "[REDACTED]";

    static final Set<String> DEFAULT_PATTERNS = Set.of(
            "password", "token", "secret", "authorization", "apikey", "api_key", "credential");

    private final Set<String> patterns;
    private final Pattern compiled;

    public SensitiveDataRedactor() {
        this(Set.of());
    }

    /**
     * Creates a redactor matching the default patterns plus the given extra field patterns.
     */
    public SensitiveDataRedactor(Collection<String> extraPatterns) {
        Set<String> all = new HashSet<>(DEFAULT_PATTERNS);
        extraPatterns.stream()
                .filter(p -> p != null && !p.isBlank())
                .map(p -> p.toLowerCase(Locale.ROOT))
                .forEach(all::add);
        this.patterns = Set.copyOf(all);
        this.compiled = Pattern.compile(
                String.join("|", patterns.stream().map(Pattern::quote).toList()),
                Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a copy of {@code data} with sensitive values replaced by {@value #REDACTED}.
     * Null input gives an empty map.
     */
    public Map<String, Object> redact(Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(data.size());
        data.forEach((key, value) -> result.put(key, isSensitive(key) ? REDACTED : redactValue(value)));
        return result;
    }

    public boolean isSensitive(String fieldName) {
        return fieldName != null && compiled.matcher(fieldName).find();
    }

    public Set<String> patterns() {
        return patterns;
    }

    @SuppressWarnings("unchecked")
    private Object redactValue(Object value) {
        if (value instanceof Map<?, ?> nested) {
            return redact((Map<String, ?>) nested);
        }
        if (value instanceof List<?> list) {
            return list.stream().map(this::redactValue).toList();
        }
        return value;
    }
}
