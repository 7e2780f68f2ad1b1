package com.vigil.observability;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks values whose key looks like a credential before data is logged or persisted.
 * <p>
 * Matching is a case-insensitive substring test on the key, so {@code twilioAuthToken} and
 * {@code DB_PASSWORD} are both caught by the defaults. Nested maps and lists of maps are
 * redacted recursively.
 */
public final class SensitiveDataRedactor {

    /** Replacement value for redacted entries. */
    public static final String REDACTED = "[REDACTED]";

    /** Key fragments redacted by default. */
    public static final Set<String> DEFAULT_PATTERNS = Set.of(
            "password", "secret", "token", "apikey", "api_key", "authorization",
            "credential", "private_key", "privatekey", "connectionstring"
    );

    private final Pattern pattern;

    public SensitiveDataRedactor() {
        this(DEFAULT_PATTERNS);
    }

    public SensitiveDataRedactor(Set<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("patterns must not be null or empty");
        }
        this.pattern = Pattern.compile(String.join("|", patterns.stream().map(Pattern::quote).toList()),
                Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a copy of {@code data} with sensitive values replaced by {@value #REDACTED}.
     * A null map yields an empty map. Keys are converted with {@link String#valueOf(Object)}.
     */
    public Map<String, Object> redact(Map<?, ?> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(data.size());
        data.forEach((key, value) -> {
            String name = String.valueOf(key);
            result.put(name, isSensitive(name) ? REDACTED : redactValue(value));
        });
        return result;
    }

    public boolean isSensitive(String key) {
        return key != null && pattern.matcher(key).find();
    }

    /**
     * Shows the first {@code visible} characters of a secret followed by {@code ...}.
     */
    public static String mask(String value, int visible) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        if (value.length() <= visible) {
            return "***";
        }
        return value.substring(0, visible) + "...";
    }

    private Object redactValue(Object value) {
        if (value instanceof Map<?, ?> nested) {
            return redact(nested);
        }
        if (value instanceof List<?> list) {
            return list.stream().map(this::redactValue).toList();
        }
        return value;
    }
}
