package com.mailbridge.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks credential-like values in structured log fields.
 * <p>
 * Request contexts carry raw bearer tokens and stored app tokens; anything logged as a
 * field map goes through {@link #redact(Map)} first. Matching is a case-insensitive
 * substring test on the field name, so {@code rawToken} and {@code appToken} are both caught.
 * Token-shaped strings can also be shortened with {@link #preview(String)}.
 */
public final class SensitiveDataRedactor {

    /** Replacement for masked values. */
    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_PATTERNS = Set.of(
            "token", "password", "secret", "authorization", "jwks", "apikey", "credential"
    );

    private final Pattern pattern;

    public SensitiveDataRedactor() {
        this(DEFAULT_PATTERNS);
    }

    /**
     * @param patterns field-name fragments to treat as sensitive (case-insensitive)
     */
    public SensitiveDataRedactor(Set<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("patterns must not be empty");
        }
        String regex = String.join("|", patterns.stream().map(Pattern::quote).toList());
        this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a copy of {@code fields} with sensitive values replaced by {@value #REDACTED}.
     * Null or empty input yields an empty map. Null values stay null.
     */
    public Map<String, Object> redact(Map<String, ?> fields) {
        if (fields == null || fields.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(fields.size());
        fields.forEach((key, value) ->
                result.put(key, value != null && isSensitive(key) ? REDACTED : value));
        return result;
    }

    /** True when the field name contains one of the sensitive fragments. */
    public boolean isSensitive(String fieldName) {
        return fieldName != null && pattern.matcher(fieldName).find();
    }

    /**
     * Shortens a secret to its first character followed by an ellipsis, for debug output.
     */
    public static String preview(String secret) {
        if (secret == null || secret.isEmpty()) {
            return null;
        }
        return secret.charAt(0) + "...";
    }
}
