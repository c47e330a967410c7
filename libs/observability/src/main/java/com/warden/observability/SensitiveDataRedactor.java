package com.warden.observability;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Redacts credential material from audit metadata and log data.
 * <p>
 * Keys are matched case-insensitively against substrings such as {@code password},
 * {@code token}, {@code secret}, {@code mfa_code}, {@code otp} and {@code backup}.
 * Nested maps are redacted recursively. Emails can be masked with {@link #maskEmail(String)}
 * before they are written to application logs.
 */
public final class SensitiveDataRedactor {

    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_SENSITIVE_PATTERNS = Set.of(
            "password", "passwd", "token", "secret", "authorization",
            "apikey", "api_key", "credential", "mfa_code", "mfacode",
            "otp", "backup", "qr_code", "qrcode"
    );

    private final Set<String> sensitivePatterns;
    private final Pattern compiledPattern;

    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    /**
     * @param patterns key substrings to treat as sensitive (case-insensitive)
     */
    public SensitiveDataRedactor(Set<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("patterns must not be null or empty");
        }
        this.sensitivePatterns = Set.copyOf(patterns);
        String regex = String.join("|", sensitivePatterns.stream()
                .map(Pattern::quote)
                .toList());
        this.compiledPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a copy of the map with sensitive values replaced by {@value #REDACTED}.
     * Null input yields an empty map; null values are kept as null.
     */
    public Map<String, Object> redact(Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(data.size());
        for (Map.Entry<String, ?> entry : data.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (isSensitive(key)) {
                result.put(key, REDACTED);
            } else if (value instanceof Map<?, ?> nested) {
                result.put(key, redact(stringKeys(nested)));
            } else if (value instanceof Collection<?> collection) {
                result.put(key, collection.stream()
                        .map(item -> item instanceof Map<?, ?> m ? redact(stringKeys(m)) : item)
                        .toList());
            } else {
                result.put(key, value);
            }
        }
        return result;
    }

    public boolean isSensitive(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        return compiledPattern.matcher(fieldName).find();
    }

    public Set<String> sensitivePatterns() {
        return sensitivePatterns;
    }

    /**
     * Masks the local part of an email address, keeping its first character:
     * {@code alice@example.com -> a***@example.com}. Values without {@code @} are fully masked.
     */
    public static String maskEmail(String email) {
        if (email == null || email.isBlank()) {
            return email;
        }
        int at = email.indexOf('@');
        if (at <= 0) {
            return "***";
        }
        return email.charAt(0) + "***" + email.substring(at);
    }

    private static Map<String, Object> stringKeys(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>(map.size());
        map.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }
}
