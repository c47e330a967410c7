package com.warden.security.password;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Holds each tenant's {@link PasswordPolicy} and checks passwords against it.
 * <p>
 * Tenants without an explicit policy get the default one. Consulted when an account is
 * created with a password, and whenever a password is changed or reset.
 */
public class PasswordPolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(PasswordPolicyEngine.class);

    public static final String COMMON_PASSWORDS_RESOURCE = "/common-passwords.txt";

    private final PasswordPolicy defaultPolicy;
    private final Map<UUID, PasswordPolicy> policies = new ConcurrentHashMap<>();
    private final Set<String> commonPasswords;

    /**
     * Uses {@link PasswordPolicy#defaults()} and the bundled common-password list.
     */
    public PasswordPolicyEngine() {
        this(PasswordPolicy.defaults(), loadCommonPasswords());
    }

    public PasswordPolicyEngine(PasswordPolicy defaultPolicy, Set<String> commonPasswords) {
        if (defaultPolicy == null) {
            throw new IllegalArgumentException("defaultPolicy must not be null");
        }
        this.defaultPolicy = defaultPolicy;
        this.commonPasswords = commonPasswords.stream()
                .map(p -> p.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public PasswordPolicy getPolicy(UUID tenantId) {
        return policies.getOrDefault(tenantId, defaultPolicy);
    }

    public void setPolicy(UUID tenantId, PasswordPolicy policy) {
        if (tenantId == null || policy == null) {
            throw new IllegalArgumentException("tenantId and policy must not be null");
        }
        policies.put(tenantId, policy);
        log.info("Password policy updated for tenant {}", tenantId);
    }

    public void resetPolicy(UUID tenantId) {
        policies.remove(tenantId);
    }

    public PolicyValidationResult validate(String password, UUID tenantId, PersonalInfo personalInfo) {
        return validate(password, getPolicy(tenantId), personalInfo);
    }

    /**
     * Checks every rule and reports all violations at once.
     */
    public PolicyValidationResult validate(String password, PasswordPolicy policy, PersonalInfo personalInfo) {
        if (password == null || password.isEmpty()) {
            return PolicyValidationResult.fail(List.of("Password is required"));
        }
        List<String> errors = new ArrayList<>();
        if (password.length() < policy.minLength()) {
            errors.add("Password must be at least " + policy.minLength() + " characters long");
        }
        if (password.length() > 128) {
            errors.add("Password must be at most 128 characters long");
        }
        if (policy.requireUppercase() && password.chars().noneMatch(Character::isUpperCase)) {
            errors.add("Password must contain at least one uppercase letter");
        }
        if (policy.requireLowercase() && password.chars().noneMatch(Character::isLowerCase)) {
            errors.add("Password must contain at least one lowercase letter");
        }
        if (policy.requireDigits() && password.chars().noneMatch(Character::isDigit)) {
            errors.add("Password must contain at least one digit");
        }
        if (policy.requireSpecial() && password.chars().noneMatch(ch -> policy.specialChars().indexOf(ch) >= 0)) {
            errors.add("Password must contain at least one special character (" + policy.specialChars() + ")");
        }
        String lower = password.toLowerCase(Locale.ROOT);
        if (policy.preventCommonPasswords() && commonPasswords.contains(lower)) {
            errors.add("Password is too common");
        }
        if (policy.preventPersonalInfo() && personalInfo != null
                && personalInfo.fragments().stream().anyMatch(lower::contains)) {
            errors.add("Password must not contain personal information");
        }
        return errors.isEmpty() ? PolicyValidationResult.ok() : PolicyValidationResult.fail(errors);
    }

    /**
     * True if the password matches the current hash or one of the remembered previous hashes.
     */
    public boolean isReused(String password, String currentHash, List<String> history,
                            PasswordPolicy policy, PasswordHasher hasher) {
        if (hasher.verify(password, currentHash)) {
            return true;
        }
        return history.stream()
                .limit(policy.historyCount())
                .anyMatch(previous -> hasher.verify(password, previous));
    }

    /**
     * True once {@code maxAgeDays} have passed since the password was set. Accounts that never
     * recorded a change time are not considered expired.
     */
    public boolean isExpired(Instant passwordChangedAt, UUID tenantId, Instant now) {
        if (passwordChangedAt == null) {
            return false;
        }
        Duration maxAge = Duration.ofDays(getPolicy(tenantId).maxAgeDays());
        return passwordChangedAt.plus(maxAge).isBefore(now);
    }

    static Set<String> loadCommonPasswords() {
        try (InputStream in = PasswordPolicyEngine.class.getResourceAsStream(COMMON_PASSWORDS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + COMMON_PASSWORDS_RESOURCE);
            }
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                return reader.lines()
                        .map(String::strip)
                        .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                        .collect(Collectors.toUnmodifiableSet());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + COMMON_PASSWORDS_RESOURCE, e);
        }
    }
}
