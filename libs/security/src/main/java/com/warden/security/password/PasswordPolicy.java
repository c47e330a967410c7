package com.warden.security.password;

import java.time.Duration;

/**
 * Password complexity, expiry and lockout rules of a tenant.
 * <p>
 * Bounds are enforced at construction: at least 8 characters, expiry within 90 days, a history
 * of at least 5 passwords, lockout after at most 10 failed attempts.
 *
 * @param minLength              minimum length, 8..128
 * @param requireUppercase       at least one upper-case letter
 * @param requireLowercase       at least one lower-case letter
 * @param requireDigits          at least one digit
 * @param requireSpecial         at least one character from {@code specialChars}
 * @param specialChars           characters that count as special
 * @param maxAgeDays             days before a password expires, 1..90
 * @param historyCount           previous passwords that may not be reused, 5..24
 * @param lockoutAttempts        failed logins before the account locks, 3..10
 * @param lockoutDuration        how long a lock lasts, 5 minutes..24 hours
 * @param preventCommonPasswords reject passwords from the common-password list
 * @param preventPersonalInfo    reject passwords containing the user's name or email
 */
public record PasswordPolicy(
        int minLength,
        boolean requireUppercase,
        boolean requireLowercase,
        boolean requireDigits,
        boolean requireSpecial,
        String specialChars,
        int maxAgeDays,
        int historyCount,
        int lockoutAttempts,
        Duration lockoutDuration,
        boolean preventCommonPasswords,
        boolean preventPersonalInfo
) {

    public static final String DEFAULT_SPECIAL_CHARS = "!@#$%^&*";

    public PasswordPolicy {
        checkRange("minLength", minLength, 8, 128);
        checkRange("maxAgeDays", maxAgeDays, 1, 90);
        checkRange("historyCount", historyCount, 5, 24);
        checkRange("lockoutAttempts", lockoutAttempts, 3, 10);
        if (lockoutDuration == null
                || lockoutDuration.compareTo(Duration.ofMinutes(5)) < 0
                || lockoutDuration.compareTo(Duration.ofHours(24)) > 0) {
            throw new IllegalArgumentException("lockoutDuration must be between 5 minutes and 24 hours");
        }
        if (specialChars == null || specialChars.isEmpty()) {
            specialChars = DEFAULT_SPECIAL_CHARS;
        }
    }

    /**
     * 12 characters, all character classes, 90 day expiry, 5 remembered passwords,
     * lock for 30 minutes after 5 failures, common and personal passwords rejected.
     */
    public static PasswordPolicy defaults() {
        return new PasswordPolicy(12, true, true, true, true, DEFAULT_SPECIAL_CHARS,
                90, 5, 5, Duration.ofMinutes(30), true, true);
    }

    public PasswordPolicy withMinLength(int value) {
        return new PasswordPolicy(value, requireUppercase, requireLowercase, requireDigits, requireSpecial,
                specialChars, maxAgeDays, historyCount, lockoutAttempts, lockoutDuration,
                preventCommonPasswords, preventPersonalInfo);
    }

    public PasswordPolicy withLockout(int attempts, Duration duration) {
        return new PasswordPolicy(minLength, requireUppercase, requireLowercase, requireDigits, requireSpecial,
                specialChars, maxAgeDays, historyCount, attempts, duration,
                preventCommonPasswords, preventPersonalInfo);
    }

    private static void checkRange(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException("%s must be between %d and %d, was %d".formatted(name, min, max, value));
        }
    }
}
