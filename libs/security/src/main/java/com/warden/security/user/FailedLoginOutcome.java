package com.warden.security.user;

import java.time.Instant;

/**
 * State of a user's lockout counters after a failed login was recorded.
 *
 * @param attempts    failed attempts since the last success or reset
 * @param lockedUntil lock expiry, null when not locked
 * @param lockedNow   true when this attempt (re)started the lock
 */
public record FailedLoginOutcome(int attempts, Instant lockedUntil, boolean lockedNow) {
}
