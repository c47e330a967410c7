package com.warden.security.notify;

/**
 * Outbound delivery of reset links, verification tokens and MFA confirmations.
 * <p>
 * Implementations must not throw for delivery problems they can retry themselves; an exception
 * aborts the calling operation.
 */
public interface NotificationSender {

    void send(NotificationChannel channel, String destination, String subject, String body);
}
