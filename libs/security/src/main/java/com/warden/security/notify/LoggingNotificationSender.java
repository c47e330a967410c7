package com.warden.security.notify;

import com.warden.observability.SensitiveDataRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a line per notification instead of delivering it. The body is never logged since it
 * carries the token.
 */
public class LoggingNotificationSender implements NotificationSender {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSender.class);

    @Override
    public void send(NotificationChannel channel, String destination, String subject, String body) {
        log.info("Notification via {} to {}: {}", channel, mask(channel, destination), subject);
    }

    private static String mask(NotificationChannel channel, String destination) {
        if (channel == NotificationChannel.EMAIL) {
            return SensitiveDataRedactor.maskEmail(destination);
        }
        if (destination == null || destination.length() <= 4) {
            return "***";
        }
        return "***" + destination.substring(destination.length() - 4);
    }
}
