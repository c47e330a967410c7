package com.warden.security.notify;

public enum NotificationChannel {
    EMAIL,
    SMS
}
