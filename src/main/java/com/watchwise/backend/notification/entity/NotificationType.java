package com.watchwise.backend.notification.entity;

public enum NotificationType {
    DEVICE_UNLINKED("device_unlinked"),
    INACTIVITY_ALERT("inactivity_alert"),
    MISSED_HEARTBEAT("missed_heartbeat"),
    APP_LIMIT_EXCEEDED("app_limit_exceeded"),
    NEW_APP_DETECTED("new_app_detected");

    private final String wire;

    NotificationType(String wire) {
        this.wire = wire;
    }

    /** Value the apps switch on. */
    public String wire() { return wire; }
}
