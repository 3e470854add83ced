package com.watchwise.backend.heartbeat.model;

import java.util.Locale;
import java.util.Optional;

public enum ActivityType {
    APP_OPENED("app_opened"),
    APP_BACKGROUND("app_background"),
    APP_SHUTDOWN("app_shutdown"),
    HEARTBEAT("heartbeat"),
    APP_ACTIVE("app_active"),
    MONITORING_STARTED("monitoring_started"),
    MONITORING_STOPPED("monitoring_stopped");

    private final String wire;

    ActivityType(String wire) {
        this.wire = wire;
    }

    public String wire() { return wire; }

    /** Missing type means the app was opened; unknown values are rejected. */
    public static Optional<ActivityType> fromWire(String raw) {
        if (raw == null || raw.isBlank()) return Optional.of(APP_OPENED);
        String v = raw.trim().toLowerCase(Locale.ROOT);
        for (ActivityType t : values()) {
            if (t.wire.equals(v)) return Optional.of(t);
        }
        return Optional.empty();
    }
}
