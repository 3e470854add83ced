package com.watchwise.backend.reconcile.model;

/**
 * Escalation ladder for a silent child device. Levels only ever go up until the
 * device is heard from again.
 */
public enum MissedHeartbeatLevel {

    FIRST("First Heartbeat Missed") {
        @Override
        public String message(String childName, int missed) {
            return childName + "'s device missed its first heartbeat. "
                    + "This could indicate the app was closed or the device is having connectivity issues.";
        }
    },
    SECOND("Second Heartbeat Missed") {
        @Override
        public String message(String childName, int missed) {
            return childName + "'s device has missed 2 consecutive heartbeats. "
                    + "The app may have been deleted or the device is turned off.";
        }
    },
    MULTIPLE("Multiple Heartbeats Missed") {
        @Override
        public String message(String childName, int missed) {
            return childName + "'s device has missed " + missed + " consecutive heartbeats. "
                    + "Please check if the WatchWise app is still installed and running.";
        }
    },
    EXTENDED("Extended Heartbeat Failure") {
        @Override
        public String message(String childName, int missed) {
            return childName + "'s device has been offline for over 5 hours. "
                    + "The WatchWise app may have been deleted or the device is experiencing issues.";
        }
    };

    private final String title;

    MissedHeartbeatLevel(String title) {
        this.title = title;
    }

    public String title() { return title; }

    public abstract String message(String childName, int missed);

    public static MissedHeartbeatLevel of(int missed) {
        if (missed <= 0) throw new IllegalArgumentException("missed must be positive: " + missed);
        if (missed == 1) return FIRST;
        if (missed == 2) return SECOND;
        if (missed <= 4) return MULTIPLE;
        return EXTENDED;
    }
}
