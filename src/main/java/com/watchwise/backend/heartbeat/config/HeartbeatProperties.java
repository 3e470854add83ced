package com.watchwise.backend.heartbeat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.heartbeat")
public class HeartbeatProperties {

    /** expected gap between two heartbeats; one escalation level per elapsed interval */
    private Duration missInterval = Duration.ofMinutes(15);

    /** silence shorter than this is never reported */
    private Duration gracePeriod = Duration.ofMinutes(20);

    /** a link synced within this window shows as online */
    private Duration onlineWindow = Duration.ofMinutes(5);

    /** no heartbeat for this long shows the device as offline */
    private Duration offlineThreshold = Duration.ofHours(24);

    public Duration getMissInterval() { return missInterval; }
    public void setMissInterval(Duration missInterval) { this.missInterval = missInterval; }

    public Duration getGracePeriod() { return gracePeriod; }
    public void setGracePeriod(Duration gracePeriod) { this.gracePeriod = gracePeriod; }

    public Duration getOnlineWindow() { return onlineWindow; }
    public void setOnlineWindow(Duration onlineWindow) { this.onlineWindow = onlineWindow; }

    public Duration getOfflineThreshold() { return offlineThreshold; }
    public void setOfflineThreshold(Duration offlineThreshold) { this.offlineThreshold = offlineThreshold; }
}
