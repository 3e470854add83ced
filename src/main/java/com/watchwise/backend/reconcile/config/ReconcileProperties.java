package com.watchwise.backend.reconcile.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * application.yml:
 * app.reconcile.*
 * <p>
 * The *-ms keys are also read as {@code @Scheduled} placeholders.
 */
@ConfigurationProperties(prefix = "app.reconcile")
public class ReconcileProperties {

    private boolean enabled = true;

    /** a child not seen for this long triggers an inactivity alert */
    private Duration inactivityThreshold = Duration.ofDays(3);

    /** rows read per page by the inactivity and missed-heartbeat sweeps */
    private int batchSize = 200;

    private long codeSweepMs = 600_000;
    private long stalePurgeMs = 3_600_000;
    private long inactivitySweepMs = 21_600_000;
    private long missedHeartbeatSweepMs = 1_200_000;
    private long bedtimeCheckMs = 60_000;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public Duration getInactivityThreshold() { return inactivityThreshold; }
    public void setInactivityThreshold(Duration inactivityThreshold) { this.inactivityThreshold = inactivityThreshold; }

    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

    public long getCodeSweepMs() { return codeSweepMs; }
    public void setCodeSweepMs(long codeSweepMs) { this.codeSweepMs = codeSweepMs; }

    public long getStalePurgeMs() { return stalePurgeMs; }
    public void setStalePurgeMs(long stalePurgeMs) { this.stalePurgeMs = stalePurgeMs; }

    public long getInactivitySweepMs() { return inactivitySweepMs; }
    public void setInactivitySweepMs(long inactivitySweepMs) { this.inactivitySweepMs = inactivitySweepMs; }

    public long getMissedHeartbeatSweepMs() { return missedHeartbeatSweepMs; }
    public void setMissedHeartbeatSweepMs(long missedHeartbeatSweepMs) { this.missedHeartbeatSweepMs = missedHeartbeatSweepMs; }

    public long getBedtimeCheckMs() { return bedtimeCheckMs; }
    public void setBedtimeCheckMs(long bedtimeCheckMs) { this.bedtimeCheckMs = bedtimeCheckMs; }
}
