package com.watchwise.backend.restriction.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Per-parent rule for one app. {@code timeLimitSeconds == 0} means no limit (disable-only).
 */
@Data
@Entity
@Table(
        name = "app_restrictions",
        uniqueConstraints = {
                @UniqueConstraint(name = "ux_app_restrictions_parent_bundle", columnNames = {"parent_id", "bundle_id"})
        }
)
public class AppRestriction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "parent_id", nullable = false)
    private Long parentId;

    @Column(name = "bundle_id", nullable = false, length = 255)
    private String bundleId;

    @Column(name = "app_name", length = 120)
    private String appName;

    @Column(name = "time_limit_seconds", nullable = false)
    private long timeLimitSeconds = 0;

    @Column(name = "is_disabled", nullable = false)
    private boolean disabled = false;

    /** disabled because today's usage reached the limit, as opposed to by the parent */
    @Column(name = "disabled_by_limit", nullable = false)
    private boolean disabledByLimit = false;

    @Column(name = "daily_usage_seconds", nullable = false)
    private long dailyUsageSeconds = 0;

    /** device-local day dailyUsage belongs to */
    @Column(name = "last_reset_date")
    private LocalDate lastResetDate;

    @Column(name = "timezone", length = 64)
    private String timezone;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    public boolean hasLimit() {
        return timeLimitSeconds > 0;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        if (updatedAt == null) updatedAt = createdAt;
    }
}
