package com.watchwise.backend.heartbeat.entity;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/** Latest signal per child device; only ever moves forward in time. */
@Data
@Entity
@Table(
        name = "heartbeats",
        uniqueConstraints = {
                @UniqueConstraint(name = "ux_heartbeats_child", columnNames = {"child_user_id"})
        }
)
public class HeartbeatRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "child_user_id", nullable = false)
    private Long childUserId;

    @Column(name = "signal_at", nullable = false)
    private Instant timestamp;

    @Column(name = "activity_type", nullable = false, length = 32)
    private String activityType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "device_info")
    private JsonNode deviceInfo;

    /** false once the app reported a graceful shutdown */
    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    void touch() {
        updatedAt = Instant.now();
    }
}
