package com.watchwise.backend.detection.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * An app seen on a child device that the parent has not decided on yet.
 * Once processed the row is never changed again.
 */
@Data
@Entity
@Table(
        name = "new_app_detections",
        uniqueConstraints = {
                @UniqueConstraint(name = "ux_new_app_detections_parent_bundle", columnNames = {"parent_id", "bundle_id"})
        },
        indexes = {
                @Index(name = "ix_new_app_detections_open", columnList = "parent_id,is_processed,detected_at")
        }
)
public class NewAppDetection {

    public enum Resolution { MONITORED, IGNORED }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "parent_id", nullable = false)
    private Long parentId;

    /** device the app was found on */
    @Column(name = "child_user_id", nullable = false)
    private Long childUserId;

    @Column(name = "bundle_id", nullable = false, length = 255)
    private String bundleId;

    @Column(name = "app_name", nullable = false, length = 120)
    private String appName;

    @Column(name = "detected_at", nullable = false)
    private Instant detectedAt;

    @Column(name = "is_processed", nullable = false)
    private boolean processed = false;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "resolution", length = 16)
    private Resolution resolution;

    public void resolve(Resolution resolution, Instant now) {
        this.processed = true;
        this.processedAt = now;
        this.resolution = resolution;
    }
}
