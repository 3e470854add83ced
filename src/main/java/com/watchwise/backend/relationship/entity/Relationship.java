package com.watchwise.backend.relationship.entity;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * Parent-child supervision link. Unlinking is terminal; pairing again creates a new row.
 * <p>
 * {@code activePairKey} is "parentId:childId" while active and null afterwards, so the
 * unique index allows any number of historical rows but only one live link per pair.
 */
@Data
@Entity
@Table(
        name = "parent_child_relationships",
        uniqueConstraints = {
                @UniqueConstraint(name = "ux_relationship_active_pair", columnNames = {"active_pair_key"})
        },
        indexes = {
                @Index(name = "ix_relationship_parent", columnList = "parent_user_id,is_active"),
                @Index(name = "ix_relationship_child", columnList = "child_user_id,is_active"),
                @Index(name = "ix_relationship_heartbeat", columnList = "is_active,last_heartbeat_at")
        }
)
public class Relationship {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "parent_user_id", nullable = false)
    private Long parentUserId;

    @Column(name = "child_user_id", nullable = false)
    private Long childUserId;

    @Column(name = "child_name", nullable = false, length = 120)
    private String childName;

    @Column(name = "device_name", nullable = false, length = 120)
    private String deviceName;

    /** code this link was created from */
    @Column(name = "pairing_code", length = 6)
    private String pairingCode;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "active_pair_key", length = 48)
    private String activePairKey;

    // ===== liveness (written only by the activity tracker, escalation counter by the sweep) =====

    @Column(name = "last_sync_at")
    private Instant lastSyncAt;

    @Column(name = "last_heartbeat_at")
    private Instant lastHeartbeatAt;

    @Column(name = "missed_heartbeats", nullable = false)
    private int missedHeartbeats = 0;

    @Column(name = "is_normal_closure", nullable = false)
    private boolean normalClosure = false;

    @Column(name = "last_graceful_shutdown_at")
    private Instant lastGracefulShutdownAt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "child_device_info")
    private JsonNode childDeviceInfo;

    // ===== unlink =====

    @Column(name = "unlinked_at")
    private Instant unlinkedAt;

    @Column(name = "unlinked_by")
    private Long unlinkedBy;

    public static String pairKey(Long parentUserId, Long childUserId) {
        return parentUserId + ":" + childUserId;
    }

    /**
     * A freshly paired link counts as a heartbeat at pairing time, so the sweep has a baseline.
     */
    public static Relationship open(Long parentUserId, Long childUserId, String childName,
                                    String deviceName, String pairingCode, Instant now) {
        Relationship r = new Relationship();
        r.setParentUserId(parentUserId);
        r.setChildUserId(childUserId);
        r.setChildName(childName);
        r.setDeviceName(deviceName);
        r.setPairingCode(pairingCode);
        r.setCreatedAt(now);
        r.setActive(true);
        r.setActivePairKey(pairKey(parentUserId, childUserId));
        r.setLastSyncAt(now);
        r.setLastHeartbeatAt(now);
        r.setMissedHeartbeats(0);
        r.setNormalClosure(false);
        return r;
    }

    public boolean involves(Long userId) {
        return userId != null && (userId.equals(parentUserId) || userId.equals(childUserId));
    }

    public Long otherParty(Long userId) {
        return userId != null && userId.equals(parentUserId) ? childUserId : parentUserId;
    }

    public void unlink(Long by, Instant now) {
        this.active = false;
        this.activePairKey = null;
        this.unlinkedAt = now;
        this.unlinkedBy = by;
    }
}
