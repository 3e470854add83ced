package com.watchwise.backend.pairing.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * A short-lived code a child device shows so a parent can link to it.
 * Issued -> consumed (active=true) or timed out (expired=true); never resurrected.
 */
@Data
@Entity
@Table(
        name = "pairing_codes",
        indexes = {
                @Index(name = "ix_pairing_codes_lookup", columnList = "code,is_active,is_expired"),
                @Index(name = "ix_pairing_codes_expiry", columnList = "is_expired,expires_at"),
                @Index(name = "ix_pairing_codes_created", columnList = "created_at")
        }
)
public class PairingCode {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "code", nullable = false, length = 6)
    private String code;

    @Column(name = "child_user_id", nullable = false)
    private Long childUserId;

    @Column(name = "child_name", nullable = false, length = 120)
    private String childName;

    @Column(name = "device_name", nullable = false, length = 120)
    private String deviceName;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    /** true once a parent consumed the code */
    @Column(name = "is_active", nullable = false)
    private boolean active = false;

    @Column(name = "is_expired", nullable = false)
    private boolean expired = false;

    // ===== consumption / cleanup metadata =====

    @Column(name = "parent_user_id")
    private Long parentUserId;

    @Column(name = "paired_at")
    private Instant pairedAt;

    @Column(name = "cleaned_up_at")
    private Instant cleanedUpAt;

    public boolean isPastDeadline(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }
}
