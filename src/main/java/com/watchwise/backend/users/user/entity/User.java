package com.watchwise.backend.users.user.entity;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

@Data
@Entity
@Table(
        name = "users",
        uniqueConstraints = {
                @UniqueConstraint(name = "ux_users_email", columnNames = {"email"})
        },
        indexes = {
                @Index(name = "ix_users_type_active", columnList = "user_type,last_active_at")
        }
)
public class User {

    public enum UserType { PARENT, CHILD }

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "email", length = 320)
    private String email;

    @Column(name = "display_name")
    private String displayName;

    @Enumerated(EnumType.STRING)
    @Column(name = "user_type", length = 16)
    private UserType userType;

    @Column(name = "status", nullable = false, length = 16)
    private String status = "ACTIVE";

    // ===== pairing =====

    @Column(name = "is_device_paired", nullable = false)
    private boolean devicePaired = false;

    @Column(name = "paired_with_parent_id")
    private Long pairedWithParentId;

    @Column(name = "paired_at")
    private Instant pairedAt;

    @Column(name = "unlinked_at")
    private Instant unlinkedAt;

    // ===== activity (written only by the activity tracker) =====

    @Column(name = "last_active_at")
    private Instant lastActiveAt;

    @Column(name = "last_activity_type", length = 32)
    private String lastActivityType;

    @Column(name = "last_graceful_shutdown_at")
    private Instant lastGracefulShutdownAt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "device_info")
    private JsonNode deviceInfo;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public void setEmail(String email) {
        this.email = (email == null) ? null : email.trim().toLowerCase();
    }

    public boolean isChild() {
        return userType == UserType.CHILD;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        if (updatedAt == null) updatedAt = Instant.now();
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }
}
