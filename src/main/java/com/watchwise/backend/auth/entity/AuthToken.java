package com.watchwise.backend.auth.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * Access token minted by the identity provider; this service only looks tokens up.
 */
@Data
@Entity
@Table(name = "auth_tokens")
public class AuthToken {

    public enum TokenType { ACCESS, REFRESH }

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 64)
    private String token;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TokenType type = TokenType.ACCESS;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();

    @Column(nullable = false)
    private boolean revoked = false;

    @Column(name = "device_id", length = 128)
    private String deviceId;

    public boolean isUsableAccessToken(Instant now) {
        return !revoked
                && type == TokenType.ACCESS
                && expiresAt != null
                && expiresAt.isAfter(now);
    }
}
