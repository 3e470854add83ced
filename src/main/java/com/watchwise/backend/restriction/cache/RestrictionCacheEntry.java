package com.watchwise.backend.restriction.cache;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * Child-readable mirror of one restriction document. Eventually consistent with the
 * source tables; {@code sourceUpdatedAt} only moves forward.
 */
@Data
@Entity
@Table(
        name = "restriction_cache_entries",
        uniqueConstraints = {
                @UniqueConstraint(name = "ux_restriction_cache_owner_key", columnNames = {"owner_user_id", "cache_key"})
        }
)
public class RestrictionCacheEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** parent whose restriction this mirrors */
    @Column(name = "owner_user_id", nullable = false)
    private Long ownerUserId;

    @Column(name = "cache_key", nullable = false, length = 300)
    private String cacheKey;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "payload")
    private JsonNode payload;

    @Column(name = "source_updated_at", nullable = false)
    private Instant sourceUpdatedAt;

    /** tombstone: the source was removed */
    @Column(name = "is_deleted", nullable = false)
    private boolean deleted = false;

    @Column(name = "written_at", nullable = false)
    private Instant writtenAt;
}
