package com.watchwise.backend.pairing.repo;

import com.watchwise.backend.pairing.entity.PairingCode;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface PairingCodeRepo extends JpaRepository<PairingCode, Long> {

    /**
     * Codes that are neither consumed nor flagged expired. Newest first:
     * two children may hold the same digits at once.
     */
    @Query("""
           select c from PairingCode c
            where c.code = :code
              and c.active = false
              and c.expired = false
            order by c.createdAt desc, c.id desc
           """)
    List<PairingCode> findUnconsumed(@Param("code") String code);

    @Query("""
           select c from PairingCode c
            where c.code = :code
              and c.active = true
            order by c.pairedAt desc, c.id desc
           """)
    List<PairingCode> findConsumed(@Param("code") String code);

    @Query("""
           select count(c) from PairingCode c
            where c.code = :code
              and c.active = false
              and c.expired = false
              and c.expiresAt >= :now
           """)
    long countLive(@Param("code") String code, @Param("now") Instant now);

    /**
     * Unconsumed codes whose deadline has passed, whether or not they are flagged yet.
     * Codes retired by a newer code before their deadline are left out.
     */
    @Query("""
           select count(c) from PairingCode c
            where c.code = :code
              and c.active = false
              and c.expiresAt < :now
              and (c.cleanedUpAt is null or c.cleanedUpAt >= c.expiresAt)
           """)
    long countLapsed(@Param("code") String code, @Param("now") Instant now);

    /**
     * Compare-and-set consumption: 0 rows means another submission won.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
           update PairingCode c
              set c.active = true,
                  c.parentUserId = :parentId,
                  c.pairedAt = :now
            where c.id = :id
              and c.active = false
              and c.expired = false
           """)
    int consume(@Param("id") Long id, @Param("parentId") Long parentId, @Param("now") Instant now);

    @Modifying
    @Query("""
           update PairingCode c
              set c.expired = true,
                  c.cleanedUpAt = :now
            where c.id = :id
              and c.expired = false
              and c.expiresAt <= :now
           """)
    int markExpired(@Param("id") Long id, @Param("now") Instant now);

    /** A child holds one meaningful code: issuing a new one retires the old ones. */
    @Modifying
    @Query("""
           update PairingCode c
              set c.expired = true,
                  c.cleanedUpAt = :now
            where c.childUserId = :childId
              and c.active = false
              and c.expired = false
           """)
    int retireUnconsumedForChild(@Param("childId") Long childUserId, @Param("now") Instant now);

    @Modifying
    @Query("""
           update PairingCode c
              set c.expired = true,
                  c.cleanedUpAt = :now
            where c.expiresAt < :now
              and c.expired = false
           """)
    int expireOverdue(@Param("now") Instant now);

    @Modifying
    @Query("delete from PairingCode c where c.createdAt < :cutoff")
    int deleteCreatedBefore(@Param("cutoff") Instant cutoff);
}
