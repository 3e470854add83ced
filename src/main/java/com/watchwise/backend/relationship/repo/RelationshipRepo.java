package com.watchwise.backend.relationship.repo;

import com.watchwise.backend.relationship.entity.Relationship;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface RelationshipRepo extends JpaRepository<Relationship, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from Relationship r where r.id = :id")
    Optional<Relationship> findByIdForUpdate(@Param("id") Long id);

    boolean existsByParentUserIdAndChildUserIdAndActiveTrue(Long parentUserId, Long childUserId);

    boolean existsByChildUserIdAndActiveTrue(Long childUserId);

    List<Relationship> findByParentUserIdAndActiveTrueOrderByCreatedAtAsc(Long parentUserId);

    List<Relationship> findByChildUserIdAndActiveTrueOrderByCreatedAtAsc(Long childUserId);

    /** Rows the activity tracker is about to compare-and-set. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
           select r from Relationship r
            where r.childUserId = :childId
              and r.active = true
            order by r.id asc
           """)
    List<Relationship> findActiveByChildForUpdate(@Param("childId") Long childUserId);

    /**
     * One page of the missed-heartbeat sweep, keyed on id so escalations between pages
     * do not shift it. Gracefully closed apps are not missing.
     */
    @Query("""
           select r from Relationship r
            where r.active = true
              and r.normalClosure = false
              and r.lastHeartbeatAt < :cutoff
              and r.id > :afterId
            order by r.id asc
           """)
    List<Relationship> findSilentSince(@Param("cutoff") Instant cutoff,
                                       @Param("afterId") Long afterId,
                                       Pageable page);

    /**
     * Raises the stored escalation level only if nothing moved underneath the sweep:
     * a heartbeat in between changes lastHeartbeatAt, a lower level never overwrites a higher one.
     */
    @Modifying
    @Query("""
           update Relationship r
              set r.missedHeartbeats = :level
            where r.id = :id
              and r.active = true
              and r.normalClosure = false
              and r.missedHeartbeats < :level
              and r.lastHeartbeatAt = :observed
           """)
    int escalate(@Param("id") Long id, @Param("level") int level, @Param("observed") Instant observedHeartbeatAt);
}
