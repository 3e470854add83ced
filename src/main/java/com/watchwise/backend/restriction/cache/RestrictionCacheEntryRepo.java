package com.watchwise.backend.restriction.cache;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface RestrictionCacheEntryRepo extends JpaRepository<RestrictionCacheEntry, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from RestrictionCacheEntry e where e.ownerUserId = :owner and e.cacheKey = :key")
    Optional<RestrictionCacheEntry> findForUpdate(@Param("owner") Long ownerUserId, @Param("key") String cacheKey);

    Optional<RestrictionCacheEntry> findByOwnerUserIdAndCacheKey(Long ownerUserId, String cacheKey);

    List<RestrictionCacheEntry> findByOwnerUserIdInOrderByOwnerUserIdAscCacheKeyAsc(Collection<Long> ownerUserIds);
}
