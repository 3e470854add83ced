package com.watchwise.backend.restriction.cache;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * The store child devices read restrictions from while enforcing offline.
 * <p>
 * Writes run in their own transaction (they are issued after the source change committed)
 * and compare the source timestamp: an older write never replaces a newer one, an equal
 * one is an idempotent re-push.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeviceRestrictionCache {

    private final RestrictionCacheEntryRepo repo;
    private final Clock clock;

    /**
     * @return false when a newer state is already cached
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean put(Long ownerUserId, String key, JsonNode payload, Instant sourceUpdatedAt) {
        return write(ownerUserId, key, payload, sourceUpdatedAt, false);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean remove(Long ownerUserId, String key, Instant sourceUpdatedAt) {
        return write(ownerUserId, key, null, sourceUpdatedAt, true);
    }

    @Transactional(readOnly = true)
    public List<RestrictionCacheEntry> entriesOf(Collection<Long> ownerUserIds) {
        if (ownerUserIds == null || ownerUserIds.isEmpty()) return List.of();
        return repo.findByOwnerUserIdInOrderByOwnerUserIdAscCacheKeyAsc(ownerUserIds);
    }

    private boolean write(Long ownerUserId, String key, JsonNode payload, Instant sourceUpdatedAt, boolean deleted) {
        RestrictionCacheEntry e = repo.findForUpdate(ownerUserId, key).orElse(null);
        if (e == null) {
            e = new RestrictionCacheEntry();
            e.setOwnerUserId(ownerUserId);
            e.setCacheKey(key);
        } else if (e.getSourceUpdatedAt() != null && e.getSourceUpdatedAt().isAfter(sourceUpdatedAt)) {
            log.debug("cache write skipped, newer state cached. owner={} key={} cached={} incoming={}",
                    ownerUserId, key, e.getSourceUpdatedAt(), sourceUpdatedAt);
            return false;
        }

        e.setPayload(deleted ? null : payload);
        e.setDeleted(deleted);
        e.setSourceUpdatedAt(sourceUpdatedAt);
        e.setWrittenAt(Instant.now(clock));
        repo.save(e);
        return true;
    }
}
