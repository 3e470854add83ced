package com.watchwise.backend.restriction.service;

import com.watchwise.backend.relationship.entity.Relationship;
import com.watchwise.backend.relationship.repo.RelationshipRepo;
import com.watchwise.backend.restriction.cache.DeviceRestrictionCache;
import com.watchwise.backend.restriction.cache.RestrictionCacheEntry;
import com.watchwise.backend.restriction.dto.RestrictionDtos.CacheEntryDto;
import com.watchwise.backend.restriction.dto.RestrictionDtos.DeviceRestrictionsDto;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** What a child device enforces: the cached state of every parent it is linked to. */
@Service
@RequiredArgsConstructor
public class DeviceRestrictionQueryService {

    private final RelationshipRepo relationships;
    private final DeviceRestrictionCache cache;

    public DeviceRestrictionsDto forChild(Long childUserId) {
        Set<Long> parents = new LinkedHashSet<>();
        for (Relationship r : relationships.findByChildUserIdAndActiveTrueOrderByCreatedAtAsc(childUserId)) {
            parents.add(r.getParentUserId());
        }

        List<RestrictionCacheEntry> entries = cache.entriesOf(parents);
        Instant last = entries.stream()
                .map(RestrictionCacheEntry::getSourceUpdatedAt)
                .max(Instant::compareTo)
                .orElse(null);

        List<CacheEntryDto> dtos = entries.stream()
                .map(e -> new CacheEntryDto(e.getOwnerUserId(), e.getCacheKey(), e.getPayload(), e.isDeleted(),
                        e.getSourceUpdatedAt()))
                .toList();
        return new DeviceRestrictionsDto(dtos, last);
    }
}
