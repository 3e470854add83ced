package com.watchwise.backend.restriction.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.watchwise.backend.common.persistence.AfterCommit;
import com.watchwise.backend.restriction.entity.AppRestriction;
import com.watchwise.backend.restriction.entity.BedtimeSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.function.BooleanSupplier;

/**
 * Pushes source changes to the device cache once they committed. The payload is taken
 * at call time; a failed push is logged and repaired by the next change to that document.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RestrictionCachePublisher {

    private final DeviceRestrictionCache cache;
    private final ObjectMapper om;

    public void publishApp(AppRestriction r) {
        Long owner = r.getParentId();
        String key = RestrictionCacheKeys.app(r.getBundleId());
        JsonNode payload = om.valueToTree(CachePayloads.AppRestrictionPayload.of(r));
        Instant at = r.getUpdatedAt();
        AfterCommit.run(() -> push(owner, key, () -> cache.put(owner, key, payload, at)));
    }

    public void publishAppRemoved(Long parentId, String bundleId, Instant at) {
        String key = RestrictionCacheKeys.app(bundleId);
        AfterCommit.run(() -> push(parentId, key, () -> cache.remove(parentId, key, at)));
    }

    public void publishBedtime(BedtimeSettings s, boolean active, Instant at) {
        Long owner = s.getUserId();
        JsonNode payload = om.valueToTree(CachePayloads.BedtimePayload.of(s, active, at));
        AfterCommit.run(() -> push(owner, RestrictionCacheKeys.BEDTIME,
                () -> cache.put(owner, RestrictionCacheKeys.BEDTIME, payload, at)));
    }

    public void publishBedtimeRemoved(Long parentId, Instant at) {
        AfterCommit.run(() -> push(parentId, RestrictionCacheKeys.BEDTIME,
                () -> cache.remove(parentId, RestrictionCacheKeys.BEDTIME, at)));
    }

    private void push(Long owner, String key, BooleanSupplier write) {
        try {
            if (!write.getAsBoolean()) {
                log.debug("cache push superseded. owner={} key={}", owner, key);
            }
        } catch (RuntimeException e) {
            log.warn("restriction cache push failed. owner={} key={}", owner, key, e);
        }
    }
}
