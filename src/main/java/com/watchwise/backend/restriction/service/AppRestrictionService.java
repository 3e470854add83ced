package com.watchwise.backend.restriction.service;

import com.watchwise.backend.common.web.ApiErrorCode;
import com.watchwise.backend.common.web.ApiException;
import com.watchwise.backend.notification.entity.NotificationType;
import com.watchwise.backend.notification.service.NotificationDispatcher;
import com.watchwise.backend.notification.service.NotificationEvent;
import com.watchwise.backend.relationship.entity.Relationship;
import com.watchwise.backend.relationship.repo.RelationshipRepo;
import com.watchwise.backend.restriction.cache.RestrictionCachePublisher;
import com.watchwise.backend.restriction.config.RestrictionProperties;
import com.watchwise.backend.restriction.dto.RestrictionDtos.AppRestrictionDto;
import com.watchwise.backend.restriction.dto.RestrictionDtos.UsageResult;
import com.watchwise.backend.restriction.entity.AppRestriction;
import com.watchwise.backend.restriction.repo.AppRestrictionRepo;
import com.watchwise.backend.restriction.support.AppCatalog;
import com.watchwise.backend.restriction.support.ClientTimeZoneResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-modify-write on the (parentId, bundleId) record, followed by a push of the
 * new state into the device cache.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AppRestrictionService {

    private final AppRestrictionRepo repo;
    private final RelationshipRepo relationships;
    private final RestrictionCachePublisher cachePublisher;
    private final NotificationDispatcher notifications;
    private final AppCatalog catalog;
    private final RestrictionProperties props;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<AppRestrictionDto> list(Long parentId) {
        return repo.findByParentIdOrderByBundleIdAsc(parentId).stream().map(AppRestrictionService::toDto).toList();
    }

    @Transactional
    public AppRestrictionDto setLimit(Long parentId, String bundleId, long seconds, String appName) {
        if (seconds < 0) throw new ApiException(ApiErrorCode.INVALID_FORMAT, "Time limit must not be negative.");
        final Instant now = Instant.now(clock);

        AppRestriction r = lockOrCreate(parentId, bundleId, appName, now);
        r.setTimeLimitSeconds(seconds);
        // a raised or cleared limit lifts a limit-triggered block
        if (r.isDisabledByLimit() && (!r.hasLimit() || r.getDailyUsageSeconds() < seconds)) {
            r.setDisabled(false);
            r.setDisabledByLimit(false);
        }
        return saveAndPublish(r, now);
    }

    @Transactional
    public AppRestrictionDto disable(Long parentId, String bundleId) {
        final Instant now = Instant.now(clock);
        AppRestriction r = lockOrCreate(parentId, bundleId, null, now);
        r.setDisabled(true);
        r.setDisabledByLimit(false);
        return saveAndPublish(r, now);
    }

    @Transactional
    public AppRestrictionDto enable(Long parentId, String bundleId) {
        AppRestriction r = repo.findForUpdate(parentId, requireBundleId(bundleId))
                .orElseThrow(() -> new ApiException(ApiErrorCode.NOT_FOUND, "App restriction not found."));
        r.setDisabled(false);
        r.setDisabledByLimit(false);
        return saveAndPublish(r, Instant.now(clock));
    }

    /** Removing an unknown app is a no-op. */
    @Transactional
    public boolean remove(Long parentId, String bundleId) {
        String id = requireBundleId(bundleId);
        Optional<AppRestriction> found = repo.findForUpdate(parentId, id);
        if (found.isEmpty()) return false;

        repo.delete(found.get());
        cachePublisher.publishAppRemoved(parentId, id, Instant.now(clock));
        log.info("app restriction removed. parentId={} bundleId={}", parentId, id);
        return true;
    }

    /**
     * Adds usage to today's counter. The first write of a later device-local day resets the
     * counter first. Crossing the limit disables the app and notifies the parent once;
     * later calls on the same day only add usage.
     */
    @Transactional
    public UsageResult recordUsage(Long parentId, String bundleId, long elapsedSeconds, ZoneId deviceZone) {
        AppRestriction r = repo.findForUpdate(parentId, requireBundleId(bundleId))
                .orElseThrow(() -> new ApiException(ApiErrorCode.NOT_FOUND, "App restriction not found."));
        return applyUsage(r, elapsedSeconds, deviceZone, null);
    }

    /**
     * Usage reported by a child device applies to every linked parent that restricts the app.
     */
    @Transactional
    public List<UsageResult> recordChildUsage(Long childUserId, String bundleId, long elapsedSeconds, ZoneId deviceZone) {
        String id = requireBundleId(bundleId);
        List<UsageResult> out = new ArrayList<>();
        for (Relationship rel : relationships.findByChildUserIdAndActiveTrueOrderByCreatedAtAsc(childUserId)) {
            repo.findForUpdate(rel.getParentUserId(), id)
                    .ifPresent(r -> out.add(applyUsage(r, elapsedSeconds, deviceZone, rel)));
        }
        return out;
    }

    private UsageResult applyUsage(AppRestriction r, long elapsedSeconds, ZoneId deviceZone, Relationship rel) {
        if (elapsedSeconds < 0) throw new ApiException(ApiErrorCode.INVALID_FORMAT, "Elapsed time must not be negative.");
        final Instant now = Instant.now(clock);

        ZoneId zone = resolveZone(r, deviceZone);
        LocalDate today = LocalDate.ofInstant(now, zone);
        // the local date only moves forward: a zone change that lands on an earlier date keeps counting
        if (r.getLastResetDate() == null || today.isAfter(r.getLastResetDate())) {
            r.setDailyUsageSeconds(0);
            r.setLastResetDate(today);
            if (r.isDisabledByLimit()) {
                r.setDisabled(false);
                r.setDisabledByLimit(false);
            }
        }

        r.setDailyUsageSeconds(r.getDailyUsageSeconds() + elapsedSeconds);
        r.setTimezone(zone.getId());

        boolean crossed = false;
        if (r.hasLimit() && r.getDailyUsageSeconds() >= r.getTimeLimitSeconds() && !r.isDisabled()) {
            r.setDisabled(true);
            r.setDisabledByLimit(true);
            crossed = true;
        }

        r.setUpdatedAt(now);
        AppRestriction saved = repo.save(r);
        cachePublisher.publishApp(saved);

        if (crossed) {
            notifyLimitExceeded(saved, rel, now);
            log.info("app limit reached. parentId={} bundleId={} usage={} limit={}",
                    saved.getParentId(), saved.getBundleId(), saved.getDailyUsageSeconds(), saved.getTimeLimitSeconds());
        }

        return new UsageResult(saved.getBundleId(), saved.getDailyUsageSeconds(), saved.getTimeLimitSeconds(),
                saved.isDisabled(), crossed);
    }

    private void notifyLimitExceeded(AppRestriction r, Relationship rel, Instant now) {
        String appName = displayName(r);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("bundleId", r.getBundleId());
        data.put("appName", appName);
        data.put("dailyUsage", r.getDailyUsageSeconds());
        data.put("timeLimit", r.getTimeLimitSeconds());
        if (rel != null) {
            data.put("childUserId", rel.getChildUserId());
            data.put("childName", rel.getChildName());
        }

        notifications.dispatch(new NotificationEvent(
                r.getParentId(),
                NotificationType.APP_LIMIT_EXCEEDED,
                "App Time Limit Exceeded",
                appName + " has reached its daily time limit",
                data,
                now
        ));
    }

    private ZoneId resolveZone(AppRestriction r, ZoneId deviceZone) {
        if (deviceZone != null) return deviceZone;
        return ClientTimeZoneResolver.parse(r.getTimezone())
                .or(() -> ClientTimeZoneResolver.parse(props.getDefaultTimezone()))
                .orElse(ZoneId.of("UTC"));
    }

    private AppRestriction lockOrCreate(Long parentId, String bundleId, String appName, Instant now) {
        String id = requireBundleId(bundleId);
        AppRestriction r = repo.findForUpdate(parentId, id).orElseGet(() -> {
            AppRestriction n = new AppRestriction();
            n.setParentId(parentId);
            n.setBundleId(id);
            n.setCreatedAt(now);
            return n;
        });
        if (appName != null && !appName.isBlank()) {
            r.setAppName(appName.trim());
        } else if (r.getAppName() == null) {
            r.setAppName(catalog.displayName(id));
        }
        return r;
    }

    private AppRestrictionDto saveAndPublish(AppRestriction r, Instant now) {
        r.setUpdatedAt(now);
        AppRestriction saved = repo.save(r);
        cachePublisher.publishApp(saved);
        log.info("app restriction saved. parentId={} bundleId={} limit={} disabled={}",
                saved.getParentId(), saved.getBundleId(), saved.getTimeLimitSeconds(), saved.isDisabled());
        return toDto(saved);
    }

    private String displayName(AppRestriction r) {
        return (r.getAppName() == null || r.getAppName().isBlank()) ? catalog.displayName(r.getBundleId()) : r.getAppName();
    }

    private static String requireBundleId(String bundleId) {
        if (bundleId == null || bundleId.isBlank() || bundleId.length() > 255) {
            throw new ApiException(ApiErrorCode.INVALID_FORMAT, "Invalid bundle id.");
        }
        return bundleId.trim();
    }

    public static AppRestrictionDto toDto(AppRestriction r) {
        return new AppRestrictionDto(
                r.getId(),
                r.getBundleId(),
                r.getAppName(),
                r.getTimeLimitSeconds(),
                r.isDisabled(),
                r.isDisabledByLimit(),
                r.getDailyUsageSeconds(),
                r.getLastResetDate(),
                r.getUpdatedAt()
        );
    }
}
