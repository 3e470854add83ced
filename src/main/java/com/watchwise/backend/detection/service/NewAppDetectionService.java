package com.watchwise.backend.detection.service;

import com.watchwise.backend.common.web.ApiErrorCode;
import com.watchwise.backend.common.web.ApiException;
import com.watchwise.backend.detection.dto.DetectionDtos.DetectionDto;
import com.watchwise.backend.detection.entity.NewAppDetection;
import com.watchwise.backend.detection.repo.NewAppDetectionRepo;
import com.watchwise.backend.notification.entity.NotificationType;
import com.watchwise.backend.notification.service.NotificationDispatcher;
import com.watchwise.backend.notification.service.NotificationEvent;
import com.watchwise.backend.relationship.entity.Relationship;
import com.watchwise.backend.relationship.repo.RelationshipRepo;
import com.watchwise.backend.restriction.config.RestrictionProperties;
import com.watchwise.backend.restriction.repo.AppRestrictionRepo;
import com.watchwise.backend.restriction.service.AppRestrictionService;
import com.watchwise.backend.restriction.support.AppCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class NewAppDetectionService {

    private final NewAppDetectionRepo detections;
    private final AppRestrictionRepo restrictions;
    private final RelationshipRepo relationships;
    private final AppRestrictionService restrictionService;
    private final NotificationDispatcher notifications;
    private final AppCatalog catalog;
    private final RestrictionProperties props;
    private final Clock clock;

    /**
     * Compares what the child device reports against what each linked parent already knows
     * (restricted or detected before) and records the rest as new.
     *
     * @return detections created across all parents
     */
    @Transactional
    public int reportInstalledApps(Long childUserId, Collection<String> bundleIds) {
        Set<String> reported = new LinkedHashSet<>();
        for (String b : bundleIds) {
            if (b != null && !b.isBlank() && b.length() <= 255) reported.add(b.trim());
        }
        if (reported.isEmpty()) return 0;

        final Instant now = Instant.now(clock);
        int created = 0;
        for (Relationship rel : relationships.findByChildUserIdAndActiveTrueOrderByCreatedAtAsc(childUserId)) {
            Long parentId = rel.getParentUserId();
            for (String bundleId : reported) {
                if (restrictions.existsByParentIdAndBundleId(parentId, bundleId)
                        || detections.existsByParentIdAndBundleId(parentId, bundleId)) {
                    continue;
                }
                NewAppDetection d = new NewAppDetection();
                d.setParentId(parentId);
                d.setChildUserId(childUserId);
                d.setBundleId(bundleId);
                d.setAppName(catalog.displayName(bundleId));
                d.setDetectedAt(now);
                detections.saveAndFlush(d);
                notifyParent(d, rel, now);
                created++;
            }
        }

        if (created > 0) {
            log.info("new apps detected. childId={} created={}", childUserId, created);
        }
        return created;
    }

    @Transactional(readOnly = true)
    public List<DetectionDto> listOpen(Long parentId) {
        return detections.findByParentIdAndProcessedFalseOrderByDetectedAtDesc(parentId).stream()
                .map(NewAppDetectionService::toDto)
                .toList();
    }

    /** Puts the app under a default daily limit. */
    @Transactional
    public DetectionDto monitor(Long parentId, Long detectionId) {
        NewAppDetection d = lockOpen(parentId, detectionId);
        restrictionService.setLimit(parentId, d.getBundleId(), props.getNewAppDefaultLimit().toSeconds(), d.getAppName());
        d.resolve(NewAppDetection.Resolution.MONITORED, Instant.now(clock));
        log.info("detection monitored. parentId={} bundleId={}", parentId, d.getBundleId());
        return toDto(detections.save(d));
    }

    @Transactional
    public DetectionDto ignore(Long parentId, Long detectionId) {
        NewAppDetection d = lockOpen(parentId, detectionId);
        d.resolve(NewAppDetection.Resolution.IGNORED, Instant.now(clock));
        log.info("detection ignored. parentId={} bundleId={}", parentId, d.getBundleId());
        return toDto(detections.save(d));
    }

    private NewAppDetection lockOpen(Long parentId, Long detectionId) {
        NewAppDetection d = detections.findByIdForUpdate(detectionId)
                .orElseThrow(() -> new ApiException(ApiErrorCode.NOT_FOUND, "Detection not found."));
        if (!d.getParentId().equals(parentId)) {
            throw new ApiException(ApiErrorCode.PERMISSION_DENIED);
        }
        if (d.isProcessed()) {
            throw new ApiException(ApiErrorCode.ALREADY_PROCESSED);
        }
        return d;
    }

    private void notifyParent(NewAppDetection d, Relationship rel, Instant now) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("detectionId", d.getId());
        data.put("bundleId", d.getBundleId());
        data.put("appName", d.getAppName());
        data.put("childUserId", rel.getChildUserId());
        data.put("childName", rel.getChildName());

        notifications.dispatch(new NotificationEvent(
                d.getParentId(),
                NotificationType.NEW_APP_DETECTED,
                "New App Detected",
                d.getAppName() + " has been installed on your child's device",
                data,
                now
        ));
    }

    static DetectionDto toDto(NewAppDetection d) {
        return new DetectionDto(
                d.getId(),
                d.getChildUserId(),
                d.getBundleId(),
                d.getAppName(),
                d.getDetectedAt(),
                d.isProcessed(),
                d.getResolution() == null ? null : d.getResolution().name()
        );
    }
}
