package com.watchwise.backend.restriction.service;

import com.watchwise.backend.common.persistence.LocalTimeStringConverter;
import com.watchwise.backend.common.web.ApiErrorCode;
import com.watchwise.backend.common.web.ApiException;
import com.watchwise.backend.restriction.cache.RestrictionCachePublisher;
import com.watchwise.backend.restriction.config.RestrictionProperties;
import com.watchwise.backend.restriction.dto.RestrictionDtos.BedtimeDto;
import com.watchwise.backend.restriction.dto.RestrictionDtos.SetBedtimeRequest;
import com.watchwise.backend.restriction.entity.BedtimeSettings;
import com.watchwise.backend.restriction.repo.BedtimeSettingsRepo;
import com.watchwise.backend.restriction.support.BedtimeWindow;
import com.watchwise.backend.restriction.support.ClientTimeZoneResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.Optional;

/**
 * Bedtime is an override layer on top of per-app limits: it never touches AppRestriction
 * rows, it only publishes whether the window is active to the device cache.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BedtimeService {

    private final BedtimeSettingsRepo repo;
    private final RestrictionCachePublisher cachePublisher;
    private final RestrictionProperties props;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Optional<BedtimeDto> get(Long parentId) {
        Instant now = Instant.now(clock);
        return repo.findByUserId(parentId).map(s -> toDto(s, isBedtimeNow(s, now)));
    }

    @Transactional
    public BedtimeDto set(Long parentId, SetBedtimeRequest req, ZoneId deviceZone) {
        LocalTime start = LocalTimeStringConverter.parseOrNull(req.startTime());
        LocalTime end = LocalTimeStringConverter.parseOrNull(req.endTime());
        if (start == null || end == null) {
            throw new ApiException(ApiErrorCode.INVALID_FORMAT, "Bedtime must be given as HH:mm.");
        }

        ZoneId zone;
        if (req.timezone() != null && !req.timezone().isBlank()) {
            zone = ClientTimeZoneResolver.parse(req.timezone())
                    .orElseThrow(() -> new ApiException(ApiErrorCode.INVALID_FORMAT, "Unknown timezone."));
        } else if (deviceZone != null) {
            zone = deviceZone;
        } else {
            zone = ClientTimeZoneResolver.parse(props.getDefaultTimezone()).orElse(ZoneId.of("UTC"));
        }

        final Instant now = Instant.now(clock);
        BedtimeSettings s = repo.findByUserIdForUpdate(parentId).orElseGet(() -> {
            BedtimeSettings n = new BedtimeSettings();
            n.setUserId(parentId);
            return n;
        });
        s.setEnabled(Boolean.TRUE.equals(req.enabled()));
        s.setStartTime(start);
        s.setEndTime(end);
        s.setEnabledDays(req.enabledDays() == null || req.enabledDays().isEmpty()
                ? EnumSet.noneOf(DayOfWeek.class)
                : EnumSet.copyOf(req.enabledDays()));
        s.setTimezone(zone.getId());
        s.setUpdatedAt(now);

        boolean active = isBedtimeNow(s, now);
        s.setBedtimeActive(active);
        BedtimeSettings saved = repo.save(s);

        if (saved.isEnabled()) {
            cachePublisher.publishBedtime(saved, active, now);
        } else {
            cachePublisher.publishBedtimeRemoved(parentId, now);
        }

        log.info("bedtime saved. parentId={} enabled={} window={}-{} zone={} activeNow={}",
                parentId, saved.isEnabled(), req.startTime(), req.endTime(), zone, active);
        return toDto(saved, active);
    }

    /**
     * Re-evaluates one schedule. While bedtime is active the payload is pushed on every call
     * (idempotent); the transition out of bedtime pushes one inactive update.
     *
     * @return whether anything was pushed
     */
    @Transactional
    public boolean evaluate(Long settingsId, Instant now) {
        BedtimeSettings s = repo.findById(settingsId).orElse(null);
        if (s == null) return false;

        boolean active = isBedtimeNow(s, now);
        if (active) {
            if (!s.isBedtimeActive()) {
                s.setBedtimeActive(true);
                repo.save(s);
                log.info("bedtime started. parentId={}", s.getUserId());
            }
            cachePublisher.publishBedtime(s, true, now);
            return true;
        }

        if (s.isBedtimeActive()) {
            s.setBedtimeActive(false);
            repo.save(s);
            if (s.isEnabled()) {
                cachePublisher.publishBedtime(s, false, now);
            } else {
                cachePublisher.publishBedtimeRemoved(s.getUserId(), now);
            }
            log.info("bedtime ended. parentId={}", s.getUserId());
            return true;
        }
        return false;
    }

    public boolean isBedtimeNow(BedtimeSettings s, Instant now) {
        if (!s.isEnabled() || s.getStartTime() == null || s.getEndTime() == null) return false;
        ZoneId zone = ClientTimeZoneResolver.parse(s.getTimezone()).orElse(ZoneId.of("UTC"));
        BedtimeWindow window = new BedtimeWindow(s.getStartTime(), s.getEndTime(), s.getEnabledDays());
        return window.isBedtimeAt(LocalDateTime.ofInstant(now, zone));
    }

    static BedtimeDto toDto(BedtimeSettings s, boolean bedtimeNow) {
        return new BedtimeDto(
                s.isEnabled(),
                LocalTimeStringConverter.HM.format(s.getStartTime()),
                LocalTimeStringConverter.HM.format(s.getEndTime()),
                s.getEnabledDays().stream().sorted().toList(),
                s.getTimezone(),
                bedtimeNow,
                s.getUpdatedAt()
        );
    }
}
