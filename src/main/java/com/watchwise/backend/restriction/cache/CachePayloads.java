package com.watchwise.backend.restriction.cache;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.watchwise.backend.common.persistence.LocalTimeStringConverter;
import com.watchwise.backend.restriction.entity.AppRestriction;
import com.watchwise.backend.restriction.entity.BedtimeSettings;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.List;

/** Document shapes the child device enforces from. Times are ISO strings. */
public final class CachePayloads {
    private CachePayloads() {}

    public record AppRestrictionPayload(
            String bundleId,
            String appName,
            long timeLimit,
            @JsonProperty("isDisabled") boolean disabled,
            long dailyUsage,
            String lastResetDate,
            String updatedAt
    ) {
        public static AppRestrictionPayload of(AppRestriction r) {
            return new AppRestrictionPayload(
                    r.getBundleId(),
                    r.getAppName(),
                    r.getTimeLimitSeconds(),
                    r.isDisabled(),
                    r.getDailyUsageSeconds(),
                    r.getLastResetDate() == null ? null : r.getLastResetDate().toString(),
                    r.getUpdatedAt() == null ? null : r.getUpdatedAt().toString()
            );
        }
    }

    /**
     * {@code bedtimeActive} is the override the device ORs with per-app limits.
     */
    public record BedtimePayload(
            @JsonProperty("isEnabled") boolean enabled,
            String startTime,
            String endTime,
            List<DayOfWeek> enabledDays,
            String timezone,
            boolean bedtimeActive,
            String evaluatedAt
    ) {
        public static BedtimePayload of(BedtimeSettings s, boolean active, Instant evaluatedAt) {
            return new BedtimePayload(
                    s.isEnabled(),
                    LocalTimeStringConverter.HM.format(s.getStartTime()),
                    LocalTimeStringConverter.HM.format(s.getEndTime()),
                    s.getEnabledDays().stream().sorted().toList(),
                    s.getTimezone(),
                    active,
                    evaluatedAt.toString()
            );
        }
    }
}
