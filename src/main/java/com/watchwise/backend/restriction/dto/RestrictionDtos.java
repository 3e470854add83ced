package com.watchwise.backend.restriction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

public final class RestrictionDtos {
    private RestrictionDtos() {}

    public record AppRestrictionDto(
            Long id,
            String bundleId,
            String appName,
            long timeLimit,
            @JsonProperty("isDisabled") boolean disabled,
            boolean disabledByLimit,
            long dailyUsage,
            LocalDate lastResetDate,
            Instant updatedAt
    ) {}

    public record SetLimitRequest(
            @NotNull @Min(0) Long timeLimitSeconds,
            @Size(max = 120) String appName
    ) {}

    public record RecordUsageRequest(
            @NotBlank @Size(max = 255) String bundleId,
            @NotNull @Min(0) Long elapsedSeconds
    ) {}

    /**
     * @param limitExceeded true only on the call that crossed the limit
     */
    public record UsageResult(
            String bundleId,
            long dailyUsage,
            long timeLimit,
            @JsonProperty("isDisabled") boolean disabled,
            boolean limitExceeded
    ) {}

    /** Child-side fan-out: one entry per linked parent that restricts the app. */
    public record DeviceUsageResponse(List<UsageResult> applied) {}

    public record SetBedtimeRequest(
            @NotNull Boolean enabled,
            @NotBlank String startTime,
            @NotBlank String endTime,
            Set<DayOfWeek> enabledDays,
            String timezone
    ) {}

    public record BedtimeDto(
            @JsonProperty("isEnabled") boolean enabled,
            String startTime,
            String endTime,
            List<DayOfWeek> enabledDays,
            String timezone,
            boolean bedtimeNow,
            Instant updatedAt
    ) {}

    public record CacheEntryDto(
            Long ownerUserId,
            String key,
            JsonNode payload,
            boolean deleted,
            Instant sourceUpdatedAt
    ) {}

    public record DeviceRestrictionsDto(
            List<CacheEntryDto> entries,
            Instant lastUpdatedAt
    ) {}

    public record SuccessResponse(boolean success) {
        public static SuccessResponse ok() { return new SuccessResponse(true); }
    }
}
