package com.watchwise.backend.detection.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.List;

public final class DetectionDtos {
    private DetectionDtos() {}

    public record ReportInstalledAppsRequest(
            @NotNull @Size(max = 500) List<String> bundleIds
    ) {}

    public record ReportInstalledAppsResponse(int detected) {}

    public record DetectionDto(
            Long id,
            Long childUserId,
            String bundleId,
            String appName,
            Instant detectedAt,
            boolean processed,
            String resolution
    ) {}
}
