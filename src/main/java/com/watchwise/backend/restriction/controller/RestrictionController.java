package com.watchwise.backend.restriction.controller;

import com.watchwise.backend.auth.security.AuthContext;
import com.watchwise.backend.restriction.dto.RestrictionDtos.*;
import com.watchwise.backend.restriction.service.AppRestrictionService;
import com.watchwise.backend.restriction.service.BedtimeService;
import com.watchwise.backend.restriction.support.ClientTimeZoneResolver;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/** Parent side: app limits, disable/enable and bedtime. */
@RestController
@RequestMapping("/api/v1/restrictions")
@RequiredArgsConstructor
public class RestrictionController {

    private final AppRestrictionService apps;
    private final BedtimeService bedtime;
    private final ClientTimeZoneResolver tzResolver;
    private final AuthContext auth;

    @GetMapping("/apps")
    public List<AppRestrictionDto> list() {
        return apps.list(auth.requireUserId());
    }

    @PutMapping("/apps/{bundleId}/limit")
    public AppRestrictionDto setLimit(@PathVariable String bundleId, @Valid @RequestBody SetLimitRequest req) {
        return apps.setLimit(auth.requireUserId(), bundleId, req.timeLimitSeconds(), req.appName());
    }

    @PostMapping("/apps/{bundleId}/disable")
    public AppRestrictionDto disable(@PathVariable String bundleId) {
        return apps.disable(auth.requireUserId(), bundleId);
    }

    @PostMapping("/apps/{bundleId}/enable")
    public AppRestrictionDto enable(@PathVariable String bundleId) {
        return apps.enable(auth.requireUserId(), bundleId);
    }

    @DeleteMapping("/apps/{bundleId}")
    public SuccessResponse remove(@PathVariable String bundleId) {
        apps.remove(auth.requireUserId(), bundleId);
        return SuccessResponse.ok();
    }

    @PostMapping("/usage")
    public UsageResult recordUsage(@Valid @RequestBody RecordUsageRequest req) {
        return apps.recordUsage(auth.requireUserId(), req.bundleId(), req.elapsedSeconds(),
                tzResolver.resolveFromCurrentRequest().orElse(null));
    }

    @GetMapping("/bedtime")
    public ResponseEntity<BedtimeDto> getBedtime() {
        return bedtime.get(auth.requireUserId())
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PutMapping("/bedtime")
    public BedtimeDto setBedtime(@Valid @RequestBody SetBedtimeRequest req) {
        return bedtime.set(auth.requireUserId(), req, tzResolver.resolveFromCurrentRequest().orElse(null));
    }
}
