package com.watchwise.backend.restriction.controller;

import com.watchwise.backend.auth.security.AuthContext;
import com.watchwise.backend.restriction.dto.RestrictionDtos.DeviceRestrictionsDto;
import com.watchwise.backend.restriction.dto.RestrictionDtos.DeviceUsageResponse;
import com.watchwise.backend.restriction.dto.RestrictionDtos.RecordUsageRequest;
import com.watchwise.backend.restriction.service.AppRestrictionService;
import com.watchwise.backend.restriction.service.DeviceRestrictionQueryService;
import com.watchwise.backend.restriction.support.ClientTimeZoneResolver;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

/** Child side: reads what to enforce and reports usage samples. */
@RestController
@RequestMapping("/api/v1/device")
@RequiredArgsConstructor
public class DeviceRestrictionController {

    private final DeviceRestrictionQueryService query;
    private final AppRestrictionService apps;
    private final ClientTimeZoneResolver tzResolver;
    private final AuthContext auth;

    @GetMapping("/restrictions")
    public DeviceRestrictionsDto restrictions() {
        return query.forChild(auth.requireUserId());
    }

    @PostMapping("/usage")
    public DeviceUsageResponse usage(@Valid @RequestBody RecordUsageRequest req) {
        return new DeviceUsageResponse(apps.recordChildUsage(auth.requireUserId(), req.bundleId(),
                req.elapsedSeconds(), tzResolver.resolveFromCurrentRequest().orElse(null)));
    }
}
