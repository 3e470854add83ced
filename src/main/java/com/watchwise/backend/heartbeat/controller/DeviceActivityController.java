package com.watchwise.backend.heartbeat.controller;

import com.watchwise.backend.auth.security.AuthContext;
import com.watchwise.backend.common.web.ApiErrorCode;
import com.watchwise.backend.common.web.ApiException;
import com.watchwise.backend.heartbeat.dto.RecordActivityRequest;
import com.watchwise.backend.heartbeat.dto.RecordActivityResponse;
import com.watchwise.backend.heartbeat.model.ActivityType;
import com.watchwise.backend.heartbeat.service.DeviceActivityService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/activity")
@RequiredArgsConstructor
public class DeviceActivityController {

    private final DeviceActivityService service;
    private final AuthContext auth;

    @PostMapping
    public RecordActivityResponse record(@RequestBody RecordActivityRequest req) {
        Long userId = auth.requireUserId();
        ActivityType type = ActivityType.fromWire(req.activityType())
                .orElseThrow(() -> new ApiException(ApiErrorCode.INVALID_FORMAT,
                        "Unknown activity type: " + req.activityType()));
        return service.recordActivity(userId, type, req.deviceInfo(), req.occurredAt());
    }
}
