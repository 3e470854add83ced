package com.watchwise.backend.detection.controller;

import com.watchwise.backend.auth.security.AuthContext;
import com.watchwise.backend.detection.dto.DetectionDtos.DetectionDto;
import com.watchwise.backend.detection.dto.DetectionDtos.ReportInstalledAppsRequest;
import com.watchwise.backend.detection.dto.DetectionDtos.ReportInstalledAppsResponse;
import com.watchwise.backend.detection.service.NewAppDetectionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class NewAppDetectionController {

    private final NewAppDetectionService service;
    private final AuthContext auth;

    /** Child device reports the bundle ids it currently sees. */
    @PostMapping("/device/installed-apps")
    public ReportInstalledAppsResponse report(@Valid @RequestBody ReportInstalledAppsRequest req) {
        return new ReportInstalledAppsResponse(service.reportInstalledApps(auth.requireUserId(), req.bundleIds()));
    }

    @GetMapping("/detections")
    public List<DetectionDto> open() {
        return service.listOpen(auth.requireUserId());
    }

    @PostMapping("/detections/{id}/monitor")
    public DetectionDto monitor(@PathVariable Long id) {
        return service.monitor(auth.requireUserId(), id);
    }

    @PostMapping("/detections/{id}/ignore")
    public DetectionDto ignore(@PathVariable Long id) {
        return service.ignore(auth.requireUserId(), id);
    }
}
