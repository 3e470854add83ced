package com.watchwise.backend.notification.controller;

import com.watchwise.backend.auth.security.AuthContext;
import com.watchwise.backend.notification.dto.NotificationDto;
import com.watchwise.backend.notification.service.NotificationInboxService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationInboxService service;
    private final AuthContext auth;

    @GetMapping
    public List<NotificationDto> list(@RequestParam(defaultValue = "50") int limit) {
        return service.list(auth.requireUserId(), limit);
    }

    @PostMapping("/{id}/read")
    public NotificationDto markRead(@PathVariable Long id) {
        return service.markRead(auth.requireUserId(), id);
    }
}
