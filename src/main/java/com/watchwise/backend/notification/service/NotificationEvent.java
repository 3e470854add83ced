package com.watchwise.backend.notification.service;

import com.watchwise.backend.notification.entity.NotificationType;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What the dispatcher receives: {recipientId, type, title, message, data, timestamp}.
 */
public record NotificationEvent(
        Long recipientId,
        NotificationType type,
        String title,
        String message,
        Map<String, Object> data,
        Instant timestamp
) {
    public NotificationEvent {
        data = (data == null)
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
